/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.seasonal;

/** A multiple of the base period that is itself autocorrelated. */
public final class Harmonic {
  private final int multiple;
  private final int period;
  private final double strength;
  private final double ratio;

  public Harmonic(int multiple, int period, double strength, double ratio) {
    this.multiple = multiple;
    this.period = period;
    this.strength = strength;
    this.ratio = ratio;
  }

  public int getMultiple() {
    return multiple;
  }

  public int getPeriod() {
    return period;
  }

  /** Autocorrelation at the harmonic period. */
  public double getStrength() {
    return strength;
  }

  /** Strength relative to the autocorrelation at the base period. */
  public double getRatio() {
    return ratio;
  }

  @Override
  public String toString() {
    return String.format("Harmonic[x%d, period=%d, strength=%.4f]", multiple, period, strength);
  }
}
