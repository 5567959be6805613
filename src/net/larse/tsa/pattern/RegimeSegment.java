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
package net.larse.tsa.pattern;

import net.larse.tsa.trend.TrendDirection;

/** The values between two change points. */
public final class RegimeSegment {
  private final int start;
  private final int end;
  private final double mean;
  private final double standardDeviation;
  private final TrendDirection trend;

  RegimeSegment(int start, int end, double mean, double standardDeviation, TrendDirection trend) {
    this.start = start;
    this.end = end;
    this.mean = mean;
    this.standardDeviation = standardDeviation;
    this.trend = trend;
  }

  /** First value index, inclusive. */
  public int getStart() {
    return start;
  }

  /** Last value index, inclusive. */
  public int getEnd() {
    return end;
  }

  public int getLength() {
    return end - start + 1;
  }

  public double getMean() {
    return mean;
  }

  /** Population standard deviation. */
  public double getStandardDeviation() {
    return standardDeviation;
  }

  /** Direction of the segment's own linear fit, with a dead-band of 0.01 per step. */
  public TrendDirection getTrend() {
    return trend;
  }

  @Override
  public String toString() {
    return String.format("[%d..%d] mean=%.4f sd=%.4f %s", start, end, mean, standardDeviation,
        trend);
  }
}
