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

/** A run of consecutive rolling volatility values at the same level. */
public final class VolatilityRegime {
  /** Level relative to the mean of the rolling volatility, one standard deviation either side. */
  public enum Level {
    LOW,
    MEDIUM,
    HIGH
  }

  private final Level level;
  private final int start;
  private final int end;

  VolatilityRegime(Level level, int start, int end) {
    this.level = level;
    this.start = start;
    this.end = end;
  }

  public Level getLevel() {
    return level;
  }

  /** Index into the rolling volatility, inclusive. */
  public int getStart() {
    return start;
  }

  /** Index into the rolling volatility, inclusive. */
  public int getEnd() {
    return end;
  }

  public int getLength() {
    return end - start + 1;
  }

  @Override
  public String toString() {
    return String.format("%s[%d..%d]", level, start, end);
  }
}
