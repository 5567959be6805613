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

import com.google.common.annotations.VisibleForTesting;

/** Overall shape of a sequence of group means, from the share of rising steps. */
public enum PatternShape {
  INCREASING,
  DECREASING,
  MIXED,
  STABLE,
  INSUFFICIENT_DATA;

  /** Rising share above 0.7 is increasing, below 0.3 decreasing; flat sequences are stable. */
  public static PatternShape of(double[] values) {
    if (values.length < 3) {
      return INSUFFICIENT_DATA;
    }
    int increasing = 0;
    int decreasing = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[i - 1]) {
        increasing++;
      } else if (values[i] < values[i - 1]) {
        decreasing++;
      }
    }
    return of(increasing, decreasing);
  }

  @VisibleForTesting
  static PatternShape of(int increasing, int decreasing) {
    int total = increasing + decreasing;
    if (total == 0) {
      return STABLE;
    }
    double ratio = (double) increasing / total;
    if (ratio > 0.7) {
      return INCREASING;
    }
    if (ratio < 0.3) {
      return DECREASING;
    }
    return MIXED;
  }
}
