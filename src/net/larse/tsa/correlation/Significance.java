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
package net.larse.tsa.correlation;

import net.larse.tsa.helper.StatisticsKernel;

/**
 * Significance of a correlation coefficient, from the statistic r sqrt((n - 2) / (1 - r^2)) under
 * a normal approximation.
 */
public enum Significance {
  HIGHLY_SIGNIFICANT(0.001),
  VERY_SIGNIFICANT(0.01),
  SIGNIFICANT(0.05),
  MARGINALLY_SIGNIFICANT(0.1),
  NOT_SIGNIFICANT(Double.POSITIVE_INFINITY);

  private final double pBelow;

  Significance(double pBelow) {
    this.pBelow = pBelow;
  }

  /** Two-sided p-value of r over n pairs; 1 for n below 3, 0 for a perfect correlation. */
  public static double pValue(double r, int n) {
    if (n < 3) {
      return 1;
    }
    double r2 = r * r;
    if (r2 >= 1) {
      return 0;
    }
    return StatisticsKernel.twoSidedPValue(r * Math.sqrt((n - 2) / (1 - r2)));
  }

  public static Significance of(double pValue) {
    for (Significance significance : values()) {
      if (pValue < significance.pBelow) {
        return significance;
      }
    }
    return NOT_SIGNIFICANT;
  }

  public boolean isSignificant() {
    return this != NOT_SIGNIFICANT;
  }
}
