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

import net.larse.tsa.timeseries.AnalysisStatus;

/** Variation of the group means of one calendar bucketing. */
public final class CalendarPattern {
  private final CalendarPeriod period;
  private final AnalysisStatus status;
  private final boolean detected;
  private final double coefficient;
  private final double variation;
  private final PatternShape shape;
  private final double[] groupMeans;

  CalendarPattern(CalendarPeriod period, AnalysisStatus status, boolean detected,
      double coefficient, double variation, PatternShape shape, double[] groupMeans) {
    this.period = period;
    this.status = status;
    this.detected = detected;
    this.coefficient = coefficient;
    this.variation = variation;
    this.shape = shape;
    this.groupMeans = groupMeans.clone();
  }

  public CalendarPeriod getPeriod() {
    return period;
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public boolean isDetected() {
    return detected;
  }

  /** Coefficient of variation of the group means. */
  public double getCoefficient() {
    return coefficient;
  }

  public double getStrength() {
    return Math.min(coefficient, 1);
  }

  /** Population standard deviation of the group means. */
  public double getVariation() {
    return variation;
  }

  public PatternShape getShape() {
    return shape;
  }

  /** Group means in bucket order. */
  public double[] getGroupMeans() {
    return groupMeans.clone();
  }

  @Override
  public String toString() {
    return String.format("CalendarPattern[%s, detected=%s, cv=%.4f, %s]",
        period, detected, coefficient, shape);
  }
}
