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

import com.google.common.collect.ImmutableList;

/** Correlation of one pair of metrics by one method. */
public final class CorrelationResult {
  private final String metricA;
  private final String metricB;
  private final CorrelationMethod method;
  private final double correlation;
  private final double pValue;
  private final int sampleSize;
  private final ImmutableList<String> controlledFor;
  private final int lag;
  private final int window;

  CorrelationResult(String metricA, String metricB, CorrelationMethod method, double correlation,
      int sampleSize, ImmutableList<String> controlledFor, int lag, int window) {
    this.metricA = metricA;
    this.metricB = metricB;
    this.method = method;
    this.correlation = correlation;
    this.pValue = Significance.pValue(correlation, sampleSize);
    this.sampleSize = sampleSize;
    this.controlledFor = controlledFor;
    this.lag = lag;
    this.window = window;
  }

  static CorrelationResult of(String metricA, String metricB, CorrelationMethod method,
      double correlation, int sampleSize) {
    return new CorrelationResult(metricA, metricB, method, correlation, sampleSize,
        ImmutableList.<String>of(), 0, 0);
  }

  public String getMetricA() {
    return metricA;
  }

  public String getMetricB() {
    return metricB;
  }

  public CorrelationMethod getMethod() {
    return method;
  }

  /** The coefficient, in [-1, 1]. */
  public double getCorrelation() {
    return correlation;
  }

  public double getStrength() {
    return Math.abs(correlation);
  }

  public CorrelationDirection getDirection() {
    return CorrelationDirection.of(correlation);
  }

  public double getPValue() {
    return pValue;
  }

  public Significance getSignificance() {
    return Significance.of(pValue);
  }

  public int getSampleSize() {
    return sampleSize;
  }

  /** Metrics controlled for by a partial correlation; empty for the other methods. */
  public ImmutableList<String> getControlledFor() {
    return controlledFor;
  }

  /** Lag of B behind A for lagged and cross correlations; 0 otherwise. */
  public int getLag() {
    return lag;
  }

  /** Window of a rolling correlation; 0 otherwise. */
  public int getWindow() {
    return window;
  }

  @Override
  public String toString() {
    return String.format("%s(%s, %s)=%.4f [%s]", method, metricA, metricB, correlation,
        getSignificance());
  }
}
