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

/** Pearson correlation inside each sliding window of a pair. */
public final class RollingCorrelation {
  private final String metricA;
  private final String metricB;
  private final int window;
  private final double[] correlations;
  private final double mean;
  private final double volatility;

  RollingCorrelation(String metricA, String metricB, int window, double[] correlations,
      double mean, double volatility) {
    this.metricA = metricA;
    this.metricB = metricB;
    this.window = window;
    this.correlations = correlations.clone();
    this.mean = mean;
    this.volatility = volatility;
  }

  public String getMetricA() {
    return metricA;
  }

  public String getMetricB() {
    return metricB;
  }

  public int getWindow() {
    return window;
  }

  /** The correlation of the window starting at each index. */
  public double[] getCorrelations() {
    return correlations.clone();
  }

  public double getMean() {
    return mean;
  }

  /** Population standard deviation of the window correlations. */
  public double getVolatility() {
    return volatility;
  }
}
