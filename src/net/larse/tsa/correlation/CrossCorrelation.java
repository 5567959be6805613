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

/**
 * Mean products sum(a[i] * b[i + lag]) / count over lags -n/2 to n/2. The values are raw means of
 * products, not coefficients, and are not limited to [-1, 1].
 */
public final class CrossCorrelation {
  private final String metricA;
  private final String metricB;
  private final ImmutableList<LagValue> values;
  private final LagValue peak;

  CrossCorrelation(String metricA, String metricB, ImmutableList<LagValue> values, LagValue peak) {
    this.metricA = metricA;
    this.metricB = metricB;
    this.values = values;
    this.peak = peak;
  }

  public String getMetricA() {
    return metricA;
  }

  public String getMetricB() {
    return metricB;
  }

  public ImmutableList<LagValue> getValues() {
    return values;
  }

  /** The lag with the largest absolute value. */
  public LagValue getPeak() {
    return peak;
  }
}
