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

/** Correlation of A[0, n - lag) with B[lag, n) for lags 0 to maxLag. */
public final class LaggedCorrelation {
  private final String metricA;
  private final String metricB;
  private final ImmutableList<LagValue> lags;
  private final LagValue best;

  LaggedCorrelation(String metricA, String metricB, ImmutableList<LagValue> lags, LagValue best) {
    this.metricA = metricA;
    this.metricB = metricB;
    this.lags = lags;
    this.best = best;
  }

  public String getMetricA() {
    return metricA;
  }

  public String getMetricB() {
    return metricB;
  }

  public ImmutableList<LagValue> getLags() {
    return lags;
  }

  /** The lag with the largest absolute correlation; the smallest such lag on ties. */
  public LagValue getBest() {
    return best;
  }
}
