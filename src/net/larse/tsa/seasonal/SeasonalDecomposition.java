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

import com.google.common.base.Preconditions;

import net.larse.tsa.helper.RegressionFit;
import net.larse.tsa.helper.StatisticsKernel;

/**
 * Additive decomposition of a series into a linear trend, a fixed seasonal profile and a residual,
 * such that original[i] = trend[i] + seasonal[i % period] + residual[i].
 *
 * <p>The trend is the least squares line over the sample index. The seasonal profile at phase k is
 * the mean of the detrended values at indices i with i % period == k.
 */
public class SeasonalDecomposition {
  private final int period;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] residual;
  private final RegressionFit trendFit;

  private SeasonalDecomposition(int period, double[] trend, double[] seasonal, double[] residual,
      RegressionFit trendFit) {
    this.period = period;
    this.trend = trend;
    this.seasonal = seasonal;
    this.residual = residual;
    this.trendFit = trendFit;
  }

  /** Decomposes y with the given period. Needs at least one full period. */
  public static SeasonalDecomposition of(double[] y, int period) {
    Preconditions.checkArgument(period >= 2, "Period must be >= 2: %s", period);
    Preconditions.checkArgument(y.length >= period,
        "Need at least one full period (%s), got %s points", period, y.length);
    int n = y.length;
    RegressionFit fit = StatisticsKernel.regression(y);

    double[] trend = new double[n];
    double[] detrended = new double[n];
    for (int i = 0; i < n; i++) {
      trend[i] = fit.predict(i);
      detrended[i] = y[i] - trend[i];
    }

    double[] seasonal = new double[period];
    int[] counts = new int[period];
    for (int i = 0; i < n; i++) {
      seasonal[i % period] += detrended[i];
      counts[i % period]++;
    }
    for (int k = 0; k < period; k++) {
      seasonal[k] /= counts[k];
    }

    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      residual[i] = detrended[i] - seasonal[i % period];
    }
    return new SeasonalDecomposition(period, trend, seasonal, residual, fit);
  }

  public int getPeriod() {
    return period;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  /** The seasonal profile, one value per phase. */
  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double getSeasonal(int index) {
    return seasonal[index % period];
  }

  public double[] getResidual() {
    return residual.clone();
  }

  /** The linear trend line the series was detrended with. */
  public RegressionFit getTrendFit() {
    return trendFit;
  }

  public int size() {
    return trend.length;
  }

  /** trend[i] + seasonal[i % period] + residual[i]. */
  public double reconstruct(int index) {
    return trend[index] + seasonal[index % period] + residual[index];
  }

  /** Standard error of the residual, sqrt(SSE / (n - 2)), or 0 for fewer than 3 points. */
  public double residualStandardError() {
    if (residual.length < 3) {
      return 0;
    }
    double sse = 0;
    for (double r : residual) {
      sse += r * r;
    }
    return Math.sqrt(sse / (residual.length - 2));
  }
}
