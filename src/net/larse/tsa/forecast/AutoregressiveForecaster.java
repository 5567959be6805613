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
package net.larse.tsa.forecast;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.timeseries.TimeSeriesUtils;

/**
 * A lightweight AR(p) model on the d-times differenced series.
 *
 * <p>Coefficient k is the lag-k autocovariance ratio gamma(k) / gamma(0) of the differenced
 * series; there is no Yule-Walker solve. Steps are predicted recursively around the differenced
 * mean. The forecast is not integrated back, so with d > 0 the values are predicted differences
 * and the result is marked {@link ForecastScale#DIFFERENCED}.
 */
public class AutoregressiveForecaster implements Forecaster {
  private final int order;
  private final int differencingOrder;

  public AutoregressiveForecaster(int order, int differencingOrder) {
    Preconditions.checkArgument(order >= 1, "AR order must be >= 1: %s", order);
    Preconditions.checkArgument(differencingOrder >= 0,
        "Differencing order must be >= 0: %s", differencingOrder);
    this.order = order;
    this.differencingOrder = differencingOrder;
  }

  @Override
  public ForecastMethod method() {
    return ForecastMethod.AUTOREGRESSIVE;
  }

  @Override
  public ForecastScale scale() {
    return differencingOrder > 0 ? ForecastScale.DIFFERENCED : ForecastScale.ORIGINAL;
  }

  /** The d-times differenced values. */
  @Override
  public double[] onScale(double[] values) {
    return TimeSeriesUtils.difference(values, differencingOrder);
  }

  /** Needs order + 2 points after differencing. */
  @Override
  public boolean supports(double[] values) {
    return values.length - differencingOrder >= order + 2;
  }

  @Override
  public ForecastResult forecast(double[] values, int horizon) {
    Preconditions.checkArgument(supports(values), "AR(%s) after %s difference(s) needs %s points",
        order, differencingOrder, order + 2 + differencingOrder);
    double[] z = TimeSeriesUtils.difference(values, differencingOrder);
    double mean = StatisticsKernel.mean(z);
    double[] phi = coefficients(z, order);

    // one-step in-sample errors
    double sse = 0;
    double sst = 0;
    int fitted = 0;
    for (int t = order; t < z.length; t++) {
      double predicted = mean;
      for (int k = 1; k <= order; k++) {
        predicted += phi[k - 1] * (z[t - k] - mean);
      }
      sse += (z[t] - predicted) * (z[t] - predicted);
      sst += (z[t] - mean) * (z[t] - mean);
      fitted++;
    }
    double sigma = fitted > 0 ? Math.sqrt(sse / fitted) : 0;

    DoubleArrayList history = new DoubleArrayList(z);
    double[] predictions = new double[horizon];
    ImmutableList.Builder<ForecastInterval> intervals = ImmutableList.builder();
    double confidence = 0;
    for (int i = 0; i < horizon; i++) {
      double predicted = mean;
      for (int k = 1; k <= order; k++) {
        predicted += phi[k - 1] * (history.getDouble(history.size() - k) - mean);
      }
      history.add(predicted);
      predictions[i] = predicted;
      double margin = sigma * Math.sqrt(i + 1);
      intervals.add(new ForecastInterval(predicted - margin, predicted + margin));
      confidence += Forecasts.stepConfidence(sigma, predicted);
    }

    ImmutableMap.Builder<String, Double> parameters = ImmutableMap.builder();
    parameters.put("order", (double) order);
    parameters.put("differencingOrder", (double) differencingOrder);
    parameters.put("mean", mean);
    parameters.put("sigma", sigma);
    for (int k = 1; k <= order; k++) {
      parameters.put("phi" + k, phi[k - 1]);
    }
    return new ForecastResult(ForecastMethod.AUTOREGRESSIVE, predictions, intervals.build(),
        confidence / horizon, sst > 0 ? 1 - sse / sst : 0, parameters.build(), scale());
  }

  /** gamma(k) / gamma(0) for k = 1 .. order; 0 when the series has no variance. */
  @VisibleForTesting
  static double[] coefficients(double[] z, int order) {
    double[] centered = TimeSeriesUtils.center(z);
    double gamma0 = 0;
    for (double c : centered) {
      gamma0 += c * c;
    }
    double[] phi = new double[order];
    if (gamma0 == 0) {
      return phi;
    }
    for (int k = 1; k <= order; k++) {
      double gamma = 0;
      for (int t = k; t < centered.length; t++) {
        gamma += centered[t] * centered[t - k];
      }
      phi[k - 1] = gamma / gamma0;
    }
    return phi;
  }
}
