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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.helper.RegressionFit;
import net.larse.tsa.helper.StatisticsKernel;

/**
 * Extrapolates a least squares line through the logarithms of the values. Values below 0.001 are
 * raised to 0.001 before taking logs. Intervals and confidence are computed in log space.
 * Extrapolations beyond the double range saturate at Double.MAX_VALUE.
 */
public class ExponentialForecaster implements Forecaster {
  static final double LOG_FLOOR = 0.001;

  @Override
  public ForecastMethod method() {
    return ForecastMethod.EXPONENTIAL;
  }

  /** Needs two strictly positive values at least. */
  @Override
  public boolean supports(double[] values) {
    return values.length >= 2 && Forecasts.allPositive(values);
  }

  @Override
  public ForecastResult forecast(double[] values, int horizon) {
    int n = values.length;
    double[] logValues = new double[n];
    for (int i = 0; i < n; i++) {
      logValues[i] = Math.log(Math.max(values[i], LOG_FLOOR));
    }
    RegressionFit fit = StatisticsKernel.regression(logValues);

    double[] predictions = new double[horizon];
    ImmutableList.Builder<ForecastInterval> intervals = ImmutableList.builder();
    double confidence = 0;
    for (int i = 0; i < horizon; i++) {
      double x = n + i;
      double logPrediction = fit.predict(x);
      double margin = fit.getStandardError() * fit.predictionFactor(x);
      predictions[i] = boundedExp(logPrediction);
      intervals.add(new ForecastInterval(boundedExp(logPrediction - margin),
          boundedExp(logPrediction + margin)));
      confidence += Forecasts.stepConfidence(fit.getStandardError(), logPrediction);
    }
    return new ForecastResult(ForecastMethod.EXPONENTIAL, predictions, intervals.build(),
        confidence / horizon, fit.getRSquared(),
        ImmutableMap.of("growthRate", fit.getSlope(), "logIntercept", fit.getIntercept(),
            "standardError", fit.getStandardError()),
        ForecastScale.ORIGINAL);
  }

  /** exp(x), saturating at Double.MAX_VALUE instead of overflowing. */
  static double boundedExp(double x) {
    return Math.min(Math.exp(x), Double.MAX_VALUE);
  }
}
