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

/** Extrapolates the least squares line over the sample index. */
public class LinearForecaster implements Forecaster {
  @Override
  public ForecastMethod method() {
    return ForecastMethod.LINEAR;
  }

  @Override
  public boolean supports(double[] values) {
    return values.length >= 2;
  }

  @Override
  public ForecastResult forecast(double[] values, int horizon) {
    RegressionFit fit = StatisticsKernel.regression(values);
    int n = values.length;
    double[] predictions = new double[horizon];
    ImmutableList.Builder<ForecastInterval> intervals = ImmutableList.builder();
    double confidence = 0;
    for (int i = 0; i < horizon; i++) {
      double x = n + i;
      predictions[i] = fit.predict(x);
      double margin = fit.getStandardError() * fit.predictionFactor(x);
      intervals.add(new ForecastInterval(predictions[i] - margin, predictions[i] + margin));
      confidence += Forecasts.stepConfidence(fit.getStandardError(), predictions[i]);
    }
    return new ForecastResult(ForecastMethod.LINEAR, predictions, intervals.build(),
        confidence / horizon, fit.getRSquared(),
        ImmutableMap.of("slope", fit.getSlope(), "intercept", fit.getIntercept(),
            "standardError", fit.getStandardError()),
        ForecastScale.ORIGINAL);
  }
}
