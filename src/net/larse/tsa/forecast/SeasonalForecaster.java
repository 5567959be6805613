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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.helper.RegressionFit;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.seasonal.SeasonalDecomposition;
import net.larse.tsa.seasonal.SeasonalityAnalyzer;
import net.larse.tsa.seasonal.SeasonalityResult;

/**
 * Extends the linear trend of a seasonal decomposition and adds the seasonal profile at each
 * projected phase. The period is detected from the autocorrelation, falling back to 7, and needs
 * two full cycles of history.
 */
public class SeasonalForecaster implements Forecaster {
  private final SeasonalityAnalyzer analyzer;

  public SeasonalForecaster(SeasonalityAnalyzer analyzer) {
    this.analyzer = Preconditions.checkNotNull(analyzer);
  }

  @Override
  public ForecastMethod method() {
    return ForecastMethod.SEASONAL;
  }

  @Override
  public boolean supports(double[] values) {
    return analyzer.analyze(values).getStatus().isOk();
  }

  @Override
  public ForecastResult forecast(double[] values, int horizon) {
    SeasonalityResult seasonality = analyzer.analyze(values);
    Preconditions.checkArgument(seasonality.getStatus().isOk(), "Cannot decompose: %s",
        seasonality.getStatus());
    SeasonalDecomposition decomposition = seasonality.getDecomposition();
    RegressionFit trend = decomposition.getTrendFit();
    int n = values.length;
    double residualError = decomposition.residualStandardError();
    double seasonalSpread = StatisticsKernel.populationStandardDeviation(
        decomposition.getSeasonal());

    double[] predictions = new double[horizon];
    ImmutableList.Builder<ForecastInterval> intervals = ImmutableList.builder();
    double confidence = 0;
    for (int i = 0; i < horizon; i++) {
      double x = n + i;
      predictions[i] = trend.predict(x) + decomposition.getSeasonal(n + i);
      double margin = residualError * trend.predictionFactor(x);
      intervals.add(new ForecastInterval(predictions[i] - margin, predictions[i] + margin));
      confidence += Forecasts.stepConfidence(seasonalSpread, predictions[i]);
    }
    return new ForecastResult(ForecastMethod.SEASONAL, predictions, intervals.build(),
        confidence / horizon, inSampleRSquared(values, decomposition),
        ImmutableMap.of("period", (double) decomposition.getPeriod(),
            "trendSlope", trend.getSlope(),
            "seasonalStrength", seasonality.getSeasonalStrength(),
            "residualStandardError", residualError),
        ForecastScale.ORIGINAL);
  }

  private static double inSampleRSquared(double[] values, SeasonalDecomposition decomposition) {
    double mean = StatisticsKernel.mean(values);
    double total = 0;
    double residual = 0;
    double[] r = decomposition.getResidual();
    for (int i = 0; i < values.length; i++) {
      total += (values[i] - mean) * (values[i] - mean);
      residual += r[i] * r[i];
    }
    return total > 0 ? 1 - residual / total : 0;
  }
}
