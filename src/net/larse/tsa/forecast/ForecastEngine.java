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

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.FitCache;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.seasonal.SeasonalityAnalyzer;
import net.larse.tsa.seasonal.SeasonalityResult;
import net.larse.tsa.timeseries.MetricSeries;
import net.larse.tsa.timeseries.TimeSeriesUtils;
import net.larse.tsa.trend.TrendDetector;
import net.larse.tsa.trend.TrendResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a forecasting method from the shape of a series, runs it and scores it by backtesting.
 *
 * <p>The method is seasonal when the autocorrelation at a detected period exceeds 0.3 (14 points or
 * more), else exponential when the linear trend has R^2 above 0.8 and slope above 0.1, else linear
 * when R^2 exceeds 0.6, else autoregressive when the volatility of relative changes exceeds 0.2,
 * else an ensemble.
 */
public final class ForecastEngine {
  private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

  static final int MIN_SEASONAL_POINTS = 14;
  static final double SEASONAL_THRESHOLD = 0.3;
  static final double EXPONENTIAL_R_SQUARED = 0.8;
  static final double EXPONENTIAL_SLOPE = 0.1;
  static final double LINEAR_R_SQUARED = 0.6;
  static final double VOLATILITY_THRESHOLD = 0.2;

  private final AnalysisArgs args;
  private final TrendDetector trendDetector;
  private final SeasonalityAnalyzer seasonalityAnalyzer;
  private final LinearForecaster linear;
  private final ExponentialForecaster exponential;
  private final SeasonalForecaster seasonal;
  private final AutoregressiveForecaster autoregressive;
  private final EnsembleForecaster ensemble;
  private final Backtester backtester;
  private final FitCache<EnsembleWeights> weightCache;

  public ForecastEngine() {
    this(new AnalysisArgs());
  }

  public ForecastEngine(AnalysisArgs args) {
    this(args, null);
  }

  /**
   * @param weightCache caller-owned cache of ensemble weights by metric, or null to compute them
   *     on every call. Cached weights are reused until the caller invalidates them.
   */
  public ForecastEngine(AnalysisArgs args, FitCache<EnsembleWeights> weightCache) {
    this.args = args.validate().copy();
    this.trendDetector = new TrendDetector(this.args);
    this.seasonalityAnalyzer = new SeasonalityAnalyzer(this.args);
    this.linear = new LinearForecaster();
    this.exponential = new ExponentialForecaster();
    this.seasonal = new SeasonalForecaster(seasonalityAnalyzer);
    this.autoregressive =
        new AutoregressiveForecaster(this.args.arOrder, this.args.differencingOrder);
    this.backtester = new Backtester(this.args.validationSplit);
    this.ensemble = new EnsembleForecaster(
        ImmutableList.of(linear, exponential, seasonal, autoregressive), backtester);
    this.weightCache = weightCache;
  }

  /** Characterises values and picks a method. */
  public MethodSelection selectMethod(double[] values) {
    double seasonalStrength = 0;
    if (values.length >= MIN_SEASONAL_POINTS) {
      SeasonalityResult seasonality = seasonalityAnalyzer.analyze(values);
      if (seasonality.isPeriodDetected() && seasonality.getStatus().isOk()) {
        seasonalStrength = seasonality.getAutocorrelationStrength();
      }
    }
    TrendResult trend = trendDetector.analyze(values);
    double volatility = volatility(values);

    ForecastMethod method;
    if (seasonalStrength > SEASONAL_THRESHOLD) {
      method = ForecastMethod.SEASONAL;
    } else if (trend.getRSquared() > EXPONENTIAL_R_SQUARED
        && trend.getSlope() > EXPONENTIAL_SLOPE) {
      method = ForecastMethod.EXPONENTIAL;
    } else if (trend.getRSquared() > LINEAR_R_SQUARED) {
      method = ForecastMethod.LINEAR;
    } else if (volatility > VOLATILITY_THRESHOLD) {
      method = ForecastMethod.AUTOREGRESSIVE;
    } else {
      method = ForecastMethod.ENSEMBLE;
    }
    return new MethodSelection(method, seasonalStrength, trend.getRSquared(), trend.getSlope(),
        volatility);
  }

  /** Population standard deviation of the relative changes. */
  @VisibleForTesting
  static double volatility(double[] values) {
    return StatisticsKernel.populationStandardDeviation(TimeSeriesUtils.returns(values));
  }

  /** Forecasts the configured horizon with the selected method. */
  public ForecastResult forecast(MetricSeries series) {
    return forecast(series, args.horizon);
  }

  public ForecastResult forecast(MetricSeries series, int horizon) {
    return forecast(series, null, horizon);
  }

  /**
   * Forecasts horizon steps with method, or with the selected method when method is null.
   *
   * @throws IllegalArgumentException if horizon is below 1
   */
  public ForecastResult forecast(MetricSeries series, ForecastMethod method, int horizon) {
    Preconditions.checkArgument(horizon >= 1, "Horizon must be >= 1: %s", horizon);
    double[] values = series.values();
    if (values.length < args.minDataPoints) {
      log.debug("{}: {} points, forecasting needs {}", series.getMetricId(), values.length,
          args.minDataPoints);
      return ForecastResult.insufficientData(method == null ? ForecastMethod.ENSEMBLE : method,
          String.format("forecasting needs %d points, got %d", args.minDataPoints,
              values.length));
    }

    if (method == null) {
      MethodSelection selection = selectMethod(values);
      log.debug("{}: selected {}", series.getMetricId(), selection);
      method = selection.getMethod();
    }

    if (method == ForecastMethod.ENSEMBLE) {
      return ensemble.forecast(values, horizon, ensembleWeights(series.getMetricId(), values));
    }

    Forecaster forecaster = forecaster(method);
    if (!forecaster.supports(values)) {
      log.debug("{}: {} cannot fit {} points", series.getMetricId(), method, values.length);
      return ForecastResult.insufficientData(method,
          String.format("%s cannot fit %d points", method, values.length));
    }
    ForecastResult result = forecaster.forecast(values, horizon);
    BacktestResult backtest = backtester.backtest(forecaster, values);
    return backtest == null ? result : result.withBacktest(backtest);
  }

  /** Backtests method on the series, or returns null when it cannot be backtested. */
  public BacktestResult backtest(MetricSeries series, ForecastMethod method) {
    return backtester.backtest(forecaster(method), series.values());
  }

  private EnsembleWeights ensembleWeights(String metricId, final double[] values) {
    if (weightCache == null) {
      return ensemble.weights(values);
    }
    return weightCache.computeIfAbsent(metricId, args, () -> ensemble.weights(values));
  }

  Forecaster forecaster(ForecastMethod method) {
    switch (method) {
      case LINEAR:
        return linear;
      case EXPONENTIAL:
        return exponential;
      case SEASONAL:
        return seasonal;
      case AUTOREGRESSIVE:
        return autoregressive;
      default:
        return ensemble;
    }
  }
}
