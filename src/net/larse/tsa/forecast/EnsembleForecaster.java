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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted average of the member forecasters that apply to a series. A member applies when it
 * supports the series and forecasts on the original scale. Members are weighted by their backtest
 * accuracy.
 */
public class EnsembleForecaster implements Forecaster {
  private static final Logger log = LoggerFactory.getLogger(EnsembleForecaster.class);

  private final ImmutableList<Forecaster> members;
  private final Backtester backtester;

  public EnsembleForecaster(List<? extends Forecaster> members, Backtester backtester) {
    Preconditions.checkArgument(!members.isEmpty(), "No ensemble members");
    this.members = ImmutableList.copyOf(members);
    this.backtester = Preconditions.checkNotNull(backtester);
  }

  @Override
  public ForecastMethod method() {
    return ForecastMethod.ENSEMBLE;
  }

  @Override
  public boolean supports(double[] values) {
    return !applicable(values).isEmpty();
  }

  /** Members that can forecast values on the original scale. */
  public ImmutableList<Forecaster> applicable(double[] values) {
    ImmutableList.Builder<Forecaster> applicable = ImmutableList.builder();
    for (Forecaster member : members) {
      if (member.scale() == ForecastScale.ORIGINAL && member.supports(values)) {
        applicable.add(member);
      }
    }
    return applicable.build();
  }

  /** Backtests every applicable member and normalises the accuracies. */
  public EnsembleWeights weights(double[] values) {
    Map<ForecastMethod, Double> accuracies = new EnumMap<>(ForecastMethod.class);
    for (Forecaster member : applicable(values)) {
      BacktestResult backtest = backtester.backtest(member, values);
      accuracies.put(member.method(),
          backtest == null ? EnsembleWeights.UNKNOWN_ACCURACY : backtest.getAccuracy());
    }
    Preconditions.checkArgument(!accuracies.isEmpty(), "No ensemble member supports %s points",
        values.length);
    return EnsembleWeights.fromAccuracies(accuracies);
  }

  @Override
  public ForecastResult forecast(double[] values, int horizon) {
    return forecast(values, horizon, weights(values));
  }

  /**
   * Combines the applicable members with the given weights. Members missing from weights are
   * skipped, and the remaining weights are renormalised.
   */
  public ForecastResult forecast(double[] values, int horizon, EnsembleWeights weights) {
    Map<ForecastMethod, ForecastResult> forecasts = new EnumMap<>(ForecastMethod.class);
    double total = 0;
    for (Forecaster member : applicable(values)) {
      if (weights.getWeights().containsKey(member.method())) {
        forecasts.put(member.method(), member.forecast(values, horizon));
        total += weights.weight(member.method());
      }
    }
    Preconditions.checkArgument(!forecasts.isEmpty(), "No weighted member supports %s points",
        values.length);

    double[] combined = new double[horizon];
    double[] lower = new double[horizon];
    double[] upper = new double[horizon];
    double confidence = 0;
    double accuracy = 0;
    ImmutableMap.Builder<String, Double> parameters = ImmutableMap.builder();
    for (Map.Entry<ForecastMethod, ForecastResult> entry : forecasts.entrySet()) {
      double weight = total > 0
          ? weights.weight(entry.getKey()) / total : 1.0 / forecasts.size();
      ForecastResult forecast = entry.getValue();
      double[] memberValues = forecast.getValues();
      for (int i = 0; i < horizon; i++) {
        combined[i] += weight * memberValues[i];
        lower[i] += weight * forecast.getIntervals().get(i).getLower();
        upper[i] += weight * forecast.getIntervals().get(i).getUpper();
      }
      confidence += weight * forecast.getConfidence();
      Double memberAccuracy = weights.getAccuracies().get(entry.getKey());
      accuracy += weight * (memberAccuracy == null ? forecast.getAccuracy() : memberAccuracy);
      parameters.put("weight." + entry.getKey().name(), weight);
    }
    log.debug("Ensemble of {} member(s): {}", forecasts.size(), weights);

    ImmutableList.Builder<ForecastInterval> intervals = ImmutableList.builder();
    for (int i = 0; i < horizon; i++) {
      intervals.add(new ForecastInterval(lower[i], upper[i]));
    }
    return new ForecastResult(ForecastMethod.ENSEMBLE, combined, intervals.build(), confidence,
        accuracy, parameters.build(), ForecastScale.ORIGINAL);
  }
}
