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

import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.timeseries.AnalysisStatus;

/** Forecast values of one method with intervals and quality measures. */
public final class ForecastResult {
  private final AnalysisStatus status;
  private final ForecastMethod method;
  private final double[] values;
  private final ImmutableList<ForecastInterval> intervals;
  private final double confidence;
  private final double accuracy;
  private final ImmutableMap<String, Double> parameters;
  private final ForecastScale scale;
  private final BacktestResult backtest;

  ForecastResult(ForecastMethod method, double[] values, ImmutableList<ForecastInterval> intervals,
      double confidence, double accuracy, ImmutableMap<String, Double> parameters,
      ForecastScale scale) {
    this(AnalysisStatus.OK, method, values, intervals, confidence, accuracy, parameters, scale,
        null);
  }

  private ForecastResult(AnalysisStatus status, ForecastMethod method, double[] values,
      ImmutableList<ForecastInterval> intervals, double confidence, double accuracy,
      ImmutableMap<String, Double> parameters, ForecastScale scale, BacktestResult backtest) {
    Preconditions.checkArgument(values.length == intervals.size(),
        "%s values but %s intervals", values.length, intervals.size());
    this.status = status;
    this.method = method;
    this.values = values.clone();
    this.intervals = intervals;
    this.confidence = ArrayHelper.clamp01(confidence);
    this.accuracy = ArrayHelper.clamp01(accuracy);
    this.parameters = parameters;
    this.scale = scale;
    this.backtest = backtest;
  }

  static ForecastResult insufficientData(ForecastMethod method, String detail) {
    return new ForecastResult(AnalysisStatus.insufficientData(detail), method, new double[0],
        ImmutableList.<ForecastInterval>of(), 0, 0, ImmutableMap.<String, Double>of(),
        ForecastScale.ORIGINAL, null);
  }

  /** A copy whose accuracy is the backtest accuracy. */
  ForecastResult withBacktest(BacktestResult backtest) {
    Preconditions.checkNotNull(backtest);
    return new ForecastResult(status, method, values, intervals, confidence,
        backtest.getAccuracy(), parameters, scale, backtest);
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public ForecastMethod getMethod() {
    return method;
  }

  /** One value per forecast step; empty when the status is not OK. */
  public double[] getValues() {
    return values.clone();
  }

  public int getHorizon() {
    return values.length;
  }

  public ImmutableList<ForecastInterval> getIntervals() {
    return intervals;
  }

  /** In [0, 1]. */
  public double getConfidence() {
    return confidence;
  }

  /** Backtest accuracy when the method could be backtested, otherwise the in-sample fit quality. */
  public double getAccuracy() {
    return accuracy;
  }

  public ImmutableMap<String, Double> getParameters() {
    return parameters;
  }

  public ForecastScale getScale() {
    return scale;
  }

  /** The backtest behind the accuracy, or null when there was none. */
  public BacktestResult getBacktest() {
    return backtest;
  }

  @Override
  public String toString() {
    return String.format("ForecastResult[%s, %s, horizon=%d, confidence=%.4f, accuracy=%.4f, %s]",
        status, method, values.length, confidence, accuracy, scale);
  }
}
