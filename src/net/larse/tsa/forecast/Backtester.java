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

import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.StatisticsKernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refits a forecaster on the first floor(n (1 - split)) points and scores its forecast of the rest.
 * Forecasts on the differenced scale are scored against the differenced held-out values.
 */
public class Backtester {
  private static final Logger log = LoggerFactory.getLogger(Backtester.class);

  static final int MIN_TRAINING = 3;
  static final int MIN_VALIDATION = 2;

  private final double validationSplit;

  public Backtester(double validationSplit) {
    Preconditions.checkArgument(validationSplit > 0 && validationSplit < 1,
        "Validation split must be in (0, 1): %s", validationSplit);
    this.validationSplit = validationSplit;
  }

  /**
   * Backtests forecaster on values.
   *
   * @return the scores, or null when the split leaves fewer than 3 training or 2 validation points
   *     or the forecaster cannot fit the training part
   */
  public BacktestResult backtest(Forecaster forecaster, double[] values) {
    int split = (int) Math.floor(values.length * (1 - validationSplit));
    int validationSize = values.length - split;
    if (split < MIN_TRAINING || validationSize < MIN_VALIDATION) {
      log.debug("{} not backtestable: {} training / {} validation points", forecaster.method(),
          split, validationSize);
      return null;
    }
    double[] training = ArrayHelper.slice(values, 0, split);
    if (!forecaster.supports(training)) {
      log.debug("{} cannot fit {} training points", forecaster.method(), split);
      return null;
    }
    // the held-out tail on the forecaster's own scale
    double[] scaled = forecaster.onScale(values);
    double[] actual = ArrayHelper.slice(scaled, scaled.length - validationSize, scaled.length);
    double[] predicted = forecaster.forecast(training, validationSize).getValues();
    return new BacktestResult(forecaster.method(), split, validationSize, mape(actual, predicted),
        rmse(actual, predicted), rSquared(actual, predicted));
  }

  /** Mean |(a - p) / a| over the non-zero actual values; 0 when all are zero. */
  static double mape(double[] actual, double[] predicted) {
    double sum = 0;
    int count = 0;
    for (int i = 0; i < actual.length; i++) {
      if (actual[i] != 0) {
        sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
        count++;
      }
    }
    return count > 0 ? StatisticsKernel.finiteOr(sum / count, 1) : 0;
  }

  static double rmse(double[] actual, double[] predicted) {
    double sum = 0;
    for (int i = 0; i < actual.length; i++) {
      sum += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
    }
    return StatisticsKernel.finiteOr(Math.sqrt(sum / actual.length), Double.MAX_VALUE);
  }

  /** 1 - SSres / SStot; 0 when the actual values are constant. */
  static double rSquared(double[] actual, double[] predicted) {
    double mean = StatisticsKernel.mean(actual);
    double residual = 0;
    double total = 0;
    for (int i = 0; i < actual.length; i++) {
      residual += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
      total += (actual[i] - mean) * (actual[i] - mean);
    }
    if (total == 0) {
      return 0;
    }
    return StatisticsKernel.finiteOr(1 - residual / total, 0);
  }
}
