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

import net.larse.tsa.helper.ArrayHelper;

/** Errors of a forecaster refit on the head of a series and scored on its held-out tail. */
public final class BacktestResult {
  private final ForecastMethod method;
  private final int trainingSize;
  private final int validationSize;
  private final double mape;
  private final double rmse;
  private final double rSquared;

  BacktestResult(ForecastMethod method, int trainingSize, int validationSize, double mape,
      double rmse, double rSquared) {
    this.method = method;
    this.trainingSize = trainingSize;
    this.validationSize = validationSize;
    this.mape = mape;
    this.rmse = rmse;
    this.rSquared = rSquared;
  }

  public ForecastMethod getMethod() {
    return method;
  }

  public int getTrainingSize() {
    return trainingSize;
  }

  public int getValidationSize() {
    return validationSize;
  }

  /** Mean absolute percentage error as a fraction, over the non-zero actual values. */
  public double getMape() {
    return mape;
  }

  public double getRmse() {
    return rmse;
  }

  /** 1 - SSres / SStot of the held-out values; may be negative. */
  public double getRSquared() {
    return rSquared;
  }

  /** (1 - MAPE) * R^2 with both factors clamped to [0, 1]. */
  public double getAccuracy() {
    return ArrayHelper.clamp01(1 - mape) * ArrayHelper.clamp01(rSquared);
  }

  @Override
  public String toString() {
    return String.format("Backtest[%s, mape=%.4f, rmse=%.4f, r2=%.4f, accuracy=%.4f]",
        method, mape, rmse, rSquared, getAccuracy());
  }
}
