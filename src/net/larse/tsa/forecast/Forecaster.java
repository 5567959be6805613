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

/** Fits one forecasting model to a series and extrapolates it. */
public interface Forecaster {
  ForecastMethod method();

  /** The scale of the values this forecaster produces. */
  default ForecastScale scale() {
    return ForecastScale.ORIGINAL;
  }

  /** values expressed on {@link #scale()}, so forecasts can be compared with them. */
  default double[] onScale(double[] values) {
    return values;
  }

  /** Whether values carry enough history, of the right sign, for this model. */
  boolean supports(double[] values);

  /**
   * Forecasts horizon steps past the end of values. The accuracy of the result is the in-sample
   * fit quality.
   */
  ForecastResult forecast(double[] values, int horizon);
}
