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

/** The forecasting method chosen for a series and the characteristics it was chosen from. */
public final class MethodSelection {
  private final ForecastMethod method;
  private final double seasonalStrength;
  private final double trendRSquared;
  private final double trendSlope;
  private final double volatility;

  MethodSelection(ForecastMethod method, double seasonalStrength, double trendRSquared,
      double trendSlope, double volatility) {
    this.method = method;
    this.seasonalStrength = seasonalStrength;
    this.trendRSquared = trendRSquared;
    this.trendSlope = trendSlope;
    this.volatility = volatility;
  }

  public ForecastMethod getMethod() {
    return method;
  }

  /** Autocorrelation at the detected period, or 0 when no period was detected. */
  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  public double getTrendRSquared() {
    return trendRSquared;
  }

  public double getTrendSlope() {
    return trendSlope;
  }

  /** Population standard deviation of the relative changes. */
  public double getVolatility() {
    return volatility;
  }

  @Override
  public String toString() {
    return String.format(
        "%s (seasonal=%.3f, r2=%.3f, slope=%.3f, volatility=%.3f)",
        method, seasonalStrength, trendRSquared, trendSlope, volatility);
  }
}
