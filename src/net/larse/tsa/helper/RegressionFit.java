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
package net.larse.tsa.helper;

/**
 * An ordinary least squares line y = intercept + slope * x, with the quantities needed to build
 * prediction intervals around it.
 */
public final class RegressionFit {
  /** The fit returned for degenerate input: flat line through zero, no explanatory power. */
  public static final RegressionFit EMPTY = new RegressionFit(0, 0, 0, 0, 0, 0, 0);

  private final double slope;
  private final double intercept;
  private final double rSquared;
  private final double standardError;
  private final int n;
  private final double xMean;
  private final double sxx;

  public RegressionFit(double slope, double intercept, double rSquared, double standardError,
      int n, double xMean, double sxx) {
    this.slope = slope;
    this.intercept = intercept;
    this.rSquared = rSquared;
    this.standardError = standardError;
    this.n = n;
    this.xMean = xMean;
    this.sxx = sxx;
  }

  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }

  /** Coefficient of determination, in [0, 1]. */
  public double getRSquared() {
    return rSquared;
  }

  /** Residual standard error sqrt(SSE / (n - 2)); 0 when n < 3. */
  public double getStandardError() {
    return standardError;
  }

  public int getN() {
    return n;
  }

  public double getXMean() {
    return xMean;
  }

  /** Sum of squared deviations of x from its mean. */
  public double getSxx() {
    return sxx;
  }

  public double predict(double x) {
    return intercept + slope * x;
  }

  /**
   * Half width of the prediction interval at x, in units of the standard error:
   * sqrt(1 + 1/n + (x - xMean)^2 / sxx).
   */
  public double predictionFactor(double x) {
    if (n == 0) {
      return 1;
    }
    double leverage = sxx > 0 ? (x - xMean) * (x - xMean) / sxx : 0;
    return Math.sqrt(1 + 1.0 / n + leverage);
  }

  @Override
  public String toString() {
    return String.format("RegressionFit[slope=%.6f, intercept=%.6f, r2=%.4f, se=%.6f, n=%d]",
        slope, intercept, rSquared, standardError, n);
  }
}
