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
package net.larse.tsa.trend;

import com.google.common.base.Preconditions;

/**
 * One fitted trend form. Coefficients are in increasing powers of the form's regressor: {a, b}
 * for the two-parameter forms and {a, b, c} for the polynomial.
 */
public final class CandidateFit {
  private final FitType type;
  private final double[] coefficients;
  private final double rSquared;

  public CandidateFit(FitType type, double[] coefficients, double rSquared) {
    this.type = Preconditions.checkNotNull(type);
    this.coefficients = coefficients.clone();
    this.rSquared = rSquared;
  }

  static CandidateFit empty(FitType type) {
    return new CandidateFit(type, new double[type == FitType.POLYNOMIAL ? 3 : 2], 0);
  }

  public FitType getType() {
    return type;
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  public double getIntercept() {
    return coefficients[0];
  }

  /** Linear coefficient, in the units of the form's regressor. */
  public double getSlope() {
    return coefficients.length > 1 ? coefficients[1] : 0;
  }

  /** R-squared of the fit, for the exponential form in log space. */
  public double getRSquared() {
    return rSquared;
  }

  /** Evaluates the fitted curve at index x. */
  public double predict(double x) {
    switch (type) {
      case LINEAR:
        return coefficients[0] + coefficients[1] * x;
      case EXPONENTIAL:
        return Math.exp(coefficients[0] + coefficients[1] * x);
      case LOGARITHMIC:
        return coefficients[0] + coefficients[1] * Math.log(x + 1);
      case POLYNOMIAL:
        return coefficients[0] + coefficients[1] * x + coefficients[2] * x * x;
      default:
        return 0;
    }
  }

  @Override
  public String toString() {
    return String.format("%s(r2=%.4f)", type, rSquared);
  }
}
