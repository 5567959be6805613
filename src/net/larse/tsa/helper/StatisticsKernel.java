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

import com.google.common.base.Preconditions;

import org.apache.commons.math.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.moment.Variance;
import org.apache.commons.math.stat.ranking.NaNStrategy;
import org.apache.commons.math.stat.ranking.NaturalRanking;
import org.apache.commons.math.stat.ranking.TiesStrategy;
import org.apache.commons.math.stat.regression.SimpleRegression;

import java.util.Arrays;

/**
 * Numeric primitives shared by the analyzers.
 *
 * <p>None of these functions return NaN or infinity for finite input. Degenerate cases (empty
 * input, zero variance, too few points) resolve to neutral values: 0 for moments, slopes and
 * correlations, 1 for p-values.
 */
public final class StatisticsKernel {
  // Abramowitz and Stegun, formula 7.1.26.
  private static final double ERF_A1 = 0.254829592;
  private static final double ERF_A2 = -0.284496736;
  private static final double ERF_A3 = 1.421413741;
  private static final double ERF_A4 = -1.453152027;
  private static final double ERF_A5 = 1.061405429;
  private static final double ERF_P = 0.3275911;

  private StatisticsKernel() {}

  public static double mean(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    return new Mean().evaluate(values);
  }

  /** Bias-corrected (n - 1) variance. */
  public static double variance(double[] values) {
    if (values.length < 2) {
      return 0;
    }
    return new Variance().evaluate(values);
  }

  /** Bias-corrected (n - 1) standard deviation. */
  public static double standardDeviation(double[] values) {
    if (values.length < 2) {
      return 0;
    }
    return new StandardDeviation().evaluate(values);
  }

  public static double populationVariance(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    return new Variance(false).evaluate(values);
  }

  public static double populationStandardDeviation(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    return new StandardDeviation(false).evaluate(values);
  }

  /** Population standard deviation divided by the absolute mean; 0 when the mean is 0. */
  public static double coefficientOfVariation(double[] values) {
    double mean = mean(values);
    if (mean == 0) {
      return 0;
    }
    return populationStandardDeviation(values) / Math.abs(mean);
  }

  /** Population skewness m3 / m2^1.5. */
  public static double skewness(double[] values) {
    double[] moments = centralMoments(values);
    if (moments[0] <= 0) {
      return 0;
    }
    return moments[1] / Math.pow(moments[0], 1.5);
  }

  /** Population excess kurtosis m4 / m2^2 - 3. */
  public static double kurtosis(double[] values) {
    double[] moments = centralMoments(values);
    if (moments[0] <= 0) {
      return 0;
    }
    return moments[2] / (moments[0] * moments[0]) - 3;
  }

  // Returns {m2, m3, m4}.
  private static double[] centralMoments(double[] values) {
    double[] moments = new double[3];
    if (values.length == 0) {
      return moments;
    }
    double mean = mean(values);
    for (double v : values) {
      double d = v - mean;
      double d2 = d * d;
      moments[0] += d2;
      moments[1] += d2 * d;
      moments[2] += d2 * d2;
    }
    for (int i = 0; i < moments.length; i++) {
      moments[i] /= values.length;
    }
    return moments;
  }

  /**
   * Percentile by linear interpolation between order statistics at index p / 100 * (n - 1).
   *
   * @param p percentile in [0, 100]
   */
  public static double percentile(double[] values, double p) {
    Preconditions.checkArgument(p >= 0 && p <= 100, "Percentile out of range: %s", p);
    if (values.length == 0) {
      return 0;
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double index = p / 100 * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    if (lower == upper) {
      return sorted[lower];
    }
    double weight = index - lower;
    return sorted[lower] * (1 - weight) + sorted[upper] * weight;
  }

  /** Ranks starting at 1; tied values share the average of their ranks. */
  public static double[] ranks(double[] values) {
    if (values.length == 0) {
      return new double[0];
    }
    return new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE).rank(values);
  }

  /**
   * Ordinary least squares of y on x.
   *
   * @return the fit, or a flat line through the mean of y when x has no spread
   */
  public static RegressionFit regression(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "Length mismatch: %s != %s", x.length, y.length);
    int n = x.length;
    if (n == 0) {
      return RegressionFit.EMPTY;
    }
    double xMean = mean(x);
    double sxx = 0;
    for (double xi : x) {
      sxx += (xi - xMean) * (xi - xMean);
    }
    if (n < 2 || sxx == 0) {
      return new RegressionFit(0, mean(y), 0, 0, n, xMean, sxx);
    }

    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < n; i++) {
      regression.addData(x[i], y[i]);
    }
    double slope = finiteOr(regression.getSlope(), 0);
    double intercept = finiteOr(regression.getIntercept(), mean(y));
    double rSquared = ArrayHelper.clamp01(finiteOr(regression.getRSquare(), 0));
    double standardError = n > 2 ? Math.sqrt(Math.max(0, regression.getMeanSquareError())) : 0;
    return new RegressionFit(slope, intercept, rSquared, finiteOr(standardError, 0), n, xMean, sxx);
  }

  /** Regression of y on its index 0..n-1. */
  public static RegressionFit regression(double[] y) {
    return regression(ArrayHelper.sequence(y.length), y);
  }

  /** Pearson correlation in [-1, 1]; 0 when either side has no variance or n < 2. */
  public static double pearson(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "Length mismatch: %s != %s", x.length, y.length);
    if (x.length < 2 || populationVariance(x) == 0 || populationVariance(y) == 0) {
      return 0;
    }
    double r = new PearsonsCorrelation().correlation(x, y);
    return ArrayHelper.clamp(finiteOr(r, 0), -1, 1);
  }

  /** Pearson correlation of the average ranks. */
  public static double spearman(double[] x, double[] y) {
    return pearson(ranks(x), ranks(y));
  }

  /**
   * Kendall's tau (C - D) / (C + D) over all pairs of observations. Pairs tied in either variable
   * count as neither concordant nor discordant.
   */
  public static double kendall(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "Length mismatch: %s != %s", x.length, y.length);
    long concordant = 0;
    long discordant = 0;
    for (int i = 0; i < x.length; i++) {
      for (int j = i + 1; j < x.length; j++) {
        double sign = Math.signum(x[i] - x[j]) * Math.signum(y[i] - y[j]);
        if (sign > 0) {
          concordant++;
        } else if (sign < 0) {
          discordant++;
        }
      }
    }
    if (concordant + discordant == 0) {
      return 0;
    }
    return (double) (concordant - discordant) / (concordant + discordant);
  }

  public static double erf(double x) {
    double sign = x < 0 ? -1 : 1;
    double ax = Math.abs(x);
    double t = 1 / (1 + ERF_P * ax);
    double poly = ((((ERF_A5 * t + ERF_A4) * t + ERF_A3) * t + ERF_A2) * t + ERF_A1) * t;
    return sign * (1 - poly * Math.exp(-ax * ax));
  }

  public static double normalCdf(double x) {
    return 0.5 * (1 + erf(x / Math.sqrt(2)));
  }

  /** Two-sided p-value 2 * (1 - Phi(|t|)) under the normal approximation. */
  public static double twoSidedPValue(double t) {
    if (Double.isNaN(t)) {
      return 1;
    }
    if (Double.isInfinite(t)) {
      return 0;
    }
    return ArrayHelper.clamp01(2 * (1 - normalCdf(Math.abs(t))));
  }

  public static double euclideanDistance(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length,
        "Length mismatch: %s != %s", a.length, b.length);
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      double d = a[i] - b[i];
      sum += d * d;
    }
    return Math.sqrt(sum);
  }

  public static double finiteOr(double value, double fallback) {
    return Double.isNaN(value) || Double.isInfinite(value) ? fallback : value;
  }
}
