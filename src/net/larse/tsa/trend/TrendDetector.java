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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.LinearLeastSquares;
import net.larse.tsa.helper.RegressionFit;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;
import net.larse.tsa.timeseries.TimeSeriesUtils;

import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits linear, exponential, logarithmic and quadratic trends over the sample index and reports the
 * direction of the linear one.
 *
 * <p>The direction uses a dead-band of 0.1 per sample around zero slope. The p-value uses the
 * statistic slope / sqrt((1 - R^2) / (n - 2)) under a normal approximation.
 */
public final class TrendDetector {
  private static final Logger log = LoggerFactory.getLogger(TrendDetector.class);

  public static final double SLOPE_DEAD_BAND = 0.1;
  // floor applied before taking logs of the values
  static final double LOG_FLOOR = 0.001;

  private final AnalysisArgs args;

  public TrendDetector() {
    this(new AnalysisArgs());
  }

  public TrendDetector(AnalysisArgs args) {
    this.args = args.validate().copy();
  }

  public TrendResult analyze(MetricSeries series) {
    return analyze(series.values());
  }

  public TrendResult analyze(double[] values) {
    int n = values.length;
    if (n < 2) {
      log.debug("Trend skipped, {} point(s)", n);
      return TrendResult.insufficientData(n);
    }

    ImmutableMap<FitType, CandidateFit> candidates = candidateFits(values);
    CandidateFit linear = candidates.get(FitType.LINEAR);
    double slope = linear.getSlope();
    double rSquared = linear.getRSquared();

    TrendDirection direction;
    switch (TimeSeriesUtils.direction(slope, SLOPE_DEAD_BAND)) {
      case INCREASING:
        direction = TrendDirection.INCREASING;
        break;
      case DECREASING:
        direction = TrendDirection.DECREASING;
        break;
      default:
        direction = TrendDirection.STABLE;
        break;
    }

    return new TrendResult(AnalysisStatus.OK, direction, bestFit(candidates), slope,
        linear.getIntercept(), rSquared, pValue(slope, rSquared, n),
        rSquared > args.confidenceThreshold ? Confidence.HIGH : Confidence.LOW,
        confidenceScore(rSquared, n), n, candidates);
  }

  /** All four candidate fits over x = 0 .. n - 1. */
  public ImmutableMap<FitType, CandidateFit> candidateFits(double[] values) {
    int n = values.length;
    double[] x = ArrayHelper.sequence(n);

    RegressionFit linear = StatisticsKernel.regression(x, values);

    double[] logValues = new double[n];
    for (int i = 0; i < n; i++) {
      logValues[i] = Math.log(Math.max(values[i], LOG_FLOOR));
    }
    RegressionFit exponential = StatisticsKernel.regression(x, logValues);

    double[] logX = new double[n];
    for (int i = 0; i < n; i++) {
      logX[i] = Math.log(x[i] + 1);
    }
    RegressionFit logarithmic = StatisticsKernel.regression(logX, values);

    return ImmutableMap.of(
        FitType.LINEAR, fromRegression(FitType.LINEAR, linear),
        FitType.EXPONENTIAL, fromRegression(FitType.EXPONENTIAL, exponential),
        FitType.LOGARITHMIC, fromRegression(FitType.LOGARITHMIC, logarithmic),
        FitType.POLYNOMIAL, quadratic(values));
  }

  private static CandidateFit fromRegression(FitType type, RegressionFit fit) {
    return new CandidateFit(type, new double[] {fit.getIntercept(), fit.getSlope()},
        fit.getRSquared());
  }

  /**
   * Degree-2 least squares over x scaled to [0, 1], with the coefficients mapped back to the
   * unscaled index.
   */
  @VisibleForTesting
  static CandidateFit quadratic(double[] values) {
    int n = values.length;
    if (n < 3) {
      return CandidateFit.empty(FitType.POLYNOMIAL);
    }
    double scale = n - 1;
    LinearLeastSquares solver = new LinearLeastSquares(3);
    double[] row = new double[3];
    for (int i = 0; i < n; i++) {
      double xs = i / scale;
      row[0] = 1;
      row[1] = xs;
      row[2] = xs * xs;
      solver.addInput(row, values[i]);
    }
    DenseMatrix64F solution = new DenseMatrix64F(3, 1);
    if (!solver.getSolution(solution)) {
      log.debug("Quadratic trend is singular for {} points", n);
      return CandidateFit.empty(FitType.POLYNOMIAL);
    }
    double[] coefficients = {
        solution.get(0, 0), solution.get(1, 0) / scale, solution.get(2, 0) / (scale * scale)};
    for (double c : coefficients) {
      if (Double.isNaN(c) || Double.isInfinite(c)) {
        return CandidateFit.empty(FitType.POLYNOMIAL);
      }
    }
    return new CandidateFit(FitType.POLYNOMIAL, coefficients, solver.getRSquared(solution));
  }

  private static FitType bestFit(ImmutableMap<FitType, CandidateFit> candidates) {
    FitType best = FitType.NONE;
    double bestRSquared = 0;
    for (CandidateFit candidate : candidates.values()) {
      if (candidate.getRSquared() > bestRSquared) {
        bestRSquared = candidate.getRSquared();
        best = candidate.getType();
      }
    }
    return best;
  }

  @VisibleForTesting
  static double pValue(double slope, double rSquared, int n) {
    if (n < 3) {
      return 1;
    }
    if (rSquared >= 1) {
      return 0;
    }
    double t = slope / Math.sqrt((1 - rSquared) / (n - 2));
    return StatisticsKernel.twoSidedPValue(t);
  }

  @VisibleForTesting
  static double confidenceScore(double rSquared, int n) {
    double score = rSquared;
    if (n < 20) {
      score *= 0.8;
    }
    if (n < 10) {
      score *= 0.6;
    }
    return ArrayHelper.clamp01(score);
  }
}
