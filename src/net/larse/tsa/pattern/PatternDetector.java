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
package net.larse.tsa.pattern;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.seasonal.SeasonalityAnalyzer;
import net.larse.tsa.timeseries.AutocorrelationPeak;
import net.larse.tsa.timeseries.MetricSeries;
import net.larse.tsa.timeseries.TimeSeriesUtils;
import net.larse.tsa.trend.CandidateFit;
import net.larse.tsa.trend.FitType;
import net.larse.tsa.trend.TrendDetector;
import net.larse.tsa.trend.TrendDirection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Searches a series for cyclical, calendar, trend, volatility, regime and clustering patterns.
 *
 * <p>Each search has its own minimum length. A shorter series yields a pattern with an
 * insufficient-data status instead of an exception.
 */
public final class PatternDetector {
  private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

  static final int MIN_CYCLICAL_POINTS = 10;
  static final int MIN_TREND_POINTS = 5;
  static final int MIN_VOLATILITY_POINTS = 10;
  static final int MIN_REGIME_POINTS = 20;
  static final int MIN_CLUSTERING_POINTS = 15;
  static final double TREND_THRESHOLD = 0.7;
  static final double SEGMENT_DEAD_BAND = 0.01;
  static final int MAX_WINDOW = 10;

  private final AnalysisArgs args;
  private final TrendDetector trendDetector;
  private final SeasonalityAnalyzer seasonalityAnalyzer;

  public PatternDetector() {
    this(new AnalysisArgs());
  }

  public PatternDetector(AnalysisArgs args) {
    this.args = args.validate().copy();
    this.trendDetector = new TrendDetector(this.args);
    this.seasonalityAnalyzer = new SeasonalityAnalyzer(this.args);
  }

  /** Runs every search. */
  public PatternReport detectAll(MetricSeries series) {
    return detect(series, EnumSet.allOf(PatternType.class));
  }

  public PatternReport detect(MetricSeries series, Set<PatternType> types) {
    double[] values = series.values();
    ImmutableMap.Builder<PatternType, Pattern> patterns = ImmutableMap.builder();
    Set<PatternType> ordered =
        types.isEmpty() ? EnumSet.noneOf(PatternType.class) : EnumSet.copyOf(types);
    for (PatternType type : ordered) {
      Pattern pattern;
      switch (type) {
        case CYCLICAL:
          pattern = cyclical(values);
          break;
        case SEASONAL:
          pattern = seasonal(series);
          break;
        case TREND:
          pattern = trend(values);
          break;
        case VOLATILITY:
          pattern = volatility(values);
          break;
        case REGIME:
          pattern = regime(values);
          break;
        case CLUSTERING:
          pattern = clustering(values);
          break;
        default:
          throw new IllegalArgumentException("Unknown pattern type: " + type);
      }
      log.debug("{}: {}", series.getMetricId(), pattern);
      patterns.put(type, pattern);
    }
    return new PatternReport(series.getMetricId(), patterns.build());
  }

  /** Autocorrelation peaks of the centered series; the strongest one is the primary period. */
  public CyclicalPattern cyclical(double[] values) {
    if (values.length < MIN_CYCLICAL_POINTS) {
      return CyclicalPattern.insufficientData(tooShort("cyclical", MIN_CYCLICAL_POINTS, values));
    }
    double[] acf = TimeSeriesUtils.autocorrelations(TimeSeriesUtils.center(values));
    ImmutableList<AutocorrelationPeak> peaks = TimeSeriesUtils.peaksByStrength(acf);
    if (peaks.isEmpty()) {
      return CyclicalPattern.notDetected();
    }
    AutocorrelationPeak primary = peaks.get(0);
    ImmutableList.Builder<Integer> secondary = ImmutableList.builder();
    for (AutocorrelationPeak peak : peaks.subList(1, peaks.size())) {
      secondary.add(peak.getLag());
    }
    double meanAbsolute = TimeSeriesUtils.meanAbsoluteAutocorrelation(acf);
    double confidence = Math.min(primary.getValue() / (primary.getValue() + meanAbsolute), 1);
    return new CyclicalPattern(primary.getLag(), primary.getValue(), secondary.build(),
        confidence,
        SeasonalityAnalyzer.harmonics(acf, primary.getLag(), primary.getValue()));
  }

  /** Calendar patterns in the configured zone. */
  public SeasonalPattern seasonal(MetricSeries series) {
    return new SeasonalPattern(seasonalityAnalyzer.calendarPatterns(series));
  }

  /** The best of the candidate trend fits, detected when its R^2 exceeds 0.7. */
  public TrendPattern trend(double[] values) {
    if (values.length < MIN_TREND_POINTS) {
      return TrendPattern.insufficientData(tooShort("trend", MIN_TREND_POINTS, values));
    }
    ImmutableMap<FitType, CandidateFit> candidates = trendDetector.candidateFits(values);
    CandidateFit best = null;
    for (CandidateFit candidate : candidates.values()) {
      if (candidate.getRSquared() > 0
          && (best == null || candidate.getRSquared() > best.getRSquared())) {
        best = candidate;
      }
    }
    if (best == null) {
      return new TrendPattern(false, FitType.NONE, 0, 0, candidates);
    }
    return new TrendPattern(best.getRSquared() > TREND_THRESHOLD, best.getType(),
        best.getRSquared(), best.getSlope(), candidates);
  }

  /** Volatility of the relative changes over rolling windows of min(10, n / 3). */
  public VolatilityPattern volatility(double[] values) {
    if (values.length < MIN_VOLATILITY_POINTS) {
      return VolatilityPattern.insufficientData(
          tooShort("volatility", MIN_VOLATILITY_POINTS, values));
    }
    double[] returns = TimeSeriesUtils.returns(values);
    int window = Math.min(MAX_WINDOW, values.length / 3);
    double[] rolling = TimeSeriesUtils.rollingStandardDeviation(returns, window);
    return new VolatilityPattern(StatisticsKernel.populationStandardDeviation(returns), rolling,
        volatilityClustering(rolling), volatilityRegimes(rolling), segmentTrend(rolling));
  }

  @VisibleForTesting
  static VolatilityClustering volatilityClustering(double[] volatility) {
    double threshold = StatisticsKernel.mean(volatility)
        + StatisticsKernel.populationStandardDeviation(volatility);
    int count = 0;
    int run = 0;
    int maxRun = 0;
    for (double v : volatility) {
      if (v > threshold) {
        if (run == 0) {
          count++;
        }
        run++;
        maxRun = Math.max(maxRun, run);
      } else {
        run = 0;
      }
    }
    return new VolatilityClustering(count, maxRun);
  }

  @VisibleForTesting
  static ImmutableList<VolatilityRegime> volatilityRegimes(double[] volatility) {
    double mean = StatisticsKernel.mean(volatility);
    double sd = StatisticsKernel.populationStandardDeviation(volatility);
    ImmutableList.Builder<VolatilityRegime> regimes = ImmutableList.builder();
    VolatilityRegime.Level current = null;
    int start = 0;
    for (int i = 0; i < volatility.length; i++) {
      VolatilityRegime.Level level;
      if (volatility[i] < mean - sd) {
        level = VolatilityRegime.Level.LOW;
      } else if (volatility[i] > mean + sd) {
        level = VolatilityRegime.Level.HIGH;
      } else {
        level = VolatilityRegime.Level.MEDIUM;
      }
      if (level != current) {
        if (current != null) {
          regimes.add(new VolatilityRegime(current, start, i - 1));
        }
        current = level;
        start = i;
      }
    }
    if (current != null) {
      regimes.add(new VolatilityRegime(current, start, volatility.length - 1));
    }
    return regimes.build();
  }

  /**
   * Change points of the relative changes and the value segments between them. A point is flagged
   * when the mean of the following window moves by more than twice the standard deviation of the
   * preceding window, or the standard deviation moves by more than half of it.
   */
  public RegimePattern regime(double[] values) {
    if (values.length < MIN_REGIME_POINTS) {
      return RegimePattern.insufficientData(tooShort("regime", MIN_REGIME_POINTS, values));
    }
    ImmutableList<Integer> changePoints = changePoints(TimeSeriesUtils.returns(values));
    if (changePoints.isEmpty()) {
      return RegimePattern.notDetected();
    }

    ImmutableList.Builder<RegimeSegment> segments = ImmutableList.builder();
    double largestShift = 0;
    double previousMean = Double.NaN;
    int start = 0;
    for (int i = 0; i <= changePoints.size(); i++) {
      int end = i < changePoints.size() ? changePoints.get(i) : values.length;
      double[] slice = ArrayHelper.slice(values, start, end);
      double mean = StatisticsKernel.mean(slice);
      segments.add(new RegimeSegment(start, end - 1, mean,
          StatisticsKernel.populationStandardDeviation(slice), segmentTrend(slice)));
      if (!Double.isNaN(previousMean)) {
        largestShift = Math.max(largestShift, Math.abs(mean - previousMean));
      }
      previousMean = mean;
      start = end;
    }
    double sd = StatisticsKernel.populationStandardDeviation(values);
    double strength = sd > 0 ? ArrayHelper.clamp01(largestShift / sd) : 0;
    return new RegimePattern(changePoints, segments.build(), strength);
  }

  /**
   * Indices i in [w, n - w) of returns, w = min(10, n / 3), where the window [i, i + w) departs
   * from [i - w, i). Runs of adjacent flagged indices collapse to their first index.
   */
  @VisibleForTesting
  static ImmutableList<Integer> changePoints(double[] returns) {
    int window = Math.min(MAX_WINDOW, returns.length / 3);
    IntArrayList flagged = new IntArrayList();
    if (window < 1) {
      return ImmutableList.of();
    }
    for (int i = window; i < returns.length - window; i++) {
      double[] before = ArrayHelper.slice(returns, i - window, i);
      double[] after = ArrayHelper.slice(returns, i, i + window);
      double beforeSd = StatisticsKernel.populationStandardDeviation(before);
      double meanChange =
          Math.abs(StatisticsKernel.mean(after) - StatisticsKernel.mean(before));
      double sdChange =
          Math.abs(StatisticsKernel.populationStandardDeviation(after) - beforeSd);
      if (meanChange > 2 * beforeSd || sdChange > 0.5 * beforeSd) {
        flagged.add(i);
      }
    }

    ImmutableList.Builder<Integer> changePoints = ImmutableList.builder();
    for (int k = 0; k < flagged.size(); k++) {
      if (k == 0 || flagged.getInt(k) != flagged.getInt(k - 1) + 1) {
        changePoints.add(flagged.getInt(k));
      }
    }
    return changePoints.build();
  }

  /** Sign of the OLS slope over index with a 0.01 dead-band. */
  private static TrendDirection segmentTrend(double[] values) {
    if (values.length < 2) {
      return TrendDirection.INSUFFICIENT_DATA;
    }
    switch (TimeSeriesUtils.direction(StatisticsKernel.regression(values).getSlope(),
        SEGMENT_DEAD_BAND)) {
      case INCREASING:
        return TrendDirection.INCREASING;
      case DECREASING:
        return TrendDirection.DECREASING;
      default:
        return TrendDirection.STABLE;
    }
  }

  /**
   * k-means over the features of the windows [i - w, i), w = min(10, n / 3), with k and the seed
   * taken from the arguments.
   */
  public ClusteringPattern clustering(double[] values) {
    if (values.length < MIN_CLUSTERING_POINTS) {
      return ClusteringPattern.insufficientData(
          tooShort("clustering", MIN_CLUSTERING_POINTS, values));
    }
    int window = Math.min(MAX_WINDOW, values.length / 3);
    ImmutableList.Builder<FeatureVector> featureBuilder = ImmutableList.builder();
    for (int i = window; i < values.length; i++) {
      featureBuilder.add(FeatureVector.of(ArrayHelper.slice(values, i - window, i)));
    }
    ImmutableList<FeatureVector> features = featureBuilder.build();
    double[][] points = new double[features.size()][];
    for (int i = 0; i < points.length; i++) {
      points[i] = features.get(i).toArray();
    }

    KMeans kMeans = KMeans.fit(points, args.clusterCount, args.randomSeed);
    int[] sizes = kMeans.sizes();
    double[][] centroids = kMeans.getCentroids();
    ImmutableList.Builder<ClusterSummary> clusters = ImmutableList.builder();
    for (int c = 0; c < sizes.length; c++) {
      if (sizes[c] > 0) {
        clusters.add(new ClusterSummary(c, sizes[c], 100.0 * sizes[c] / points.length,
            centroids[c]));
      }
    }
    return new ClusteringPattern(window, features, kMeans.getAssignments(), clusters.build(),
        kMeans.silhouette(), kMeans.getIterations());
  }

  private static String tooShort(String search, int required, double[] values) {
    return String.format("%s search needs %d points, got %d", search, required, values.length);
  }
}
