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
package net.larse.tsa.seasonal;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.AutocorrelationPeak;
import net.larse.tsa.timeseries.MetricSeries;
import net.larse.tsa.timeseries.TimeSeriesUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Finds the dominant period of a series, decomposes it additively at that period and measures
 * calendar (hour of day, day of week, day of month) effects.
 */
public final class SeasonalityAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(SeasonalityAnalyzer.class);

  public static final int DEFAULT_PERIOD = 7;
  public static final int MIN_CALENDAR_POINTS = 30;
  static final double HARMONIC_THRESHOLD = 0.1;
  static final int MAX_HARMONIC = 5;
  static final double CALENDAR_THRESHOLD = 0.1;

  private final AnalysisArgs args;

  public SeasonalityAnalyzer() {
    this(new AnalysisArgs());
  }

  public SeasonalityAnalyzer(AnalysisArgs args) {
    this.args = args.validate().copy();
  }

  /**
   * The first autocorrelation peak in lag order, or 0 when the series has none. Lags 1 up to
   * min(n / 2, 20) are searched.
   */
  public int detectPeriod(double[] values) {
    double[] acf = TimeSeriesUtils.autocorrelations(TimeSeriesUtils.center(values));
    List<AutocorrelationPeak> peaks = TimeSeriesUtils.peaksByLag(acf);
    return peaks.isEmpty() ? 0 : peaks.get(0).getLag();
  }

  public SeasonalityResult analyze(MetricSeries series) {
    return analyze(series.values());
  }

  public SeasonalityResult analyze(MetricSeries series, int period) {
    return analyze(series.values(), period);
  }

  /** Analyzes values at the detected period, or {@link #DEFAULT_PERIOD} when none is found. */
  public SeasonalityResult analyze(double[] values) {
    int detected = detectPeriod(values);
    if (detected == 0) {
      log.debug("No autocorrelation peak in {} points, using period {}", values.length,
          DEFAULT_PERIOD);
      return analyze(values, DEFAULT_PERIOD, false);
    }
    return analyze(values, detected, true);
  }

  public SeasonalityResult analyze(double[] values, int period) {
    return analyze(values, period, false);
  }

  private SeasonalityResult analyze(double[] values, int period, boolean periodDetected) {
    Preconditions.checkArgument(period >= 2, "Period must be >= 2: %s", period);
    if (values.length < 2 * period) {
      return SeasonalityResult.insufficientData(period, periodDetected,
          String.format("decomposition at period %d needs %d points, got %d",
              period, 2 * period, values.length));
    }

    SeasonalDecomposition decomposition = SeasonalDecomposition.of(values, period);
    double[] seasonal = decomposition.getSeasonal();

    double[] centered = TimeSeriesUtils.center(values);
    double[] acf = TimeSeriesUtils.autocorrelations(centered);
    double base = TimeSeriesUtils.autocorrelation(centered, period);

    int peak = ArrayHelper.argMax(seasonal);
    return new SeasonalityResult(AnalysisStatus.OK, period, periodDetected, decomposition,
        seasonalStrength(seasonal), base, StatisticsKernel.populationStandardDeviation(seasonal),
        (double) peak / period * 2 * Math.PI, harmonics(acf, period, base));
  }

  /** var / (mean^2 + var) of the seasonal profile; 0 when both are 0. */
  static double seasonalStrength(double[] seasonal) {
    double variance = StatisticsKernel.populationVariance(seasonal);
    double mean = StatisticsKernel.mean(seasonal);
    double denominator = mean * mean + variance;
    return denominator > 0 ? variance / denominator : 0;
  }

  /** Multiples 2 to 5 of period inside the searched lags with autocorrelation above 0.1. */
  public static ImmutableList<Harmonic> harmonics(double[] acf, int period, double base) {
    ImmutableList.Builder<Harmonic> harmonics = ImmutableList.builder();
    for (int multiple = 2; multiple <= MAX_HARMONIC; multiple++) {
      int lag = period * multiple;
      if (lag >= acf.length) {
        break;
      }
      if (acf[lag] > HARMONIC_THRESHOLD) {
        harmonics.add(new Harmonic(multiple, lag, acf[lag], base > 0 ? acf[lag] / base : 0));
      }
    }
    return harmonics.build();
  }

  /**
   * Groups the values by calendar bucket in the configured zone and measures how much the group
   * means vary. Needs at least 30 points, and at least two groups per bucketing.
   */
  public CalendarAnalysis calendarPatterns(MetricSeries series) {
    ImmutableMap.Builder<CalendarPeriod, CalendarPattern> patterns = ImmutableMap.builder();
    if (series.size() < MIN_CALENDAR_POINTS) {
      return new CalendarAnalysis(AnalysisStatus.insufficientData(String.format(
          "calendar patterns need %d points, got %d", MIN_CALENDAR_POINTS, series.size())),
          patterns.build());
    }
    ZoneId zone = args.zoneId();
    for (CalendarPeriod period : CalendarPeriod.values()) {
      patterns.put(period, calendarPattern(series, period, zone));
    }
    return new CalendarAnalysis(AnalysisStatus.OK, patterns.build());
  }

  private static CalendarPattern calendarPattern(MetricSeries series, CalendarPeriod period,
      ZoneId zone) {
    SortedMap<Integer, DoubleArrayList> groups = new TreeMap<>();
    for (int i = 0; i < series.size(); i++) {
      int bucket = period.bucket(ZonedDateTime.ofInstant(series.timestampAt(i), zone));
      DoubleArrayList group = groups.get(bucket);
      if (group == null) {
        group = new DoubleArrayList();
        groups.put(bucket, group);
      }
      group.add(series.valueAt(i));
    }

    double[] means = new double[groups.size()];
    int k = 0;
    for (Map.Entry<Integer, DoubleArrayList> group : groups.entrySet()) {
      means[k++] = StatisticsKernel.mean(group.getValue().toDoubleArray());
    }
    if (means.length < 2) {
      return new CalendarPattern(period,
          AnalysisStatus.insufficientData(period + " bucketing has a single group"), false, 0, 0,
          PatternShape.INSUFFICIENT_DATA, means);
    }
    double coefficient = StatisticsKernel.coefficientOfVariation(means);
    return new CalendarPattern(period, AnalysisStatus.OK, coefficient > CALENDAR_THRESHOLD,
        coefficient, StatisticsKernel.populationStandardDeviation(means), PatternShape.of(means),
        means);
  }
}
