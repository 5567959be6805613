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
package net.larse.tsa.anomaly;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.seasonal.SeasonalDecomposition;
import net.larse.tsa.seasonal.SeasonalityAnalyzer;
import net.larse.tsa.seasonal.SeasonalityResult;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flags outliers with four independent methods.
 *
 * <ul>
 *   <li>Z-score: |v - mean| / sd above 2 / sensitivity, population moments.
 *   <li>IQR: values outside [Q1 - k IQR, Q3 + k IQR].
 *   <li>Isolation: mean over max absolute distance to the other values above a threshold.
 *   <li>Seasonal: decomposition residual over the residual sd above 2 / sensitivity. Only runs
 *       on 14 points or more with a detected period.
 * </ul>
 *
 * <p>In batch mode every point is compared with the whole series. In streaming mode only the newest
 * point is compared with the window of points before it, and the seasonal method does not take
 * part.
 *
 * <p>Consensus anomalies are scored from the mean method score, the deviation from the 5 points on
 * either side, the deviation from the whole series and the local time of day and week.
 */
public final class AnomalyDetector {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  static final int MIN_SEASONAL_POINTS = 14;
  static final int CONTEXT_WINDOW = 5;

  private final AnalysisArgs args;
  private final SeasonalityAnalyzer seasonalityAnalyzer;

  public AnomalyDetector() {
    this(new AnalysisArgs());
  }

  public AnomalyDetector(AnalysisArgs args) {
    this.args = args.validate().copy();
    this.seasonalityAnalyzer = new SeasonalityAnalyzer(this.args);
  }

  /** The z-score above which a point is flagged. */
  public double zScoreThreshold() {
    return 2 / args.sensitivity;
  }

  public ImmutableList<AnomalyRecord> detectZScore(MetricSeries series) {
    return zScore(series, series.values(), 0, series.size());
  }

  public ImmutableList<AnomalyRecord> detectIqr(MetricSeries series) {
    return iqr(series, series.values(), 0, series.size());
  }

  public ImmutableList<AnomalyRecord> detectIsolation(MetricSeries series) {
    ImmutableList.Builder<AnomalyRecord> records = ImmutableList.builder();
    double[] values = series.values();
    double mean = StatisticsKernel.mean(values);
    for (int i = 0; i < values.length; i++) {
      double score = isolationScore(values[i], values, i);
      if (score > args.isolationThreshold) {
        records.add(isolationRecord(series, i, score, mean));
      }
    }
    return records.build();
  }

  /**
   * Flags points whose residual from trend plus seasonal profile is unusually large. Empty when
   * the series is shorter than 14 points or has no autocorrelation peak.
   */
  public ImmutableList<AnomalyRecord> detectSeasonal(MetricSeries series) {
    ImmutableList.Builder<AnomalyRecord> records = ImmutableList.builder();
    double[] values = series.values();
    if (values.length < MIN_SEASONAL_POINTS) {
      return records.build();
    }
    SeasonalityResult seasonality = seasonalityAnalyzer.analyze(values);
    if (!seasonality.isPeriodDetected() || !seasonality.getStatus().isOk()) {
      log.debug("{}: no seasonal period, skipping seasonal anomalies", series.getMetricId());
      return records.build();
    }
    SeasonalDecomposition decomposition = seasonality.getDecomposition();
    double[] residual = decomposition.getResidual();
    double sd = StatisticsKernel.populationStandardDeviation(residual);
    if (sd == 0) {
      return records.build();
    }
    double threshold = zScoreThreshold();
    for (int i = 0; i < values.length; i++) {
      double score = Math.abs(residual[i]) / sd;
      if (score > threshold) {
        records.add(new AnomalyRecord(i, series.timestampAt(i), values[i],
            AnomalyMethod.SEASONAL, score, Severity.of(score, 2, 2.5, 3),
            residual[i] > 0 ? AnomalyDirection.HIGH : AnomalyDirection.LOW));
      }
    }
    return records.build();
  }

  /** Runs all four methods over the whole series and combines them. */
  public AnomalyReport detect(MetricSeries series) {
    ImmutableList<AnomalyRecord> zScore = detectZScore(series);
    ImmutableList<AnomalyRecord> iqr = detectIqr(series);
    ImmutableList<AnomalyRecord> isolation = detectIsolation(series);
    ImmutableList<AnomalyRecord> seasonal = detectSeasonal(series);
    log.debug("{}: {} z-score, {} IQR, {} isolation, {} seasonal anomalies",
        series.getMetricId(), zScore.size(), iqr.size(), isolation.size(), seasonal.size());
    return new AnomalyReport(series.getMetricId(), zScore, iqr, isolation, seasonal,
        consensus(series, ImmutableList.of(zScore, iqr, isolation, seasonal)));
  }

  /**
   * Checks the newest point against the anomalyWindow points before it. With fewer points of
   * history the verdict is insufficient data, never a flag.
   */
  public StreamingVerdict evaluateLatest(MetricSeries series) {
    int window = args.anomalyWindow;
    int n = series.size();
    if (n - 1 < window) {
      log.debug("{}: streaming check needs {} points of history, has {}", series.getMetricId(),
          window, Math.max(n - 1, 0));
      return StreamingVerdict.insufficientData(String.format(
          "streaming check needs %d points of history, got %d", window, Math.max(n - 1, 0)));
    }
    double[] reference = ArrayHelper.slice(series.values(), n - 1 - window, n - 1);
    int latest = n - 1;

    ImmutableList.Builder<AnomalyRecord> records = ImmutableList.builder();
    records.addAll(zScore(series, reference, latest, n));
    records.addAll(iqr(series, reference, latest, n));
    double score = isolationScore(series.valueAt(latest), reference, -1);
    if (score > args.isolationThreshold) {
      records.add(isolationRecord(series, latest, score, StatisticsKernel.mean(reference)));
    }
    return new StreamingVerdict(AnalysisStatus.OK, records.build());
  }

  // Flags points [from, to) of series against the moments of reference.
  private ImmutableList<AnomalyRecord> zScore(MetricSeries series, double[] reference, int from,
      int to) {
    ImmutableList.Builder<AnomalyRecord> records = ImmutableList.builder();
    double mean = StatisticsKernel.mean(reference);
    double sd = StatisticsKernel.populationStandardDeviation(reference);
    if (sd == 0) {
      return records.build();
    }
    double threshold = zScoreThreshold();
    for (int i = from; i < to; i++) {
      double value = series.valueAt(i);
      double z = Math.abs(value - mean) / sd;
      if (z > threshold) {
        records.add(new AnomalyRecord(i, series.timestampAt(i), value, AnomalyMethod.ZSCORE, z,
            Severity.of(z, 2, 2.5, 3), direction(value, mean)));
      }
    }
    return records.build();
  }

  // Flags points [from, to) of series outside the fences of reference.
  private ImmutableList<AnomalyRecord> iqr(MetricSeries series, double[] reference, int from,
      int to) {
    ImmutableList.Builder<AnomalyRecord> records = ImmutableList.builder();
    if (reference.length == 0) {
      return records.build();
    }
    double q1 = StatisticsKernel.percentile(reference, 25);
    double q3 = StatisticsKernel.percentile(reference, 75);
    double range = q3 - q1;
    double lower = q1 - args.iqrMultiplier * range;
    double upper = q3 + args.iqrMultiplier * range;
    double mean = StatisticsKernel.mean(reference);
    for (int i = from; i < to; i++) {
      double value = series.valueAt(i);
      if (value < lower || value > upper) {
        double excess = value < lower ? lower - value : value - upper;
        double score = range > 0 ? excess / range : 0;
        records.add(new AnomalyRecord(i, series.timestampAt(i), value, AnomalyMethod.IQR, score,
            Severity.of(score, 0.5, 1.5, 3), direction(value, mean)));
      }
    }
    return records.build();
  }

  /**
   * Mean absolute distance from value to the others divided by the largest such distance. The
   * element at skip is excluded from the others (pass -1 to use all of them).
   */
  static double isolationScore(double value, double[] others, int skip) {
    double sum = 0;
    double max = 0;
    int count = 0;
    for (int j = 0; j < others.length; j++) {
      if (j == skip) {
        continue;
      }
      double distance = Math.abs(value - others[j]);
      sum += distance;
      max = Math.max(max, distance);
      count++;
    }
    if (count == 0 || max == 0) {
      return 0;
    }
    return sum / count / max;
  }

  private static AnomalyRecord isolationRecord(MetricSeries series, int index, double score,
      double mean) {
    double value = series.valueAt(index);
    return new AnomalyRecord(index, series.timestampAt(index), value, AnomalyMethod.ISOLATION,
        score, Severity.of(score, 0.6, 0.75, 0.9), direction(value, mean));
  }

  private static AnomalyDirection direction(double value, double mean) {
    return value > mean ? AnomalyDirection.HIGH : AnomalyDirection.LOW;
  }

  /** min(z / 3, 1) of values[index] within the 5 points on either side of it. */
  static double contextScore(double[] values, int index) {
    int from = Math.max(0, index - CONTEXT_WINDOW);
    int to = Math.min(values.length, index + CONTEXT_WINDOW + 1);
    double[] context = ArrayHelper.slice(values, from, to);
    double sd = StatisticsKernel.populationStandardDeviation(context);
    if (sd == 0) {
      return 0;
    }
    return Math.min(Math.abs(values[index] - StatisticsKernel.mean(context)) / sd / 3, 1);
  }

  /** min(z / 5, 1) of values[index] within the whole series. */
  static double magnitudeScore(double[] values, int index) {
    double sd = StatisticsKernel.populationStandardDeviation(values);
    if (sd == 0) {
      return 0;
    }
    return Math.min(Math.abs(values[index] - StatisticsKernel.mean(values)) / sd / 5, 1);
  }

  /** 0.3 between 02:00 and 06:59 local time, plus 0.2 on weekends. */
  static double temporalScore(Instant timestamp, ZoneId zone) {
    ZonedDateTime local = timestamp.atZone(zone);
    double score = 0;
    if (local.getHour() >= 2 && local.getHour() <= 6) {
      score += 0.3;
    }
    DayOfWeek day = local.getDayOfWeek();
    if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
      score += 0.2;
    }
    return score;
  }

  private ImmutableList<ConsensusAnomaly> consensus(MetricSeries series,
      List<ImmutableList<AnomalyRecord>> byMethod) {
    Map<Integer, Set<AnomalyMethod>> methods = new TreeMap<>();
    Map<Integer, Double> scores = new TreeMap<>();
    Map<Integer, Severity> severities = new TreeMap<>();
    for (ImmutableList<AnomalyRecord> records : byMethod) {
      for (AnomalyRecord record : records) {
        Integer index = record.getIndex();
        Set<AnomalyMethod> flagged = methods.get(index);
        if (flagged == null) {
          flagged = EnumSet.noneOf(AnomalyMethod.class);
          methods.put(index, flagged);
          scores.put(index, 0.0);
          severities.put(index, Severity.LOW);
        }
        flagged.add(record.getMethod());
        scores.put(index, scores.get(index) + record.getScore());
        if (record.getSeverity().compareTo(severities.get(index)) > 0) {
          severities.put(index, record.getSeverity());
        }
      }
    }

    double[] values = series.values();
    ZoneId zone = args.zoneId();
    ImmutableList.Builder<ConsensusAnomaly> consensus = ImmutableList.builder();
    for (Map.Entry<Integer, Set<AnomalyMethod>> entry : methods.entrySet()) {
      int index = entry.getKey();
      Set<AnomalyMethod> flagged = entry.getValue();
      if (flagged.size() >= args.minAgreement) {
        Instant timestamp = series.timestampAt(index);
        consensus.add(new ConsensusAnomaly(index, timestamp, values[index],
            ImmutableSet.copyOf(flagged), scores.get(index) / flagged.size(),
            severities.get(index), contextScore(values, index), magnitudeScore(values, index),
            temporalScore(timestamp, zone)));
      }
    }
    return consensus.build();
  }
}
