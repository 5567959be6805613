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
package net.larse.tsa.correlation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.StatisticsKernel;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.InvalidSeriesException;
import net.larse.tsa.timeseries.MetricSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Correlates aligned metric series pairwise with several methods and groups strongly correlated
 * metrics.
 *
 * <p>The symmetric methods (Pearson, Spearman, Kendall, partial, rolling) run once per unordered
 * pair. Lagged and cross correlations run for every ordered pair, with B lagging A.
 */
public final class CorrelationEngine {
  private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

  static final double CLUSTER_THRESHOLD = 0.6;
  static final double PARTIAL_CONTROL_FACTOR = 0.1;

  private final AnalysisArgs args;

  public CorrelationEngine() {
    this(new AnalysisArgs());
  }

  public CorrelationEngine(AnalysisArgs args) {
    this.args = args.validate().copy();
  }

  /**
   * Runs every method over every pair.
   *
   * @throws InvalidSeriesException unless there are at least two series of equal length with
   *     distinct ids
   */
  public CorrelationReport analyze(List<MetricSeries> series) {
    validate(series);
    int n = series.get(0).size();
    if (n < 2) {
      return CorrelationReport.insufficientData("correlation needs at least 2 aligned points");
    }

    ImmutableListMultimap.Builder<CorrelationMethod, CorrelationResult> results =
        ImmutableListMultimap.builder();
    ImmutableList.Builder<RollingCorrelation> rolling = ImmutableList.builder();
    for (int i = 0; i < series.size(); i++) {
      for (int j = i + 1; j < series.size(); j++) {
        MetricSeries a = series.get(i);
        MetricSeries b = series.get(j);
        results.put(CorrelationMethod.PEARSON, pearson(a, b));
        results.put(CorrelationMethod.SPEARMAN, spearman(a, b));
        results.put(CorrelationMethod.KENDALL, kendall(a, b));
        if (series.size() >= 3) {
          results.put(CorrelationMethod.PARTIAL, partial(a, b, series));
        }
        RollingCorrelation pairRolling = rolling(a, b);
        if (pairRolling != null) {
          rolling.add(pairRolling);
          results.put(CorrelationMethod.ROLLING, new CorrelationResult(a.getMetricId(),
              b.getMetricId(), CorrelationMethod.ROLLING, pairRolling.getMean(), n,
              ImmutableList.<String>of(), 0, pairRolling.getWindow()));
        }
      }
    }

    ImmutableList.Builder<LaggedCorrelation> lagged = ImmutableList.builder();
    ImmutableList.Builder<CrossCorrelation> cross = ImmutableList.builder();
    for (MetricSeries a : series) {
      for (MetricSeries b : series) {
        if (a == b) {
          continue;
        }
        LaggedCorrelation pairLagged = lagged(a, b);
        if (pairLagged != null) {
          lagged.add(pairLagged);
          LagValue best = pairLagged.getBest();
          results.put(CorrelationMethod.LAGGED, new CorrelationResult(a.getMetricId(),
              b.getMetricId(), CorrelationMethod.LAGGED, best.getValue(), n - best.getLag(),
              ImmutableList.<String>of(), best.getLag(), 0));
        }
        CrossCorrelation pairCross = cross(a, b);
        int peakLag = pairCross.getPeak().getLag();
        cross.add(pairCross);
        double[][] overlap = overlap(a.values(), b.values(), peakLag);
        results.put(CorrelationMethod.CROSS, new CorrelationResult(a.getMetricId(),
            b.getMetricId(), CorrelationMethod.CROSS,
            StatisticsKernel.pearson(overlap[0], overlap[1]), overlap[0].length,
            ImmutableList.<String>of(), peakLag, 0));
      }
    }

    ImmutableListMultimap<CorrelationMethod, CorrelationResult> built = results.build();
    ImmutableList<CorrelationCluster> clusters =
        clusters(series, built.get(CorrelationMethod.PEARSON));
    log.debug("Correlated {} metrics over {} points, {} cluster(s)", series.size(), n,
        clusters.size());
    return new CorrelationReport(AnalysisStatus.OK, built, lagged.build(), rolling.build(),
        cross.build(), clusters);
  }

  public CorrelationResult pearson(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    return CorrelationResult.of(a.getMetricId(), b.getMetricId(), CorrelationMethod.PEARSON,
        StatisticsKernel.pearson(a.values(), b.values()), a.size());
  }

  public CorrelationResult spearman(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    return CorrelationResult.of(a.getMetricId(), b.getMetricId(), CorrelationMethod.SPEARMAN,
        StatisticsKernel.spearman(a.values(), b.values()), a.size());
  }

  public CorrelationResult kendall(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    return CorrelationResult.of(a.getMetricId(), b.getMetricId(), CorrelationMethod.KENDALL,
        StatisticsKernel.kendall(a.values(), b.values()), a.size());
  }

  /**
   * Pearson correlation of a and b scaled by max(0, 1 - 0.1 k), where k is the number of other
   * metrics in all. This approximates the effect of controlling for them; it is not a
   * regression-residual partial correlation. The scale never flips the sign of r.
   */
  public CorrelationResult partial(MetricSeries a, MetricSeries b, List<MetricSeries> all) {
    checkAligned(a, b);
    ImmutableList.Builder<String> controls = ImmutableList.builder();
    int k = 0;
    for (MetricSeries other : all) {
      if (!other.getMetricId().equals(a.getMetricId())
          && !other.getMetricId().equals(b.getMetricId())) {
        controls.add(other.getMetricId());
        k++;
      }
    }
    double r = StatisticsKernel.pearson(a.values(), b.values());
    double scale = Math.max(0, 1 - PARTIAL_CONTROL_FACTOR * k);
    double partial = ArrayHelper.clamp(r * scale, -1, 1);
    return new CorrelationResult(a.getMetricId(), b.getMetricId(), CorrelationMethod.PARTIAL,
        partial, a.size(), controls.build(), 0, 0);
  }

  /** The largest lag used for a pair of n points. */
  public int maxLag(int n) {
    return args.maxLag > 0 ? args.maxLag : Math.min(10, n / 3);
  }

  /** Lagged correlations of a against b; null when n does not exceed the largest lag. */
  public LaggedCorrelation lagged(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    int n = a.size();
    int maxLag = maxLag(n);
    if (n <= maxLag) {
      return null;
    }
    double[] x = a.values();
    double[] y = b.values();
    ImmutableList.Builder<LagValue> lags = ImmutableList.builder();
    LagValue best = null;
    for (int lag = 0; lag <= maxLag; lag++) {
      if (n - lag < 2) {
        break;
      }
      double r = StatisticsKernel.pearson(ArrayHelper.slice(x, 0, n - lag),
          ArrayHelper.slice(y, lag, n));
      LagValue value = new LagValue(lag, r);
      lags.add(value);
      if (best == null || Math.abs(r) > Math.abs(best.getValue())) {
        best = value;
      }
    }
    return new LaggedCorrelation(a.getMetricId(), b.getMetricId(), lags.build(), best);
  }

  /** The rolling window used for a pair of n points. */
  public int rollingWindow(int n) {
    return args.windowSize > 0 ? args.windowSize : Math.min(20, n / 2);
  }

  /**
   * Pearson correlation of every full window [s, s + window); null when n does not exceed the
   * window or the window is shorter than 2.
   */
  public RollingCorrelation rolling(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    int n = a.size();
    int window = rollingWindow(n);
    if (window < 2 || n <= window) {
      return null;
    }
    double[] x = a.values();
    double[] y = b.values();
    double[] correlations = new double[n - window + 1];
    for (int s = 0; s < correlations.length; s++) {
      correlations[s] = StatisticsKernel.pearson(ArrayHelper.slice(x, s, s + window),
          ArrayHelper.slice(y, s, s + window));
    }
    return new RollingCorrelation(a.getMetricId(), b.getMetricId(), window, correlations,
        StatisticsKernel.mean(correlations),
        StatisticsKernel.populationStandardDeviation(correlations));
  }

  /** Mean products of a[i] and b[i + lag] for lags -n/2 to n/2. */
  public CrossCorrelation cross(MetricSeries a, MetricSeries b) {
    checkAligned(a, b);
    double[] x = a.values();
    double[] y = b.values();
    int n = x.length;
    ImmutableList.Builder<LagValue> values = ImmutableList.builder();
    LagValue peak = null;
    for (int lag = -(n / 2); lag <= n / 2; lag++) {
      double sum = 0;
      int count = 0;
      for (int i = 0; i < n; i++) {
        int j = i + lag;
        if (j >= 0 && j < n) {
          sum += x[i] * y[j];
          count++;
        }
      }
      if (count > 0) {
        LagValue value = new LagValue(lag, sum / count);
        values.add(value);
        if (peak == null || Math.abs(value.getValue()) > Math.abs(peak.getValue())) {
          peak = value;
        }
      }
    }
    return new CrossCorrelation(a.getMetricId(), b.getMetricId(), values.build(), peak);
  }

  // The pairs (x[i], y[i + lag]) that exist.
  private static double[][] overlap(double[] x, double[] y, int lag) {
    int from = Math.max(0, -lag);
    int to = Math.min(x.length, y.length - lag);
    int length = Math.max(0, to - from);
    double[][] pairs = new double[2][length];
    for (int k = 0; k < length; k++) {
      pairs[0][k] = x[from + k];
      pairs[1][k] = y[from + k + lag];
    }
    return pairs;
  }

  /**
   * Connected components of the graph linking metrics whose Pearson strength exceeds 0.6.
   * Singletons are dropped. Components are listed in order of their first metric.
   */
  public ImmutableList<CorrelationCluster> clusters(List<MetricSeries> series,
      List<CorrelationResult> pearson) {
    int m = series.size();
    double[][] strength = new double[m][m];
    for (CorrelationResult result : pearson) {
      int i = indexOf(series, result.getMetricA());
      int j = indexOf(series, result.getMetricB());
      if (i >= 0 && j >= 0) {
        strength[i][j] = result.getStrength();
        strength[j][i] = result.getStrength();
      }
    }

    ImmutableList.Builder<CorrelationCluster> clusters = ImmutableList.builder();
    boolean[] visited = new boolean[m];
    for (int start = 0; start < m; start++) {
      if (visited[start]) {
        continue;
      }
      IntArrayList component = new IntArrayList();
      IntArrayList queue = new IntArrayList();
      queue.add(start);
      visited[start] = true;
      while (!queue.isEmpty()) {
        int node = queue.removeInt(0);
        component.add(node);
        for (int other = 0; other < m; other++) {
          if (!visited[other] && strength[node][other] > CLUSTER_THRESHOLD) {
            visited[other] = true;
            queue.add(other);
          }
        }
      }
      if (component.size() < 2) {
        continue;
      }
      int[] members = component.toIntArray();
      Arrays.sort(members);
      ImmutableList.Builder<String> ids = ImmutableList.builder();
      double sum = 0;
      int pairs = 0;
      for (int p = 0; p < members.length; p++) {
        ids.add(series.get(members[p]).getMetricId());
        for (int q = p + 1; q < members.length; q++) {
          sum += strength[members[p]][members[q]];
          pairs++;
        }
      }
      clusters.add(new CorrelationCluster(ids.build(), pairs == 0 ? 0 : sum / pairs));
    }
    return clusters.build();
  }

  private static int indexOf(List<MetricSeries> series, String metricId) {
    for (int i = 0; i < series.size(); i++) {
      if (series.get(i).getMetricId().equals(metricId)) {
        return i;
      }
    }
    return -1;
  }

  private static void validate(List<MetricSeries> series) {
    if (series == null || series.size() < 2) {
      throw new InvalidSeriesException("Correlation needs at least 2 series");
    }
    Set<String> ids = new HashSet<>();
    int n = series.get(0).size();
    for (MetricSeries s : series) {
      if (!ids.add(s.getMetricId())) {
        throw new InvalidSeriesException("Duplicate metric id %s", s.getMetricId());
      }
      if (s.size() != n) {
        throw new InvalidSeriesException("Series %s has %d points, expected %d",
            s.getMetricId(), s.size(), n);
      }
    }
  }

  private static void checkAligned(MetricSeries a, MetricSeries b) {
    if (a.size() != b.size()) {
      throw new InvalidSeriesException("Series %s and %s are not aligned: %d != %d",
          a.getMetricId(), b.getMetricId(), a.size(), b.size());
    }
  }
}
