package net.larse.tsa.correlation;

import com.google.common.collect.ImmutableList;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.InvalidSeriesException;
import net.larse.tsa.timeseries.MetricSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class CorrelationEngineTest {
  private static final Instant START = Instant.parse("2024-02-01T00:00:00Z");
  private static final int N = 40;

  private CorrelationEngine engine;
  private MetricSeries a;
  private MetricSeries b;
  private MetricSeries d;

  private static MetricSeries series(String id, double[] values) {
    return MetricSeries.indexed(id, START, Duration.ofHours(1), values);
  }

  @Before
  public void setUp() {
    engine = new CorrelationEngine();
    double[] x = new double[N];
    double[] y = new double[N];
    double[] z = new double[N];
    for (int i = 0; i < N; i++) {
      x[i] = i;
      y[i] = 3 * i + 2;
      // symmetric around the middle of x, so uncorrelated with it
      z[i] = (i - 19.5) * (i - 19.5);
    }
    a = series("a", x);
    b = series("b", y);
    d = series("d", z);
  }

  @Test
  public void testSelfAndNegation() {
    double[] values = {3, 1, 4, 1, 5, 9, 2, 6, 5, 3};
    double[] negated = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      negated[i] = -values[i];
    }
    MetricSeries s = series("s", values);
    assertEquals(1, engine.pearson(s, series("copy", values)).getCorrelation(), 1e-9);
    CorrelationResult negative = engine.pearson(s, series("neg", negated));
    assertEquals(-1, negative.getCorrelation(), 1e-9);
    assertEquals(CorrelationDirection.NEGATIVE, negative.getDirection());
    assertEquals(1, negative.getStrength(), 1e-9);
  }

  @Test
  public void testRankCorrelations() {
    MetricSeries up = series("up", new double[] {1, 2, 3, 4, 5});
    MetricSeries down = series("down", new double[] {5, 4, 3, 2, 1});
    assertEquals(-1, engine.spearman(up, down).getCorrelation(), 1e-9);
    assertEquals(-1, engine.kendall(up, down).getCorrelation(), 1e-9);
  }

  @Test
  public void testReport() {
    CorrelationReport report = engine.analyze(ImmutableList.of(a, b, d));
    assertTrue(report.getStatus().isOk());
    assertEquals(3, report.get(CorrelationMethod.PEARSON).size());

    CorrelationResult ab = report.find(CorrelationMethod.PEARSON, "a", "b");
    assertEquals(1, ab.getCorrelation(), 1e-9);
    assertEquals(Significance.HIGHLY_SIGNIFICANT, ab.getSignificance());
    assertEquals(N, ab.getSampleSize());

    CorrelationResult ad = report.find(CorrelationMethod.PEARSON, "a", "d");
    assertEquals(0, ad.getCorrelation(), 1e-9);
    assertEquals(Significance.NOT_SIGNIFICANT, ad.getSignificance());

    CorrelationResult partial = report.find(CorrelationMethod.PARTIAL, "a", "b");
    assertEquals(0.9, partial.getCorrelation(), 1e-9);
    assertEquals(ImmutableList.of("d"), partial.getControlledFor());

    assertTrue(report.getStrong().contains(ab));
    assertTrue(report.getWeak().contains(ad));
  }

  @Test
  public void testPartialWithManyControlsKeepsSign() {
    ImmutableList.Builder<MetricSeries> all = ImmutableList.builder();
    all.add(a, b);
    for (int m = 0; m < 11; m++) {
      double[] values = new double[N];
      for (int i = 0; i < N; i++) {
        values[i] = (m + 2) * i + (i % 3);
      }
      all.add(series("m" + m, values));
    }
    CorrelationResult partial = engine.partial(a, b, all.build());
    assertEquals(11, partial.getControlledFor().size());
    assertEquals(0, partial.getCorrelation(), 0);
    assertEquals(CorrelationDirection.POSITIVE, partial.getDirection());
  }

  @Test
  public void testPartialNeedsThreeMetrics() {
    CorrelationReport report = engine.analyze(ImmutableList.of(a, b));
    assertTrue(report.get(CorrelationMethod.PARTIAL).isEmpty());
    assertEquals(1, report.get(CorrelationMethod.KENDALL).size());
  }

  @Test
  public void testClustersOfCorrelatedMetrics() {
    CorrelationReport report = engine.analyze(ImmutableList.of(a, d, b));
    assertEquals(1, report.getClusters().size());
    CorrelationCluster cluster = report.getClusters().get(0);
    assertEquals(ImmutableList.of("a", "b"), cluster.getMetrics());
    assertEquals(1, cluster.getScore(), 1e-9);
  }

  @Test
  public void testLaggedRecoversShift() {
    double[] leading = new double[N];
    double[] following = new double[N];
    for (int i = 0; i < N; i++) {
      leading[i] = ((41 * i) % 101) / 101.0;
    }
    for (int i = 0; i < N; i++) {
      following[i] = i >= 3 ? leading[i - 3] : 0.5;
    }
    LaggedCorrelation lagged =
        engine.lagged(series("leading", leading), series("following", following));
    assertEquals(engine.maxLag(N) + 1, lagged.getLags().size());
    assertEquals(3, lagged.getBest().getLag());
    assertEquals(1, lagged.getBest().getValue(), 1e-9);
  }

  @Test
  public void testRollingWindow() {
    RollingCorrelation rolling = engine.rolling(a, b);
    assertEquals(20, rolling.getWindow());
    assertEquals(N - 20 + 1, rolling.getCorrelations().length);
    assertEquals(1, rolling.getMean(), 1e-9);
    assertEquals(0, rolling.getVolatility(), 1e-9);

    AnalysisArgs args = new AnalysisArgs();
    args.windowSize = 5;
    assertEquals(N - 5 + 1, new CorrelationEngine(args).rolling(a, b).getCorrelations().length);
  }

  @Test
  public void testCrossCorrelationLags() {
    CrossCorrelation cross = engine.cross(a, b);
    assertEquals(N + 1, cross.getValues().size());
    assertEquals(-N / 2, cross.getValues().get(0).getLag());
  }

  @Test(expected = InvalidSeriesException.class)
  public void testSingleSeriesIsRejected() {
    engine.analyze(ImmutableList.of(a));
  }

  @Test(expected = InvalidSeriesException.class)
  public void testMisalignedSeriesAreRejected() {
    engine.analyze(ImmutableList.of(a, series("short", new double[] {1, 2, 3})));
  }

  @Test(expected = InvalidSeriesException.class)
  public void testDuplicateIdsAreRejected() {
    engine.analyze(ImmutableList.of(a, series("a", new double[N])));
  }

  @Test
  public void testTooShortForCorrelation() {
    CorrelationReport report = engine.analyze(ImmutableList.of(
        series("x", new double[] {1}), series("y", new double[] {2})));
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, report.getStatus().getCode());
  }

  @Test
  public void testSignificanceBuckets() {
    assertEquals(1, Significance.pValue(0.9, 2), 0);
    assertEquals(0, Significance.pValue(1, 10), 0);
    assertEquals(Significance.HIGHLY_SIGNIFICANT, Significance.of(0.0005));
    assertEquals(Significance.VERY_SIGNIFICANT, Significance.of(0.005));
    assertEquals(Significance.SIGNIFICANT, Significance.of(0.03));
    assertEquals(Significance.MARGINALLY_SIGNIFICANT, Significance.of(0.07));
    assertEquals(Significance.NOT_SIGNIFICANT, Significance.of(0.5));
    assertFalse(Significance.NOT_SIGNIFICANT.isSignificant());
    assertEquals(CorrelationDirection.POSITIVE, CorrelationDirection.of(0));
  }
}
