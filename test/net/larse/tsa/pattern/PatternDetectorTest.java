package net.larse.tsa.pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;
import net.larse.tsa.trend.TrendDirection;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class PatternDetectorTest {
  private PatternDetector detector;

  @Before
  public void setUp() {
    detector = new PatternDetector();
  }

  private static double[] alternating(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = i % 2 == 0 ? 1 : 100;
    }
    return values;
  }

  private static double[] levelShift() {
    double[] values = new double[40];
    for (int i = 0; i < values.length; i++) {
      values[i] = i < 20 ? 100 : 200;
    }
    return values;
  }

  @Test
  public void testCyclical() {
    CyclicalPattern pattern = detector.cyclical(alternating(20));
    assertTrue(pattern.isDetected());
    assertEquals(2, pattern.getPrimaryPeriod());
    assertTrue(pattern.getPrimaryStrength() > 0.5);
    assertTrue(pattern.getSecondaryPeriods().contains(4));
    assertTrue(pattern.getConfidence() > 0 && pattern.getConfidence() <= 1);
  }

  @Test
  public void testTooShortSearches() {
    double[] values = {1, 2, 3, 4};
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA,
        detector.cyclical(values).getStatus().getCode());
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA,
        detector.trend(values).getStatus().getCode());
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA,
        detector.volatility(values).getStatus().getCode());
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA,
        detector.regime(values).getStatus().getCode());
    ClusteringPattern clustering = detector.clustering(values);
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, clustering.getStatus().getCode());
    assertFalse(clustering.isDetected());
  }

  @Test
  public void testTrendOfLine() {
    double[] values = new double[12];
    for (int i = 0; i < values.length; i++) {
      values[i] = 3 * i + 1;
    }
    TrendPattern pattern = detector.trend(values);
    assertTrue(pattern.isDetected());
    assertEquals(1, pattern.getConfidence(), 1e-9);
    assertEquals(TrendDirection.INCREASING, pattern.getDirection());
    assertFalse(pattern.getCandidates().isEmpty());
  }

  @Test
  public void testNoTrendInAlternation() {
    TrendPattern pattern = detector.trend(alternating(20));
    assertFalse(pattern.isDetected());
    assertEquals("weak_trend", pattern.getReason());
  }

  @Test
  public void testRegimeLevelShift() {
    RegimePattern pattern = detector.regime(levelShift());
    assertTrue(pattern.isDetected());
    assertEquals(ImmutableList.of(10), pattern.getChangePoints());
    assertEquals(2, pattern.getRegimeCount());

    RegimeSegment first = pattern.getSegments().get(0);
    assertEquals(0, first.getStart());
    assertEquals(9, first.getEnd());
    assertEquals(100, first.getMean(), 1e-9);
    assertEquals(TrendDirection.STABLE, first.getTrend());

    RegimeSegment second = pattern.getSegments().get(1);
    assertEquals(10, second.getStart());
    assertEquals(39, second.getEnd());
    assertEquals(TrendDirection.INCREASING, second.getTrend());
    assertEquals(1, pattern.getStrength(), 0);
  }

  @Test
  public void testNoRegimeChangesInConstantSeries() {
    double[] values = new double[30];
    java.util.Arrays.fill(values, 7);
    RegimePattern pattern = detector.regime(values);
    assertFalse(pattern.isDetected());
    assertTrue(pattern.getChangePoints().isEmpty());
    assertEquals("no_regime_changes", pattern.getReason());
  }

  @Test
  public void testChangePointsNeedRoom() {
    assertTrue(PatternDetector.changePoints(new double[] {1, 2}).isEmpty());
  }

  @Test
  public void testVolatilityClusteringAndRegimes() {
    double[] volatility = {1, 1, 1, 10, 10, 1, 1, 10, 1, 1};
    VolatilityClustering clustering = PatternDetector.volatilityClustering(volatility);
    assertEquals(2, clustering.getCount());
    assertEquals(2, clustering.getMaxLength());
    assertEquals(1, clustering.getAverageLength(), 0);
    assertTrue(clustering.isDetected());

    ImmutableList<VolatilityRegime> regimes = PatternDetector.volatilityRegimes(volatility);
    assertEquals(5, regimes.size());
    assertEquals(VolatilityRegime.Level.MEDIUM, regimes.get(0).getLevel());
    assertEquals(2, regimes.get(0).getEnd());
    assertEquals(VolatilityRegime.Level.HIGH, regimes.get(1).getLevel());
    assertEquals(2, regimes.get(1).getLength());
    assertEquals(VolatilityRegime.Level.HIGH, regimes.get(3).getLevel());
    assertEquals(7, regimes.get(3).getStart());
  }

  @Test
  public void testStableVolatility() {
    double[] growth = new double[20];
    for (int i = 0; i < growth.length; i++) {
      growth[i] = Math.pow(2, i);
    }
    VolatilityPattern pattern = detector.volatility(growth);
    assertEquals(0, pattern.getCurrentVolatility(), 0);
    assertFalse(pattern.getClustering().isDetected());
    assertEquals(1, pattern.getRegimes().size());
    assertFalse(pattern.isDetected());
    assertEquals("stable_volatility", pattern.getReason());
  }

  @Test
  public void testClustering() {
    double[] values = new double[30];
    for (int i = 0; i < values.length; i++) {
      values[i] = i < 15 ? 10 + (i % 3) : 50 + 5 * (i % 4);
    }
    ClusteringPattern pattern = detector.clustering(values);
    assertEquals(10, pattern.getWindowSize());
    assertEquals(20, pattern.getFeatures().size());
    assertEquals(20, pattern.getAssignments().length);

    double percentage = 0;
    int size = 0;
    for (ClusterSummary cluster : pattern.getClusters()) {
      percentage += cluster.getPercentage();
      size += cluster.getSize();
    }
    assertEquals(100, percentage, 1e-9);
    assertEquals(20, size);
    assertTrue(pattern.isDetected());
    assertTrue(pattern.getIterations() <= KMeans.MAX_ITERATIONS);
  }

  @Test
  public void testDetectSubset() {
    MetricSeries series = MetricSeries.indexed("cpu", Instant.parse("2024-01-01T00:00:00Z"),
        Duration.ofHours(1), alternating(20));
    PatternReport report =
        detector.detect(series, ImmutableSet.of(PatternType.TREND, PatternType.CYCLICAL));
    assertEquals(2, report.getPatterns().size());
    assertNotNull(report.get(PatternType.CYCLICAL, CyclicalPattern.class));
    assertNull(report.get(PatternType.REGIME, RegimePattern.class));
    assertEquals(1, report.getDetected().size());
    assertTrue(detector.detect(series, ImmutableSet.<PatternType>of()).getPatterns().isEmpty());
  }

  @Test
  public void testDetectAll() {
    double[] values = new double[48];
    for (int i = 0; i < values.length; i++) {
      values[i] = 20 + 5 * Math.sin(2 * Math.PI * i / 12) + (i % 5);
    }
    MetricSeries series = MetricSeries.indexed("load", Instant.parse("2024-01-01T00:00:00Z"),
        Duration.ofHours(1), values);
    PatternReport report = detector.detectAll(series);
    assertEquals("load", report.getMetricId());
    assertEquals(PatternType.values().length, report.getPatterns().size());
    for (Pattern pattern : report.getPatterns().values()) {
      assertTrue(pattern.getStrength() >= 0);
    }
  }
}
