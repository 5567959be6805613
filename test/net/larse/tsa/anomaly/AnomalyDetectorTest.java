package net.larse.tsa.anomaly;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class AnomalyDetectorTest {
  private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
  private static final Set<AnomalyMethod> POINT_METHODS =
      EnumSet.of(AnomalyMethod.ZSCORE, AnomalyMethod.IQR, AnomalyMethod.ISOLATION);

  private AnomalyDetector detector;

  @Before
  public void setUp() {
    detector = new AnomalyDetector();
  }

  private static MetricSeries series(double... values) {
    return MetricSeries.indexed("latency", START, Duration.ofMinutes(1), values);
  }

  // 10, 11, 10, 11, ... with a spike at index spikeAt
  private static double[] alternating(int n, int spikeAt, double spike) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = i % 2 == 0 ? 10 : 11;
    }
    if (spikeAt >= 0) {
      values[spikeAt] = spike;
    }
    return values;
  }

  @Test
  public void testDefaultThreshold() {
    assertEquals(2 / 0.7, detector.zScoreThreshold(), 1e-12);
  }

  @Test
  public void testSpikeIsFlaggedByEveryPointMethod() {
    MetricSeries series = series(alternating(20, 10, 100));
    AnomalyReport report = detector.detect(series);

    // the spike hides the two-point cycle, so there is no period to decompose at
    assertTrue(report.getSeasonal().isEmpty());
    for (AnomalyMethod method : POINT_METHODS) {
      ImmutableList<AnomalyRecord> records = report.get(method);
      assertEquals(method.toString(), 1, records.size());
      AnomalyRecord record = records.get(0);
      assertEquals(10, record.getIndex());
      assertEquals(100, record.getValue(), 0);
      assertEquals(START.plus(Duration.ofMinutes(10)), record.getTimestamp());
      assertEquals(AnomalyDirection.HIGH, record.getDirection());
      assertEquals(Severity.CRITICAL, record.getSeverity());
    }
    assertEquals(ImmutableSet.of(10), report.getUnion());

    assertEquals(1, report.getConsensus().size());
    ConsensusAnomaly consensus = report.getConsensus().get(0);
    assertEquals(10, consensus.getIndex());
    assertEquals(0.75, consensus.getAgreement(), 0);
    assertEquals(Severity.CRITICAL, consensus.getSeverity());
  }

  @Test
  public void testConsensusScores() {
    AnomalyReport report = detector.detect(series(alternating(20, 10, 100)));
    ConsensusAnomaly consensus = report.getConsensus().get(0);

    // mean 15 and sd sqrt(380.5) over the series
    assertEquals(85 / Math.sqrt(380.5) / 5, consensus.getMagnitudeScore(), 1e-9);
    // z above 3 within indices 5 .. 15
    assertEquals(1.0, consensus.getContextScore(), 0);
    // Friday, ten past midnight UTC
    assertEquals(0, consensus.getTemporalScore(), 0);
    assertEquals((consensus.getMeanScore() + 1.0 + consensus.getMagnitudeScore()) / 4,
        consensus.getScore(), 1e-12);
  }

  @Test
  public void testTemporalScore() {
    ZoneId utc = ZoneId.of("UTC");
    // Saturday
    assertEquals(0.5, AnomalyDetector.temporalScore(Instant.parse("2024-03-02T03:00:00Z"), utc),
        1e-12);
    assertEquals(0.2, AnomalyDetector.temporalScore(Instant.parse("2024-03-02T12:00:00Z"), utc),
        1e-12);
    // Friday
    assertEquals(0.3, AnomalyDetector.temporalScore(Instant.parse("2024-03-01T06:59:00Z"), utc),
        1e-12);
    assertEquals(0, AnomalyDetector.temporalScore(Instant.parse("2024-03-01T07:00:00Z"), utc), 0);
    // 03:00 in New York is 08:00 UTC
    assertEquals(0.3, AnomalyDetector.temporalScore(Instant.parse("2024-03-01T08:00:00Z"),
        ZoneId.of("America/New_York")), 1e-12);
  }

  @Test
  public void testContextAndMagnitudeOfFlatSeries() {
    double[] values = new double[12];
    Arrays.fill(values, 3);
    assertEquals(0, AnomalyDetector.contextScore(values, 0), 0);
    assertEquals(0, AnomalyDetector.magnitudeScore(values, 11), 0);
  }

  // sine with period 6 and index 19 pulled to the series mean
  private static double[] seasonalDip() {
    double[] values = new double[48];
    for (int i = 0; i < values.length; i++) {
      values[i] = 10 + 3 * Math.sin(2 * Math.PI * i / 6);
    }
    values[19] = 10;
    return values;
  }

  @Test
  public void testSeasonalResidualIsFlagged() {
    MetricSeries series = series(seasonalDip());
    ImmutableList<AnomalyRecord> seasonal = detector.detectSeasonal(series);
    assertEquals(1, seasonal.size());
    AnomalyRecord record = seasonal.get(0);
    assertEquals(19, record.getIndex());
    assertEquals(AnomalyMethod.SEASONAL, record.getMethod());
    assertEquals(AnomalyDirection.LOW, record.getDirection());
    assertEquals(Severity.CRITICAL, record.getSeverity());
    assertTrue(record.getScore() > 5);

    // the value sits at the series mean
    for (AnomalyRecord zScore : detector.detectZScore(series)) {
      assertNotEquals(19, zScore.getIndex());
    }
    AnomalyReport report = detector.detect(series);
    assertEquals(1, report.get(AnomalyMethod.SEASONAL).size());
    assertEquals(19, report.getSeasonal().get(0).getIndex());
    assertTrue(report.getUnion().contains(19));
  }

  @Test
  public void testSeasonalNeedsPeriodAndLength() {
    double[] values = seasonalDip();
    assertTrue(detector.detectSeasonal(series(Arrays.copyOf(values, 13))).isEmpty());
    assertTrue(detector.detectSeasonal(series(alternating(20, 10, 100))).isEmpty());
  }

  @Test
  public void testLowOutlierDirection() {
    AnomalyReport report = detector.detect(series(alternating(20, 5, -80)));
    assertEquals(AnomalyDirection.LOW, report.getZScore().get(0).getDirection());
    assertEquals(AnomalyDirection.LOW, report.getIqr().get(0).getDirection());
  }

  @Test
  public void testConstantSeriesHasNoAnomalies() {
    double[] values = new double[30];
    Arrays.fill(values, 42);
    AnomalyReport report = detector.detect(series(values));
    assertTrue(report.isEmpty());
    assertTrue(report.getConsensus().isEmpty());
  }

  private static double[] noisy() {
    double[] values = new double[60];
    for (int i = 0; i < values.length; i++) {
      values[i] = 50 + ((i * 37) % 23) - 11;
    }
    values[7] = 95;
    values[19] = 72;
    values[33] = 66;
    values[48] = 12;
    values[55] = 3;
    return values;
  }

  private static Set<Integer> iqrIndices(double multiplier, MetricSeries series) {
    AnalysisArgs args = new AnalysisArgs();
    args.iqrMultiplier = multiplier;
    Set<Integer> indices = new HashSet<>();
    for (AnomalyRecord record : new AnomalyDetector(args).detectIqr(series)) {
      indices.add(record.getIndex());
    }
    return indices;
  }

  @Test
  public void testWiderIqrFencesFlagASubset() {
    MetricSeries series = series(noisy());
    Set<Integer> narrow = iqrIndices(1.5, series);
    Set<Integer> wide = iqrIndices(3.0, series);
    assertFalse(narrow.isEmpty());
    assertTrue(narrow.containsAll(wide));
    assertTrue(wide.size() <= narrow.size());
  }

  @Test
  public void testHigherSensitivityFlagsMore() {
    MetricSeries series = series(noisy());
    AnalysisArgs sensitive = new AnalysisArgs();
    sensitive.sensitivity = 1.0;
    int relaxed = detector.detectZScore(series).size();
    int strict = new AnomalyDetector(sensitive).detectZScore(series).size();
    assertTrue(strict >= relaxed);
  }

  @Test
  public void testDetectionIsDeterministic() {
    MetricSeries series = series(noisy());
    AnomalyReport first = detector.detect(series);
    AnomalyReport second = detector.detect(series);
    for (AnomalyMethod method : AnomalyMethod.values()) {
      assertEquals(first.get(method).size(), second.get(method).size());
      for (int i = 0; i < first.get(method).size(); i++) {
        assertEquals(first.get(method).get(i).getIndex(), second.get(method).get(i).getIndex());
        assertEquals(Double.doubleToLongBits(first.get(method).get(i).getScore()),
            Double.doubleToLongBits(second.get(method).get(i).getScore()));
      }
    }
  }

  @Test
  public void testIsolationScore() {
    // distances 1, 2, 3: mean 2, max 3
    assertEquals(2.0 / 3, AnomalyDetector.isolationScore(0, new double[] {1, 2, 3}, -1), 1e-12);
    assertEquals(2.0 / 3, AnomalyDetector.isolationScore(0, new double[] {1, 0, 2, 3}, 1), 1e-12);
    assertEquals(0, AnomalyDetector.isolationScore(5, new double[] {5, 5}, -1), 0);
  }

  @Test
  public void testSeverityCutoffs() {
    assertEquals(Severity.LOW, Severity.of(1.9, 2, 2.5, 3));
    assertEquals(Severity.MEDIUM, Severity.of(2.1, 2, 2.5, 3));
    assertEquals(Severity.HIGH, Severity.of(2.7, 2, 2.5, 3));
    assertEquals(Severity.CRITICAL, Severity.of(3.5, 2, 2.5, 3));
  }

  @Test
  public void testStreamingNeedsFullWindow() {
    // 23 points of history for a window of 24
    StreamingVerdict verdict = detector.evaluateLatest(series(alternating(24, 23, 100)));
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, verdict.getStatus().getCode());
    assertFalse(verdict.isAnomalous());
  }

  @Test
  public void testStreamingFlagsNewestPoint() {
    StreamingVerdict verdict = detector.evaluateLatest(series(alternating(25, 24, 100)));
    assertTrue(verdict.getStatus().isOk());
    assertTrue(verdict.isAnomalous());
    Set<AnomalyMethod> methods = new HashSet<>();
    for (AnomalyRecord record : verdict.getAnomalies()) {
      assertEquals(24, record.getIndex());
      methods.add(record.getMethod());
    }
    assertEquals(POINT_METHODS, methods);
  }

  @Test
  public void testStreamingOrdinaryPoint() {
    AnalysisArgs args = new AnalysisArgs();
    // a two-valued window puts every point at isolation score 0.5
    args.isolationThreshold = 0.9;
    StreamingVerdict verdict =
        new AnomalyDetector(args).evaluateLatest(series(alternating(30, -1, 0)));
    assertTrue(verdict.getStatus().isOk());
    assertFalse(verdict.isAnomalous());
  }

  @Test
  public void testConsensusThresholdIsConfigurable() {
    AnalysisArgs args = new AnalysisArgs();
    args.minAgreement = 1;
    MetricSeries series = series(noisy());
    AnomalyReport report = new AnomalyDetector(args).detect(series);
    assertEquals(report.getUnion().size(), report.getConsensus().size());
  }
}
