package net.larse.tsa.trend;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class TrendDetectorTest {
  private TrendDetector detector;

  @Before
  public void setUp() {
    detector = new TrendDetector();
  }

  private static double[] line(int n, double intercept, double slope) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = intercept + slope * i;
    }
    return values;
  }

  @Test
  public void testLinearIncrease() {
    TrendResult result = detector.analyze(line(25, 10, 2));
    assertTrue(result.getStatus().isOk());
    assertEquals(TrendDirection.INCREASING, result.getDirection());
    assertEquals(2, result.getSlope(), 1e-9);
    assertEquals(10, result.getIntercept(), 1e-9);
    assertEquals(1, result.getRSquared(), 1e-9);
    assertEquals(2, result.getStrength(), 1e-9);
    assertTrue(result.getPValue() < 1e-6);
    assertEquals(Confidence.HIGH, result.getConfidence());
    assertEquals(25, result.getSampleSize());
    assertEquals(4, result.getCandidates().size());
  }

  @Test
  public void testDirectionDeadBand() {
    assertEquals(TrendDirection.DECREASING, detector.analyze(line(10, 50, -0.5)).getDirection());
    assertEquals(TrendDirection.STABLE, detector.analyze(line(10, 50, 0.05)).getDirection());
  }

  @Test
  public void testSeriesInput() {
    MetricSeries series = MetricSeries.indexed("requests", Instant.EPOCH, Duration.ofMinutes(5),
        line(12, 3, 1.5));
    assertEquals(1.5, detector.analyze(series).getSlope(), 1e-9);
  }

  @Test
  public void testInsufficientData() {
    TrendResult result = detector.analyze(new double[] {4});
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, result.getStatus().getCode());
    assertTrue(result.getStatus().getReason().startsWith(AnalysisStatus.INSUFFICIENT_DATA_REASON));
    assertEquals(TrendDirection.INSUFFICIENT_DATA, result.getDirection());
    assertEquals(0, result.getSlope(), 0);
    assertEquals(0, result.getRSquared(), 0);
    assertEquals(1, result.getPValue(), 0);
    assertEquals(FitType.NONE, result.getBestFit());
  }

  @Test
  public void testExponentialGrowthPrefersExponentialFit() {
    double[] values = new double[20];
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.exp(0.3 * i);
    }
    TrendResult result = detector.analyze(values);
    assertEquals(FitType.EXPONENTIAL, result.getBestFit());
    CandidateFit exponential = result.getBestCandidate();
    assertEquals(0.3, exponential.getSlope(), 1e-9);
    assertEquals(values[19], exponential.predict(19), 1e-6);
  }

  @Test
  public void testQuadraticCoefficientsOnIndexScale() {
    double[] values = new double[15];
    for (int i = 0; i < values.length; i++) {
      values[i] = 5 - 2 * i + 0.5 * i * i;
    }
    CandidateFit fit = TrendDetector.quadratic(values);
    assertEquals(FitType.POLYNOMIAL, fit.getType());
    assertEquals(5, fit.getCoefficients()[0], 1e-6);
    assertEquals(-2, fit.getCoefficients()[1], 1e-6);
    assertEquals(0.5, fit.getCoefficients()[2], 1e-6);
    assertEquals(values[10], fit.predict(10), 1e-6);
  }

  @Test
  public void testPValueEdgeCases() {
    assertEquals(1, TrendDetector.pValue(3, 0.5, 2), 0);
    assertEquals(0, TrendDetector.pValue(3, 1, 10), 0);
    assertEquals(1, TrendDetector.pValue(0, 0, 10), 1e-6);
  }

  @Test
  public void testConfidenceScorePenalisesShortSeries() {
    assertEquals(0.9, TrendDetector.confidenceScore(0.9, 30), 1e-12);
    assertEquals(0.72, TrendDetector.confidenceScore(0.9, 15), 1e-12);
    assertEquals(0.432, TrendDetector.confidenceScore(0.9, 5), 1e-12);
  }

  @Test
  public void testConfidenceThresholdIsConfigurable() {
    AnalysisArgs args = new AnalysisArgs();
    args.confidenceThreshold = 0.999;
    double[] noisy = line(20, 0, 1);
    noisy[5] += 4;
    noisy[12] -= 4;
    TrendResult strict = new TrendDetector(args).analyze(noisy);
    assertEquals(Confidence.LOW, strict.getConfidence());
    assertEquals(Confidence.HIGH, detector.analyze(noisy).getConfidence());
  }
}
