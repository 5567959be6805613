package net.larse.tsa.seasonal;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class SeasonalityAnalyzerTest {
  // a Monday
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private SeasonalityAnalyzer analyzer;
  private double[] sine;

  @Before
  public void setUp() {
    analyzer = new SeasonalityAnalyzer();
    sine = new double[60];
    for (int i = 0; i < sine.length; i++) {
      sine[i] = 50 + 10 * Math.sin(2 * Math.PI * i / 6);
    }
  }

  @Test
  public void testDetectsPeriod() {
    assertEquals(6, analyzer.detectPeriod(sine));
    SeasonalityResult result = analyzer.analyze(sine);
    assertTrue(result.getStatus().isOk());
    assertTrue(result.isPeriodDetected());
    assertEquals(6, result.getPeriod());
    assertEquals(1, result.getAutocorrelationStrength(), 1e-9);
    assertTrue(result.getSeasonalStrength() > 0.99);
    assertEquals(10 / Math.sqrt(2), result.getAmplitude(), 0.5);
    // lags 12 and 18; 24 is beyond the searched lags
    assertEquals(2, result.getHarmonics().size());
    assertEquals(12, result.getHarmonics().get(0).getPeriod());
  }

  @Test
  public void testFallsBackToDefaultPeriod() {
    double[] line = new double[30];
    for (int i = 0; i < line.length; i++) {
      line[i] = i;
    }
    assertEquals(0, analyzer.detectPeriod(line));
    SeasonalityResult result = analyzer.analyze(line);
    assertFalse(result.isPeriodDetected());
    assertEquals(SeasonalityAnalyzer.DEFAULT_PERIOD, result.getPeriod());
  }

  @Test
  public void testDecompositionReconstructsInput() {
    double[] values = new double[45];
    for (int i = 0; i < values.length; i++) {
      values[i] = 3 + 0.4 * i + 5 * Math.cos(i * 2 * Math.PI / 7) + ((i * 17) % 5) * 0.3;
    }
    SeasonalDecomposition decomposition = SeasonalDecomposition.of(values, 7);
    double[] trend = decomposition.getTrend();
    double[] seasonal = decomposition.getSeasonal();
    double[] residual = decomposition.getResidual();
    assertEquals(7, seasonal.length);
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], trend[i] + seasonal[i % 7] + residual[i], 1e-9);
      assertEquals(values[i], decomposition.reconstruct(i), 1e-9);
    }
  }

  @Test
  public void testTooShortForPeriod() {
    SeasonalityResult result = analyzer.analyze(new double[] {1, 2, 3, 4, 5, 6, 7, 8}, 7);
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, result.getStatus().getCode());
    assertNull(result.getDecomposition());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsPeriodBelowTwo() {
    analyzer.analyze(sine, 1);
  }

  private static MetricSeries businessHours() {
    double[] values = new double[24 * 14];
    for (int i = 0; i < values.length; i++) {
      int hour = i % 24;
      values[i] = hour >= 9 && hour <= 17 ? 150 : 100;
    }
    return MetricSeries.indexed("requests", START, Duration.ofHours(1), values);
  }

  @Test
  public void testCalendarPatterns() {
    CalendarAnalysis calendar = analyzer.calendarPatterns(businessHours());
    assertTrue(calendar.getStatus().isOk());
    CalendarPattern daily = calendar.getPatterns().get(CalendarPeriod.DAILY);
    assertTrue(daily.isDetected());
    assertEquals(24, daily.getGroupMeans().length);
    assertEquals(Math.sqrt(0.375 * 0.625) * 50 / 118.75, daily.getCoefficient(), 1e-9);
    assertFalse(calendar.getPatterns().get(CalendarPeriod.WEEKLY).isDetected());
    assertFalse(calendar.getPatterns().get(CalendarPeriod.MONTHLY).isDetected());
    assertEquals(CalendarPeriod.DAILY, calendar.getDominantPeriod());
    assertEquals(daily.getStrength(), calendar.getOverallStrength(), 1e-12);
  }

  @Test
  public void testCalendarPatternsUseConfiguredZone() {
    AnalysisArgs args = new AnalysisArgs();
    args.zone = "Asia/Tokyo";
    CalendarPattern utc = analyzer.calendarPatterns(businessHours())
        .getPatterns().get(CalendarPeriod.DAILY);
    CalendarPattern tokyo = new SeasonalityAnalyzer(args).calendarPatterns(businessHours())
        .getPatterns().get(CalendarPeriod.DAILY);
    // midnight in Tokyo is 15:00 UTC
    assertEquals(100, utc.getGroupMeans()[0], 1e-9);
    assertEquals(150, tokyo.getGroupMeans()[0], 1e-9);
  }

  @Test
  public void testCalendarPatternsNeedThirtyPoints() {
    MetricSeries series = MetricSeries.indexed("requests", START, Duration.ofHours(1),
        new double[20]);
    CalendarAnalysis calendar = analyzer.calendarPatterns(series);
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, calendar.getStatus().getCode());
    assertFalse(calendar.isDetected());
    assertNull(calendar.getDominantPeriod());
  }
}
