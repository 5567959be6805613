package net.larse.tsa.forecast;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.FitCache;
import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.timeseries.MetricSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class ForecastEngineTest {
  private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

  private ForecastEngine engine;

  private static MetricSeries series(String id, double... values) {
    return MetricSeries.indexed(id, START, Duration.ofDays(1), values);
  }

  private static double[] line(int n, double intercept, double slope) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = intercept + slope * i;
    }
    return values;
  }

  @Before
  public void setUp() {
    engine = new ForecastEngine();
  }

  @Test
  public void testSelectsExponentialForSteepTrend() {
    MethodSelection selection = engine.selectMethod(line(12, 5, 2));
    assertEquals(ForecastMethod.EXPONENTIAL, selection.getMethod());
    assertEquals(1, selection.getTrendRSquared(), 1e-9);
    assertEquals(2, selection.getTrendSlope(), 1e-9);
    assertEquals(0, selection.getSeasonalStrength(), 0);
  }

  @Test
  public void testSelectsLinearForShallowTrend() {
    assertEquals(ForecastMethod.LINEAR, engine.selectMethod(line(12, 100, 0.05)).getMethod());
  }

  @Test
  public void testSelectsAutoregressionForVolatileSeries() {
    double[] values = new double[12];
    for (int i = 0; i < values.length; i++) {
      values[i] = i % 2 == 0 ? 1 : 10;
    }
    MethodSelection selection = engine.selectMethod(values);
    assertTrue(selection.getVolatility() > ForecastEngine.VOLATILITY_THRESHOLD);
    assertEquals(ForecastMethod.AUTOREGRESSIVE, selection.getMethod());
  }

  @Test
  public void testSelectsEnsembleForFlatSeries() {
    double[] values = new double[12];
    java.util.Arrays.fill(values, 5);
    assertEquals(ForecastMethod.ENSEMBLE, engine.selectMethod(values).getMethod());
  }

  @Test
  public void testForecastWithSelectedMethod() {
    ForecastResult result = engine.forecast(series("cpu", line(12, 5, 2)));
    assertTrue(result.getStatus().isOk());
    assertEquals(ForecastMethod.EXPONENTIAL, result.getMethod());
    assertEquals(new AnalysisArgs().horizon, result.getHorizon());
    assertNotNull(result.getBacktest());
  }

  @Test
  public void testForcedMethod() {
    ForecastResult result = engine.forecast(series("cpu", line(20, 5, 2)),
        ForecastMethod.LINEAR, 3);
    assertEquals(ForecastMethod.LINEAR, result.getMethod());
    assertArrayEquals(new double[] {45, 47, 49}, result.getValues(), 1e-9);
    assertEquals(result.getBacktest().getAccuracy(), result.getAccuracy(), 0);
  }

  @Test
  public void testUnsupportedMethodIsInsufficient() {
    double[] values = line(12, -5, 1);
    ForecastResult result = engine.forecast(series("temp", values),
        ForecastMethod.EXPONENTIAL, 3);
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, result.getStatus().getCode());
    assertEquals(0, result.getValues().length);
  }

  @Test
  public void testTooFewPoints() {
    ForecastResult result = engine.forecast(series("cpu", 1, 2, 3));
    assertEquals(AnalysisStatus.Code.INSUFFICIENT_DATA, result.getStatus().getCode());
    assertEquals(ForecastMethod.ENSEMBLE, result.getMethod());
    assertEquals(0, result.getHorizon());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHorizonMustBePositive() {
    engine.forecast(series("cpu", line(12, 5, 2)), 0);
  }

  @Test
  public void testEnsembleWeightsAreCached() {
    AnalysisArgs args = new AnalysisArgs();
    FitCache<EnsembleWeights> cache = new FitCache<>();
    ForecastEngine cached = new ForecastEngine(args, cache);
    MetricSeries series = series("cpu", line(20, 5, 2));

    ForecastResult first = cached.forecast(series, ForecastMethod.ENSEMBLE, 5);
    assertEquals(1, cache.size());
    EnsembleWeights weights = cache.get("cpu", args);
    assertNotNull(weights);

    ForecastResult second = cached.forecast(series, ForecastMethod.ENSEMBLE, 5);
    assertSame(weights, cache.get("cpu", args));
    assertArrayEquals(first.getValues(), second.getValues(), 0);

    cache.invalidate("cpu");
    assertEquals(0, cache.size());
  }

  @Test
  public void testDeterministic() {
    double[] values = new double[30];
    for (int i = 0; i < values.length; i++) {
      values[i] = 50 + 10 * Math.sin(i / 2.0) + (i % 3);
    }
    MetricSeries series = series("mem", values);
    ForecastResult first = engine.forecast(series, 5);
    ForecastResult second = new ForecastEngine().forecast(series, 5);
    assertEquals(first.getMethod(), second.getMethod());
    assertArrayEquals(first.getValues(), second.getValues(), 0);
  }

  @Test
  public void testVolatility() {
    assertEquals(0, ForecastEngine.volatility(new double[] {1, 2, 4, 8}), 1e-12);
    assertEquals(0, ForecastEngine.volatility(new double[] {3}), 0);
  }
}
