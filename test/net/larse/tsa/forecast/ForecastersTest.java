package net.larse.tsa.forecast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.helper.AnalysisArgs;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.seasonal.SeasonalityAnalyzer;

import org.junit.Before;
import org.junit.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ForecastersTest {
  private double[] line;
  private double[] sine;
  private Backtester backtester;

  @Before
  public void setUp() {
    line = new double[20];
    for (int i = 0; i < line.length; i++) {
      line[i] = 2 * i + 5;
    }
    sine = new double[60];
    for (int i = 0; i < sine.length; i++) {
      sine[i] = 10 + 3 * Math.sin(2 * Math.PI * i / 6);
    }
    backtester = new Backtester(0.2);
  }

  @Test
  public void testLinearExtendsLine() {
    ForecastResult result = new LinearForecaster().forecast(line, 5);
    assertEquals(5, result.getHorizon());
    assertEquals(5, result.getIntervals().size());
    for (int i = 0; i < 5; i++) {
      assertEquals(2 * (20 + i) + 5, result.getValues()[i], 1e-9);
      assertTrue(result.getIntervals().get(i).contains(result.getValues()[i]));
    }
    assertEquals(1, result.getAccuracy(), 1e-9);
    assertEquals(ForecastScale.ORIGINAL, result.getScale());
    assertEquals(2, result.getParameters().get("slope"), 1e-9);
  }

  @Test
  public void testExponentialFollowsGrowth() {
    double[] growth = new double[15];
    for (int i = 0; i < growth.length; i++) {
      growth[i] = 3 * Math.pow(1.1, i);
    }
    ExponentialForecaster forecaster = new ExponentialForecaster();
    assertTrue(forecaster.supports(growth));
    ForecastResult result = forecaster.forecast(growth, 3);
    assertEquals(3 * Math.pow(1.1, 15), result.getValues()[0], 1e-6);
    assertEquals(Math.log(1.1), result.getParameters().get("growthRate"), 1e-9);

    assertFalse(forecaster.supports(new double[] {1, 0, 2}));
  }

  @Test
  public void testExponentialSaturatesInsteadOfOverflowing() {
    double[] explosive = new double[12];
    for (int i = 0; i < explosive.length; i++) {
      explosive[i] = Math.exp(60 * i);
    }
    ForecastResult result = new ExponentialForecaster().forecast(explosive, 7);
    for (int i = 0; i < 7; i++) {
      double value = result.getValues()[i];
      assertFalse(Double.isInfinite(value) || Double.isNaN(value));
      assertFalse(Double.isInfinite(result.getIntervals().get(i).getUpper()));
    }
    assertEquals(Double.MAX_VALUE, result.getValues()[6], 0);
    assertEquals(Double.MAX_VALUE, ExponentialForecaster.boundedExp(1000), 0);
    assertEquals(Math.E, ExponentialForecaster.boundedExp(1), 0);
  }

  @Test
  public void testSeasonalContinuesCycle() {
    SeasonalForecaster forecaster = new SeasonalForecaster(new SeasonalityAnalyzer());
    assertTrue(forecaster.supports(sine));
    ForecastResult result = forecaster.forecast(sine, 6);
    assertEquals(6, result.getParameters().get("period"), 0);
    for (int i = 0; i < 6; i++) {
      assertEquals(10 + 3 * Math.sin(2 * Math.PI * (60 + i) / 6), result.getValues()[i], 0.5);
    }
  }

  @Test
  public void testAutoregressionPredictsDifferences() {
    AutoregressiveForecaster forecaster = new AutoregressiveForecaster(1, 1);
    assertEquals(ForecastScale.DIFFERENCED, forecaster.scale());
    ForecastResult result = forecaster.forecast(line, 4);
    assertEquals(ForecastScale.DIFFERENCED, result.getScale());
    // constant differences of 2 leave no autocovariance, so every step is the mean difference
    for (double value : result.getValues()) {
      assertEquals(2, value, 1e-9);
    }
    assertEquals(ForecastScale.ORIGINAL, new AutoregressiveForecaster(2, 0).scale());
    assertFalse(forecaster.supports(new double[] {1, 2, 3}));
  }

  @Test
  public void testAutoregressiveCoefficients() {
    assertArrayEquals(new double[] {0, 0}, AutoregressiveForecaster.coefficients(
        new double[] {4, 4, 4, 4}, 2), 0);
    double[] phi = AutoregressiveForecaster.coefficients(new double[] {1, -1, 1, -1, 1, -1}, 1);
    assertEquals(-5.0 / 6, phi[0], 1e-12);
  }

  @Test
  public void testBacktestOfLine() {
    BacktestResult backtest = backtester.backtest(new LinearForecaster(), line);
    assertEquals(16, backtest.getTrainingSize());
    assertEquals(4, backtest.getValidationSize());
    assertEquals(0, backtest.getMape(), 1e-9);
    assertEquals(0, backtest.getRmse(), 1e-9);
    assertEquals(1, backtest.getAccuracy(), 1e-9);
  }

  @Test
  public void testBacktestOfDifferencedForecast() {
    double[] zigzag = new double[40];
    for (int i = 0; i < zigzag.length; i++) {
      zigzag[i] = 100 + 2 * i + (i % 2 == 0 ? 0.5 : -0.5);
    }
    AutoregressiveForecaster forecaster = new AutoregressiveForecaster(1, 1);
    assertArrayEquals(new double[] {1, 3, 1},
        ArrayHelper.slice(forecaster.onScale(zigzag), 0, 3), 1e-12);

    BacktestResult backtest = backtester.backtest(forecaster, zigzag);
    assertEquals(32, backtest.getTrainingSize());
    assertEquals(8, backtest.getValidationSize());
    assertTrue(backtest.getMape() < 0.2);
    assertTrue(backtest.getRSquared() > 0.5);
    assertTrue(backtest.getAccuracy() > 0.5);
  }

  @Test
  public void testBacktestTooShort() {
    assertNull(backtester.backtest(new LinearForecaster(), new double[] {1, 2, 3, 4}));
  }

  @Test
  public void testMapeSkipsZeros() {
    assertEquals(0.5, Backtester.mape(new double[] {0, 2}, new double[] {5, 1}), 1e-12);
    assertEquals(0, Backtester.mape(new double[] {0, 0}, new double[] {5, 1}), 0);
  }

  @Test
  public void testWeightsAreNormalised() {
    Map<ForecastMethod, Double> accuracies = new EnumMap<>(ForecastMethod.class);
    accuracies.put(ForecastMethod.LINEAR, 0.6);
    accuracies.put(ForecastMethod.SEASONAL, 0.2);
    EnsembleWeights weights = EnsembleWeights.fromAccuracies(accuracies);
    assertEquals(0.75, weights.weight(ForecastMethod.LINEAR), 1e-12);
    assertEquals(0.25, weights.weight(ForecastMethod.SEASONAL), 1e-12);
    assertEquals(0, weights.weight(ForecastMethod.EXPONENTIAL), 0);

    EnsembleWeights equal = EnsembleWeights.fromAccuracies(
        ImmutableMap.of(ForecastMethod.LINEAR, 0.0, ForecastMethod.EXPONENTIAL, 0.0));
    assertEquals(0.5, equal.weight(ForecastMethod.LINEAR), 0);
  }

  @Test
  public void testEnsembleSkipsDifferencedMembers() {
    AnalysisArgs args = new AnalysisArgs();
    EnsembleForecaster ensemble = new EnsembleForecaster(ImmutableList.of(
        new LinearForecaster(), new ExponentialForecaster(),
        new AutoregressiveForecaster(args.arOrder, args.differencingOrder)), backtester);
    assertEquals(2, ensemble.applicable(line).size());

    ForecastResult result = ensemble.forecast(line, 7);
    assertEquals(ForecastMethod.ENSEMBLE, result.getMethod());
    assertEquals(7, result.getValues().length);
    assertTrue(result.getConfidence() >= 0 && result.getConfidence() <= 1);
    assertTrue(result.getAccuracy() >= 0 && result.getAccuracy() <= 1);
    assertFalse(result.getParameters().containsKey("weight.AUTOREGRESSIVE"));
  }
}
