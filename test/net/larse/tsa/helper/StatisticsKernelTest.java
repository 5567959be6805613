package net.larse.tsa.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class StatisticsKernelTest {
  private static final double EPS = 1e-9;

  @Test
  public void testMoments() {
    double[] x = {2, 4, 4, 4, 5, 5, 7, 9};
    assertEquals(5, StatisticsKernel.mean(x), EPS);
    assertEquals(2, StatisticsKernel.populationStandardDeviation(x), EPS);
    assertEquals(32.0 / 7, StatisticsKernel.variance(x), EPS);
    assertEquals(0.4, StatisticsKernel.coefficientOfVariation(x), EPS);
  }

  @Test
  public void testDegenerateInputs() {
    assertEquals(0, StatisticsKernel.mean(new double[0]), 0);
    assertEquals(0, StatisticsKernel.variance(new double[] {3}), 0);
    assertEquals(0, StatisticsKernel.coefficientOfVariation(new double[] {-1, 1}), 0);
    assertEquals(0, StatisticsKernel.skewness(new double[] {5, 5, 5}), 0);
    assertEquals(0, StatisticsKernel.kurtosis(new double[] {5, 5, 5}), 0);
    assertEquals(0, StatisticsKernel.pearson(new double[] {1, 1, 1}, new double[] {1, 2, 3}), 0);
  }

  @Test
  public void testSkewnessSignAndSymmetry() {
    assertEquals(0, StatisticsKernel.skewness(new double[] {1, 2, 3, 4, 5}), EPS);
    assertTrue(StatisticsKernel.skewness(new double[] {1, 1, 1, 1, 10}) > 0);
    assertTrue(StatisticsKernel.skewness(new double[] {10, 10, 10, 10, 1}) < 0);
  }

  @Test
  public void testPercentileInterpolates() {
    double[] x = {4, 1, 3, 2};
    assertEquals(1, StatisticsKernel.percentile(x, 0), EPS);
    assertEquals(1.75, StatisticsKernel.percentile(x, 25), EPS);
    assertEquals(2.5, StatisticsKernel.percentile(x, 50), EPS);
    assertEquals(4, StatisticsKernel.percentile(x, 100), EPS);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPercentileOutOfRange() {
    StatisticsKernel.percentile(new double[] {1, 2}, 101);
  }

  @Test
  public void testRanksAverageTies() {
    assertArrayEquals(new double[] {1, 2.5, 2.5, 4},
        StatisticsKernel.ranks(new double[] {10, 20, 20, 30}), EPS);
  }

  @Test
  public void testRegressionOfLine() {
    double[] y = new double[20];
    for (int i = 0; i < y.length; i++) {
      y[i] = 10 + 2 * i;
    }
    RegressionFit fit = StatisticsKernel.regression(y);
    assertEquals(2, fit.getSlope(), EPS);
    assertEquals(10, fit.getIntercept(), EPS);
    assertEquals(1, fit.getRSquared(), EPS);
    assertEquals(0, fit.getStandardError(), 1e-6);
    assertEquals(50, fit.predict(20), EPS);
  }

  @Test
  public void testRegressionWithoutSpread() {
    RegressionFit fit = StatisticsKernel.regression(new double[] {3, 3}, new double[] {1, 5});
    assertEquals(0, fit.getSlope(), 0);
    assertEquals(3, fit.getIntercept(), EPS);
    assertEquals(0, fit.getRSquared(), 0);
  }

  @Test
  public void testCorrelations() {
    double[] x = {1, 3, 2, 5, 4, 7, 6};
    double[] neg = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      neg[i] = -x[i];
    }
    assertEquals(1, StatisticsKernel.pearson(x, x), EPS);
    assertEquals(-1, StatisticsKernel.pearson(x, neg), EPS);
    assertEquals(-1, StatisticsKernel.spearman(new double[] {1, 2, 3, 4, 5},
        new double[] {5, 4, 3, 2, 1}), EPS);
    assertEquals(-1, StatisticsKernel.kendall(new double[] {1, 2, 3, 4, 5},
        new double[] {5, 4, 3, 2, 1}), EPS);
    // 8 concordant and 2 discordant pairs
    assertEquals(0.6, StatisticsKernel.kendall(new double[] {1, 2, 3, 4, 5},
        new double[] {1, 3, 2, 5, 4}), EPS);
  }

  @Test
  public void testNormalApproximation() {
    assertEquals(0.975, StatisticsKernel.normalCdf(1.96), 1e-3);
    assertEquals(0.5, StatisticsKernel.normalCdf(0), 1e-6);
    assertEquals(1, StatisticsKernel.twoSidedPValue(0), 1e-6);
    assertEquals(0.05, StatisticsKernel.twoSidedPValue(1.96), 1e-3);
    assertEquals(1, StatisticsKernel.twoSidedPValue(Double.NaN), 0);
    assertEquals(0, StatisticsKernel.twoSidedPValue(Double.POSITIVE_INFINITY), 0);
  }

  @Test
  public void testEuclideanDistance() {
    assertEquals(5, StatisticsKernel.euclideanDistance(new double[] {0, 0},
        new double[] {3, 4}), EPS);
  }
}
