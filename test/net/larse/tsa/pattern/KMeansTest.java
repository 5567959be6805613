package net.larse.tsa.pattern;

import org.junit.Test;

import static org.junit.Assert.*;

public class KMeansTest {
  private static final double[][] TWO_GROUPS = {{0, 0}, {0, 1}, {10, 10}, {10, 11}};

  @Test
  public void testSeparatesGroups() {
    KMeans kMeans = KMeans.fit(TWO_GROUPS, 2, 42L);
    int[] assignments = kMeans.getAssignments();
    assertEquals(assignments[0], assignments[1]);
    assertEquals(assignments[2], assignments[3]);
    assertNotEquals(assignments[0], assignments[2]);
    assertArrayEquals(new int[] {2, 2}, kMeans.sizes());
    assertTrue(kMeans.silhouette() > 0.8);
  }

  @Test
  public void testSameSeedSameResult() {
    double[][] points = new double[25][];
    for (int i = 0; i < points.length; i++) {
      points[i] = new double[] {(i * 7) % 11, (i * 3) % 5};
    }
    KMeans first = KMeans.fit(points, 3, 7L);
    KMeans second = KMeans.fit(points, 3, 7L);
    assertArrayEquals(first.getAssignments(), second.getAssignments());
    assertEquals(first.getIterations(), second.getIterations());
  }

  @Test
  public void testFeatureVector() {
    FeatureVector features = FeatureVector.of(new double[] {1, 2, 3});
    assertEquals(FeatureVector.DIMENSIONS, features.toArray().length);
    assertEquals(2, features.getMean(), 1e-12);
    assertEquals(Math.sqrt(2.0 / 3), features.getStandardDeviation(), 1e-12);
    assertEquals(2, features.getRange(), 0);
    assertEquals(0, features.getSkewness(), 1e-12);
  }
}
