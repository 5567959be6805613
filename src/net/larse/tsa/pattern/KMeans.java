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
package net.larse.tsa.pattern;

import com.google.common.base.Preconditions;

import net.larse.tsa.helper.StatisticsKernel;

import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomGenerator;

import java.util.Arrays;

/**
 * Lloyd's k-means with Euclidean distance. Initial centroids are distinct points drawn in an order
 * shuffled by a seeded generator, so a fit is reproducible for a given seed.
 */
final class KMeans {
  static final int MAX_ITERATIONS = 100;

  private final double[][] points;
  private final double[][] centroids;
  private final int[] assignments;
  private int iterations;

  private KMeans(double[][] points, double[][] centroids) {
    this.points = points;
    this.centroids = centroids;
    this.assignments = new int[points.length];
    Arrays.fill(assignments, -1);
  }

  /**
   * Clusters points into at most k groups. Fewer groups are used when there are fewer than k
   * distinct points.
   */
  static KMeans fit(double[][] points, int k, long seed) {
    Preconditions.checkArgument(points.length > 0, "No points to cluster");
    Preconditions.checkArgument(k >= 1, "k must be positive: %s", k);
    KMeans kMeans = new KMeans(points, initialCentroids(points, k, seed));
    kMeans.iterate();
    return kMeans;
  }

  private static double[][] initialCentroids(double[][] points, int k, long seed) {
    RandomGenerator random = new JDKRandomGenerator();
    random.setSeed(seed);
    int[] order = new int[points.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    for (int i = order.length - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int tmp = order[i];
      order[i] = order[j];
      order[j] = tmp;
    }

    double[][] chosen = new double[k][];
    int count = 0;
    for (int i = 0; i < order.length && count < k; i++) {
      double[] candidate = points[order[i]];
      boolean duplicate = false;
      for (int c = 0; c < count && !duplicate; c++) {
        duplicate = Arrays.equals(chosen[c], candidate);
      }
      if (!duplicate) {
        chosen[count++] = candidate.clone();
      }
    }
    return Arrays.copyOf(chosen, count);
  }

  private void iterate() {
    boolean changed = true;
    while (changed && iterations < MAX_ITERATIONS) {
      changed = false;
      iterations++;
      for (int i = 0; i < points.length; i++) {
        int closest = nearest(points[i]);
        if (assignments[i] != closest) {
          assignments[i] = closest;
          changed = true;
        }
      }
      updateCentroids();
    }
  }

  private int nearest(double[] point) {
    int closest = 0;
    double best = Double.POSITIVE_INFINITY;
    for (int c = 0; c < centroids.length; c++) {
      double distance = StatisticsKernel.euclideanDistance(point, centroids[c]);
      if (distance < best) {
        best = distance;
        closest = c;
      }
    }
    return closest;
  }

  // Empty clusters keep their previous centroid.
  private void updateCentroids() {
    int dimensions = centroids[0].length;
    double[][] sums = new double[centroids.length][dimensions];
    int[] counts = new int[centroids.length];
    for (int i = 0; i < points.length; i++) {
      int c = assignments[i];
      counts[c]++;
      for (int d = 0; d < dimensions; d++) {
        sums[c][d] += points[i][d];
      }
    }
    for (int c = 0; c < centroids.length; c++) {
      if (counts[c] > 0) {
        for (int d = 0; d < dimensions; d++) {
          centroids[c][d] = sums[c][d] / counts[c];
        }
      }
    }
  }

  int[] getAssignments() {
    return assignments.clone();
  }

  double[][] getCentroids() {
    double[][] copy = new double[centroids.length][];
    for (int c = 0; c < centroids.length; c++) {
      copy[c] = centroids[c].clone();
    }
    return copy;
  }

  int getIterations() {
    return iterations;
  }

  /** Number of points per centroid. */
  int[] sizes() {
    int[] sizes = new int[centroids.length];
    for (int c : assignments) {
      sizes[c]++;
    }
    return sizes;
  }

  /**
   * Simplified silhouette: for each point (b - a) / max(a, b) when b > a and 0 otherwise, where a
   * is the mean distance to the rest of its cluster and b the smallest mean distance to another
   * non-empty cluster. Averaged over all points.
   */
  double silhouette() {
    double total = 0;
    for (int i = 0; i < points.length; i++) {
      double[] distanceSums = new double[centroids.length];
      int[] counts = new int[centroids.length];
      for (int j = 0; j < points.length; j++) {
        if (j != i) {
          distanceSums[assignments[j]] += StatisticsKernel.euclideanDistance(points[i], points[j]);
          counts[assignments[j]]++;
        }
      }
      int own = assignments[i];
      double a = counts[own] > 0 ? distanceSums[own] / counts[own] : 0;
      double b = Double.POSITIVE_INFINITY;
      for (int c = 0; c < centroids.length; c++) {
        if (c != own && counts[c] > 0) {
          b = Math.min(b, distanceSums[c] / counts[c]);
        }
      }
      if (b > a && !Double.isInfinite(b)) {
        total += (b - a) / Math.max(a, b);
      }
    }
    return total / points.length;
  }
}
