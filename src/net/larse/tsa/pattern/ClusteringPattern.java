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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.timeseries.AnalysisStatus;

/**
 * Groups of similar windows found by k-means over window features. Detected when more than one
 * cluster is non-empty; the strength is the silhouette score.
 */
public final class ClusteringPattern extends Pattern {
  static final String SINGLE_CLUSTER = "single_cluster";

  private final int windowSize;
  private final ImmutableList<FeatureVector> features;
  private final int[] assignments;
  private final ImmutableList<ClusterSummary> clusters;
  private final int iterations;

  ClusteringPattern(int windowSize, ImmutableList<FeatureVector> features, int[] assignments,
      ImmutableList<ClusterSummary> clusters, double silhouette, int iterations) {
    super(PatternType.CLUSTERING, AnalysisStatus.OK, clusters.size() > 1, silhouette,
        clusters.size() > 1 ? "" : SINGLE_CLUSTER);
    this.windowSize = windowSize;
    this.features = features;
    this.assignments = assignments.clone();
    this.clusters = clusters;
    this.iterations = iterations;
  }

  private ClusteringPattern(AnalysisStatus status) {
    super(PatternType.CLUSTERING, status, false, 0, "");
    this.windowSize = 0;
    this.features = ImmutableList.of();
    this.assignments = new int[0];
    this.clusters = ImmutableList.of();
    this.iterations = 0;
  }

  static ClusteringPattern insufficientData(String detail) {
    return new ClusteringPattern(AnalysisStatus.insufficientData(detail));
  }

  public int getWindowSize() {
    return windowSize;
  }

  /** Features of the windows [i - windowSize, i) for i = windowSize .. n - 1. */
  public ImmutableList<FeatureVector> getFeatures() {
    return features;
  }

  /** Cluster id of each feature window. */
  public int[] getAssignments() {
    return assignments.clone();
  }

  /** Non-empty clusters in id order. */
  public ImmutableList<ClusterSummary> getClusters() {
    return clusters;
  }

  public int getClusterCount() {
    return clusters.size();
  }

  public double getSilhouetteScore() {
    return getStrength();
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    if (!getStatus().isOk()) {
      return ImmutableMap.of();
    }
    return ImmutableMap.of(
        "clusterCount", (double) clusters.size(),
        "silhouette", getStrength(),
        "windowSize", (double) windowSize);
  }
}
