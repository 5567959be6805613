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
package net.larse.tsa.correlation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import net.larse.tsa.timeseries.AnalysisStatus;

/** All correlations between a set of aligned metrics. */
public final class CorrelationReport {
  static final double STRONG = 0.7;
  static final double WEAK = 0.3;

  private final AnalysisStatus status;
  private final ImmutableListMultimap<CorrelationMethod, CorrelationResult> results;
  private final ImmutableList<LaggedCorrelation> lagged;
  private final ImmutableList<RollingCorrelation> rolling;
  private final ImmutableList<CrossCorrelation> cross;
  private final ImmutableList<CorrelationCluster> clusters;

  CorrelationReport(AnalysisStatus status,
      ImmutableListMultimap<CorrelationMethod, CorrelationResult> results,
      ImmutableList<LaggedCorrelation> lagged, ImmutableList<RollingCorrelation> rolling,
      ImmutableList<CrossCorrelation> cross, ImmutableList<CorrelationCluster> clusters) {
    this.status = status;
    this.results = results;
    this.lagged = lagged;
    this.rolling = rolling;
    this.cross = cross;
    this.clusters = clusters;
  }

  static CorrelationReport insufficientData(String detail) {
    return new CorrelationReport(AnalysisStatus.insufficientData(detail),
        ImmutableListMultimap.<CorrelationMethod, CorrelationResult>of(),
        ImmutableList.<LaggedCorrelation>of(), ImmutableList.<RollingCorrelation>of(),
        ImmutableList.<CrossCorrelation>of(), ImmutableList.<CorrelationCluster>of());
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public ImmutableListMultimap<CorrelationMethod, CorrelationResult> getResults() {
    return results;
  }

  public ImmutableList<CorrelationResult> get(CorrelationMethod method) {
    return results.get(method);
  }

  /** The result of a method for a pair, in either order for the symmetric methods. */
  public CorrelationResult find(CorrelationMethod method, String metricA, String metricB) {
    for (CorrelationResult result : results.get(method)) {
      if (result.getMetricA().equals(metricA) && result.getMetricB().equals(metricB)) {
        return result;
      }
    }
    if (method != CorrelationMethod.LAGGED && method != CorrelationMethod.CROSS) {
      for (CorrelationResult result : results.get(method)) {
        if (result.getMetricA().equals(metricB) && result.getMetricB().equals(metricA)) {
          return result;
        }
      }
    }
    return null;
  }

  public ImmutableList<LaggedCorrelation> getLagged() {
    return lagged;
  }

  public ImmutableList<RollingCorrelation> getRolling() {
    return rolling;
  }

  public ImmutableList<CrossCorrelation> getCross() {
    return cross;
  }

  public ImmutableList<CorrelationCluster> getClusters() {
    return clusters;
  }

  /** Results with strength above 0.7. */
  public ImmutableList<CorrelationResult> getStrong() {
    ImmutableList.Builder<CorrelationResult> strong = ImmutableList.builder();
    for (CorrelationResult result : results.values()) {
      if (result.getStrength() > STRONG) {
        strong.add(result);
      }
    }
    return strong.build();
  }

  /** Results with strength below 0.3. */
  public ImmutableList<CorrelationResult> getWeak() {
    ImmutableList.Builder<CorrelationResult> weak = ImmutableList.builder();
    for (CorrelationResult result : results.values()) {
      if (result.getStrength() < WEAK) {
        weak.add(result);
      }
    }
    return weak.build();
  }

  public ImmutableList<CorrelationResult> getNegative() {
    ImmutableList.Builder<CorrelationResult> negative = ImmutableList.builder();
    for (CorrelationResult result : results.values()) {
      if (result.getDirection() == CorrelationDirection.NEGATIVE) {
        negative.add(result);
      }
    }
    return negative.build();
  }

  public ImmutableList<CorrelationResult> getSignificant() {
    ImmutableList.Builder<CorrelationResult> significant = ImmutableList.builder();
    for (CorrelationResult result : results.values()) {
      if (result.getSignificance().isSignificant()) {
        significant.add(result);
      }
    }
    return significant.build();
  }
}
