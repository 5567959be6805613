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
package net.larse.tsa.anomaly;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/** Batch anomalies of one series by method, with their union and consensus. */
public final class AnomalyReport {
  private final String metricId;
  private final ImmutableList<AnomalyRecord> zScore;
  private final ImmutableList<AnomalyRecord> iqr;
  private final ImmutableList<AnomalyRecord> isolation;
  private final ImmutableList<AnomalyRecord> seasonal;
  private final ImmutableList<ConsensusAnomaly> consensus;

  AnomalyReport(String metricId, ImmutableList<AnomalyRecord> zScore,
      ImmutableList<AnomalyRecord> iqr, ImmutableList<AnomalyRecord> isolation,
      ImmutableList<AnomalyRecord> seasonal, ImmutableList<ConsensusAnomaly> consensus) {
    this.metricId = metricId;
    this.zScore = zScore;
    this.iqr = iqr;
    this.isolation = isolation;
    this.seasonal = seasonal;
    this.consensus = consensus;
  }

  public String getMetricId() {
    return metricId;
  }

  public ImmutableList<AnomalyRecord> getZScore() {
    return zScore;
  }

  public ImmutableList<AnomalyRecord> getIqr() {
    return iqr;
  }

  public ImmutableList<AnomalyRecord> getIsolation() {
    return isolation;
  }

  public ImmutableList<AnomalyRecord> getSeasonal() {
    return seasonal;
  }

  public ImmutableList<AnomalyRecord> get(AnomalyMethod method) {
    switch (method) {
      case ZSCORE:
        return zScore;
      case IQR:
        return iqr;
      case SEASONAL:
        return seasonal;
      default:
        return isolation;
    }
  }

  /** Indices flagged by any method, ascending. */
  public ImmutableSortedSet<Integer> getUnion() {
    ImmutableSortedSet.Builder<Integer> union = ImmutableSortedSet.naturalOrder();
    for (AnomalyMethod method : AnomalyMethod.values()) {
      for (AnomalyRecord record : get(method)) {
        union.add(record.getIndex());
      }
    }
    return union.build();
  }

  /** Points flagged by at least the configured number of methods, by index. */
  public ImmutableList<ConsensusAnomaly> getConsensus() {
    return consensus;
  }

  public boolean isEmpty() {
    return zScore.isEmpty() && iqr.isEmpty() && isolation.isEmpty() && seasonal.isEmpty();
  }
}
