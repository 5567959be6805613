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

import net.larse.tsa.timeseries.AnalysisStatus;

/** Outcome of checking the newest point of a series against its trailing window. */
public final class StreamingVerdict {
  private final AnalysisStatus status;
  private final ImmutableList<AnomalyRecord> anomalies;

  StreamingVerdict(AnalysisStatus status, ImmutableList<AnomalyRecord> anomalies) {
    this.status = status;
    this.anomalies = anomalies;
  }

  static StreamingVerdict insufficientData(String detail) {
    return new StreamingVerdict(AnalysisStatus.insufficientData(detail),
        ImmutableList.<AnomalyRecord>of());
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  /** One record per method that flagged the newest point; empty when not anomalous. */
  public ImmutableList<AnomalyRecord> getAnomalies() {
    return anomalies;
  }

  public boolean isAnomalous() {
    return !anomalies.isEmpty();
  }
}
