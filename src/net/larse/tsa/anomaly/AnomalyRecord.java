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

import java.time.Instant;

/** One point flagged by one detection method. */
public final class AnomalyRecord {
  private final int index;
  private final Instant timestamp;
  private final double value;
  private final AnomalyMethod method;
  private final double score;
  private final Severity severity;
  private final AnomalyDirection direction;

  public AnomalyRecord(int index, Instant timestamp, double value, AnomalyMethod method,
      double score, Severity severity, AnomalyDirection direction) {
    this.index = index;
    this.timestamp = timestamp;
    this.value = value;
    this.method = method;
    this.score = score;
    this.severity = severity;
    this.direction = direction;
  }

  /** Position of the point in the analyzed series. */
  public int getIndex() {
    return index;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  public AnomalyMethod getMethod() {
    return method;
  }

  /**
   * Method-specific score: |z| for z-scores, distance beyond the fence in interquartile ranges for
   * IQR, and the isolation ratio in [0, 1] for isolation.
   */
  public double getScore() {
    return score;
  }

  public Severity getSeverity() {
    return severity;
  }

  public AnomalyDirection getDirection() {
    return direction;
  }

  @Override
  public String toString() {
    return String.format("%s@%d[%s, value=%.4f, score=%.4f, %s]",
        method, index, severity, value, score, direction);
  }
}
