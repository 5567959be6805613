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

import com.google.common.collect.ImmutableSet;

import java.time.Instant;

/** A point flagged by several methods at once. */
public final class ConsensusAnomaly {
  private final int index;
  private final Instant timestamp;
  private final double value;
  private final ImmutableSet<AnomalyMethod> methods;
  private final double meanScore;
  private final Severity severity;
  private final double contextScore;
  private final double magnitudeScore;
  private final double temporalScore;

  ConsensusAnomaly(int index, Instant timestamp, double value, ImmutableSet<AnomalyMethod> methods,
      double meanScore, Severity severity, double contextScore, double magnitudeScore,
      double temporalScore) {
    this.index = index;
    this.timestamp = timestamp;
    this.value = value;
    this.methods = methods;
    this.meanScore = meanScore;
    this.severity = severity;
    this.contextScore = contextScore;
    this.magnitudeScore = magnitudeScore;
    this.temporalScore = temporalScore;
  }

  public int getIndex() {
    return index;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  public ImmutableSet<AnomalyMethod> getMethods() {
    return methods;
  }

  /** Share of all methods that flagged the point. */
  public double getAgreement() {
    return (double) methods.size() / AnomalyMethod.values().length;
  }

  /** Mean of the method scores. The scores are on different scales. */
  public double getMeanScore() {
    return meanScore;
  }

  /** The highest severity any method assigned. */
  public Severity getSeverity() {
    return severity;
  }

  /** Deviation from the neighbouring points, in [0, 1]. */
  public double getContextScore() {
    return contextScore;
  }

  /** Deviation from the whole series, in [0, 1]. */
  public double getMagnitudeScore() {
    return magnitudeScore;
  }

  /** Night and weekend weight of the local timestamp, in [0, 0.5]. */
  public double getTemporalScore() {
    return temporalScore;
  }

  /** Mean of the method score and the context, magnitude and temporal scores. */
  public double getScore() {
    return (meanScore + contextScore + magnitudeScore + temporalScore) / 4;
  }

  @Override
  public String toString() {
    return String.format("Consensus@%d%s", index, methods);
  }
}
