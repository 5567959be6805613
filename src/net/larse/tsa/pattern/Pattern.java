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
import com.google.common.collect.ImmutableMap;

import net.larse.tsa.timeseries.AnalysisStatus;

/**
 * The outcome of one pattern search over a series. Subclasses add the measurements specific to
 * their pattern type.
 *
 * <p>A pattern that was not detected carries a reason: the insufficient-data reason of its status
 * when the series was too short, otherwise a label such as "no_cyclical_pattern".
 */
public abstract class Pattern {
  private final PatternType type;
  private final AnalysisStatus status;
  private final boolean detected;
  private final double strength;
  private final String reason;

  protected Pattern(PatternType type, AnalysisStatus status, boolean detected, double strength,
      String reason) {
    this.type = Preconditions.checkNotNull(type);
    this.status = Preconditions.checkNotNull(status);
    this.detected = detected;
    this.strength = strength;
    this.reason = status.isOk() ? Preconditions.checkNotNull(reason) : status.getReason();
  }

  public PatternType getType() {
    return type;
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public boolean isDetected() {
    return detected;
  }

  public double getStrength() {
    return strength;
  }

  /** Empty when detected. */
  public String getReason() {
    return reason;
  }

  /** The numeric measurements of this pattern, by name. Empty when the status is not OK. */
  public abstract ImmutableMap<String, Double> getParameters();

  @Override
  public String toString() {
    if (detected) {
      return String.format("%s(strength=%.4f)", type, strength);
    }
    return String.format("%s(not detected: %s)", type, reason);
  }
}
