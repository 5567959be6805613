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

import net.larse.tsa.seasonal.Harmonic;
import net.larse.tsa.timeseries.AnalysisStatus;

/** The strongest autocorrelation peak of a series and the weaker peaks behind it. */
public final class CyclicalPattern extends Pattern {
  static final String NO_CYCLICAL_PATTERN = "no_cyclical_pattern";

  private final int primaryPeriod;
  private final ImmutableList<Integer> secondaryPeriods;
  private final double confidence;
  private final ImmutableList<Harmonic> harmonics;

  CyclicalPattern(int primaryPeriod, double primaryStrength,
      ImmutableList<Integer> secondaryPeriods, double confidence,
      ImmutableList<Harmonic> harmonics) {
    super(PatternType.CYCLICAL, AnalysisStatus.OK, true, primaryStrength, "");
    this.primaryPeriod = primaryPeriod;
    this.secondaryPeriods = secondaryPeriods;
    this.confidence = confidence;
    this.harmonics = harmonics;
  }

  private CyclicalPattern(AnalysisStatus status, String reason) {
    super(PatternType.CYCLICAL, status, false, 0, reason);
    this.primaryPeriod = 0;
    this.secondaryPeriods = ImmutableList.of();
    this.confidence = 0;
    this.harmonics = ImmutableList.of();
  }

  static CyclicalPattern notDetected() {
    return new CyclicalPattern(AnalysisStatus.OK, NO_CYCLICAL_PATTERN);
  }

  static CyclicalPattern insufficientData(String detail) {
    return new CyclicalPattern(AnalysisStatus.insufficientData(detail), "");
  }

  /** Lag of the strongest peak; 0 when not detected. */
  public int getPrimaryPeriod() {
    return primaryPeriod;
  }

  /** Autocorrelation at the primary period. */
  public double getPrimaryStrength() {
    return getStrength();
  }

  /** Lags of the remaining peaks, strongest first. */
  public ImmutableList<Integer> getSecondaryPeriods() {
    return secondaryPeriods;
  }

  /** peak / (peak + mean absolute autocorrelation), at most 1. */
  public double getConfidence() {
    return confidence;
  }

  public ImmutableList<Harmonic> getHarmonics() {
    return harmonics;
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    if (!isDetected()) {
      return ImmutableMap.of();
    }
    return ImmutableMap.of(
        "primaryPeriod", (double) primaryPeriod,
        "primaryStrength", getStrength(),
        "confidence", confidence,
        "harmonicCount", (double) harmonics.size());
  }
}
