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
package net.larse.tsa.seasonal;

import com.google.common.collect.ImmutableList;

import net.larse.tsa.timeseries.AnalysisStatus;

/** Decomposition of a series at one period, with strength measures of its seasonal profile. */
public final class SeasonalityResult {
  private final AnalysisStatus status;
  private final int period;
  private final boolean periodDetected;
  private final SeasonalDecomposition decomposition;
  private final double seasonalStrength;
  private final double autocorrelationStrength;
  private final double amplitude;
  private final double phase;
  private final ImmutableList<Harmonic> harmonics;

  SeasonalityResult(AnalysisStatus status, int period, boolean periodDetected,
      SeasonalDecomposition decomposition, double seasonalStrength,
      double autocorrelationStrength, double amplitude, double phase,
      ImmutableList<Harmonic> harmonics) {
    this.status = status;
    this.period = period;
    this.periodDetected = periodDetected;
    this.decomposition = decomposition;
    this.seasonalStrength = seasonalStrength;
    this.autocorrelationStrength = autocorrelationStrength;
    this.amplitude = amplitude;
    this.phase = phase;
    this.harmonics = harmonics;
  }

  static SeasonalityResult insufficientData(int period, boolean periodDetected, String detail) {
    return new SeasonalityResult(AnalysisStatus.insufficientData(detail), period, periodDetected,
        null, 0, 0, 0, 0, ImmutableList.<Harmonic>of());
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public int getPeriod() {
    return period;
  }

  /** True when the period came from the autocorrelation search rather than a default. */
  public boolean isPeriodDetected() {
    return periodDetected;
  }

  /** The decomposition, or null when the status is not OK. */
  public SeasonalDecomposition getDecomposition() {
    return decomposition;
  }

  /** var(seasonal) / (mean(seasonal)^2 + var(seasonal)), 0 for a flat profile. */
  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  /** Autocorrelation of the centered series at the period. */
  public double getAutocorrelationStrength() {
    return autocorrelationStrength;
  }

  /** Standard deviation of the seasonal profile. */
  public double getAmplitude() {
    return amplitude;
  }

  /** Position of the profile maximum as an angle in [0, 2 pi). */
  public double getPhase() {
    return phase;
  }

  public ImmutableList<Harmonic> getHarmonics() {
    return harmonics;
  }

  @Override
  public String toString() {
    return String.format("SeasonalityResult[%s, period=%d, strength=%.4f, acf=%.4f]",
        status, period, seasonalStrength, autocorrelationStrength);
  }
}
