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

import com.google.common.collect.ImmutableMap;

import net.larse.tsa.timeseries.AnalysisStatus;
import net.larse.tsa.trend.CandidateFit;
import net.larse.tsa.trend.FitType;
import net.larse.tsa.trend.TrendDirection;

/** The best fitting trend form, detected when it explains more than 70% of the variance. */
public final class TrendPattern extends Pattern {
  static final String WEAK_TREND = "weak_trend";

  private final FitType bestFit;
  private final double confidence;
  private final TrendDirection direction;
  private final ImmutableMap<FitType, CandidateFit> candidates;

  TrendPattern(boolean detected, FitType bestFit, double confidence, double slope,
      ImmutableMap<FitType, CandidateFit> candidates) {
    super(PatternType.TREND, AnalysisStatus.OK, detected, Math.abs(slope),
        detected ? "" : WEAK_TREND);
    this.bestFit = bestFit;
    this.confidence = confidence;
    this.direction = slope > 0 ? TrendDirection.INCREASING
        : slope < 0 ? TrendDirection.DECREASING : TrendDirection.STABLE;
    this.candidates = candidates;
  }

  private TrendPattern(AnalysisStatus status) {
    super(PatternType.TREND, status, false, 0, "");
    this.bestFit = FitType.NONE;
    this.confidence = 0;
    this.direction = TrendDirection.INSUFFICIENT_DATA;
    this.candidates = ImmutableMap.of();
  }

  static TrendPattern insufficientData(String detail) {
    return new TrendPattern(AnalysisStatus.insufficientData(detail));
  }

  public FitType getBestFit() {
    return bestFit;
  }

  /** R-squared of the best fit. */
  public double getConfidence() {
    return confidence;
  }

  /** Sign of the best fit's linear coefficient, without a dead-band. */
  public TrendDirection getDirection() {
    return direction;
  }

  public ImmutableMap<FitType, CandidateFit> getCandidates() {
    return candidates;
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    if (!getStatus().isOk()) {
      return ImmutableMap.of();
    }
    return ImmutableMap.of("rSquared", confidence, "strength", getStrength());
  }
}
