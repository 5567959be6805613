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
package net.larse.tsa.trend;

import com.google.common.collect.ImmutableMap;

import net.larse.tsa.timeseries.AnalysisStatus;

/** Linear trend of a series together with the competing candidate fits. */
public final class TrendResult {
  private final AnalysisStatus status;
  private final TrendDirection direction;
  private final FitType bestFit;
  private final double slope;
  private final double intercept;
  private final double rSquared;
  private final double pValue;
  private final Confidence confidence;
  private final double confidenceScore;
  private final int sampleSize;
  private final ImmutableMap<FitType, CandidateFit> candidates;

  TrendResult(AnalysisStatus status, TrendDirection direction, FitType bestFit, double slope,
      double intercept, double rSquared, double pValue, Confidence confidence,
      double confidenceScore, int sampleSize, ImmutableMap<FitType, CandidateFit> candidates) {
    this.status = status;
    this.direction = direction;
    this.bestFit = bestFit;
    this.slope = slope;
    this.intercept = intercept;
    this.rSquared = rSquared;
    this.pValue = pValue;
    this.confidence = confidence;
    this.confidenceScore = confidenceScore;
    this.sampleSize = sampleSize;
    this.candidates = candidates;
  }

  static TrendResult insufficientData(int sampleSize) {
    return new TrendResult(AnalysisStatus.insufficientData("trend needs at least 2 points"),
        TrendDirection.INSUFFICIENT_DATA, FitType.NONE, 0, 0, 0, 1, Confidence.LOW, 0, sampleSize,
        ImmutableMap.<FitType, CandidateFit>of());
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public TrendDirection getDirection() {
    return direction;
  }

  public FitType getBestFit() {
    return bestFit;
  }

  /** Slope of the linear fit, per sample. */
  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }

  /** Absolute linear slope. */
  public double getStrength() {
    return Math.abs(slope);
  }

  /** R-squared of the linear fit. */
  public double getRSquared() {
    return rSquared;
  }

  public double getPValue() {
    return pValue;
  }

  public Confidence getConfidence() {
    return confidence;
  }

  /** R-squared discounted for short series. */
  public double getConfidenceScore() {
    return confidenceScore;
  }

  public int getSampleSize() {
    return sampleSize;
  }

  public ImmutableMap<FitType, CandidateFit> getCandidates() {
    return candidates;
  }

  /** The candidate with the highest R-squared, or null when no candidate explains anything. */
  public CandidateFit getBestCandidate() {
    return candidates.get(bestFit);
  }

  @Override
  public String toString() {
    return String.format("TrendResult[%s, slope=%.4f, r2=%.4f, p=%.4g, best=%s]",
        direction, slope, rSquared, pValue, bestFit);
  }
}
