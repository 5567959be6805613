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

import net.larse.tsa.timeseries.AnalysisStatus;

/**
 * Change points in the behaviour of the relative changes and the segments of values they delimit.
 * The strength is the largest jump between the means of adjacent segments, in units of the
 * series' standard deviation and at most 1.
 */
public final class RegimePattern extends Pattern {
  static final String NO_REGIME_CHANGES = "no_regime_changes";

  private final ImmutableList<Integer> changePoints;
  private final ImmutableList<RegimeSegment> segments;

  RegimePattern(ImmutableList<Integer> changePoints, ImmutableList<RegimeSegment> segments,
      double strength) {
    super(PatternType.REGIME, AnalysisStatus.OK, true, strength, "");
    this.changePoints = changePoints;
    this.segments = segments;
  }

  private RegimePattern(AnalysisStatus status, String reason) {
    super(PatternType.REGIME, status, false, 0, reason);
    this.changePoints = ImmutableList.of();
    this.segments = ImmutableList.of();
  }

  static RegimePattern notDetected() {
    return new RegimePattern(AnalysisStatus.OK, NO_REGIME_CHANGES);
  }

  static RegimePattern insufficientData(String detail) {
    return new RegimePattern(AnalysisStatus.insufficientData(detail), "");
  }

  /** Indices where a new segment starts, ascending. */
  public ImmutableList<Integer> getChangePoints() {
    return changePoints;
  }

  public ImmutableList<RegimeSegment> getSegments() {
    return segments;
  }

  public int getRegimeCount() {
    return segments.size();
  }

  /** Mean segment length; 0 when there are no segments. */
  public double getAverageRegimeLength() {
    if (segments.isEmpty()) {
      return 0;
    }
    double total = 0;
    for (RegimeSegment segment : segments) {
      total += segment.getLength();
    }
    return total / segments.size();
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    if (!isDetected()) {
      return ImmutableMap.of();
    }
    return ImmutableMap.of(
        "regimeCount", (double) segments.size(),
        "averageRegimeLength", getAverageRegimeLength(),
        "strength", getStrength());
  }
}
