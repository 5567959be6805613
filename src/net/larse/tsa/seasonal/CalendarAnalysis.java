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

import com.google.common.collect.ImmutableMap;

import net.larse.tsa.timeseries.AnalysisStatus;

/** Daily, weekly and monthly calendar patterns of one series. */
public final class CalendarAnalysis {
  private final AnalysisStatus status;
  private final ImmutableMap<CalendarPeriod, CalendarPattern> patterns;

  CalendarAnalysis(AnalysisStatus status, ImmutableMap<CalendarPeriod, CalendarPattern> patterns) {
    this.status = status;
    this.patterns = patterns;
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  /** Every analyzed bucketing, detected or not. */
  public ImmutableMap<CalendarPeriod, CalendarPattern> getPatterns() {
    return patterns;
  }

  public boolean isDetected() {
    for (CalendarPattern pattern : patterns.values()) {
      if (pattern.isDetected()) {
        return true;
      }
    }
    return false;
  }

  /** Mean strength of the detected patterns, 0 if none. */
  public double getOverallStrength() {
    double sum = 0;
    int count = 0;
    for (CalendarPattern pattern : patterns.values()) {
      if (pattern.isDetected()) {
        sum += pattern.getStrength();
        count++;
      }
    }
    return count == 0 ? 0 : sum / count;
  }

  /** The strongest detected bucketing, or null if none was detected. */
  public CalendarPeriod getDominantPeriod() {
    CalendarPeriod dominant = null;
    double best = 0;
    for (CalendarPattern pattern : patterns.values()) {
      if (pattern.isDetected() && pattern.getStrength() > best) {
        best = pattern.getStrength();
        dominant = pattern.getPeriod();
      }
    }
    return dominant;
  }
}
