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

/** The patterns searched for in one series, by type. */
public final class PatternReport {
  private final String metricId;
  private final ImmutableMap<PatternType, Pattern> patterns;

  PatternReport(String metricId, ImmutableMap<PatternType, Pattern> patterns) {
    this.metricId = metricId;
    this.patterns = patterns;
  }

  public String getMetricId() {
    return metricId;
  }

  public ImmutableMap<PatternType, Pattern> getPatterns() {
    return patterns;
  }

  /** The pattern of type cast to its class, or null if that type was not searched. */
  public <P extends Pattern> P get(PatternType type, Class<P> patternClass) {
    Pattern pattern = patterns.get(type);
    return pattern == null ? null : patternClass.cast(pattern);
  }

  public ImmutableList<Pattern> getDetected() {
    ImmutableList.Builder<Pattern> detected = ImmutableList.builder();
    for (Pattern pattern : patterns.values()) {
      if (pattern.isDetected()) {
        detected.add(pattern);
      }
    }
    return detected.build();
  }

  @Override
  public String toString() {
    return metricId + ": " + patterns.values();
  }
}
