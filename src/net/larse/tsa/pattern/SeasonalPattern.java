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

import net.larse.tsa.seasonal.CalendarAnalysis;
import net.larse.tsa.seasonal.CalendarPattern;
import net.larse.tsa.seasonal.CalendarPeriod;

import java.util.Locale;
import java.util.Map;

/** Calendar effects (hour of day, day of week, day of month) as a pattern. */
public final class SeasonalPattern extends Pattern {
  static final String NO_CALENDAR_PATTERN = "no_calendar_pattern";

  private final CalendarAnalysis calendar;

  SeasonalPattern(CalendarAnalysis calendar) {
    super(PatternType.SEASONAL, calendar.getStatus(), calendar.isDetected(),
        calendar.getOverallStrength(), calendar.isDetected() ? "" : NO_CALENDAR_PATTERN);
    this.calendar = calendar;
  }

  public CalendarAnalysis getCalendar() {
    return calendar;
  }

  /** The strongest detected calendar period, or null when none was detected. */
  public CalendarPeriod getDominantPeriod() {
    return calendar.getDominantPeriod();
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    ImmutableMap.Builder<String, Double> parameters = ImmutableMap.builder();
    for (Map.Entry<CalendarPeriod, CalendarPattern> entry : calendar.getPatterns().entrySet()) {
      if (entry.getValue().isDetected()) {
        parameters.put(entry.getKey().name().toLowerCase(Locale.ROOT) + ".strength",
            entry.getValue().getStrength());
      }
    }
    return parameters.build();
  }
}
