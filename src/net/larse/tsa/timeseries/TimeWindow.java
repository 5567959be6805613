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
package net.larse.tsa.timeseries;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A lookback window such as "7d", parsed from a label of the form {@code <n>h|d|w}. */
public final class TimeWindow {
  private static final Logger log = LoggerFactory.getLogger(TimeWindow.class);
  private static final Pattern LABEL = Pattern.compile("(\\d{1,6})([hdw])");

  public static final Duration DEFAULT = Duration.ofDays(30);

  private final String label;
  private final Duration duration;

  private TimeWindow(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  /** Parses label; an unrecognised label falls back to 30 days. */
  public static TimeWindow parse(String label) {
    Preconditions.checkNotNull(label, "label");
    Matcher matcher = LABEL.matcher(label.trim().toLowerCase(Locale.ROOT));
    if (!matcher.matches() || Long.parseLong(matcher.group(1)) == 0) {
      log.debug("Unrecognised time window '{}', using {}", label, DEFAULT);
      return new TimeWindow(label, DEFAULT);
    }
    long amount = Long.parseLong(matcher.group(1));
    Duration duration;
    switch (matcher.group(2)) {
      case "h":
        duration = Duration.ofHours(amount);
        break;
      case "w":
        duration = Duration.ofDays(7 * amount);
        break;
      default:
        duration = Duration.ofDays(amount);
        break;
    }
    return new TimeWindow(label, duration);
  }

  public String getLabel() {
    return label;
  }

  public Duration getDuration() {
    return duration;
  }

  /** The earliest instant inside the window that ends at now. */
  public Instant cutoff(Instant now) {
    return now.minus(duration);
  }

  @Override
  public String toString() {
    return label + " (" + duration + ")";
  }
}
