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
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * An ordered series of observations of one metric.
 *
 * <p>Timestamps are strictly increasing and every value is finite; both are checked at
 * construction and reported as {@link InvalidSeriesException}.
 */
public final class MetricSeries {
  private final String metricId;
  private final ImmutableList<DataPoint> points;
  private final double[] values;

  public MetricSeries(String metricId, List<DataPoint> points) {
    if (metricId == null || metricId.trim().isEmpty()) {
      throw new InvalidSeriesException("Metric id is empty");
    }
    Preconditions.checkNotNull(points, "points");
    this.metricId = metricId;
    this.points = ImmutableList.copyOf(points);
    this.values = new double[this.points.size()];
    for (int i = 0; i < values.length; i++) {
      DataPoint point = this.points.get(i);
      if (Double.isNaN(point.getValue()) || Double.isInfinite(point.getValue())) {
        throw new InvalidSeriesException("Non-finite value %s at index %d of %s",
            point.getValue(), i, metricId);
      }
      if (i > 0 && !point.getTimestamp().isAfter(this.points.get(i - 1).getTimestamp())) {
        throw new InvalidSeriesException("Timestamps of %s not strictly increasing at index %d",
            metricId, i);
      }
      values[i] = point.getValue();
    }
  }

  /** Builds a series with evenly spaced timestamps start, start + step, ... */
  public static MetricSeries indexed(String metricId, Instant start, Duration step,
      double... values) {
    Preconditions.checkArgument(!step.isNegative() && !step.isZero(), "Step must be positive");
    ImmutableList.Builder<DataPoint> points = ImmutableList.builder();
    Instant timestamp = start;
    for (double value : values) {
      points.add(new DataPoint(timestamp, value));
      timestamp = timestamp.plus(step);
    }
    return new MetricSeries(metricId, points.build());
  }

  public String getMetricId() {
    return metricId;
  }

  public ImmutableList<DataPoint> getPoints() {
    return points;
  }

  /** The values in time order. Returns a copy. */
  public double[] values() {
    return values.clone();
  }

  public double valueAt(int index) {
    return values[index];
  }

  public Instant timestampAt(int index) {
    return points.get(index).getTimestamp();
  }

  public int size() {
    return values.length;
  }

  public boolean isEmpty() {
    return values.length == 0;
  }

  /** Points between from (incl) and to (excl). */
  public MetricSeries subSeries(int from, int to) {
    Preconditions.checkPositionIndexes(from, to, size());
    return new MetricSeries(metricId, points.subList(from, to));
  }

  /** Points at or after cutoff. */
  public MetricSeries since(Instant cutoff) {
    int from = 0;
    while (from < size() && points.get(from).getTimestamp().isBefore(cutoff)) {
      from++;
    }
    return subSeries(from, size());
  }

  /** Points inside the lookback window ending at now. */
  public MetricSeries within(TimeWindow window, Instant now) {
    return since(window.cutoff(now));
  }

  @Override
  public String toString() {
    return "MetricSeries[" + metricId + ", " + size() + " points]";
  }
}
