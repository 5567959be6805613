package net.larse.tsa.timeseries;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

public class MetricSeriesTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  public void testIndexedSeries() {
    MetricSeries series = MetricSeries.indexed("cpu", START, Duration.ofHours(1), 1, 2, 3);
    assertEquals(3, series.size());
    assertEquals(START.plus(Duration.ofHours(2)), series.timestampAt(2));
    assertArrayEquals(new double[] {1, 2, 3}, series.values(), 0);
  }

  @Test
  public void testValuesAreCopied() {
    MetricSeries series = MetricSeries.indexed("cpu", START, Duration.ofHours(1), 1, 2, 3);
    series.values()[0] = 100;
    assertEquals(1, series.valueAt(0), 0);
  }

  @Test(expected = InvalidSeriesException.class)
  public void testRejectsNonIncreasingTimestamps() {
    new MetricSeries("cpu", ImmutableList.of(new DataPoint(START, 1), new DataPoint(START, 2)));
  }

  @Test(expected = InvalidSeriesException.class)
  public void testRejectsNonFiniteValues() {
    MetricSeries.indexed("cpu", START, Duration.ofHours(1), 1, Double.NaN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsEmptyId() {
    MetricSeries.indexed(" ", START, Duration.ofHours(1), 1, 2);
  }

  @Test
  public void testWindowing() {
    MetricSeries series = MetricSeries.indexed("cpu", START, Duration.ofDays(1),
        1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    assertArrayEquals(new double[] {3, 4}, series.subSeries(2, 4).values(), 0);
    assertArrayEquals(new double[] {8, 9, 10},
        series.since(START.plus(Duration.ofDays(7))).values(), 0);
    Instant now = START.plus(Duration.ofDays(9));
    assertEquals(4, series.within(TimeWindow.parse("3d"), now).size());
    assertTrue(series.since(now.plusSeconds(1)).isEmpty());
  }

  @Test
  public void testTimeWindowLabels() {
    assertEquals(Duration.ofHours(12), TimeWindow.parse("12h").getDuration());
    assertEquals(Duration.ofDays(7), TimeWindow.parse("7d").getDuration());
    assertEquals(Duration.ofDays(14), TimeWindow.parse("2w").getDuration());
    assertEquals(Duration.ofDays(90), TimeWindow.parse("90D").getDuration());
    assertEquals(TimeWindow.DEFAULT, TimeWindow.parse("last month").getDuration());
    assertEquals(TimeWindow.DEFAULT, TimeWindow.parse("0d").getDuration());
    assertEquals(START, TimeWindow.parse("1d").cutoff(START.plus(Duration.ofDays(1))));
  }
}
