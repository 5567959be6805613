package net.larse.tsa.timeseries;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TimeSeriesUtilsTest {

  @Test
  public void testDifference() {
    double[] squares = {1, 4, 9, 16, 25};
    assertArrayEquals(new double[] {3, 5, 7, 9}, TimeSeriesUtils.difference(squares, 1), 0);
    assertArrayEquals(new double[] {2, 2, 2}, TimeSeriesUtils.difference(squares, 2), 0);
    double[] copy = TimeSeriesUtils.difference(squares, 0);
    assertArrayEquals(squares, copy, 0);
    assertNotSame(squares, copy);
  }

  @Test
  public void testReturnsReplaceNonFiniteChanges() {
    assertArrayEquals(new double[] {1, 0, 0.5},
        TimeSeriesUtils.returns(new double[] {1, 2, 2, 3}), 1e-12);
    // the change from 0 divides by zero
    assertArrayEquals(new double[] {0, 0}, TimeSeriesUtils.returns(new double[] {0, 5, 5}), 0);
    assertEquals(0, TimeSeriesUtils.returns(new double[] {7}).length);
  }

  @Test
  public void testAlternatingSeriesPeaksAtLagTwo() {
    double[] values = new double[20];
    for (int i = 0; i < values.length; i++) {
      values[i] = i % 2 == 0 ? 1 : 100;
    }
    double[] acf = TimeSeriesUtils.autocorrelations(TimeSeriesUtils.center(values));
    assertEquals(10, acf.length);
    assertEquals(1, acf[0], 1e-12);
    assertEquals(-1, acf[1], 1e-12);
    List<AutocorrelationPeak> peaks = TimeSeriesUtils.peaksByLag(acf);
    assertEquals(2, peaks.get(0).getLag());
    assertEquals(1, peaks.get(0).getValue(), 1e-12);
  }

  @Test
  public void testDefaultLagLimit() {
    assertEquals(5, TimeSeriesUtils.defaultLagLimit(10));
    assertEquals(6, TimeSeriesUtils.defaultLagLimit(11));
    assertEquals(20, TimeSeriesUtils.defaultLagLimit(100));
  }

  @Test
  public void testRollingStandardDeviationExcludesLastWindow() {
    double[] rolling = TimeSeriesUtils.rollingStandardDeviation(new double[] {1, 1, 3, 3, 5}, 2);
    assertArrayEquals(new double[] {0, 1, 0}, rolling, 1e-12);
  }

  @Test
  public void testDirectionDeadBand() {
    assertEquals(TimeSeriesUtils.Direction.INCREASING, TimeSeriesUtils.direction(0.2, 0.1));
    assertEquals(TimeSeriesUtils.Direction.DECREASING, TimeSeriesUtils.direction(-0.2, 0.1));
    assertEquals(TimeSeriesUtils.Direction.STABLE, TimeSeriesUtils.direction(0.1, 0.1));
  }
}
