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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.tsa.helper.StatisticsKernel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Autocorrelation, differencing and windowing utilities over raw value arrays.
 *
 * <p>Autocorrelation arrays are indexed by lag. Index 0 holds 1 (or 0 for an all-zero series) and
 * is never a peak.
 */
public class TimeSeriesUtils {
  /** Largest lag searched by default, exclusive. */
  public static final int MAX_AUTOCORRELATION_LAG = 20;

  /** Autocorrelation values below this never form a peak. */
  public static final double PEAK_THRESHOLD = 0.2;

  /** Values minus their mean. */
  public static double[] center(double[] values) {
    double mean = StatisticsKernel.mean(values);
    double[] centered = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      centered[i] = values[i] - mean;
    }
    return centered;
  }

  /** Number of lags searched by default: lags 1 .. below min(n / 2, 20). */
  public static int defaultLagLimit(int n) {
    // lag < n / 2 with real division
    int limit = (n + 1) / 2;
    return Math.min(limit, MAX_AUTOCORRELATION_LAG);
  }

  /** Autocorrelation of the centered series for lags 0 .. below defaultLagLimit(n). */
  public static double[] autocorrelations(double[] centered) {
    return autocorrelations(centered, defaultLagLimit(centered.length));
  }

  /**
   * Autocorrelation for lags 0 .. below lagLimit. The value at lag k is
   * sum(c[i] * c[i - k]) / sum(c[i]^2), both sums over i = k .. n - 1.
   */
  public static double[] autocorrelations(double[] centered, int lagLimit) {
    Preconditions.checkArgument(lagLimit >= 0, "Negative lag limit: %s", lagLimit);
    double[] acf = new double[Math.max(lagLimit, 1)];
    for (int lag = 0; lag < acf.length; lag++) {
      acf[lag] = autocorrelation(centered, lag);
    }
    return acf;
  }

  public static double autocorrelation(double[] centered, int lag) {
    double numerator = 0;
    double denominator = 0;
    for (int i = lag; i < centered.length; i++) {
      numerator += centered[i] * centered[i - lag];
      denominator += centered[i] * centered[i];
    }
    return denominator > 0 ? numerator / denominator : 0;
  }

  /**
   * Interior local maxima of acf above {@link #PEAK_THRESHOLD}, in lag order. A lag is interior
   * when both neighbouring lags (excluding lag 0) were computed.
   */
  public static List<AutocorrelationPeak> peaksByLag(double[] acf) {
    List<AutocorrelationPeak> peaks = new ArrayList<>();
    for (int lag = 2; lag < acf.length - 1; lag++) {
      double curr = acf[lag];
      if (curr > acf[lag - 1] && curr > acf[lag + 1] && curr > PEAK_THRESHOLD) {
        peaks.add(new AutocorrelationPeak(lag, curr));
      }
    }
    return peaks;
  }

  /** The peaks of acf, strongest first; ties keep lag order. */
  public static ImmutableList<AutocorrelationPeak> peaksByStrength(double[] acf) {
    List<AutocorrelationPeak> peaks = peaksByLag(acf);
    peaks.sort(Comparator.comparingDouble(AutocorrelationPeak::getValue).reversed());
    return ImmutableList.copyOf(peaks);
  }

  /** Mean absolute autocorrelation over lags 1 and up. */
  public static double meanAbsoluteAutocorrelation(double[] acf) {
    if (acf.length < 2) {
      return 0;
    }
    double sum = 0;
    for (int lag = 1; lag < acf.length; lag++) {
      sum += Math.abs(acf[lag]);
    }
    return sum / (acf.length - 1);
  }

  /** Applies first differences order times. Each pass shortens the series by one. */
  public static double[] difference(double[] values, int order) {
    Preconditions.checkArgument(order >= 0, "Negative differencing order: %s", order);
    double[] result = values;
    for (int pass = 0; pass < order && result.length > 0; pass++) {
      double[] next = new double[result.length - 1];
      for (int i = 1; i < result.length; i++) {
        next[i - 1] = result[i] - result[i - 1];
      }
      result = next;
    }
    return result == values ? values.clone() : result;
  }

  /** Relative changes (v[i] - v[i-1]) / v[i-1]; non-finite changes are 0. */
  public static double[] returns(double[] values) {
    if (values.length < 2) {
      return new double[0];
    }
    double[] returns = new double[values.length - 1];
    for (int i = 1; i < values.length; i++) {
      returns[i - 1] = StatisticsKernel.finiteOr((values[i] - values[i - 1]) / values[i - 1], 0);
    }
    return returns;
  }

  /**
   * Population standard deviation of the windows values[i - window, i) for i = window .. n - 1.
   * The window ending at the last value is not included.
   */
  public static double[] rollingStandardDeviation(double[] values, int window) {
    Preconditions.checkArgument(window >= 1, "Window must be positive: %s", window);
    DoubleArrayList result = new DoubleArrayList();
    for (int i = window; i < values.length; i++) {
      double[] slice = new double[window];
      System.arraycopy(values, i - window, slice, 0, window);
      result.add(StatisticsKernel.populationStandardDeviation(slice));
    }
    return result.toDoubleArray();
  }

  /** Classifies a slope with a symmetric dead-band. */
  public static Direction direction(double slope, double deadBand) {
    if (slope > deadBand) {
      return Direction.INCREASING;
    }
    if (slope < -deadBand) {
      return Direction.DECREASING;
    }
    return Direction.STABLE;
  }

  /** Direction of a slope. */
  public enum Direction {
    INCREASING,
    DECREASING,
    STABLE
  }
}
