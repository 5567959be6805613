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

import net.larse.tsa.helper.StatisticsKernel;

import java.util.Arrays;

/** Summary statistics of one window of values, used as a point for clustering. */
public final class FeatureVector {
  public static final int DIMENSIONS = 7;

  private final double mean;
  private final double standardDeviation;
  private final double min;
  private final double max;
  private final double skewness;
  private final double kurtosis;

  private FeatureVector(double mean, double standardDeviation, double min, double max,
      double skewness, double kurtosis) {
    this.mean = mean;
    this.standardDeviation = standardDeviation;
    this.min = min;
    this.max = max;
    this.skewness = skewness;
    this.kurtosis = kurtosis;
  }

  /** Features of a non-empty window, with population moments. */
  public static FeatureVector of(double[] window) {
    double[] sorted = window.clone();
    Arrays.sort(sorted);
    return new FeatureVector(StatisticsKernel.mean(window),
        StatisticsKernel.populationStandardDeviation(window), sorted[0],
        sorted[sorted.length - 1], StatisticsKernel.skewness(window),
        StatisticsKernel.kurtosis(window));
  }

  public double getMean() {
    return mean;
  }

  public double getStandardDeviation() {
    return standardDeviation;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getRange() {
    return max - min;
  }

  public double getSkewness() {
    return skewness;
  }

  /** Excess kurtosis. */
  public double getKurtosis() {
    return kurtosis;
  }

  /** {mean, sd, min, max, range, skewness, kurtosis}. */
  public double[] toArray() {
    return new double[] {mean, standardDeviation, min, max, getRange(), skewness, kurtosis};
  }
}
