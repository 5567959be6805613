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
import net.larse.tsa.trend.TrendDirection;

/**
 * Volatility of the relative changes of a series: its overall level, how it clusters in time and
 * the low/medium/high regimes it moves through. Detected when high volatility clusters or more
 * than one regime occurs.
 */
public final class VolatilityPattern extends Pattern {
  static final String STABLE_VOLATILITY = "stable_volatility";

  private final double[] rollingVolatility;
  private final VolatilityClustering clustering;
  private final ImmutableList<VolatilityRegime> regimes;
  private final TrendDirection volatilityTrend;

  VolatilityPattern(double currentVolatility, double[] rollingVolatility,
      VolatilityClustering clustering, ImmutableList<VolatilityRegime> regimes,
      TrendDirection volatilityTrend) {
    this(AnalysisStatus.OK, clustering.isDetected() || regimes.size() > 1, currentVolatility,
        rollingVolatility, clustering, regimes, volatilityTrend);
  }

  private VolatilityPattern(AnalysisStatus status, boolean detected, double currentVolatility,
      double[] rollingVolatility, VolatilityClustering clustering,
      ImmutableList<VolatilityRegime> regimes, TrendDirection volatilityTrend) {
    super(PatternType.VOLATILITY, status, detected, currentVolatility,
        detected ? "" : STABLE_VOLATILITY);
    this.rollingVolatility = rollingVolatility.clone();
    this.clustering = clustering;
    this.regimes = regimes;
    this.volatilityTrend = volatilityTrend;
  }

  static VolatilityPattern insufficientData(String detail) {
    return new VolatilityPattern(AnalysisStatus.insufficientData(detail), false, 0, new double[0],
        new VolatilityClustering(0, 0), ImmutableList.<VolatilityRegime>of(),
        TrendDirection.INSUFFICIENT_DATA);
  }

  /** Population standard deviation of all relative changes. */
  public double getCurrentVolatility() {
    return getStrength();
  }

  public double[] getRollingVolatility() {
    return rollingVolatility.clone();
  }

  public VolatilityClustering getClustering() {
    return clustering;
  }

  public ImmutableList<VolatilityRegime> getRegimes() {
    return regimes;
  }

  /** Direction of the rolling volatility, with a dead-band of 0.01 per step. */
  public TrendDirection getVolatilityTrend() {
    return volatilityTrend;
  }

  @Override
  public ImmutableMap<String, Double> getParameters() {
    if (!getStatus().isOk()) {
      return ImmutableMap.of();
    }
    return ImmutableMap.of(
        "currentVolatility", getStrength(),
        "clusterCount", (double) clustering.getCount(),
        "regimeCount", (double) regimes.size());
  }
}
