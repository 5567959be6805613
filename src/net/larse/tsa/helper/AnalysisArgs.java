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
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Options shared by all analyzers. Each analyzer copies the instance it is given, so later changes
 * to a caller's instance never affect an analyzer that is already built.
 */
public class AnalysisArgs extends AlgorithmBase.ArgsBase {
  @Doc(help = "Lookback label resolved by the caller against its own clock, e.g. 1d, 7d, 30d, 90d.")
  @Optional
  public String timeWindow = "30d";

  @Doc(help = "Minimum number of points required to forecast.")
  @Optional
  public int minDataPoints = 10;

  @Doc(help = "R-squared above which a trend fit is reported with high confidence.")
  @Optional
  public double confidenceThreshold = 0.8;

  @Doc(help = "Anomaly sensitivity in (0, 1]. The z-score threshold is 2 / sensitivity.")
  @Optional
  public double sensitivity = 0.7;

  @Doc(help = "Rolling correlation window. 0 derives min(20, n / 2).")
  @Optional
  public int windowSize = 0;

  @Doc(help = "Number of preceding points a streamed value is compared against.")
  @Optional
  public int anomalyWindow = 24;

  @Doc(help = "Largest lag for lagged correlation. 0 derives min(10, n / 3).")
  @Optional
  public int maxLag = 0;

  @Doc(help = "Number of steps to forecast.")
  @Optional
  public int horizon = 7;

  @Doc(help = "Fraction of the series held out when backtesting a forecaster.")
  @Optional
  public double validationSplit = 0.2;

  @Doc(help = "Multiplier k of the interquartile range for the outlier fences.")
  @Optional
  public double iqrMultiplier = 1.5;

  @Doc(help = "Isolation score above which a point is flagged.")
  @Optional
  public double isolationThreshold = 0.5;

  @Doc(help = "Order of the autoregressive forecaster.")
  @Optional
  public int arOrder = 1;

  @Doc(help = "Number of differencing passes before the autoregressive fit.")
  @Optional
  public int differencingOrder = 1;

  @Doc(help = "Number of k-means clusters for window clustering.")
  @Optional
  public int clusterCount = 3;

  @Doc(help = "Seed of the k-means centroid initialisation.")
  @Optional
  public long randomSeed = 42L;

  @Doc(help = "Number of anomaly methods that must agree for a consensus anomaly.")
  @Optional
  public int minAgreement = 2;

  @Doc(help = "Time zone used to group timestamps into calendar buckets.")
  @Optional
  public String zone = "UTC";

  /**
   * Checks every option against its valid range.
   *
   * @return this
   * @throws IllegalArgumentException if an option is out of range
   */
  public AnalysisArgs validate() {
    Preconditions.checkArgument(timeWindow != null && !timeWindow.isEmpty(), "timeWindow is empty");
    Preconditions.checkArgument(minDataPoints >= 2, "minDataPoints must be >= 2: %s", minDataPoints);
    Preconditions.checkArgument(confidenceThreshold >= 0 && confidenceThreshold <= 1,
        "confidenceThreshold must be in [0, 1]: %s", confidenceThreshold);
    Preconditions.checkArgument(sensitivity > 0 && sensitivity <= 1,
        "sensitivity must be in (0, 1]: %s", sensitivity);
    Preconditions.checkArgument(windowSize == 0 || windowSize >= 2,
        "windowSize must be 0 or >= 2: %s", windowSize);
    Preconditions.checkArgument(anomalyWindow >= 2, "anomalyWindow must be >= 2: %s", anomalyWindow);
    Preconditions.checkArgument(maxLag >= 0, "maxLag must be >= 0: %s", maxLag);
    Preconditions.checkArgument(horizon >= 1, "horizon must be >= 1: %s", horizon);
    Preconditions.checkArgument(validationSplit > 0 && validationSplit < 1,
        "validationSplit must be in (0, 1): %s", validationSplit);
    Preconditions.checkArgument(iqrMultiplier > 0, "iqrMultiplier must be > 0: %s", iqrMultiplier);
    Preconditions.checkArgument(isolationThreshold >= 0 && isolationThreshold <= 1,
        "isolationThreshold must be in [0, 1]: %s", isolationThreshold);
    Preconditions.checkArgument(arOrder >= 1, "arOrder must be >= 1: %s", arOrder);
    Preconditions.checkArgument(differencingOrder >= 0,
        "differencingOrder must be >= 0: %s", differencingOrder);
    Preconditions.checkArgument(clusterCount >= 2, "clusterCount must be >= 2: %s", clusterCount);
    Preconditions.checkArgument(minAgreement >= 1 && minAgreement <= 3,
        "minAgreement must be in [1, 3]: %s", minAgreement);
    Preconditions.checkArgument(zone != null, "zone is null");
    try {
      ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Unknown zone: " + zone, e);
    }
    return this;
  }

  /** Returns an independent copy of these options. */
  public AnalysisArgs copy() {
    AnalysisArgs copy = new AnalysisArgs();
    copy.apply(asMap());
    return copy;
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
