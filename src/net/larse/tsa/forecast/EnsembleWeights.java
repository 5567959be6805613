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
package net.larse.tsa.forecast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** Normalised member weights of an ensemble, with the accuracies they were derived from. */
public final class EnsembleWeights {
  /** Weight basis of a member that could not be backtested. */
  public static final double UNKNOWN_ACCURACY = 0.5;

  private final ImmutableMap<ForecastMethod, Double> accuracies;
  private final ImmutableMap<ForecastMethod, Double> weights;

  /** Normalises accuracies to weights summing to 1; equal weights when they sum to 0. */
  public static EnsembleWeights fromAccuracies(Map<ForecastMethod, Double> accuracies) {
    Preconditions.checkArgument(!accuracies.isEmpty(), "No ensemble members");
    double total = 0;
    for (double accuracy : accuracies.values()) {
      Preconditions.checkArgument(accuracy >= 0, "Negative accuracy: %s", accuracy);
      total += accuracy;
    }
    ImmutableMap.Builder<ForecastMethod, Double> weights = ImmutableMap.builder();
    for (Map.Entry<ForecastMethod, Double> entry : accuracies.entrySet()) {
      weights.put(entry.getKey(),
          total > 0 ? entry.getValue() / total : 1.0 / accuracies.size());
    }
    return new EnsembleWeights(ImmutableMap.copyOf(accuracies), weights.build());
  }

  private EnsembleWeights(ImmutableMap<ForecastMethod, Double> accuracies,
      ImmutableMap<ForecastMethod, Double> weights) {
    this.accuracies = accuracies;
    this.weights = weights;
  }

  public ImmutableMap<ForecastMethod, Double> getWeights() {
    return weights;
  }

  /** Backtest accuracy of each member, or 0.5 where it could not be backtested. */
  public ImmutableMap<ForecastMethod, Double> getAccuracies() {
    return accuracies;
  }

  public double weight(ForecastMethod method) {
    Double weight = weights.get(method);
    return weight == null ? 0 : weight;
  }

  @Override
  public String toString() {
    return "EnsembleWeights" + weights;
  }
}
