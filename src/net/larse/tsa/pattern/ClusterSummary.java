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

/** Size and centre of one non-empty k-means cluster. */
public final class ClusterSummary {
  private final int id;
  private final int size;
  private final double percentage;
  private final double[] centroid;

  ClusterSummary(int id, int size, double percentage, double[] centroid) {
    this.id = id;
    this.size = size;
    this.percentage = percentage;
    this.centroid = centroid.clone();
  }

  public int getId() {
    return id;
  }

  public int getSize() {
    return size;
  }

  /** Share of all feature windows in this cluster, in percent. */
  public double getPercentage() {
    return percentage;
  }

  /** Centre in feature space, ordered as {@link FeatureVector#toArray()}. */
  public double[] getCentroid() {
    return centroid.clone();
  }

  @Override
  public String toString() {
    return String.format("cluster %d: %d (%.1f%%)", id, size, percentage);
  }
}
