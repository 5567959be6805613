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

import java.time.Instant;

/** One observation of a metric. */
public final class DataPoint {
  private final Instant timestamp;
  private final double value;

  public DataPoint(Instant timestamp, double value) {
    this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp");
    this.value = value;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DataPoint)) {
      return false;
    }
    DataPoint other = (DataPoint) o;
    return timestamp.equals(other.timestamp)
        && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * timestamp.hashCode() + Double.hashCode(value);
  }

  @Override
  public String toString() {
    return timestamp + "=" + value;
  }
}
