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

import org.apache.commons.lang3.ArrayUtils;

/** Static array manipulation functions. */
public class ArrayHelper {
  /** Returns {0, 1, ..., n - 1} as doubles. */
  public static double[] sequence(int n) {
    return sequence(0, n);
  }

  /** Returns {start, start + 1, ..., start + n - 1} as doubles. */
  public static double[] sequence(int start, int n) {
    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      result[i] = start + i;
    }
    return result;
  }

  /** Index of the first maximum in array, or -1 if the array is empty. */
  public static int argMax(double[] array) {
    int best = -1;
    for (int i = 0; i < array.length; i++) {
      if (best < 0 || array[i] > array[best]) {
        best = i;
      }
    }
    return best;
  }

  /** Copy of array between start (incl) and end (excl). */
  public static double[] slice(double[] array, int start, int end) {
    return ArrayUtils.subarray(array, start, end);
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  public static double clamp01(double value) {
    return clamp(value, 0, 1);
  }
}
