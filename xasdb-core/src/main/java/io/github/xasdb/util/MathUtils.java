/*
 * Copyright (c) 2025 The xasdb Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.xasdb.util;

import org.jetbrains.annotations.NotNull;

/**
 * Index searches and finite differences on sampled curves.
 */
public class MathUtils {

  private MathUtils() {
  }

  /**
   * @return the largest index whose value is at or below the given value, 0 if the value is below
   * the minimum of the array. Does not require a sorted array.
   */
  public static int indexAtOrBelow(double @NotNull [] values, double value) {
    if (values.length == 0 || value < min(values)) {
      return 0;
    }
    for (int i = values.length - 1; i >= 0; i--) {
      if (values[i] <= value) {
        return i;
      }
    }
    return 0;
  }

  /**
   * @return the index of the value closest to the given value. Ties resolve to the lower index.
   */
  public static int indexNearest(double @NotNull [] values, double value) {
    int best = 0;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      final double distance = Math.abs(values[i] - value);
      if (distance < bestDistance) {
        best = i;
        bestDistance = distance;
      }
    }
    return best;
  }

  /**
   * Sample-spaced gradient: central differences in the interior, one-sided differences at both
   * ends. A single value has a gradient of 0.
   */
  public static double @NotNull [] gradient(double @NotNull [] values) {
    final int n = values.length;
    final double[] grad = new double[n];
    if (n < 2) {
      return grad;
    }
    grad[0] = values[1] - values[0];
    grad[n - 1] = values[n - 1] - values[n - 2];
    for (int i = 1; i < n - 1; i++) {
      grad[i] = (values[i + 1] - values[i - 1]) / 2d;
    }
    return grad;
  }

  public static double min(double @NotNull [] values) {
    double min = Double.POSITIVE_INFINITY;
    for (double v : values) {
      min = Math.min(min, v);
    }
    return min;
  }

  public static double max(double @NotNull [] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }
}
