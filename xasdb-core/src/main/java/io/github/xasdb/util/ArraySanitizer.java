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

import io.github.xasdb.util.exceptions.MalformedInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Cleans measured arrays before fitting: separates repeated successive energies and drops samples
 * that are NaN or infinite. Never fails on dirty data, these conditions are corrected silently.
 */
public class ArraySanitizer {

  public static final double DEFAULT_TINY = 1e-8;
  public static final double DEFAULT_FRACTION = 0.02;

  private static final Logger logger = Logger.getLogger(ArraySanitizer.class.getName());

  private ArraySanitizer() {
  }

  /**
   * {@link #removeDuplicates(double[], double, double)} with tiny = 1e-8 and frac = 0.02.
   */
  public static double @NotNull [] removeDuplicates(double @NotNull [] values) {
    return removeDuplicates(values, DEFAULT_TINY, DEFAULT_FRACTION);
  }

  /**
   * Separates repeated successive values of an array that is expected to increase monotonically.
   * For every index i with |v[i+1] - v[i]| < tiny, v[i] is lowered by the largest of tiny,
   * frac*|v[i]-v[i-1]| and frac*|v[i+1]-v[i]|. Example: [0, 1.1, 2.2, 2.2, 3.3] becomes
   * [0, 1.1, 2.178, 2.2, 3.3].
   * <p>
   * The duplicates are found once on the input and then adjusted in ascending order, each step
   * seeing the previous adjustments. This is a single pass: runs of values spaced closer than tiny
   * may still contain a near-duplicate afterwards.
   *
   * @return a copy of the input with the adjusted values
   */
  public static double @NotNull [] removeDuplicates(double @NotNull [] values, double tiny,
      double frac) {
    final double[] out = values.clone();
    final List<Integer> duplicates = new ArrayList<>();
    for (int i = 0; i < out.length - 1; i++) {
      if (Math.abs(out[i] - out[i + 1]) < tiny) {
        duplicates.add(i);
      }
    }

    for (int i : duplicates) {
      double dx = tiny;
      if (i > 0) {
        dx = Math.max(dx, frac * Math.abs(out[i] - out[i - 1]));
      }
      if (i < out.length - 1) {
        dx = Math.max(dx, frac * Math.abs(out[i + 1] - out[i]));
      }
      out[i] -= dx;
    }

    if (!duplicates.isEmpty() && logger.isLoggable(Level.FINE)) {
      logger.fine("Separated %d repeated values".formatted(duplicates.size()));
    }
    return out;
  }

  /**
   * Removes every index at which either array holds NaN or an infinite value, from both arrays,
   * keeping the order of the remaining samples.
   *
   * @return the input arrays themselves if nothing had to be removed, otherwise trimmed copies
   * @throws MalformedInputException if the arrays differ in length
   */
  public static @NotNull ArrayPair removeInvalid(double @NotNull [] a, double @NotNull [] b) {
    final int[] valid = validIndices(a, b);
    if (valid.length == a.length) {
      return new ArrayPair(a, b);
    }

    final double[] a1 = new double[valid.length];
    final double[] b1 = new double[valid.length];
    for (int j = 0; j < valid.length; j++) {
      a1[j] = a[valid[j]];
      b1[j] = b[valid[j]];
    }
    logger.fine(() -> "Removed %d NaN or infinite samples".formatted(a.length - valid.length));
    return new ArrayPair(a1, b1);
  }

  /**
   * @return ascending indices at which both arrays hold finite values, the positions of the
   * samples {@link #removeInvalid(double[], double[])} keeps
   * @throws MalformedInputException if the arrays differ in length
   */
  public static int @NotNull [] validIndices(double @NotNull [] a, double @NotNull [] b) {
    if (a.length != b.length) {
      throw new MalformedInputException(
          "Arrays must have equal length, got %d and %d".formatted(a.length, b.length));
    }
    return IntStream.range(0, a.length)
        .filter(i -> Double.isFinite(a[i]) && Double.isFinite(b[i])).toArray();
  }
}
