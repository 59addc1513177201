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

package io.github.xasdb.modules.dataprocessing.xafs_preedge;

import com.google.common.collect.Range;
import io.github.xasdb.util.MathUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Turns the pre-edge and post-edge ranges, given relative to E0, into bounds inside the data and
 * index ranges of the energy array.
 */
public class FitRegionSelector {

  /**
   * Windows hold at least this many samples if the array is long enough.
   */
  public static final int MIN_WINDOW_POINTS = 2;

  private FitRegionSelector() {
  }

  /**
   * Rules, in order:
   * <ol>
   *   <li>pre1 defaults to min(energy) - e0</li>
   *   <li>norm2 defaults to max(energy) - e0, a negative norm2 becomes max(energy) - e0 - norm2</li>
   *   <li>pre1 is raised to at least min(energy) - e0, norm2 lowered to at most max(energy) - e0</li>
   *   <li>swapped bounds of either window are put back in order</li>
   *   <li>lower bounds map to the last index at or below the energy, upper bounds to the nearest
   *   index</li>
   *   <li>windows of less than two samples are widened to lower + 2, at most the array length</li>
   * </ol>
   * The lower/upper index asymmetry of rule 5 decides which samples enter the fits and must stay
   * as is.
   *
   * @param energy sanitized energies
   * @param e0     edge energy, one of the energy values
   * @param pre1   pre-edge start relative to e0, null for the data start
   * @param pre2   pre-edge end relative to e0
   * @param norm1  post-edge start relative to e0
   * @param norm2  post-edge end relative to e0, null for the data end
   */
  public static @NotNull FitRegions resolveWindows(double @NotNull [] energy, double e0,
      @Nullable Double pre1, double pre2, double norm1, @Nullable Double norm2) {
    final double minRel = MathUtils.min(energy) - e0;
    final double maxRel = MathUtils.max(energy) - e0;

    double preLo = pre1 != null ? pre1 : minRel;
    double postHi = norm2 != null ? norm2 : maxRel;
    if (postHi < 0) {
      postHi = maxRel - postHi;
    }
    preLo = Math.max(preLo, minRel);
    postHi = Math.min(postHi, maxRel);

    double preHi = pre2;
    if (preLo > preHi) {
      final double tmp = preLo;
      preLo = preHi;
      preHi = tmp;
    }
    double postLo = norm1;
    if (postLo > postHi) {
      final double tmp = postLo;
      postLo = postHi;
      postHi = tmp;
    }

    return new FitRegions(new FitWindow(preLo, preHi), new FitWindow(postLo, postHi),
        toIndexRange(energy, preLo + e0, preHi + e0),
        toIndexRange(energy, postLo + e0, postHi + e0));
  }

  /**
   * @return half-open index range [lower, upper)
   */
  static @NotNull Range<Integer> toIndexRange(double @NotNull [] energy, double lowerEnergy,
      double upperEnergy) {
    final int lower = MathUtils.indexAtOrBelow(energy, lowerEnergy);
    int upper = MathUtils.indexNearest(energy, upperEnergy);
    if (upper - lower < MIN_WINDOW_POINTS) {
      upper = Math.min(energy.length, lower + MIN_WINDOW_POINTS);
    }
    return Range.closedOpen(lower, upper);
  }
}
