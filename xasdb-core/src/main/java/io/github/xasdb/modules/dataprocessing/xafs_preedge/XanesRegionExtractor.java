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

import io.github.xasdb.util.MathUtils;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Cuts the near-edge part out of a normalized spectrum, by default from 30 eV below to 70 eV above
 * the edge.
 */
public class XanesRegionExtractor {

  public static final double DEFAULT_BELOW = 30d;
  public static final double DEFAULT_ABOVE = 70d;

  private XanesRegionExtractor() {
  }

  public static @NotNull XanesRegion extract(@NotNull PreEdgeResult result) {
    return extract(result, result.e0(), DEFAULT_BELOW, DEFAULT_ABOVE);
  }

  /**
   * @param e0    edge energy to center on, e.g. a tabulated edge energy instead of the derived one
   * @param below eV below e0 to include
   * @param above eV above e0 to include
   */
  public static @NotNull XanesRegion extract(@NotNull PreEdgeResult result, double e0,
      double below, double above) {
    final double[] energy = result.energy();
    final int from = MathUtils.indexAtOrBelow(energy, e0 - below);
    final int to = Math.max(from, MathUtils.indexAtOrBelow(energy, e0 + above) + 1);

    final double[] relative = new double[to - from];
    for (int i = from; i < to; i++) {
      relative[i - from] = energy[i] - e0;
    }
    return new XanesRegion(e0, relative, Arrays.copyOfRange(result.norm(), from, to));
  }
}
