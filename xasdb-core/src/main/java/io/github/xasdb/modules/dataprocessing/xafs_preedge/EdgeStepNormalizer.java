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

import io.github.xasdb.util.exceptions.DegenerateStepException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Combines the pre-edge and post-edge backgrounds into the edge step and the normalized spectrum.
 */
public class EdgeStepNormalizer {

  private EdgeStepNormalizer() {
  }

  /**
   * @param energy       sanitized energies
   * @param mu           mu per energy
   * @param preFit       pre-edge background
   * @param postFit      post-edge background
   * @param edgeIndex    index of E0
   * @param suppliedStep edge step to use instead of postFit(E0) - preFit(E0), may be null
   * @param regions      windows the fits were made on
   * @throws DegenerateStepException if the step is zero or not finite
   */
  public static @NotNull PreEdgeResult normalize(double @NotNull [] energy,
      double @NotNull [] mu, @NotNull BackgroundFit preFit, @NotNull BackgroundFit postFit,
      int edgeIndex, @Nullable Double suppliedStep, @NotNull FitRegions regions) {
    final double[] pre = preFit.curve();
    final double[] post = postFit.curve();

    final double edgeStep =
        suppliedStep != null ? suppliedStep : post[edgeIndex] - pre[edgeIndex];
    if (edgeStep == 0d || !Double.isFinite(edgeStep)) {
      throw new DegenerateStepException(edgeStep, suppliedStep != null);
    }

    final double[] norm = new double[mu.length];
    for (int i = 0; i < mu.length; i++) {
      norm[i] = (mu[i] - pre[i]) / edgeStep;
    }
    return new PreEdgeResult(energy[edgeIndex], edgeIndex, edgeStep, energy, mu, pre, post, norm,
        preFit, postFit, regions);
  }
}
