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

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of pre-edge subtraction and normalization. All per-sample arrays have the length of the
 * input spectrum and are aligned with {@link #energy()}. Arrays are owned by the result and not
 * copied on access.
 *
 * @param e0          edge energy, snapped to an energy sample
 * @param edgeIndex   index of e0 in the input samples
 * @param edgeStep    edge jump used for normalization
 * @param energy      input energies with repeated values separated
 * @param mu          copy of the input mu
 * @param preEdge     pre-edge line per sample
 * @param postEdge    post-edge normalization curve per sample
 * @param norm        (mu - preEdge) / edgeStep, NaN for NaN or infinite input samples
 * @param preEdgeFit  the pre-edge line fit
 * @param postEdgeFit the post-edge polynomial fit, degree is the effective nnorm
 * @param regions     the windows actually used, index ranges over the input samples
 */
public record PreEdgeResult(double e0, int edgeIndex, double edgeStep, double @NotNull [] energy,
                            double @NotNull [] mu, double @NotNull [] preEdge,
                            double @NotNull [] postEdge, double @NotNull [] norm,
                            @NotNull BackgroundFit preEdgeFit,
                            @NotNull BackgroundFit postEdgeFit, @NotNull FitRegions regions) {

  public int getNumberOfValues() {
    return energy.length;
  }

  /**
   * @return post-edge polynomial degree after clamping
   */
  public int nnorm() {
    return postEdgeFit.degree();
  }

  public double nvict() {
    return postEdgeFit.powerExponent();
  }
}
