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
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Estimates the absorption edge from the maximum of the derivative dmu/dE.
 */
public class EdgeLocator {

  /**
   * Derivative values above this fraction of the maximum are edge candidates.
   */
  public static final double CANDIDATE_FRACTION = 0.05;

  private static final Logger logger = Logger.getLogger(EdgeLocator.class.getName());

  private EdgeLocator() {
  }

  /**
   * @return the energy of {@link #locateEdgeIndex(double[], double[])}
   */
  public static double locateEdge(double @NotNull [] energy, double @NotNull [] mu) {
    return energy[locateEdgeIndex(energy, mu)];
  }

  /**
   * Picks the index of the largest positive derivative whose direct neighbours are candidates as
   * well, so single-sample spikes cannot win. Falls back to index 0 if no index qualifies.
   */
  public static int locateEdgeIndex(double @NotNull [] energy, double @NotNull [] mu) {
    final double[] dmu = derivative(energy, mu);
    final int n = dmu.length;

    double maxDeriv = Double.NEGATIVE_INFINITY;
    for (double d : dmu) {
      if (Double.isFinite(d)) {
        maxDeriv = Math.max(maxDeriv, d);
      }
    }
    final double threshold = maxDeriv * CANDIDATE_FRACTION;
    final boolean[] candidate = new boolean[n];
    for (int i = 0; i < n; i++) {
      candidate[i] = Double.isFinite(dmu[i]) && dmu[i] > threshold;
    }

    int edgeIndex = 0;
    double edgeDeriv = 0d;
    for (int i = 1; i < n - 1; i++) {
      if (candidate[i] && candidate[i - 1] && candidate[i + 1] && dmu[i] > edgeDeriv) {
        edgeIndex = i;
        edgeDeriv = dmu[i];
      }
    }
    if (edgeDeriv == 0d) {
      logger.fine("No supported derivative maximum found, using the first energy as edge");
    }
    return edgeIndex;
  }

  /**
   * dmu/dE as ratio of the sample-spaced gradients of both arrays.
   */
  public static double @NotNull [] derivative(double @NotNull [] energy, double @NotNull [] mu) {
    final double[] dmu = MathUtils.gradient(mu);
    final double[] de = MathUtils.gradient(energy);
    for (int i = 0; i < dmu.length; i++) {
      dmu[i] /= de[i];
    }
    return dmu;
  }
}
