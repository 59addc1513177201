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
import io.github.xasdb.util.ArrayPair;
import io.github.xasdb.util.ArraySanitizer;
import io.github.xasdb.util.exceptions.InsufficientDataException;
import java.util.Arrays;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jetbrains.annotations.NotNull;

/**
 * Least-squares polynomial backgrounds for the regions below and above the edge.
 */
public class BackgroundFitter {

  private BackgroundFitter() {
  }

  /**
   * Fits a polynomial to signal * energy^powerExponent within the index range and evaluates it,
   * divided by energy^powerExponent again, over the whole energy array. NaN and infinite samples of
   * the window are skipped.
   *
   * @param energy        sanitized energies
   * @param signal        mu per energy
   * @param indices       half-open index range of the fit window
   * @param degree        polynomial degree, at least 1
   * @param powerExponent energy exponent (nvict)
   * @param region        window name used in error messages
   * @throws InsufficientDataException if the window holds fewer than degree + 1 usable samples
   */
  public static @NotNull BackgroundFit fitBackground(double @NotNull [] energy,
      double @NotNull [] signal, @NotNull Range<Integer> indices, int degree,
      double powerExponent, @NotNull String region) {
    final int from = indices.lowerEndpoint();
    final int to = indices.upperEndpoint();
    final double[] windowEnergy = Arrays.copyOfRange(energy, from, to);
    final double[] windowSignal = new double[to - from];
    for (int i = from; i < to; i++) {
      windowSignal[i - from] = signal[i] * Math.pow(energy[i], powerExponent);
    }

    final ArrayPair usable = ArraySanitizer.removeInvalid(windowEnergy, windowSignal);
    if (usable.size() < degree + 1) {
      throw new InsufficientDataException(region, usable.size(), degree + 1);
    }

    final double[] coefficients = polyfit(usable.first(), usable.second(), degree);
    final double[] curve = new double[energy.length];
    final BackgroundFit partial = new BackgroundFit(coefficients, degree, powerExponent, curve);
    for (int i = 0; i < energy.length; i++) {
      curve[i] = partial.evaluate(energy[i]);
    }
    return partial;
  }

  /**
   * Least-squares polynomial via the SVD pseudo-inverse of the Vandermonde matrix. Columns are
   * scaled to unit norm before solving, which keeps high powers of eV energies well conditioned.
   *
   * @return coefficients, highest degree first
   */
  static double @NotNull [] polyfit(double @NotNull [] x, double @NotNull [] y, int degree) {
    final int order = degree + 1;
    final RealMatrix vander = createVandermondeMatrix(x, order);

    final double[] scale = new double[order];
    for (int j = 0; j < order; j++) {
      scale[j] = vander.getColumnVector(j).getNorm();
      if (scale[j] == 0d) {
        scale[j] = 1d;
      }
      vander.setColumnVector(j, vander.getColumnVector(j).mapDivide(scale[j]));
    }

    final DecompositionSolver solver = new SingularValueDecomposition(vander).getSolver();
    final RealVector solution = solver.solve(new ArrayRealVector(y, false));

    final double[] coefficients = new double[order];
    for (int j = 0; j < order; j++) {
      coefficients[j] = solution.getEntry(j) / scale[j];
    }
    return coefficients;
  }

  private static RealMatrix createVandermondeMatrix(double[] x, int order) {
    final double[][] matrix = new double[x.length][order];
    for (int i = 0; i < x.length; i++) {
      double xPower = 1.0;
      // highest degree first
      for (int j = order - 1; j >= 0; j--) {
        matrix[i][j] = xPower;
        xPower *= x[i];
      }
    }
    return new Array2DRowRealMatrix(matrix, false);
  }
}
