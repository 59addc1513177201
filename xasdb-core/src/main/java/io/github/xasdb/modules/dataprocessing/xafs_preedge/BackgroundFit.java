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
 * Polynomial background fitted to mu(E) * E^powerExponent.
 *
 * @param coefficients  polynomial coefficients, highest degree first
 * @param degree        polynomial degree
 * @param powerExponent energy exponent (nvict) applied to the signal before fitting
 * @param curve         background evaluated at every sample of the energy array, in units of mu
 */
public record BackgroundFit(double @NotNull [] coefficients, int degree, double powerExponent,
                            double @NotNull [] curve) {

  /**
   * @return the background in units of mu at any energy
   */
  public double evaluate(double energy) {
    return evaluatePolynomial(energy) * Math.pow(energy, -powerExponent);
  }

  /**
   * @return the fitted polynomial at the energy, still scaled by E^powerExponent
   */
  public double evaluatePolynomial(double energy) {
    double result = 0d;
    for (double c : coefficients) {
      result = result * energy + c;
    }
    return result;
  }
}
