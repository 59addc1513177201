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

package io.github.xasdb.datamodel;

import io.github.xasdb.util.exceptions.MalformedInputException;
import org.jetbrains.annotations.NotNull;

/**
 * Measured absorption spectrum, mu(E) sampled at energies in eV. Validated once on construction,
 * the arrays are copied and never handed out for modification.
 *
 * @param energy x-ray energies in eV, expected to increase
 * @param mu     absorption coefficient per energy
 */
public record XafsSpectrum(double @NotNull [] energy, double @NotNull [] mu) {

  public XafsSpectrum {
    validate(energy, mu);
    energy = energy.clone();
    mu = mu.clone();
  }

  /**
   * Transmission geometry: mu = -ln(itrans / i0).
   */
  public static @NotNull XafsSpectrum fromTransmission(double[] energy, double[] i0,
      double[] itrans) {
    validate(energy, i0);
    validate(energy, itrans);
    final double[] mu = new double[energy.length];
    for (int i = 0; i < mu.length; i++) {
      mu[i] = -Math.log(itrans[i] / i0[i]);
    }
    return new XafsSpectrum(energy, mu);
  }

  /**
   * @param energy energies in the given unit, converted to eV
   */
  public static @NotNull XafsSpectrum of(double[] energy, double[] mu, @NotNull EnergyUnit unit) {
    validate(energy, mu);
    return new XafsSpectrum(unit.toElectronVolts(energy), mu);
  }

  /**
   * @throws MalformedInputException for missing, empty or unequal arrays
   */
  public static void validate(double[] energy, double[] values) {
    if (energy == null || values == null) {
      throw new MalformedInputException("Spectrum arrays must not be null");
    }
    if (energy.length == 0) {
      throw new MalformedInputException("Spectrum is empty");
    }
    if (energy.length != values.length) {
      throw new MalformedInputException(
          "Energy and signal arrays differ in length: %d vs %d".formatted(energy.length,
              values.length));
    }
  }

  public int getNumberOfValues() {
    return energy.length;
  }

  @Override
  public double @NotNull [] energy() {
    return energy.clone();
  }

  @Override
  public double @NotNull [] mu() {
    return mu.clone();
  }
}
