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
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Unit of the energy column of stored spectra.
 */
public enum EnergyUnit {
  EV(1d), KEV(1000d);

  private final double toElectronVolts;

  EnergyUnit(double toElectronVolts) {
    this.toElectronVolts = toElectronVolts;
  }

  public double @NotNull [] toElectronVolts(double @NotNull [] energies) {
    final double[] out = new double[energies.length];
    for (int i = 0; i < energies.length; i++) {
      out[i] = energies[i] * toElectronVolts;
    }
    return out;
  }

  /**
   * Accepts labels like "eV", "keV" or "keV (calibrated)". Monochromator angles are not supported.
   *
   * @throws MalformedInputException for unknown or angle units
   */
  public static @NotNull EnergyUnit parse(@NotNull String label) {
    final String l = label.trim().toLowerCase(Locale.ROOT);
    if (l.startsWith("kev")) {
      return KEV;
    }
    if (l.startsWith("ev")) {
      return EV;
    }
    if (l.startsWith("deg")) {
      throw new MalformedInputException("Conversion from monochromator angle to energy is not "
          + "supported: " + label);
    }
    throw new MalformedInputException("Unknown energy unit: " + label);
  }
}
