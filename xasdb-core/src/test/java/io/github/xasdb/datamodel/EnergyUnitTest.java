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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EnergyUnitTest {

  @Test
  void testParse() {
    Assertions.assertEquals(EnergyUnit.EV, EnergyUnit.parse("eV"));
    Assertions.assertEquals(EnergyUnit.KEV, EnergyUnit.parse(" keV "));
    Assertions.assertEquals(EnergyUnit.KEV, EnergyUnit.parse("keV (calibrated)"));
  }

  @Test
  void testAngleAndUnknownUnitsRejected() {
    Assertions.assertThrows(MalformedInputException.class, () -> EnergyUnit.parse("degrees"));
    Assertions.assertThrows(MalformedInputException.class, () -> EnergyUnit.parse("nm"));
  }

  @Test
  void testConversion() {
    Assertions.assertArrayEquals(new double[]{8979},
        EnergyUnit.KEV.toElectronVolts(new double[]{8.979}), 1e-9);
    Assertions.assertArrayEquals(new double[]{8979},
        EnergyUnit.EV.toElectronVolts(new double[]{8979}));
  }
}
