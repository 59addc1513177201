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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class XanesRegionExtractorTest {

  private static PreEdgeResult result;

  @BeforeAll
  static void normalize() {
    result = new PreEdgeNormalizer(null, null, 1, 0d, null, -50d, 20d, null, false).process(
        XafsTestSpectra.energy(), XafsTestSpectra.smoothStepMu());
  }

  @Test
  void testDefaultWindowAroundDerivedEdge() {
    final XanesRegion xanes = XanesRegionExtractor.extract(result);

    Assertions.assertEquals(100d, xanes.e0());
    Assertions.assertEquals(11, xanes.getNumberOfValues());
    Assertions.assertEquals(-30d, xanes.relativeEnergy()[0]);
    Assertions.assertEquals(70d, xanes.relativeEnergy()[10]);
    Assertions.assertEquals(0.5, xanes.norm()[3], 1e-9);
  }

  @Test
  void testReferenceEdgeEnergy() {
    final XanesRegion xanes = XanesRegionExtractor.extract(result, 105d, 30d, 70d);

    Assertions.assertEquals(105d, xanes.e0());
    Assertions.assertEquals(11, xanes.getNumberOfValues());
    Assertions.assertEquals(-35d, xanes.relativeEnergy()[0]);
    Assertions.assertEquals(65d, xanes.relativeEnergy()[10]);
  }

  @Test
  void testWindowBeyondData() {
    final XanesRegion xanes = XanesRegionExtractor.extract(result, 100d, 500d, 500d);
    Assertions.assertEquals(result.getNumberOfValues(), xanes.getNumberOfValues());
  }
}
