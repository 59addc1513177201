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
import io.github.xasdb.datamodel.XafsSpectrum;
import io.github.xasdb.util.exceptions.DegenerateStepException;
import io.github.xasdb.util.exceptions.EdgeOutOfRangeException;
import io.github.xasdb.util.exceptions.InsufficientDataException;
import io.github.xasdb.util.exceptions.MalformedInputException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PreEdgeNormalizerTest {

  /**
   * Linear post-edge fit starting 20 eV above the edge, so the synthetic spectra have enough
   * post-edge samples.
   */
  private static PreEdgeNormalizer shortPostEdge(Double e0, Double step, int nnorm,
      boolean strict) {
    return new PreEdgeNormalizer(e0, step, nnorm, 0d, null, -50d, 20d, null, strict);
  }

  @Test
  void testNormalizesSyntheticEdge() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();

    final PreEdgeResult result = shortPostEdge(null, null, 1, false).process(energy, mu);

    Assertions.assertEquals(100d, result.e0(), 10d);
    Assertions.assertEquals(XafsTestSpectra.EDGE_INDEX, result.edgeIndex());
    Assertions.assertEquals(1d, result.edgeStep(), 1e-9);
    Assertions.assertEquals(mu[0], result.preEdge()[0], 1e-9);
    Assertions.assertEquals(0d, result.norm()[9], 1e-9);
    Assertions.assertEquals(0.5, result.norm()[10], 1e-9);
    Assertions.assertEquals(1d, result.norm()[11], 1e-9);
    Assertions.assertEquals(1d, result.norm()[20], 1e-9);
    Assertions.assertEquals(energy.length, result.getNumberOfValues());
    Assertions.assertEquals(new FitWindow(-100d, -50d), result.regions().preEdge());
    Assertions.assertEquals(new FitWindow(20d, 100d), result.regions().postEdge());
  }

  @Test
  void testSharpStepWithSuppliedEdge() {
    final PreEdgeResult result = shortPostEdge(100d, null, 1, false).process(
        XafsTestSpectra.energy(), XafsTestSpectra.sharpStepMu());

    Assertions.assertEquals(100d, result.e0());
    Assertions.assertEquals(1d, result.edgeStep(), 1e-9);
    Assertions.assertEquals(0d, result.norm()[9], 1e-9);
    Assertions.assertEquals(1d, result.norm()[10], 1e-9);
  }

  @Test
  void testSharpStepWithoutEdgeFallsBackToFirstSample() {
    final PreEdgeResult result = new PreEdgeNormalizer().process(XafsTestSpectra.energy(),
        XafsTestSpectra.sharpStepMu());

    Assertions.assertEquals(0d, result.e0());
    Assertions.assertEquals(0, result.edgeIndex());
    Assertions.assertEquals(new FitWindow(-50d, 0d), result.regions().preEdge());
    // both backgrounds are exact lines, extrapolated to E = 0
    Assertions.assertEquals(1d, result.edgeStep(), 1e-6);
  }

  @Test
  void testDefaultPostEdgeWindowTooShort() {
    // norm1 = 100 eV above E0 = 100 eV leaves only the last sample
    final InsufficientDataException ex = Assertions.assertThrows(
        InsufficientDataException.class,
        () -> new PreEdgeNormalizer().process(XafsTestSpectra.energy(),
            XafsTestSpectra.smoothStepMu()));
    Assertions.assertEquals(1, ex.getAvailablePoints());
    Assertions.assertEquals(4, ex.getRequiredPoints());
  }

  @Test
  void testZeroEdgeStep() {
    final double[] energy = XafsTestSpectra.energy();
    Assertions.assertThrows(DegenerateStepException.class,
        () -> shortPostEdge(100d, null, 1, false).process(energy, new double[energy.length]));
  }

  @Test
  void testSuppliedZeroStep() {
    Assertions.assertThrows(DegenerateStepException.class,
        () -> shortPostEdge(null, 0d, 1, false).process(XafsTestSpectra.energy(),
            XafsTestSpectra.smoothStepMu()));
  }

  @Test
  void testSuppliedStepReproducesDerivedNormalization() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();
    final PreEdgeResult derived = shortPostEdge(null, null, 1, false).process(energy, mu);

    final PreEdgeResult supplied = shortPostEdge(null, derived.edgeStep(), 1, false).process(
        energy, mu);

    Assertions.assertEquals(derived.edgeStep(), supplied.edgeStep());
    Assertions.assertArrayEquals(derived.norm(), supplied.norm());
  }

  @Test
  void testOutOfRangeEdgeIsReplaced() {
    final PreEdgeResult result = shortPostEdge(5000d, null, 1, false).process(
        XafsTestSpectra.energy(), XafsTestSpectra.smoothStepMu());
    Assertions.assertEquals(100d, result.e0());
  }

  @Test
  void testNonFiniteEdgeIsReplaced() {
    final PreEdgeResult result = shortPostEdge(Double.NaN, null, 1, false).process(
        XafsTestSpectra.energy(), XafsTestSpectra.smoothStepMu());
    Assertions.assertEquals(100d, result.e0());
  }

  @Test
  void testStrictEdgeValidation() {
    final EdgeOutOfRangeException ex = Assertions.assertThrows(EdgeOutOfRangeException.class,
        () -> shortPostEdge(5000d, null, 1, true).process(XafsTestSpectra.energy(),
            XafsTestSpectra.smoothStepMu()));
    Assertions.assertEquals(5000d, ex.getEdgeEnergy());
    Assertions.assertEquals(0d, ex.getMinEnergy());
    Assertions.assertEquals(200d, ex.getMaxEnergy());
  }

  @Test
  void testEdgeSnapsToNearestSample() {
    final PreEdgeResult result = shortPostEdge(103d, null, 1, false).process(
        XafsTestSpectra.energy(), XafsTestSpectra.smoothStepMu());
    Assertions.assertEquals(100d, result.e0());
    Assertions.assertEquals(XafsTestSpectra.EDGE_INDEX, result.edgeIndex());
  }

  @Test
  void testPostEdgeDegreeIsClamped() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();

    final PreEdgeResult high = shortPostEdge(null, null, 9, false).process(energy, mu);
    Assertions.assertEquals(PreEdgeNormalizer.MAX_POST_EDGE_DEGREE, high.nnorm());
    Assertions.assertEquals(1d, high.edgeStep(), 1e-3);

    final PreEdgeResult low = shortPostEdge(null, null, 0, false).process(energy, mu);
    Assertions.assertEquals(PreEdgeNormalizer.MIN_POST_EDGE_DEGREE, low.nnorm());
    Assertions.assertEquals(PreEdgeNormalizer.PRE_EDGE_DEGREE, low.preEdgeFit().degree());
  }

  @Test
  void testInvalidSamplesKeepInputLength() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();
    mu[3] = Double.NaN;
    energy[15] = Double.POSITIVE_INFINITY;

    final PreEdgeResult result = shortPostEdge(null, null, 1, false).process(energy, mu);

    Assertions.assertEquals(energy.length, result.getNumberOfValues());
    Assertions.assertEquals(energy.length, result.norm().length);
    Assertions.assertEquals(energy.length, result.preEdge().length);
    Assertions.assertEquals(energy.length, result.postEdge().length);
    Assertions.assertEquals(100d, result.e0());
    Assertions.assertEquals(XafsTestSpectra.EDGE_INDEX, result.edgeIndex());
    Assertions.assertEquals(1d, result.edgeStep(), 1e-9);

    Assertions.assertTrue(Double.isNaN(result.norm()[3]));
    Assertions.assertTrue(Double.isNaN(result.norm()[15]));
    Assertions.assertEquals(0.13, result.preEdge()[3], 1e-9);
    Assertions.assertEquals(0.5, result.norm()[10], 1e-9);
    Assertions.assertEquals(1d, result.norm()[20], 1e-9);
    for (int i = 0; i < energy.length; i++) {
      if (i != 3 && i != 15) {
        Assertions.assertTrue(Double.isFinite(result.norm()[i]));
      }
    }
    // windows index the input samples
    Assertions.assertEquals(Range.closedOpen(0, 5), result.regions().preEdgeIndices());
    Assertions.assertEquals(Range.closedOpen(12, 20), result.regions().postEdgeIndices());
  }

  @Test
  void testResultDoesNotShareInputArrays() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();

    final PreEdgeResult result = shortPostEdge(null, null, 1, false).process(energy, mu);
    Assertions.assertNotSame(mu, result.mu());
    Assertions.assertNotSame(energy, result.energy());

    result.mu()[0] = 42d;
    result.energy()[0] = 42d;
    Assertions.assertEquals(0.1, mu[0]);
    Assertions.assertEquals(0d, energy[0]);
  }

  @Test
  void testRepeatedEnergiesAreSeparated() {
    final double[] energy = XafsTestSpectra.energy();
    energy[3] = energy[4];

    final PreEdgeResult result = shortPostEdge(null, null, 1, false).process(energy,
        XafsTestSpectra.smoothStepMu());

    Assertions.assertEquals(energy.length, result.getNumberOfValues());
    Assertions.assertEquals(39.6, result.energy()[3], 1e-9);
    for (int i = 1; i < result.energy().length; i++) {
      Assertions.assertTrue(result.energy()[i] > result.energy()[i - 1]);
    }
    // input untouched
    Assertions.assertEquals(40d, energy[3]);
  }

  @Test
  void testVictoreenExponent() {
    final double[] energy = new double[21];
    final double[] mu = new double[energy.length];
    for (int i = 0; i < energy.length; i++) {
      energy[i] = 1000d + 10d * i;
      mu[i] = 100d / energy[i] + (i < 10 ? 0.1 : 1.1);
    }
    mu[10] = 100d / energy[10] + 0.6;

    final PreEdgeResult result = new PreEdgeNormalizer(null, null, 1, 1d, null, -50d, 20d, null,
        false).process(energy, mu);

    Assertions.assertEquals(1100d, result.e0());
    Assertions.assertEquals(1d, result.nvict());
    Assertions.assertEquals(1d, result.edgeStep(), 1e-9);
    Assertions.assertEquals(mu[0], result.preEdge()[0], 1e-9);
  }

  @Test
  void testMalformedInput() {
    final PreEdgeNormalizer normalizer = new PreEdgeNormalizer();
    Assertions.assertThrows(MalformedInputException.class,
        () -> normalizer.process(null, new double[]{1}));
    Assertions.assertThrows(MalformedInputException.class,
        () -> normalizer.process(new double[0], new double[0]));
    Assertions.assertThrows(MalformedInputException.class,
        () -> normalizer.process(new double[]{1, 2}, new double[]{1}));
    Assertions.assertThrows(MalformedInputException.class,
        () -> normalizer.process(new double[]{1, 2}, new double[]{Double.NaN, Double.NaN}));
  }

  @Test
  void testInputArraysNotModified() {
    final double[] energy = XafsTestSpectra.energy();
    final double[] mu = XafsTestSpectra.smoothStepMu();
    shortPostEdge(null, null, 1, false).process(energy, mu);

    Assertions.assertArrayEquals(XafsTestSpectra.energy(), energy);
    Assertions.assertArrayEquals(XafsTestSpectra.smoothStepMu(), mu);
  }

  @Test
  void testProcessSpectrum() {
    final PreEdgeResult result = shortPostEdge(null, null, 1, false).process(
        new XafsSpectrum(XafsTestSpectra.energy(), XafsTestSpectra.smoothStepMu()));
    Assertions.assertEquals(1d, result.edgeStep(), 1e-9);
  }

  @Test
  void testFromParameters() {
    final PreEdgeParameters parameters = new PreEdgeParameters();
    parameters.setParameter(PreEdgeParameters.edgeEnergy, true, 7112d);
    parameters.setParameter(PreEdgeParameters.postEdgeEnd, false, 400d);
    parameters.setParameter(PreEdgeParameters.postEdgeStart, 150d);
    parameters.setParameter(PreEdgeParameters.postEdgeDegree, 2);
    parameters.setParameter(PreEdgeParameters.strictEdgeValidation, true);

    final PreEdgeNormalizer normalizer = PreEdgeNormalizer.fromParameters(parameters);

    Assertions.assertEquals(7112d, normalizer.getE0());
    Assertions.assertNull(normalizer.getStep());
    Assertions.assertNull(normalizer.getPre1());
    Assertions.assertEquals(-50d, normalizer.getPre2());
    Assertions.assertEquals(150d, normalizer.getNorm1());
    Assertions.assertNull(normalizer.getNorm2());
    Assertions.assertEquals(2, normalizer.getNnorm());
    Assertions.assertEquals(0d, normalizer.getNvict());
    Assertions.assertTrue(normalizer.isStrictEdge());
  }

  @Test
  void testDefaults() {
    final PreEdgeNormalizer normalizer = PreEdgeNormalizer.fromParameters(
        new PreEdgeParameters());
    Assertions.assertNull(normalizer.getE0());
    Assertions.assertEquals(3, normalizer.getNnorm());
    Assertions.assertEquals(-50d, normalizer.getPre2());
    Assertions.assertEquals(100d, normalizer.getNorm1());
    Assertions.assertFalse(normalizer.isStrictEdge());
  }
}
