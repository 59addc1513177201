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
import io.github.xasdb.parameters.ParameterSet;
import io.github.xasdb.util.ArrayPair;
import io.github.xasdb.util.ArraySanitizer;
import io.github.xasdb.util.MathUtils;
import io.github.xasdb.util.exceptions.DegenerateStepException;
import io.github.xasdb.util.exceptions.EdgeOutOfRangeException;
import io.github.xasdb.util.exceptions.InsufficientDataException;
import io.github.xasdb.util.exceptions.MalformedInputException;
import java.util.Objects;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * XAFS pre-edge subtraction and normalization:
 * <ol>
 *   <li>determine E0 from the maximum of dmu/dE if not supplied</li>
 *   <li>fit a line to mu(E)*E^nvict below the edge, energy = [E0 + pre1, E0 + pre2]</li>
 *   <li>fit a polynomial of degree nnorm to mu(E)*E^nvict above the edge,
 *   energy = [E0 + norm1, E0 + norm2]</li>
 *   <li>take the edge step as the difference of both curves at E0 and normalize</li>
 * </ol>
 * Instances are immutable and can be shared between threads.
 */
public class PreEdgeNormalizer {

  public static final int MIN_POST_EDGE_DEGREE = 1;
  public static final int MAX_POST_EDGE_DEGREE = 5;
  public static final int PRE_EDGE_DEGREE = 1;

  private static final Logger logger = Logger.getLogger(PreEdgeNormalizer.class.getName());

  private final @Nullable Double e0;
  private final @Nullable Double step;
  private final int nnorm;
  private final double nvict;
  private final @Nullable Double pre1;
  private final double pre2;
  private final double norm1;
  private final @Nullable Double norm2;
  private final boolean strictEdge;

  public PreEdgeNormalizer() {
    this(null, null, 3, 0d, null, -50d, 100d, null, false);
  }

  /**
   * @param e0         edge energy in eV or null to determine it
   * @param step       edge step or null to determine it
   * @param nnorm      post-edge polynomial degree, clamped to [1, 5]
   * @param nvict      energy exponent of both fits
   * @param pre1       pre-edge start relative to E0 or null for the data start
   * @param pre2       pre-edge end relative to E0
   * @param norm1      post-edge start relative to E0
   * @param norm2      post-edge end relative to E0 or null for the data end
   * @param strictEdge fail on an out-of-range e0 instead of determining E0
   */
  public PreEdgeNormalizer(@Nullable Double e0, @Nullable Double step, int nnorm, double nvict,
      @Nullable Double pre1, double pre2, double norm1, @Nullable Double norm2,
      boolean strictEdge) {
    this.e0 = e0;
    this.step = step;
    this.nnorm = nnorm;
    this.nvict = nvict;
    this.pre1 = pre1;
    this.pre2 = pre2;
    this.norm1 = norm1;
    this.norm2 = norm2;
    this.strictEdge = strictEdge;
  }

  public static @NotNull PreEdgeNormalizer fromParameters(@NotNull ParameterSet parameters) {
    return new PreEdgeNormalizer(
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.edgeEnergy, null),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.edgeStep, null),
        Objects.requireNonNull(parameters.getValue(PreEdgeParameters.postEdgeDegree)),
        Objects.requireNonNull(parameters.getValue(PreEdgeParameters.victoreenExponent)),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.preEdgeStart, null),
        Objects.requireNonNull(parameters.getValue(PreEdgeParameters.preEdgeEnd)),
        Objects.requireNonNull(parameters.getValue(PreEdgeParameters.postEdgeStart)),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.postEdgeEnd, null),
        Boolean.TRUE.equals(parameters.getValue(PreEdgeParameters.strictEdgeValidation)));
  }

  public @NotNull PreEdgeResult process(@NotNull XafsSpectrum spectrum) {
    return process(spectrum.energy(), spectrum.mu());
  }

  /**
   * Runs the full pre-edge subtraction. The input arrays are not modified. The result arrays have
   * the length of the input; samples where energy or mu is NaN or infinite do not enter E0 or the
   * fits and have a NaN normalized value.
   *
   * @throws MalformedInputException    for null, empty or unequal arrays, or if no finite sample
   *                                    remains
   * @throws InsufficientDataException  if a fit window has too few usable samples
   * @throws DegenerateStepException    if the edge step is zero
   * @throws EdgeOutOfRangeException    if strict edge validation is on and e0 is out of range
   */
  public @NotNull PreEdgeResult process(double[] energy, double[] mu) {
    XafsSpectrum.validate(energy, mu);

    // E0 and the fit windows are found on the finite samples only
    final int[] kept = ArraySanitizer.validIndices(energy, mu);
    if (kept.length == 0) {
      throw new MalformedInputException("Spectrum has no finite samples");
    }
    final ArrayPair valid = ArraySanitizer.removeInvalid(energy, mu);
    final double[] en = ArraySanitizer.removeDuplicates(valid.first());
    final double[] mux = valid.second();

    final int validEdgeIndex = MathUtils.indexNearest(en, resolveEdgeEnergy(en, mux));
    final FitRegions validRegions = FitRegionSelector.resolveWindows(en, en[validEdgeIndex],
        pre1, pre2, norm1, norm2);

    // results cover every input sample, invalid ones stay NaN in the normalized output
    final double[] outEnergy = energy.clone();
    for (int j = 0; j < kept.length; j++) {
      outEnergy[kept[j]] = en[j];
    }
    final double[] outMu = mu.clone();
    final FitRegions regions = new FitRegions(validRegions.preEdge(), validRegions.postEdge(),
        toInputIndices(validRegions.preEdgeIndices(), kept),
        toInputIndices(validRegions.postEdgeIndices(), kept));

    final int degree = clampDegree(nnorm);
    final BackgroundFit preFit = BackgroundFitter.fitBackground(outEnergy, outMu,
        regions.preEdgeIndices(), PRE_EDGE_DEGREE, nvict, "pre-edge");
    final BackgroundFit postFit = BackgroundFitter.fitBackground(outEnergy, outMu,
        regions.postEdgeIndices(), degree, nvict, "post-edge");

    final PreEdgeResult result = EdgeStepNormalizer.normalize(outEnergy, outMu, preFit, postFit,
        kept[validEdgeIndex], step, regions);
    if (kept.length < outMu.length) {
      markInvalid(result.norm(), kept);
    }
    logger.finest(() -> "E0=%.3f, edge step=%.5g, pre=%s, post=%s".formatted(result.e0(),
        result.edgeStep(), regions.preEdge(), regions.postEdge()));
    return result;
  }

  private static void markInvalid(double[] values, int[] kept) {
    int next = 0;
    for (int i = 0; i < values.length; i++) {
      if (next < kept.length && kept[next] == i) {
        next++;
      } else {
        values[i] = Double.NaN;
      }
    }
  }

  /**
   * Maps a half-open range over the finite samples onto the input samples. Invalid samples inside
   * the mapped range are skipped by the fit.
   */
  private static Range<Integer> toInputIndices(Range<Integer> validIndices, int[] kept) {
    return Range.closedOpen(kept[validIndices.lowerEndpoint()],
        kept[validIndices.upperEndpoint() - 1] + 1);
  }

  private double resolveEdgeEnergy(double[] energy, double[] mu) {
    final double min = MathUtils.min(energy);
    final double max = MathUtils.max(energy);
    if (e0 != null && Double.isFinite(e0) && e0 >= min && e0 <= max) {
      return e0;
    }
    if (e0 != null) {
      if (strictEdge) {
        throw new EdgeOutOfRangeException(e0, min, max);
      }
      logger.warning(
          "Edge energy %s is outside of the data range [%s, %s], determining E0 from the data".formatted(
              e0, min, max));
    }
    return EdgeLocator.locateEdge(energy, mu);
  }

  private static int clampDegree(int nnorm) {
    final int degree = Math.max(Math.min(nnorm, MAX_POST_EDGE_DEGREE), MIN_POST_EDGE_DEGREE);
    if (degree != nnorm) {
      logger.warning("Post-edge degree %d clamped to %d".formatted(nnorm, degree));
    }
    return degree;
  }

  public @Nullable Double getE0() {
    return e0;
  }

  public @Nullable Double getStep() {
    return step;
  }

  public int getNnorm() {
    return nnorm;
  }

  public double getNvict() {
    return nvict;
  }

  public @Nullable Double getPre1() {
    return pre1;
  }

  public double getPre2() {
    return pre2;
  }

  public double getNorm1() {
    return norm1;
  }

  public @Nullable Double getNorm2() {
    return norm2;
  }

  public boolean isStrictEdge() {
    return strictEdge;
  }
}
