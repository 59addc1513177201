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

import io.github.xasdb.parameters.Parameter;
import io.github.xasdb.parameters.impl.SimpleParameterSet;
import io.github.xasdb.parameters.parametertypes.BooleanParameter;
import io.github.xasdb.parameters.parametertypes.DoubleParameter;
import io.github.xasdb.parameters.parametertypes.IntegerParameter;
import io.github.xasdb.parameters.parametertypes.OptionalParameter;
import java.text.DecimalFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class PreEdgeParameters extends SimpleParameterSet {

  public static final OptionalParameter<DoubleParameter> edgeEnergy = new OptionalParameter<>(
      new DoubleParameter("Edge energy (E0)", """
          Absorption edge energy in eV. If not set, or outside of the measured energy range,
          E0 is taken from the maximum of the derivative of mu(E).
          """, new DecimalFormat("0.###"), null));

  public static final OptionalParameter<DoubleParameter> edgeStep = new OptionalParameter<>(
      new DoubleParameter("Edge step", """
          Edge jump used to normalize mu(E). If not set, it is the difference of the post-edge
          and pre-edge curves at E0.
          """, new DecimalFormat("0.####"), null));

  public static final OptionalParameter<DoubleParameter> preEdgeStart = new OptionalParameter<>(
      new DoubleParameter("Pre-edge range start", """
          Start of the pre-edge fit range in eV relative to E0, typically negative.
          Defaults to the first measured energy.
          """, new DecimalFormat("0.#"), null));

  public static final DoubleParameter preEdgeEnd = new DoubleParameter("Pre-edge range end",
      "End of the pre-edge fit range in eV relative to E0.", new DecimalFormat("0.#"), -50d);

  public static final DoubleParameter postEdgeStart = new DoubleParameter("Post-edge range start",
      "Start of the post-edge (normalization) fit range in eV relative to E0.",
      new DecimalFormat("0.#"), 100d);

  public static final OptionalParameter<DoubleParameter> postEdgeEnd = new OptionalParameter<>(
      new DoubleParameter("Post-edge range end", """
          End of the post-edge fit range in eV relative to E0. Defaults to the last measured energy.
          Negative values are counted from the end of the data.
          """, new DecimalFormat("0.#"), null));

  public static final IntegerParameter postEdgeDegree = new IntegerParameter(
      "Post-edge polynomial degree", """
      Degree of the post-edge normalization polynomial. Values outside of 1 to 5 are clamped.
      """, 3);

  public static final DoubleParameter victoreenExponent = new DoubleParameter(
      "Energy exponent (nvict)", """
      mu(E) is multiplied by E^nvict before both background fits, which helps to model
      Victoreen-like backgrounds over wide energy ranges.
      """, new DecimalFormat("0.##"), 0d);

  public static final BooleanParameter strictEdgeValidation = new BooleanParameter(
      "Strict edge validation", """
      Fail if the supplied edge energy is outside of the measured energy range instead of
      determining E0 from the data.
      """, false);

  /**
   * Keys of the parameters when read from properties, e.g. -Dnorm1=150.
   */
  public static final Map<Parameter<?>, String> PROPERTY_KEYS;

  static {
    final Map<Parameter<?>, String> keys = new LinkedHashMap<>();
    keys.put(edgeEnergy, "e0");
    keys.put(edgeStep, "step");
    keys.put(preEdgeStart, "pre1");
    keys.put(preEdgeEnd, "pre2");
    keys.put(postEdgeStart, "norm1");
    keys.put(postEdgeEnd, "norm2");
    keys.put(postEdgeDegree, "nnorm");
    keys.put(victoreenExponent, "nvict");
    keys.put(strictEdgeValidation, "strictEdge");
    PROPERTY_KEYS = Collections.unmodifiableMap(keys);
  }

  public PreEdgeParameters() {
    super(edgeEnergy, edgeStep, preEdgeStart, preEdgeEnd, postEdgeStart, postEdgeEnd,
        postEdgeDegree, victoreenExponent, strictEdgeValidation);
  }
}
