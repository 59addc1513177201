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

package io.github.xasdb.parameters.impl;

import io.github.xasdb.modules.dataprocessing.xafs_preedge.PreEdgeParameters;
import io.github.xasdb.parameters.ParameterSet;
import io.github.xasdb.parameters.parametertypes.DoubleParameter;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimpleParameterSetTest {

  @Test
  void testLoadFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty("xafs.e0", "7112");
    properties.setProperty("xafs.nnorm", " 2 ");
    properties.setProperty("xafs.norm1", "150");
    properties.setProperty("xafs.strictEdge", "true");
    properties.setProperty("xafs.pre1", "");
    properties.setProperty("nvict", "3");

    final PreEdgeParameters parameters = new PreEdgeParameters();
    parameters.loadValuesFromProperties(properties, "xafs.", PreEdgeParameters.PROPERTY_KEYS);

    Assertions.assertEquals(7112d,
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.edgeEnergy,
            null));
    Assertions.assertEquals(2, parameters.getValue(PreEdgeParameters.postEdgeDegree));
    Assertions.assertEquals(150d, parameters.getValue(PreEdgeParameters.postEdgeStart));
    Assertions.assertEquals(Boolean.TRUE,
        parameters.getValue(PreEdgeParameters.strictEdgeValidation));
    // blank and unprefixed keys are ignored
    Assertions.assertNull(
        parameters.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.preEdgeStart,
            null));
    Assertions.assertEquals(0d, parameters.getValue(PreEdgeParameters.victoreenExponent));
  }

  @Test
  void testUnparsableValue() {
    final Properties properties = new Properties();
    properties.setProperty("norm1", "abc");
    final PreEdgeParameters parameters = new PreEdgeParameters();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> parameters.loadValuesFromProperties(properties, null,
            PreEdgeParameters.PROPERTY_KEYS));
  }

  @Test
  void testCheckParameterValues() {
    final PreEdgeParameters parameters = new PreEdgeParameters();
    final List<String> errors = new ArrayList<>();
    Assertions.assertTrue(parameters.checkParameterValues(errors));
    Assertions.assertTrue(errors.isEmpty());

    // selected without a value
    parameters.setParameter(PreEdgeParameters.edgeStep, true, null);
    parameters.setParameter(PreEdgeParameters.preEdgeEnd, Double.NaN);
    Assertions.assertFalse(parameters.checkParameterValues(errors));
    Assertions.assertEquals(2, errors.size());
  }

  @Test
  void testBounds() {
    final DoubleParameter bounded = new DoubleParameter("Fraction", "", new DecimalFormat("0.##"),
        0.5, 0d, 1d);
    final SimpleParameterSet parameters = new SimpleParameterSet(bounded);
    final List<String> errors = new ArrayList<>();

    parameters.setParameter(bounded, 1.5);
    Assertions.assertFalse(parameters.checkParameterValues(errors));
    Assertions.assertTrue(errors.get(0).contains("maximum"));
  }

  @Test
  void testPrototypesAreNotModified() {
    final PreEdgeParameters parameters = new PreEdgeParameters();
    parameters.setParameter(PreEdgeParameters.postEdgeStart, 200d);

    Assertions.assertEquals(100d, PreEdgeParameters.postEdgeStart.getValue());
    Assertions.assertNotSame(PreEdgeParameters.postEdgeStart,
        parameters.getParameter(PreEdgeParameters.postEdgeStart));
  }

  @Test
  void testCloneParameterSet() {
    final PreEdgeParameters parameters = new PreEdgeParameters();
    parameters.setParameter(PreEdgeParameters.edgeEnergy, true, 8979d);

    final ParameterSet clone = parameters.cloneParameterSet();
    parameters.setParameter(PreEdgeParameters.edgeEnergy, false, null);

    Assertions.assertEquals(8979d,
        clone.getEmbeddedParameterValueIfSelectedOrElse(PreEdgeParameters.edgeEnergy, null));
    Assertions.assertEquals(parameters.getParameters().length, clone.getParameters().length);
  }

  @Test
  void testUnknownParameter() {
    final SimpleParameterSet parameters = new SimpleParameterSet(PreEdgeParameters.preEdgeEnd);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> parameters.getParameter(PreEdgeParameters.postEdgeStart));
  }
}
