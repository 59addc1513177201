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

package io.github.xasdb.datamodel.edges;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class JsonEdgeEnergyTableTest {

  private static JsonEdgeEnergyTable table;

  @BeforeAll
  static void load() throws IOException {
    table = JsonEdgeEnergyTable.loadDefault();
  }

  @Test
  void testBundledTable() {
    Assertions.assertEquals(98, table.getNumberOfElements());
    Assertions.assertEquals(7112.0, table.edgeEnergy(26, "K"));
    Assertions.assertEquals(8979.0, table.edgeEnergy("Cu", "K"));
    Assertions.assertEquals(706.8, table.edgeEnergy("fe", "l3"));
  }

  @Test
  void testSymbols() {
    Assertions.assertEquals("Fe", table.symbol(26));
    Assertions.assertEquals(29, table.atomicNumber("cu"));
    Assertions.assertNull(table.atomicNumber("Xx"));
    Assertions.assertNull(table.symbol(150));
  }

  @Test
  void testUnknownEdge() {
    Assertions.assertNull(table.edgeEnergy(26, "N7"));
    Assertions.assertNull(table.edgeEnergy("Xx", "K"));
    Assertions.assertTrue(table.edgeLabels(26).contains("L1"));
    Assertions.assertTrue(table.edgeLabels(150).isEmpty());
  }

  @Test
  void testLoadFromStream() throws IOException {
    final String json = """
        {"edges": [{"z": 30, "symbol": "Zn", "energies": {"K": 9659.0}}]}
        """;
    final JsonEdgeEnergyTable custom = JsonEdgeEnergyTable.load(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    Assertions.assertEquals(1, custom.getNumberOfElements());
    Assertions.assertEquals(9659.0, custom.edgeEnergy(30, "k"));
  }

  @Test
  void testInvalidJson() {
    Assertions.assertThrows(IOException.class, () -> JsonEdgeEnergyTable.load(
        new ByteArrayInputStream("{\"edges\": 5}".getBytes(StandardCharsets.UTF_8))));
  }
}
