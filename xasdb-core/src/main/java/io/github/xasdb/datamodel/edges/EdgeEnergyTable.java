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

import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only lookup of tabulated x-ray absorption edge energies. Callers use it to check or replace
 * an edge energy derived from data; the normalization itself does not depend on it.
 */
public interface EdgeEnergyTable {

  /**
   * @param atomicNumber Z of the element
   * @param edgeLabel    edge name such as K, L1, L3 or M5 (case-insensitive)
   * @return edge energy in eV or null if the element or edge is not tabulated
   */
  @Nullable Double edgeEnergy(int atomicNumber, @NotNull String edgeLabel);

  default @Nullable Double edgeEnergy(@NotNull String symbol, @NotNull String edgeLabel) {
    final Integer z = atomicNumber(symbol);
    return z == null ? null : edgeEnergy(z, edgeLabel);
  }

  /**
   * @return element symbol or null for an unknown atomic number
   */
  @Nullable String symbol(int atomicNumber);

  /**
   * @return atomic number or null for an unknown symbol (case-insensitive)
   */
  @Nullable Integer atomicNumber(@NotNull String symbol);

  /**
   * @return the tabulated edge labels of an element, empty if unknown
   */
  @NotNull Set<String> edgeLabels(int atomicNumber);
}
