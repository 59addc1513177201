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

package io.github.xasdb.util.exceptions;

/**
 * A supplied edge energy lies outside the energy span of the spectrum. Only raised when strict edge
 * validation is requested, otherwise the edge is derived from the data instead.
 */
public class EdgeOutOfRangeException extends XafsProcessingException {

  private final double edgeEnergy;
  private final double minEnergy;
  private final double maxEnergy;

  public EdgeOutOfRangeException(double edgeEnergy, double minEnergy, double maxEnergy) {
    super("Edge energy %s is outside of the spectrum energy range [%s, %s]".formatted(edgeEnergy,
        minEnergy, maxEnergy));
    this.edgeEnergy = edgeEnergy;
    this.minEnergy = minEnergy;
    this.maxEnergy = maxEnergy;
  }

  public double getEdgeEnergy() {
    return edgeEnergy;
  }

  public double getMinEnergy() {
    return minEnergy;
  }

  public double getMaxEnergy() {
    return maxEnergy;
  }
}
