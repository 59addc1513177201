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

import org.jetbrains.annotations.NotNull;

/**
 * A fit window holds fewer usable samples than the requested polynomial degree needs.
 */
public class InsufficientDataException extends XafsProcessingException {

  private final int availablePoints;
  private final int requiredPoints;

  public InsufficientDataException(@NotNull String region, int availablePoints,
      int requiredPoints) {
    super("Not enough data points in the %s fit window: %d usable, %d required".formatted(region,
        availablePoints, requiredPoints));
    this.availablePoints = availablePoints;
    this.requiredPoints = requiredPoints;
  }

  public int getAvailablePoints() {
    return availablePoints;
  }

  public int getRequiredPoints() {
    return requiredPoints;
  }
}
