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

package io.github.xasdb.parameters.parametertypes;

import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DoubleParameter extends AbstractParameter<Double> {

  private final @NotNull NumberFormat format;
  private final @Nullable Double minimum;
  private final @Nullable Double maximum;

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue) {
    this(name, description, format, defaultValue, null, null);
  }

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue, @Nullable Double minimum,
      @Nullable Double maximum) {
    super(name, description, defaultValue);
    this.format = format;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  @Override
  public void setValueFromString(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return;
    }
    try {
      setValue(Double.parseDouble(text.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Cannot parse value of %s: '%s'".formatted(getName(), text), e);
    }
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(getName() + " is not set properly");
      return false;
    }
    if (Double.isNaN(value)) {
      errorMessages.add(getName() + " is not a number");
      return false;
    }
    if (minimum != null && value < minimum) {
      errorMessages.add("%s lower than the minimum of %s".formatted(getName(),
          format.format(minimum)));
      return false;
    }
    if (maximum != null && value > maximum) {
      errorMessages.add("%s greater than the maximum of %s".formatted(getName(),
          format.format(maximum)));
      return false;
    }
    return true;
  }

  @Override
  public @NotNull DoubleParameter cloneParameter() {
    return new DoubleParameter(getName(), getDescription(), format, value, minimum, maximum);
  }
}
