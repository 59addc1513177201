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

import java.util.Collection;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class BooleanParameter extends AbstractParameter<Boolean> {

  public BooleanParameter(@NotNull String name, @NotNull String description,
      boolean defaultValue) {
    super(name, description, defaultValue);
  }

  @Override
  public void setValueFromString(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return;
    }
    switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> setValue(true);
      case "false", "no", "0" -> setValue(false);
      default -> throw new IllegalArgumentException(
          "Cannot parse value of %s: '%s'".formatted(getName(), text));
    }
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    return true;
  }

  @Override
  public @NotNull BooleanParameter cloneParameter() {
    return new BooleanParameter(getName(), getDescription(), Boolean.TRUE.equals(value));
  }
}
