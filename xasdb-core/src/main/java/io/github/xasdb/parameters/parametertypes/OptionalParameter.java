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

import io.github.xasdb.parameters.Parameter;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Wraps a parameter that only applies when selected. The value of this parameter is the selection,
 * the embedded parameter holds the actual value.
 */
public class OptionalParameter<EmbeddedParameterType extends Parameter<?>> extends
    AbstractParameter<Boolean> {

  private final @NotNull EmbeddedParameterType embeddedParameter;

  public OptionalParameter(@NotNull EmbeddedParameterType embeddedParameter) {
    this(embeddedParameter, false);
  }

  public OptionalParameter(@NotNull EmbeddedParameterType embeddedParameter, boolean selected) {
    super(embeddedParameter.getName(), embeddedParameter.getDescription(), selected);
    this.embeddedParameter = embeddedParameter;
  }

  public @NotNull EmbeddedParameterType getEmbeddedParameter() {
    return embeddedParameter;
  }

  /**
   * Parses the embedded value and selects this parameter.
   */
  @Override
  public void setValueFromString(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return;
    }
    embeddedParameter.setValueFromString(text);
    setValue(true);
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!Boolean.TRUE.equals(value)) {
      return true;
    }
    return embeddedParameter.checkValue(errorMessages);
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull OptionalParameter<EmbeddedParameterType> cloneParameter() {
    final EmbeddedParameterType embeddedClone = (EmbeddedParameterType) embeddedParameter.cloneParameter();
    return new OptionalParameter<>(embeddedClone, Boolean.TRUE.equals(value));
  }
}
