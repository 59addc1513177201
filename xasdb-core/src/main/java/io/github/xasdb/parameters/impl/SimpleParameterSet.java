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

import io.github.xasdb.parameters.Parameter;
import io.github.xasdb.parameters.ParameterSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Parameter set that clones its prototypes on construction and looks them up by name.
 */
public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Map<String, Parameter<?>> parameters = new LinkedHashMap<>();

  public SimpleParameterSet(@NotNull Parameter<?>... parameters) {
    for (Parameter<?> p : parameters) {
      this.parameters.put(p.getName(), p.cloneParameter());
    }
  }

  @Override
  public @NotNull Parameter<?> @NotNull [] getParameters() {
    return parameters.values().toArray(Parameter<?>[]::new);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T extends Parameter<?>> @NotNull T getParameter(@NotNull T parameter) {
    final Parameter<?> own = parameters.get(parameter.getName());
    if (own == null) {
      throw new IllegalArgumentException(
          "Parameter " + parameter.getName() + " is not part of " + getClass().getSimpleName());
    }
    return (T) own;
  }

  /**
   * Sets values from properties keyed by {@code prefix + key}, where the key of each parameter is
   * supplied by the mapping. Keys without a property keep their value.
   *
   * @param keys parameter prototype to property key
   */
  public void loadValuesFromProperties(@NotNull Properties properties, @Nullable String prefix,
      @NotNull Map<Parameter<?>, String> keys) {
    final String pre = prefix == null ? "" : prefix;
    for (Map.Entry<Parameter<?>, String> entry : keys.entrySet()) {
      final String text = properties.getProperty(pre + entry.getValue());
      if (text == null || text.isBlank()) {
        continue;
      }
      getParameter(entry.getKey()).setValueFromString(text.trim());
      logger.fine(() -> "Set %s = %s".formatted(entry.getKey().getName(), text));
    }
  }

  /**
   * @return a set holding clones of this set's parameters, including their current values
   */
  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    return new SimpleParameterSet(getParameters());
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
    boolean first = true;
    for (Parameter<?> p : parameters.values()) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(p.getName()).append('=').append(p.getValue());
      first = false;
    }
    return sb.append('}').toString();
  }
}
