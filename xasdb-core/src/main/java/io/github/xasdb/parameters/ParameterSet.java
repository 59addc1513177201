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

package io.github.xasdb.parameters;

import io.github.xasdb.parameters.parametertypes.OptionalParameter;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface ParameterSet {

  @NotNull Parameter<?> @NotNull [] getParameters();

  /**
   * @param parameter the static prototype of the parameter
   * @return this set's own instance of the parameter
   */
  <T extends Parameter<?>> @NotNull T getParameter(@NotNull T parameter);

  default <V> @Nullable V getValue(@NotNull Parameter<V> parameter) {
    return getParameter(parameter).getValue();
  }

  default <V> void setParameter(@NotNull Parameter<V> parameter, @Nullable V value) {
    getParameter(parameter).setValue(value);
  }

  default <V, P extends Parameter<V>> void setParameter(@NotNull OptionalParameter<P> parameter,
      boolean selected, @Nullable V value) {
    final OptionalParameter<P> own = getParameter(parameter);
    own.setValue(selected);
    own.getEmbeddedParameter().setValue(value);
  }

  /**
   * @return the embedded value if the optional parameter is selected, the default otherwise
   */
  default <V, P extends Parameter<V>> @Nullable V getEmbeddedParameterValueIfSelectedOrElse(
      @NotNull OptionalParameter<P> parameter, @Nullable V defaultValue) {
    final OptionalParameter<P> own = getParameter(parameter);
    if (!Boolean.TRUE.equals(own.getValue())) {
      return defaultValue;
    }
    final V value = own.getEmbeddedParameter().getValue();
    return value != null ? value : defaultValue;
  }

  /**
   * @return true if all values are valid. Problems are added to errorMessages.
   */
  default boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean ok = true;
    for (Parameter<?> p : getParameters()) {
      ok &= p.checkValue(errorMessages);
    }
    return ok;
  }

  @NotNull ParameterSet cloneParameterSet();
}
