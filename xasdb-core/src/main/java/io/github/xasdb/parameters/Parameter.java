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

import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named, described value of a processing step. Static instances act as prototypes, every
 * {@link ParameterSet} holds its own clones.
 *
 * @param <ValueType> type of the held value
 */
public interface Parameter<ValueType> {

  @NotNull String getName();

  @NotNull String getDescription();

  @Nullable ValueType getValue();

  void setValue(@Nullable ValueType value);

  /**
   * Parses a textual value, e.g. from a system property. Blank text keeps the current value.
   *
   * @throws IllegalArgumentException if the text cannot be parsed
   */
  void setValueFromString(@Nullable String text);

  /**
   * @param errorMessages receives a message for each problem found
   * @return true if the current value is acceptable
   */
  boolean checkValue(@NotNull Collection<String> errorMessages);

  @NotNull Parameter<ValueType> cloneParameter();
}
