/*
 * Copyright (c) 2025 The imcomplexity Development Team
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

package io.github.imcomplexity.parameters;

import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface ParameterSet {

  @NotNull Parameter<?>[] getParameters();

  /**
   * @param parameter the prototype (static) parameter
   * @return the instance held by this set
   */
  @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter);

  default <V> @Nullable V getValue(@NotNull Parameter<V> parameter) {
    return getParameter(parameter).getValue();
  }

  default <V> void setParameter(@NotNull Parameter<V> parameter, @Nullable V value) {
    getParameter(parameter).setValue(value);
  }

  /**
   * @return true if all values are valid, otherwise errorMessages lists the problems
   */
  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();
}
