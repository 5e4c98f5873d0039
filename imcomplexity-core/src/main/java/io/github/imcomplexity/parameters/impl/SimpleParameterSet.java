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

package io.github.imcomplexity.parameters.impl;

import io.github.imcomplexity.parameters.Parameter;
import io.github.imcomplexity.parameters.ParameterSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

public class SimpleParameterSet implements ParameterSet {

  private final @NotNull Parameter<?>[] parameters;

  public SimpleParameterSet(@NotNull Parameter<?>... parameters) {
    this.parameters = new Parameter<?>[parameters.length];
    for (int i = 0; i < parameters.length; i++) {
      this.parameters[i] = parameters[i].cloneParameter();
    }
  }

  @Override
  public @NotNull Parameter<?>[] getParameters() {
    return parameters.clone();
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter) {
    for (Parameter<?> p : parameters) {
      if (p.getName().equals(parameter.getName())) {
        return (T) p;
      }
    }
    throw new IllegalArgumentException(
        "Parameter " + parameter.getName() + " does not exist in " + getClass().getSimpleName());
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allValid = true;
    for (Parameter<?> p : parameters) {
      allValid &= p.checkValue(errorMessages);
    }
    return allValid;
  }

  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    return new SimpleParameterSet(parameters);
  }

  @Override
  public String toString() {
    return Arrays.stream(parameters).map(p -> p.getName() + "=" + p.getValue())
        .collect(Collectors.joining(", ", getClass().getSimpleName() + "{", "}"));
  }
}
