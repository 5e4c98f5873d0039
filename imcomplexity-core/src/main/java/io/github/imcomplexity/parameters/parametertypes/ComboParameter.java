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

package io.github.imcomplexity.parameters.parametertypes;

import io.github.imcomplexity.parameters.Parameter;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One value out of a fixed set of choices.
 */
public class ComboParameter<E> implements Parameter<E> {

  private final String name;
  private final String description;
  private final List<E> choices;
  private E value;

  public ComboParameter(String name, String description, E[] choices, E defaultValue) {
    this.name = name;
    this.description = description;
    this.choices = List.copyOf(Arrays.asList(choices));
    this.value = defaultValue;
  }

  private ComboParameter(String name, String description, List<E> choices, E value) {
    this.name = name;
    this.description = description;
    this.choices = choices;
    this.value = value;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  public @NotNull List<E> getChoices() {
    return choices;
  }

  @Override
  public @Nullable E getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable E newValue) {
    this.value = newValue;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(name + " is not set properly");
      return false;
    }
    if (!choices.contains(value)) {
      errorMessages.add(name + " must be one of " + choices + " but was " + value);
      return false;
    }
    return true;
  }

  @Override
  public @NotNull ComboParameter<E> cloneParameter() {
    return new ComboParameter<>(name, description, choices, value);
  }
}
