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

package io.github.imcomplexity.modules;

import io.github.imcomplexity.parameters.ParameterSet;
import io.github.imcomplexity.taskcontrol.Task;
import io.github.imcomplexity.util.ExitCode;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * A module creates tasks for a batch of inputs. Tasks are run by the caller.
 *
 * @param <I> input type
 */
public interface ProcessingModule<I> {

  @NotNull String getName();

  @NotNull String getDescription();

  @NotNull Class<? extends ParameterSet> getParameterSetClass();

  @NotNull ExitCode runModule(@NotNull ParameterSet parameters, @NotNull List<I> inputs,
      @NotNull Collection<Task> tasks);
}
