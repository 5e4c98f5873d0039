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

package io.github.imcomplexity.modules.dataprocessing.dwt_threshold;

import io.github.imcomplexity.util.MathUtils;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Coefficients of one detail orientation that passed the percentile threshold.
 *
 * @param thresholds per channel magnitude cutoff
 * @param survivors  signed values of all coefficients with |value| >= the cutoff of their
 *                   channel, ordered by level, then channel, then row-major position
 */
public record ThresholdSelection(double[] thresholds, double[] survivors) {

  public int getNumberOfSurvivors() {
    return survivors.length;
  }

  public double sumOfMagnitudes() {
    return MathUtils.sumAbs(survivors);
  }

  @Override
  public @NotNull String toString() {
    return "ThresholdSelection{thresholds=" + Arrays.toString(thresholds) + ", survivors="
        + survivors.length + '}';
  }
}
