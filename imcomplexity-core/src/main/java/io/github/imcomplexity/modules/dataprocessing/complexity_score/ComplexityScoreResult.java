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

package io.github.imcomplexity.modules.dataprocessing.complexity_score;

import com.google.common.collect.ImmutableMap;
import io.github.imcomplexity.datamodel.DetailOrientation;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import io.github.imcomplexity.modules.dataprocessing.dwt_threshold.ThresholdSelection;
import org.jetbrains.annotations.NotNull;

/**
 * Score of one image together with the intermediate data it was computed from. The raw pyramid
 * can be handed to visualization without decomposing the image again.
 *
 * @param score         sum of surviving coefficient magnitudes divided by the image pixel count
 * @param imageHeight   height of the scored image
 * @param imageWidth    width of the scored image
 * @param pyramid       unmasked decomposition of the normalized image
 * @param maskedPyramid decomposition after masking, same instance as pyramid without mask
 * @param selections    thresholded coefficients per detail orientation
 */
public record ComplexityScoreResult(double score, int imageHeight, int imageWidth,
                                    @NotNull WaveletPyramid pyramid,
                                    @NotNull WaveletPyramid maskedPyramid,
                                    @NotNull ImmutableMap<DetailOrientation, ThresholdSelection> selections) {

  public boolean isMasked() {
    return pyramid != maskedPyramid;
  }

  public @NotNull ThresholdSelection getSelection(@NotNull DetailOrientation orientation) {
    return selections.get(orientation);
  }

  public int getNumberOfSurvivors() {
    return selections.values().stream().mapToInt(ThresholdSelection::getNumberOfSurvivors).sum();
  }
}
