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

package io.github.imcomplexity.modules.dataprocessing.dwt_pyramid;

import io.github.imcomplexity.datamodel.ChannelStack;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import io.github.imcomplexity.util.MathUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Prepares pyramid subbands for external pseudo-color rendering. Does not render anything.
 */
public class PyramidDisplayNormalization {

  private PyramidDisplayNormalization() {
  }

  /**
   * Sums the coefficient magnitudes of all channels per pixel, normalizes to [0, 1] and inverts,
   * so strong details are dark on a bright background.
   *
   * @return [row][column] values in [0, 1]
   * @throws io.github.imcomplexity.util.exceptions.NormalizationException if all pixels have the
   *                                                                       same magnitude
   */
  public static @NotNull double[][] normalizeDetailMagnitude(@NotNull ChannelStack subband) {
    final int height = subband.getHeight();
    final int width = subband.getWidth();
    final double[] magnitude = new double[height * width];
    for (int c = 0; c < subband.getNumberOfChannels(); c++) {
      for (int r = 0; r < height; r++) {
        for (int x = 0; x < width; x++) {
          magnitude[r * width + x] += Math.abs(subband.getValue(c, r, x));
        }
      }
    }
    final double[] normalized = MathUtils.normalizeToUnitRange(magnitude);
    final double[][] out = new double[height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        out[r][x] = 1d - normalized[r * width + x];
      }
    }
    return out;
  }

  /**
   * Brings the approximation back to the input value range. Every level of an orthonormal
   * transform scales a constant signal by 2.
   */
  public static @NotNull ChannelStack scaleApproximation(@NotNull WaveletPyramid pyramid) {
    return pyramid.getApproximation().scale(1d / (1L << pyramid.getNumberOfLevels()));
  }
}
