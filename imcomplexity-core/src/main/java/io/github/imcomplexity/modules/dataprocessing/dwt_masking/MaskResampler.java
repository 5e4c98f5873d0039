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

package io.github.imcomplexity.modules.dataprocessing.dwt_masking;

import io.github.imcomplexity.datamodel.RegionMask;
import io.github.imcomplexity.util.exceptions.DimensionException;
import org.jetbrains.annotations.NotNull;

/**
 * Nearest-neighbor resampling of a region mask. Shapes are always given as (height, width), i.e.,
 * (rows, columns), for every level. Each target pixel takes the source pixel that contains its
 * center: src = floor((dst + 0.5) * srcSize / dstSize).
 */
public class MaskResampler {

  private MaskResampler() {
  }

  /**
   * @return [row][column] values of the mask resized to (height, width)
   */
  public static @NotNull double[][] resizeNearest(@NotNull RegionMask mask, int height,
      int width) {
    if (mask.hasZeroArea()) {
      throw new DimensionException("Cannot resize a mask of zero area " + mask);
    }
    if (height < 1 || width < 1) {
      throw new DimensionException(
          "Cannot resize " + mask + " to (" + height + ", " + width + ")");
    }
    final int[] rowIndex = sourceIndices(mask.getHeight(), height);
    final int[] columnIndex = sourceIndices(mask.getWidth(), width);
    final double[][] resized = new double[height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        resized[r][x] = mask.getValue(rowIndex[r], columnIndex[x]);
      }
    }
    return resized;
  }

  private static int[] sourceIndices(int sourceLength, int targetLength) {
    final int[] indices = new int[targetLength];
    final double ratio = sourceLength / (double) targetLength;
    for (int i = 0; i < targetLength; i++) {
      indices[i] = Math.min(sourceLength - 1, (int) Math.floor((i + 0.5) * ratio));
    }
    return indices;
  }
}
