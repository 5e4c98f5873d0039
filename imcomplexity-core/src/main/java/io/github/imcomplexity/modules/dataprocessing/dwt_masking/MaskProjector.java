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

import io.github.imcomplexity.datamodel.ChannelStack;
import io.github.imcomplexity.datamodel.DetailOrientation;
import io.github.imcomplexity.datamodel.RegionMask;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Projects a region mask onto every level of a pyramid: resize to the subband resolution,
 * threshold at {@link RegionMask#REGION_CUTOFF}, erode and zero all detail coefficients outside
 * the eroded region. The approximation is never masked. Inputs are not modified.
 */
public class MaskProjector {

  private static final Logger logger = Logger.getLogger(MaskProjector.class.getName());

  /**
   * 5x5 square: the 8-connected 3x3 element iterated twice
   */
  private static final boolean[][] EROSION_STRUCTURE = BinaryMorphology.iterateStructure(
      BinaryMorphology.generateStructure(2), 2);

  public static @NotNull boolean[][] getErosionStructure() {
    final boolean[][] copy = new boolean[EROSION_STRUCTURE.length][];
    for (int r = 0; r < copy.length; r++) {
      copy[r] = EROSION_STRUCTURE[r].clone();
    }
    return copy;
  }

  /**
   * @return eroded in-region flags of shape (height, width)
   * @throws io.github.imcomplexity.util.exceptions.DimensionException if the mask has zero area
   *                                                                   or the target shape is
   *                                                                   empty
   */
  public @NotNull boolean[][] projectMask(@NotNull RegionMask mask, int height, int width) {
    final double[][] resized = MaskResampler.resizeNearest(mask, height, width);
    final boolean[][] inRegion = new boolean[height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        inRegion[r][x] = resized[r][x] > RegionMask.REGION_CUTOFF;
      }
    }
    return BinaryMorphology.erode(inRegion, EROSION_STRUCTURE);
  }

  public @NotNull WaveletPyramid apply(@NotNull WaveletPyramid pyramid, @NotNull RegionMask mask) {
    final int levels = pyramid.getNumberOfLevels();
    final List<ChannelStack> cH = new ArrayList<>(levels);
    final List<ChannelStack> cV = new ArrayList<>(levels);
    final List<ChannelStack> cD = new ArrayList<>(levels);
    for (int i = 0; i < levels; i++) {
      final ChannelStack h = pyramid.getDetail(DetailOrientation.HORIZONTAL, i);
      final boolean[][] levelMask = projectMask(mask, h.getHeight(), h.getWidth());
      cH.add(h.multiplyByMask(levelMask));
      cV.add(pyramid.getDetail(DetailOrientation.VERTICAL, i).multiplyByMask(levelMask));
      cD.add(pyramid.getDetail(DetailOrientation.DIAGONAL, i).multiplyByMask(levelMask));

      final int level = i;
      logger.fine(() -> "Level " + level + ": " + countSet(levelMask) + " of " + h.getHeight()
          * h.getWidth() + " coefficients in eroded region");
    }
    return pyramid.withDetails(cH, cV, cD);
  }

  private static int countSet(boolean[][] mask) {
    int count = 0;
    for (boolean[] row : mask) {
      for (boolean b : row) {
        if (b) {
          count++;
        }
      }
    }
    return count;
  }
}
