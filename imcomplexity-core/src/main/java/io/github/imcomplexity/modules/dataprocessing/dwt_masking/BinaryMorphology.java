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

import org.jetbrains.annotations.NotNull;

/**
 * 2D binary morphology on [row][column] boolean arrays. Structuring elements are odd sized and
 * centered.
 */
public class BinaryMorphology {

  private BinaryMorphology() {
  }

  /**
   * 3x3 structuring element. Connectivity 1 gives the 4-neighborhood cross, connectivity 2 the
   * full 8-neighborhood.
   */
  public static @NotNull boolean[][] generateStructure(int connectivity) {
    final boolean[][] structure = new boolean[3][3];
    for (int dr = -1; dr <= 1; dr++) {
      for (int dc = -1; dc <= 1; dc++) {
        structure[dr + 1][dc + 1] = Math.abs(dr) + Math.abs(dc) <= connectivity;
      }
    }
    return structure;
  }

  /**
   * Grows a structuring element by dilating it with itself, {@code iterations - 1} times. A 3x3
   * element iterated twice covers 5x5.
   */
  public static @NotNull boolean[][] iterateStructure(@NotNull boolean[][] structure,
      int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be >= 1 but was " + iterations);
    }
    final int size = structure.length;
    final int grownSize = (size - 1) * iterations + 1;
    final int offset = (grownSize - size) / 2;
    boolean[][] grown = new boolean[grownSize][grownSize];
    for (int r = 0; r < size; r++) {
      System.arraycopy(structure[r], 0, grown[r + offset], offset, size);
    }
    for (int i = 1; i < iterations; i++) {
      grown = dilate(grown, structure);
    }
    return grown;
  }

  /**
   * A pixel stays set only if every structuring element offset lands on a set pixel. Pixels
   * outside the array count as unset, so regions touching the border shrink as well.
   */
  public static @NotNull boolean[][] erode(@NotNull boolean[][] input,
      @NotNull boolean[][] structure) {
    final int height = input.length;
    final int width = height == 0 ? 0 : input[0].length;
    final int center = structure.length / 2;
    final boolean[][] out = new boolean[height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        out[r][x] = input[r][x] && fits(input, structure, center, r, x, height, width);
      }
    }
    return out;
  }

  public static @NotNull boolean[][] dilate(@NotNull boolean[][] input,
      @NotNull boolean[][] structure) {
    final int height = input.length;
    final int width = height == 0 ? 0 : input[0].length;
    final int center = structure.length / 2;
    final boolean[][] out = new boolean[height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        if (!input[r][x]) {
          continue;
        }
        for (int sr = 0; sr < structure.length; sr++) {
          for (int sc = 0; sc < structure[sr].length; sc++) {
            final int rr = r + sr - center;
            final int xx = x + sc - center;
            if (structure[sr][sc] && rr >= 0 && rr < height && xx >= 0 && xx < width) {
              out[rr][xx] = true;
            }
          }
        }
      }
    }
    return out;
  }

  private static boolean fits(boolean[][] input, boolean[][] structure, int center, int r, int x,
      int height, int width) {
    for (int sr = 0; sr < structure.length; sr++) {
      for (int sc = 0; sc < structure[sr].length; sc++) {
        if (!structure[sr][sc]) {
          continue;
        }
        final int rr = r + sr - center;
        final int xx = x + sc - center;
        if (rr < 0 || rr >= height || xx < 0 || xx >= width || !input[rr][xx]) {
          return false;
        }
      }
    }
    return true;
  }
}
