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

package io.github.imcomplexity.datamodel;

import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Optional region of interest of an image. Values of any numeric range; a pixel is in the region
 * if its value is greater than {@link #REGION_CUTOFF}. The mask may have a different resolution
 * than the image it belongs to.
 */
public final class RegionMask {

  public static final double REGION_CUTOFF = 0d;

  /**
   * Cutoff used by display collaborators (alpha channel like masks). Not used for scoring.
   */
  public static final double DISPLAY_CUTOFF = 128d;

  private final double[][] values;
  private final int height;
  private final int width;

  private RegionMask(double[][] values, int height, int width) {
    this.values = values;
    this.height = height;
    this.width = width;
  }

  /**
   * @param values [row][column], copied. An empty array results in a mask of zero area.
   */
  public static @NotNull RegionMask fromValues(@NotNull double[][] values) {
    final int height = values.length;
    final int width = height == 0 ? 0 : values[0].length;
    final double[][] copy = new double[height][];
    for (int r = 0; r < height; r++) {
      if (values[r].length != width) {
        throw new DimensionException(
            "Mask row " + r + " has " + values[r].length + " columns, expected " + width);
      }
      copy[r] = Arrays.copyOf(values[r], width);
    }
    return new RegionMask(copy, height, width);
  }

  public static @NotNull RegionMask fromBooleans(@NotNull boolean[][] inRegion) {
    final double[][] values = new double[inRegion.length][];
    for (int r = 0; r < inRegion.length; r++) {
      values[r] = new double[inRegion[r].length];
      for (int x = 0; x < inRegion[r].length; x++) {
        values[r][x] = inRegion[r][x] ? 1d : 0d;
      }
    }
    return fromValues(values);
  }

  public static @NotNull RegionMask filled(int height, int width, double value) {
    final double[][] values = new double[height][width];
    for (double[] row : values) {
      Arrays.fill(row, value);
    }
    return new RegionMask(values, height, width);
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  public boolean hasZeroArea() {
    return height == 0 || width == 0;
  }

  public double getValue(int row, int column) {
    return values[row][column];
  }

  public boolean isInRegion(int row, int column) {
    return values[row][column] > REGION_CUTOFF;
  }

  @Override
  public String toString() {
    return "RegionMask(" + height + ", " + width + ")";
  }
}
