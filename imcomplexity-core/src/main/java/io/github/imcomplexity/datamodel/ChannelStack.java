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
import java.awt.image.BufferedImage;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Dense (height, width, channels) array of doubles. Used for input images as well as for
 * approximation and detail subbands, where each channel holds the coefficients of the
 * corresponding image channel. Values are stored channel-indexed ([channel][row][column]).
 * <p>
 * Instances are immutable: factories copy their input and all accessors return copies.
 */
public final class ChannelStack {

  private final double[][][] data;
  private final int height;
  private final int width;

  private ChannelStack(double[][][] data) {
    this.data = data;
    this.height = data[0].length;
    this.width = data[0][0].length;
  }

  public static @NotNull ChannelStack zeros(int height, int width, int channels) {
    checkShape(height, width, channels);
    return new ChannelStack(new double[channels][height][width]);
  }

  /**
   * @param channels [channel][row][column], all channels of equal shape. Copied.
   */
  public static @NotNull ChannelStack fromChannels(@NotNull double[][][] channels) {
    if (channels.length == 0 || channels[0].length == 0 || channels[0][0].length == 0) {
      throw new DimensionException("Channel stack needs at least one channel, row and column");
    }
    final int height = channels[0].length;
    final int width = channels[0][0].length;
    final double[][][] copy = new double[channels.length][height][];
    for (int c = 0; c < channels.length; c++) {
      if (channels[c].length != height) {
        throw new DimensionException(
            "Channel " + c + " has " + channels[c].length + " rows, expected " + height);
      }
      for (int r = 0; r < height; r++) {
        if (channels[c][r].length != width) {
          throw new DimensionException(
              "Row " + r + " of channel " + c + " has " + channels[c][r].length
                  + " columns, expected " + width);
        }
        copy[c][r] = Arrays.copyOf(channels[c][r], width);
      }
    }
    return new ChannelStack(copy);
  }

  public static @NotNull ChannelStack fromSingleChannel(@NotNull double[][] values) {
    return fromChannels(new double[][][]{values});
  }

  /**
   * @param values row-major (height, width, channels) layout, i.e., the channels of a pixel are
   *               adjacent
   */
  public static @NotNull ChannelStack fromInterleaved(@NotNull double[] values, int height,
      int width, int channels) {
    checkShape(height, width, channels);
    if (values.length != height * width * channels) {
      throw new DimensionException(
          "Expected " + height * width * channels + " values for shape (" + height + ", " + width
              + ", " + channels + ") but got " + values.length);
    }
    final double[][][] data = new double[channels][height][width];
    int i = 0;
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        for (int c = 0; c < channels; c++) {
          data[c][r][x] = values[i++];
        }
      }
    }
    return new ChannelStack(data);
  }

  /**
   * RGB channels of an already decoded image in [0, 255]. Alpha is ignored.
   */
  public static @NotNull ChannelStack fromRgbImage(@NotNull BufferedImage image) {
    final int height = image.getHeight();
    final int width = image.getWidth();
    checkShape(height, width, 3);
    final double[][][] data = new double[3][height][width];
    for (int r = 0; r < height; r++) {
      for (int x = 0; x < width; x++) {
        final int rgb = image.getRGB(x, r);
        data[0][r][x] = (rgb >> 16) & 0xFF;
        data[1][r][x] = (rgb >> 8) & 0xFF;
        data[2][r][x] = rgb & 0xFF;
      }
    }
    return new ChannelStack(data);
  }

  private static void checkShape(int height, int width, int channels) {
    if (height < 1 || width < 1 || channels < 1) {
      throw new DimensionException(
          "Invalid shape (" + height + ", " + width + ", " + channels + ")");
    }
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  public int getNumberOfChannels() {
    return data.length;
  }

  public int size() {
    return height * width * data.length;
  }

  public double getValue(int channel, int row, int column) {
    return data[channel][row][column];
  }

  public @NotNull double[][] copyChannel(int channel) {
    final double[][] copy = new double[height][];
    for (int r = 0; r < height; r++) {
      copy[r] = Arrays.copyOf(data[channel][r], width);
    }
    return copy;
  }

  /**
   * @return the values of one channel in row-major order
   */
  public @NotNull double[] flattenChannel(int channel) {
    final double[] flat = new double[height * width];
    for (int r = 0; r < height; r++) {
      System.arraycopy(data[channel][r], 0, flat, r * width, width);
    }
    return flat;
  }

  public double max() {
    double max = Double.NEGATIVE_INFINITY;
    for (double[][] channel : data) {
      for (double[] row : channel) {
        for (double v : row) {
          max = Math.max(max, v);
        }
      }
    }
    return max;
  }

  public @NotNull ChannelStack scale(double factor) {
    final double[][][] scaled = new double[data.length][height][width];
    for (int c = 0; c < data.length; c++) {
      for (int r = 0; r < height; r++) {
        for (int x = 0; x < width; x++) {
          scaled[c][r][x] = data[c][r][x] * factor;
        }
      }
    }
    return new ChannelStack(scaled);
  }

  /**
   * Zeroes every value outside the mask, identically for all channels.
   *
   * @param mask [row][column] of this stack's height and width
   */
  public @NotNull ChannelStack multiplyByMask(@NotNull boolean[][] mask) {
    if (mask.length != height || mask[0].length != width) {
      throw new DimensionException(
          "Mask shape (" + mask.length + ", " + (mask.length == 0 ? 0 : mask[0].length)
              + ") does not match " + getShapeString());
    }
    final double[][][] masked = new double[data.length][height][width];
    for (int c = 0; c < data.length; c++) {
      for (int r = 0; r < height; r++) {
        for (int x = 0; x < width; x++) {
          masked[c][r][x] = mask[r][x] ? data[c][r][x] : 0d;
        }
      }
    }
    return new ChannelStack(masked);
  }

  public boolean hasSameShape(@NotNull ChannelStack other) {
    return height == other.height && width == other.width
        && data.length == other.data.length;
  }

  public @NotNull String getShapeString() {
    return "(" + height + ", " + width + ", " + data.length + ")";
  }

  @Override
  public String toString() {
    return "ChannelStack" + getShapeString();
  }
}
