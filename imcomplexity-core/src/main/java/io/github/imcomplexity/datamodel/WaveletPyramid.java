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

import com.google.common.collect.ImmutableList;
import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Result of a multi-level decomposition: the final (coarsest) approximation and, per level, the
 * horizontal, vertical and diagonal detail subbands. Level index 0 is the finest (first)
 * decomposition, index {@code getNumberOfLevels() - 1} the coarsest.
 * <p>
 * Immutable. Masking derives a new pyramid via {@link #withDetails(List, List, List)}.
 */
public final class WaveletPyramid {

  private final @NotNull Wavelet wavelet;
  private final @NotNull ChannelStack approximation;
  private final @NotNull ImmutableList<ChannelStack> horizontal;
  private final @NotNull ImmutableList<ChannelStack> vertical;
  private final @NotNull ImmutableList<ChannelStack> diagonal;

  public WaveletPyramid(@NotNull Wavelet wavelet, @NotNull ChannelStack approximation,
      @NotNull List<ChannelStack> horizontal, @NotNull List<ChannelStack> vertical,
      @NotNull List<ChannelStack> diagonal) {
    if (horizontal.isEmpty() || horizontal.size() != vertical.size()
        || horizontal.size() != diagonal.size()) {
      throw new DimensionException(
          "Detail sequences must be non-empty and of equal length but were " + horizontal.size()
              + ", " + vertical.size() + ", " + diagonal.size());
    }
    for (int i = 0; i < horizontal.size(); i++) {
      final ChannelStack h = horizontal.get(i);
      if (!h.hasSameShape(vertical.get(i)) || !h.hasSameShape(diagonal.get(i))) {
        throw new DimensionException("Detail subbands of level " + i + " differ in shape");
      }
      if (h.getNumberOfChannels() != approximation.getNumberOfChannels()) {
        throw new DimensionException(
            "Level " + i + " has " + h.getNumberOfChannels() + " channels, approximation has "
                + approximation.getNumberOfChannels());
      }
    }
    this.wavelet = wavelet;
    this.approximation = approximation;
    this.horizontal = ImmutableList.copyOf(horizontal);
    this.vertical = ImmutableList.copyOf(vertical);
    this.diagonal = ImmutableList.copyOf(diagonal);
  }

  public @NotNull Wavelet getWavelet() {
    return wavelet;
  }

  public int getNumberOfLevels() {
    return horizontal.size();
  }

  public int getNumberOfChannels() {
    return approximation.getNumberOfChannels();
  }

  /**
   * @return cA of the coarsest level
   */
  public @NotNull ChannelStack getApproximation() {
    return approximation;
  }

  public @NotNull ImmutableList<ChannelStack> getDetails(@NotNull DetailOrientation orientation) {
    return switch (orientation) {
      case HORIZONTAL -> horizontal;
      case VERTICAL -> vertical;
      case DIAGONAL -> diagonal;
    };
  }

  public @NotNull ChannelStack getDetail(@NotNull DetailOrientation orientation, int level) {
    return getDetails(orientation).get(level);
  }

  /**
   * @return a pyramid with the same approximation and the given detail subbands
   */
  public @NotNull WaveletPyramid withDetails(@NotNull List<ChannelStack> horizontal,
      @NotNull List<ChannelStack> vertical, @NotNull List<ChannelStack> diagonal) {
    if (horizontal.size() != getNumberOfLevels()) {
      throw new DimensionException(
          "Expected " + getNumberOfLevels() + " levels but got " + horizontal.size());
    }
    for (int i = 0; i < horizontal.size(); i++) {
      if (!horizontal.get(i).hasSameShape(this.horizontal.get(i))) {
        throw new DimensionException("Replacement subbands of level " + i + " changed shape");
      }
    }
    return new WaveletPyramid(wavelet, approximation, horizontal, vertical, diagonal);
  }

  @Override
  public String toString() {
    return "WaveletPyramid{" + "wavelet=" + wavelet + ", levels=" + getNumberOfLevels()
        + ", approximation=" + approximation.getShapeString() + '}';
  }
}
