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
import io.github.imcomplexity.datamodel.Wavelet;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import io.github.imcomplexity.util.MathUtils;
import io.github.imcomplexity.util.exceptions.ConfigException;
import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Decomposes every channel of an image independently by applying the single-level transform
 * {@code levels} times, each time on the approximation of the previous level (finest level
 * first). Results of all channels are written into channel-indexed containers that are allocated
 * up front.
 */
public class WaveletPyramidBuilder {

  private static final Logger logger = Logger.getLogger(WaveletPyramidBuilder.class.getName());

  private final @NotNull Wavelet wavelet;
  private final @NotNull DiscreteWaveletTransform2D transform;

  public WaveletPyramidBuilder(@NotNull Wavelet wavelet) {
    this.wavelet = wavelet;
    this.transform = new DiscreteWaveletTransform2D(wavelet);
  }

  /**
   * @throws DimensionException if levels exceeds floor(log2(min(height, width)))
   */
  public @NotNull WaveletPyramid build(@NotNull ChannelStack image, int levels) {
    checkLevels(image.getHeight(), image.getWidth(), levels);

    final int channels = image.getNumberOfChannels();
    final double[][][] approximation = new double[channels][][];
    final double[][][][] horizontal = new double[levels][channels][][];
    final double[][][][] vertical = new double[levels][channels][][];
    final double[][][][] diagonal = new double[levels][channels][][];

    for (int c = 0; c < channels; c++) {
      double[][] current = image.copyChannel(c);
      for (int i = 0; i < levels; i++) {
        final DiscreteWaveletTransform2D.Coefficients coeffs = transform.forward(current);
        horizontal[i][c] = coeffs.horizontal();
        vertical[i][c] = coeffs.vertical();
        diagonal[i][c] = coeffs.diagonal();
        current = coeffs.approximation();
      }
      approximation[c] = current;
    }

    final List<ChannelStack> cH = new ArrayList<>(levels);
    final List<ChannelStack> cV = new ArrayList<>(levels);
    final List<ChannelStack> cD = new ArrayList<>(levels);
    for (int i = 0; i < levels; i++) {
      cH.add(ChannelStack.fromChannels(horizontal[i]));
      cV.add(ChannelStack.fromChannels(vertical[i]));
      cD.add(ChannelStack.fromChannels(diagonal[i]));
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest("Level " + i + " detail shape " + cH.get(i).getShapeString());
      }
    }
    final WaveletPyramid pyramid = new WaveletPyramid(wavelet,
        ChannelStack.fromChannels(approximation), cH, cV, cD);
    logger.fine(() -> "Decomposed image " + image.getShapeString() + " into " + pyramid);
    return pyramid;
  }

  public @NotNull DiscreteWaveletTransform2D getTransform() {
    return transform;
  }

  static void checkLevels(int height, int width, int levels) {
    if (levels < 1) {
      throw new ConfigException("Number of levels must be at least 1 but was " + levels);
    }
    final int maxLevels = MathUtils.maxDyadicLevels(Math.min(height, width));
    if (levels > maxLevels) {
      throw new DimensionException(
          "Image of size " + height + "x" + width + " supports at most " + maxLevels
              + " levels, requested " + levels);
    }
  }
}
