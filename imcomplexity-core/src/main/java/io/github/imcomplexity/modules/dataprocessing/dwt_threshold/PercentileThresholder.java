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

import io.github.imcomplexity.datamodel.ChannelStack;
import io.github.imcomplexity.util.MathUtils;
import io.github.imcomplexity.util.exceptions.ConfigException;
import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.math3.util.ResizableDoubleArray;
import org.jetbrains.annotations.NotNull;

/**
 * Keeps the strongest coefficients of one detail orientation. The magnitude percentile is
 * computed per channel over all levels at once, then every coefficient at or above the cutoff of
 * its channel is kept with its sign.
 */
public class PercentileThresholder {

  private static final Logger logger = Logger.getLogger(PercentileThresholder.class.getName());

  private final double percentile;

  /**
   * @param percentile in [0, 100]
   */
  public PercentileThresholder(double percentile) {
    if (Double.isNaN(percentile) || percentile < 0d || percentile > 100d) {
      throw new ConfigException("Threshold percentile must be within [0, 100] but was "
          + percentile);
    }
    this.percentile = percentile;
  }

  public double getPercentile() {
    return percentile;
  }

  /**
   * @param levels one detail orientation of all levels, finest first
   * @return the per channel thresholds and surviving coefficients
   */
  public @NotNull ThresholdSelection select(@NotNull List<ChannelStack> levels) {
    final double[] thresholds = computeThresholds(levels);
    final ResizableDoubleArray survivors = new ResizableDoubleArray();
    for (ChannelStack level : levels) {
      for (int c = 0; c < level.getNumberOfChannels(); c++) {
        for (double v : level.flattenChannel(c)) {
          if (Math.abs(v) >= thresholds[c]) {
            survivors.addElement(v);
          }
        }
      }
    }
    final ThresholdSelection selection = new ThresholdSelection(thresholds,
        survivors.getElements());
    logger.fine(() -> "Percentile " + percentile + ": " + selection);
    return selection;
  }

  /**
   * @return the magnitude percentile of each channel over all levels
   */
  public @NotNull double[] computeThresholds(@NotNull List<ChannelStack> levels) {
    if (levels.isEmpty()) {
      throw new DimensionException("No levels to threshold");
    }
    final int channels = levels.get(0).getNumberOfChannels();
    int total = 0;
    for (ChannelStack level : levels) {
      if (level.getNumberOfChannels() != channels) {
        throw new DimensionException(
            "All levels need " + channels + " channels but found " + level.getShapeString());
      }
      total += level.getHeight() * level.getWidth();
    }

    final double[] thresholds = new double[channels];
    final double[] magnitudes = new double[total];
    for (int c = 0; c < channels; c++) {
      int offset = 0;
      for (ChannelStack level : levels) {
        for (double v : level.flattenChannel(c)) {
          magnitudes[offset++] = Math.abs(v);
        }
      }
      thresholds[c] = MathUtils.calcPercentile(magnitudes, percentile);
    }
    return thresholds;
  }
}
