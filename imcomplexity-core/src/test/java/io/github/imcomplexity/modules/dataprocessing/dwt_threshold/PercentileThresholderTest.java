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
import io.github.imcomplexity.util.exceptions.ConfigException;
import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PercentileThresholderTest {

  @Test
  void keepsTopPercent() {
    final double[][] values = new double[10][10];
    for (int r = 0; r < 10; r++) {
      for (int x = 0; x < 10; x++) {
        values[r][x] = r * 10 + x + 1;
      }
    }
    final ThresholdSelection selection = new PercentileThresholder(99).select(
        List.of(ChannelStack.fromSingleChannel(values)));
    Assertions.assertEquals(99.01, selection.thresholds()[0], 1e-9);
    Assertions.assertArrayEquals(new double[]{100}, selection.survivors(), 0d);
    Assertions.assertEquals(100d, selection.sumOfMagnitudes(), 0d);
  }

  @Test
  void survivorsKeepTheirSign() {
    final ChannelStack level = ChannelStack.fromSingleChannel(new double[][]{{-5, 1}, {2, 3}});
    final ThresholdSelection selection = new PercentileThresholder(50).select(List.of(level));
    Assertions.assertEquals(2.5, selection.thresholds()[0], 1e-12);
    Assertions.assertArrayEquals(new double[]{-5, 3}, selection.survivors(), 0d);
    Assertions.assertEquals(8d, selection.sumOfMagnitudes(), 1e-12);
  }

  @Test
  void thresholdSpansAllLevels() {
    final List<ChannelStack> levels = List.of(
        ChannelStack.fromSingleChannel(new double[][]{{1, 2}}),
        ChannelStack.fromSingleChannel(new double[][]{{10}}));
    final ThresholdSelection selection = new PercentileThresholder(100).select(levels);
    Assertions.assertEquals(10d, selection.thresholds()[0], 0d);
    Assertions.assertArrayEquals(new double[]{10}, selection.survivors(), 0d);
  }

  @Test
  void channelsThresholdedSeparately() {
    final ChannelStack level = ChannelStack.fromChannels(
        new double[][][]{{{1, 2, 3}}, {{100, 200, 300}}});
    final PercentileThresholder thresholder = new PercentileThresholder(50);
    Assertions.assertArrayEquals(new double[]{2, 200}, thresholder.computeThresholds(
        List.of(level)), 1e-12);
    // survivors ordered by channel
    Assertions.assertArrayEquals(new double[]{2, 3, 200, 300},
        thresholder.select(List.of(level)).survivors(), 0d);
  }

  @Test
  void zeroPercentileKeepsEverything() {
    final ChannelStack level = ChannelStack.fromSingleChannel(new double[][]{{0, -1}, {0, 4}});
    final ThresholdSelection selection = new PercentileThresholder(0).select(List.of(level));
    Assertions.assertEquals(4, selection.getNumberOfSurvivors());
    Assertions.assertEquals(5d, selection.sumOfMagnitudes(), 0d);
  }

  @Test
  void allZeroSubbandsSurviveAsZero() {
    final ChannelStack level = ChannelStack.zeros(4, 4, 2);
    final ThresholdSelection selection = new PercentileThresholder(99).select(List.of(level));
    Assertions.assertEquals(0d, selection.sumOfMagnitudes(), 0d);
  }

  @Test
  void invalidArguments() {
    Assertions.assertThrows(ConfigException.class, () -> new PercentileThresholder(-1));
    Assertions.assertThrows(ConfigException.class, () -> new PercentileThresholder(100.5));
    Assertions.assertThrows(ConfigException.class, () -> new PercentileThresholder(Double.NaN));
    Assertions.assertThrows(DimensionException.class,
        () -> new PercentileThresholder(50).select(List.of()));
    Assertions.assertThrows(DimensionException.class,
        () -> new PercentileThresholder(50).select(
            List.of(ChannelStack.zeros(2, 2, 1), ChannelStack.zeros(1, 1, 3))));
  }
}
