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
import io.github.imcomplexity.datamodel.Wavelet;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import io.github.imcomplexity.modules.dataprocessing.dwt_pyramid.WaveletPyramidBuilder;
import io.github.imcomplexity.util.TestImages;
import io.github.imcomplexity.util.exceptions.DimensionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MaskProjectorTest {

  private final MaskProjector projector = new MaskProjector();

  @Test
  void erosionStructureIsFiveByFive() {
    final boolean[][] structure = MaskProjector.getErosionStructure();
    Assertions.assertEquals(5, structure.length);
    structure[0][0] = false;
    Assertions.assertTrue(MaskProjector.getErosionStructure()[0][0]);
  }

  @Test
  void fullMaskLosesBorder() {
    final boolean[][] projected = projector.projectMask(RegionMask.filled(3, 3, 255), 10, 10);
    for (int r = 0; r < 10; r++) {
      for (int x = 0; x < 10; x++) {
        final boolean inner = r >= 2 && r <= 7 && x >= 2 && x <= 7;
        Assertions.assertEquals(inner, projected[r][x], r + "," + x);
      }
    }
  }

  @Test
  void rowsAndColumnsKeepTheirAxes() {
    // 4 rows x 8 columns, top half in region
    final double[][] values = new double[4][8];
    java.util.Arrays.fill(values[0], 255);
    java.util.Arrays.fill(values[1], 255);
    final boolean[][] projected = projector.projectMask(RegionMask.fromValues(values), 16, 32);
    Assertions.assertEquals(16, projected.length);
    Assertions.assertEquals(32, projected[0].length);
    for (int r = 0; r < 16; r++) {
      for (int x = 0; x < 32; x++) {
        final boolean inner = r >= 2 && r <= 5 && x >= 2 && x <= 29;
        Assertions.assertEquals(inner, projected[r][x], r + "," + x);
      }
    }
  }

  @Test
  void anyPositiveValueIsInRegion() {
    final boolean[][] projected = projector.projectMask(RegionMask.filled(8, 8, 1), 8, 8);
    Assertions.assertTrue(projected[4][4]);
    final boolean[][] none = projector.projectMask(RegionMask.filled(8, 8, 0), 8, 8);
    Assertions.assertFalse(none[4][4]);
  }

  @Test
  void zeroAreaMask() {
    final WaveletPyramid pyramid = new WaveletPyramidBuilder(Wavelet.HAAR).build(
        TestImages.noise(16, 16, 1, 1d, 1), 2);
    Assertions.assertThrows(DimensionException.class,
        () -> projector.apply(pyramid, RegionMask.fromValues(new double[0][0])));
    Assertions.assertThrows(DimensionException.class,
        () -> projector.projectMask(RegionMask.fromValues(new double[3][0]), 4, 4));
  }

  @Test
  void masksDetailsOnly() {
    final WaveletPyramid pyramid = new WaveletPyramidBuilder(Wavelet.HAAR).build(
        TestImages.noise(32, 32, 3, 1d, 2), 2);
    final double[] before = pyramid.getDetail(DetailOrientation.DIAGONAL, 0).flattenChannel(2);

    final WaveletPyramid masked = projector.apply(pyramid, RegionMask.filled(32, 32, 255));

    Assertions.assertSame(pyramid.getApproximation(), masked.getApproximation());
    Assertions.assertArrayEquals(before,
        pyramid.getDetail(DetailOrientation.DIAGONAL, 0).flattenChannel(2), 0d);

    for (DetailOrientation orientation : DetailOrientation.values()) {
      final ChannelStack original = pyramid.getDetail(orientation, 0);
      final ChannelStack result = masked.getDetail(orientation, 0);
      for (int c = 0; c < 3; c++) {
        // border of the 16x16 subband is removed by erosion
        Assertions.assertEquals(0d, result.getValue(c, 0, 5));
        Assertions.assertEquals(0d, result.getValue(c, 15, 15));
        Assertions.assertEquals(original.getValue(c, 8, 8), result.getValue(c, 8, 8));
      }
    }
  }
}
