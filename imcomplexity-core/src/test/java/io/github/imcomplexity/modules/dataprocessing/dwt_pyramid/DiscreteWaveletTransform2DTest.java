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

import io.github.imcomplexity.datamodel.Wavelet;
import io.github.imcomplexity.modules.dataprocessing.dwt_pyramid.DiscreteWaveletTransform2D.Coefficients;
import io.github.imcomplexity.util.exceptions.DimensionException;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DiscreteWaveletTransform2DTest {

  @Test
  void haarKnownValues() {
    final Coefficients c = new DiscreteWaveletTransform2D(Wavelet.HAAR).forward(
        new double[][]{{1, 2}, {3, 4}});
    Assertions.assertEquals(5d, c.approximation()[0][0], 1e-12);
    Assertions.assertEquals(-2d, c.horizontal()[0][0], 1e-12);
    Assertions.assertEquals(-1d, c.vertical()[0][0], 1e-12);
    Assertions.assertEquals(0d, c.diagonal()[0][0], 1e-12);
  }

  /**
   * A single row behaves like a 1D transform: the column pass over one sample yields two equal
   * rows scaled by sqrt(2). Expected values are the db2 "symmetric" mode coefficients of 0, 1, 2,
   * 3, 4.
   */
  @Test
  void db2SingleRowKnownValues() {
    final Coefficients c = new DiscreteWaveletTransform2D(Wavelet.DB2).forward(
        new double[][]{{0, 1, 2, 3, 4}});
    final double[] approximation = {0.3535533905932738, 0.8965754721680537, 3.854412119465504,
        5.691529426552888};
    final double[] detail = {-0.6123724356957945, 0d, 0.4829629131445342, 0.1294095225512607};
    final double sqrt2 = Math.sqrt(2);
    Assertions.assertEquals(2, c.approximation().length);
    for (int r = 0; r < 2; r++) {
      for (int o = 0; o < 4; o++) {
        Assertions.assertEquals(sqrt2 * approximation[o], c.approximation()[r][o], 1e-12);
        Assertions.assertEquals(sqrt2 * detail[o], c.vertical()[r][o], 1e-12);
        Assertions.assertEquals(0d, c.horizontal()[r][o], 1e-12);
        Assertions.assertEquals(0d, c.diagonal()[r][o], 1e-12);
      }
    }
  }

  @Test
  void db2KnownValues() {
    final double[][] values = {{0.0, 0.1, 0.4, 0.9, 0.5}, {0.3, 0.3, 0.5, 0.9, 0.4},
        {0.1, 0.0, 0.1, 0.4, 0.9}, {0.5, 0.3, 0.3, 0.5, 0.9}};
    final Coefficients c = new DiscreteWaveletTransform2D(Wavelet.DB2).forward(values);
    assertMatrixEquals(new double[][]{
        {0.18750000000000003, 0.19868602791855877, 1.4186297632095826, 1.0938702367904178},
        {0.3133974596215562, 0.29509618943233423, 1.3642949192431124, 1.067403810567666},
        {0.7125000000000001, 0.5316987298107781, 0.8532613454658644, 1.784238654534136}},
        c.approximation());
    assertMatrixEquals(new double[][]{
        {-0.23815698604072064, -0.2049038105676658, -0.023774047358083507, 0.08872595264191645},
        {-0.31830127018922194, -0.31830127018922194, -0.2814582562299425, 0.19485571585149875},
        {0.32475952641916456, 0.2915063509461097, 0.11037658773652742, -0.0021234122634725505}},
        c.horizontal());
    assertMatrixEquals(new double[][]{
        {-0.0649519052838329, -0.17320508075688773, -0.12556896660119582, 0.5369310333988043},
        {-0.03169872981077807, -0.17320508075688776, -0.11495190528383285, 0.4930607966083866},
        {0.1515544456622768, -0.17320508075688773, 0.2536778579257494, -0.05882214207425068}},
        c.vertical());
    assertMatrixEquals(new double[][]{
        {-0.0375, 0d, 0.02957531754730547, 0.007924682452694523},
        {0d, 0d, 0.1375, -0.1375},
        {0.0375, 0d, -0.029575317547305476, -0.00792468245269454}},
        c.diagonal());
  }

  private static void assertMatrixEquals(double[][] expected, double[][] actual) {
    Assertions.assertEquals(expected.length, actual.length);
    for (int r = 0; r < expected.length; r++) {
      Assertions.assertArrayEquals(expected[r], actual[r], 1e-12, "row " + r);
    }
  }

  @Test
  void horizontalEdgesOnlyInHorizontalDetail() {
    // rows alternate between 0 and 1: changes along axis 0 only
    final double[][] stripes = new double[8][8];
    for (int r = 0; r < 8; r += 2) {
      java.util.Arrays.fill(stripes[r], 1d);
    }
    final Coefficients c = new DiscreteWaveletTransform2D(Wavelet.HAAR).forward(stripes);
    for (int r = 0; r < 4; r++) {
      for (int x = 0; x < 4; x++) {
        Assertions.assertEquals(1d, Math.abs(c.horizontal()[r][x]), 1e-12);
        Assertions.assertEquals(0d, c.vertical()[r][x], 1e-12);
        Assertions.assertEquals(0d, c.diagonal()[r][x], 1e-12);
      }
    }
  }

  @Test
  void coefficientLengths() {
    Assertions.assertEquals(4, new DiscreteWaveletTransform2D(Wavelet.HAAR).coefficientLength(8));
    Assertions.assertEquals(5, new DiscreteWaveletTransform2D(Wavelet.HAAR).coefficientLength(9));
    Assertions.assertEquals(5, new DiscreteWaveletTransform2D(Wavelet.DB2).coefficientLength(8));
    Assertions.assertEquals(7, new DiscreteWaveletTransform2D(Wavelet.DB4).coefficientLength(7));

    final Coefficients c = new DiscreteWaveletTransform2D(Wavelet.DB3).forward(new double[7][10]);
    Assertions.assertEquals(6, c.diagonal().length);
    Assertions.assertEquals(7, c.diagonal()[0].length);
  }

  @Test
  void constantInputHasNoDetail() {
    final double[][] flat = new double[9][6];
    for (double[] row : flat) {
      java.util.Arrays.fill(row, 0.75);
    }
    for (Wavelet wavelet : Wavelet.values()) {
      final Coefficients c = new DiscreteWaveletTransform2D(wavelet).forward(flat);
      for (int r = 0; r < c.horizontal().length; r++) {
        for (int x = 0; x < c.horizontal()[r].length; x++) {
          Assertions.assertEquals(0d, c.horizontal()[r][x], 1e-12, wavelet.getFamilyName());
          Assertions.assertEquals(0d, c.vertical()[r][x], 1e-12, wavelet.getFamilyName());
          Assertions.assertEquals(0d, c.diagonal()[r][x], 1e-12, wavelet.getFamilyName());
          Assertions.assertEquals(1.5d, c.approximation()[r][x], 1e-12, wavelet.getFamilyName());
        }
      }
    }
  }

  @Test
  void perfectReconstruction() {
    final Random random = new Random(7);
    for (Wavelet wavelet : Wavelet.values()) {
      for (int[] shape : new int[][]{{8, 8}, {7, 9}, {3, 5}, {1, 4}}) {
        final double[][] values = new double[shape[0]][shape[1]];
        for (double[] row : values) {
          for (int x = 0; x < row.length; x++) {
            row[x] = random.nextDouble();
          }
        }
        final DiscreteWaveletTransform2D dwt = new DiscreteWaveletTransform2D(wavelet);
        final double[][] restored = dwt.inverse(dwt.forward(values), shape[0], shape[1]);
        for (int r = 0; r < shape[0]; r++) {
          Assertions.assertArrayEquals(values[r], restored[r], 1e-10,
              wavelet + " " + shape[0] + "x" + shape[1]);
        }
      }
    }
  }

  @Test
  void inverseRejectsWrongShape() {
    final DiscreteWaveletTransform2D dwt = new DiscreteWaveletTransform2D(Wavelet.HAAR);
    final Coefficients c = dwt.forward(new double[8][8]);
    Assertions.assertThrows(DimensionException.class, () -> dwt.inverse(c, 12, 8));
  }

  @Test
  void symmetricIndex() {
    Assertions.assertEquals(0, DiscreteWaveletTransform2D.symmetricIndex(-1, 4));
    Assertions.assertEquals(1, DiscreteWaveletTransform2D.symmetricIndex(-2, 4));
    Assertions.assertEquals(3, DiscreteWaveletTransform2D.symmetricIndex(4, 4));
    Assertions.assertEquals(2, DiscreteWaveletTransform2D.symmetricIndex(5, 4));
    Assertions.assertEquals(0, DiscreteWaveletTransform2D.symmetricIndex(7, 4));
    Assertions.assertEquals(0, DiscreteWaveletTransform2D.symmetricIndex(8, 4));
    Assertions.assertEquals(0, DiscreteWaveletTransform2D.symmetricIndex(-3, 1));
  }
}
