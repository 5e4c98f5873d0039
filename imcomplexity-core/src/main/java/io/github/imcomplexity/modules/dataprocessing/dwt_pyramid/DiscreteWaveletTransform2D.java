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
import io.github.imcomplexity.util.exceptions.DimensionException;
import org.jetbrains.annotations.NotNull;

/**
 * Single-level separable 2D discrete wavelet transform of one channel.
 * <p>
 * Signal borders are extended half-sample symmetric (x[-1] = x[0], x[n] = x[n-1]) on every level.
 * One level maps n samples to floor((n + F - 1) / 2) coefficients, F being the filter length
 * (ceil(n / 2) for haar). Filtering runs along the columns of each row (axis 1) first, then along
 * the rows (axis 0).
 */
public class DiscreteWaveletTransform2D {

  private final @NotNull Wavelet wavelet;
  private final double[] decLo;
  private final double[] decHi;
  private final double[] recLo;
  private final double[] recHi;

  public DiscreteWaveletTransform2D(@NotNull Wavelet wavelet) {
    this.wavelet = wavelet;
    this.decLo = wavelet.getDecompositionLowPass();
    this.decHi = wavelet.getDecompositionHighPass();
    this.recLo = wavelet.getReconstructionLowPass();
    this.recHi = wavelet.getReconstructionHighPass();
  }

  public @NotNull Wavelet getWavelet() {
    return wavelet;
  }

  /**
   * Number of coefficients one decomposition produces from n samples.
   */
  public int coefficientLength(int n) {
    return (n + wavelet.getFilterLength() - 1) / 2;
  }

  /**
   * @param values [row][column], not modified
   */
  public @NotNull Coefficients forward(@NotNull double[][] values) {
    final int height = values.length;
    if (height == 0 || values[0].length == 0) {
      throw new DimensionException("Cannot decompose an empty array");
    }
    final int width = values[0].length;
    final int w2 = coefficientLength(width);
    final int h2 = coefficientLength(height);

    // axis 1
    final double[][] lo = new double[height][];
    final double[][] hi = new double[height][];
    for (int r = 0; r < height; r++) {
      lo[r] = decompose(values[r], decLo);
      hi[r] = decompose(values[r], decHi);
    }

    // axis 0
    final double[][] cA = new double[h2][w2];
    final double[][] cH = new double[h2][w2];
    final double[][] cV = new double[h2][w2];
    final double[][] cD = new double[h2][w2];
    final double[] column = new double[height];
    for (int x = 0; x < w2; x++) {
      readColumn(lo, x, column);
      writeColumn(cA, x, decompose(column, decLo));
      writeColumn(cH, x, decompose(column, decHi));
      readColumn(hi, x, column);
      writeColumn(cV, x, decompose(column, decLo));
      writeColumn(cD, x, decompose(column, decHi));
    }
    return new Coefficients(cA, cH, cV, cD);
  }

  /**
   * Reconstructs the input of {@link #forward(double[][])}.
   *
   * @param height height of the original input
   * @param width  width of the original input
   */
  public @NotNull double[][] inverse(@NotNull Coefficients coefficients, int height, int width) {
    final int h2 = coefficients.approximation().length;
    final int w2 = coefficients.approximation()[0].length;
    if (coefficientLength(height) != h2 || coefficientLength(width) != w2) {
      throw new DimensionException(
          "Coefficients of shape (" + h2 + ", " + w2 + ") cannot reconstruct (" + height + ", "
              + width + ") with " + wavelet);
    }

    // axis 0
    final double[][] lo = new double[height][w2];
    final double[][] hi = new double[height][w2];
    final double[] a = new double[h2];
    final double[] d = new double[h2];
    for (int x = 0; x < w2; x++) {
      readColumn(coefficients.approximation(), x, a);
      readColumn(coefficients.horizontal(), x, d);
      writeColumn(lo, x, reconstruct(a, d, height));
      readColumn(coefficients.vertical(), x, a);
      readColumn(coefficients.diagonal(), x, d);
      writeColumn(hi, x, reconstruct(a, d, height));
    }

    // axis 1
    final double[][] out = new double[height][];
    for (int r = 0; r < height; r++) {
      out[r] = reconstruct(lo[r], hi[r], width);
    }
    return out;
  }

  /**
   * Filters and downsamples: out[o] = sum_j filter[j] * x[2o + 1 - j].
   */
  private double[] decompose(double[] x, double[] filter) {
    final int n = x.length;
    final double[] out = new double[coefficientLength(n)];
    for (int o = 0; o < out.length; o++) {
      double sum = 0d;
      for (int j = 0; j < filter.length; j++) {
        sum += filter[j] * x[symmetricIndex(2 * o + 1 - j, n)];
      }
      out[o] = sum;
    }
    return out;
  }

  /**
   * Upsampling synthesis, keeping the first {@code length} samples of the valid part
   * (2N - F + 2 samples).
   */
  private double[] reconstruct(double[] approximation, double[] detail, int length) {
    final int f = recLo.length;
    final int n = approximation.length;
    final double[] out = new double[length];
    for (int i = 0; i < length; i++) {
      double sum = 0d;
      for (int o = (i + f - 2) / 2; o >= 0; o--) {
        final int k = i + f - 2 - 2 * o;
        if (k >= f) {
          break;
        }
        if (o < n) {
          sum += approximation[o] * recLo[k] + detail[o] * recHi[k];
        }
      }
      out[i] = sum;
    }
    return out;
  }

  static int symmetricIndex(int index, int n) {
    if (n == 1) {
      return 0;
    }
    final int period = 2 * n;
    int k = index % period;
    if (k < 0) {
      k += period;
    }
    return k < n ? k : period - 1 - k;
  }

  private static void readColumn(double[][] src, int column, double[] dst) {
    for (int r = 0; r < dst.length; r++) {
      dst[r] = src[r][column];
    }
  }

  private static void writeColumn(double[][] dst, int column, double[] src) {
    for (int r = 0; r < src.length; r++) {
      dst[r][column] = src[r];
    }
  }

  /**
   * Subbands of one decomposition level, each [row][column].
   */
  public record Coefficients(double[][] approximation, double[][] horizontal,
                             double[][] vertical, double[][] diagonal) {

  }
}
