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

import io.github.imcomplexity.util.exceptions.ConfigException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * Orthogonal wavelet families available for the decomposition. Each family is defined by its
 * scaling filter (reconstruction low-pass); the decomposition filters are the time reversed
 * reconstruction filters and the high-pass filters follow from the quadrature mirror relation
 * recHi[k] = (-1)^k * recLo[F - 1 - k].
 */
public enum Wavelet {

  HAAR("haar", new String[]{"db1"}, //
      0.7071067811865476, 0.7071067811865476),

  DB2("db2", new String[0], //
      0.48296291314453416, 0.8365163037378079, 0.2241438680420134, -0.12940952255126037),

  DB3("db3", new String[0], //
      0.33267055295008263, 0.8068915093110925, 0.45987750211849154, -0.13501102001025458,
      -0.08544127388202666, 0.03522629188570953),

  DB4("db4", new String[0], //
      0.2303778133088965, 0.7148465705529157, 0.6308807679298589, -0.027983769416859854,
      -0.18703481171909309, 0.030841381835560764, 0.0328830116668852, -0.010597401785069032),

  // least asymmetric filters of length 4 and 6 coincide with db2 and db3
  SYM2("sym2", new String[0], //
      0.48296291314453416, 0.8365163037378079, 0.2241438680420134, -0.12940952255126037),

  SYM3("sym3", new String[0], //
      0.33267055295008263, 0.8068915093110925, 0.45987750211849154, -0.13501102001025458,
      -0.08544127388202666, 0.03522629188570953);

  private final String familyName;
  private final String[] aliases;
  private final double[] recLo;
  private final double[] recHi;
  private final double[] decLo;
  private final double[] decHi;

  Wavelet(String familyName, String[] aliases, double... scalingFilter) {
    this.familyName = familyName;
    this.aliases = aliases;
    final int f = scalingFilter.length;
    this.recLo = scalingFilter;
    this.recHi = new double[f];
    this.decLo = new double[f];
    this.decHi = new double[f];
    for (int k = 0; k < f; k++) {
      recHi[k] = (k % 2 == 0 ? 1d : -1d) * scalingFilter[f - 1 - k];
    }
    for (int k = 0; k < f; k++) {
      decLo[k] = recLo[f - 1 - k];
      decHi[k] = recHi[f - 1 - k];
    }
  }

  /**
   * @param name family name as used by common wavelet libraries, e.g., "haar" or "db2". Case
   *             insensitive.
   * @throws ConfigException if no family of that name exists
   */
  public static @NotNull Wavelet forName(@NotNull String name) {
    final String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (Wavelet wavelet : values()) {
      if (wavelet.familyName.equals(normalized) || Arrays.asList(wavelet.aliases)
          .contains(normalized)) {
        return wavelet;
      }
    }
    throw new ConfigException(
        "Unknown wavelet '" + name + "'. Available: " + Arrays.stream(values())
            .map(Wavelet::getFamilyName).collect(Collectors.joining(", ")));
  }

  public @NotNull String getFamilyName() {
    return familyName;
  }

  public int getFilterLength() {
    return recLo.length;
  }

  public @NotNull double[] getDecompositionLowPass() {
    return decLo.clone();
  }

  public @NotNull double[] getDecompositionHighPass() {
    return decHi.clone();
  }

  public @NotNull double[] getReconstructionLowPass() {
    return recLo.clone();
  }

  public @NotNull double[] getReconstructionHighPass() {
    return recHi.clone();
  }

  @Override
  public String toString() {
    return familyName;
  }
}
