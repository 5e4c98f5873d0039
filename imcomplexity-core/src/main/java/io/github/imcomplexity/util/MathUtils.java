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

package io.github.imcomplexity.util;

import io.github.imcomplexity.util.exceptions.ConfigException;
import io.github.imcomplexity.util.exceptions.NormalizationException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.jetbrains.annotations.NotNull;

public class MathUtils {

  private MathUtils() {
  }

  /**
   * Percentile with linear interpolation between the two nearest ranks (position p/100 * (n-1)
   * in the sorted values). p = 0 returns the minimum, p = 100 the maximum.
   *
   * @param values     not empty, not modified
   * @param percentile in [0, 100]
   */
  public static double calcPercentile(@NotNull double[] values, double percentile) {
    if (Double.isNaN(percentile) || percentile < 0d || percentile > 100d) {
      throw new ConfigException("Percentile must be within [0, 100] but was " + percentile);
    }
    if (values.length == 0) {
      throw new IllegalArgumentException("Cannot compute a percentile of zero values");
    }
    if (percentile == 0d) {
      // commons-math only accepts (0, 100]
      return StatUtils.min(values);
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
  }

  /**
   * Min-max normalization to [0, 1].
   *
   * @return a new array
   * @throws NormalizationException if the values are empty or all equal
   */
  public static double[] normalizeToUnitRange(@NotNull double[] values) {
    if (values.length == 0) {
      throw new NormalizationException("Cannot normalize an empty array");
    }
    final double min = StatUtils.min(values);
    final double max = StatUtils.max(values);
    final double range = max - min;
    if (!(range > 0d) || Double.isInfinite(range)) {
      throw new NormalizationException(
          "Cannot normalize values with range [" + min + ", " + max + "]");
    }
    final double[] normalized = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      normalized[i] = (values[i] - min) / range;
    }
    return normalized;
  }

  public static double sumAbs(@NotNull double[] values) {
    double sum = 0d;
    for (double v : values) {
      sum += Math.abs(v);
    }
    return sum;
  }

  /**
   * Largest number of dyadic decomposition levels a side of the given length supports, i.e.,
   * floor(log2(length)).
   */
  public static int maxDyadicLevels(int length) {
    if (length < 1) {
      return 0;
    }
    return 31 - Integer.numberOfLeadingZeros(length);
  }
}
