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

package io.github.imcomplexity.modules.dataprocessing.complexity_score;

import io.github.imcomplexity.datamodel.Wavelet;
import io.github.imcomplexity.parameters.impl.SimpleParameterSet;
import io.github.imcomplexity.parameters.parametertypes.ComboParameter;
import io.github.imcomplexity.parameters.parametertypes.DoubleParameter;
import io.github.imcomplexity.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;
import org.jetbrains.annotations.NotNull;

/**
 * Settings of the complexity score. Scores are only comparable between runs with identical
 * settings.
 */
public class ComplexityScoreParameters extends SimpleParameterSet {

  public static final IntegerParameter LEVELS = new IntegerParameter("DWT levels",
      "Number of recursive wavelet decompositions. Limited by log2 of the smaller image side.", 4,
      1, Integer.MAX_VALUE);

  public static final DoubleParameter THRESHOLD_PERCENTILE = new DoubleParameter(
      "Threshold percentile",
      "Only detail coefficients with a magnitude at or above this percentile (per channel, over all levels) contribute to the score.",
      new DecimalFormat("0.##"), 99d, 0d, 100d);

  public static final ComboParameter<Wavelet> WAVELET = new ComboParameter<>("Wavelet",
      "Wavelet family used for the decomposition.", Wavelet.values(), Wavelet.HAAR);

  public ComplexityScoreParameters() {
    super(LEVELS, THRESHOLD_PERCENTILE, WAVELET);
  }

  /**
   * @param waveletName family name, e.g., "haar"
   * @throws io.github.imcomplexity.util.exceptions.ConfigException for unknown wavelet names
   */
  public static @NotNull ComplexityScoreParameters create(int levels, double thrPercentile,
      @NotNull String waveletName) {
    final ComplexityScoreParameters parameters = new ComplexityScoreParameters();
    parameters.setParameter(LEVELS, levels);
    parameters.setParameter(THRESHOLD_PERCENTILE, thrPercentile);
    parameters.setParameter(WAVELET, Wavelet.forName(waveletName));
    return parameters;
  }
}
