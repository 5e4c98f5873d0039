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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.github.imcomplexity.datamodel.ChannelStack;
import io.github.imcomplexity.datamodel.DetailOrientation;
import io.github.imcomplexity.datamodel.RegionMask;
import io.github.imcomplexity.datamodel.Wavelet;
import io.github.imcomplexity.datamodel.WaveletPyramid;
import io.github.imcomplexity.modules.dataprocessing.dwt_masking.MaskProjector;
import io.github.imcomplexity.modules.dataprocessing.dwt_pyramid.WaveletPyramidBuilder;
import io.github.imcomplexity.modules.dataprocessing.dwt_threshold.PercentileThresholder;
import io.github.imcomplexity.modules.dataprocessing.dwt_threshold.ThresholdSelection;
import io.github.imcomplexity.parameters.ParameterSet;
import io.github.imcomplexity.util.exceptions.ConfigException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Visual complexity of an image from the energy of its wavelet detail coefficients.
 * <ol>
 *   <li>rescale 8-bit images (max > 1) to [0, 1]</li>
 *   <li>decompose every channel into a wavelet pyramid</li>
 *   <li>optionally zero detail coefficients outside the eroded region mask</li>
 *   <li>keep, per detail orientation, the coefficients at or above the magnitude percentile</li>
 *   <li>score = sum of surviving magnitudes / (image height * image width)</li>
 * </ol>
 * Instances are immutable and hold no per-call state, so one scorer can be used from several
 * threads at once.
 */
public class ComplexityScorer {

  private static final Logger logger = Logger.getLogger(ComplexityScorer.class.getName());

  private final int levels;
  private final double thrPercentile;
  private final @NotNull Wavelet wavelet;
  private final @NotNull WaveletPyramidBuilder pyramidBuilder;
  private final @NotNull MaskProjector maskProjector;
  private final @NotNull PercentileThresholder thresholder;

  public ComplexityScorer() {
    this(new ComplexityScoreParameters());
  }

  public ComplexityScorer(int levels, double thrPercentile, @NotNull String waveletName) {
    this(ComplexityScoreParameters.create(levels, thrPercentile, waveletName));
  }

  /**
   * @throws ConfigException if the parameters are invalid
   */
  public ComplexityScorer(@NotNull ParameterSet parameters) {
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      throw new ConfigException(errors);
    }
    this.levels = Objects.requireNonNull(parameters.getValue(ComplexityScoreParameters.LEVELS));
    this.thrPercentile = Objects.requireNonNull(
        parameters.getValue(ComplexityScoreParameters.THRESHOLD_PERCENTILE));
    this.wavelet = Objects.requireNonNull(parameters.getValue(ComplexityScoreParameters.WAVELET));
    this.pyramidBuilder = new WaveletPyramidBuilder(wavelet);
    this.maskProjector = new MaskProjector();
    this.thresholder = new PercentileThresholder(thrPercentile);
  }

  public double score(@NotNull ChannelStack image, @Nullable RegionMask mask) {
    return evaluate(image, mask).score();
  }

  public @NotNull ComplexityScoreResult evaluate(@NotNull ChannelStack image,
      @Nullable RegionMask mask) {
    final WaveletPyramid pyramid = decompose(image);
    final WaveletPyramid masked = mask == null ? pyramid : maskProjector.apply(pyramid, mask);

    final EnumMap<DetailOrientation, ThresholdSelection> selections = new EnumMap<>(
        DetailOrientation.class);
    double sum = 0d;
    for (DetailOrientation orientation : DetailOrientation.values()) {
      final ThresholdSelection selection = thresholder.select(masked.getDetails(orientation));
      selections.put(orientation, selection);
      sum += selection.sumOfMagnitudes();
    }

    final double score = sum / ((double) image.getHeight() * image.getWidth());
    logger.fine(() -> "Score " + score + " for " + image.getShapeString() + " (" + wavelet + ", "
        + levels + " levels, percentile " + thrPercentile + (mask == null ? ")" : ", masked)"));
    final ImmutableMap<DetailOrientation, ThresholdSelection> immutableSelections = Maps.immutableEnumMap(
        selections);
    return new ComplexityScoreResult(score, image.getHeight(), image.getWidth(), pyramid, masked,
        immutableSelections);
  }

  /**
   * Rescales the image if needed and builds the unmasked pyramid, e.g., for visualization.
   */
  public @NotNull WaveletPyramid decompose(@NotNull ChannelStack image) {
    return pyramidBuilder.build(normalizeIntensities(image), levels);
  }

  /**
   * 8-bit images, detected by a maximum above 1, are scaled to [0, 1].
   */
  public static @NotNull ChannelStack normalizeIntensities(@NotNull ChannelStack image) {
    return image.max() > 1d ? image.scale(1d / 255d) : image;
  }

  public int getLevels() {
    return levels;
  }

  public double getThresholdPercentile() {
    return thrPercentile;
  }

  public @NotNull Wavelet getWavelet() {
    return wavelet;
  }
}
