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

import io.github.imcomplexity.parameters.ParameterSet;
import io.github.imcomplexity.taskcontrol.AbstractTask;
import io.github.imcomplexity.taskcontrol.TaskStatus;
import io.github.imcomplexity.util.exceptions.ImageComplexityException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Scores a batch of images and ranks them by complexity. A failing image stops the task with
 * status {@link TaskStatus#ERROR} and no ranking.
 */
public class ComplexityScoreTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(ComplexityScoreTask.class.getName());

  private final @NotNull List<ComplexityScoreInput> inputs;
  private final @NotNull ComplexityScorer scorer;
  private final List<ScoredImage> results = new ArrayList<>();
  private volatile int processedItems;

  public ComplexityScoreTask(@NotNull ParameterSet parameters,
      @NotNull List<ComplexityScoreInput> inputs) {
    this.inputs = List.copyOf(inputs);
    this.scorer = new ComplexityScorer(parameters);
  }

  @Override
  protected void process() {
    final List<ScoredImage> scored = new ArrayList<>(inputs.size());
    for (ComplexityScoreInput input : inputs) {
      if (isCanceled()) {
        return;
      }
      try {
        scored.add(new ScoredImage(input.name(), scorer.evaluate(input.image(), input.mask())));
      } catch (ImageComplexityException e) {
        error("Scoring of " + input.name() + " failed: " + e.getMessage(), e);
        return;
      }
      processedItems++;
    }

    scored.sort(Comparator.comparingDouble(ScoredImage::score).reversed()
        .thenComparing(ScoredImage::name));
    synchronized (results) {
      results.addAll(scored);
    }
    setStatus(TaskStatus.FINISHED);
    logger.info(() -> "Scored " + scored.size() + " images with " + scorer.getWavelet() + ", "
        + scorer.getLevels() + " levels, percentile " + scorer.getThresholdPercentile());
  }

  /**
   * @return images by descending score, ties by name. Empty unless the task finished.
   */
  public @NotNull List<ScoredImage> getRanking() {
    synchronized (results) {
      return List.copyOf(results);
    }
  }

  @Override
  public @NotNull String getTaskDescription() {
    return "Wavelet complexity score of " + inputs.size() + " images";
  }

  @Override
  public double getFinishedPercentage() {
    if (inputs.isEmpty()) {
      return 0;
    }
    return processedItems / (double) inputs.size();
  }

  public record ScoredImage(@NotNull String name, @NotNull ComplexityScoreResult result) {

    public double score() {
      return result.score();
    }
  }
}
