/*
 * Copyright (c) 2004-2025 The gaussdecomp Development Team
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

package io.github.gaussdecomp.modules.dataprocessing.decomp_training;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.AgdDecomposer;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.DecompositionSettings;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.BatchDecompositionResult;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.BatchDecompositionTask;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.DecompositionRow;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the smoothing parameters that maximise the decomposition accuracy on labelled spectra.
 * Performs gradient ascent with momentum in ln(alpha) using central differences. Accuracy is
 * measured on the initial guesses only.
 */
public class AlphaTrainer {

  private static final Logger logger = Logger.getLogger(AlphaTrainer.class.getName());

  public static final double DEFAULT_LEARNING_RATE = 0.9;
  public static final double DEFAULT_EPS = 0.25;
  public static final double DEFAULT_MAD = 0.1;
  public static final double MOMENTUM = 0.5;
  public static final int WINDOW = 10;
  public static final int DEFAULT_MAX_ITERATIONS = 500;

  private final List<TrainingSpectrum> trainingSet;
  private final DecompositionSettings baseSettings;
  private final double learningRate;
  private final double eps;
  private final double mad;
  private final int maxIterations;

  public AlphaTrainer(@NotNull List<TrainingSpectrum> trainingSet,
      @NotNull DecompositionSettings baseSettings) {
    this(trainingSet, baseSettings, DEFAULT_LEARNING_RATE, DEFAULT_EPS, DEFAULT_MAD,
        DEFAULT_MAX_ITERATIONS);
  }

  public AlphaTrainer(@NotNull List<TrainingSpectrum> trainingSet,
      @NotNull DecompositionSettings baseSettings, double learningRate, double eps, double mad,
      int maxIterations) {
    if (trainingSet.isEmpty()) {
      throw new IllegalArgumentException("Training set is empty");
    }
    if (learningRate <= 0 || eps <= 0 || mad <= 0 || maxIterations < 1) {
      throw new IllegalArgumentException(
          "Invalid training parameters: learning_rate=%s, eps=%s, MAD=%s, max_iterations=%d"
              .formatted(learningRate, eps, mad, maxIterations));
    }
    this.trainingSet = List.copyOf(trainingSet);
    this.baseSettings = baseSettings;
    this.learningRate = learningRate;
    this.eps = eps;
    this.mad = mad;
    this.maxIterations = maxIterations;
  }

  /**
   * Trains alpha1 alone, or alpha1 and alpha2 jointly if {@code alpha2Initial} is not null.
   */
  public @NotNull TrainingResult train(double alpha1Initial, @Nullable Double alpha2Initial) {
    if (alpha1Initial <= 0 || (alpha2Initial != null && alpha2Initial <= 0)) {
      throw new IllegalArgumentException("Initial alphas must be positive");
    }
    final int dims = alpha2Initial == null ? 1 : 2;
    double[] lnAlpha = dims == 1 ? new double[]{Math.log(alpha1Initial)}
        : new double[]{Math.log(alpha1Initial), Math.log(alpha2Initial)};
    final double[] velocity = new double[dims];
    final List<double[]> history = new ArrayList<>();
    history.add(lnAlpha.clone());

    double[] previousMean = null;
    int stableIterations = 0;
    int iteration = 0;
    boolean converged = false;
    while (iteration < maxIterations) {
      iteration++;
      final double[] gradient = new double[dims];
      for (int k = 0; k < dims; k++) {
        final double[] up = lnAlpha.clone();
        final double[] down = lnAlpha.clone();
        up[k] += eps;
        down[k] -= eps;
        gradient[k] = (accuracy(up) - accuracy(down)) / (2 * eps);
      }
      final double[] next = lnAlpha.clone();
      for (int k = 0; k < dims; k++) {
        velocity[k] = MOMENTUM * velocity[k] + learningRate * gradient[k];
        next[k] += velocity[k];
      }
      lnAlpha = next;
      history.add(lnAlpha.clone());

      final double[] lnAlphaLog = lnAlpha;
      final int it = iteration;
      logger.finest(() -> "Training iteration %d: ln(alpha) = %s".formatted(it,
          Arrays.toString(lnAlphaLog)));

      if (history.size() < WINDOW) {
        continue;
      }
      final double[] mean = runningMean(history, dims);
      if (previousMean != null && maxAbsDifference(mean, previousMean) < mad) {
        stableIterations++;
      } else {
        stableIterations = 0;
      }
      previousMean = mean;
      if (stableIterations >= WINDOW) {
        converged = true;
        break;
      }
    }

    final double acc = accuracy(lnAlpha);
    final double alpha1 = Math.exp(lnAlpha[0]);
    final Double alpha2 = dims == 2 ? Math.exp(lnAlpha[1]) : null;
    if (converged) {
      logger.info(() -> ("Training converged after %d iterations: alpha1=%.4f, alpha2=%s, "
          + "accuracy=%.3f").formatted(history.size() - 1, alpha1, alpha2, acc));
    } else {
      logger.warning(() -> "Training did not converge within %d iterations".formatted(
          maxIterations));
    }
    return new TrainingResult(alpha1, alpha2, acc, iteration, converged, history);
  }

  /**
   * F1 accuracy of the initial guesses for the given alphas in ln space.
   */
  double accuracy(double[] lnAlpha) {
    final DecompositionSettings settings = baseSettings.toBuilder()
        .alpha1(Math.exp(lnAlpha[0]))
        .alpha2(lnAlpha.length > 1 ? Math.exp(lnAlpha[1]) : null)
        .twoPhase(lnAlpha.length > 1)
        .performFinalFit(false)
        .improveFitting(null)
        .verbose(false)
        .build();
    return accuracy(settings);
  }

  public double accuracy(@NotNull DecompositionSettings settings) {
    final List<Spectrum> spectra = trainingSet.stream().map(TrainingSpectrum::spectrum).toList();
    final BatchDecompositionTask task = new BatchDecompositionTask(spectra,
        new AgdDecomposer(settings), settings.useNcpus());
    task.run();
    final BatchDecompositionResult result = task.getResult();
    if (result == null) {
      throw new IllegalStateException("Decomposition of the training set did not finish: "
          + task.getErrorMessage());
    }

    int matches = 0;
    int trueCount = 0;
    int guessCount = 0;
    for (int i = 0; i < trainingSet.size(); i++) {
      final GaussianParameters truth = trainingSet.get(i).truth();
      final GaussianParameters guess = initialGuess(result.row(i));
      matches += ComponentMatcher.countMatches(truth, guess);
      trueCount += truth.componentCount();
      guessCount += guess.componentCount();
    }
    return ComponentMatcher.f1(matches, trueCount, guessCount);
  }

  private static GaussianParameters initialGuess(DecompositionRow row) {
    if (row.amplitudesInitial() == null) {
      return GaussianParameters.EMPTY;
    }
    return GaussianParameters.of(row.amplitudesInitial(), row.fwhmsInitial(), row.meansInitial());
  }

  private static double[] runningMean(List<double[]> history, int dims) {
    final double[] mean = new double[dims];
    for (int i = history.size() - WINDOW; i < history.size(); i++) {
      for (int k = 0; k < dims; k++) {
        mean[k] += history.get(i)[k] / WINDOW;
      }
    }
    return mean;
  }

  private static double maxAbsDifference(double[] a, double[] b) {
    double max = 0;
    for (int k = 0; k < a.length; k++) {
      max = Math.max(max, Math.abs(a[k] - b[k]));
    }
    return max;
  }
}
