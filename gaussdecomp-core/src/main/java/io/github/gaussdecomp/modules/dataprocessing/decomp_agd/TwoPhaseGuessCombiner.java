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

package io.github.gaussdecomp.modules.dataprocessing.decomp_agd;

import io.github.gaussdecomp.datamodel.GaussianComponent;
import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitAttempt;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitBounds;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.GaussianLeastSquaresFitter;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.SecondDerivativeResiduals;
import io.github.gaussdecomp.util.DecompositionTrace;
import io.github.gaussdecomp.util.MedianFilter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Combines narrow (alpha1) and broad (alpha2) candidates. In two-phase mode the phase one
 * candidates are fitted to the second derivative, subtracted from the data and the median
 * filtered residual is searched again at alpha2.
 */
public class TwoPhaseGuessCombiner {

  /**
   * Fraction of a candidate's sigma covered by its fit mask window.
   */
  private static final double FIT_MASK_WIDTH = 0.9;

  private final InitialGuessEstimator estimator;
  private final GaussianLeastSquaresFitter fitter;
  private final DecompositionTrace trace;

  public TwoPhaseGuessCombiner(@NotNull InitialGuessEstimator estimator,
      @NotNull GaussianLeastSquaresFitter fitter, @NotNull DecompositionTrace trace) {
    this.estimator = estimator;
    this.fitter = fitter;
    this.trace = trace;
  }

  /**
   * @param alpha2 null for single phase mode
   * @param bounds limits of the intermediate fit
   * @return the combined candidates or null if the spectrum contains NaN values
   */
  public @Nullable CombinedGuess combine(@NotNull Spectrum spectrum, double alpha1,
      @Nullable Double alpha2, @NotNull FitBounds bounds) {
    final double[] vel = spectrum.velocity();
    final double[] data = spectrum.intensity();
    final InitialGuess phaseOne = estimator.estimate(vel, data, spectrum.rms(), alpha1);
    if (phaseOne == null) {
      return null;
    }
    if (alpha2 == null) {
      return new CombinedGuess(phaseOne, null, null, null,
          phaseOne.parameters().sortedByAmplitudeDescending());
    }

    double[] residual = data;
    GaussianParameters intermediate = null;
    if (phaseOne.componentCount() == 0) {
      trace.trace(() -> "Phase two without phase one components, no intermediate subtraction");
    } else {
      final boolean[] mask = fitMask(spectrum, phaseOne.parameters());
      final SecondDerivativeResiduals residuals = new SecondDerivativeResiduals(vel, data,
          spectrum.errors(), phaseOne.u2(), mask, spectrum.channelSpacing());
      final FitAttempt attempt = fitter.fit(phaseOne.parameters(), bounds, residuals);
      if (attempt.success()) {
        intermediate = attempt.parameters();
        final double[] model = intermediate.evaluate(vel);
        final double[] subtracted = new double[data.length];
        for (int i = 0; i < data.length; i++) {
          subtracted[i] = data[i] - model[i];
        }
        residual = MedianFilter.apply(subtracted, medianWindow(alpha1));
      } else {
        trace.trace(() -> "Intermediate fit failed (" + attempt.message()
            + "), searching phase two on the data");
      }
    }

    final InitialGuess phaseTwo = estimator.estimate(vel, residual, spectrum.rms(), alpha2);
    GaussianParameters combined = phaseOne.parameters();
    if (phaseTwo != null && phaseTwo.componentCount() > 0) {
      combined = combined.concat(phaseTwo.parameters());
    }
    final GaussianParameters finalGuess = combined;
    trace.trace(() -> "N final parameter guesses: " + finalGuess.componentCount());
    return new CombinedGuess(phaseOne, phaseTwo, intermediate, residual,
        finalGuess.sortedByAmplitudeDescending());
  }

  /**
   * Window size of the median filter applied to the intermediate residual, an empirical relation
   * to alpha1.
   */
  static int medianWindow(double alpha1) {
    return (int) (2d * Math.pow(10d, (Math.log10(alpha1) + 2.187) / 3.859));
  }

  /**
   * Channels within 0.9 sigma of a candidate are fitted in second derivative space.
   */
  static boolean[] fitMask(@NotNull Spectrum spectrum, @NotNull GaussianParameters candidates) {
    final int n = spectrum.size();
    final boolean[] mask = new boolean[n];
    final double dv = spectrum.channelSpacing();
    for (int c = 0; c < candidates.componentCount(); c++) {
      final double center = spectrum.velocityToChannel(candidates.mean(c));
      final double half = candidates.fwhm(c) / dv / GaussianComponent.SIGMA_TO_FWHM
          * FIT_MASK_WIDTH;
      final int lower = sliceIndex((int) (center - half), n);
      final int upper = sliceIndex((int) (center + half), n);
      for (int i = lower; i < upper; i++) {
        mask[i] = true;
      }
    }
    return mask;
  }

  /**
   * Negative indices count from the end, results are clamped to [0, n].
   */
  private static int sliceIndex(int index, int n) {
    if (index < 0) {
      return Math.max(0, index + n);
    }
    return Math.min(index, n);
  }
}
