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

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.DataResiduals;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitAttempt;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitBounds;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.GaussianLeastSquaresFitter;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.FitImprover;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImproveFitSettings;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImprovedFit;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.SpectrumRejectedException;
import io.github.gaussdecomp.util.DecompositionTrace;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Autonomous Gaussian decomposition of single spectra: derivative based guessing in one or two
 * phases, a final least-squares fit and optionally the iterative fit improvement.
 */
public class AgdDecomposer implements SpectrumDecomposer {

  private static final Logger logger = Logger.getLogger(AgdDecomposer.class.getName());

  private final DecompositionSettings settings;
  private final GaussianLeastSquaresFitter fitter;
  private final DecompositionTrace trace;

  public AgdDecomposer(@NotNull DecompositionSettings settings) {
    this(settings, settings.verbose() ? DecompositionTrace.toLogger(logger, Level.INFO)
        : DecompositionTrace.NO_OP);
  }

  public AgdDecomposer(@NotNull DecompositionSettings settings,
      @NotNull DecompositionTrace trace) {
    this(settings, new GaussianLeastSquaresFitter(), trace);
  }

  public AgdDecomposer(@NotNull DecompositionSettings settings,
      @NotNull GaussianLeastSquaresFitter fitter, @NotNull DecompositionTrace trace) {
    this.settings = settings;
    this.fitter = fitter;
    this.trace = trace;
  }

  public @NotNull DecompositionSettings getSettings() {
    return settings;
  }

  @Override
  public @NotNull DecompositionResult decompose(@NotNull Spectrum spectrum) {
    final int index = spectrum.index();
    final DecompositionTrace spectrumTrace = trace.withPrefix("Spectrum " + index + ": ");
    if (spectrum.containsNaN()) {
      spectrumTrace.trace(() -> "NaN values in data, cannot continue");
      return DecompositionResult.failed(index, "NaN values in spectrum");
    }

    final FitBounds bounds = bounds(spectrum);
    final CombinedGuess guess = guess(spectrum, bounds, spectrumTrace);
    if (guess == null) {
      return DecompositionResult.failed(index, "No initial guess possible");
    }
    final GaussianParameters initial = guess.finalGuess();

    GaussianParameters fit = null;
    GaussianParameters fitErrors = null;
    if (settings.performFinalFit() && !initial.isEmpty()) {
      final FitAttempt attempt = fitter.fit(initial, bounds.withoutFwhmLimit(),
          DataResiduals.of(spectrum));
      if (attempt.success()) {
        fit = attempt.parameters();
        fitErrors = attempt.errors();
      } else {
        spectrumTrace.trace(() -> "Final fit did not converge: " + attempt.message());
      }
    }

    final ImproveFitSettings improveSettings = settings.improveFitting();
    if (improveSettings != null) {
      final FitImprover improver = new FitImprover(improveSettings, fitter, spectrumTrace);
      try {
        final ImprovedFit improved = improver.improve(spectrum, fit != null ? fit : initial,
            bounds);
        return DecompositionResult.decomposed(index,
            new FitOutcome.Improved(initial, improved.parameters(), improved.errors(),
                improved.quality()));
      } catch (SpectrumRejectedException e) {
        spectrumTrace.trace(() -> "Rejected: " + e.getMessage());
        return DecompositionResult.failed(index, e.getMessage());
      }
    }

    if (initial.isEmpty()) {
      return DecompositionResult.decomposed(index, new FitOutcome.NoComponents(initial));
    }
    if (fit == null) {
      return DecompositionResult.decomposed(index, new FitOutcome.GuessOnly(initial));
    }
    return DecompositionResult.decomposed(index,
        new FitOutcome.Fitted(initial, fit, fitErrors));
  }

  /**
   * Candidates of both phases, exposed for diagnostic charts.
   *
   * @return the candidates or null if the spectrum contains NaN values
   */
  public @Nullable CombinedGuess guess(@NotNull Spectrum spectrum) {
    return guess(spectrum, bounds(spectrum), trace);
  }

  private @Nullable CombinedGuess guess(Spectrum spectrum, FitBounds bounds,
      DecompositionTrace spectrumTrace) {
    final InitialGuessEstimator estimator = new InitialGuessEstimator(settings.snrThresh(),
        settings.snr2Thresh(), spectrumTrace);
    final TwoPhaseGuessCombiner combiner = new TwoPhaseGuessCombiner(estimator, fitter,
        spectrumTrace);
    return combiner.combine(spectrum, settings.alpha1(),
        settings.twoPhase() ? settings.alpha2() : null, bounds);
  }

  /**
   * Amplitude and FWHM ceilings, only applied when the fit is improved. The FWHM limit is given
   * in channels.
   */
  FitBounds bounds(Spectrum spectrum) {
    final ImproveFitSettings improve = settings.improveFitting();
    if (improve == null) {
      return FitBounds.UNBOUNDED;
    }
    final Double maxFwhm = improve.maxFwhm() == null ? null
        : improve.maxFwhm() * spectrum.channelSpacing();
    return new FitBounds(improve.maxAmpFactor() * spectrum.maxIntensity(), maxFwhm);
  }
}
