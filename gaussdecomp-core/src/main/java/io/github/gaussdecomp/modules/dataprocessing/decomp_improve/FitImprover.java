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

package io.github.gaussdecomp.modules.dataprocessing.decomp_improve;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.FitQuality;
import io.github.gaussdecomp.datamodel.decomposition.QualityControl;
import io.github.gaussdecomp.datamodel.decomposition.QualityControl.Termination;
import io.github.gaussdecomp.datamodel.decomposition.QualityFlag;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.DataResiduals;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitAttempt;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitBounds;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.GaussianLeastSquaresFitter;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ResidualPeakFinder.Feature;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ResidualPeakFinder.Polarity;
import io.github.gaussdecomp.util.ChannelMasks;
import io.github.gaussdecomp.util.DecompositionTrace;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Iteratively improves a multi-Gaussian fit of one spectrum.
 * <p>
 * Every candidate fit is screened: components with too low amplitude or significance, with a
 * FWHM outside the allowed range, or centered outside the spectrum or its signal ranges are
 * dropped and the rest is refitted. A candidate replaces the current fit only if it lowers the
 * AICc by more than {@value #AICC_TOLERANCE}.
 * <p>
 * Each round first adds components for significant positive residual peaks, then tries to
 * replace components causing negative residuals (log code 1), much broader than the rest (2) or
 * blended with a neighbour (3). A second round runs if the reduced chi-square or the F-test
 * p-value is still out of range. FWHM thresholds are given in channels.
 * <p>
 * Instances hold no per-spectrum state and can be shared by worker threads.
 */
public class FitImprover {

  public static final int LOG_NEGATIVE_RESIDUAL = 1;
  public static final int LOG_BROAD = 2;
  public static final int LOG_BLENDED = 3;

  static final double AICC_TOLERANCE = 0.1;
  /**
   * Upper limit of consecutive accepted refits of one kind within a round.
   */
  private static final int MAX_CONSECUTIVE_REFITS = 50;

  private final ImproveFitSettings settings;
  private final GaussianLeastSquaresFitter fitter;
  private final DecompositionTrace trace;

  public FitImprover(@NotNull ImproveFitSettings settings,
      @NotNull GaussianLeastSquaresFitter fitter) {
    this(settings, fitter, DecompositionTrace.NO_OP);
  }

  public FitImprover(@NotNull ImproveFitSettings settings,
      @NotNull GaussianLeastSquaresFitter fitter, @NotNull DecompositionTrace trace) {
    this.settings = settings;
    this.fitter = fitter;
    this.trace = trace;
  }

  public @NotNull ImproveFitSettings getSettings() {
    return settings;
  }

  /**
   * @param spectrum the spectrum
   * @param start    starting components, may be empty
   * @param bounds   limits of all fits, in velocity units
   * @throws SpectrumRejectedException if the component budget is exceeded, or if the fit stays
   *                                   out of range and unresolved fits are discarded
   */
  public @NotNull ImprovedFit improve(@NotNull Spectrum spectrum,
      @NotNull GaussianParameters start, @NotNull FitBounds bounds)
      throws SpectrumRejectedException {
    return new Run(spectrum, bounds).improve(start);
  }

  /**
   * State of one improvement.
   */
  private final class Run {

    private final Spectrum spectrum;
    private final double[] vel;
    private final double[] data;
    private final double[] errors;
    private final int n;
    private final double rms;
    private final double dv;
    private final boolean[] mask;
    private final boolean[] spikeFree;
    private final FitBounds bounds;
    private final DataResiduals residuals;

    private final Set<QualityFlag> fired = new LinkedHashSet<>();
    private final List<Integer> log = new ArrayList<>();
    private final List<List<Integer>> fittedResidualPeaks = new ArrayList<>();
    private boolean improved;

    private Run(Spectrum spectrum, FitBounds bounds) {
      this.spectrum = spectrum;
      this.vel = spectrum.velocity();
      this.data = spectrum.intensity();
      this.errors = spectrum.errors();
      this.n = spectrum.size();
      this.rms = spectrum.rms();
      this.dv = spectrum.channelSpacing();
      final boolean[] signal = ChannelMasks.fromRanges(n, spectrum.signalRanges());
      final boolean[] noSpikes = ChannelMasks.excluding(n, spectrum.noiseSpikeRanges());
      this.mask = new boolean[n];
      for (int i = 0; i < n; i++) {
        mask[i] = signal[i] && noSpikes[i];
      }
      this.spikeFree = spectrum.noiseSpikeRanges().isEmpty() ? null : noSpikes;
      this.bounds = bounds;
      this.residuals = DataResiduals.of(spectrum);
    }

    private ImprovedFit improve(GaussianParameters start) throws SpectrumRejectedException {
      BestFit best = fitAndScreen(start);
      checkBudget(best);

      boolean firstRun = true;
      int iterations = 0;
      while (firstRun || needsImprovement(best)) {
        iterations++;
        final int countOld = fittedResidualPeaks.size();
        for (int i = 0; i < MAX_CONSECUTIVE_REFITS; i++) {
          final BestFit candidate = refitResidualPeaks(best);
          if (candidate == null) {
            break;
          }
          best = accept(candidate, QualityFlag.RESIDUAL_PEAK, null);
        }
        final boolean newPeaks = fittedResidualPeaks.size() != countOld;
        if ((!firstRun && !newPeaks) || best.componentCount() == 0) {
          break;
        }

        if (settings.refitNegResPeak()) {
          final BestFit candidate = refitNegativeResidual(best);
          if (candidate != null) {
            best = accept(candidate, QualityFlag.NEGATIVE_RESIDUAL, LOG_NEGATIVE_RESIDUAL);
          }
        }
        if (settings.refitBroad()) {
          for (int i = 0; i < MAX_CONSECUTIVE_REFITS; i++) {
            final BestFit candidate = refitBroad(best);
            if (candidate == null) {
              break;
            }
            best = accept(candidate, QualityFlag.BROAD_COMPONENT, LOG_BROAD);
          }
        }
        if (settings.refitBlended()) {
          for (int i = 0; i < MAX_CONSECUTIVE_REFITS; i++) {
            final BestFit candidate = refitBlended(best);
            if (candidate == null) {
              break;
            }
            best = accept(candidate, QualityFlag.BLENDED_COMPONENTS, LOG_BLENDED);
          }
        }
        if (!firstRun) {
          break;
        }
        firstRun = false;
      }
      return finish(best, iterations);
    }

    private ImprovedFit finish(BestFit best, int iterations) throws SpectrumRejectedException {
      final int negativeFeatures =
          best.componentCount() == 0 ? 0 : negativeResidualFeatures(best).size();
      final int blendedRefits = (int) log.stream().filter(code -> code == LOG_BLENDED).count();
      final Double pvalue = best.componentCount() == 0 ? null : pvalue(best);

      final boolean rchi2Violated = best.rchi2() > settings.rchi2Limit();
      final boolean pvalueViolated = pvalue != null && pvalue < settings.minPvalue();
      if (rchi2Violated) {
        fired.add(QualityFlag.RCHI2_ABOVE_LIMIT);
      }
      if (pvalueViolated) {
        fired.add(QualityFlag.PVALUE_BELOW_MINIMUM);
      }
      final Termination termination;
      if (best.componentCount() == 0) {
        termination = Termination.NO_COMPONENTS;
      } else if (rchi2Violated || pvalueViolated) {
        termination = Termination.UNRESOLVED;
      } else {
        termination = Termination.STABLE;
      }
      if (termination == Termination.UNRESOLVED && settings.discardUnresolvedFits()) {
        throw new SpectrumRejectedException(
            "Fit unresolved after %d rounds: rchi2=%.3f, pvalue=%s".formatted(iterations,
                best.rchi2(), pvalue));
      }
      trace.trace(() -> "Improvement finished after %d rounds with %d components (%s)".formatted(
          iterations, best.componentCount(), termination));

      final QualityControl qc = new QualityControl(List.copyOf(fired), iterations, termination);
      final FitQuality quality = new FitQuality(best.rchi2(), best.aicc(), pvalue,
          negativeFeatures, blendedRefits, log, qc);
      return new ImprovedFit(best.parameters(), best.errors(), best.model(), best.residual(),
          quality, improved, bounds);
    }

    private BestFit accept(BestFit candidate, QualityFlag flag, @Nullable Integer logCode)
        throws SpectrumRejectedException {
      fired.add(flag);
      if (logCode != null) {
        log.add(logCode);
      }
      improved = true;
      trace.trace(() -> "Accepted %s refit: %d components, rchi2=%.3f, aicc=%.3f".formatted(flag,
          candidate.componentCount(), candidate.rchi2(), candidate.aicc()));
      checkBudget(candidate);
      return candidate;
    }

    private void checkBudget(BestFit fit) throws SpectrumRejectedException {
      final Integer max = settings.maxNcomps();
      if (max != null && fit.componentCount() > max) {
        throw new SpectrumRejectedException(
            "Component budget exceeded: %d components, maximum is %d".formatted(
                fit.componentCount(), max));
      }
    }

    private boolean needsImprovement(BestFit best) {
      if (best.rchi2() > settings.rchi2Limit()) {
        return true;
      }
      return best.componentCount() > 0 && pvalue(best) < settings.minPvalue();
    }

    private boolean isBetter(BestFit candidate, BestFit current) {
      return candidate.aicc() < current.aicc() && !GoodnessOfFit.isClose(candidate.aicc(),
          current.aicc(), AICC_TOLERANCE);
    }

    // fitting and screening

    /**
     * Fits the components and drops screened components until all survivors pass. A fit that
     * does not converge yields the empty model.
     */
    private BestFit fitAndScreen(GaussianParameters start) {
      GaussianParameters params = start;
      while (!params.isEmpty()) {
        final FitAttempt attempt = fitter.fit(params, bounds, residuals);
        if (!attempt.success()) {
          trace.trace(() -> "Fit did not converge: " + attempt.message());
          return zeroFit();
        }
        final List<Integer> rejected = screen(attempt.parameters());
        if (rejected.isEmpty()) {
          return bestFit(attempt.parameters(), attempt.errors());
        }
        params = attempt.parameters().without(rejected);
      }
      return zeroFit();
    }

    private List<Integer> screen(GaussianParameters params) {
      final List<Integer> rejected = new ArrayList<>();
      for (int i = 0; i < params.componentCount(); i++) {
        final QualityFlag flag = screenComponent(params.amplitude(i), params.fwhm(i) / dv,
            spectrum.velocityToChannel(params.mean(i)));
        if (flag != null) {
          fired.add(flag);
          rejected.add(i);
        }
      }
      return rejected;
    }

    private @Nullable QualityFlag screenComponent(double amp, double fwhmChannels,
        double channel) {
      if (amp < settings.snrFit() * rms) {
        return QualityFlag.LOW_AMPLITUDE;
      }
      if (ResidualPeakFinder.componentSignificance(amp, fwhmChannels, rms)
          < settings.significance()) {
        return QualityFlag.LOW_SIGNIFICANCE;
      }
      if (settings.refitBroad() && (fwhmChannels < settings.minFwhm() || (
          settings.maxFwhm() != null && fwhmChannels > settings.maxFwhm()))) {
        return QualityFlag.FWHM_OUT_OF_RANGE;
      }
      if (settings.excludeMeansOutsideChannelRange() && (channel < 0 || channel > n - 1)) {
        return QualityFlag.MEAN_OUT_OF_RANGE;
      }
      if (!spectrum.signalRanges().isEmpty() && !ChannelMasks.inAnyRange(
          (int) Math.round(channel), spectrum.signalRanges())) {
        return QualityFlag.OUTSIDE_SIGNAL_RANGE;
      }
      return null;
    }

    private BestFit bestFit(GaussianParameters params, @Nullable GaussianParameters fitErrors) {
      final double[] model = params.evaluate(vel);
      final double[] residual = new double[n];
      for (int i = 0; i < n; i++) {
        residual[i] = data[i] - model[i];
      }
      final int k = params.componentCount();
      final GaussianParameters err = fitErrors != null ? fitErrors
          : GaussianParameters.fromVector(new double[3 * k]);
      return new BestFit(params, err, model, residual,
          GoodnessOfFit.reducedChiSquare(data, model, errors, k, mask),
          GoodnessOfFit.aicc(data, model, k, mask));
    }

    private BestFit zeroFit() {
      return bestFit(GaussianParameters.EMPTY, GaussianParameters.EMPTY);
    }

    /**
     * F-test p-value of the fit against a refit without its weakest component.
     */
    private double pvalue(BestFit best) {
      final int k = best.componentCount();
      final int dof = ChannelMasks.count(mask) - 3 * k;
      final double chi2Full = GoodnessOfFit.chiSquare(data, best.model(), errors, mask);
      final int[] byAmplitude = best.parameters().indicesByAmplitudeAscending();
      final GaussianParameters reduced = best.parameters().without(byAmplitude[0]);
      GaussianParameters reducedFit = reduced;
      if (!reduced.isEmpty()) {
        final FitAttempt attempt = fitter.fit(reduced, bounds, residuals);
        if (attempt.success()) {
          reducedFit = attempt.parameters();
        }
      }
      final double chi2Reduced = GoodnessOfFit.chiSquare(data, reducedFit.evaluate(vel), errors,
          mask);
      return GoodnessOfFit.fTestPvalue(chi2Reduced, chi2Full, dof);
    }

    // refits

    private @Nullable BestFit refitResidualPeaks(BestFit best) {
      final List<Feature> features = ResidualPeakFinder.find(best.residual(), rms,
          settings.snr(), settings.significance(), Polarity.POSITIVE);
      if (features.isEmpty()) {
        return null;
      }
      final List<Integer> offsets = features.stream().map(Feature::offset).toList();
      if (fittedResidualPeaks.contains(offsets)) {
        return null;
      }
      fittedResidualPeaks.add(offsets);
      trace.trace(() -> "Fitting " + features.size() + " residual peaks at channels " + offsets);
      final BestFit candidate = fitAndScreen(best.parameters().concat(toComponents(features)));
      return isBetter(candidate, best) ? candidate : null;
    }

    /**
     * Negative residual features below {@code -snr_negative * rms} that are caused by the model,
     * most negative first.
     */
    private List<Feature> negativeResidualFeatures(BestFit best) {
      final double[] residual = best.residual();
      final List<Feature> features = new ArrayList<>();
      for (Feature f : ResidualPeakFinder.find(residual, rms, settings.snrNegative(),
          settings.significance(), Polarity.NEGATIVE)) {
        final int o = f.offset();
        // dip already present in the data
        if (residual[o] > data[o] - settings.snr() * rms) {
          continue;
        }
        if (spikeFree != null && !spikeFree[o]) {
          continue;
        }
        features.add(f);
      }
      features.sort(Comparator.comparingDouble(Feature::amplitude));
      return features;
    }

    private @Nullable BestFit refitNegativeResidual(BestFit best) {
      for (Feature f : negativeResidualFeatures(best)) {
        final int lower = Math.max(0, (int) (f.offset() - f.fwhm()));
        final int upper = (int) (f.offset() + f.fwhm()) + 2;
        final int index = componentContaining(best.parameters(), lower, upper);
        if (index < 0) {
          continue;
        }
        final BestFit candidate = replaceComponent(best, index, lower, upper);
        if (candidate != null) {
          return candidate;
        }
      }
      return null;
    }

    private @Nullable BestFit refitBroad(BestFit best) {
      final GaussianParameters params = best.parameters();
      if (params.componentCount() < 2) {
        return null;
      }
      int broadest = 0;
      for (int i = 1; i < params.componentCount(); i++) {
        if (params.fwhm(i) > params.fwhm(broadest)) {
          broadest = i;
        }
      }
      double second = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < params.componentCount(); i++) {
        if (i != broadest) {
          second = Math.max(second, params.fwhm(i));
        }
      }
      if (!(params.fwhm(broadest) > settings.fwhmFactor() * second)) {
        return null;
      }
      final int[] window = window(params, broadest);
      return replaceComponent(best, broadest, window[0], window[1]);
    }

    private @Nullable BestFit refitBlended(BestFit best) {
      final GaussianParameters params = best.parameters();
      final Set<Integer> blended = new TreeSet<>();
      for (int[] pair : blendedPairs(params)) {
        blended.add(pair[0]);
        blended.add(pair[1]);
      }
      final List<Integer> weakestFirst = new ArrayList<>(blended);
      weakestFirst.sort(Comparator.comparingDouble(params::amplitude));
      for (int index : weakestFirst) {
        final int[] window = window(params, index);
        final BestFit candidate = replaceComponent(best, index, window[0], window[1]);
        if (candidate != null) {
          return candidate;
        }
      }
      return null;
    }

    /**
     * Removes a component and refits. If that alone does not improve the fit, residual peaks
     * within channels [lower, upper) of the reduced fit are added and fitted.
     */
    private @Nullable BestFit replaceComponent(BestFit best, int index, int lower, int upper) {
      final BestFit reduced = fitAndScreen(best.parameters().without(index));
      if (isBetter(reduced, best)) {
        return reduced;
      }
      final List<Feature> features = ResidualPeakFinder.find(reduced.residual(), lower, upper,
          rms, settings.snr(), settings.significance(), Polarity.POSITIVE);
      if (features.isEmpty()) {
        return null;
      }
      final BestFit candidate = fitAndScreen(
          reduced.parameters().concat(toComponents(features)));
      return isBetter(candidate, best) ? candidate : null;
    }

    /**
     * Index of the single component whose +-FWHM channel window contains [lower, upper), -1 if
     * none or several do.
     */
    private int componentContaining(GaussianParameters params, int lower, int upper) {
      int found = -1;
      for (int i = 0; i < params.componentCount(); i++) {
        final int[] window = window(params, i);
        if (window[0] <= lower && window[1] >= upper) {
          if (found >= 0) {
            return -1;
          }
          found = i;
        }
      }
      return found;
    }

    private int[] window(GaussianParameters params, int index) {
      final double channel = spectrum.velocityToChannel(params.mean(index));
      final double width = params.fwhm(index) / dv;
      return new int[]{Math.max(0, (int) (channel - width)), (int) (channel + width) + 2};
    }

    private List<int[]> blendedPairs(GaussianParameters params) {
      final List<int[]> pairs = new ArrayList<>();
      for (int i = 0; i < params.componentCount(); i++) {
        for (int j = i + 1; j < params.componentCount(); j++) {
          final double separation = Math.abs(params.mean(i) - params.mean(j));
          final double minFwhm = Math.min(params.fwhm(i), params.fwhm(j));
          if (separation < minFwhm * settings.separationFactor()) {
            pairs.add(new int[]{i, j});
          }
        }
      }
      return pairs;
    }

    private GaussianParameters toComponents(List<Feature> features) {
      final int k = features.size();
      final double[] amps = new double[k];
      final double[] fwhms = new double[k];
      final double[] means = new double[k];
      for (int i = 0; i < k; i++) {
        final Feature f = features.get(i);
        amps[i] = f.amplitude();
        fwhms[i] = f.fwhm() * dv;
        means[i] = spectrum.channelToVelocity(f.offset());
      }
      return GaussianParameters.of(amps, fwhms, means);
    }
  }
}
