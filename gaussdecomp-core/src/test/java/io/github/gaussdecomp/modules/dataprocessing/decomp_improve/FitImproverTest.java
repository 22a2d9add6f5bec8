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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.Range;
import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.FitQuality;
import io.github.gaussdecomp.datamodel.decomposition.QualityControl.Termination;
import io.github.gaussdecomp.datamodel.decomposition.QualityFlag;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitAttempt;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitBounds;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.GaussianLeastSquaresFitter;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.ResidualFunction;
import io.github.gaussdecomp.testutils.SyntheticSpectra;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

class FitImproverTest {

  /**
   * Returns the start parameters as the fit result, so the quality control alone decides.
   */
  private static final GaussianLeastSquaresFitter IDENTITY_FITTER =
      new GaussianLeastSquaresFitter() {
        @Override
        public @NotNull FitAttempt fit(@NotNull GaussianParameters start,
            @NotNull FitBounds bounds, @NotNull ResidualFunction residuals) {
          return new FitAttempt(true, start,
              GaussianParameters.fromVector(new double[3 * start.componentCount()]), 1, 0d, null);
        }
      };

  private static final Spectrum NOISELESS = SyntheticSpectra.noiseless(0, 256, 0.1,
      SyntheticSpectra.single(5d, 10d, 128d));

  // thresholds far above the 1.0 residual of the noiseless spectrum
  private static ImproveFitSettings.Builder quiet() {
    return ImproveFitSettings.builder().snr(100d).snrFit(1d);
  }

  @Test
  void poorFitStaysUnresolved() throws SpectrumRejectedException {
    final FitImprover improver = new FitImprover(quiet().build(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(NOISELESS, SyntheticSpectra.single(4d, 10d, 128d),
        FitBounds.UNBOUNDED);

    assertEquals(1, fit.componentCount());
    assertFalse(fit.improved());
    final FitQuality quality = fit.quality();
    // 7.53 / 0.01 / 253
    assertEquals(2.975, quality.rchi2(), 0.01);
    assertNotNull(quality.pvalue());
    assertTrue(quality.pvalue() > 0.99);
    assertEquals(Termination.UNRESOLVED, quality.qualityControl().termination());
    assertEquals(2, quality.qualityControl().iterations());
    assertTrue(quality.qualityControl().fired(QualityFlag.RCHI2_ABOVE_LIMIT));
    assertFalse(quality.qualityControl().fired(QualityFlag.PVALUE_BELOW_MINIMUM));
    assertEquals(0, quality.negativeResidualPeaks());
  }

  @Test
  void unresolvedFitIsDiscarded() {
    final FitImprover improver = new FitImprover(
        quiet().discardUnresolvedFits(true).build(), IDENTITY_FITTER);
    assertThrows(SpectrumRejectedException.class,
        () -> improver.improve(NOISELESS, SyntheticSpectra.single(4d, 10d, 128d),
            FitBounds.UNBOUNDED));
  }

  @Test
  void componentBudget() {
    final FitImprover improver = new FitImprover(quiet().maxNcomps(1).build(), IDENTITY_FITTER);
    final GaussianParameters start = GaussianParameters.of(new double[]{4d, 4d},
        new double[]{10d, 10d}, new double[]{100d, 150d});
    assertThrows(SpectrumRejectedException.class,
        () -> improver.improve(NOISELESS, start, FitBounds.UNBOUNDED));
  }

  @Test
  void narrowComponentIsScreened() throws SpectrumRejectedException {
    final FitImprover improver = new FitImprover(quiet().minFwhm(20d).build(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(NOISELESS, SyntheticSpectra.single(5d, 10d, 128d),
        FitBounds.UNBOUNDED);
    assertEquals(0, fit.componentCount());
    assertEquals(Termination.NO_COMPONENTS, fit.quality().qualityControl().termination());
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.FWHM_OUT_OF_RANGE));
    assertNull(fit.quality().pvalue());
  }

  @Test
  void weakComponentIsScreened() throws SpectrumRejectedException {
    final FitImprover improver = new FitImprover(quiet().build(), IDENTITY_FITTER);
    final GaussianParameters start = GaussianParameters.of(new double[]{5d, 0.05},
        new double[]{10d, 10d}, new double[]{128d, 30d});
    final ImprovedFit fit = improver.improve(NOISELESS, start, FitBounds.UNBOUNDED);
    assertEquals(1, fit.componentCount());
    assertEquals(128d, fit.parameters().mean(0));
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.LOW_AMPLITUDE));
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void cleanSingleComponentIsStable() throws SpectrumRejectedException {
    final Spectrum spectrum = SyntheticSpectra.spectrum(0, 200, 0.1, 11L,
        SyntheticSpectra.single(2d, 12d, 100d));
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(),
        new GaussianLeastSquaresFitter());
    final ImprovedFit fit = improver.improve(spectrum, SyntheticSpectra.single(1.8, 10d, 98d),
        FitBounds.UNBOUNDED);

    assertEquals(1, fit.componentCount());
    assertEquals(2d, fit.parameters().amplitude(0), 0.1);
    assertEquals(12d, fit.parameters().fwhm(0), 0.5);
    assertEquals(100d, fit.parameters().mean(0), 0.3);
    assertEquals(1, fit.errors().componentCount());
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
    assertEquals(1, fit.quality().qualityControl().iterations());
    assertTrue(fit.quality().rchi2() < 1.5);
  }

  @Test
  void missingComponentIsRecoveredFromResidual() throws SpectrumRejectedException {
    final GaussianParameters truth = GaussianParameters.of(new double[]{2d, 1.5},
        new double[]{10d, 10d}, new double[]{60d, 140d});
    final Spectrum spectrum = SyntheticSpectra.spectrum(0, 200, 0.1, 23L, truth);
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(),
        new GaussianLeastSquaresFitter());
    final ImprovedFit fit = improver.improve(spectrum, SyntheticSpectra.single(2d, 10d, 60d),
        FitBounds.UNBOUNDED);

    assertTrue(fit.improved());
    assertEquals(2, fit.componentCount());
    assertEquals(2, fit.errors().componentCount());
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.RESIDUAL_PEAK));
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
    final GaussianParameters sorted = fit.parameters().sortedByAmplitudeDescending();
    assertEquals(60d, sorted.mean(0), 0.5);
    assertEquals(140d, sorted.mean(1), 0.5);
    assertEquals(1.5, sorted.amplitude(1), 0.15);
  }

  private static GaussianParameters withExtra(double amp, double fwhm, double mean) {
    return SyntheticSpectra.single(5d, 10d, 128d).concat(SyntheticSpectra.single(amp, fwhm, mean));
  }

  @Test
  void negativeResidualRemovesComponent() throws SpectrumRejectedException {
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(NOISELESS, withExtra(10d, 20d, 40d),
        FitBounds.UNBOUNDED);

    assertEquals(List.of(FitImprover.LOG_NEGATIVE_RESIDUAL), fit.quality().log());
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.NEGATIVE_RESIDUAL));
    assertTrue(fit.improved());
    assertEquals(1, fit.componentCount());
    assertEquals(128d, fit.parameters().mean(0));
    assertEquals(0, fit.quality().negativeResidualPeaks());
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void negativeResidualInsideNoiseSpikeIsIgnored() throws SpectrumRejectedException {
    final Spectrum spiky = NOISELESS.withRanges(List.of(), List.of(Range.closedOpen(10, 70)));
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(spiky, withExtra(10d, 20d, 40d),
        FitBounds.UNBOUNDED);

    assertTrue(fit.quality().log().isEmpty());
    assertFalse(fit.quality().qualityControl().fired(QualityFlag.NEGATIVE_RESIDUAL));
    assertEquals(2, fit.componentCount());
    assertEquals(0, fit.quality().negativeResidualPeaks());
    assertTrue(fit.quality().rchi2() < 0.01);
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void noiseSpikeChannelsDoNotCountForChiSquare() throws SpectrumRejectedException {
    final double[] intensity = NOISELESS.intensity().clone();
    for (int i = 40; i < 43; i++) {
      intensity[i] += 3d;
    }
    final Spectrum spiky = Spectrum.withConstantError(0, NOISELESS.velocity(), intensity, 0.1)
        .withRanges(List.of(), List.of(Range.closedOpen(40, 43)));
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(spiky, SyntheticSpectra.single(5d, 10d, 128d),
        FitBounds.UNBOUNDED);

    assertEquals(1, fit.componentCount());
    assertEquals(0d, fit.quality().rchi2());
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void broadComponentIsReplaced() throws SpectrumRejectedException {
    final Spectrum spectrum = SyntheticSpectra.noiseless(0, 256, 0.1,
        SyntheticSpectra.single(5d, 8d, 100d));
    final GaussianParameters start = GaussianParameters.of(new double[]{5d, 0.5},
        new double[]{8d, 40d}, new double[]{100d, 100d});
    final FitImprover improver = new FitImprover(
        ImproveFitSettings.builder().refitNegResPeak(false).build(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(spectrum, start, FitBounds.UNBOUNDED);

    assertEquals(List.of(FitImprover.LOG_BROAD), fit.quality().log());
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.BROAD_COMPONENT));
    assertEquals(1, fit.componentCount());
    assertEquals(8d, fit.parameters().fwhm(0));
    assertEquals(0, fit.quality().blendedComponents());
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void blendedComponentIsMerged() throws SpectrumRejectedException {
    final FitImprover improver = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(NOISELESS, withExtra(0.25, 10d, 129d),
        FitBounds.UNBOUNDED);

    assertEquals(List.of(FitImprover.LOG_BLENDED), fit.quality().log());
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.BLENDED_COMPONENTS));
    assertEquals(1, fit.componentCount());
    assertEquals(5d, fit.parameters().amplitude(0));
    assertEquals(1, fit.quality().blendedComponents());
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void blendedCountIsZeroWithoutMerge() throws SpectrumRejectedException {
    final GaussianParameters start = GaussianParameters.of(new double[]{2.5, 2.5},
        new double[]{10d, 10d}, new double[]{127d, 129d});
    final FitImprover improver = new FitImprover(
        ImproveFitSettings.builder().refitBlended(false).build(), IDENTITY_FITTER);
    final ImprovedFit fit = improver.improve(NOISELESS, start, FitBounds.UNBOUNDED);

    assertEquals(2, fit.componentCount());
    assertTrue(fit.quality().log().isEmpty());
    assertEquals(0, fit.quality().blendedComponents());
  }

  @Test
  void meanOutsideChannelRangeIsScreened() throws SpectrumRejectedException {
    final ImprovedFit fit = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER)
        .improve(NOISELESS, withExtra(1d, 10d, 300d), FitBounds.UNBOUNDED);
    assertEquals(1, fit.componentCount());
    assertEquals(128d, fit.parameters().mean(0));
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.MEAN_OUT_OF_RANGE));
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());

    final ImprovedFit kept = new FitImprover(
        ImproveFitSettings.builder().excludeMeansOutsideChannelRange(false).build(),
        IDENTITY_FITTER).improve(NOISELESS, withExtra(1d, 10d, 300d), FitBounds.UNBOUNDED);
    assertEquals(2, kept.componentCount());
    assertFalse(kept.quality().qualityControl().fired(QualityFlag.MEAN_OUT_OF_RANGE));
  }

  @Test
  void meanOutsideSignalRangesIsScreened() throws SpectrumRejectedException {
    final Spectrum ranged = NOISELESS.withRanges(List.of(Range.closedOpen(100, 160)), List.of());
    final ImprovedFit fit = new FitImprover(ImproveFitSettings.defaults(), IDENTITY_FITTER)
        .improve(ranged, withExtra(1d, 10d, 40d), FitBounds.UNBOUNDED);
    assertEquals(1, fit.componentCount());
    assertEquals(128d, fit.parameters().mean(0));
    assertTrue(fit.quality().qualityControl().fired(QualityFlag.OUTSIDE_SIGNAL_RANGE));
    assertEquals(Termination.STABLE, fit.quality().qualityControl().termination());
  }

  @Test
  void fittedWidthsStayWithinLimits() throws SpectrumRejectedException {
    final GaussianParameters truth = GaussianParameters.of(new double[]{3d, 3d},
        new double[]{12d, 2d}, new double[]{80d, 150d});
    final Spectrum spectrum = SyntheticSpectra.spectrum(0, 200, 0.1, 31L, truth);
    final FitImprover improver = new FitImprover(
        ImproveFitSettings.builder().minFwhm(4d).maxFwhm(30d).build(),
        new GaussianLeastSquaresFitter());
    final ImprovedFit fit = improver.improve(spectrum, truth, new FitBounds(null, 30d));

    assertTrue(fit.quality().qualityControl().fired(QualityFlag.FWHM_OUT_OF_RANGE));
    assertTrue(fit.componentCount() >= 1);
    for (double fwhm : fit.parameters().fwhms()) {
      assertTrue(fwhm >= 4d && fwhm <= 30d, "fwhm " + fwhm);
    }
  }
}
