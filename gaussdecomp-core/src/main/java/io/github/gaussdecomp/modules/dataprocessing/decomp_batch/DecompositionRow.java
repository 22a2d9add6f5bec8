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

package io.github.gaussdecomp.modules.dataprocessing.decomp_batch;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import io.github.gaussdecomp.datamodel.decomposition.FitQuality;
import io.github.gaussdecomp.datamodel.decomposition.QualityControl;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One spectrum's entry in a batch result. Fields that do not apply are null; a failed spectrum
 * only keeps its index.
 */
public record DecompositionRow(int indexFit, double @Nullable [] amplitudesFit,
                               double @Nullable [] fwhmsFit, double @Nullable [] meansFit,
                               @Nullable Integer nComponentsInitial,
                               double @Nullable [] amplitudesInitial,
                               double @Nullable [] fwhmsInitial,
                               double @Nullable [] meansInitial,
                               double @Nullable [] amplitudesFitErr,
                               double @Nullable [] fwhmsFitErr,
                               double @Nullable [] meansFitErr, @Nullable Double bestFitRchi2,
                               @Nullable Double bestFitAicc, @Nullable Integer nComponents,
                               @Nullable Integer nNegResPeak, @Nullable Integer nBlended,
                               @Nullable List<Integer> logGplus, @Nullable Double pvalue,
                               @Nullable QualityControl qualityControl) {

  public static DecompositionRow failed(int index) {
    return new DecompositionRow(index, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null, null, null, null, null);
  }

  public static DecompositionRow of(@NotNull DecompositionResult result) {
    if (result instanceof DecompositionResult.Decomposed decomposed) {
      return of(decomposed.index(), decomposed.outcome());
    }
    return failed(result.index());
  }

  static DecompositionRow of(int index, @NotNull FitOutcome outcome) {
    final GaussianParameters initial = outcome.initialGuess();
    final GaussianParameters fit;
    final GaussianParameters errors;
    if (outcome instanceof FitOutcome.NoComponents) {
      fit = GaussianParameters.EMPTY;
      errors = GaussianParameters.EMPTY;
    } else {
      fit = outcome.bestFit();
      errors = outcome.bestFitErrors();
    }
    final FitQuality quality =
        outcome instanceof FitOutcome.Improved improved ? improved.quality() : null;

    return new DecompositionRow(index, fit == null ? null : fit.amplitudes(),
        fit == null ? null : fit.fwhms(), fit == null ? null : fit.means(),
        initial.componentCount(), initial.amplitudes(), initial.fwhms(), initial.means(),
        errors == null ? null : errors.amplitudes(), errors == null ? null : errors.fwhms(),
        errors == null ? null : errors.means(), quality == null ? null : quality.rchi2(),
        quality == null ? null : quality.aicc(), outcome.componentCount(),
        quality == null ? null : quality.negativeResidualPeaks(),
        quality == null ? null : quality.blendedComponents(),
        quality == null ? null : quality.log(), quality == null ? null : quality.pvalue(),
        quality == null ? null : quality.qualityControl());
  }

  public boolean isFailed() {
    return nComponents == null;
  }

  public @Nullable Object get(@NotNull BatchField field) {
    return switch (field) {
      case INDEX_FIT -> indexFit;
      case AMPLITUDES_FIT -> amplitudesFit;
      case FWHMS_FIT -> fwhmsFit;
      case MEANS_FIT -> meansFit;
      case N_COMPONENTS_INITIAL -> nComponentsInitial;
      case AMPLITUDES_INITIAL -> amplitudesInitial;
      case FWHMS_INITIAL -> fwhmsInitial;
      case MEANS_INITIAL -> meansInitial;
      case AMPLITUDES_FIT_ERR -> amplitudesFitErr;
      case FWHMS_FIT_ERR -> fwhmsFitErr;
      case MEANS_FIT_ERR -> meansFitErr;
      case BEST_FIT_RCHI2 -> bestFitRchi2;
      case BEST_FIT_AICC -> bestFitAicc;
      case N_COMPONENTS -> nComponents;
      case N_NEG_RES_PEAK -> nNegResPeak;
      case N_BLENDED -> nBlended;
      case LOG_GPLUS -> logGplus;
      case PVALUE -> pvalue;
      case QUALITY_CONTROL -> qualityControl;
    };
  }
}
