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

package io.github.gaussdecomp.datamodel.decomposition;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Goodness-of-fit statistics of an improved fit.
 *
 * @param rchi2                reduced chi-square over the signal channels
 * @param aicc                 corrected Akaike information criterion
 * @param pvalue               F-test of N against N-1 components, null without components. This
 *                             is the cumulative F probability of the improvement the weakest
 *                             component brings, so values near 1 mean the component is needed
 *                             and values below the minimum p-value mean it is not.
 * @param negativeResidualPeaks number of remaining negative residual features
 * @param blendedComponents    number of accepted blended component refits
 * @param log                  codes of the refits performed: 1 negative residual, 2 broad, 3
 *                             blended
 * @param qualityControl       checks that fired during improvement
 */
public record FitQuality(double rchi2, double aicc, @Nullable Double pvalue,
                         int negativeResidualPeaks, int blendedComponents,
                         @NotNull List<Integer> log, @NotNull QualityControl qualityControl) {

  public FitQuality {
    log = List.copyOf(log);
  }
}
