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
import io.github.gaussdecomp.datamodel.decomposition.FitQuality;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit.FitBounds;
import org.jetbrains.annotations.NotNull;

/**
 * Result of {@link FitImprover#improve}.
 *
 * @param model    best-fit model samples
 * @param residual data minus model
 * @param improved true if any refit replaced the starting fit
 * @param bounds   parameter limits the fits were run with
 */
public record ImprovedFit(@NotNull GaussianParameters parameters,
                          @NotNull GaussianParameters errors, double[] model, double[] residual,
                          @NotNull FitQuality quality, boolean improved,
                          @NotNull FitBounds bounds) {

  public int componentCount() {
    return parameters.componentCount();
  }
}
