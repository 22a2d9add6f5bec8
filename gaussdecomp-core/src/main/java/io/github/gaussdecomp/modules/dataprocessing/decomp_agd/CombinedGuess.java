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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Candidates of both decomposition phases.
 *
 * @param phaseOne         guess at alpha1 on the data
 * @param phaseTwo         guess at alpha2 on the residual, null in single phase mode
 * @param intermediateFit  phase one components fitted in second derivative space, null if not run
 *                         or not converged
 * @param phaseTwoResidual signal searched in phase two, null in single phase mode
 * @param finalGuess       all candidates sorted by descending amplitude
 */
public record CombinedGuess(@NotNull InitialGuess phaseOne, @Nullable InitialGuess phaseTwo,
                            @Nullable GaussianParameters intermediateFit,
                            double @Nullable [] phaseTwoResidual,
                            @NotNull GaussianParameters finalGuess) {

}
