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

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of alpha training.
 *
 * @param alpha1     trained first-phase smoothing
 * @param alpha2     trained second-phase smoothing, null for one-phase training
 * @param accuracy   F1 accuracy at the trained alphas
 * @param iterations number of gradient steps taken
 * @param converged  false if the iteration limit was reached first
 * @param history    ln(alpha) values per iteration, one array per iteration
 */
public record TrainingResult(double alpha1, @Nullable Double alpha2, double accuracy,
                             int iterations, boolean converged, List<double[]> history) {

  public TrainingResult {
    history = List.copyOf(history);
  }
}
