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

package io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit;

import java.util.Arrays;

/**
 * Sum of Gaussians {@code A exp(-4 ln2 (x - mu)^2 / fwhm^2)} with analytic partial derivatives.
 */
public final class MultiGaussianFunction {

  private static final double FOUR_LN2 = 4d * Math.log(2d);

  private MultiGaussianFunction() {
  }

  /**
   * Evaluates the model and its Jacobian.
   *
   * @param x          channel velocities
   * @param parameters flat parameter vector
   * @param model      output, length x.length
   * @param jacobian   output, x.length rows by parameters.length columns, may be null
   */
  public static void evaluate(double[] x, double[] parameters, double[] model,
      double[][] jacobian) {
    final int n = parameters.length / 3;
    Arrays.fill(model, 0d);
    for (int c = 0; c < n; c++) {
      final double amp = parameters[c];
      final double fwhm = parameters[n + c];
      final double mean = parameters[2 * n + c];
      final double fwhm2 = fwhm * fwhm;
      for (int i = 0; i < x.length; i++) {
        final double d = x[i] - mean;
        final double e = Math.exp(-FOUR_LN2 * d * d / fwhm2);
        final double value = amp * e;
        model[i] += value;
        if (jacobian != null) {
          jacobian[i][c] = e;
          jacobian[i][n + c] = value * 2d * FOUR_LN2 * d * d / (fwhm2 * fwhm);
          jacobian[i][2 * n + c] = value * 2d * FOUR_LN2 * d / fwhm2;
        }
      }
    }
  }

  public static double[] value(double[] x, double[] parameters) {
    final double[] model = new double[x.length];
    evaluate(x, parameters, model, null);
    return model;
  }
}
