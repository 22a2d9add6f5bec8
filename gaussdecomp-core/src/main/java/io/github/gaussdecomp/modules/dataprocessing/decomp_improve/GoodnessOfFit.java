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

import io.github.gaussdecomp.util.ChannelMasks;
import org.apache.commons.math3.distribution.FDistribution;

/**
 * Fit statistics evaluated over a channel mask.
 */
public final class GoodnessOfFit {

  private GoodnessOfFit() {
  }

  /**
   * Reduced chi-square with {@code 3 * componentCount} free parameters.
   *
   * @return the reduced chi-square, infinite if there are no degrees of freedom left
   */
  public static double reducedChiSquare(double[] data, double[] model, double[] errors,
      int componentCount, boolean[] mask) {
    final int n = ChannelMasks.count(mask);
    final int dof = n - 3 * componentCount;
    if (dof <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    return chiSquare(data, model, errors, mask) / dof;
  }

  public static double chiSquare(double[] data, double[] model, double[] errors,
      boolean[] mask) {
    double chi2 = 0d;
    for (int i = 0; i < data.length; i++) {
      if (mask[i]) {
        final double r = (data[i] - model[i]) / errors[i];
        chi2 += r * r;
      }
    }
    return chi2;
  }

  /**
   * Corrected Akaike information criterion {@code 2(k - lnL) + 2k(k + 1) / (n - k - 1)} with the
   * Gaussian log-likelihood {@code lnL = -n/2 ln(SSR / n)} and {@code k = 3 * componentCount}.
   */
  public static double aicc(double[] data, double[] model, int componentCount, boolean[] mask) {
    final int n = ChannelMasks.count(mask);
    final int k = 3 * componentCount;
    if (n - k - 1 <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    double ssr = 0d;
    for (int i = 0; i < data.length; i++) {
      if (mask[i]) {
        final double r = data[i] - model[i];
        ssr += r * r;
      }
    }
    final double logLikelihood = -0.5 * n * Math.log(ssr / n);
    return 2d * (k - logLikelihood) + 2d * k * (k + 1) / (n - k - 1);
  }

  /**
   * F-test of a model against a nested model with three parameters less. The returned value is
   * the F distribution's cumulative probability of the observed improvement, so a small value
   * marks a last component that does not improve the fit beyond chance.
   *
   * @param chiSquareReduced chi-square of the model with one component less
   * @param chiSquareFull    chi-square of the full model
   * @param dof              degrees of freedom of the full model
   * @return value in [0, 1], NaN without degrees of freedom
   */
  public static double fTestPvalue(double chiSquareReduced, double chiSquareFull, int dof) {
    if (dof <= 0) {
      return Double.NaN;
    }
    if (chiSquareFull <= 0d) {
      return chiSquareReduced > 0d ? 1d : 0d;
    }
    final double f = ((chiSquareReduced - chiSquareFull) / 3d) / (chiSquareFull / dof);
    if (!(f > 0d)) {
      return 0d;
    }
    return new FDistribution(3d, dof).cumulativeProbability(f);
  }

  /**
   * {@code |a - b| <= atol + rtol * |b|} with rtol 1e-5.
   */
  static boolean isClose(double a, double b, double atol) {
    if (a == b) {
      return true;
    }
    return Math.abs(a - b) <= atol + 1e-5 * Math.abs(b);
  }
}
