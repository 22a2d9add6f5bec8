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

import org.jetbrains.annotations.NotNull;

/**
 * Regularized derivatives of a spectrum, obtained by convolving with derivatives of a normalized
 * Gaussian kernel. The kernel standard deviation is {@code alpha} channels, the kernel half-width
 * {@code max(trunc(alpha), 5) * 6} channels. Convolution wraps around at the spectrum edges.
 *
 * @param u  first derivative
 * @param u2 second derivative
 * @param u3 third derivative
 * @param u4 fourth derivative
 */
public record AgdDerivatives(double[] u, double[] u2, double[] u3, double[] u4) {

  private static final int MIN_KERNEL_SIGMA = 5;
  private static final int KERNEL_SIGMAS = 6;

  /**
   * @param data  intensities
   * @param dv    channel spacing
   * @param alpha kernel standard deviation in channels, &gt; 0
   */
  public static @NotNull AgdDerivatives compute(double @NotNull [] data, double dv,
      double alpha) {
    if (!(alpha > 0)) {
      throw new IllegalArgumentException("alpha must be positive but was " + alpha);
    }
    final int dn = halfWidth(alpha);

    // odd orders: kernel sampled between channels
    final double[] gauss = new double[2 * dn + 2];
    for (int i = 0; i < gauss.length; i++) {
      final double x = i - dn - 0.5;
      gauss[i] = Math.exp(-x * x / 2d / alpha / alpha);
    }
    normalize(gauss);
    final double[] gauss1 = scale(diff(gauss), 1d / dv);
    final double[] gauss3 = scale(diff(diff(gauss1)), 1d / (dv * dv));

    // even orders: kernel sampled on channels
    final double[] gaussEven = new double[2 * dn + 1];
    for (int i = 0; i < gaussEven.length; i++) {
      final double x = i - dn;
      gaussEven[i] = Math.exp(-x * x / 2d / alpha / alpha);
    }
    normalize(gaussEven);
    final double[] gauss2 = scale(diff(scale(diff(gaussEven), 1d / dv)), 1d / dv);
    final double[] gauss4 = scale(diff(diff(gauss2)), 1d / (dv * dv));

    return new AgdDerivatives(convolveWrap(data, gauss1), convolveWrap(data, gauss2),
        convolveWrap(data, gauss3), convolveWrap(data, gauss4));
  }

  static int halfWidth(double alpha) {
    final int sigma = Math.max((int) alpha, MIN_KERNEL_SIGMA);
    return sigma * KERNEL_SIGMAS;
  }

  /**
   * Periodic convolution {@code out[i] = sum_m kernel[m] * data[(i + L/2 - m) mod n]}.
   */
  static double[] convolveWrap(double[] data, double[] kernel) {
    final int n = data.length;
    final int center = kernel.length / 2;
    final double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0d;
      for (int m = 0; m < kernel.length; m++) {
        sum += kernel[m] * data[Math.floorMod(i + center - m, n)];
      }
      out[i] = sum;
    }
    return out;
  }

  static double[] diff(double[] values) {
    final double[] d = new double[values.length - 1];
    for (int i = 0; i < d.length; i++) {
      d[i] = values[i + 1] - values[i];
    }
    return d;
  }

  private static double[] scale(double[] values, double factor) {
    for (int i = 0; i < values.length; i++) {
      values[i] *= factor;
    }
    return values;
  }

  private static void normalize(double[] values) {
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    scale(values, 1d / sum);
  }
}
