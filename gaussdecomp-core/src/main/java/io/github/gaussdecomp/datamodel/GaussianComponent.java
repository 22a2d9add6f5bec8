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

package io.github.gaussdecomp.datamodel;

/**
 * One Gaussian line, parameterized by its full width at half maximum.
 */
public record GaussianComponent(double amplitude, double fwhm, double mean) {

  /**
   * Converts a Gaussian standard deviation to its FWHM: 2 * sqrt(2 ln 2).
   */
  public static final double SIGMA_TO_FWHM = 2d * Math.sqrt(2d * Math.log(2d));

  /**
   * 4 ln 2, the exponent factor of the FWHM parameterization.
   */
  static final double FOUR_LN2 = 4d * Math.log(2d);

  public static double value(double amplitude, double fwhm, double mean, double x) {
    final double d = x - mean;
    return amplitude * Math.exp(-FOUR_LN2 * d * d / (fwhm * fwhm));
  }

  public double value(double x) {
    return value(amplitude, fwhm, mean, x);
  }

  public double sigma() {
    return fwhm / SIGMA_TO_FWHM;
  }
}
