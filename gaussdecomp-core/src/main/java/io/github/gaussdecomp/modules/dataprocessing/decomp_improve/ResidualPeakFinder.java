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

import java.util.ArrayList;
import java.util.List;

/**
 * Finds runs of consecutive channels where a residual exceeds {@code snr * rms} and turns the
 * significant ones into Gaussian guesses.
 */
final class ResidualPeakFinder {

  /**
   * Integrated significance of a Gaussian per {@code A sqrt(fwhm) / rms}.
   */
  static final double SIGNIFICANCE_SCALE = 0.75269184778925247;

  enum Polarity {
    POSITIVE, NEGATIVE
  }

  /**
   * @param amplitude extreme value of the run, negative for negative features
   * @param fwhm      FWHM guess in channels
   * @param offset    channel of the extreme value
   */
  record Feature(double amplitude, double fwhm, int offset) {

  }

  private ResidualPeakFinder() {
  }

  static List<Feature> find(double[] residual, double rms, double snr, double significance,
      Polarity polarity) {
    return find(residual, 0, residual.length, rms, snr, significance, polarity);
  }

  /**
   * Searches channels [from, to).
   */
  static List<Feature> find(double[] residual, int from, int to, double rms, double snr,
      double significance, Polarity polarity) {
    final double threshold = snr * rms;
    final int end = Math.min(to, residual.length);
    final List<Feature> features = new ArrayList<>();
    int i = Math.max(0, from);
    while (i < end) {
      if (!exceeds(residual[i], threshold, polarity)) {
        i++;
        continue;
      }
      final int lower = i;
      while (i < end && exceeds(residual[i], threshold, polarity)) {
        i++;
      }
      final Feature feature = feature(residual, lower, i, rms, significance, polarity);
      if (feature != null) {
        features.add(feature);
      }
    }
    return features;
  }

  private static Feature feature(double[] residual, int lower, int upper, double rms,
      double significance, Polarity polarity) {
    double sum = 0d;
    int offset = lower;
    for (int k = lower; k < upper; k++) {
      sum += Math.abs(residual[k]);
      if (Math.abs(residual[k]) > Math.abs(residual[offset])) {
        offset = k;
      }
    }
    final double runSignificance = sum / (Math.sqrt(upper - lower) * rms);
    if (!(runSignificance > significance)) {
      return null;
    }
    final double amplitude = residual[offset];
    final double width = runSignificance * rms / (Math.abs(amplitude) * SIGNIFICANCE_SCALE);
    return new Feature(amplitude, width * width, offset);
  }

  private static boolean exceeds(double value, double threshold, Polarity polarity) {
    return polarity == Polarity.POSITIVE ? value > threshold : value < -threshold;
  }

  /**
   * Significance of a fitted component with FWHM in channels.
   */
  static double componentSignificance(double amplitude, double fwhmChannels, double rms) {
    return amplitude * Math.sqrt(fwhmChannels) * SIGNIFICANCE_SCALE / rms;
  }
}
