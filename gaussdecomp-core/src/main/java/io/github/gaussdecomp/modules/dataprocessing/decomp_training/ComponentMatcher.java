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

import io.github.gaussdecomp.datamodel.GaussianParameters;
import org.jetbrains.annotations.NotNull;

/**
 * Matches guessed components against true components. A guess matches a true component if its
 * mean lies within half the true FWHM and amplitude and FWHM agree within a factor of two. Each
 * guess can match at most one true component.
 */
public final class ComponentMatcher {

  public static final double MAX_RATIO = 2d;

  private ComponentMatcher() {
  }

  /**
   * @return number of matched pairs, greedily assigned from the strongest true component on
   */
  public static int countMatches(@NotNull GaussianParameters truth,
      @NotNull GaussianParameters guess) {
    final boolean[] used = new boolean[guess.componentCount()];
    final int[] order = truth.indicesByAmplitudeAscending();
    int matches = 0;
    for (int o = order.length - 1; o >= 0; o--) {
      final int t = order[o];
      int best = -1;
      double bestDistance = Double.POSITIVE_INFINITY;
      for (int g = 0; g < used.length; g++) {
        if (used[g] || !matches(truth, t, guess, g)) {
          continue;
        }
        final double distance = Math.abs(guess.mean(g) - truth.mean(t));
        if (distance < bestDistance) {
          bestDistance = distance;
          best = g;
        }
      }
      if (best >= 0) {
        used[best] = true;
        matches++;
      }
    }
    return matches;
  }

  static boolean matches(GaussianParameters truth, int t, GaussianParameters guess, int g) {
    return Math.abs(guess.mean(g) - truth.mean(t)) <= truth.fwhm(t) / 2
        && withinRatio(guess.amplitude(g), truth.amplitude(t))
        && withinRatio(guess.fwhm(g), truth.fwhm(t));
  }

  private static boolean withinRatio(double value, double reference) {
    if (value <= 0 || reference <= 0) {
      return false;
    }
    final double ratio = value / reference;
    return ratio <= MAX_RATIO && ratio >= 1 / MAX_RATIO;
  }

  /**
   * F1 score from summed counts. Perfect (1) if there is nothing to find and nothing was found.
   */
  public static double f1(int matches, int trueCount, int guessCount) {
    if (trueCount + guessCount == 0) {
      return 1d;
    }
    return 2d * matches / (trueCount + guessCount);
  }
}
