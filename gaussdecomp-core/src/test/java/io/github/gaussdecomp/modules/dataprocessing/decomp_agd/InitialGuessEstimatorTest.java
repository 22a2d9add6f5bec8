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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.testutils.SyntheticSpectra;
import org.junit.jupiter.api.Test;

class InitialGuessEstimatorTest {

  private final InitialGuessEstimator estimator = new InitialGuessEstimator(5d, 5d);
  private final double[] velocity = SyntheticSpectra.axis(256, 1d);

  @Test
  void findsIsolatedGaussian() {
    final double[] data = SyntheticSpectra.single(5d, 10d, 100.3).evaluate(velocity);
    final InitialGuess guess = estimator.estimate(velocity, data, 0.1, 2d);
    assertNotNull(guess);
    assertEquals(1, guess.componentCount());
    final GaussianParameters p = guess.parameters();
    assertEquals(100.3, p.mean(0), 1d);
    assertEquals(5d, p.amplitude(0), 0.1);
    assertTrue(p.fwhm(0) > 9d && p.fwhm(0) < 13d, "fwhm " + p.fwhm(0));
    assertEquals(0.5, guess.threshold(), 1e-12);
  }

  @Test
  void findsTwoSeparatedGaussians() {
    final GaussianParameters truth = GaussianParameters.of(new double[]{3d, 6d},
        new double[]{8d, 12d}, new double[]{70.2, 170.6});
    final double[] data = truth.evaluate(velocity);
    final InitialGuess guess = estimator.estimate(velocity, data, 0.1, 2d);
    assertNotNull(guess);
    assertEquals(2, guess.componentCount());
    assertEquals(70.2, guess.parameters().mean(0), 1d);
    assertEquals(170.6, guess.parameters().mean(1), 1d);
  }

  @Test
  void weakSignalGivesNoCandidates() {
    final double[] data = SyntheticSpectra.single(0.3, 10d, 100.3).evaluate(velocity);
    final InitialGuess guess = estimator.estimate(velocity, data, 0.1, 2d);
    assertNotNull(guess);
    assertEquals(0, guess.componentCount());
    assertTrue(guess.parameters().isEmpty());
  }

  @Test
  void sameInputSameGuess() {
    final double[] data = SyntheticSpectra.spectrum(0, 256, 0.1, 42L,
        SyntheticSpectra.single(4d, 9d, 128.4)).intensity();
    final InitialGuess first = estimator.estimate(velocity, data, 0.1, 2.5);
    final InitialGuess second = estimator.estimate(velocity, data, 0.1, 2.5);
    assertNotNull(first);
    assertNotNull(second);
    assertEquals(first.parameters(), second.parameters());
  }

  @Test
  void nanDataGivesNull() {
    final double[] data = SyntheticSpectra.single(5d, 10d, 100.3).evaluate(velocity);
    data[20] = Double.NaN;
    assertNull(estimator.estimate(velocity, data, 0.1, 2d));
  }

  @Test
  void deblendingCorrectsOverlap() {
    // exp(-4 ln2 * 25 / 25) = 1/16
    final double[] corrected = InitialGuessEstimator.deblend(new double[]{1.0625, 1.0625},
        new double[]{5d, 5d}, new double[]{0d, 5d});
    assertArrayEquals(new double[]{1d, 1d}, corrected, 1e-9);
  }

  @Test
  void deblendingKeepsRawAmplitudesIfCorrectionTurnsNegative() {
    final double[] amps = {1d, 0.5};
    assertArrayEquals(amps, InitialGuessEstimator.deblend(amps, new double[]{10d, 10d},
        new double[]{0d, 0.5}));
  }

  @Test
  void noiseFromNegativeTail() {
    assertEquals(1.118033988749895,
        InitialGuessEstimator.estimateNoise(new double[]{-2, 2, -1, 1, 0, 10}), 1e-12);
  }

  @Test
  void missingNoiseIsEstimated() {
    final double[] data = SyntheticSpectra.spectrum(0, 256, 0.1, 7L,
        SyntheticSpectra.single(4d, 9d, 128.4)).intensity();
    final InitialGuess guess = estimator.estimate(velocity, data, null, 2.5);
    assertNotNull(guess);
    assertEquals(InitialGuessEstimator.estimateNoise(data), guess.noise(), 1e-15);
  }
}
