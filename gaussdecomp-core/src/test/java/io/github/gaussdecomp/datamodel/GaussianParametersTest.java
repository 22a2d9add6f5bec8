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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GaussianParametersTest {

  private final GaussianParameters params = GaussianParameters.of(new double[]{1, 3, 2},
      new double[]{10, 11, 12}, new double[]{20, 21, 22});

  @Test
  void flatVectorLayout() {
    assertArrayEquals(new double[]{1, 3, 2, 10, 11, 12, 20, 21, 22}, params.toVector());
    assertEquals(params, GaussianParameters.fromVector(params.toVector()));
    assertThrows(IllegalArgumentException.class,
        () -> GaussianParameters.fromVector(new double[4]));
  }

  @Test
  void unequalLengthsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> GaussianParameters.of(new double[]{1}, new double[]{1, 2}, new double[]{1}));
  }

  @Test
  void emptyVectorIsEmpty() {
    assertSame(GaussianParameters.EMPTY, GaussianParameters.fromVector(new double[0]));
    assertTrue(GaussianParameters.EMPTY.isEmpty());
  }

  @Test
  void sortByAmplitude() {
    final GaussianParameters sorted = params.sortedByAmplitudeDescending();
    assertArrayEquals(new double[]{3, 2, 1}, sorted.amplitudes());
    assertArrayEquals(new double[]{11, 12, 10}, sorted.fwhms());
    assertArrayEquals(new double[]{21, 22, 20}, sorted.means());
    assertArrayEquals(new int[]{0, 2, 1}, params.indicesByAmplitudeAscending());
  }

  @Test
  void sortIsStableForTies() {
    final GaussianParameters ties = GaussianParameters.of(new double[]{1, 1},
        new double[]{5, 6}, new double[]{0, 1});
    assertArrayEquals(new double[]{5, 6}, ties.sortedByAmplitudeDescending().fwhms());
  }

  @Test
  void removeAndConcat() {
    assertArrayEquals(new double[]{1, 2}, params.without(1).amplitudes());
    assertArrayEquals(new double[]{3}, params.without(List.of(0, 2)).amplitudes());
    final GaussianParameters joined = params.without(1).concat(params.without(List.of(0, 2)));
    assertArrayEquals(new double[]{1, 2, 3}, joined.amplitudes());
    assertArrayEquals(new double[]{20, 22, 21}, joined.means());
    assertSame(params, params.concat(GaussianParameters.EMPTY));
  }

  @Test
  void evaluateAtMeanAndHalfMaximum() {
    final GaussianParameters single = GaussianParameters.of(new double[]{4}, new double[]{6},
        new double[]{10});
    final double[] y = single.evaluate(new double[]{10, 7, 13});
    assertEquals(4, y[0], 1e-12);
    assertEquals(2, y[1], 1e-12);
    assertEquals(2, y[2], 1e-12);
  }

  @Test
  void accessorsReturnCopies() {
    params.amplitudes()[0] = 100;
    assertEquals(1, params.amplitude(0));
  }
}
