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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class GoodnessOfFitTest {

  private static final double[] DATA = {1, 2, 3, 4, 5, 6, 7, 8};
  private static final double[] MODEL = {1.5, 2, 2.5, 4, 5.5, 6, 6.5, 8};

  private static boolean[] all(int n) {
    final boolean[] mask = new boolean[n];
    Arrays.fill(mask, true);
    return mask;
  }

  @Test
  void reducedChiSquare() {
    final double[] errors = new double[8];
    Arrays.fill(errors, 0.5);
    assertEquals(0.8, GoodnessOfFit.reducedChiSquare(DATA, MODEL, errors, 1, all(8)), 1e-12);

    // masked channels do not count, neither for chi-square nor for the degrees of freedom
    final boolean[] mask = all(8);
    mask[0] = false;
    mask[2] = false;
    assertEquals(2d / 3d, GoodnessOfFit.reducedChiSquare(DATA, MODEL, errors, 1, mask), 1e-12);
  }

  @Test
  void reducedChiSquareWithoutDegreesOfFreedom() {
    final double[] errors = new double[8];
    Arrays.fill(errors, 1d);
    assertEquals(Double.POSITIVE_INFINITY,
        GoodnessOfFit.reducedChiSquare(DATA, MODEL, errors, 3, all(8)));
  }

  @Test
  void aicc() {
    assertEquals(-4.635532333438686, GoodnessOfFit.aicc(DATA, MODEL, 1, all(8)), 1e-9);
    // an additional component only pays off with a lower residual
    assertTrue(GoodnessOfFit.aicc(DATA, MODEL, 1, all(8)) < GoodnessOfFit.aicc(DATA, MODEL, 2,
        all(8)));
    assertEquals(Double.POSITIVE_INFINITY, GoodnessOfFit.aicc(DATA, MODEL, 3, all(8)));
  }

  @Test
  void fTestPvalue() {
    assertTrue(Double.isNaN(GoodnessOfFit.fTestPvalue(20d, 10d, 0)));
    assertEquals(0d, GoodnessOfFit.fTestPvalue(10d, 10d, 20));
    assertEquals(0d, GoodnessOfFit.fTestPvalue(5d, 10d, 20));
    assertEquals(1d, GoodnessOfFit.fTestPvalue(1d, 0d, 5));
    assertEquals(0d, GoodnessOfFit.fTestPvalue(0d, 0d, 5));

    final double strong = GoodnessOfFit.fTestPvalue(1000d, 100d, 100);
    final double weak = GoodnessOfFit.fTestPvalue(101d, 100d, 100);
    assertTrue(strong > 0.999, "strong " + strong);
    assertTrue(weak < 0.3, "weak " + weak);
    assertTrue(GoodnessOfFit.fTestPvalue(130d, 100d, 100) > weak);
  }

  @Test
  void isClose() {
    assertTrue(GoodnessOfFit.isClose(-50d, -50.05, 0.1));
    assertTrue(GoodnessOfFit.isClose(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0.1));
    assertFalse(GoodnessOfFit.isClose(-50d, -50.5, 0.1));
  }
}
