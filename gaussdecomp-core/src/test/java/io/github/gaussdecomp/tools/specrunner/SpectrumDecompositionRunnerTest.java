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

package io.github.gaussdecomp.tools.specrunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.BatchDecompositionResult;
import io.github.gaussdecomp.testutils.SyntheticSpectra;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpectrumDecompositionRunnerTest {

  private static final List<String> NAMES = List.of("first", "second");

  private static BatchDecompositionResult result() {
    final GaussianParameters guess = SyntheticSpectra.single(4d, 9d, 20d);
    final GaussianParameters fit = SyntheticSpectra.single(5d, 10d, 21d);
    final GaussianParameters errors = SyntheticSpectra.single(0.1, 0.2, 0.05);
    return BatchDecompositionResult.of(List.of(
        DecompositionResult.decomposed(0, new FitOutcome.Fitted(guess, fit, errors)),
        DecompositionResult.failed(1, "NaN values in spectrum")));
  }

  @Test
  void summaryHasOneLinePerSpectrum() {
    final String[] lines = SpectrumDecompositionRunner.summary(NAMES, result()).split("\n");
    assertEquals(3, lines.length);
    assertTrue(lines[0].startsWith("spectrum\tindex\tn_initial\tn_components"));
    assertTrue(lines[1].startsWith("first\t0\t1\t1\t"), lines[1]);
    assertTrue(lines[1].endsWith("\tok"), lines[1]);
    assertTrue(lines[2].startsWith("second\t1\t\t\t"), lines[2]);
    assertTrue(lines[2].endsWith("\tfailed: NaN values in spectrum"), lines[2]);
  }

  @Test
  void componentsOfFittedSpectra() {
    final String[] lines = SpectrumDecompositionRunner.components(NAMES, result()).split("\n");
    assertEquals(2, lines.length);
    assertEquals("first\t0\t0\t5.00000\t10.0000\t21.0000\t0.100000\t0.200000\t0.0500000",
        lines[1]);
  }
}
