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

package io.github.gaussdecomp.modules.dataprocessing.decomp_batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.DecompositionSettings;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.SpectrumDecomposer;
import io.github.gaussdecomp.taskcontrol.TaskStatus;
import io.github.gaussdecomp.testutils.SyntheticSpectra;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BatchDecompositionTaskTest {

  private static List<Spectrum> noiseSpectra(int count) {
    final List<Spectrum> spectra = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      spectra.add(SyntheticSpectra.spectrum(i, 32, 0.1, i, GaussianParameters.EMPTY));
    }
    return spectra;
  }

  private static DecompositionResult nothing(Spectrum spectrum) {
    return DecompositionResult.decomposed(spectrum.index(),
        new FitOutcome.NoComponents(GaussianParameters.EMPTY));
  }

  @Test
  void resultsKeepInputOrder() {
    // the first spectra take longest
    final SpectrumDecomposer slowFirst = spectrum -> {
      try {
        Thread.sleep(5L * (8 - spectrum.index()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return nothing(spectrum);
    };
    final BatchDecompositionTask task = new BatchDecompositionTask(noiseSpectra(8), slowFirst, 4);
    task.run();

    assertEquals(TaskStatus.FINISHED, task.getStatus());
    assertEquals(1d, task.getFinishedPercentage());
    final BatchDecompositionResult result = task.getResult();
    assertNotNull(result);
    assertEquals(8, result.size());
    for (int i = 0; i < 8; i++) {
      assertEquals(i, result.row(i).indexFit());
      assertEquals(0, result.row(i).nComponents().intValue());
    }
    assertTrue(result.failures().isEmpty());
    assertEquals(0, result.totalComponents());
  }

  @Test
  void failureIsRecordedAtItsIndex() {
    final SpectrumDecomposer failsOnThree = spectrum -> {
      if (spectrum.index() == 3) {
        throw new IllegalStateException("boom");
      }
      return nothing(spectrum);
    };
    final BatchDecompositionTask task = new BatchDecompositionTask(noiseSpectra(6), failsOnThree,
        3);
    task.run();

    assertEquals(TaskStatus.FINISHED, task.getStatus());
    final BatchDecompositionResult result = task.getResult();
    assertNotNull(result);
    assertEquals(1, result.failures().size());
    assertEquals(3, result.failures().get(0).index());
    assertEquals("IllegalStateException: boom", result.failures().get(0).reason());
    assertTrue(result.row(3).isFailed());
    assertEquals(3, result.row(3).indexFit());
    assertFalse(result.row(2).isFailed());
    assertNull(result.get(BatchField.N_COMPONENTS).get(3));
    assertEquals(0, result.get("N_components").get(4));
  }

  @Test
  void nanSpectrumFailsWithoutStoppingTheBatch() {
    final Spectrum clean = SyntheticSpectra.spectrum(0, 256, 0.05, 1L,
        SyntheticSpectra.single(5d, 10d, 128d));
    final double[] intensity = clean.intensity().clone();
    intensity[40] = Double.NaN;
    final Spectrum broken = Spectrum.of(1, clean.velocity(), intensity, clean.errors());
    final DecompositionSettings settings = DecompositionSettings.builder().alpha1(2.5)
        .useNcpus(2).build();

    final BatchDecompositionTask task = new BatchDecompositionTask(List.of(clean, broken),
        settings);
    task.run();

    final BatchDecompositionResult result = task.getResult();
    assertNotNull(result);
    assertEquals(1, result.row(0).nComponents().intValue());
    assertNull(result.row(1).nComponents());
    assertNull(result.row(1).amplitudesFit());
    assertEquals(1, result.failures().size());
    assertEquals(1, result.totalComponents());

    // charts are drawn from the kept outcomes without decomposing again
    assertEquals(2, result.results().size());
    final FitOutcome outcome = result.outcome(0);
    assertNotNull(outcome);
    assertEquals(1, outcome.componentCount());
    assertNotNull(outcome.bestFit());
    assertEquals(128d, outcome.bestFit().mean(0), 1d);
    assertNull(result.outcome(1));
    assertTrue(result.results().get(1) instanceof DecompositionResult.Failed);
  }

  @Test
  void resultAsMap() {
    final BatchDecompositionTask task = BatchDecompositionTask.single(noiseSpectra(1).get(0),
        BatchDecompositionTaskTest::nothing);
    task.run();
    final BatchDecompositionResult result = task.getResult();
    assertNotNull(result);

    final Map<String, List<Object>> map = result.asMap();
    assertEquals(19, map.size());
    assertEquals(Arrays.stream(BatchField.values()).map(BatchField::getKey).toList(),
        List.copyOf(map.keySet()));
    assertEquals(List.of(0), map.get("index_fit"));
    assertEquals(List.of(0), map.get("N_components_initial"));
    assertEquals(0, ((double[]) map.get("amplitudes_fit").get(0)).length);
    assertNull(map.get("pvalue").get(0));
  }

  @Test
  void invalidThreadCount() {
    assertThrows(IllegalArgumentException.class,
        () -> new BatchDecompositionTask(noiseSpectra(2), BatchDecompositionTaskTest::nothing, 0));
  }
}
