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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImproveFitSettings;
import org.junit.jupiter.api.Test;

class DecompositionSettingsTest {

  @Test
  void defaults() {
    final DecompositionSettings s = DecompositionSettings.builder().alpha1(2.58).build();
    assertEquals(DecompositionSettings.Phase.ONE, s.phase());
    assertEquals(5d, s.snrThresh());
    assertEquals(5d, s.snr2Thresh());
    assertTrue(s.performFinalFit());
    assertFalse(s.improvesFit());
    assertTrue(s.useNcpus() >= 1);
  }

  @Test
  void alpha1IsRequired() {
    assertThrows(IllegalArgumentException.class, () -> DecompositionSettings.builder().build());
  }

  @Test
  void twoPhaseRequiresAlpha2() {
    final DecompositionSettings.Builder builder = DecompositionSettings.builder().alpha1(2.58)
        .set("phase", "two");
    assertThrows(IllegalArgumentException.class, builder::build);
    final DecompositionSettings s = builder.set("alpha2", "5.14").build();
    assertEquals(DecompositionSettings.Phase.TWO, s.phase());
    assertEquals(5.14, s.alpha2().doubleValue());
  }

  @Test
  void setByKey() {
    final DecompositionSettings s = DecompositionSettings.builder().set("alpha1", "1.5")
        .set("SNR_thresh", "3").set("SNR2_thresh", "4").set("use_ncpus", "2")
        .set("perform_final_fit", "false").set("verbose", "true").set("plot", "1").build();
    assertEquals(1.5, s.alpha1());
    assertEquals(3d, s.snrThresh());
    assertEquals(4d, s.snr2Thresh());
    assertEquals(2, s.useNcpus());
    assertFalse(s.performFinalFit());
    assertTrue(s.verbose());
    assertTrue(s.plot());
  }

  @Test
  void unknownKeyIsRejected() {
    final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> DecompositionSettings.builder().set("alpha3", "1"));
    assertTrue(e.getMessage().contains("alpha3"));
    assertThrows(IllegalArgumentException.class,
        () -> DecompositionSettings.builder().set("phase", "three"));
  }

  @Test
  void improveFittingSwitch() {
    final DecompositionSettings on = DecompositionSettings.builder().alpha1(2d)
        .set("improve_fitting", "true").build();
    assertEquals(ImproveFitSettings.defaults(), on.improveFitting());
    final DecompositionSettings off = on.toBuilder().set("improve_fitting", "false").build();
    assertNull(off.improveFitting());
  }
}
