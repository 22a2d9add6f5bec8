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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ImproveFitSettingsTest {

  @Test
  void defaults() {
    final ImproveFitSettings s = ImproveFitSettings.defaults();
    assertEquals(3d, s.snr());
    assertEquals(1.5, s.snrFit());
    assertEquals(3d, s.snrNegative());
    assertEquals(5d, s.significance());
    assertEquals(1.5, s.rchi2Limit());
    assertEquals(0.01, s.minPvalue());
    assertNull(s.maxFwhm());
    assertNull(s.maxNcomps());
    assertTrue(s.refitNegResPeak() && s.refitBroad() && s.refitBlended());
    assertFalse(s.discardUnresolvedFits());
  }

  @Test
  void derivedThresholdsFollowSnr() {
    final ImproveFitSettings s = ImproveFitSettings.builder().set("snr", "4").build();
    assertEquals(2d, s.snrFit());
    assertEquals(4d, s.snrNegative());
    final ImproveFitSettings explicit = ImproveFitSettings.builder().set("snr", "4")
        .set("snr_fit", "3").set("snr_negative", "None").build();
    assertEquals(3d, explicit.snrFit());
    assertEquals(4d, explicit.snrNegative());
  }

  @Test
  void setByKey() {
    final ImproveFitSettings s = ImproveFitSettings.builder().set("max_ncomps", "4")
        .set("min_fwhm", "2").set("max_fwhm", "30").set("refit_blended", "false")
        .set("discard_unresolved_fits", "true").build();
    assertEquals(4, s.maxNcomps().intValue());
    assertEquals(2d, s.minFwhm());
    assertEquals(30d, s.maxFwhm().doubleValue());
    assertFalse(s.refitBlended());
    assertTrue(s.discardUnresolvedFits());
    assertNull(s.toBuilder().set("max_ncomps", "none").build().maxNcomps());
  }

  @Test
  void invalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> ImproveFitSettings.builder().set("refit", "true"));
    assertThrows(IllegalArgumentException.class,
        () -> ImproveFitSettings.builder().set("min_fwhm", "10").set("max_fwhm", "5").build());
    assertThrows(IllegalArgumentException.class,
        () -> ImproveFitSettings.builder().set("max_ncomps", "0").build());
    assertThrows(IllegalArgumentException.class,
        () -> ImproveFitSettings.builder().set("snr", "-1").build());
  }
}
