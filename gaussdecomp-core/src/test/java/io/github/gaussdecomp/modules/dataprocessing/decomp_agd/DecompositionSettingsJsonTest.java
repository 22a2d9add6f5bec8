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
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

class DecompositionSettingsJsonTest {

  @Test
  void writtenSettingsReadBack() {
    final DecompositionSettings settings = DecompositionSettings.builder().alpha1(2.58)
        .alpha2(5.14).twoPhase(true).useNcpus(3).improveFitting(
            ImproveFitSettings.builder().maxNcomps(6).minFwhm(2d).build()).build();
    final String text = DecompositionSettingsJson.toJson(settings).toString(2);
    assertEquals(settings, DecompositionSettingsJson.fromJson(text));
  }

  @Test
  void improvementOffIsWrittenAsFalse() {
    final DecompositionSettings settings = DecompositionSettings.builder().alpha1(2d).build();
    final JSONObject json = DecompositionSettingsJson.toJson(settings);
    assertFalse(json.getBoolean(DecompositionSettingsJson.IMPROVE_FITTING));
    assertTrue(json.isNull("alpha2"));
    assertEquals("one", json.getString("phase"));
    assertNull(DecompositionSettingsJson.fromJson(json.toString()).improveFitting());
  }

  @Test
  void partialSettingsUseDefaults() {
    final DecompositionSettings s = DecompositionSettingsJson.fromJson(
        "{\"alpha1\": 3, \"improve_fitting\": {\"snr\": 4}}");
    assertEquals(3d, s.alpha1());
    assertEquals(2d, s.improveFitting().snrFit());
  }

  @Test
  void invalidJson() {
    assertThrows(IllegalArgumentException.class,
        () -> DecompositionSettingsJson.fromJson("{\"alpha1\": 3, \"alpha7\": 1}"));
    assertThrows(IllegalArgumentException.class,
        () -> DecompositionSettingsJson.fromJson("not json"));
  }
}
