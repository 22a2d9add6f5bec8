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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.Range;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpectrumTest {

  private final Spectrum spectrum = Spectrum.withConstantError(3, new double[]{-10, -9.5, -9, -8.5},
      new double[]{0.1, 1, 2, 0.5}, 0.2);

  @Test
  void channelConversion() {
    assertEquals(0.5, spectrum.channelSpacing());
    assertEquals(2, spectrum.velocityToChannel(-9));
    assertEquals(-9.25, spectrum.channelToVelocity(1.5), 1e-12);
    assertEquals(-10.5, spectrum.channelToVelocity(-1), 1e-12);
  }

  @Test
  void noiseAndMaximum() {
    assertEquals(0.2, spectrum.rms());
    assertEquals(2, spectrum.maxIntensity());
    assertFalse(spectrum.containsNaN());
  }

  @Test
  void inputArraysAreCopied() {
    final double[] y = {1, 2};
    final Spectrum s = Spectrum.withConstantError(0, new double[]{0, 1}, y, 1);
    y[0] = Double.NaN;
    assertFalse(s.containsNaN());
  }

  @Test
  void validation() {
    assertThrows(IllegalArgumentException.class,
        () -> Spectrum.of(0, new double[]{0, 1}, new double[]{0, 1, 2}, new double[]{1, 1}));
    assertThrows(IllegalArgumentException.class,
        () -> Spectrum.of(0, new double[]{0}, new double[]{0}, new double[]{1}));
  }

  @Test
  void rangesAreKept() {
    final Spectrum ranged = spectrum.withRanges(List.of(Range.closedOpen(1, 3)), List.of());
    assertEquals(List.of(Range.closedOpen(1, 3)), ranged.signalRanges());
    assertEquals(3, ranged.index());
  }
}
