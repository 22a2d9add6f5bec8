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

package io.github.gaussdecomp.modules.dataprocessing.decomp_agd.fit;

import org.jetbrains.annotations.Nullable;

/**
 * Parameter limits of a multi-Gaussian fit. Amplitudes and FWHMs are always bounded at 0 from
 * below; null upper limits mean unbounded. Means are never bounded.
 */
public record FitBounds(@Nullable Double maxAmplitude, @Nullable Double maxFwhm) {

  public static final FitBounds UNBOUNDED = new FitBounds(null, null);

  public FitBounds withoutFwhmLimit() {
    return maxFwhm == null ? this : new FitBounds(maxAmplitude, null);
  }

  ParameterTransform[] transforms(int componentCount) {
    final ParameterTransform amplitude = ParameterTransform.of(0d,
        maxAmplitude == null ? Double.POSITIVE_INFINITY : maxAmplitude);
    final ParameterTransform fwhm = ParameterTransform.of(0d,
        maxFwhm == null ? Double.POSITIVE_INFINITY : maxFwhm);
    final ParameterTransform[] transforms = new ParameterTransform[3 * componentCount];
    for (int i = 0; i < componentCount; i++) {
      transforms[i] = amplitude;
      transforms[componentCount + i] = fwhm;
      transforms[2 * componentCount + i] = ParameterTransform.UNBOUNDED;
    }
    return transforms;
  }
}
