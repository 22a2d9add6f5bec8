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

/**
 * Maps a bounded parameter to an unbounded internal value for the solver (MINUIT style). Lower
 * only: {@code p = min - 1 + sqrt(x^2 + 1)}; both: {@code p = min + (sin(x) + 1)(max - min) / 2}.
 */
final class ParameterTransform {

  static final ParameterTransform UNBOUNDED = new ParameterTransform(Double.NEGATIVE_INFINITY,
      Double.POSITIVE_INFINITY);

  private final double min;
  private final double max;

  private ParameterTransform(double min, double max) {
    this.min = min;
    this.max = max;
  }

  static ParameterTransform of(double min, double max) {
    if (Double.isInfinite(min) && Double.isInfinite(max)) {
      return UNBOUNDED;
    }
    // an empty interval keeps only its lower bound
    if (max <= min) {
      return new ParameterTransform(min, Double.POSITIVE_INFINITY);
    }
    return new ParameterTransform(min, max);
  }

  static ParameterTransform lowerBound(double min) {
    return of(min, Double.POSITIVE_INFINITY);
  }

  private boolean hasMin() {
    return !Double.isInfinite(min);
  }

  private boolean hasMax() {
    return !Double.isInfinite(max);
  }

  double clip(double value) {
    return Math.max(min, Math.min(max, value));
  }

  double toInternal(double value) {
    final double v = clip(value);
    if (hasMin() && hasMax()) {
      return Math.asin(Math.max(-1d, Math.min(1d, 2d * (v - min) / (max - min) - 1d)));
    }
    if (hasMin()) {
      final double s = v - min + 1d;
      return Math.sqrt(s * s - 1d);
    }
    if (hasMax()) {
      final double s = max - v + 1d;
      return Math.sqrt(s * s - 1d);
    }
    return v;
  }

  double toExternal(double x) {
    if (hasMin() && hasMax()) {
      return min + (Math.sin(x) + 1d) * (max - min) / 2d;
    }
    if (hasMin()) {
      return min - 1d + Math.sqrt(x * x + 1d);
    }
    if (hasMax()) {
      return max + 1d - Math.sqrt(x * x + 1d);
    }
    return x;
  }

  /**
   * d external / d internal at the internal value x.
   */
  double derivative(double x) {
    if (hasMin() && hasMax()) {
      return Math.cos(x) * (max - min) / 2d;
    }
    if (hasMin()) {
      return x / Math.sqrt(x * x + 1d);
    }
    if (hasMax()) {
      return -x / Math.sqrt(x * x + 1d);
    }
    return 1d;
  }
}
