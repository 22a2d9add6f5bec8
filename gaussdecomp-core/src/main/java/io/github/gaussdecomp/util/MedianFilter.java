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

package io.github.gaussdecomp.util;

import java.util.Arrays;

/**
 * Running median with mirrored boundaries ({@code d c b a | a b c d | d c b a}). For even window
 * sizes the upper of the two middle values is taken.
 */
public final class MedianFilter {

  private MedianFilter() {
  }

  public static double[] apply(double[] data, int size) {
    if (size <= 1 || data.length == 0) {
      return data.clone();
    }
    final int n = data.length;
    final int half = size / 2;
    final double[] window = new double[size];
    final double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      for (int k = 0; k < size; k++) {
        window[k] = data[reflect(i + k - half, n)];
      }
      Arrays.sort(window);
      out[i] = window[half];
    }
    return out;
  }

  static int reflect(int index, int n) {
    final int period = 2 * n;
    int i = Math.floorMod(index, period);
    return i < n ? i : period - 1 - i;
  }
}
