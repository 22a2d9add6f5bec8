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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable parameter vector of a multi-Gaussian model. Stored as three parallel sequences
 * (amplitudes, FWHMs, means) sharing one index; the flat vector layout is
 * {@code [amps..., fwhms..., means...]}.
 */
public final class GaussianParameters {

  public static final GaussianParameters EMPTY = new GaussianParameters(new double[0],
      new double[0], new double[0]);

  private final double[] amplitudes;
  private final double[] fwhms;
  private final double[] means;

  private GaussianParameters(double[] amplitudes, double[] fwhms, double[] means) {
    this.amplitudes = amplitudes;
    this.fwhms = fwhms;
    this.means = means;
  }

  public static GaussianParameters of(double @NotNull [] amplitudes, double @NotNull [] fwhms,
      double @NotNull [] means) {
    if (amplitudes.length != fwhms.length || amplitudes.length != means.length) {
      throw new IllegalArgumentException(
          "amplitudes, fwhms and means must have equal length but were %d, %d, %d".formatted(
              amplitudes.length, fwhms.length, means.length));
    }
    if (amplitudes.length == 0) {
      return EMPTY;
    }
    return new GaussianParameters(amplitudes.clone(), fwhms.clone(), means.clone());
  }

  /**
   * @param vector flat vector {@code [amps..., fwhms..., means...]}
   */
  public static GaussianParameters fromVector(double @NotNull [] vector) {
    if (vector.length % 3 != 0) {
      throw new IllegalArgumentException(
          "Parameter vector length must be a multiple of 3 but was " + vector.length);
    }
    final int n = vector.length / 3;
    return of(Arrays.copyOfRange(vector, 0, n), Arrays.copyOfRange(vector, n, 2 * n),
        Arrays.copyOfRange(vector, 2 * n, 3 * n));
  }

  public static GaussianParameters ofComponents(@NotNull List<GaussianComponent> components) {
    final int n = components.size();
    final double[] a = new double[n];
    final double[] f = new double[n];
    final double[] m = new double[n];
    for (int i = 0; i < n; i++) {
      final GaussianComponent c = components.get(i);
      a[i] = c.amplitude();
      f[i] = c.fwhm();
      m[i] = c.mean();
    }
    return of(a, f, m);
  }

  public int componentCount() {
    return amplitudes.length;
  }

  public boolean isEmpty() {
    return amplitudes.length == 0;
  }

  public double amplitude(int i) {
    return amplitudes[i];
  }

  public double fwhm(int i) {
    return fwhms[i];
  }

  public double mean(int i) {
    return means[i];
  }

  public double[] amplitudes() {
    return amplitudes.clone();
  }

  public double[] fwhms() {
    return fwhms.clone();
  }

  public double[] means() {
    return means.clone();
  }

  public GaussianComponent component(int i) {
    return new GaussianComponent(amplitudes[i], fwhms[i], means[i]);
  }

  public List<GaussianComponent> components() {
    final List<GaussianComponent> list = new ArrayList<>(amplitudes.length);
    for (int i = 0; i < amplitudes.length; i++) {
      list.add(component(i));
    }
    return list;
  }

  public double[] toVector() {
    final int n = amplitudes.length;
    final double[] vector = new double[3 * n];
    System.arraycopy(amplitudes, 0, vector, 0, n);
    System.arraycopy(fwhms, 0, vector, n, n);
    System.arraycopy(means, 0, vector, 2 * n, n);
    return vector;
  }

  /**
   * @return a copy without the component at the given index
   */
  public GaussianParameters without(int index) {
    final List<GaussianComponent> list = components();
    list.remove(index);
    return ofComponents(list);
  }

  /**
   * @return a copy without all components at the given indices
   */
  public GaussianParameters without(@NotNull List<Integer> indices) {
    final List<GaussianComponent> list = new ArrayList<>();
    for (int i = 0; i < amplitudes.length; i++) {
      if (!indices.contains(i)) {
        list.add(component(i));
      }
    }
    return ofComponents(list);
  }

  /**
   * Concatenates each sub-vector of this and other, keeping the flat layout.
   */
  public GaussianParameters concat(@NotNull GaussianParameters other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    final List<GaussianComponent> list = components();
    list.addAll(other.components());
    return ofComponents(list);
  }

  /**
   * Stable sort by descending amplitude, ties keep their relative order.
   */
  public GaussianParameters sortedByAmplitudeDescending() {
    final List<GaussianComponent> list = components();
    list.sort(Comparator.comparingDouble(GaussianComponent::amplitude).reversed());
    return ofComponents(list);
  }

  /**
   * Indices sorted by ascending amplitude (stable).
   */
  public int[] indicesByAmplitudeAscending() {
    return IntStream.range(0, amplitudes.length).boxed()
        .sorted(Comparator.comparingDouble(i -> amplitudes[i])).mapToInt(Integer::intValue)
        .toArray();
  }

  /**
   * Sum of all components evaluated at each x.
   */
  public double[] evaluate(double @NotNull [] x) {
    final double[] model = new double[x.length];
    for (int c = 0; c < amplitudes.length; c++) {
      for (int i = 0; i < x.length; i++) {
        model[i] += GaussianComponent.value(amplitudes[c], fwhms[c], means[c], x[i]);
      }
    }
    return model;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GaussianParameters that)) {
      return false;
    }
    return Arrays.equals(amplitudes, that.amplitudes) && Arrays.equals(fwhms, that.fwhms)
        && Arrays.equals(means, that.means);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(amplitudes);
    result = 31 * result + Arrays.hashCode(fwhms);
    result = 31 * result + Arrays.hashCode(means);
    return result;
  }

  @Override
  public String toString() {
    return "GaussianParameters{amplitudes=" + Arrays.toString(amplitudes) + ", fwhms="
        + Arrays.toString(fwhms) + ", means=" + Arrays.toString(means) + '}';
  }
}
