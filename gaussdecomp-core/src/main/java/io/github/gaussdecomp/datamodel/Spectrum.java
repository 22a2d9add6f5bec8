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

import com.google.common.collect.Range;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A single spectrum on a uniformly spaced velocity axis. Arrays are copied on construction, so a
 * spectrum can be handed to a worker thread without sharing mutable state with the caller.
 *
 * @param index            stable position of the spectrum within its batch
 * @param velocity         strictly monotonic, uniformly spaced channel velocities
 * @param intensity        measured intensities, one per channel
 * @param errors           per-channel 1-sigma noise, one per channel
 * @param signalRanges     half-open channel intervals where signal is expected, empty means the
 *                         whole spectrum
 * @param noiseSpikeRanges half-open channel intervals that contain artifacts
 */
public record Spectrum(int index, double[] velocity, double[] intensity, double[] errors,
                       @NotNull List<Range<Integer>> signalRanges,
                       @NotNull List<Range<Integer>> noiseSpikeRanges) {

  public Spectrum {
    Objects.requireNonNull(velocity, "velocity");
    Objects.requireNonNull(intensity, "intensity");
    Objects.requireNonNull(errors, "errors");
    if (velocity.length != intensity.length || velocity.length != errors.length) {
      throw new IllegalArgumentException(
          "velocity, intensity and errors must have equal length but were %d, %d, %d".formatted(
              velocity.length, intensity.length, errors.length));
    }
    if (velocity.length < 2) {
      throw new IllegalArgumentException("A spectrum needs at least two channels");
    }
    velocity = velocity.clone();
    intensity = intensity.clone();
    errors = errors.clone();
    signalRanges = List.copyOf(Objects.requireNonNullElse(signalRanges, List.of()));
    noiseSpikeRanges = List.copyOf(Objects.requireNonNullElse(noiseSpikeRanges, List.of()));
  }

  public static Spectrum of(int index, double[] velocity, double[] intensity, double[] errors) {
    return new Spectrum(index, velocity, intensity, errors, List.of(), List.of());
  }

  /**
   * Spectrum with the same noise level in every channel.
   */
  public static Spectrum withConstantError(int index, double[] velocity, double[] intensity,
      double rms) {
    final double[] errors = new double[intensity.length];
    Arrays.fill(errors, rms);
    return of(index, velocity, intensity, errors);
  }

  public Spectrum withRanges(@NotNull List<Range<Integer>> signalRanges,
      @NotNull List<Range<Integer>> noiseSpikeRanges) {
    return new Spectrum(index, velocity, intensity, errors, signalRanges, noiseSpikeRanges);
  }

  public int size() {
    return intensity.length;
  }

  /**
   * @return absolute channel width in velocity units
   */
  public double channelSpacing() {
    return Math.abs(velocity[1] - velocity[0]);
  }

  /**
   * Noise level used for thresholds, taken from the first channel.
   */
  public double rms() {
    return errors[0];
  }

  /**
   * Fractional channel position of a velocity.
   */
  public double velocityToChannel(double v) {
    return (v - velocity[0]) / (velocity[1] - velocity[0]);
  }

  /**
   * Velocity at a fractional channel position, linearly interpolated between neighbouring channels
   * and extrapolated with the first channel width outside the axis.
   */
  public double channelToVelocity(double channel) {
    final int lower = (int) Math.floor(channel);
    if (lower < 0 || lower >= velocity.length - 1) {
      return velocity[0] + channel * (velocity[1] - velocity[0]);
    }
    final double t = channel - lower;
    return velocity[lower] + t * (velocity[lower + 1] - velocity[lower]);
  }

  public boolean containsNaN() {
    for (double v : intensity) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }

  public double maxIntensity() {
    return Arrays.stream(intensity).max().orElse(0d);
  }
}
