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

import io.github.gaussdecomp.datamodel.GaussianComponent;
import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.util.DecompositionTrace;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Proposes Gaussian components from the zero crossings of the regularized third derivative. A
 * crossing becomes a candidate if the intensity is above {@code snrThreshold * noise}, the fourth
 * derivative is positive and the second derivative is below its noise threshold.
 */
public class InitialGuessEstimator {

  /**
   * Ratio between the spread of the lower half of |u2| and the noise of u2.
   */
  private static final double U2_NOISE_SCALE = 0.377;

  private final double snrThreshold;
  private final double snr2Threshold;
  private final DecompositionTrace trace;

  public InitialGuessEstimator(double snrThreshold, double snr2Threshold) {
    this(snrThreshold, snr2Threshold, DecompositionTrace.NO_OP);
  }

  public InitialGuessEstimator(double snrThreshold, double snr2Threshold,
      @NotNull DecompositionTrace trace) {
    this.snrThreshold = snrThreshold;
    this.snr2Threshold = snr2Threshold;
    this.trace = trace;
  }

  /**
   * @param velocity channel velocities, uniformly spaced
   * @param data     intensities
   * @param noise    noise level, null or 0 to estimate it from the negative tail of the data
   * @param alpha    regularization scale in channels
   * @return the candidates, or null if the data contains NaN values
   */
  public @Nullable InitialGuess estimate(double @NotNull [] velocity, double @NotNull [] data,
      @Nullable Double noise, double alpha) {
    if (Arrays.stream(data).anyMatch(Double::isNaN)) {
      trace.trace(() -> "NaN values in data, no initial guess possible");
      return null;
    }
    final int n = data.length;
    final double dv = Math.abs(velocity[1] - velocity[0]);
    final AgdDerivatives derivatives = AgdDerivatives.compute(data, dv, alpha);
    final double[] u2 = derivatives.u2();
    final double[] u3 = derivatives.u3();
    final double[] u4 = derivatives.u4();

    final double rms = noise == null || noise == 0d ? estimateNoise(data) : noise;
    final double threshold = snrThreshold * rms;
    final double threshold2 = snr2Threshold > 0 ? -secondDerivativeNoise(u2) * snr2Threshold : 0d;
    trace.trace(() -> "alpha=%s noise=%s threshold=%s threshold2=%s".formatted(alpha, rms,
        threshold, threshold2));

    final List<Integer> indices = new ArrayList<>();
    for (int j = 0; j < n - 1; j++) {
      final boolean signChange = Math.signum(u3[j + 1]) != Math.signum(u3[j]);
      if (signChange && data[j + 1] > threshold && u4[j + 1] > 0d && u2[j + 1] < threshold2) {
        indices.add(j);
      }
    }
    trace.trace(() -> "Components found for alpha=%s: %d".formatted(alpha, indices.size()));
    if (indices.isEmpty()) {
      return new InitialGuess(GaussianParameters.EMPTY, u2, rms, threshold, threshold2);
    }

    final int k = indices.size();
    final double[] means = new double[k];
    final double[] fwhms = new double[k];
    final double[] amps = new double[k];
    for (int c = 0; c < k; c++) {
      final int j = indices.get(c);
      means[c] = velocity[j] + 0.5 * (velocity[j + 1] - velocity[j]);
      fwhms[c] = Math.sqrt(Math.abs(data[j] / u2[j])) * GaussianComponent.SIGMA_TO_FWHM;
      amps[c] = data[j];
    }
    return new InitialGuess(GaussianParameters.of(deblend(amps, fwhms, means), fwhms, means), u2,
        rms, threshold, threshold2);
  }

  /**
   * Corrects amplitudes of overlapping candidates by solving the least-squares system of their
   * mutual Gaussian overlaps. The correction is kept only if every corrected amplitude is
   * positive, otherwise the raw amplitudes are returned.
   */
  static double[] deblend(double[] amps, double[] fwhms, double[] means) {
    final int k = amps.length;
    final RealMatrix overlap = new Array2DRowRealMatrix(k, k);
    for (int i = 0; i < k; i++) {
      for (int j = 0; j < k; j++) {
        final double sigma = fwhms[j] / GaussianComponent.SIGMA_TO_FWHM;
        final double d = means[i] - means[j];
        overlap.setEntry(i, j, Math.exp(-d * d / 2d / (sigma * sigma)));
      }
    }
    final DecompositionSolver solver = new SingularValueDecomposition(overlap).getSolver();
    final RealVector corrected = solver.solve(new ArrayRealVector(amps, false));
    for (int i = 0; i < k; i++) {
      if (!(corrected.getEntry(i) > 0d)) {
        return amps.clone();
      }
    }
    return corrected.toArray();
  }

  /**
   * Population standard deviation of all samples below the absolute minimum of the data.
   */
  public static double estimateNoise(double @NotNull [] data) {
    final double limit = Math.abs(Arrays.stream(data).min().orElse(0d));
    final double[] tail = Arrays.stream(data).filter(v -> v < limit).toArray();
    return new StandardDeviation(false).evaluate(tail);
  }

  private static double secondDerivativeNoise(double[] u2) {
    final double[] lowerHalf = IntStream.range(0, u2.length).boxed()
        .sorted(Comparator.comparingDouble(i -> Math.abs(u2[i]))).limit((long) (0.5 * u2.length))
        .mapToDouble(i -> u2[i]).toArray();
    return new StandardDeviation(false).evaluate(lowerHalf) / U2_NOISE_SCALE;
  }
}
