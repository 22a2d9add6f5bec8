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

import io.github.gaussdecomp.datamodel.GaussianParameters;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.jetbrains.annotations.NotNull;

/**
 * Bounded Levenberg-Marquardt refinement of multi-Gaussian parameters. Bounds are enforced by
 * solving for unbounded internal parameters (see {@link ParameterTransform}); 1-sigma errors are
 * derived from the covariance at the solution, scaled by the reduced chi-square.
 */
public class GaussianLeastSquaresFitter {

  private static final Logger logger = Logger.getLogger(
      GaussianLeastSquaresFitter.class.getName());

  public static final double DEFAULT_TOLERANCE = 1.5e-8;
  private static final double SINGULARITY_THRESHOLD = 1e-14;

  private final double tolerance;

  public GaussianLeastSquaresFitter() {
    this(DEFAULT_TOLERANCE);
  }

  public GaussianLeastSquaresFitter(double tolerance) {
    this.tolerance = tolerance;
  }

  /**
   * @param start     start parameters, clipped into the bounds
   * @param bounds    parameter limits
   * @param residuals residual function to minimize
   * @return the fit result, never throws on non-convergence
   */
  public @NotNull FitAttempt fit(@NotNull GaussianParameters start, @NotNull FitBounds bounds,
      @NotNull ResidualFunction residuals) {
    if (start.isEmpty()) {
      return FitAttempt.failure(start, "No components to fit");
    }
    final int nParams = 3 * start.componentCount();
    final int m = residuals.size();
    if (m < nParams) {
      return FitAttempt.failure(start,
          "%d parameters but only %d residuals".formatted(nParams, m));
    }
    final ParameterTransform[] transforms = bounds.transforms(start.componentCount());

    final double[] external = start.toVector();
    final double[] internalStart = new double[nParams];
    for (int i = 0; i < nParams; i++) {
      internalStart[i] = transforms[i].toInternal(external[i]);
    }

    final MultivariateJacobianFunction model = point -> {
      final double[] internal = point.toArray();
      final double[] p = toExternal(internal, transforms);
      final double[] r = new double[m];
      final double[][] jacobian = new double[m][nParams];
      residuals.evaluate(p, r, jacobian);
      for (int j = 0; j < nParams; j++) {
        final double g = transforms[j].derivative(internal[j]);
        for (int i = 0; i < m; i++) {
          jacobian[i][j] *= g;
        }
      }
      return new Pair<>(new ArrayRealVector(r, false), new Array2DRowRealMatrix(jacobian, false));
    };

    final int maxEvaluations = 2000 * (nParams + 1);
    // target zero: the optimizer minimizes the squared norm of the residual vector itself
    final LeastSquaresProblem problem = new LeastSquaresBuilder().start(internalStart)
        .model(model).target(new double[m]).lazyEvaluation(false)
        .maxEvaluations(maxEvaluations).maxIterations(maxEvaluations).build();
    final LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
        .withCostRelativeTolerance(tolerance).withParameterRelativeTolerance(tolerance);

    final Optimum optimum;
    try {
      optimum = optimizer.optimize(problem);
    } catch (MathIllegalStateException | MathArithmeticException e) {
      logger.log(Level.FINEST, "Least-squares fit did not converge: " + e.getMessage());
      return FitAttempt.failure(start, e.getMessage() == null ? e.toString() : e.getMessage());
    }

    final double[] internal = optimum.getPoint().toArray();
    final double[] solution = toExternal(internal, transforms);
    if (Arrays.stream(solution).anyMatch(v -> !Double.isFinite(v))) {
      return FitAttempt.failure(start, "Fit diverged to non-finite parameters");
    }
    final double cost = optimum.getCost();
    final double chiSquare = cost * cost;
    final double[] errors = errors(optimum, internal, transforms, chiSquare, m);
    return FitAttempt.success(GaussianParameters.fromVector(solution),
        GaussianParameters.fromVector(errors), optimum.getEvaluations(), chiSquare);
  }

  private static double[] errors(Optimum optimum, double[] internal,
      ParameterTransform[] transforms, double chiSquare, int nResiduals) {
    final int nParams = internal.length;
    final double[] errors = new double[nParams];
    final int dof = nResiduals - nParams;
    if (dof <= 0) {
      Arrays.fill(errors, Double.NaN);
      return errors;
    }
    final RealMatrix covariance;
    try {
      covariance = optimum.getCovariances(SINGULARITY_THRESHOLD);
    } catch (SingularMatrixException e) {
      Arrays.fill(errors, Double.NaN);
      return errors;
    }
    final double reducedChiSquare = chiSquare / dof;
    for (int i = 0; i < nParams; i++) {
      final double variance = covariance.getEntry(i, i) * reducedChiSquare;
      errors[i] = variance < 0 ? Double.NaN
          : Math.sqrt(variance) * Math.abs(transforms[i].derivative(internal[i]));
    }
    return errors;
  }

  private static double[] toExternal(double[] internal, ParameterTransform[] transforms) {
    final double[] external = new double[internal.length];
    for (int i = 0; i < internal.length; i++) {
      external[i] = transforms[i].toExternal(internal[i]);
    }
    return external;
  }
}
