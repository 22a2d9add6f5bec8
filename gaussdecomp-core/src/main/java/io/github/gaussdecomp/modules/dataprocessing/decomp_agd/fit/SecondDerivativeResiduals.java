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

import java.util.Arrays;

/**
 * Residual of a model against the smoothed second derivative of a spectrum. Inside the fit mask
 * the second difference of the model is compared to {@code u2} on the interior channels; outside
 * the mask the model is compared to the raw data with a weight of 1/10. The result has
 * {@code (n - 2) + n} entries.
 */
public class SecondDerivativeResiduals implements ResidualFunction {

  private static final double OUTSIDE_MASK_WEIGHT = 0.1;

  private final double[] x;
  private final double[] data;
  private final double[] errors;
  private final double[] u2;
  private final boolean[] fitMask;
  private final double dv2;
  private final double[] model;
  private final double[][] modelJacobian;
  private int nParams = -1;

  public SecondDerivativeResiduals(double[] x, double[] data, double[] errors, double[] u2,
      boolean[] fitMask, double dv) {
    final int n = x.length;
    if (data.length != n || errors.length != n || u2.length != n || fitMask.length != n) {
      throw new IllegalArgumentException("All channel arrays must have equal length");
    }
    if (n < 3) {
      throw new IllegalArgumentException("At least three channels are needed");
    }
    this.x = x;
    this.data = data;
    this.errors = errors;
    this.u2 = u2;
    this.fitMask = fitMask;
    this.dv2 = dv * dv;
    this.model = new double[n];
    this.modelJacobian = new double[n][];
  }

  @Override
  public int size() {
    return 2 * x.length - 2;
  }

  @Override
  public void evaluate(double[] parameters, double[] residuals, double[][] jacobian) {
    final int n = x.length;
    if (parameters.length != nParams) {
      nParams = parameters.length;
      for (int i = 0; i < n; i++) {
        modelJacobian[i] = new double[nParams];
      }
    }
    MultiGaussianFunction.evaluate(x, parameters, model, jacobian == null ? null : modelJacobian);

    for (int i = 0; i < n - 2; i++) {
      final int c = i + 1;
      if (!fitMask[c]) {
        residuals[i] = 0d;
        if (jacobian != null) {
          Arrays.fill(jacobian[i], 0d);
        }
        continue;
      }
      final double d2 = (model[i] - 2d * model[c] + model[i + 2]) / dv2;
      residuals[i] = (d2 - u2[c]) / errors[c];
      if (jacobian != null) {
        for (int j = 0; j < nParams; j++) {
          jacobian[i][j] = (modelJacobian[i][j] - 2d * modelJacobian[c][j]
              + modelJacobian[i + 2][j]) / dv2 / errors[c];
        }
      }
    }

    for (int i = 0; i < n; i++) {
      final int row = n - 2 + i;
      if (fitMask[i]) {
        residuals[row] = 0d;
        if (jacobian != null) {
          Arrays.fill(jacobian[row], 0d);
        }
        continue;
      }
      residuals[row] = (model[i] - data[i]) / errors[i] * OUTSIDE_MASK_WEIGHT;
      if (jacobian != null) {
        for (int j = 0; j < nParams; j++) {
          jacobian[row][j] = modelJacobian[i][j] / errors[i] * OUTSIDE_MASK_WEIGHT;
        }
      }
    }
  }
}
