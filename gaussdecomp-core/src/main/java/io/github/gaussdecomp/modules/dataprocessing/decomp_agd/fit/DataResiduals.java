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

import io.github.gaussdecomp.datamodel.Spectrum;
import org.jetbrains.annotations.NotNull;

/**
 * Error weighted residual {@code (model - data) / errors} over all channels.
 */
public class DataResiduals implements ResidualFunction {

  private final double[] x;
  private final double[] data;
  private final double[] errors;
  private final double[] model;

  public DataResiduals(double[] x, double[] data, double[] errors) {
    if (x.length != data.length || x.length != errors.length) {
      throw new IllegalArgumentException("x, data and errors must have equal length");
    }
    this.x = x;
    this.data = data;
    this.errors = errors;
    this.model = new double[x.length];
  }

  public static DataResiduals of(@NotNull Spectrum spectrum) {
    return new DataResiduals(spectrum.velocity(), spectrum.intensity(), spectrum.errors());
  }

  @Override
  public int size() {
    return x.length;
  }

  @Override
  public void evaluate(double[] parameters, double[] residuals, double[][] jacobian) {
    MultiGaussianFunction.evaluate(x, parameters, model, jacobian);
    for (int i = 0; i < x.length; i++) {
      residuals[i] = (model[i] - data[i]) / errors[i];
      if (jacobian != null) {
        final double[] row = jacobian[i];
        for (int j = 0; j < row.length; j++) {
          row[j] /= errors[i];
        }
      }
    }
  }
}
