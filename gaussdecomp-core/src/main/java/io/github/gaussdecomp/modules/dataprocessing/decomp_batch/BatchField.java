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

package io.github.gaussdecomp.modules.dataprocessing.decomp_batch;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Fixed columns of a batch decomposition result.
 */
public enum BatchField {
  INDEX_FIT("index_fit"),
  AMPLITUDES_FIT("amplitudes_fit"),
  FWHMS_FIT("fwhms_fit"),
  MEANS_FIT("means_fit"),
  N_COMPONENTS_INITIAL("N_components_initial"),
  AMPLITUDES_INITIAL("amplitudes_initial"),
  FWHMS_INITIAL("fwhms_initial"),
  MEANS_INITIAL("means_initial"),
  AMPLITUDES_FIT_ERR("amplitudes_fit_err"),
  FWHMS_FIT_ERR("fwhms_fit_err"),
  MEANS_FIT_ERR("means_fit_err"),
  BEST_FIT_RCHI2("best_fit_rchi2"),
  BEST_FIT_AICC("best_fit_aicc"),
  N_COMPONENTS("N_components"),
  N_NEG_RES_PEAK("N_neg_res_peak"),
  N_BLENDED("N_blended"),
  LOG_GPLUS("log_gplus"),
  PVALUE("pvalue"),
  QUALITY_CONTROL("quality_control");

  private final String key;

  BatchField(String key) {
    this.key = key;
  }

  public @NotNull String getKey() {
    return key;
  }

  public static @NotNull BatchField forKey(@NotNull String key) {
    return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown batch field: " + key));
  }

  @Override
  public String toString() {
    return key;
  }
}
