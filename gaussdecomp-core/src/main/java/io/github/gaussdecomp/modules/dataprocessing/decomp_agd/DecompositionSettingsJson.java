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

import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImproveFitSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads and writes {@link DecompositionSettings} as JSON using the same keys as
 * {@link DecompositionSettings.Builder#set(String, String)}. The improvement settings are nested
 * under {@code improve_fitting}, which is {@code false} if the fit is not improved.
 */
public final class DecompositionSettingsJson {

  public static final String IMPROVE_FITTING = "improve_fitting";

  private DecompositionSettingsJson() {
  }

  public static @NotNull JSONObject toJson(@NotNull DecompositionSettings settings) {
    final JSONObject json = new JSONObject();
    json.put("alpha1", settings.alpha1());
    json.put("alpha2", orNull(settings.alpha2()));
    json.put("phase", settings.twoPhase() ? "two" : "one");
    json.put("SNR_thresh", settings.snrThresh());
    json.put("SNR2_thresh", settings.snr2Thresh());
    json.put("use_ncpus", settings.useNcpus());
    json.put("verbose", settings.verbose());
    json.put("plot", settings.plot());
    json.put("perform_final_fit", settings.performFinalFit());
    final ImproveFitSettings improve = settings.improveFitting();
    json.put(IMPROVE_FITTING, improve == null ? false : toJson(improve));
    return json;
  }

  public static @NotNull JSONObject toJson(@NotNull ImproveFitSettings settings) {
    final JSONObject json = new JSONObject();
    json.put("snr", settings.snr());
    json.put("snr_fit", settings.snrFit());
    json.put("snr_negative", settings.snrNegative());
    json.put("significance", settings.significance());
    json.put("min_fwhm", settings.minFwhm());
    json.put("max_fwhm", orNull(settings.maxFwhm()));
    json.put("rchi2_limit", settings.rchi2Limit());
    json.put("max_amp_factor", settings.maxAmpFactor());
    json.put("refit_neg_res_peak", settings.refitNegResPeak());
    json.put("refit_broad", settings.refitBroad());
    json.put("refit_blended", settings.refitBlended());
    json.put("fwhm_factor", settings.fwhmFactor());
    json.put("separation_factor", settings.separationFactor());
    json.put("exclude_means_outside_channel_range", settings.excludeMeansOutsideChannelRange());
    json.put("min_pvalue", settings.minPvalue());
    json.put("max_ncomps", orNull(settings.maxNcomps()));
    json.put("discard_unresolved_fits", settings.discardUnresolvedFits());
    return json;
  }

  /**
   * @throws IllegalArgumentException if the text is no JSON object, contains unknown keys or
   *                                  invalid values
   */
  public static @NotNull DecompositionSettings fromJson(@NotNull String text) {
    final JSONObject json;
    try {
      json = new JSONObject(text);
    } catch (JSONException e) {
      throw new IllegalArgumentException("Cannot parse decomposition settings: " + e.getMessage(),
          e);
    }
    return fromJson(json);
  }

  public static @NotNull DecompositionSettings fromJson(@NotNull JSONObject json) {
    final DecompositionSettings.Builder builder = DecompositionSettings.builder();
    for (String key : json.keySet()) {
      final Object value = json.get(key);
      if (IMPROVE_FITTING.equals(key) && value instanceof JSONObject improve) {
        builder.improveFitting(improveFromJson(improve));
      } else {
        builder.set(key, asString(value));
      }
    }
    return builder.build();
  }

  public static @NotNull ImproveFitSettings improveFromJson(@NotNull JSONObject json) {
    final ImproveFitSettings.Builder builder = ImproveFitSettings.builder();
    for (String key : json.keySet()) {
      builder.set(key, asString(json.get(key)));
    }
    return builder.build();
  }

  private static @Nullable String asString(Object value) {
    return JSONObject.NULL.equals(value) ? null : String.valueOf(value);
  }

  private static Object orNull(@Nullable Object value) {
    return value == null ? JSONObject.NULL : value;
  }
}
