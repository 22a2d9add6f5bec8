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

package io.github.gaussdecomp.modules.dataprocessing.decomp_improve;

import static io.github.gaussdecomp.util.SettingValues.parseBoolean;
import static io.github.gaussdecomp.util.SettingValues.isUnset;
import static io.github.gaussdecomp.util.SettingValues.parseDouble;
import static io.github.gaussdecomp.util.SettingValues.parseInt;
import static io.github.gaussdecomp.util.SettingValues.parseNullableDouble;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thresholds and switches of the fit improvement loop. Instances are immutable and may be shared
 * by all spectra of a batch.
 *
 * @param snr                             signal to noise ratio for residual peaks
 * @param snrFit                          minimum amplitude to noise ratio of fitted components
 * @param snrNegative                     signal to noise ratio for negative residual features
 * @param significance                    minimum integrated significance of a component
 * @param minFwhm                         minimum FWHM in channels
 * @param maxFwhm                         maximum FWHM in channels, null for none
 * @param rchi2Limit                      reduced chi-square above which the fit is improved
 * @param maxAmpFactor                    amplitude ceiling as a factor of the data maximum
 * @param refitNegResPeak                 refit components at negative residual features
 * @param refitBroad                      refit components that are much broader than the others
 * @param refitBlended                    refit blended components
 * @param fwhmFactor                      ratio to the second broadest FWHM for a broad component
 * @param separationFactor                minimum separation of components in units of the smaller
 *                                        FWHM
 * @param excludeMeansOutsideChannelRange drop components centered outside the spectrum
 * @param minPvalue                       minimum F-test p-value of the last component
 * @param maxNcomps                       component budget, null for none
 * @param discardUnresolvedFits           reject the spectrum if the loop ends with reduced
 *                                        chi-square or p-value out of range
 */
public record ImproveFitSettings(double snr, double snrFit, double snrNegative,
                                 double significance, double minFwhm, @Nullable Double maxFwhm,
                                 double rchi2Limit, double maxAmpFactor, boolean refitNegResPeak,
                                 boolean refitBroad, boolean refitBlended, double fwhmFactor,
                                 double separationFactor,
                                 boolean excludeMeansOutsideChannelRange, double minPvalue,
                                 @Nullable Integer maxNcomps, boolean discardUnresolvedFits) {

  /**
   * Keys accepted by {@link Builder#set(String, String)}.
   */
  public static final List<String> KEYS = List.of("snr", "snr_fit", "snr_negative",
      "significance", "min_fwhm", "max_fwhm", "rchi2_limit", "max_amp_factor",
      "refit_neg_res_peak", "refit_broad", "refit_blended", "fwhm_factor", "separation_factor",
      "exclude_means_outside_channel_range", "min_pvalue", "max_ncomps",
      "discard_unresolved_fits");

  public ImproveFitSettings {
    requirePositive("snr", snr);
    requirePositive("snr_fit", snrFit);
    requirePositive("snr_negative", snrNegative);
    requirePositive("rchi2_limit", rchi2Limit);
    requirePositive("max_amp_factor", maxAmpFactor);
    requirePositive("fwhm_factor", fwhmFactor);
    requirePositive("separation_factor", separationFactor);
    if (minFwhm < 0) {
      throw new IllegalArgumentException("min_fwhm must not be negative");
    }
    if (maxFwhm != null && maxFwhm < minFwhm) {
      throw new IllegalArgumentException("max_fwhm must not be smaller than min_fwhm");
    }
    if (maxNcomps != null && maxNcomps < 1) {
      throw new IllegalArgumentException("max_ncomps must be at least 1");
    }
  }

  public static ImproveFitSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().snr(snr).snrFit(snrFit).snrNegative(snrNegative)
        .significance(significance).minFwhm(minFwhm).maxFwhm(maxFwhm).rchi2Limit(rchi2Limit)
        .maxAmpFactor(maxAmpFactor).refitNegResPeak(refitNegResPeak).refitBroad(refitBroad)
        .refitBlended(refitBlended).fwhmFactor(fwhmFactor).separationFactor(separationFactor)
        .excludeMeansOutsideChannelRange(excludeMeansOutsideChannelRange).minPvalue(minPvalue)
        .maxNcomps(maxNcomps).discardUnresolvedFits(discardUnresolvedFits);
  }

  private static void requirePositive(String key, double value) {
    if (!(value > 0)) {
      throw new IllegalArgumentException(key + " must be positive but was " + value);
    }
  }

  public static final class Builder {

    private double snr = 3d;
    private Double snrFit;
    private Double snrNegative;
    private double significance = 5d;
    private double minFwhm = 1d;
    private Double maxFwhm;
    private double rchi2Limit = 1.5;
    private double maxAmpFactor = 1.1;
    private boolean refitNegResPeak = true;
    private boolean refitBroad = true;
    private boolean refitBlended = true;
    private double fwhmFactor = 2d;
    private double separationFactor = 0.8493218002991817;
    private boolean excludeMeansOutsideChannelRange = true;
    private double minPvalue = 0.01;
    private Integer maxNcomps;
    private boolean discardUnresolvedFits = false;

    private Builder() {
    }

    /**
     * Sets a value by its configuration key.
     *
     * @throws IllegalArgumentException for unknown keys or unparsable values
     */
    public Builder set(@NotNull String key, @Nullable String value) {
      switch (key) {
        case "snr" -> snr(parseDouble(key, value));
        case "snr_fit" -> snrFit(parseNullableDouble(key, value));
        case "snr_negative" -> snrNegative(parseNullableDouble(key, value));
        case "significance" -> significance(parseDouble(key, value));
        case "min_fwhm" -> minFwhm(parseDouble(key, value));
        case "max_fwhm" -> maxFwhm(parseNullableDouble(key, value));
        case "rchi2_limit" -> rchi2Limit(parseDouble(key, value));
        case "max_amp_factor" -> maxAmpFactor(parseDouble(key, value));
        case "refit_neg_res_peak" -> refitNegResPeak(parseBoolean(key, value));
        case "refit_broad" -> refitBroad(parseBoolean(key, value));
        case "refit_blended" -> refitBlended(parseBoolean(key, value));
        case "fwhm_factor" -> fwhmFactor(parseDouble(key, value));
        case "separation_factor" -> separationFactor(parseDouble(key, value));
        case "exclude_means_outside_channel_range" ->
            excludeMeansOutsideChannelRange(parseBoolean(key, value));
        case "min_pvalue" -> minPvalue(parseDouble(key, value));
        case "max_ncomps" -> maxNcomps(isUnset(value) ? null : parseInt(key, value));
        case "discard_unresolved_fits" -> discardUnresolvedFits(parseBoolean(key, value));
        default -> throw new IllegalArgumentException("Unknown improve fitting setting: " + key);
      }
      return this;
    }

    public Builder snr(double snr) {
      this.snr = snr;
      return this;
    }

    /**
     * @param snrFit null to use half of {@link #snr(double)}
     */
    public Builder snrFit(@Nullable Double snrFit) {
      this.snrFit = snrFit;
      return this;
    }

    /**
     * @param snrNegative null to use {@link #snr(double)}
     */
    public Builder snrNegative(@Nullable Double snrNegative) {
      this.snrNegative = snrNegative;
      return this;
    }

    public Builder significance(double significance) {
      this.significance = significance;
      return this;
    }

    public Builder minFwhm(double minFwhm) {
      this.minFwhm = minFwhm;
      return this;
    }

    public Builder maxFwhm(@Nullable Double maxFwhm) {
      this.maxFwhm = maxFwhm;
      return this;
    }

    public Builder rchi2Limit(double rchi2Limit) {
      this.rchi2Limit = rchi2Limit;
      return this;
    }

    public Builder maxAmpFactor(double maxAmpFactor) {
      this.maxAmpFactor = maxAmpFactor;
      return this;
    }

    public Builder refitNegResPeak(boolean refitNegResPeak) {
      this.refitNegResPeak = refitNegResPeak;
      return this;
    }

    public Builder refitBroad(boolean refitBroad) {
      this.refitBroad = refitBroad;
      return this;
    }

    public Builder refitBlended(boolean refitBlended) {
      this.refitBlended = refitBlended;
      return this;
    }

    public Builder fwhmFactor(double fwhmFactor) {
      this.fwhmFactor = fwhmFactor;
      return this;
    }

    public Builder separationFactor(double separationFactor) {
      this.separationFactor = separationFactor;
      return this;
    }

    public Builder excludeMeansOutsideChannelRange(boolean exclude) {
      this.excludeMeansOutsideChannelRange = exclude;
      return this;
    }

    public Builder minPvalue(double minPvalue) {
      this.minPvalue = minPvalue;
      return this;
    }

    public Builder maxNcomps(@Nullable Integer maxNcomps) {
      this.maxNcomps = maxNcomps;
      return this;
    }

    public Builder discardUnresolvedFits(boolean discard) {
      this.discardUnresolvedFits = discard;
      return this;
    }

    public ImproveFitSettings build() {
      return new ImproveFitSettings(snr, snrFit == null ? snr / 2d : snrFit,
          snrNegative == null ? snr : snrNegative, significance, minFwhm, maxFwhm, rchi2Limit,
          maxAmpFactor, refitNegResPeak, refitBroad, refitBlended, fwhmFactor, separationFactor,
          excludeMeansOutsideChannelRange, minPvalue, maxNcomps, discardUnresolvedFits);
    }
  }
}
