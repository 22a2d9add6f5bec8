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

import static io.github.gaussdecomp.util.SettingValues.isUnset;
import static io.github.gaussdecomp.util.SettingValues.parseBoolean;
import static io.github.gaussdecomp.util.SettingValues.parseDouble;
import static io.github.gaussdecomp.util.SettingValues.parseInt;
import static io.github.gaussdecomp.util.SettingValues.parseNullableDouble;

import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImproveFitSettings;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Settings of the autonomous Gaussian decomposition.
 *
 * @param alpha1          regularization scale of phase one (narrow components)
 * @param alpha2          regularization scale of phase two (broad components), required in
 *                        two-phase mode
 * @param twoPhase        run the second, broad phase on the residual of phase one
 * @param snrThresh       intensity signal to noise threshold for candidates
 * @param snr2Thresh      second derivative signal to noise threshold, 0 disables the mask
 * @param useNcpus        number of worker threads of a batch
 * @param verbose         trace every decomposition step to the log
 * @param plot            write a chart for every spectrum, used by the runner
 * @param performFinalFit fit the final guess to the data
 * @param improveFitting  settings of the fit improvement, null to skip it
 */
public record DecompositionSettings(double alpha1, @Nullable Double alpha2, boolean twoPhase,
                                    double snrThresh, double snr2Thresh, int useNcpus,
                                    boolean verbose, boolean plot, boolean performFinalFit,
                                    @Nullable ImproveFitSettings improveFitting) {

  public static final List<String> KEYS = List.of("alpha1", "alpha2", "two_phase", "phase",
      "SNR_thresh", "SNR2_thresh", "use_ncpus", "verbose", "plot", "perform_final_fit",
      "improve_fitting");

  public enum Phase {
    ONE, TWO
  }

  public DecompositionSettings {
    if (!(alpha1 > 0)) {
      throw new IllegalArgumentException("alpha1 must be positive but was " + alpha1);
    }
    if (twoPhase && (alpha2 == null || !(alpha2 > 0))) {
      throw new IllegalArgumentException("Two-phase decomposition requires a positive alpha2");
    }
    if (useNcpus < 1) {
      throw new IllegalArgumentException("use_ncpus must be at least 1 but was " + useNcpus);
    }
  }

  public Phase phase() {
    return twoPhase ? Phase.TWO : Phase.ONE;
  }

  public boolean improvesFit() {
    return improveFitting != null;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().alpha1(alpha1).alpha2(alpha2).twoPhase(twoPhase).snrThresh(snrThresh)
        .snr2Thresh(snr2Thresh).useNcpus(useNcpus).verbose(verbose).plot(plot)
        .performFinalFit(performFinalFit).improveFitting(improveFitting);
  }

  public static final class Builder {

    private double alpha1 = Double.NaN;
    private Double alpha2;
    private boolean twoPhase = false;
    private double snrThresh = 5d;
    private double snr2Thresh = 5d;
    private int useNcpus = Runtime.getRuntime().availableProcessors();
    private boolean verbose = false;
    private boolean plot = false;
    private boolean performFinalFit = true;
    private ImproveFitSettings improveFitting;

    private Builder() {
    }

    /**
     * Sets a value by its configuration key.
     *
     * @throws IllegalArgumentException for unknown keys or unparsable values
     */
    public Builder set(@NotNull String key, @Nullable String value) {
      switch (key) {
        case "alpha1" -> alpha1(parseDouble(key, value));
        case "alpha2" -> alpha2(parseNullableDouble(key, value));
        case "two_phase" -> twoPhase(parseBoolean(key, value));
        case "phase" -> twoPhase(parsePhase(value) == Phase.TWO);
        case "SNR_thresh" -> snrThresh(parseDouble(key, value));
        case "SNR2_thresh" -> snr2Thresh(parseDouble(key, value));
        case "use_ncpus" -> useNcpus(isUnset(value) ? Runtime.getRuntime().availableProcessors()
            : parseInt(key, value));
        case "verbose" -> verbose(parseBoolean(key, value));
        case "plot" -> plot(parseBoolean(key, value));
        case "perform_final_fit" -> performFinalFit(parseBoolean(key, value));
        case "improve_fitting" -> {
          if (!parseBoolean(key, value)) {
            improveFitting(null);
          } else if (improveFitting == null) {
            improveFitting(ImproveFitSettings.defaults());
          }
        }
        default -> throw new IllegalArgumentException("Unknown decomposition setting: " + key);
      }
      return this;
    }

    private static Phase parsePhase(@Nullable String value) {
      if (value == null) {
        throw new IllegalArgumentException("Setting phase requires a value");
      }
      try {
        return Phase.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Setting phase must be one or two but was " + value,
            e);
      }
    }

    public Builder alpha1(double alpha1) {
      this.alpha1 = alpha1;
      return this;
    }

    public Builder alpha2(@Nullable Double alpha2) {
      this.alpha2 = alpha2;
      return this;
    }

    public Builder twoPhase(boolean twoPhase) {
      this.twoPhase = twoPhase;
      return this;
    }

    public Builder snrThresh(double snrThresh) {
      this.snrThresh = snrThresh;
      return this;
    }

    public Builder snr2Thresh(double snr2Thresh) {
      this.snr2Thresh = snr2Thresh;
      return this;
    }

    public Builder useNcpus(int useNcpus) {
      this.useNcpus = useNcpus;
      return this;
    }

    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder plot(boolean plot) {
      this.plot = plot;
      return this;
    }

    public Builder performFinalFit(boolean performFinalFit) {
      this.performFinalFit = performFinalFit;
      return this;
    }

    public Builder improveFitting(@Nullable ImproveFitSettings improveFitting) {
      this.improveFitting = improveFitting;
      return this;
    }

    public DecompositionSettings build() {
      return new DecompositionSettings(alpha1, alpha2, twoPhase, snrThresh, snr2Thresh, useNcpus,
          verbose, plot, performFinalFit, improveFitting);
    }
  }
}
