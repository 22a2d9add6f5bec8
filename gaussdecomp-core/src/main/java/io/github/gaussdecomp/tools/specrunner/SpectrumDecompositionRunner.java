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

package io.github.gaussdecomp.tools.specrunner;

import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import io.github.gaussdecomp.datamodel.decomposition.QualityControl;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.AgdDecomposer;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.DecompositionSettings;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.DecompositionSettingsJson;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.BatchDecompositionResult;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.BatchDecompositionTask;
import io.github.gaussdecomp.modules.dataprocessing.decomp_batch.DecompositionRow;
import io.github.gaussdecomp.modules.dataprocessing.decomp_improve.ImproveFitSettings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Standalone runner that decomposes all "*_spectrum.tsv" files of a directory as one batch. Signal
 * ranges are read from a matching "*_ranges.tsv" if present.
 * <p>
 * Usage:
 * -DinputDir=/absolute/path -DoutDir=/absolute/output/path -Dalpha1=2.5 -Dplot=true
 * Or call main with args: inputDir [outDir]
 * <p>
 * Every decomposition setting key can be passed as a system property, for example
 * -DSNR_thresh=3 -Dimprove_fitting=true -Dmin_fwhm=2. Alternatively -Dsettings=file.json loads a
 * settings file as written by this runner. -Drms sets the noise of spectra without an error
 * column.
 */
public class SpectrumDecompositionRunner {

  public static void main(String[] args) throws Exception {
    final String inputDirArg =
        (args != null && args.length > 0 && args[0] != null && !args[0].isBlank()) ? args[0]
            : System.getProperty("inputDir", "");
    if (inputDirArg == null || inputDirArg.isBlank()) {
      System.err.println("Please provide input directory via -DinputDir or first CLI arg.");
      return;
    }
    final Path inputDir = Paths.get(inputDirArg).toAbsolutePath().normalize();
    final String outDirArg =
        (args != null && args.length > 1 && args[1] != null && !args[1].isBlank()) ? args[1]
            : System.getProperty("outDir", inputDir.resolve("decomposition").toString());
    final Path outDir = Paths.get(outDirArg).toAbsolutePath().normalize();
    final String rmsArg = System.getProperty("rms", "").trim();
    final Double rms = rmsArg.isEmpty() ? null : Double.parseDouble(rmsArg);

    final DecompositionSettings settings;
    try {
      settings = readSettings();
    } catch (IllegalArgumentException | IOException e) {
      System.err.println("Invalid settings: " + e.getMessage());
      return;
    }

    Files.createDirectories(outDir);
    System.out.printf(Locale.US, "Input: %s%nOutput: %s%nalpha1=%.3f, alpha2=%s, threads=%d%n",
        inputDir, outDir, settings.alpha1(), settings.alpha2(), settings.useNcpus());

    final List<Path> spectrumFiles;
    try (Stream<Path> s = Files.list(inputDir)) {
      spectrumFiles = s.filter(p -> p.getFileName().toString().endsWith("_spectrum.tsv")).sorted()
          .toList();
    }
    if (spectrumFiles.isEmpty()) {
      System.err.println("No *_spectrum.tsv files found in " + inputDir);
      return;
    }

    final SpectrumTsvReader reader = new SpectrumTsvReader(rms);
    final List<Spectrum> spectra = new ArrayList<>();
    final List<String> names = new ArrayList<>();
    for (Path file : spectrumFiles) {
      final String stem = file.getFileName().toString().replace("_spectrum.tsv", "");
      try {
        spectra.add(reader.readSpectrum(spectra.size(), file,
            inputDir.resolve(stem + "_ranges.tsv")));
        names.add(stem);
      } catch (IOException | IllegalArgumentException e) {
        System.err.println("Skipping " + stem + ": " + e.getMessage());
      }
    }
    if (spectra.isEmpty()) {
      System.err.println("No readable spectra in " + inputDir);
      return;
    }

    final AgdDecomposer decomposer = new AgdDecomposer(settings);
    final BatchDecompositionTask task = new BatchDecompositionTask(spectra, decomposer,
        settings.useNcpus());
    task.run();
    final BatchDecompositionResult result = task.getResult();
    if (result == null) {
      System.err.println("Decomposition did not finish: " + task.getErrorMessage());
      return;
    }

    Files.writeString(outDir.resolve("decomposition_summary.tsv"), summary(names, result),
        StandardCharsets.UTF_8);
    Files.writeString(outDir.resolve("components.tsv"), components(names, result),
        StandardCharsets.UTF_8);
    Files.writeString(outDir.resolve("decomposition_settings.json"),
        DecompositionSettingsJson.toJson(settings).toString(2), StandardCharsets.UTF_8);

    int savedPng = 0;
    if (settings.plot()) {
      final DecompositionChartWriter charts = new DecompositionChartWriter();
      for (int i = 0; i < spectra.size(); i++) {
        final FitOutcome outcome = result.outcome(i);
        if (outcome == null) {
          continue;
        }
        charts.saveChart(outDir.resolve(names.get(i) + ".png").toFile(), names.get(i),
            spectra.get(i), outcome);
        savedPng++;
      }
    }

    System.out.printf(Locale.US, "Decomposed %d spectra into %d components, %d failed.%n",
        result.size(), result.totalComponents(), result.failures().size());
    if (settings.plot()) {
      System.out.printf(Locale.US, "Saved %d charts to %s%n", savedPng, outDir);
    }
  }

  static DecompositionSettings readSettings() throws IOException {
    final String file = System.getProperty("settings", "").trim();
    final DecompositionSettings.Builder builder;
    if (!file.isEmpty()) {
      builder = DecompositionSettingsJson.fromJson(
          Files.readString(Paths.get(file), StandardCharsets.UTF_8)).toBuilder();
    } else {
      builder = DecompositionSettings.builder();
    }
    for (String key : DecompositionSettings.KEYS) {
      final String value = System.getProperty(key);
      if (value != null) {
        builder.set(key, value);
      }
    }

    final DecompositionSettings base = builder.build();
    if (!base.improvesFit()) {
      return base;
    }
    final ImproveFitSettings.Builder improve = base.improveFitting().toBuilder();
    for (String key : ImproveFitSettings.KEYS) {
      final String value = System.getProperty(key);
      if (value != null) {
        improve.set(key, value);
      }
    }
    return base.toBuilder().improveFitting(improve.build()).build();
  }

  static @NotNull String summary(List<String> names, BatchDecompositionResult result) {
    final StringBuilder sb = new StringBuilder(
        "spectrum\tindex\tn_initial\tn_components\trchi2\taicc\tpvalue\tn_neg_res_peak"
            + "\tn_blended\ttermination\tstatus\n");
    for (int i = 0; i < result.size(); i++) {
      final DecompositionRow row = result.row(i);
      final QualityControl qc = row.qualityControl();
      sb.append(names.get(i)).append('\t').append(row.indexFit()).append('\t')
          .append(format(row.nComponentsInitial())).append('\t')
          .append(format(row.nComponents())).append('\t')
          .append(format(row.bestFitRchi2())).append('\t')
          .append(format(row.bestFitAicc())).append('\t')
          .append(format(row.pvalue())).append('\t')
          .append(format(row.nNegResPeak())).append('\t')
          .append(format(row.nBlended())).append('\t')
          .append(qc == null ? "" : qc.termination().name()).append('\t')
          .append(row.isFailed() ? "failed: " + failureReason(result, row.indexFit()) : "ok")
          .append('\n');
    }
    return sb.toString();
  }

  static @NotNull String components(List<String> names, BatchDecompositionResult result) {
    final StringBuilder sb = new StringBuilder(
        "spectrum\tindex\tcomponent\tamplitude\tfwhm\tmean\tamplitude_err\tfwhm_err\tmean_err\n");
    for (int i = 0; i < result.size(); i++) {
      final DecompositionRow row = result.row(i);
      final boolean fitted = row.amplitudesFit() != null;
      final double[] amps = fitted ? row.amplitudesFit() : row.amplitudesInitial();
      if (amps == null) {
        continue;
      }
      final double[] fwhms = fitted ? row.fwhmsFit() : row.fwhmsInitial();
      final double[] means = fitted ? row.meansFit() : row.meansInitial();
      for (int c = 0; c < amps.length; c++) {
        sb.append(names.get(i)).append('\t').append(row.indexFit()).append('\t').append(c)
            .append('\t').append(format(amps[c])).append('\t').append(format(fwhms[c]))
            .append('\t').append(format(means[c])).append('\t')
            .append(error(row.amplitudesFitErr(), c)).append('\t')
            .append(error(row.fwhmsFitErr(), c)).append('\t')
            .append(error(row.meansFitErr(), c)).append('\n');
      }
    }
    return sb.toString();
  }

  private static String failureReason(BatchDecompositionResult result, int index) {
    return result.failures().stream().filter(f -> f.index() == index)
        .map(DecompositionResult.Failed::reason).findFirst().orElse("");
  }

  private static String error(double @Nullable [] errors, int c) {
    return errors == null || c >= errors.length ? "" : format(errors[c]);
  }

  private static String format(@Nullable Number value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Integer) {
      return value.toString();
    }
    return String.format(Locale.US, "%.6g", value.doubleValue());
  }
}
