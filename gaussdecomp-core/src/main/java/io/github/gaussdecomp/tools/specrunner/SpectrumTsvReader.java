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

import com.google.common.base.Splitter;
import com.google.common.collect.Range;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.InitialGuessEstimator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reads spectra from tab separated files.
 * <p>
 * Spectrum files have the columns velocity, intensity and an optional per-channel error. A header
 * row is detected by its column names. Without an error column the noise is taken from the given
 * rms or estimated from the negative part of the spectrum.
 * <p>
 * Range files list half-open channel intervals {@code start end [kind]} where kind is
 * {@code signal} (default) or {@code noise_spike}.
 */
public class SpectrumTsvReader {

  private static final Logger logger = Logger.getLogger(SpectrumTsvReader.class.getName());

  private static final Splitter SPLITTER = Splitter.onPattern("[\t,;]").trimResults();

  private final @Nullable Double rms;

  public SpectrumTsvReader(@Nullable Double rms) {
    this.rms = rms;
  }

  public @NotNull Spectrum readSpectrum(int index, @NotNull Path spectrumFile,
      @Nullable Path rangesFile) throws IOException {
    final List<String[]> rows = readRows(spectrumFile);
    if (rows.isEmpty()) {
      throw new IOException("Spectrum file is empty: " + spectrumFile);
    }
    final String[] header = rows.get(0);
    int xIdx = guessIndex(header, "velocity", "vel", "x", "channel");
    int yIdx = guessIndex(header, "intensity", "y", "signal", "data");
    int errIdx = guessIndex(header, "error", "errors", "err", "sigma", "rms");
    int startRow = 1;
    if (xIdx < 0 || yIdx < 0) {
      // no header, fixed column order
      startRow = 0;
      xIdx = 0;
      yIdx = 1;
      errIdx = header.length > 2 ? 2 : -1;
    }

    final List<double[]> values = new ArrayList<>(rows.size());
    for (int r = startRow; r < rows.size(); r++) {
      final String[] row = rows.get(r);
      if (row.length <= Math.max(xIdx, yIdx)) {
        logger.fine("Skipping short row %d in %s".formatted(r + 1, spectrumFile));
        continue;
      }
      final double err = errIdx >= 0 && errIdx < row.length ? parse(row[errIdx], spectrumFile, r)
          : Double.NaN;
      values.add(new double[]{parse(row[xIdx], spectrumFile, r), parse(row[yIdx], spectrumFile, r),
          err});
    }

    final double[] velocity = values.stream().mapToDouble(v -> v[0]).toArray();
    final double[] intensity = values.stream().mapToDouble(v -> v[1]).toArray();
    double[] errors = values.stream().mapToDouble(v -> v[2]).toArray();
    if (Arrays.stream(errors).anyMatch(Double::isNaN)) {
      final double noise = rms != null ? rms : InitialGuessEstimator.estimateNoise(
          Arrays.stream(intensity).filter(v -> !Double.isNaN(v)).toArray());
      errors = new double[intensity.length];
      Arrays.fill(errors, noise);
    }

    final Spectrum spectrum = Spectrum.of(index, velocity, intensity, errors);
    if (rangesFile == null || !Files.exists(rangesFile)) {
      return spectrum;
    }
    final List<Range<Integer>> signal = new ArrayList<>();
    final List<Range<Integer>> spikes = new ArrayList<>();
    readRanges(rangesFile, signal, spikes);
    return spectrum.withRanges(signal, spikes);
  }

  static void readRanges(Path file, List<Range<Integer>> signal, List<Range<Integer>> spikes)
      throws IOException {
    final List<String[]> rows = readRows(file);
    for (int r = 0; r < rows.size(); r++) {
      final String[] row = rows.get(r);
      if (row.length < 2 || (r == 0 && !isNumeric(row[0]))) {
        continue;
      }
      final int start = (int) parse(row[0], file, r);
      final int end = (int) parse(row[1], file, r);
      if (end <= start) {
        throw new IOException("Empty range %d-%d in line %d of %s".formatted(start, end, r + 1,
            file));
      }
      final String kind = row.length > 2 ? row[2].toLowerCase(Locale.ROOT) : "signal";
      switch (kind) {
        case "signal", "" -> signal.add(Range.closedOpen(start, end));
        case "noise_spike", "spike" -> spikes.add(Range.closedOpen(start, end));
        default -> throw new IOException("Unknown range kind '%s' in line %d of %s".formatted(
            kind, r + 1, file));
      }
    }
  }

  private static List<String[]> readRows(Path file) throws IOException {
    final List<String[]> rows = new ArrayList<>();
    for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
      if (line.isBlank() || line.startsWith("#")) {
        continue;
      }
      rows.add(SPLITTER.splitToList(line).toArray(String[]::new));
    }
    return rows;
  }

  private static int guessIndex(String[] header, String... names) {
    for (int i = 0; i < header.length; i++) {
      final String h = header[i].toLowerCase(Locale.ROOT);
      for (String name : names) {
        if (h.equals(name)) {
          return i;
        }
      }
    }
    return -1;
  }

  private static boolean isNumeric(String s) {
    try {
      Double.parseDouble(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static double parse(String s, Path file, int row) throws IOException {
    if (s.isEmpty() || s.equalsIgnoreCase("nan")) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      throw new IOException("Cannot parse '%s' in line %d of %s".formatted(s, row + 1, file), e);
    }
  }
}
