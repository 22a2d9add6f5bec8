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

import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decomposition results of a batch, one row per input spectrum and in input order. Each
 * {@link BatchField} can be read as a column.
 */
public final class BatchDecompositionResult {

  private final List<DecompositionResult> results;
  private final List<DecompositionRow> rows;
  private final List<DecompositionResult.Failed> failures;

  private BatchDecompositionResult(List<DecompositionResult> results, List<DecompositionRow> rows,
      List<DecompositionResult.Failed> failures) {
    this.results = List.copyOf(results);
    this.rows = List.copyOf(rows);
    this.failures = List.copyOf(failures);
  }

  public static BatchDecompositionResult of(@NotNull List<DecompositionResult> results) {
    final List<DecompositionRow> rows = new ArrayList<>(results.size());
    final List<DecompositionResult.Failed> failures = new ArrayList<>();
    for (DecompositionResult result : results) {
      Objects.requireNonNull(result);
      rows.add(DecompositionRow.of(result));
      if (result instanceof DecompositionResult.Failed failed) {
        failures.add(failed);
      }
    }
    return new BatchDecompositionResult(results, rows, failures);
  }

  public int size() {
    return rows.size();
  }

  public @NotNull List<DecompositionRow> rows() {
    return rows;
  }

  public @NotNull DecompositionRow row(int index) {
    return rows.get(index);
  }

  /**
   * @return the per-spectrum results the rows were built from, in input order
   */
  public @NotNull List<DecompositionResult> results() {
    return results;
  }

  /**
   * @return the full outcome of the spectrum at the given position, null if it failed
   */
  public @Nullable FitOutcome outcome(int index) {
    return results.get(index) instanceof DecompositionResult.Decomposed decomposed
        ? decomposed.outcome() : null;
  }

  public @NotNull List<DecompositionResult.Failed> failures() {
    return failures;
  }

  /**
   * @return the column of the given field. Entries are null where the field does not apply.
   */
  public @NotNull List<Object> get(@NotNull BatchField field) {
    final List<Object> column = new ArrayList<>(rows.size());
    for (DecompositionRow row : rows) {
      column.add(row.get(field));
    }
    return Collections.unmodifiableList(column);
  }

  public @NotNull List<Object> get(@NotNull String key) {
    return get(BatchField.forKey(key));
  }

  public @NotNull Map<String, List<Object>> asMap() {
    final Map<String, List<Object>> map = new LinkedHashMap<>();
    for (BatchField field : BatchField.values()) {
      map.put(field.getKey(), get(field));
    }
    return map;
  }

  public int totalComponents() {
    return rows.stream().map(DecompositionRow::nComponents).filter(Objects::nonNull)
        .mapToInt(Integer::intValue).sum();
  }
}
