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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.DecompositionResult;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.AgdDecomposer;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.DecompositionSettings;
import io.github.gaussdecomp.modules.dataprocessing.decomp_agd.SpectrumDecomposer;
import io.github.gaussdecomp.taskcontrol.AbstractTask;
import io.github.gaussdecomp.taskcontrol.TaskStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decomposes a list of spectra on a fixed thread pool. Results are collected in input order. A
 * spectrum that fails is recorded as failed and does not stop the others; all failures are
 * reported once the batch is done.
 */
public class BatchDecompositionTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(BatchDecompositionTask.class.getName());

  private final List<Spectrum> spectra;
  private final SpectrumDecomposer decomposer;
  private final int threads;
  private final AtomicInteger processed = new AtomicInteger();

  private BatchDecompositionResult result;

  public BatchDecompositionTask(@NotNull List<Spectrum> spectra,
      @NotNull DecompositionSettings settings) {
    this(spectra, new AgdDecomposer(settings), settings.useNcpus());
  }

  public BatchDecompositionTask(@NotNull List<Spectrum> spectra,
      @NotNull SpectrumDecomposer decomposer, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("Number of threads must be at least 1 but was " + threads);
    }
    this.spectra = List.copyOf(spectra);
    this.decomposer = decomposer;
    this.threads = threads;
    totalItems = this.spectra.size();
  }

  /**
   * Decomposes a single spectrum with one worker thread.
   */
  public static BatchDecompositionTask single(@NotNull Spectrum spectrum,
      @NotNull SpectrumDecomposer decomposer) {
    return new BatchDecompositionTask(List.of(spectrum), decomposer, 1);
  }

  @Override
  public String getTaskDescription() {
    return "Gaussian decomposition of " + spectra.size() + " spectra";
  }

  @Override
  public double getFinishedPercentage() {
    return totalItems == 0 ? 0d : processed.get() / (double) totalItems;
  }

  /**
   * @return the result, or null if the task has not finished
   */
  public @Nullable BatchDecompositionResult getResult() {
    return result;
  }

  @Override
  protected void process() {
    setStatus(TaskStatus.PROCESSING);
    final ExecutorService executor = Executors.newFixedThreadPool(
        Math.min(threads, Math.max(1, spectra.size())),
        new ThreadFactoryBuilder().setNameFormat("gauss-decomposition-%d").setDaemon(true)
            .build());
    try {
      final List<Future<DecompositionResult>> futures = new ArrayList<>(spectra.size());
      for (Spectrum spectrum : spectra) {
        futures.add(executor.submit(() -> {
          try {
            return decomposer.decompose(spectrum);
          } finally {
            processed.incrementAndGet();
          }
        }));
      }

      final List<DecompositionResult> results = new ArrayList<>(spectra.size());
      for (int i = 0; i < futures.size(); i++) {
        if (isCanceled()) {
          futures.forEach(f -> f.cancel(true));
          return;
        }
        results.add(collect(spectra.get(i).index(), futures.get(i)));
      }

      result = BatchDecompositionResult.of(results);
      logFailures(result.failures());
      logger.info(() -> "Decomposed %d spectra into %d components using %d threads".formatted(
          spectra.size(), result.totalComponents(), threads));
      setStatus(TaskStatus.FINISHED);
    } finally {
      executor.shutdownNow();
    }
  }

  private DecompositionResult collect(int index, Future<DecompositionResult> future) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause() != null ? e.getCause() : e;
      return DecompositionResult.failed(index,
          cause.getClass().getSimpleName() + ": " + cause.getMessage());
    } catch (CancellationException e) {
      return DecompositionResult.failed(index, "Canceled");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DecompositionResult.failed(index, "Interrupted");
    }
  }

  private void logFailures(List<DecompositionResult.Failed> failures) {
    if (failures.isEmpty()) {
      return;
    }
    logger.warning(() -> "Decomposition failed for %d of %d spectra:%n%s".formatted(
        failures.size(), spectra.size(), failures.stream()
            .map(f -> "  spectrum " + f.index() + ": " + f.reason())
            .collect(Collectors.joining(System.lineSeparator()))));
  }
}
