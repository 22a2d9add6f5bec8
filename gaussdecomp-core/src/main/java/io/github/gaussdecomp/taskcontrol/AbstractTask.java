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

package io.github.gaussdecomp.taskcontrol;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class for long running tasks. Subclasses implement {@link #process()} and report progress
 * through {@link #totalItems} and {@link #getFinishedPercentage()}.
 */
public abstract class AbstractTask implements Task {

  private static final Logger logger = Logger.getLogger(AbstractTask.class.getName());

  private volatile TaskStatus status = TaskStatus.WAITING;
  private volatile String errorMessage;
  protected long totalItems;

  protected abstract void process();

  @Override
  public final void run() {
    if (isCanceled()) {
      return;
    }
    try {
      process();
    } catch (RuntimeException e) {
      error("Unexpected error in " + getTaskDescription() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public @NotNull TaskStatus getStatus() {
    return status;
  }

  protected void setStatus(@NotNull TaskStatus status) {
    this.status = status;
  }

  @Override
  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  public boolean isCanceled() {
    return status == TaskStatus.CANCELED;
  }

  public boolean isFinished() {
    return status == TaskStatus.FINISHED;
  }

  @Override
  public void cancel() {
    if (status == TaskStatus.WAITING || status == TaskStatus.PROCESSING) {
      setStatus(TaskStatus.CANCELED);
    }
  }

  protected void error(@NotNull String message, @Nullable Throwable t) {
    logger.log(Level.SEVERE, message, t);
    this.errorMessage = message;
    setStatus(TaskStatus.ERROR);
  }

  protected void error(@NotNull String message) {
    error(message, null);
  }
}
