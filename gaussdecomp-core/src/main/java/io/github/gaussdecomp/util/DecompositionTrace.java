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

package io.github.gaussdecomp.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Sink for step by step diagnostics of a decomposition. Messages are suppliers so that a silent
 * trace never builds strings.
 */
@FunctionalInterface
public interface DecompositionTrace {

  DecompositionTrace NO_OP = message -> {
  };

  void trace(@NotNull Supplier<String> message);

  /**
   * Trace that forwards all messages to the logger at {@link Level#FINE}.
   */
  static DecompositionTrace toLogger(@NotNull Logger logger) {
    return toLogger(logger, Level.FINE);
  }

  static DecompositionTrace toLogger(@NotNull Logger logger, @NotNull Level level) {
    return message -> logger.log(level, message);
  }

  /**
   * @return a trace that prepends the prefix to every message, e.g. the spectrum index
   */
  default DecompositionTrace withPrefix(@NotNull String prefix) {
    if (this == NO_OP) {
      return NO_OP;
    }
    return message -> trace(() -> prefix + message.get());
  }
}
