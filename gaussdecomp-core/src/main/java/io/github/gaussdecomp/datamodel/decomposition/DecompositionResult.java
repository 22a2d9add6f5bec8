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

package io.github.gaussdecomp.datamodel.decomposition;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Result of decomposing one spectrum: either an outcome or a failure with a readable reason.
 */
public sealed interface DecompositionResult {

  int index();

  static DecompositionResult decomposed(int index, @NotNull FitOutcome outcome) {
    return new Decomposed(index, outcome);
  }

  static DecompositionResult failed(int index, @NotNull String reason) {
    return new Failed(index, reason);
  }

  record Decomposed(int index, @NotNull FitOutcome outcome) implements DecompositionResult {

    public Decomposed {
      Objects.requireNonNull(outcome);
    }
  }

  record Failed(int index, @NotNull String reason) implements DecompositionResult {

    public Failed {
      Objects.requireNonNull(reason);
    }
  }
}
