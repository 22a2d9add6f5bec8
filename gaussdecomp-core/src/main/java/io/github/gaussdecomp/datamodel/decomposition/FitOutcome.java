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

import io.github.gaussdecomp.datamodel.GaussianParameters;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * What a decomposition produced for one spectrum. Every variant carries the initial guess.
 */
public sealed interface FitOutcome {

  @NotNull GaussianParameters initialGuess();

  /**
   * @return the best-fit parameters or null if no fit was performed
   */
  default @Nullable GaussianParameters bestFit() {
    return null;
  }

  default @Nullable GaussianParameters bestFitErrors() {
    return null;
  }

  /**
   * Number of components in the final result.
   */
  int componentCount();

  /**
   * The guesser found nothing and no improvement was requested.
   */
  record NoComponents(@NotNull GaussianParameters initialGuess) implements FitOutcome {

    @Override
    public int componentCount() {
      return 0;
    }
  }

  /**
   * Only the initial guess is available, because no final fit was requested or it did not
   * converge.
   */
  record GuessOnly(@NotNull GaussianParameters initialGuess) implements FitOutcome {

    @Override
    public int componentCount() {
      return initialGuess.componentCount();
    }
  }

  record Fitted(@NotNull GaussianParameters initialGuess, @NotNull GaussianParameters bestFit,
                @NotNull GaussianParameters bestFitErrors) implements FitOutcome {

    public Fitted {
      Objects.requireNonNull(bestFit);
      Objects.requireNonNull(bestFitErrors);
    }

    @Override
    public int componentCount() {
      return bestFit.componentCount();
    }
  }

  record Improved(@NotNull GaussianParameters initialGuess, @NotNull GaussianParameters bestFit,
                  @NotNull GaussianParameters bestFitErrors, @NotNull FitQuality quality)
      implements FitOutcome {

    public Improved {
      Objects.requireNonNull(bestFit);
      Objects.requireNonNull(bestFitErrors);
      Objects.requireNonNull(quality);
    }

    @Override
    public int componentCount() {
      return bestFit.componentCount();
    }
  }
}
