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

import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Record of the acceptance checks run by the fit improvement loop.
 *
 * @param firedChecks checks that triggered at least once, in the order they first fired
 * @param iterations  number of improvement rounds
 * @param termination why the loop stopped
 */
public record QualityControl(@NotNull List<QualityFlag> firedChecks, int iterations,
                             @NotNull Termination termination) {

  public QualityControl {
    firedChecks = List.copyOf(firedChecks);
  }

  public boolean fired(QualityFlag flag) {
    return firedChecks.contains(flag);
  }

  public enum Termination {
    /**
     * No check remains violated.
     */
    STABLE,
    NO_COMPONENTS,
    /**
     * The loop ran out of refits while reduced chi-square or p-value were still out of range.
     */
    UNRESOLVED
  }
}
