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

import com.google.common.collect.Range;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.NotNull;

public final class ChannelMasks {

  private ChannelMasks() {
  }

  /**
   * Boolean mask over n channels that is true inside the given half-open channel ranges. An empty
   * range list selects every channel.
   */
  public static boolean[] fromRanges(int n, @NotNull List<Range<Integer>> ranges) {
    final boolean[] mask = new boolean[n];
    if (ranges.isEmpty()) {
      Arrays.fill(mask, true);
      return mask;
    }
    for (Range<Integer> range : ranges) {
      final int lower = Math.max(0, lowerChannel(range));
      final int upper = Math.min(n, upperChannel(range));
      for (int i = lower; i < upper; i++) {
        mask[i] = true;
      }
    }
    return mask;
  }

  /**
   * Mask that is false inside the given ranges, used to exclude noise spikes.
   */
  public static boolean[] excluding(int n, @NotNull List<Range<Integer>> ranges) {
    final boolean[] mask = new boolean[n];
    Arrays.fill(mask, true);
    for (Range<Integer> range : ranges) {
      final int lower = Math.max(0, lowerChannel(range));
      final int upper = Math.min(n, upperChannel(range));
      for (int i = lower; i < upper; i++) {
        mask[i] = false;
      }
    }
    return mask;
  }

  public static int count(boolean[] mask) {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /**
   * @return true if the channel lies within one of the ranges
   */
  public static boolean inAnyRange(int channel, @NotNull List<Range<Integer>> ranges) {
    for (Range<Integer> range : ranges) {
      if (channel >= lowerChannel(range) && channel < upperChannel(range)) {
        return true;
      }
    }
    return false;
  }

  private static int lowerChannel(Range<Integer> range) {
    if (!range.hasLowerBound()) {
      return Integer.MIN_VALUE;
    }
    return switch (range.lowerBoundType()) {
      case CLOSED -> range.lowerEndpoint();
      case OPEN -> range.lowerEndpoint() + 1;
    };
  }

  private static int upperChannel(Range<Integer> range) {
    if (!range.hasUpperBound()) {
      return Integer.MAX_VALUE;
    }
    return switch (range.upperBoundType()) {
      case OPEN -> range.upperEndpoint();
      case CLOSED -> range.upperEndpoint() + 1;
    };
  }
}
