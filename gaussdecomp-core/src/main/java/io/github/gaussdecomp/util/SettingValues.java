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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Parses textual setting values. "none", "null" and blank values stand for an unset optional
 * value.
 */
public final class SettingValues {

  private SettingValues() {
  }

  public static double parseDouble(@NotNull String key, @Nullable String value) {
    final Double d = parseNullableDouble(key, value);
    if (d == null) {
      throw new IllegalArgumentException("Setting " + key + " requires a value");
    }
    return d;
  }

  public static @Nullable Double parseNullableDouble(@NotNull String key,
      @Nullable String value) {
    if (isUnset(value)) {
      return null;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + key + " is not a number: " + value, e);
    }
  }

  public static int parseInt(@NotNull String key, @Nullable String value) {
    final double d = parseDouble(key, value);
    if (d != Math.rint(d)) {
      throw new IllegalArgumentException("Setting " + key + " is not an integer: " + value);
    }
    return (int) d;
  }

  public static boolean parseBoolean(@NotNull String key, @Nullable String value) {
    if (value != null) {
      final String v = value.trim();
      if (v.equalsIgnoreCase("true") || v.equals("1")) {
        return true;
      }
      if (v.equalsIgnoreCase("false") || v.equals("0")) {
        return false;
      }
    }
    throw new IllegalArgumentException("Setting " + key + " is not a boolean: " + value);
  }

  public static boolean isUnset(@Nullable String value) {
    return value == null || value.isBlank() || value.trim().equalsIgnoreCase("none")
        || value.trim().equalsIgnoreCase("null");
  }
}
