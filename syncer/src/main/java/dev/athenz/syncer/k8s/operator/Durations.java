/*
 * Copyright 2024 Responsive Computing, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.athenz.syncer.k8s.operator;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Parses durations written the way the syncer's flags have always accepted them, e.g.
 * {@code 1h0m0s}, {@code 250ms} or {@code 1.5s}. A duration is a sequence of decimal numbers,
 * each followed by a unit ({@code ns}, {@code us}, {@code ms}, {@code s}, {@code m},
 * {@code h}), with an optional leading sign. A bare {@code 0} needs no unit.
 */
public final class Durations {
  private static final ImmutableMap<String, Long> UNIT_NANOS =
      ImmutableMap.<String, Long>builder()
      .put("ns", 1L)
      .put("us", 1_000L)
      .put("µs", 1_000L)
      .put("μs", 1_000L)
      .put("ms", 1_000_000L)
      .put("s", 1_000_000_000L)
      .put("m", 60_000_000_000L)
      .put("h", 3_600_000_000_000L)
      .build();

  private Durations() {}

  public static Duration parse(final String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("empty duration");
    }
    String s = value;
    boolean negative = false;
    if (s.charAt(0) == '-' || s.charAt(0) == '+') {
      negative = s.charAt(0) == '-';
      s = s.substring(1);
    }
    if (s.equals("0")) {
      return Duration.ZERO;
    }
    if (s.isEmpty()) {
      throw invalid(value, "no value");
    }

    BigDecimal nanos = BigDecimal.ZERO;
    int i = 0;
    while (i < s.length()) {
      final int numberStart = i;
      while (i < s.length() && isNumberChar(s.charAt(i))) {
        i++;
      }
      final String number = s.substring(numberStart, i);
      final int unitStart = i;
      while (i < s.length() && !isNumberChar(s.charAt(i))) {
        i++;
      }
      final String unit = s.substring(unitStart, i);
      if (number.isEmpty() || number.equals(".")) {
        throw invalid(value, "expected a number before '" + unit + "'");
      }
      if (unit.isEmpty()) {
        throw invalid(value, "missing unit after " + number);
      }
      final Long unitNanos = UNIT_NANOS.get(unit);
      if (unitNanos == null) {
        throw invalid(value, "unknown unit '" + unit + "'");
      }
      try {
        nanos = nanos.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unitNanos)));
      } catch (final NumberFormatException e) {
        throw invalid(value, "bad number " + number);
      }
    }
    try {
      final long total = nanos.setScale(0, RoundingMode.DOWN).longValueExact();
      return Duration.ofNanos(negative ? -total : total);
    } catch (final ArithmeticException e) {
      throw invalid(value, "out of range");
    }
  }

  /**
   * @throws IllegalArgumentException unless the value parses to a duration greater than zero
   */
  public static Duration parsePositive(final String name, final String value) {
    final Duration duration;
    try {
      duration = parse(value);
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("%s: %s", name, e.getMessage()), e);
    }
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(
          String.format("%s must be positive, got %s", name, value));
    }
    return duration;
  }

  private static boolean isNumberChar(final char c) {
    return (c >= '0' && c <= '9') || c == '.';
  }

  private static IllegalArgumentException invalid(final String value, final String reason) {
    return new IllegalArgumentException(
        String.format("invalid duration \"%s\": %s", value, reason));
  }
}
