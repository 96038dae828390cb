/*
 * Copyright (C) 2025 Isima, Inc.
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
package io.isima.chartdata.query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import org.apache.commons.lang3.StringUtils;

/** Conversions and comparisons of row values. */
public class ValueUtils {
  // kinds of values in comparison order
  private static final int RANK_NUMBER = 0;
  private static final int RANK_DATE = 1;
  private static final int RANK_BOOLEAN = 2;
  private static final int RANK_STRING = 3;

  /**
   * Normalizes a value for use as a part of a group key.
   *
   * <p>Integral numbers of any type become {@link Long}, other numbers become {@link Double} and
   * dates become {@link Instant}, so that values equal by number or by instant share a key.
   */
  public static Object normalizeKey(Object value) {
    if (value instanceof Number) {
      final var number = (Number) value;
      final double d = number.doubleValue();
      if (value instanceof Long || value instanceof Integer || value instanceof Short
          || value instanceof Byte) {
        return number.longValue();
      }
      if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
        return (long) d;
      }
      return d;
    }
    if (isTemporal(value)) {
      return toInstantOrNull(value);
    }
    return value;
  }

  public static boolean isTemporal(Object value) {
    return value instanceof Date
        || value instanceof Instant
        || value instanceof LocalDate
        || value instanceof LocalDateTime
        || value instanceof OffsetDateTime
        || value instanceof ZonedDateTime;
  }

  /**
   * Converts a value to double.
   *
   * @return The converted value, or null if the value is null or not numeric
   */
  public static Double toDoubleOrNull(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1.0 : 0.0;
    }
    if (value instanceof String) {
      final String src = ((String) value).trim();
      if (StringUtils.isEmpty(src)) {
        return null;
      }
      try {
        return Double.valueOf(src);
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /**
   * Converts a date value or an ISO-8601 string to an instant. Local dates and times are taken
   * as UTC.
   *
   * @return The instant, or null if the value is not a date
   */
  public static Instant toInstantOrNull(Object value) {
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof String) {
      return parseInstant(((String) value).trim());
    }
    return null;
  }

  private static Instant parseInstant(String src) {
    if (src.length() < 10 || !Character.isDigit(src.charAt(0))) {
      return null;
    }
    try {
      return OffsetDateTime.parse(src).toInstant();
    } catch (DateTimeParseException e) {
      // try the next format
    }
    try {
      return LocalDateTime.parse(src).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      // try the next format
    }
    try {
      return LocalDate.parse(src).atStartOfDay().toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * Compares two non-null values.
   *
   * <p>The order is total. Values are ranked by kind first: numbers, then dates, then booleans,
   * then everything else. A numeric string ranks as a number and an ISO-8601 date string ranks as
   * a date. Values of the same kind are compared numerically, by instant, as booleans, or by
   * string representation, respectively.
   */
  public static int compare(Object left, Object right) {
    final Object l = comparable(left);
    final Object r = comparable(right);
    final int rankDiff = Integer.compare(rank(l), rank(r));
    if (rankDiff != 0) {
      return rankDiff;
    }
    switch (rank(l)) {
      case RANK_NUMBER:
        return Double.compare((Double) l, (Double) r);
      case RANK_DATE:
        return ((Instant) l).compareTo((Instant) r);
      case RANK_BOOLEAN:
        return Boolean.compare((Boolean) l, (Boolean) r);
      default:
        return ((String) l).compareTo((String) r);
    }
  }

  // converts to Double, Instant, Boolean or String
  private static Object comparable(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return value;
    }
    if (isTemporal(value)) {
      return toInstantOrNull(value);
    }
    final String src = value.toString();
    if (value instanceof String) {
      final Double number = toDoubleOrNull(src);
      if (number != null) {
        return number;
      }
      final Instant instant = toInstantOrNull(src);
      if (instant != null) {
        return instant;
      }
    }
    return src;
  }

  private static int rank(Object comparable) {
    if (comparable instanceof Double) {
      return RANK_NUMBER;
    }
    if (comparable instanceof Instant) {
      return RANK_DATE;
    }
    if (comparable instanceof Boolean) {
      return RANK_BOOLEAN;
    }
    return RANK_STRING;
  }

  /** Tests equality of two non-null values with the conversions of {@link #compare}. */
  public static boolean looseEquals(Object left, Object right) {
    if (left.equals(right)) {
      return true;
    }
    return compare(left, right) == 0;
  }
}
