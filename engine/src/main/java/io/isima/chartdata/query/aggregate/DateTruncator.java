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
package io.isima.chartdata.query.aggregate;

import io.isima.chartdata.models.DimensionTransform;
import io.isima.chartdata.query.ValueUtils;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/** Truncates date values to calendar periods in UTC. Weeks start on Monday. */
public class DateTruncator {

  /**
   * Truncates a date value.
   *
   * @param value A date object or an ISO-8601 string
   * @param transform The period to truncate to
   * @return Start of the period, or null if the value is not a date
   */
  public static Instant truncate(Object value, DimensionTransform transform) {
    final Instant instant = ValueUtils.toInstantOrNull(value);
    if (instant == null) {
      return null;
    }
    final ZonedDateTime time = instant.atZone(ZoneOffset.UTC);
    final ZonedDateTime day = time.truncatedTo(ChronoUnit.DAYS);
    switch (transform) {
      case YEAR:
        return day.withDayOfYear(1).toInstant();
      case QUARTER:
        final int firstMonth = ((time.getMonthValue() - 1) / 3) * 3 + 1;
        return day.withDayOfMonth(1).withMonth(firstMonth).toInstant();
      case MONTH:
        return day.withDayOfMonth(1).toInstant();
      case WEEK:
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
      case DAY:
        return day.toInstant();
      case HOUR:
        return time.truncatedTo(ChronoUnit.HOURS).toInstant();
      default:
        throw new UnsupportedOperationException("Unsupported transform " + transform);
    }
  }
}
