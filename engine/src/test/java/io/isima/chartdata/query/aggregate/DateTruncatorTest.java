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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import io.isima.chartdata.models.DimensionTransform;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import org.junit.Test;

public class DateTruncatorTest {

  // Thursday
  private static final Instant TIME = Instant.parse("2024-08-15T13:45:30Z");

  @Test
  public void testTruncations() {
    assertEquals(
        Instant.parse("2024-01-01T00:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.YEAR));
    assertEquals(
        Instant.parse("2024-07-01T00:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.QUARTER));
    assertEquals(
        Instant.parse("2024-08-01T00:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.MONTH));
    assertEquals(
        Instant.parse("2024-08-12T00:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.WEEK));
    assertEquals(
        Instant.parse("2024-08-15T00:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.DAY));
    assertEquals(
        Instant.parse("2024-08-15T13:00:00Z"),
        DateTruncator.truncate(TIME, DimensionTransform.HOUR));
  }

  @Test
  public void testInputTypes() {
    final var expected = Instant.parse("2024-08-01T00:00:00Z");
    assertEquals(expected, DateTruncator.truncate(Date.from(TIME), DimensionTransform.MONTH));
    assertEquals(expected, DateTruncator.truncate("2024-08-15", DimensionTransform.MONTH));
    assertEquals(
        expected, DateTruncator.truncate("2024-08-15T10:00:00+09:00", DimensionTransform.MONTH));
    assertEquals(
        expected, DateTruncator.truncate(LocalDate.of(2024, 8, 31), DimensionTransform.MONTH));
  }

  @Test
  public void testWeekStartsOnMonday() {
    // Sunday belongs to the week that started six days before
    assertEquals(
        Instant.parse("2024-08-12T00:00:00Z"),
        DateTruncator.truncate("2024-08-18T23:59:59Z", DimensionTransform.WEEK));
    assertEquals(
        Instant.parse("2024-08-19T00:00:00Z"),
        DateTruncator.truncate("2024-08-19T00:00:00Z", DimensionTransform.WEEK));
  }

  @Test
  public void testNotADate() {
    assertNull(DateTruncator.truncate("north", DimensionTransform.DAY));
    assertNull(DateTruncator.truncate(12, DimensionTransform.DAY));
  }
}
