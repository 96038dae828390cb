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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import org.junit.Test;

public class ValueUtilsTest {

  @Test
  public void testNormalizeKey() {
    assertEquals(3L, ValueUtils.normalizeKey(3));
    assertEquals(3L, ValueUtils.normalizeKey(3.0));
    assertEquals(3.5, ValueUtils.normalizeKey(3.5));
    assertEquals(ValueUtils.normalizeKey(7), ValueUtils.normalizeKey(7L));
    assertEquals(
        Instant.parse("2024-03-01T00:00:00Z"), ValueUtils.normalizeKey(LocalDate.of(2024, 3, 1)));
    assertEquals("North", ValueUtils.normalizeKey("North"));
    assertNull(ValueUtils.normalizeKey(null));
  }

  @Test
  public void testToDouble() {
    assertEquals(12.5, ValueUtils.toDoubleOrNull(" 12.5 "), 0.0);
    assertEquals(1.0, ValueUtils.toDoubleOrNull(true), 0.0);
    assertNull(ValueUtils.toDoubleOrNull("twelve"));
    assertNull(ValueUtils.toDoubleOrNull(""));
    assertNull(ValueUtils.toDoubleOrNull(null));
  }

  @Test
  public void testToInstant() {
    final Instant expected = Instant.parse("2024-01-15T10:00:00Z");
    assertEquals(expected, ValueUtils.toInstantOrNull("2024-01-15T10:00:00Z"));
    assertEquals(expected, ValueUtils.toInstantOrNull("2024-01-15T12:00:00+02:00"));
    assertEquals(expected, ValueUtils.toInstantOrNull("2024-01-15T10:00:00"));
    assertEquals(expected, ValueUtils.toInstantOrNull(Date.from(expected)));
    assertEquals(
        Instant.parse("2024-01-15T00:00:00Z"), ValueUtils.toInstantOrNull("2024-01-15"));
    assertNull(ValueUtils.toInstantOrNull("North"));
    assertNull(ValueUtils.toInstantOrNull("20240115"));
    assertNull(ValueUtils.toInstantOrNull(20240115));
  }

  @Test
  public void testCompare() {
    assertTrue(ValueUtils.compare(2, 10) < 0);
    assertTrue(ValueUtils.compare("2", 10) < 0);
    assertTrue(ValueUtils.compare("2", "10") < 0);
    assertTrue(ValueUtils.compare(LocalDate.of(2024, 1, 2), "2024-01-01T12:00:00Z") > 0);
    assertTrue(ValueUtils.compare(false, true) < 0);
    assertEquals(0, ValueUtils.compare(1.0, 1L));
  }

  @Test
  public void testLooseEquals() {
    assertTrue(ValueUtils.looseEquals(1000, "1000"));
    assertTrue(ValueUtils.looseEquals(2L, 2.0));
    assertTrue(ValueUtils.looseEquals("North", "North"));
    assertFalse(ValueUtils.looseEquals("North", "north"));
    assertFalse(ValueUtils.looseEquals(1, "one"));
    assertFalse(ValueUtils.looseEquals(true, 1));
  }

  @Test
  public void testCompareRanksKinds() {
    // numbers, then dates, then booleans, then other values
    assertTrue(ValueUtils.compare(10, "9") > 0);
    assertTrue(ValueUtils.compare("9", "100x") < 0);
    assertTrue(ValueUtils.compare(10, "100x") < 0);
    assertTrue(ValueUtils.compare(1e12, LocalDate.of(1970, 1, 1)) < 0);
    assertTrue(ValueUtils.compare("2024-01-15", false) < 0);
    assertTrue(ValueUtils.compare(true, "N/A") < 0);
    assertTrue(ValueUtils.compare("N/A", 5) > 0);
    assertEquals(0, ValueUtils.compare("N/A", "N/A"));
  }
}
