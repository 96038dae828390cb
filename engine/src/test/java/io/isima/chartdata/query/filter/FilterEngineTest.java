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
package io.isima.chartdata.query.filter;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.models.FilterRule;
import io.isima.chartdata.models.FilterTree;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;

public class FilterEngineTest {

  private List<Map<String, Object>> input;
  private Diagnostics diagnostics;

  private static Map<String, Object> row(String name, Object region, Object revenue) {
    final Map<String, Object> row = new HashMap<>();
    row.put("name", name);
    row.put("region", region);
    row.put("revenue", revenue);
    return row;
  }

  @Before
  public void setUp() {
    input = new ArrayList<>();
    input.add(row("a", "North", 1000));
    input.add(row("b", "North", 1500.5));
    input.add(row("c", "South", "1200"));
    input.add(row("d", null, null));
    input.add(row("e", "North East", 700L));
    diagnostics = new Diagnostics();
  }

  private List<Object> names(FilterRule... rules) {
    return names(FilterTree.and(rules));
  }

  private List<Object> names(FilterTree tree) {
    return FilterEngine.apply(input, tree, diagnostics).stream()
        .map((row) -> row.get("name"))
        .collect(Collectors.toList());
  }

  @Test
  public void testEquality() {
    assertThat(names(new FilterRule("region", "=", "North")), contains("a", "b"));
    assertThat(names(new FilterRule("region", "==", "South")), contains("c"));
    assertThat(names(new FilterRule("revenue", "=", 1200)), contains("c"));
    // null fields never match
    assertThat(names(new FilterRule("region", "!=", "North")), contains("c", "e"));
  }

  @Test
  public void testComparison() {
    assertThat(names(new FilterRule("revenue", ">", 1000)), contains("b", "c"));
    assertThat(names(new FilterRule("revenue", ">=", 1000)), contains("a", "b", "c"));
    assertThat(names(new FilterRule("revenue", "<", 1000)), contains("e"));
    assertThat(names(new FilterRule("revenue", "<=", 700)), contains("e"));
  }

  @Test
  public void testNullChecks() {
    assertThat(names(new FilterRule("region", "is-null", null)), contains("d"));
    assertThat(
        names(new FilterRule("missing", "is null", null)), contains("a", "b", "c", "d", "e"));
    assertThat(names(new FilterRule("region", "is not null", null)), contains("a", "b", "c", "e"));
  }

  @Test
  public void testNullValueInRuleMatchesNothing() {
    assertThat(names(new FilterRule("region", "=", null)), is(empty()));
  }

  @Test
  public void testSetOperators() {
    assertThat(names(new FilterRule("region", "in", List.of("North", "South"))),
        contains("a", "b", "c"));
    assertThat(names(new FilterRule("region", "not-in", List.of("North"))), contains("c", "e"));
    assertThat(names(new FilterRule("revenue", "between", List.of(1000, 1300))),
        contains("a", "c"));
  }

  @Test
  public void testStringOperators() {
    assertThat(names(new FilterRule("region", "contains", "orth")), contains("a", "b", "e"));
    assertThat(names(new FilterRule("region", "not contains", "orth")), contains("c"));
    assertThat(names(new FilterRule("region", "starts-with", "North ")), contains("e"));
    assertThat(names(new FilterRule("region", "ends with", "th")), contains("a", "b", "c"));
    assertThat(names(new FilterRule("region", "like", "N%t_")), contains("a", "b"));
    assertThat(names(new FilterRule("region", "like", "%st")), contains("e"));
  }

  @Test
  public void testCombinators() {
    final var north = new FilterRule("region", "=", "North");
    final var big = new FilterRule("revenue", ">", 1100);
    assertThat(names(FilterTree.and(north, big)), contains("b"));
    assertThat(names(FilterTree.or(north, big)), contains("a", "b", "c"));
  }

  @Test
  public void testUnknownOperatorFailsOpen() {
    assertThat(names(new FilterRule("region", "approximately", "North")),
        contains("a", "b", "c", "d", "e"));
    final var reported = diagnostics.getDiagnostics();
    assertEquals(1, reported.size());
    assertThat(reported.get(0).getKind(), is(DiagnosticKind.UNKNOWN_OPERATOR));
    assertThat(reported.get(0).getSubject(), is("region"));
  }

  @Test
  public void testInvalidValueFailsOpen() {
    assertThat(names(new FilterRule("region", "in", "North")), contains("a", "b", "c", "d", "e"));
    assertThat(
        diagnostics.getDiagnostics().get(0).getKind(), is(DiagnosticKind.INVALID_FILTER_VALUE));
  }

  @Test
  public void testEmptyTreeKeepsEverything() {
    assertEquals(5, FilterEngine.apply(input, null, diagnostics).size());
    assertEquals(5, FilterEngine.apply(input, new FilterTree(), diagnostics).size());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  public void testDates() {
    final List<Map<String, Object>> rows = new ArrayList<>();
    final Map<String, Object> early = new HashMap<>();
    early.put("at", Instant.parse("2024-01-10T00:00:00Z"));
    rows.add(early);
    final Map<String, Object> late = new HashMap<>();
    late.put("at", "2024-03-01T12:00:00Z");
    rows.add(late);
    final var result =
        FilterEngine.apply(
            rows, FilterTree.and(new FilterRule("at", ">", "2024-02-01")), diagnostics);
    assertThat(result, contains(late));
  }

  @Test
  public void testLikePattern() {
    assertTrue(FilterEngine.likeToPattern("a.c%").matcher("a.cdef").matches());
    assertThat(FilterEngine.likeToPattern("a.c%").matcher("abcdef").matches(), is(false));
  }
}
