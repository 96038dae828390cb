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
package io.isima.chartdata.diagnostics;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class DiagnosticsTest {

  @Test
  public void testDuplicatesAreCounted() {
    final var diagnostics = new Diagnostics();
    for (int i = 0; i < 10000; ++i) {
      diagnostics.report(DiagnosticKind.EXPRESSION_FAILURE, "margin", "field cost is null");
    }
    diagnostics.report(DiagnosticKind.UNKNOWN_FILTER_FIELD, "colour", "unknown");
    diagnostics.report(DiagnosticKind.EXPRESSION_FAILURE, "margin", "field cost is not numeric");

    final var margin =
        new Diagnostic(DiagnosticKind.EXPRESSION_FAILURE, "margin", "field cost is null");
    assertEquals(3, diagnostics.getDiagnostics().size());
    assertEquals(margin, diagnostics.getDiagnostics().get(0));
    assertEquals(10000, diagnostics.getOccurrences(margin));
  }

  @Test
  public void testFlush() {
    final var diagnostics = new Diagnostics();
    diagnostics.report(DiagnosticKind.UNKNOWN_OPERATOR, "region", "unknown operator: ~");
    diagnostics.report(DiagnosticKind.UNKNOWN_OPERATOR, "region", "unknown operator: ~");

    final List<Integer> counts = new ArrayList<>();
    diagnostics.flush((diagnostic, occurrences) -> counts.add(occurrences));
    assertThat(counts, contains(2));
    assertTrue(diagnostics.isEmpty());

    // the default listener only logs
    diagnostics.report(DiagnosticKind.DIMENSION_FAILURE, "month", "field date is not a date");
    diagnostics.flush(new LoggingDiagnosticsListener());
    assertTrue(diagnostics.isEmpty());
  }
}
