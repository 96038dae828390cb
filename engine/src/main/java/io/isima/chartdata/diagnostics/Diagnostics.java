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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects diagnostics of one computation.
 *
 * <p>Identical diagnostics are merged and counted, so a formula that fails on every row is
 * reported once.
 */
public class Diagnostics {

  private final Map<Diagnostic, Integer> entries = new LinkedHashMap<>();

  public void report(DiagnosticKind kind, String subject, String message) {
    report(new Diagnostic(kind, subject, message));
  }

  public synchronized void report(Diagnostic diagnostic) {
    entries.merge(diagnostic, 1, Integer::sum);
  }

  public synchronized List<Diagnostic> getDiagnostics() {
    return new ArrayList<>(entries.keySet());
  }

  public synchronized int getOccurrences(Diagnostic diagnostic) {
    return entries.getOrDefault(diagnostic, 0);
  }

  public synchronized boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Sends the collected diagnostics to the listener and clears the collector. */
  public void flush(DiagnosticsListener listener) {
    final Map<Diagnostic, Integer> snapshot;
    synchronized (this) {
      snapshot = new LinkedHashMap<>(entries);
      entries.clear();
    }
    if (listener != null) {
      snapshot.forEach(listener::onDiagnostic);
    }
  }
}
