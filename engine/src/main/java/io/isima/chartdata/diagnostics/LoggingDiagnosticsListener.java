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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDiagnosticsListener implements DiagnosticsListener {
  private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticsListener.class);

  @Override
  public void onDiagnostic(Diagnostic diagnostic, int occurrences) {
    logger.warn(
        "{} on {}: {} (occurrences={})",
        diagnostic.getKind(),
        diagnostic.getSubject(),
        diagnostic.getMessage(),
        occurrences);
  }
}
