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

/** Kinds of non-fatal issues reported while computing a pipeline. */
public enum DiagnosticKind {
  /** A filter rule refers to neither a dimension nor a measure. Applied before grouping. */
  UNKNOWN_FILTER_FIELD,
  /** A filter rule has an operator the engine does not know. The rule passes every row. */
  UNKNOWN_OPERATOR,
  /** A filter rule value does not fit its operator. The rule passes every row. */
  INVALID_FILTER_VALUE,
  /** A calculated measure could not be computed. The value is set to null. */
  EXPRESSION_FAILURE,
  /** A computed dimension could not be computed. The value is set to null. */
  DIMENSION_FAILURE,
}
