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
package io.isima.chartdata.grammar.tokenizer;

public enum TokenType {
  // Numeric literal - for example 12, 0.5, .25
  NUMBER,

  // Field reference - for example total_revenue
  IDENTIFIER,

  // Arithmetic operator - one of + - * /
  OPERATOR,

  // Opening Parenthesis - (
  PARENTHESIS_OPEN,

  // Closing parenthesis - )
  PARENTHESIS_CLOSE
}
