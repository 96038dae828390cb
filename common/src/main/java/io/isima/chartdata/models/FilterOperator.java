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
package io.isima.chartdata.models;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Operators that a filter rule may use.
 *
 * <p>Word operators are matched case insensitively and spaces or underscores are equivalent to
 * hyphens, so "not in", "NOT_IN" and "not-in" denote the same operator.
 */
public enum FilterOperator {
  EQUAL("=", "=="),
  NOT_EQUAL("!=", "<>"),
  LESS_THAN("<"),
  GREATER_THAN(">"),
  LESS_THAN_EQUAL("<="),
  GREATER_THAN_EQUAL(">="),
  IN("in"),
  NOT_IN("not-in"),
  CONTAINS("contains"),
  NOT_CONTAINS("not-contains"),
  STARTS_WITH("starts-with"),
  ENDS_WITH("ends-with"),
  LIKE("like"),
  BETWEEN("between"),
  IS_NULL("is-null"),
  IS_NOT_NULL("is-not-null");

  private final List<String> symbols;

  private static final Map<String, FilterOperator> bySymbol = createSymbolMap();

  FilterOperator(String... symbols) {
    this.symbols = List.of(symbols);
  }

  private static Map<String, FilterOperator> createSymbolMap() {
    final var map = new HashMap<String, FilterOperator>();
    for (final var value : values()) {
      value.symbols.forEach((symbol) -> map.put(symbol, value));
    }
    return map;
  }

  /**
   * Resolves an operator from its textual form.
   *
   * @param operator Operator text as written in a filter rule
   * @return The operator, or null if the text does not denote a known operator
   */
  public static FilterOperator forValue(String operator) {
    if (StringUtils.isBlank(operator)) {
      return null;
    }
    final String normalized = operator.trim().toLowerCase().replaceAll("[\\s_]+", "-");
    return bySymbol.get(normalized);
  }

  /** Returns true if the operator accepts a null field value as a possible match. */
  public boolean isNullCheck() {
    return this == IS_NULL || this == IS_NOT_NULL;
  }

  public String getSymbol() {
    return symbols.get(0);
  }
}
