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

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.models.Combinator;
import io.isima.chartdata.models.FilterOperator;
import io.isima.chartdata.models.FilterRule;
import io.isima.chartdata.models.FilterTree;
import io.isima.chartdata.query.ValueUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies filter trees to rows.
 *
 * <p>A missing field reads as null. Every comparison with a null field value is false except for
 * {@code is-null} and {@code is-not-null}. A rule whose operator is unknown or whose value does
 * not fit the operator matches every row and is reported as a diagnostic.
 */
public class FilterEngine {
  private static final Logger logger = LoggerFactory.getLogger(FilterEngine.class);

  public static <T extends Map<String, ?>> List<T> apply(
      List<T> rows, FilterTree tree, Diagnostics diagnostics) {
    if (tree == null || tree.getRules() == null || tree.getRules().isEmpty()) {
      return rows;
    }
    final Predicate<Map<String, ?>> predicate = compile(tree, diagnostics);
    final var result = new ArrayList<T>();
    for (var row : rows) {
      if (predicate.test(row)) {
        result.add(row);
      }
    }
    logger.trace("Filter {} kept {} of {} rows", tree, result.size(), rows.size());
    return result;
  }

  /** Builds a row predicate from a filter tree. A null or empty tree matches every row. */
  public static Predicate<Map<String, ?>> compile(FilterTree tree, Diagnostics diagnostics) {
    if (tree == null || tree.getRules() == null || tree.getRules().isEmpty()) {
      return (row) -> true;
    }
    final List<Predicate<Map<String, ?>>> predicates = new ArrayList<>();
    for (var rule : tree.getRules()) {
      if (rule != null) {
        predicates.add(compileRule(rule, diagnostics));
      }
    }
    if (tree.getCombinator() == Combinator.OR) {
      return (row) -> predicates.stream().anyMatch((p) -> p.test(row));
    }
    return (row) -> predicates.stream().allMatch((p) -> p.test(row));
  }

  static Predicate<Map<String, ?>> compileRule(FilterRule rule, Diagnostics diagnostics) {
    final String field = rule.getField();
    final FilterOperator operator = FilterOperator.forValue(rule.getOperator());
    if (operator == null) {
      report(diagnostics, DiagnosticKind.UNKNOWN_OPERATOR, field,
          "unknown operator '" + rule.getOperator() + "'; the rule matches every row");
      return (row) -> true;
    }
    final Object expected = rule.getValue();
    if (operator.isNullCheck()) {
      final boolean wantNull = operator == FilterOperator.IS_NULL;
      return (row) -> (row.get(field) == null) == wantNull;
    }

    final Predicate<Object> test;
    switch (operator) {
      case EQUAL:
        test = (value) -> expected != null && ValueUtils.looseEquals(value, expected);
        break;
      case NOT_EQUAL:
        test = (value) -> expected != null && !ValueUtils.looseEquals(value, expected);
        break;
      case LESS_THAN:
        test = (value) -> expected != null && ValueUtils.compare(value, expected) < 0;
        break;
      case GREATER_THAN:
        test = (value) -> expected != null && ValueUtils.compare(value, expected) > 0;
        break;
      case LESS_THAN_EQUAL:
        test = (value) -> expected != null && ValueUtils.compare(value, expected) <= 0;
        break;
      case GREATER_THAN_EQUAL:
        test = (value) -> expected != null && ValueUtils.compare(value, expected) >= 0;
        break;
      case IN:
      case NOT_IN:
        {
          if (!(expected instanceof Collection)) {
            return invalidValue(diagnostics, rule, "a list value is required");
          }
          final List<?> candidates =
              ((Collection<?>) expected)
                  .stream().filter((c) -> c != null).collect(Collectors.toList());
          final boolean negate = operator == FilterOperator.NOT_IN;
          test =
              (value) ->
                  candidates.stream().anyMatch((c) -> ValueUtils.looseEquals(value, c)) != negate;
          break;
        }
      case BETWEEN:
        {
          if (!(expected instanceof List) || ((List<?>) expected).size() != 2
              || ((List<?>) expected).contains(null)) {
            return invalidValue(diagnostics, rule, "a list of two non-null bounds is required");
          }
          final Object lower = ((List<?>) expected).get(0);
          final Object upper = ((List<?>) expected).get(1);
          test =
              (value) ->
                  ValueUtils.compare(value, lower) >= 0 && ValueUtils.compare(value, upper) <= 0;
          break;
        }
      case CONTAINS:
        test = (value) -> expected != null && value.toString().contains(expected.toString());
        break;
      case NOT_CONTAINS:
        test = (value) -> expected != null && !value.toString().contains(expected.toString());
        break;
      case STARTS_WITH:
        test = (value) -> expected != null && value.toString().startsWith(expected.toString());
        break;
      case ENDS_WITH:
        test = (value) -> expected != null && value.toString().endsWith(expected.toString());
        break;
      case LIKE:
        {
          if (expected == null) {
            return invalidValue(diagnostics, rule, "a pattern is required");
          }
          final Pattern pattern = likeToPattern(expected.toString());
          test = (value) -> pattern.matcher(value.toString()).matches();
          break;
        }
      default:
        report(diagnostics, DiagnosticKind.UNKNOWN_OPERATOR, field,
            "unsupported operator '" + rule.getOperator() + "'; the rule matches every row");
        return (row) -> true;
    }
    return (row) -> {
      final Object value = row.get(field);
      return value != null && test.test(value);
    };
  }

  /** Converts an SQL LIKE pattern, with % and _ wildcards, to a regular expression. */
  static Pattern likeToPattern(String like) {
    final var sb = new StringBuilder();
    final var literal = new StringBuilder();
    for (char ch : like.toCharArray()) {
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          sb.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        sb.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) {
      sb.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(sb.toString(), Pattern.DOTALL);
  }

  private static Predicate<Map<String, ?>> invalidValue(
      Diagnostics diagnostics, FilterRule rule, String reason) {
    report(diagnostics, DiagnosticKind.INVALID_FILTER_VALUE, rule.getField(),
        String.format("invalid value %s for operator '%s': %s; the rule matches every row",
            rule.getValue(), rule.getOperator(), reason));
    return (row) -> true;
  }

  private static void report(
      Diagnostics diagnostics, DiagnosticKind kind, String subject, String message) {
    if (diagnostics != null) {
      diagnostics.report(kind, subject, message);
    }
  }
}
