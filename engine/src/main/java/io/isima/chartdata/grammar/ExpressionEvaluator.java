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
package io.isima.chartdata.grammar;

import com.google.common.base.Preconditions;
import com.googlecode.concurrentlinkedhashmap.ConcurrentLinkedHashMap;
import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.parser.ExpressionParser;
import io.isima.chartdata.grammar.tokenizer.TokenizerUtils;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles arithmetic formulas and evaluates them against named numeric fields.
 *
 * <p>Compiled expressions are kept in a bounded map keyed by the formula text. The evaluator is
 * thread safe.
 */
public class ExpressionEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

  private static final int COMPILED_CACHE_CAPACITY = 1024;

  private final int maxLength;
  private final int maxDepth;
  private final long timeoutMillis;

  private final Map<String, CompiledExpression> compiled;

  public ExpressionEvaluator(int maxLength, int maxDepth, long timeoutMillis) {
    Preconditions.checkArgument(maxLength > 0, "maxLength must be positive");
    Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive");
    this.maxLength = maxLength;
    this.maxDepth = maxDepth;
    this.timeoutMillis = timeoutMillis;
    compiled =
        new ConcurrentLinkedHashMap.Builder<String, CompiledExpression>()
            .maximumWeightedCapacity(COMPILED_CACHE_CAPACITY)
            .build();
  }

  /**
   * Validates and parses a formula.
   *
   * @throws ExpressionException when the formula is blank, too long, contains a character outside
   *     the allowed set, or does not parse
   */
  public CompiledExpression compile(String expression) throws ExpressionException {
    if (expression != null) {
      final var cached = compiled.get(expression);
      if (cached != null) {
        return cached;
      }
    }
    validate(expression);
    final var root = new ExpressionParser(maxDepth).processExpression(expression);
    final var result = new CompiledExpression(expression, root, timeoutMillis);
    logger.trace("Compiled expression '{}' -> {}", expression, result);
    compiled.put(expression, result);
    return result;
  }

  public double evaluate(String expression, Map<String, ?> fields) throws ExpressionException {
    return compile(expression).evaluate(fields);
  }

  private void validate(String expression) throws ExpressionException {
    if (StringUtils.isBlank(expression)) {
      throw new ExpressionException("expression must not be empty");
    }
    if (expression.length() > maxLength) {
      throw new ExpressionException(
          String.format(
              "expression is too long; length=%d, limit=%d", expression.length(), maxLength));
    }
    final int index = TokenizerUtils.findDisallowedCharacter(expression);
    if (index >= 0) {
      throw new ExpressionException(
          String.format(
              "disallowed character '%c' at position %d", expression.charAt(index), index));
    }
  }
}
