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

import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.node.ExpressionTreeNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/** Parsed formula ready for evaluation. Instances are immutable and may be shared. */
public class CompiledExpression {

  private final String source;
  private final ExpressionTreeNode root;
  private final Set<String> referencedFields;
  private final long timeoutNanos;

  CompiledExpression(String source, ExpressionTreeNode root, long timeoutMillis) {
    this.source = source;
    this.root = root;
    final var fields = new LinkedHashSet<String>();
    root.collectFieldNames(fields);
    this.referencedFields = Collections.unmodifiableSet(fields);
    this.timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
  }

  public String getSource() {
    return source;
  }

  /** Names of the fields the formula refers to, in order of appearance. */
  public Set<String> getReferencedFields() {
    return referencedFields;
  }

  /**
   * Evaluates the formula.
   *
   * @param fields Values of the fields the formula may refer to
   * @return Computed value, which may be infinite or NaN on division by zero
   * @throws ExpressionException when a referenced field is missing or not numeric, or when the
   *     evaluation takes longer than the configured timeout
   */
  public double evaluate(Map<String, ?> fields) throws ExpressionException {
    final long start = System.nanoTime();
    final double result = root.evaluate(fields);
    final long elapsed = System.nanoTime() - start;
    if (timeoutNanos > 0 && elapsed > timeoutNanos) {
      final var e = new ExpressionException(
          String.format("evaluation of '%s' took %d ms", source,
              TimeUnit.NANOSECONDS.toMillis(elapsed)));
      e.setInternalMessage(PipelineError.TIMEOUT.getErrorCode());
      throw e;
    }
    return result;
  }

  @Override
  public String toString() {
    return root.printTree();
  }
}
