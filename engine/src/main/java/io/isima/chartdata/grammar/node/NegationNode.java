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
package io.isima.chartdata.grammar.node;

import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.tokenizer.Token;
import java.util.Map;

/** Unary minus. The operand is kept as the left child. */
public class NegationNode extends ExpressionTreeNode {

  public NegationNode(Token token, ExpressionTreeNode operand) {
    super(token);
    setLeftChild(operand);
  }

  @Override
  public double evaluate(Map<String, ?> fields) throws ExpressionException {
    return -left.evaluate(fields);
  }
}
