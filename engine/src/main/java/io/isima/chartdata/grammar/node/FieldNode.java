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
import io.isima.chartdata.grammar.utils.ComputationUtil;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FieldNode extends ExpressionTreeNode {

  private static final Logger logger = LoggerFactory.getLogger(FieldNode.class);

  public FieldNode(Token token) {
    super(token);
  }

  public String getFieldName() {
    return token.getContent();
  }

  @Override
  public double evaluate(Map<String, ?> fields) throws ExpressionException {
    final String fieldName = token.getContent();
    if (!fields.containsKey(fieldName)) {
      logger.trace("No value found for field {}", fieldName);
      throw new ExpressionException("unknown field: " + fieldName);
    }
    final Object value = fields.get(fieldName);
    logger.trace("Got value {} for field {}", value, fieldName);
    return ComputationUtil.getValueAsDouble(fieldName, value);
  }

  @Override
  public void collectFieldNames(Set<String> names) {
    names.add(token.getContent());
  }
}
