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
package io.isima.chartdata.query.measure;

import io.isima.chartdata.grammar.CompiledExpression;
import lombok.Getter;
import lombok.ToString;

/**
 * A measure computed from dimensions and measures declared before it.
 *
 * <p>When the formula does not compile, the measure keeps the error message instead of a compiled
 * expression and produces null on every row.
 */
@Getter
@ToString
public class CalculatedMeasure extends CompiledMeasure {
  private final String expressionSource;
  private final CompiledExpression expression;
  private final String compileError;

  public CalculatedMeasure(String name, String expressionSource, CompiledExpression expression) {
    super(name);
    this.expressionSource = expressionSource;
    this.expression = expression;
    this.compileError = null;
  }

  public CalculatedMeasure(String name, String expressionSource, String compileError) {
    super(name);
    this.expressionSource = expressionSource;
    this.expression = null;
    this.compileError = compileError;
  }

  @Override
  public boolean isCalculated() {
    return true;
  }
}
