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
package io.isima.chartdata.grammar.parser;

import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.node.BinaryOperationNode;
import io.isima.chartdata.grammar.node.ExpressionTreeNode;
import io.isima.chartdata.grammar.node.FieldNode;
import io.isima.chartdata.grammar.node.NegationNode;
import io.isima.chartdata.grammar.node.NumberNode;
import io.isima.chartdata.grammar.tokenizer.Token;
import io.isima.chartdata.grammar.tokenizer.TokenType;
import io.isima.chartdata.grammar.tokenizer.Tokenizer;
import java.util.List;

/**
 * Recursive descent parser for calculated measure formulas.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | primary
 * primary    := NUMBER | IDENTIFIER | '(' expression ')'
 * </pre>
 *
 * <p>Binary operators are left associative. Nesting of parentheses and unary minus is limited by
 * the max depth given to the constructor. An instance keeps the parse position, so it must not be
 * shared between threads.
 */
public class ExpressionParser {

  private final int maxDepth;

  private List<Token> tokens;
  private int position;
  private int depth;

  public ExpressionParser(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /**
   * Tokenizes and parses an expression.
   *
   * @param expression The source formula
   * @return Root of the expression tree
   * @throws ExpressionException when the formula is not valid
   */
  public ExpressionTreeNode processExpression(String expression) throws ExpressionException {
    return parse(Tokenizer.tokenize(expression));
  }

  public ExpressionTreeNode parse(List<Token> tokens) throws ExpressionException {
    this.tokens = tokens;
    position = 0;
    depth = 0;
    if (tokens.isEmpty()) {
      throw new ExpressionException("empty expression");
    }
    final var root = parseExpression();
    if (position < tokens.size()) {
      throw new ExpressionException("unexpected token " + tokens.get(position).getContent());
    }
    return root;
  }

  private ExpressionTreeNode parseExpression() throws ExpressionException {
    var node = parseTerm();
    while (isOperator("+") || isOperator("-")) {
      final var operator = next();
      node = new BinaryOperationNode(operator, node, parseTerm());
    }
    return node;
  }

  private ExpressionTreeNode parseTerm() throws ExpressionException {
    var node = parseUnary();
    while (isOperator("*") || isOperator("/")) {
      final var operator = next();
      node = new BinaryOperationNode(operator, node, parseUnary());
    }
    return node;
  }

  private ExpressionTreeNode parseUnary() throws ExpressionException {
    if (isOperator("-")) {
      final var operator = next();
      enter();
      final var operand = parseUnary();
      --depth;
      return new NegationNode(operator, operand);
    }
    return parsePrimary();
  }

  private ExpressionTreeNode parsePrimary() throws ExpressionException {
    if (position >= tokens.size()) {
      throw new ExpressionException("unexpected end of expression");
    }
    final var token = next();
    switch (token.getType()) {
      case NUMBER:
        return new NumberNode(token);
      case IDENTIFIER:
        return new FieldNode(token);
      case PARENTHESIS_OPEN:
        enter();
        final var inner = parseExpression();
        if (position >= tokens.size()
            || tokens.get(position).getType() != TokenType.PARENTHESIS_CLOSE) {
          throw new ExpressionException("missing closing parenthesis");
        }
        ++position;
        --depth;
        return inner;
      default:
        throw new ExpressionException("unexpected token " + token.getContent());
    }
  }

  private void enter() throws ExpressionException {
    if (++depth > maxDepth) {
      throw new ExpressionException("expression is nested too deeply; limit=" + maxDepth);
    }
  }

  private boolean isOperator(String symbol) {
    if (position >= tokens.size()) {
      return false;
    }
    final var token = tokens.get(position);
    return token.getType() == TokenType.OPERATOR && token.getContent().equals(symbol);
  }

  private Token next() {
    return tokens.get(position++);
  }
}
