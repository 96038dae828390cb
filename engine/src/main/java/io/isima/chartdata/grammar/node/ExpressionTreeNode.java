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
import java.util.Set;

/**
 * Node of a parsed arithmetic expression.
 *
 * <p>Nodes are immutable once the parser has linked them, so a tree can be evaluated by multiple
 * threads at the same time.
 */
public abstract class ExpressionTreeNode {

  protected final Token token;
  protected ExpressionTreeNode left;
  protected ExpressionTreeNode right;

  public ExpressionTreeNode(Token token) {
    this.token = token;
    left = null;
    right = null;
  }

  public void setLeftChild(ExpressionTreeNode node) {
    this.left = node;
  }

  public void setRightChild(ExpressionTreeNode node) {
    this.right = node;
  }

  public Token getToken() {
    return token;
  }

  public ExpressionTreeNode getLeft() {
    return left;
  }

  public ExpressionTreeNode getRight() {
    return right;
  }

  /**
   * Evaluates the subtree rooted at this node.
   *
   * @param fields Values of the fields the expression may refer to
   * @return Computed value
   * @throws ExpressionException when a referenced field is missing or not numeric
   */
  public abstract double evaluate(Map<String, ?> fields) throws ExpressionException;

  /** Adds names of the fields referred in this subtree to the given set. */
  public void collectFieldNames(Set<String> names) {
    if (left != null) {
      left.collectFieldNames(names);
    }
    if (right != null) {
      right.collectFieldNames(names);
    }
  }

  public String printTree() {
    String delimiter = "";
    StringBuilder sb = new StringBuilder();
    if (left != null) {
      sb.append(left.printTree());
      delimiter = ".";
    }
    sb.append(delimiter).append(token.getContent());
    delimiter = ".";
    if (right != null) {
      sb.append(delimiter).append(right.printTree());
    }
    return sb.toString();
  }

  public int getHeight() {
    int leftSubtreeHeight = left == null ? 0 : left.getHeight();
    int rightSubtreeHeight = right == null ? 0 : right.getHeight();
    return Math.max(leftSubtreeHeight, rightSubtreeHeight) + 1;
  }

  public boolean isLeafNode() {
    return left == null && right == null;
  }
}
