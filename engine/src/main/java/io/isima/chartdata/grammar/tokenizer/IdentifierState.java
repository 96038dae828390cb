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

import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.tokenizer.TokenizerUtils.CharClass;
import java.util.List;

/**
 * This class denotes the identifier state in tokenizer DFA. It has below behavior 1) Transition to
 * itself on letters, digits and underscores 2) Throw ExpressionException on a dot since member
 * access is not part of the grammar 3) Otherwise push an identifier token and hand the character
 * over to a new StartState
 */
public class IdentifierState implements TokenizerState {
  private final List<Token> currentTokenList;
  private final StringBuilder currentTokenString;

  public IdentifierState(List<Token> currentTokenList, StringBuilder currentTokenString) {
    this.currentTokenString = currentTokenString;
    this.currentTokenList = currentTokenList;
  }

  @Override
  public TokenizerState consumeChar(char nextChar) throws ExpressionException {
    final CharClass charClass = TokenizerUtils.getCharClass(nextChar);
    switch (charClass) {
      case LETTER:
      case DIGIT:
      case UNDERSCORE:
        currentTokenString.append(nextChar);
        return this;
      case DOT:
        throw new ExpressionException(
            "member access is not allowed: " + currentTokenString.toString() + nextChar);
      default:
        terminate();
        return new StartState(currentTokenList).consumeChar(nextChar);
    }
  }

  @Override
  public void terminate() {
    currentTokenList.add(new Token(TokenType.IDENTIFIER, currentTokenString.toString()));
  }
}
