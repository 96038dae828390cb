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
 * This class denotes the number state in tokenizer DFA. It has below behavior 1) Transition to
 * itself on a digit, or on the first dot 2) Throw ExpressionException on a second dot or on a
 * letter or underscore directly following the number 3) Otherwise push a number token and hand the
 * character over to a new StartState
 */
public class NumberState implements TokenizerState {
  private final List<Token> tokenList;
  private final StringBuilder currentTokenString;
  private boolean hasDot;

  public NumberState(List<Token> tokenList, StringBuilder currentTokenString) {
    this.tokenList = tokenList;
    this.currentTokenString = currentTokenString;
    this.hasDot = currentTokenString.indexOf(".") >= 0;
  }

  @Override
  public TokenizerState consumeChar(char nextChar) throws ExpressionException {
    final CharClass charClass = TokenizerUtils.getCharClass(nextChar);
    switch (charClass) {
      case DIGIT:
        currentTokenString.append(nextChar);
        return this;
      case DOT:
        if (hasDot) {
          throw new ExpressionException(
              "malformed number: " + currentTokenString.toString() + nextChar);
        }
        hasDot = true;
        currentTokenString.append(nextChar);
        return this;
      case LETTER:
      case UNDERSCORE:
        throw new ExpressionException(
            "unexpected character after number: " + currentTokenString.toString() + nextChar);
      default:
        terminate();
        return new StartState(tokenList).consumeChar(nextChar);
    }
  }

  @Override
  public void terminate() throws ExpressionException {
    final String tokenString = currentTokenString.toString();
    if (tokenString.equals(".")) {
      throw new ExpressionException("malformed number: " + tokenString);
    }
    tokenList.add(new Token(TokenType.NUMBER, tokenString));
  }
}
