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
 * This class denotes the start state in tokenizer DFA. It has below behavior 1) Transition to
 * NumberState on a digit or a dot 2) Transition to IdentifierState on a letter or an underscore 3)
 * Emit operator and parenthesis tokens and stay in this state 4) Skip whitespaces 5) Throw
 * ExpressionException on invalid character
 */
public class StartState implements TokenizerState {
  private final List<Token> currentTokenList;

  public StartState(List<Token> tokenList) {
    this.currentTokenList = tokenList;
  }

  @Override
  public TokenizerState consumeChar(char nextChar) throws ExpressionException {
    final CharClass charClass = TokenizerUtils.getCharClass(nextChar);
    switch (charClass) {
      case DIGIT:
      case DOT:
        return new NumberState(currentTokenList, new StringBuilder().append(nextChar));
      case LETTER:
      case UNDERSCORE:
        return new IdentifierState(currentTokenList, new StringBuilder().append(nextChar));
      case OPERATOR:
        currentTokenList.add(new Token(TokenType.OPERATOR, String.valueOf(nextChar)));
        return this;
      case PARENTHESIS_OPEN:
        currentTokenList.add(new Token(TokenType.PARENTHESIS_OPEN, "("));
        return this;
      case PARENTHESIS_CLOSE:
        currentTokenList.add(new Token(TokenType.PARENTHESIS_CLOSE, ")"));
        return this;
      case SPACE:
        return this;
      default:
        throw new ExpressionException("invalid character: <" + nextChar + ">");
    }
  }

  @Override
  public void terminate() {
    // Do nothing, it is a no-op
  }
}
