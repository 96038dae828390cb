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
import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class TokenizerTest {

  @Test
  public void testTokenizationForValidExpressions() throws Exception {
    String[] validExpressions =
        new String[] {
          "1",
          "1.5",
          ".5",
          "revenue",
          "_private",
          "total_revenue2",
          "revenue - cost",
          "(revenue-cost)/revenue",
          "  -a * ( b + 3 )  ",
          "((((a))))",
        };
    for (String expression : validExpressions) {
      final var tokens = Tokenizer.tokenize(expression);
      Assert.assertFalse(expression, tokens.isEmpty());
    }
  }

  @Test
  public void testTokens() throws Exception {
    final List<Token> tokens = Tokenizer.tokenize("(revenue - 1.5)*cost_2");
    Assert.assertEquals(
        List.of(
            new Token(TokenType.PARENTHESIS_OPEN, "("),
            new Token(TokenType.IDENTIFIER, "revenue"),
            new Token(TokenType.OPERATOR, "-"),
            new Token(TokenType.NUMBER, "1.5"),
            new Token(TokenType.PARENTHESIS_CLOSE, ")"),
            new Token(TokenType.OPERATOR, "*"),
            new Token(TokenType.IDENTIFIER, "cost_2")),
        tokens);
  }

  @Test
  public void testTokenizationForInvalidExpressions() {
    String[] invalidExpressions =
        new String[] {
          "1..2", "1.2.3", "a.b", "12abc", ".", "a > b", "'text'", "a; b", "f[0]",
        };
    for (String expression : invalidExpressions) {
      try {
        Tokenizer.tokenize(expression);
        Assert.fail("exception is expected for " + expression);
      } catch (ExpressionException e) {
        Assert.assertNotNull(e.getMessage());
      }
    }
  }

  @Test
  public void testWhitespaceOnly() throws Exception {
    Assert.assertTrue(Tokenizer.tokenize("   ").isEmpty());
  }
}
