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

import java.util.Arrays;

/** This class has utility constants for tokenizer. */
public class TokenizerUtils {
  private static final CharClass[] CLASS_MAP;

  public static final char[] OPERATORS = new char[] {'+', '-', '*', '/'};

  /** Character classes recognized by the tokenizer states. */
  enum CharClass {
    DIGIT,
    LETTER,
    UNDERSCORE,
    DOT,
    OPERATOR,
    PARENTHESIS_OPEN,
    PARENTHESIS_CLOSE,
    SPACE,
    INVALID
  }

  static {
    CLASS_MAP = new CharClass[128];
    Arrays.fill(CLASS_MAP, CharClass.INVALID);
    for (char op : OPERATORS) {
      CLASS_MAP[op] = CharClass.OPERATOR;
    }
    CLASS_MAP[' '] = CharClass.SPACE;
    CLASS_MAP['\t'] = CharClass.SPACE;
    CLASS_MAP['\n'] = CharClass.SPACE;
    CLASS_MAP['\r'] = CharClass.SPACE;
    CLASS_MAP['\f'] = CharClass.SPACE;
    CLASS_MAP[0x0b] = CharClass.SPACE;
    CLASS_MAP['('] = CharClass.PARENTHESIS_OPEN;
    CLASS_MAP[')'] = CharClass.PARENTHESIS_CLOSE;
    Arrays.fill(CLASS_MAP, 'a', 'z' + 1, CharClass.LETTER);
    Arrays.fill(CLASS_MAP, 'A', 'Z' + 1, CharClass.LETTER);
    Arrays.fill(CLASS_MAP, '0', '9' + 1, CharClass.DIGIT);
    CLASS_MAP['.'] = CharClass.DOT;
    CLASS_MAP['_'] = CharClass.UNDERSCORE;
  }

  static CharClass getCharClass(char ch) {
    if (ch >= 128) {
      return CharClass.INVALID;
    } else {
      return CLASS_MAP[ch];
    }
  }

  /**
   * Checks whether every character of the expression is allowed: ASCII letters and digits,
   * underscore, dot, parentheses, whitespace and the four arithmetic operators.
   *
   * @param expression The expression to check
   * @return The index of the first disallowed character, or -1 if all characters are allowed
   */
  public static int findDisallowedCharacter(String expression) {
    for (int i = 0; i < expression.length(); ++i) {
      if (getCharClass(expression.charAt(i)) == CharClass.INVALID) {
        return i;
      }
    }
    return -1;
  }
}
