/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.circomj;

/**
 * Enum for different token types supported in Circom
 */
public enum TokenType {
  //= Single char tokens
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_SQUARE("["),
  RIGHT_SQUARE("]"),
  LEFT_BRACE("{"),
  RIGHT_BRACE("}"),
  BANG("!"),
  PERCENT("%"),
  ACCENT("^"),
  AMPERSAND("&"),
  STAR("*"),
  MINUS("-"),
  PLUS("+"),
  SLASH("/"),
  BACKSLASH("\\"),
  EQUAL("="),
  LESS_THAN("<"),
  GREATER_THAN(">"),
  QUESTION("?"),
  COMMA(","),
  DOT("."),
  GRAVE("~"),
  PIPE("|"),
  COLON(":"),
  SEMICOLON(";"),

  //= Double char tokens
  BANG_EQUAL("!="),
  EQUAL_EQUAL("=="),
  LESS_THAN_EQUAL("<="),
  GREATER_THAN_EQUAL(">="),
  AMPERSAND_AMPERSAND("&&"),
  PIPE_PIPE("||"),
  MINUS_EQUAL("-="),
  PLUS_EQUAL("+="),
  SLASH_EQUAL("/="),
  BACKSLASH_EQUAL("\\="),
  STAR_EQUAL("*="),
  AMPERSAND_EQUAL("&="),
  PIPE_EQUAL("|="),
  ACCENT_EQUAL("^="),
  PERCENT_EQUAL("%="),
  DOUBLE_LESS_THAN("<<"),
  DOUBLE_GREATER_THAN(">>"),
  MINUS_MINUS("--"),
  PLUS_PLUS("++"),
  STAR_STAR("**"),

  //= Triple char tokens
  STAR_STAR_EQUAL("**="),
  DOUBLE_LESS_THAN_EQUAL("<<="),
  DOUBLE_GREATER_THAN_EQUAL(">>="),
  TRIPLE_EQUAL("==="),
  LEFT_SIGNAL_ASSIGN("<--"),       // <--
  LEFT_CONSTRAINT_ASSIGN("<=="),   // <==
  RIGHT_SIGNAL_ASSIGN("-->"),      // -->
  RIGHT_CONSTRAINT_ASSIGN("==>"),  // ==>

  //= Literals
  IDENTIFIER(),
  NUMBER(),
  STRING_CONST(),
  VERSION(),

  //= Keywords
  PRAGMA("pragma"),
  CIRCOM("circom"),
  CUSTOM_TEMPLATES("custom_templates"),
  INCLUDE("include"),
  FUNCTION("function"),
  TEMPLATE("template"),
  BUS("bus"),
  CUSTOM("custom"),
  PARALLEL("parallel"),
  COMPONENT("component"),
  MAIN("main"),
  PUBLIC("public"),
  SIGNAL("signal"),
  INPUT("input"),
  OUTPUT("output"),
  VAR("var"),
  IF("if"),
  ELSE("else"),
  WHILE("while"),
  FOR("for"),
  RETURN("return"),
  LOG("log"),
  ASSERT("assert"),
  UNDERSCORE("_"),

  //= Special
  ERROR(),          // Unrecognised input: value holds the error message
  EOF();            // End of file

  final String asString;

  TokenType(String str) {
    this.asString = str;
  }
  TokenType()           { this.asString = null; }

  boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  /**
   * Check if operator is one of the compound assignment operators such as +=, -=, etc
   * that are rewritten as "x = x op e".
   * @return true if operator is a compound assignment operator
   */
  boolean isCompoundAssignment() {
    return this.is(PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL, STAR_STAR_EQUAL,
                   BACKSLASH_EQUAL, DOUBLE_LESS_THAN_EQUAL, DOUBLE_GREATER_THAN_EQUAL, AMPERSAND_EQUAL,
                   PIPE_EQUAL, ACCENT_EQUAL);
  }

  /**
   * Check if token introduces an initialiser or the right hand side of a substitution:
   * one of "=", "&lt;--", "&lt;==".
   * @return true if operator is an assignment operator
   */
  boolean isAssignment() {
    return this.is(EQUAL, LEFT_SIGNAL_ASSIGN, LEFT_CONSTRAINT_ASSIGN);
  }

  @Override
  public String toString() {
    return asString != null ? asString : super.toString();
  }
}
