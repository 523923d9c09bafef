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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.circomj.TokenType.*;

/**
 * Splits Circom source into tokens on demand.
 * <p>Tokens are scanned lazily and each token is linked to the one scanned after it.
 * The Parser can remember any token it has seen and later {@link #rewind} to it, which
 * gives arbitrary lookahead without buffering.</p>
 * <p>Bad input never causes an exception. Unknown characters, unterminated strings and
 * unterminated comments come back as ERROR tokens carrying the error message as their
 * value so that the Parser can report them and keep going.</p>
 */
public class Tokeniser {
  private final String source;
  private       int    pos = 0;     // Where scanning resumes in source
  private       Token  lastToken;   // Token most recently returned by next()
  private       Token  nextToken;   // Token that next() will return, null if not yet scanned

  // Symbols and keywords indexed by first char, longest first
  private static final Map<Character,List<TokenType>> symbols = symbolTable();

  public Tokeniser(String source) {
    this.source = source;
  }

  public String getSource() {
    return source;
  }

  /**
   * Consume the next token. Once EOF is reached every further call returns the same EOF token.
   * @return the token
   */
  public Token next() {
    Token token = peek();
    lastToken = token;
    nextToken = token.getNext();
    return token;
  }

  public Token previous() {
    return lastToken;
  }

  /**
   * @return the token that the next call to {@link #next()} will return
   */
  public Token peek() {
    if (nextToken == null) {
      if (lastToken != null && lastToken.is(EOF)) {
        nextToken = lastToken;
      }
      else {
        nextToken = scan();
        if (lastToken != null) {
          lastToken.setNext(nextToken);
        }
      }
    }
    return nextToken;
  }

  /**
   * Reposition the token stream.
   * @param previous  the token to report as previous()
   * @param current   the token that next() should return
   */
  public void rewind(Token previous, Token current) {
    lastToken = previous;
    nextToken = current;
  }

  //////////////////////////////////////////////////

  private Token scan() {
    Token unterminated = skipWhitespaceAndComments();
    if (unterminated != null) {
      return unterminated;
    }

    Token token = new Token(source, pos);
    if (pos == source.length()) {
      return token.setType(EOF);
    }

    char c = source.charAt(pos);
    if (c >= '0' && c <= '9') { return number(token); }
    if (c == '"')             { return string(token); }

    for (TokenType type: symbols.getOrDefault(c, List.of())) {
      String symbol = type.asString;
      if (source.startsWith(symbol, pos) && !runsIntoIdentifier(symbol)) {
        return consume(token, type, symbol.length()).setKeyword(isIdentifierPart(symbol.charAt(0)));
      }
    }
    return identifier(token);
  }

  /**
   * Symbols that end in a word char (keywords and "_") only match on a word boundary,
   * so "var1" is an identifier and not "var" followed by "1".
   */
  private boolean runsIntoIdentifier(String symbol) {
    int end = pos + symbol.length();
    return isIdentifierPart(symbol.charAt(symbol.length() - 1)) &&
           end < source.length() && isIdentifierPart(source.charAt(end));
  }

  /**
   *# identifier -> [$_]* [A-Za-z] [A-Za-z0-9$_]*
   */
  private Token identifier(Token token) {
    int i = pos;
    while (i < source.length() && (source.charAt(i) == '$' || source.charAt(i) == '_')) { i++; }
    if (i == source.length() || !isLetter(source.charAt(i))) {
      return i == pos ? error(token, 1, "Unexpected character '" + source.charAt(pos) + "'")
                      : error(token, i - pos, "Identifier must contain a letter after leading '$' or '_'");
    }
    while (i < source.length() && isIdentifierPart(source.charAt(i))) { i++; }
    return consume(token, IDENTIFIER, i - pos);
  }

  /**
   * Decimal or hex number. Three groups of decimal digits separated by '.' form a
   * VERSION instead (e.g. the "2.1.6" in "pragma circom 2.1.6;").
   */
  private Token number(Token token) {
    if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
      int end = skipDigits(pos + 2, 16);
      if (end == pos + 2) {
        return error(token, 2, "Missing digits for hexadecimal literal");
      }
      BigInteger value = new BigInteger(source.substring(pos + 2, end), 16);
      return consume(token, NUMBER, end - pos).setValue(value);
    }

    int end   = skipDigits(pos, 10);
    int parts = 1;
    int versionEnd = end;
    while (parts < 3 && versionEnd + 1 < source.length() && source.charAt(versionEnd) == '.' && isDigit(source.charAt(versionEnd + 1), 10)) {
      versionEnd = skipDigits(versionEnd + 1, 10);
      parts++;
    }
    if (parts == 3) {
      return version(token, versionEnd);
    }
    BigInteger value = new BigInteger(source.substring(pos, end));
    return consume(token, NUMBER, end - pos).setValue(value);
  }

  private Token version(Token token, int end) {
    String[] parts = source.substring(pos, end).split("\\.");
    int[]    version = new int[parts.length];
    try {
      for (int i = 0; i < parts.length; i++) {
        version[i] = Integer.parseInt(parts[i]);
      }
    }
    catch (NumberFormatException e) {
      return error(token, end - pos, "Version number too large");
    }
    return consume(token, VERSION, end - pos).setValue(version);
  }

  /**
   * Strings have no escapes and must close on the line they open on.
   */
  private Token string(Token token) {
    int close = pos + 1;
    while (close < source.length() && source.charAt(close) != '"' && source.charAt(close) != '\n') { close++; }
    if (close == source.length() || source.charAt(close) == '\n') {
      return error(token, close - pos, "Unexpected end of line in string");
    }
    String value = source.substring(pos + 1, close);
    return consume(token, STRING_CONST, close + 1 - pos).setValue(value);
  }

  /**
   * Skip whitespace, "//" comments and "/* ... *&#47;" comments.
   * @return an ERROR token if a multi-line comment is still open at end of file
   */
  private Token skipWhitespaceAndComments() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
        pos++;
      }
      else if (source.startsWith("//", pos)) {
        int eol = source.indexOf('\n', pos);
        pos = eol == -1 ? source.length() : eol + 1;
      }
      else if (source.startsWith("/*", pos)) {
        int close = source.indexOf("*/", pos + 2);
        if (close == -1) {
          return error(new Token(source, pos), source.length() - pos, "Unexpected end of file in comment");
        }
        pos = close + 2;
      }
      else {
        break;
      }
    }
    return null;
  }

  private int skipDigits(int i, int base) {
    while (i < source.length() && isDigit(source.charAt(i), base)) { i++; }
    return i;
  }

  private Token consume(Token token, TokenType type, int length) {
    pos += length;
    return token.setType(type).setLength(length);
  }

  private Token error(Token token, int length, String msg) {
    return consume(token, ERROR, length).setValue(msg);
  }

  private static boolean isDigit(char c, int base) {
    return Character.digit(c, base) != -1 && c < 128;
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierPart(char c) {
    return isLetter(c) || (c >= '0' && c <= '9') || c == '$' || c == '_';
  }

  private static Map<Character,List<TokenType>> symbolTable() {
    Map<Character,List<TokenType>> table = new HashMap<>();
    Arrays.stream(TokenType.values())
          .filter(type -> type.asString != null)
          .sorted(Comparator.comparingInt((TokenType type) -> type.asString.length()).reversed())
          .forEach(type -> table.computeIfAbsent(type.asString.charAt(0), c -> new ArrayList<>()).add(type));
    return table;
  }
}
