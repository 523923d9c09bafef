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

import static io.circomj.TokenType.ERROR;

/**
 * A token scanned from Circom source. The token's position comes from {@link Location}
 * and its text is the slice of source from its offset for its length.
 * <p>Literal tokens carry a value: a BigInteger for NUMBER, the unquoted text for
 * STRING_CONST, an int[] of major/minor/patch for VERSION, and the message for ERROR.</p>
 * <p>Each token links to the token scanned after it, which is what lets the
 * {@link Tokeniser} rewind.</p>
 */
public class Token extends Location {
  private TokenType type;
  private int       length;
  private Object    value;
  private boolean   keyword;
  private Token     next;

  /**
   * Start a token at the given offset. Type and length are filled in once scanned.
   */
  public Token(String source, int offset) {
    super(source, offset);
  }

  public TokenType getType()               { return type; }
  public Token     setType(TokenType type) { this.type = type; return this; }

  public int   getLength()           { return length; }
  public Token setLength(int length) { this.length = length; return this; }

  /**
   * @return offset just past the last char of the token
   */
  public int getEnd() { return offset + length; }

  public boolean isKeyword()                  { return keyword; }
  public Token   setKeyword(boolean keyword)  { this.keyword = keyword; return this; }

  public Token getNext()           { return next; }
  void         setNext(Token next) { this.next = next; }

  public boolean is(TokenType... types)    { return type.is(types); }
  public boolean isNot(TokenType... types) { return !type.is(types); }
  public boolean isError()                 { return type == ERROR; }

  /**
   * @return the literal value, or the token text for tokens without one
   */
  public Object getValue() {
    return value != null ? value : getChars();
  }

  public Token setValue(Object value) {
    this.value = value;
    return this;
  }

  public String getChars() {
    int end = Math.min(getEnd(), source.length());
    return source.substring(offset, end);
  }

  public String getStringValue() {
    return value instanceof String ? (String) value : getChars();
  }

  @Override public String toString() {
    return type + "(" + getValue() + ")";
  }
}
