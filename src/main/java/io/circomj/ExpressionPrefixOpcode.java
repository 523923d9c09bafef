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

public enum ExpressionPrefixOpcode {
  SUB("-"),
  BOOL_NOT("!"),
  COMPLEMENT("~");

  final String asString;

  ExpressionPrefixOpcode(String asString) {
    this.asString = asString;
  }

  static ExpressionPrefixOpcode of(TokenType type) {
    switch (type) {
      case MINUS: return SUB;
      case BANG:  return BOOL_NOT;
      case GRAVE: return COMPLEMENT;
      default:
        throw new IllegalStateException("Internal error: no prefix opcode for " + type);
    }
  }

  @Override
  public String toString() {
    return asString;
  }
}
