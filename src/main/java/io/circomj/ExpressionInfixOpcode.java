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

public enum ExpressionInfixOpcode {
  MUL("*"),
  DIV("/"),
  ADD("+"),
  SUB("-"),
  POW("**"),
  INT_DIV("\\"),
  MOD("%"),
  SHIFT_L("<<"),
  SHIFT_R(">>"),
  LESSER_EQ("<="),
  GREATER_EQ(">="),
  LESSER("<"),
  GREATER(">"),
  EQ("=="),
  NOT_EQ("!="),
  BOOL_OR("||"),
  BOOL_AND("&&"),
  BIT_OR("|"),
  BIT_AND("&"),
  BIT_XOR("^");

  final String asString;

  ExpressionInfixOpcode(String asString) {
    this.asString = asString;
  }

  /**
   * Opcode for a binary operator token or for the operator part of a compound
   * assignment token (e.g. PLUS_EQUAL gives ADD).
   * @param type  the token type
   * @return the opcode
   */
  static ExpressionInfixOpcode of(TokenType type) {
    switch (type) {
      case STAR:          case STAR_EQUAL:                return MUL;
      case SLASH:         case SLASH_EQUAL:               return DIV;
      case PLUS:          case PLUS_EQUAL:  case PLUS_PLUS:   return ADD;
      case MINUS:         case MINUS_EQUAL: case MINUS_MINUS: return SUB;
      case STAR_STAR:     case STAR_STAR_EQUAL:           return POW;
      case BACKSLASH:     case BACKSLASH_EQUAL:           return INT_DIV;
      case PERCENT:       case PERCENT_EQUAL:             return MOD;
      case DOUBLE_LESS_THAN:    case DOUBLE_LESS_THAN_EQUAL:    return SHIFT_L;
      case DOUBLE_GREATER_THAN: case DOUBLE_GREATER_THAN_EQUAL: return SHIFT_R;
      case LESS_THAN_EQUAL:     return LESSER_EQ;
      case GREATER_THAN_EQUAL:  return GREATER_EQ;
      case LESS_THAN:           return LESSER;
      case GREATER_THAN:        return GREATER;
      case EQUAL_EQUAL:         return EQ;
      case BANG_EQUAL:          return NOT_EQ;
      case PIPE_PIPE:           return BOOL_OR;
      case AMPERSAND_AMPERSAND: return BOOL_AND;
      case PIPE:          case PIPE_EQUAL:                return BIT_OR;
      case AMPERSAND:     case AMPERSAND_EQUAL:           return BIT_AND;
      case ACCENT:        case ACCENT_EQUAL:              return BIT_XOR;
      default:
        throw new IllegalStateException("Internal error: no infix opcode for " + type);
    }
  }

  @Override
  public String toString() {
    return asString;
  }
}
