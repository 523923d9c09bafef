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
 * The three forms of substitution. The form determines both which operator was used
 * in the source and what kind of substitution is recorded in the AST.
 */
public enum AssignOp {
  ASSIGN_VAR("="),
  ASSIGN_SIGNAL("<--"),
  ASSIGN_CONSTRAINT_SIGNAL("<==");

  final String asString;

  AssignOp(String asString) {
    this.asString = asString;
  }

  /**
   * Map an assignment token to its AssignOp. The reversed forms "--&gt;" and "==&gt;"
   * map to the same ops as their left pointing counterparts.
   * @param type  the token type
   * @return the AssignOp
   */
  static AssignOp of(TokenType type) {
    switch (type) {
      case EQUAL:                   return ASSIGN_VAR;
      case LEFT_SIGNAL_ASSIGN:
      case RIGHT_SIGNAL_ASSIGN:     return ASSIGN_SIGNAL;
      case LEFT_CONSTRAINT_ASSIGN:
      case RIGHT_CONSTRAINT_ASSIGN: return ASSIGN_CONSTRAINT_SIGNAL;
      default:
        throw new IllegalStateException("Internal error: " + type + " is not an assignment operator");
    }
  }

  @Override
  public String toString() {
    return asString;
  }
}
