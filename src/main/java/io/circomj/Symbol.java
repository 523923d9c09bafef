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

import java.util.List;

/**
 * One declared name within a declaration statement together with its array
 * dimensions and its own initialiser (if it has one). Only used while the Parser
 * turns a declaration statement into single variable Declarations.
 */
class Symbol {
  final SourceSpan span;
  final String     name;
  final List<Expr> dimensions;
  final AssignOp   op;     // Operator that introduced the initialiser (null if no initialiser)
  final Expr       init;

  Symbol(SourceSpan span, String name, List<Expr> dimensions, AssignOp op, Expr init) {
    this.span       = span;
    this.name       = name;
    this.dimensions = List.copyOf(dimensions);
    this.op         = op;
    this.init       = init;
  }

  Symbol(SourceSpan span, String name, List<Expr> dimensions) {
    this(span, name, dimensions, null, null);
  }
}
