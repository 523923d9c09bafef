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
 * Argument of a log(...) statement: either a string literal or an expression.
 */
public abstract class LogArgument {

  public static class LogString extends LogArgument {
    public final String value;
    public LogString(String value) { this.value = value; }
  }

  public static class LogExpr extends LogArgument {
    public final Expr expr;
    public LogExpr(Expr expr) { this.expr = expr; }
  }
}
