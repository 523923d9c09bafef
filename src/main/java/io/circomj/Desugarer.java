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
import java.util.List;
import java.util.stream.Collectors;

import static io.circomj.AssignOp.ASSIGN_VAR;

/**
 * Rewrites the compound forms of the surface syntax into the canonical statements of
 * the AST. These are pure functions from the fragments the Parser has parsed to the
 * statements it should produce:
 * <ul>
 *   <li>declarations of several symbols become one Declaration per symbol, each followed by
 *       the Substitution for its initialiser,</li>
 *   <li>declarations of a tuple of symbols with one initialiser become one Declaration per
 *       symbol followed by a single MultiSubstitution,</li>
 *   <li>"x op= e" and "x++" become "x = x op e" and "x = x + 1",</li>
 *   <li>for loops become a block with the initialisers followed by a while loop.</li>
 * </ul>
 * Every node created here gets the span of the construct it was created from.
 */
class Desugarer {

  private Desugarer() {}

  /**
   * Split "type a[d] = e1, b, c &lt;== e3" into Declarations and Substitutions.
   * If initializeVars is set then a var symbol without an initialiser gets an explicit
   * substitution of 0 (or an array of 0 for array declarations).
   */
  static List<Stmt> splitDeclaration(SourceSpan span, VariableType type, List<Symbol> symbols, boolean initializeVars) {
    List<Stmt> stmts = new ArrayList<>();
    for (Symbol symbol: symbols) {
      stmts.add(new Stmt.Declaration(span, type, symbol.name, symbol.dimensions));
      if (symbol.init != null) {
        stmts.add(new Stmt.Substitution(span, symbol.name, List.of(), symbol.op, symbol.init));
      }
      else
      if (initializeVars && type.is(VariableType.Kind.VAR)) {
        stmts.add(new Stmt.Substitution(span, symbol.name, List.of(), ASSIGN_VAR, noValue(span, symbol.dimensions)));
      }
    }
    return stmts;
  }

  /**
   * Split "type (a, b[2], c) op init" into one Declaration per symbol followed by a single
   * MultiSubstitution "(a, b, c) op init". Without an initialiser we just get the Declarations.
   */
  static List<Stmt> splitTupleDeclaration(SourceSpan span, VariableType type, List<Symbol> symbols, AssignOp op, Expr init) {
    List<Stmt> stmts = symbols.stream()
                              .map(symbol -> new Stmt.Declaration(span, type, symbol.name, symbol.dimensions))
                              .collect(Collectors.toList());
    if (init != null) {
      List<Expr> targets = symbols.stream()
                                  .map(symbol -> new Expr.Variable(symbol.span, symbol.name, List.of()))
                                  .collect(Collectors.toList());
      Expr.TupleLiteral lhe = new Expr.TupleLiteral(symbols.get(0).span.to(symbols.get(symbols.size() - 1).span), targets);
      stmts.add(new Stmt.MultiSubstitution(span, lhe, op, init));
    }
    return stmts;
  }

  /**
   * Split a declaration of bus type. Every symbol is first assigned a new instance of the
   * bus (one per element for arrays) and then gets the substitution for its own initialiser
   * if it has one.
   */
  static List<Stmt> splitBusDeclaration(SourceSpan span, VariableType.Bus type, List<Symbol> symbols, Expr.BusCall busCall) {
    List<Stmt> stmts = new ArrayList<>();
    for (Symbol symbol: symbols) {
      stmts.add(new Stmt.Declaration(span, type, symbol.name, symbol.dimensions));
      stmts.add(new Stmt.Substitution(span, symbol.name, List.of(), ASSIGN_VAR, uniformArray(span, busCall, symbol.dimensions)));
      if (symbol.init != null) {
        stmts.add(new Stmt.Substitution(span, symbol.name, List.of(), symbol.op, symbol.init));
      }
    }
    return stmts;
  }

  /**
   * Build the substitution for "target op rhe". A Variable target gives a Substitution and a
   * tuple of targets gives a MultiSubstitution. Anything else cannot be assigned to.
   * @param location  where to report an error
   */
  static Stmt substitution(SourceSpan span, Expr target, AssignOp op, Expr rhe, Location location) {
    switch (target.getKind()) {
      case VARIABLE: {
        Expr.Variable variable = (Expr.Variable) target;
        return new Stmt.Substitution(span, variable.name, variable.access, op, rhe);
      }
      case TUPLE_LITERAL:
        return new Stmt.MultiSubstitution(span, target, op, rhe);
      case NUMBER:
      case INFIX_OP:
      case PREFIX_OP:
      case INLINE_SWITCH:
      case PARALLEL_OP:
      case ARRAY_LITERAL:
      case UNIFORM_ARRAY:
      case CALL:
      case BUS_CALL:
      case ANONYMOUS_COMPONENT_CALL:
        throw new CompileError(ReportCode.IllegalExpression, "Invalid target for '" + op + "': expecting variable or tuple", location, target.span);
      default:
        throw new IllegalStateException("Internal error: unexpected expression kind " + target.getKind());
    }
  }

  /**
   * x op= e  ==&gt;  x = x op e
   */
  static Stmt compoundAssignment(SourceSpan span, Expr.Variable target, TokenType operator, Expr operand) {
    Expr rhe = new Expr.InfixOp(span, target, ExpressionInfixOpcode.of(operator), operand);
    return new Stmt.Substitution(span, target.name, target.access, ASSIGN_VAR, rhe);
  }

  /**
   * x++  ==&gt;  x = x + 1
   * x--  ==&gt;  x = x - 1
   * @param one  the value 1 in the field we are compiling for
   */
  static Stmt increment(SourceSpan span, Expr.Variable target, TokenType operator, BigInteger one) {
    return compoundAssignment(span, target, operator, new Expr.Number(span, one));
  }

  /**
   * for (init; cond; step) body  ==&gt;  { init; while (cond) { body step; } }
   */
  static Stmt.Block lowerFor(SourceSpan span, List<Stmt> init, Expr cond, List<Stmt> step, Stmt body) {
    List<Stmt> loopBody = new ArrayList<>();
    loopBody.add(body);
    loopBody.addAll(step);
    Stmt.While whileStmt = new Stmt.While(span, cond, new Stmt.Block(body.span, loopBody));

    List<Stmt> stmts = new ArrayList<>(init);
    stmts.add(whileStmt);
    return new Stmt.Block(span, stmts);
  }

  /**
   * Statement that does nothing. Used in place of statements that could not be parsed.
   */
  static Stmt.Block placeholder(SourceSpan span) {
    return new Stmt.Block(span, List.of());
  }

  /**
   * Default value for an uninitialised var: 0 or, for arrays, nested uniform arrays of 0
   * with the innermost dimension applied first.
   */
  private static Expr noValue(SourceSpan span, List<Expr> dimensions) {
    return uniformArray(span, new Expr.Number(span, BigInteger.ZERO), dimensions);
  }

  private static Expr uniformArray(SourceSpan span, Expr element, List<Expr> dimensions) {
    Expr value = element;
    for (int i = dimensions.size() - 1; i >= 0; i--) {
      value = new Expr.UniformArray(span, value, dimensions.get(i));
    }
    return value;
  }
}
