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

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest extends BaseTest {

  @Test public void longElseIfChain() {
    StringBuilder code = new StringBuilder("if (x == 0) y = 0;");
    for (int i = 1; i < 250; i++) {
      code.append("\nelse if (x == ").append(i).append(") y = ").append(i).append(";");
    }
    code.append("\nelse y = 250;");
    List<Stmt> stmts = stmts(code.toString());
    assertEquals(1, stmts.size());
    Stmt stmt = stmts.get(0);
    for (int i = 0; i < 250; i++) {
      var ifStmt = (Stmt.IfThenElse) stmt;
      assertEquals(BigInteger.valueOf(i), ((Expr.Number) ((Stmt.Substitution) ifStmt.ifCase).rhe).value);
      stmt = ifStmt.elseCase;
    }
    assertEquals(BigInteger.valueOf(250), ((Expr.Number) ((Stmt.Substitution) stmt).rhe).value);
  }

  @Test public void elseIfChainSpans() {
    String source = template("if (a) x = 1; else if (b) x = 2; else x = 3;");
    var outer = (Stmt.IfThenElse) parseOk(source).definitions.get(0).body.stmts.get(0);
    assertEquals("if (a) x = 1; else if (b) x = 2; else x = 3;", text(source, outer.span));
    assertEquals("if (b) x = 2; else x = 3;", text(source, outer.elseCase.span));
  }

  @Test public void badConditionInElseIfChain() {
    ParseResult result = parse(template("if (a) x = 1; else if (b ==) { x = 2; }\ny = 4;"));
    assertEquals(1, result.getReports().size(), result.getReports().toString());
    assertEquals(ReportCode.IllegalExpression, result.getReports().get(0).getCode());
    List<Stmt> stmts = result.getProgram().definitions.get(0).body.stmts;
    assertEquals("y", ((Stmt.Substitution) stmts.get(stmts.size() - 1)).var);
    var ifStmt = (Stmt.IfThenElse) stmts.get(0);
    assertTrue(((Stmt.Block) ifStmt.elseCase).isEmpty());
  }

  @Test public void danglingElse() {
    List<Stmt> stmts = stmts("if (c1) if (c2) s1 = 1; else s2 = 2;");
    assertEquals(1, stmts.size());
    var outer = (Stmt.IfThenElse) stmts.get(0);
    assertNull(outer.elseCase);
    var inner = (Stmt.IfThenElse) outer.ifCase;
    assertNotNull(inner.elseCase);
    assertEquals("s2", ((Stmt.Substitution) inner.elseCase).var);
  }

  @Test public void elseWithBraces() {
    var outer = (Stmt.IfThenElse) stmts("if (c1) { if (c2) s1 = 1; } else s2 = 2;").get(0);
    assertNotNull(outer.elseCase);
    var block = (Stmt.Block) outer.ifCase;
    assertNull(((Stmt.IfThenElse) block.stmts.get(0)).elseCase);
  }

  @Test public void elseIfChain() {
    var stmt = (Stmt.IfThenElse) stmts("if (a) x = 1; else if (b) x = 2; else x = 3;").get(0);
    var elseIf = (Stmt.IfThenElse) stmt.elseCase;
    assertEquals("b", ((Expr.Variable) elseIf.cond).name);
    assertEquals(Stmt.Kind.SUBSTITUTION, elseIf.elseCase.getKind());
  }

  @Test public void declarationAsIfBody() {
    var stmt = (Stmt.IfThenElse) stmts("if (c) var x = 1;").get(0);
    var block = (Stmt.Block) stmt.ifCase;
    assertEquals(2, block.stmts.size());
    assertEquals(Stmt.Kind.DECLARATION, block.stmts.get(0).getKind());
    assertEquals(Stmt.Kind.SUBSTITUTION, block.stmts.get(1).getKind());
  }

  @Test public void whileLoop() {
    var stmt = (Stmt.While) stmts("while (i < n) { i++; }").get(0);
    assertEquals("(i < n)", SourcePrinter.print(stmt.cond));
    assertEquals(1, ((Stmt.Block) stmt.body).stmts.size());
  }

  @Test public void forLoopIsLoweredToWhile() {
    BiConsumer<String,String> doTest = (forLoop, whileLoop) -> {
      assertEquals(render(stmts(whileLoop)), render(stmts(forLoop)));
    };
    doTest.accept("for (var i = 0; i < n; i++) x += i;",
                  "{ var i = 0; while (i < n) { x += i; i++; } }");
    doTest.accept("for (i = 0; i < n; i += 2) { x = x * i; }",
                  "{ i = 0; while (i < n) { { x = x * i; } i += 2; } }");
    doTest.accept("for (var i = 0; i < n; i++) for (var j = 0; j < i; j++) c[i][j] <== a[i] * b[j];",
                  "{ var i = 0; while (i < n) { { var j = 0; while (j < i) { c[i][j] <== a[i] * b[j]; j++; } } i++; } }");
  }

  @Test public void forLoopShape() {
    var block = (Stmt.Block) stmts("for (var i = 0; i < 10; i++) x += i;").get(0);
    assertEquals(3, block.stmts.size());
    assertEquals(Stmt.Kind.DECLARATION, block.stmts.get(0).getKind());
    assertEquals(Stmt.Kind.SUBSTITUTION, block.stmts.get(1).getKind());
    var loop = (Stmt.While) block.stmts.get(2);
    var body = (Stmt.Block) loop.body;
    assertEquals(2, body.stmts.size());
    assertEquals("x", ((Stmt.Substitution) body.stmts.get(0)).var);
    assertEquals("i", ((Stmt.Substitution) body.stmts.get(1)).var);
  }

  @Test public void returnLogAssert() {
    var ret = (Stmt.Return) stmts("return a + 1;").get(0);
    assertEquals("(a + 1)", SourcePrinter.print(ret.value));

    var log = (Stmt.LogCall) stmts("log(\"value\", x, x + 1);").get(0);
    assertEquals(3, log.args.size());
    assertEquals("value", ((LogArgument.LogString) log.args.get(0)).value);
    assertEquals("x", ((Expr.Variable) ((LogArgument.LogExpr) log.args.get(1)).expr).name);
    assertEquals("log(\"value\", x, (x + 1));", SourcePrinter.print(log));
    assertEquals(0, ((Stmt.LogCall) stmts("log();").get(0)).args.size());

    var assertStmt = (Stmt.Assert) stmts("assert(x != 0);").get(0);
    assertEquals("assert((x != 0));", SourcePrinter.print(assertStmt));
  }

  @Test public void signalAssignments() {
    BiConsumer<String,String> doTest = (code, expected) -> assertEquals(expected, render(stmts(code)));
    doTest.accept("x <== y;", "x <== y;");
    doTest.accept("x <-- y;", "x <-- y;");
    doTest.accept("y ==> x;", "x <== y;");
    doTest.accept("y --> x;", "x <-- y;");
    doTest.accept("x = y;", "x = y;");
    doTest.accept("a === b + 1;", "a === (b + 1);");
    doTest.accept("c.in[0] <== 1;", "c.in[0] <== 1;");
    doTest.accept("(a, b) <== T()(x);", "(a, b) <== T()(x);");
    doTest.accept("T(1)(x);", "T(1)(x);");
  }

  @Test public void reversedOperatorsSwapSides() {
    var subst = (Stmt.Substitution) stmts("a * 2 ==> out;").get(0);
    assertEquals("out", subst.var);
    assertEquals(AssignOp.ASSIGN_CONSTRAINT_SIGNAL, subst.op);
    assertEquals("(a * 2)", SourcePrinter.print(subst.rhe));
  }

  @Test public void constraintEquality() {
    var stmt = (Stmt.ConstraintEquality) stmts("a * b === c;").get(0);
    assertEquals(Expr.Kind.INFIX_OP, stmt.lhe.getKind());
    assertEquals("c", ((Expr.Variable) stmt.rhe).name);
  }

  @Test public void anonymousComponentStatement() {
    var stmt = (Stmt.AnonymousComponentStmt) stmts("T(1)(a, b);").get(0);
    assertEquals("T", stmt.call.id);
    assertEquals(2, stmt.call.signals.size());
  }

  @Test public void compoundAssignments() {
    BiConsumer<String,ExpressionInfixOpcode> doTest = (operator, opcode) -> {
      var subst = (Stmt.Substitution) stmts("x " + operator + " 3;").get(0);
      assertEquals("x", subst.var);
      assertEquals(AssignOp.ASSIGN_VAR, subst.op);
      var infix = (Expr.InfixOp) subst.rhe;
      assertEquals(opcode, infix.op);
      assertEquals("x", ((Expr.Variable) infix.lhe).name);
      assertEquals(BigInteger.valueOf(3), ((Expr.Number) infix.rhe).value);
    };
    doTest.accept("+=", ExpressionInfixOpcode.ADD);
    doTest.accept("-=", ExpressionInfixOpcode.SUB);
    doTest.accept("*=", ExpressionInfixOpcode.MUL);
    doTest.accept("/=", ExpressionInfixOpcode.DIV);
    doTest.accept("\\=", ExpressionInfixOpcode.INT_DIV);
    doTest.accept("%=", ExpressionInfixOpcode.MOD);
    doTest.accept("**=", ExpressionInfixOpcode.POW);
    doTest.accept("<<=", ExpressionInfixOpcode.SHIFT_L);
    doTest.accept(">>=", ExpressionInfixOpcode.SHIFT_R);
    doTest.accept("&=", ExpressionInfixOpcode.BIT_AND);
    doTest.accept("|=", ExpressionInfixOpcode.BIT_OR);
    doTest.accept("^=", ExpressionInfixOpcode.BIT_XOR);
  }

  @Test public void compoundAssignmentToArrayElement() {
    assertEquals("a[i].b = (a[i].b + 1);", render(stmts("a[i].b += 1;")));
  }

  @Test public void postfixIncrement() {
    assertEquals("x = (x + 1);", render(stmts("x++;")));
    assertEquals("x = (x - 1);", render(stmts("x--;")));
    assertEquals("a[0] = (a[0] + 1);", render(stmts("a[0]++;")));
  }

  @Test public void invalidTargets() {
    testError(template("1 = x;"), ReportCode.IllegalExpression, "Invalid target");
    testError(template("f(a) <== x;"), ReportCode.IllegalExpression, "Invalid target");
    testError(template("(a, b) += 1;"), ReportCode.IllegalExpression, "Invalid target");
    testError(template("(a + b)++;"), ReportCode.IllegalExpression, "Invalid target");
  }

  @Test public void expressionStatement() {
    ParseResult result = parse(template("x + 1;"));
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.IllegalExpression, result.getReports().get(0).getCode());
    var placeholder = (Stmt.Block) result.getProgram().definitions.get(0).body.stmts.get(0);
    assertTrue(placeholder.isEmpty());
  }

  @Test public void statementSpans() {
    String source = template("if (a) x = 1; else { y <== 2; }");
    var stmt = (Stmt.IfThenElse) parseOk(source).definitions.get(0).body.stmts.get(0);
    assertEquals("if (a) x = 1; else { y <== 2; }", text(source, stmt.span));
    assertEquals("x = 1", text(source, stmt.ifCase.span));
    assertEquals("{ y <== 2; }", text(source, stmt.elseCase.span));
  }
}
