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

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorRecoveryTest extends BaseTest {

  private List<Stmt> body(ParseResult result) {
    return result.getProgram().definitions.get(0).body.stmts;
  }

  @Test public void missingSemicolon() {
    String source = "template T() {\n  x = 1\n  y = 2;\n}\n";
    ParseResult result = parse(source);
    assertEquals(1, result.getReports().size());
    Report report = result.getReports().get(0);
    assertEquals(ReportCode.MissingSemicolon, report.getCode());
    int end = source.indexOf("1") + 1;
    assertEquals(new SourceSpan(end, end, 0), report.getSpan());
    assertEquals(2, report.getLocation().getLineNum());
    assertEquals(8, report.getLocation().getColumn());

    // Same tree as if the semicolon had been there
    String fixed = "template T() {\n  x = 1;\n  y = 2;\n}\n";
    assertEquals(SourcePrinter.print(parseOk(fixed)), SourcePrinter.print(result.getProgram()));
  }

  @Test public void missingSemicolonEverywhere() {
    Consumer<String> doTest = code -> {
      ParseResult result = parse(template(code));
      assertEquals(1, result.getReports().size(), "Reports for: " + code);
      assertEquals(ReportCode.MissingSemicolon, result.getReports().get(0).getCode());
    };
    doTest.accept("return x");
    doTest.accept("var a = 1");
    doTest.accept("signal input a");
    doTest.accept("a === b");
    doTest.accept("log(a)");
    doTest.accept("assert(a)");
    doTest.accept("x++");
    doTest.accept("T()(a)");
    doTest.accept("x <== 1 y <== 2;");
  }

  @Test public void missingSemicolonAfterPragmaAndMain() {
    ParseResult result = parse("pragma circom 2.0.0\ninclude \"a\"\ntemplate T() {}\ncomponent main = T()");
    assertEquals(3, result.getReports(ReportCode.MissingSemicolon).size());
    assertEquals(3, result.getReports().size());
    Program program = result.getProgram();
    assertEquals(List.of("a"), program.includes);
    assertNotNull(program.mainComponent);
  }

  @Test public void unrecognizedVersion() {
    String source = "pragma circom abc;\ntemplate T() { x = 1; }\n";
    ParseResult result = parse(source);
    assertEquals(1, result.getReports().size());
    Report report = result.getReports().get(0);
    assertEquals(ReportCode.UnrecognizedVersion, report.getCode());
    assertEquals("abc", text(source, report.getSpan()));
    Program program = result.getProgram();
    assertTrue(program.pragmas.get(0) instanceof Pragma.Unrecognized);
    assertEquals("pragma circom abc", text(source, program.pragmas.get(0).span));
    assertEquals(1, program.definitions.size());
    assertEquals(1, program.definitions.get(0).body.stmts.size());

    testError("pragma circom 2.0;", ReportCode.UnrecognizedVersion);
    testError("pragma circom;", ReportCode.UnrecognizedVersion);
  }

  @Test public void unrecognizedPragma() {
    String source = "pragma foo bar;\ntemplate T() {}\n";
    ParseResult result = parse(source);
    assertEquals(1, result.getReports().size());
    Report report = result.getReports().get(0);
    assertEquals(ReportCode.UnrecognizedPragma, report.getCode());
    assertEquals("foo bar", text(source, report.getSpan()));
    assertTrue(result.getProgram().pragmas.get(0) instanceof Pragma.Unrecognized);
    assertEquals(1, result.getProgram().definitions.size());
  }

  @Test public void unrecognizedPragmaWithoutSemicolon() {
    ParseResult result = parse("pragma foo\ntemplate T() {}\n");
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.UnrecognizedPragma, result.getReports().get(0).getCode());
    assertEquals(1, result.getProgram().definitions.size());
  }

  @Test public void unrecognizedInclude() {
    ParseResult result = parse("include foo;\ninclude \"b\";\ntemplate T() {}\n");
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.UnrecognizedInclude, result.getReports().get(0).getCode());
    assertEquals(List.of("", "b"), result.getProgram().includes);
    assertEquals(1, result.getProgram().definitions.size());
  }

  @Test public void prefixIncrement() {
    Consumer<String> doTest = code -> {
      ParseResult result = parse(template(code));
      assertEquals(1, result.getReports().size());
      Report report = result.getReports().get(0);
      assertEquals(ReportCode.IllegalExpression, report.getCode());
      assertTrue(report.getMessage().contains("not supported"));
      List<Stmt> stmts = body(result);
      assertEquals(1, stmts.size());
      assertTrue(((Stmt.Block) stmts.get(0)).isEmpty());
    };
    doTest.accept("++x;");
    doTest.accept("--x;");
    doTest.accept("++a[i];");

    assertEquals(1, stmts("x++;").size());
  }

  @Test public void badStatement() {
    ParseResult result = parse(template("x = ;\ny = 1;"));
    assertEquals(1, result.getReports().size());
    List<Stmt> stmts = body(result);
    assertEquals(2, stmts.size());
    assertTrue(((Stmt.Block) stmts.get(0)).isEmpty());
    assertEquals("y", ((Stmt.Substitution) stmts.get(1)).var);
  }

  @Test public void badStatementInNestedBlock() {
    ParseResult result = parse(template("if (a) { x = ; z = 2; }\ny = 1;"));
    assertEquals(1, result.getReports().size());
    List<Stmt> stmts = body(result);
    assertEquals(2, stmts.size());
    var block = (Stmt.Block) ((Stmt.IfThenElse) stmts.get(0)).ifCase;
    assertEquals(2, block.stmts.size());
    assertEquals("y", ((Stmt.Substitution) stmts.get(1)).var);
  }

  @Test public void skipOverBlockInBadStatement() {
    ParseResult result = parse(template("x = 1 + { a = 1; b = 2; }\ny = 1;"));
    assertTrue(result.hasErrors());
    List<Stmt> stmts = body(result);
    assertEquals("y", ((Stmt.Substitution) stmts.get(stmts.size() - 1)).var);
  }

  @Test public void badDefinitionHeader() {
    ParseResult result = parse("template (a) { x = 1; }\ntemplate U() { y = 1; }\n");
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.IllegalExpression, result.getReports().get(0).getCode());
    assertEquals(1, result.getProgram().definitions.size());
    assertEquals("U", result.getProgram().definitions.get(0).name);
  }

  @Test public void strayTopLevelTokens() {
    ParseResult result = parse("x;\ny = 2;\ntemplate T() {}\ncomponent main = T();\n");
    assertEquals(1, result.getReports().size());
    assertEquals(1, result.getProgram().definitions.size());
    assertNotNull(result.getProgram().mainComponent);
  }

  @Test public void badCharacter() {
    ParseResult result = parse(template("x = 1 # 2;\ny = 3;"));
    assertTrue(result.getReports(ReportCode.IllegalExpression)
                     .stream()
                     .anyMatch(report -> report.getMessage().equals("Unexpected character '#'")));
    List<Stmt> stmts = body(result);
    assertEquals("y", ((Stmt.Substitution) stmts.get(stmts.size() - 1)).var);
  }

  @Test public void missingCloseBrace() {
    ParseResult result = parse("template T() { x = 1;");
    assertEquals(1, result.getReports().size());
    assertTrue(result.getReports().get(0).getMessage().contains("missing '}'"));
    assertEquals(1, body(result).size());
  }

  @Test public void expressionsNestedTooDeep() {
    maxNestingDepth = 20;
    ParseResult result = parse(template("x = " + "(".repeat(50) + "1" + ")".repeat(50) + ";\ny = 2;"));
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.NestingTooDeep, result.getReports().get(0).getCode());
    List<Stmt> stmts = body(result);
    assertEquals(2, stmts.size());
    assertEquals("y", ((Stmt.Substitution) stmts.get(1)).var);

    // Within the limit
    assertEquals(1, stmts("x = " + "(".repeat(10) + "1" + ")".repeat(10) + ";").size());
  }

  @Test public void blocksNestedTooDeep() {
    maxNestingDepth = 20;
    ParseResult result = parse(template("{".repeat(50) + "x = 1;" + "}".repeat(50) + "\ny = 2;"));
    assertEquals(1, result.getReports().size());
    assertEquals(ReportCode.NestingTooDeep, result.getReports().get(0).getCode());
    List<Stmt> stmts = body(result);
    assertEquals(2, stmts.size());
    assertEquals("y", ((Stmt.Substitution) stmts.get(1)).var);
  }

  @Test public void deepNestingWithDefaultLimit() {
    Consumer<String> doTest = expr -> {
      ParseResult result = parse(template("x = " + expr + ";"));
      assertEquals(ReportCode.NestingTooDeep, result.getReports().get(0).getCode());
    };
    doTest.accept("(".repeat(5000) + "1" + ")".repeat(5000));
    doTest.accept("- ".repeat(5000) + "1");
    doTest.accept("a ** ".repeat(5000) + "a");
    doTest.accept("[".repeat(5000) + "1" + "]".repeat(5000));
  }

  @Test public void neverThrows() {
    List<String> sources = List.of("}}}}", "{{{{", "template", "template T", "template T(", "template T( {}",
                                   "bus", "function f() {", "component main =", "component main = T(",
                                   "component x", "pragma", "pragma circom", "include", "\"unterminated",
                                   "/* unterminated", "template T() { if (", "template T() { if }",
                                   "template T() { else x = 1; }", "template T() { signal }",
                                   "template T() { signal input {a x; }", "template T() { for (;;) {} }",
                                   "template T() { (((( }", "template T() { x = T()(a <== ; }",
                                   "template T() { a.b.c = 1; a[ = 2; }", "}{", "template T() { var (a, ) = 1; }",
                                   "template T() { Point(1 p; }", "template T() { log(\"a\" }",
                                   "template T() { x = a ? b; }", "template T() { _ = ; }", "#$%^&");
    for (String source: sources) {
      ParseResult result = assertDoesNotThrow(() -> parse(source), source);
      assertNotNull(result.getProgram());
      assertTrue(result.hasErrors(), "Expected errors for: " + source);
      result.getReports().forEach(report -> assertNotNull(report.format("test.circom")));
    }
  }
}
