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

import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class SourcePrinterTest extends BaseTest {

  @Test public void program() {
    String source = "pragma circom 2.0.0;\n" +
                    "pragma custom_templates;\n" +
                    "include \"lib.circom\";\n" +
                    "template T(n) {\n" +
                    "  signal input a;\n" +
                    "  signal output b;\n" +
                    "  b <== a * n;\n" +
                    "}\n" +
                    "component main {public [a]} = T(2);\n";
    String expected = source.replace("a * n", "(a * n)");
    assertEquals(expected, SourcePrinter.print(parseOk(source)));
  }

  @Test public void unrecognizedPragmasAreDropped() {
    Program program = parse("pragma foo;\ntemplate T() {}").getProgram();
    assertEquals("template T() {}\n", SourcePrinter.print(program));
  }

  @Test public void declarations() {
    assertEquals("{\n  var (a, b) = (1, 2);\n  var c[2];\n  var d = 0;\n}",
                 SourcePrinter.print(parseOk(template("var (a, b) = (1, 2); var c[2]; var d;")).definitions.get(0).body));
    assertEquals("{\n  signal input {binary} a[2];\n  signal output b <== (a[0] + a[1]);\n  component c = T(1);\n}",
                 SourcePrinter.print(parseOk(template("signal input {binary} a[2]; signal output b <== a[0] + a[1]; component c = T(1);")).definitions.get(0).body));
    assertEquals("{\n  Point(2) output {t} p;\n  Point q;\n  q <== r;\n  Point(1) s[2];\n}",
                 SourcePrinter.print(parseOk(template("Point(2) output {t} p; Point q <== r; Point(1) s[2];")).definitions.get(0).body));
  }

  @Test public void splitSymbolsAreNotMerged() {
    assertEquals("{\n  var a = 1;\n  var b = 0;\n}",
                 SourcePrinter.print(parseOk(template("var a = 1, b;")).definitions.get(0).body));
  }

  @Test public void statements() {
    assertEquals("if ((a > b)) x = 1;\nelse {\n  x = 2;\n}", render(stmts("if (a > b) x = 1; else { x = 2; }")));
    assertEquals("while (c) {}", render(stmts("while (c) {}")));
    assertEquals("(a, _) <== T()(in <== x);", render(stmts("(a, _) <== T()(in <== x);")));
  }

  @Test public void roundTrip() {
    Consumer<String> doTest = source -> {
      String printed = SourcePrinter.print(parseOk(source));
      assertEquals(printed, SourcePrinter.print(parseOk(printed)), "Source was: " + source);
    };

    doTest.accept("pragma circom 2.1.6;\ninclude \"lib.circom\";\n" +
                  "template T(n) { signal input a; signal output b; b <== a * n; }\n" +
                  "component main {public [a]} = T(2);");
    doTest.accept("template T() { signal input {binary} a[2]; signal output b; var x = 0;" +
                  " for (var i = 0; i < 2; i++) { x += a[i] * 2 ** i; } b <== x; }");
    doTest.accept("function f(a, b) { if (a > b) return a; else if (a == b) return 0; else return b; }");
    doTest.accept("bus Point() { signal x; signal y; }\n" +
                  "template U() { Point input p; Point(2) q; signal output o;" +
                  " (o, _) <== V()(p.x, p.y); o === p.x; log(\"o\", o); assert(o != 0); }");
    doTest.accept("template parallel custom W(n) { component c[n]; c[0] = X(); signal s;" +
                  " s <== parallel Y()(a <== 1); s ==> t; x \\= 2; var m[2][n]; x--; }");
    doTest.accept("template T() { signal output (a, b) <== V()(1); var (c, d) = (1, 2); var (e, f); }");
    doTest.accept("template T() { var x = c ? -a : ~b | 3 ^ 4 & 5 >> 1; x = [1, [2, 3]]; x = f(x, parallel g(1)); }");
    doTest.accept("template T() { if (a) if (b) x = 1; else x = 2; while (x < 10) x++; }");
  }

  @Test public void roundTripWithoutInitialisation() {
    initializeVars = false;
    String printed = SourcePrinter.print(parseOk(template("var a, b[3]; var (c, d);")));
    assertEquals("template T() {\n  var a;\n  var b[3];\n  var c;\n  var d;\n}\n", printed);
    assertEquals(printed, SourcePrinter.print(parseOk(printed)));
  }

  @Test public void signalOperatorOnVarIsNotMergedIntoDeclaration() {
    initializeVars = false;
    String printed = SourcePrinter.print(parseOk(template("var x; x <-- y; component c; c <== d;")));
    assertEquals("template T() {\n  var x;\n  x <-- y;\n  component c;\n  c <== d;\n}\n", printed);
    assertEquals(printed, SourcePrinter.print(parseOk(printed)));
  }
}
