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
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CircomjTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return new Circomj(new PrintStream(out, true), new PrintStream(err, true)).run(args);
  }

  @Test public void printSource() {
    assertEquals(0, run("-p", "-e", "template T() { x = 1; }"));
    assertEquals("template T() {\n  x = 1;\n}\n", out.toString());
    assertEquals("", err.toString());
  }

  @Test public void noPrint() {
    assertEquals(0, run("-e", "template T() { x = 1; }"));
    assertEquals("", out.toString());
  }

  @Test public void reportsErrors() {
    assertEquals(1, run("-e", "template T() { x = 1 }"));
    assertTrue(err.toString().startsWith("<command line>:1:21: MissingSemicolon: Missing ';'"), err.toString());
  }

  @Test public void uninitialisedVars() {
    assertEquals(0, run("-u", "-p", "-e", "template T() { var x; }"));
    assertEquals("template T() {\n  var x;\n}\n", out.toString());
    out.reset();
    assertEquals(0, run("-p", "-e", "template T() { var x; }"));
    assertEquals("template T() {\n  var x = 0;\n}\n", out.toString());
  }

  @Test public void modulus() {
    assertEquals(0, run("-m", "0x11", "-e", "template T() { x++; }"));
    assertEquals(0, run("-m", "17", "-e", "template T() { x++; }"));
    assertThrows(IllegalArgumentException.class, () -> run("-m", "abc", "-e", "template T() {}"));
    assertThrows(IllegalArgumentException.class, () -> run("-m", "1", "-e", "template T() {}"));
  }

  @Test public void badArgs() {
    assertThrows(IllegalArgumentException.class, () -> run());
    assertThrows(IllegalArgumentException.class, () -> run("-z", "-e", "x"));
    assertThrows(IllegalArgumentException.class, () -> run("-e"));
    assertThrows(IllegalArgumentException.class, () -> run("-f", "x", "-e", "template T() {}"));
    var error = assertThrows(IllegalArgumentException.class, () -> run("-h"));
    assertTrue(error.getMessage().contains("Usage: circomj"));
  }

  @Test public void files(@TempDir Path dir) throws IOException {
    Path good = dir.resolve("good.circom");
    Path bad  = dir.resolve("bad.circom");
    Files.writeString(good, "template T() { x = 1; }\n");
    Files.writeString(bad, "template U() {\n  y = 2\n}\n");

    assertEquals(0, run("-p", good.toString()));
    assertEquals("template T() {\n  x = 1;\n}\n", out.toString());

    assertEquals(1, run(good.toString(), bad.toString()));
    assertTrue(err.toString().startsWith(bad + ":2:8: MissingSemicolon"), err.toString());
  }

  @Test public void missingFile(@TempDir Path dir) {
    assertEquals(1, run(dir.resolve("missing.circom").toString()));
    assertTrue(err.toString().contains("could not read file"));
  }
}
