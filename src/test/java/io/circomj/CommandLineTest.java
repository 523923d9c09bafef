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

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineTest {

  private static CommandLine parse(String... args) {
    return CommandLine.parse(args, "usage");
  }

  private static void testError(String expected, String... args) {
    var error = assertThrows(IllegalArgumentException.class, () -> parse(args));
    assertEquals(expected + "\nusage", error.getMessage());
  }

  @Test public void flagsAndFiles() {
    var commandLine = parse("-pv", "a.circom", "-u", "b.circom");
    assertTrue(commandLine.print);
    assertTrue(commandLine.verbose);
    assertTrue(commandLine.uninitialised);
    assertNull(commandLine.source);
    assertNull(commandLine.fileId);
    assertNull(commandLine.modulus);
    assertEquals(List.of("a.circom", "b.circom"), commandLine.files);
  }

  @Test public void defaults() {
    var commandLine = parse("a.circom");
    assertFalse(commandLine.print);
    assertFalse(commandLine.verbose);
    assertFalse(commandLine.uninitialised);
    assertEquals(List.of("a.circom"), commandLine.files);
  }

  @Test public void values() {
    var commandLine = parse("-e", "x = 1;", "-f3", "-m", "0x11");
    assertEquals("x = 1;", commandLine.source);
    assertEquals("3", commandLine.fileId);
    assertEquals("0x11", commandLine.modulus);
    assertTrue(commandLine.files.isEmpty());
  }

  @Test public void valueAfterFlags() {
    var commandLine = parse("-pf", "7", "-uvm17");
    assertTrue(commandLine.print);
    assertEquals("7", commandLine.fileId);
    assertTrue(commandLine.uninitialised);
    assertTrue(commandLine.verbose);
    assertEquals("17", commandLine.modulus);
  }

  @Test public void valueStartingWithDash() {
    assertEquals("-1", parse("-f", "-1").fileId);
  }

  @Test public void filesAfterDoubleDash() {
    var commandLine = parse("-p", "a", "--", "-b.circom", "--", "-v");
    assertTrue(commandLine.print);
    assertFalse(commandLine.verbose);
    assertEquals(List.of("a", "-b.circom", "--", "-v"), commandLine.files);
  }

  @Test public void singleDashIsFile() {
    assertEquals(List.of("-"), parse("-").files);
  }

  @Test public void errors() {
    testError("Unknown option '-x'", "-x");
    testError("Unknown option '-I'", "-pI", "a");
    testError("Option '-p' given more than once", "-p", "-p");
    testError("Option '-v' given more than once", "-vv");
    testError("Option '-e' given more than once", "-e", "a", "-e", "b");
    testError("Missing value for option '-e'", "-e");
    testError("Missing value for option '-m'", "-pm");
  }

  @Test public void help() {
    var error = assertThrows(IllegalArgumentException.class, () -> parse("-p", "-h"));
    assertEquals("usage", error.getMessage());
  }
}
