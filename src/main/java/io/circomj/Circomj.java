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

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point. Parses each file (or the source given with -e) and writes
 * any reports to stderr. Exits with status 1 if any file had errors.
 */
public class Circomj {

  static final String usage =
    "Usage: circomj [options] [file]*\n" +
    "         -e source  : source string is parsed as Circom code (files not used)\n" +
    "         -p         : print parsed program as canonical source\n" +
    "         -u         : leave uninitialised vars without a value\n" +
    "         -f fileId  : file id of first file (incremented for each subsequent file)\n" +
    "         -m modulus : prime of the field (decimal or 0x hex)\n" +
    "         -v         : show verbose errors (give stack trace)\n" +
    "         -h         : print this help\n";

  private final PrintStream out;
  private final PrintStream err;

  Circomj(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int status;
    try {
      status = new Circomj(System.out, System.err).run(args);
    }
    catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      status = 2;
    }
    System.exit(status);
  }

  /**
   * @return 0 if there were no errors, 1 if any file had errors
   * @throws IllegalArgumentException for invalid arguments
   */
  int run(String[] args) {
    CommandLine commandLine = CommandLine.parse(args, usage);
    if (commandLine.source == null && commandLine.files.isEmpty()) {
      throw new IllegalArgumentException("Missing '-e' option and no files specified\n" + usage);
    }

    int        fileId  = commandLine.fileId  == null ? 0 : parseInt(commandLine.fileId, "file id");
    BigInteger modulus = commandLine.modulus == null ? ParseContext.BN254_PRIME : parseModulus(commandLine.modulus);

    boolean failed = false;
    if (commandLine.source != null) {
      failed = !parse("<command line>", commandLine.source, context(commandLine, fileId, modulus), commandLine.print);
    }
    else {
      for (String file: commandLine.files) {
        try {
          String source = Files.readString(Path.of(file));
          failed |= !parse(file, source, context(commandLine, fileId++, modulus), commandLine.print);
        }
        catch (IOException e) {
          err.println(file + ": could not read file: " + e.getMessage());
          if (commandLine.verbose) {
            e.printStackTrace(err);
          }
          failed = true;
        }
      }
    }
    return failed ? 1 : 0;
  }

  private boolean parse(String fileName, String source, ParseContext context, boolean print) {
    ParseResult result = CircomParser.parse(source, context);
    result.getReports().forEach(report -> err.println(report.format(fileName)));
    if (print) {
      out.print(SourcePrinter.print(result.getProgram()));
    }
    return !result.hasErrors();
  }

  private static ParseContext context(CommandLine commandLine, int fileId, BigInteger modulus) {
    return ParseContext.create()
                       .fileId(fileId)
                       .fieldModulus(modulus)
                       .initializeVars(!commandLine.uninitialised)
                       .build();
  }

  private static int parseInt(String value, String what) {
    try {
      return Integer.parseInt(value);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + what + ": " + value, e);
    }
  }

  private static BigInteger parseModulus(String value) {
    try {
      return value.startsWith("0x") || value.startsWith("0X") ? new BigInteger(value.substring(2), 16)
                                                              : new BigInteger(value);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid field modulus: " + value, e);
    }
  }
}
