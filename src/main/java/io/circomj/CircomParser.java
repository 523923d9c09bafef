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
 * Entry point for parsing Circom source code into an AST.
 * Each call parses one file. Includes are returned in the Program but are not
 * followed: callers parse included files separately and merge the results.
 */
public class CircomParser {

  /**
   * Parse source using default settings
   * @param source  the source code
   * @return the ParseResult
   */
  public static ParseResult parse(String source) {
    return parse(source, ParseContext.create().build());
  }

  /**
   * Parse source code. Malformed input never causes an exception: every problem is
   * returned as a Report and the Program contains placeholders for the constructs
   * that could not be parsed.
   * @param source   the source code
   * @param context  the settings for this parse
   * @return the ParseResult with Program and Reports
   */
  public static ParseResult parse(String source, ParseContext context) {
    Parser  parser  = new Parser(new Tokeniser(source), context);
    Program program = parser.parseProgram();
    return new ParseResult(program, parser.getReports());
  }
}
