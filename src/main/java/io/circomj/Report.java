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
 * A diagnostic produced by the Parser. Reports never stop the parse: the construct
 * that caused the report is replaced with a placeholder and parsing carries on.
 */
public class Report {
  private final ReportCode code;
  private final String     message;
  private final SourceSpan span;
  private final Location   location;   // Used for line/column info when printing

  public Report(ReportCode code, String message, SourceSpan span, Location location) {
    this.code     = code;
    this.message  = message;
    this.span     = span;
    this.location = location;
  }

  public ReportCode getCode()     { return code; }
  public String     getMessage()  { return message; }
  public SourceSpan getSpan()     { return span; }
  public int        getFileId()   { return span.fileId; }
  public Location   getLocation() { return location; }

  /**
   * Convert to a CompileError (for callers that want an exception)
   * @return the CompileError
   */
  public CompileError toError() {
    return new CompileError(code, message, location, span);
  }

  /**
   * Format the report with line and column and the marked source line
   * @param fileName  name of file to show in the message
   * @return the formatted report
   */
  public String format(String fileName) {
    if (location == null || location.getSource() == null) {
      return String.format("%s: %s: %s", fileName, code, message);
    }
    return String.format("%s:%d:%d: %s: %s%n%s", fileName, location.getLineNum(), location.getColumn(),
                         code, message, location.getMarkedSourceLine());
  }

  @Override
  public String toString() {
    return code + "@" + span + ": " + message;
  }
}
