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
 * An offset into a source file. Line and column are derived from the offset the first
 * time they are needed, since most positions never end up in a diagnostic.
 */
public class Location {
  protected final String source;
  protected final int    offset;

  private String line;
  private int    lineNum = 0;   // 1-based once resolved
  private int    column;        // 1-based

  protected Location(String source, int offset) {
    this.source = source;
    this.offset = offset;
  }

  public static Location at(String source, int offset) {
    return new Location(source, offset);
  }

  public String getSource() { return source; }
  public int    getOffset() { return offset; }

  public String getLine()    { resolve(); return line; }
  public int    getLineNum() { resolve(); return lineNum; }
  public int    getColumn()  { resolve(); return column; }

  /**
   * @return the source line followed by a line with a '^' under this position
   */
  public String getMarkedSourceLine() {
    resolve();
    return String.format("%s%n%s^", line, " ".repeat(column - 1));
  }

  private void resolve() {
    if (lineNum > 0) {
      return;
    }
    // Offsets past the end (EOF) sit just after the last char of the last line
    int pos       = Math.min(offset, source.length());
    int lineStart = source.lastIndexOf('\n', pos - 1) + 1;
    int lineEnd   = source.indexOf('\n', pos);
    if (lineEnd == -1) {
      lineEnd = source.length();
    }
    line    = source.substring(lineStart, lineEnd).replace("\r", "");
    lineNum = 1;
    for (int i = source.indexOf('\n'); i != -1 && i < lineStart; i = source.indexOf('\n', i + 1)) {
      lineNum++;
    }
    column  = pos - lineStart + 1;
  }
}
