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

import java.util.Objects;

/**
 * Range of source code (start inclusive, end exclusive) that an AST node was parsed from,
 * together with the id of the file the source came from.
 */
public final class SourceSpan {
  public final int start;
  public final int end;
  public final int fileId;

  public SourceSpan(int start, int end, int fileId) {
    if (start > end) {
      throw new IllegalArgumentException("Span start " + start + " is after end " + end);
    }
    this.start  = start;
    this.end    = end;
    this.fileId = fileId;
  }

  /**
   * Span starting where this one starts and ending where the other one ends
   * @param other  the span to extend to
   * @return the combined span
   */
  public SourceSpan to(SourceSpan other) {
    return new SourceSpan(start, Math.max(start, other.end), fileId);
  }

  public int length() { return end - start; }

  @Override
  public boolean equals(Object o) {
    if (this == o) { return true; }
    if (!(o instanceof SourceSpan)) { return false; }
    SourceSpan that = (SourceSpan) o;
    return start == that.start && end == that.end && fileId == that.fileId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, fileId);
  }

  @Override
  public String toString() {
    return fileId + ":" + start + ".." + end;
  }
}
