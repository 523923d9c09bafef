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
 * Pragmas at the start of a file:
 * <pre>
 *   pragma circom 2.1.6;
 *   pragma custom_templates;
 * </pre>
 * Pragmas that could not be understood are kept as Unrecognized so that later
 * phases can see that there was something there.
 */
public abstract class Pragma {

  public final SourceSpan span;

  Pragma(SourceSpan span) {
    this.span = span;
  }

  public static class Version extends Pragma {
    public final int major;
    public final int minor;
    public final int patch;
    public Version(SourceSpan span, int major, int minor, int patch) {
      super(span);
      this.major = major;
      this.minor = minor;
      this.patch = patch;
    }
    @Override public String toString() { return major + "." + minor + "." + patch; }
  }

  public static class CustomGates extends Pragma {
    public CustomGates(SourceSpan span) { super(span); }
  }

  public static class Unrecognized extends Pragma {
    public Unrecognized(SourceSpan span) { super(span); }
  }
}
