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

import java.util.List;

/**
 * Top level definitions: functions, templates and buses.
 * The body is always a Block.
 */
public abstract class Definition {

  public final SourceSpan   span;
  public final String       name;
  public final List<String> args;
  public final SourceSpan   argLocation;   // Span of parameter list including parentheses
  public final Stmt.Block   body;

  Definition(SourceSpan span, String name, List<String> args, SourceSpan argLocation, Stmt.Block body) {
    this.span        = span;
    this.name        = name;
    this.args        = List.copyOf(args);
    this.argLocation = argLocation;
    this.body        = body;
  }

  public static class Function extends Definition {
    public Function(SourceSpan span, String name, List<String> args, SourceSpan argLocation, Stmt.Block body) {
      super(span, name, args, argLocation, body);
    }
  }

  public static class Template extends Definition {
    public final boolean parallel;
    public final boolean customGate;
    public Template(SourceSpan span, String name, List<String> args, SourceSpan argLocation, Stmt.Block body,
                    boolean parallel, boolean customGate) {
      super(span, name, args, argLocation, body);
      this.parallel   = parallel;
      this.customGate = customGate;
    }
  }

  public static class Bus extends Definition {
    public Bus(SourceSpan span, String name, List<String> args, SourceSpan argLocation, Stmt.Block body) {
      super(span, name, args, argLocation, body);
    }
  }
}
