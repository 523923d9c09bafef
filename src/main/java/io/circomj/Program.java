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
 * Root of the AST for one source file.
 */
public class Program {
  public final SourceSpan       span;
  public final List<Pragma>     pragmas;
  public final List<String>     includes;
  public final List<Definition> definitions;
  public final MainComponent    mainComponent;   // null if file has no main component

  public Program(SourceSpan span, List<Pragma> pragmas, List<String> includes, List<Definition> definitions,
                 MainComponent mainComponent) {
    this.span          = span;
    this.pragmas       = List.copyOf(pragmas);
    this.includes      = List.copyOf(includes);
    this.definitions   = List.copyOf(definitions);
    this.mainComponent = mainComponent;
  }

  public int getFileId() {
    return span.fileId;
  }

  /**
   * Find definition with given name
   * @param name  the name
   * @return the definition or null if none
   */
  public Definition getDefinition(String name) {
    return definitions.stream().filter(def -> def.name.equals(name)).findFirst().orElse(null);
  }
}
