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
 * component main {public [a, b]} = T(...);
 */
public class MainComponent {
  public final SourceSpan   span;
  public final List<String> publicSignals;
  public final Expr         initializer;

  public MainComponent(SourceSpan span, List<String> publicSignals, Expr initializer) {
    this.span          = span;
    this.publicSignals = List.copyOf(publicSignals);
    this.initializer   = initializer;
  }
}
