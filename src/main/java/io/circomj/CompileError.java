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
import java.util.stream.Collectors;

/**
 * Error detected while parsing. Within the Parser these are thrown to abandon the
 * construct being parsed and are caught at the nearest recovery point where they are
 * turned into a {@link Report}. Callers that prefer an exception over a list of
 * reports can get one that aggregates all errors from {@link ParseResult#throwIfErrors()}.
 */
public class CompileError extends CircomjError {

  private final ReportCode         code;
  private final SourceSpan         span;
  private final List<CompileError> errors;

  public CompileError(String error, Location location) {
    this(ReportCode.IllegalExpression, error, location, null);
  }

  public CompileError(ReportCode code, String error, Location location) {
    this(code, error, location, null);
  }

  /**
   * @param span  the source range the error covers or null to use the token at the location
   */
  public CompileError(ReportCode code, String error, Location location, SourceSpan span) {
    super(error, location);
    this.code   = code;
    this.span   = span;
    this.errors = null;
  }

  /**
   * Aggregate several errors. Code and location are those of the first error.
   */
  public CompileError(List<CompileError> errors) {
    super(errors.get(0).getErrorMessage(), errors.get(0).getLocation());
    this.code   = errors.get(0).getCode();
    this.span   = errors.get(0).getSpan();
    this.errors = List.copyOf(errors);
  }

  public ReportCode getCode() {
    return code;
  }

  public SourceSpan getSpan() {
    return span;
  }

  public List<CompileError> getErrors() {
    return errors == null ? List.of(this) : errors;
  }

  @Override
  public String getMessage() {
    if (errors == null) {
      return super.getMessage();
    }
    return errors.size() + " errors found:\n" +
           errors.stream().map(CircomjError::getMessage).collect(Collectors.joining("\n"));
  }
}
