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
 * Result of parsing a file: the (possibly partial) Program and the reports in
 * the order they were produced.
 */
public class ParseResult {
  private final Program      program;
  private final List<Report> reports;

  public ParseResult(Program program, List<Report> reports) {
    this.program = program;
    this.reports = List.copyOf(reports);
  }

  public Program      getProgram() { return program; }
  public List<Report> getReports() { return reports; }

  public boolean hasErrors() {
    return !reports.isEmpty();
  }

  /**
   * Reports of the given kind
   * @param code  the report code
   * @return list of matching reports
   */
  public List<Report> getReports(ReportCode code) {
    return reports.stream().filter(report -> report.getCode() == code).collect(Collectors.toList());
  }

  /**
   * Throw a CompileError listing all reports if there were any
   * @return the Program if there were no reports
   */
  public Program throwIfErrors() {
    if (reports.isEmpty()) {
      return program;
    }
    if (reports.size() == 1) {
      throw reports.get(0).toError();
    }
    throw new CompileError(reports.stream().map(Report::toError).collect(Collectors.toList()));
  }
}
