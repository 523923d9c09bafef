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
 * Base class of the errors thrown by circomj. Holds the message without any location
 * information and the Location (if known) that the error refers to.
 */
public class CircomjError extends RuntimeException {

  private final String   errorMessage;
  private final Location location;

  public CircomjError(String errorMessage, Location location) {
    // Errors are used for flow control within the Parser so we don't capture stack traces
    super(null, null, false, false);
    this.errorMessage = errorMessage;
    this.location     = location;
  }

  public Location getLocation() {
    return location;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  /**
   * Message with line and column (if known) but without the marked source line
   * @return the message
   */
  public String getSingleLineMessage() {
    if (location == null || location.getSource() == null) {
      return errorMessage;
    }
    return errorMessage + " @ line " + location.getLineNum() + ", column " + location.getColumn();
  }

  @Override
  public String getMessage() {
    if (location == null || location.getSource() == null) {
      return getSingleLineMessage();
    }
    return getSingleLineMessage() + "\n" + location.getMarkedSourceLine();
  }
}
