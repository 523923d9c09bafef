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

import java.math.BigInteger;

/**
 * Per invocation settings for the Parser. Create using the builder:
 * <pre>
 *   ParseContext context = ParseContext.create()
 *                                      .fileId(3)
 *                                      .initializeVars(false)
 *                                      .build();
 * </pre>
 */
public class ParseContext {

  // Prime of the BN254 scalar field used by default by the Circom compiler
  public static final BigInteger BN254_PRIME =
    new BigInteger("21888242871839275222246405745257275088548364400416034697622273808495617");

  public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

  int        fileId          = 0;
  BigInteger fieldModulus    = BN254_PRIME;

  // Whether "var x;" is followed by an explicit "x = 0" (or uniform array of 0) substitution
  boolean    initializeVars  = true;

  // Maximum nesting of expressions and statements before we give up on the current statement
  int        maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

  ///////////////////////////////

  public static ParseContextBuilder create() {
    return new ParseContext().getParseContextBuilder();
  }

  private ParseContext() {}

  private ParseContextBuilder getParseContextBuilder() {
    return new ParseContextBuilder();
  }

  public class ParseContextBuilder {
    private ParseContextBuilder() {}

    public ParseContextBuilder fileId(int id)                  { fileId          = id;      return this; }
    public ParseContextBuilder fieldModulus(BigInteger prime)  { fieldModulus    = prime;   return this; }
    public ParseContextBuilder initializeVars(boolean value)   { initializeVars  = value;   return this; }
    public ParseContextBuilder maxNestingDepth(int depth)      { maxNestingDepth = depth;   return this; }

    public ParseContext build() {
      if (fieldModulus == null || fieldModulus.compareTo(BigInteger.ONE) <= 0) {
        throw new IllegalArgumentException("Field modulus must be greater than 1");
      }
      if (maxNestingDepth < 1) {
        throw new IllegalArgumentException("Maximum nesting depth must be at least 1");
      }
      return ParseContext.this;
    }
  }

  //////////////////////////////////

  public int        getFileId()          { return fileId; }
  public BigInteger getFieldModulus()    { return fieldModulus; }
  public boolean    initializeVars()     { return initializeVars; }
  public int        getMaxNestingDepth() { return maxNestingDepth; }

  /**
   * The value 1 in the field (used when turning x++ into x = x + 1)
   * @return one in the field
   */
  public BigInteger one() {
    return BigInteger.ONE.mod(fieldModulus);
  }
}
