/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hmminference.sequencelearning.hmm;

/**
 * Thrown by the inference algorithms when an observed sequence could not be processed.
 * The model itself stays valid and may be used for further calls.
 */
public class HmmSequenceException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    EMPTY_SEQUENCE,
    UNKNOWN_SYMBOL
  }

  private final Kind kind;
  private final String symbol;

  private HmmSequenceException(Kind kind, String message, String symbol) {
    super(message);
    this.kind = kind;
    this.symbol = symbol;
  }

  public static HmmSequenceException emptySequence() {
    return new HmmSequenceException(Kind.EMPTY_SEQUENCE, "input sequence shouldn't be empty", null);
  }

  public static HmmSequenceException unknownSymbol(String symbol) {
    return new HmmSequenceException(Kind.UNKNOWN_SYMBOL, "Invalid observation state: " + symbol, symbol);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return the observation symbol which is missing from the alphabet, or null for an empty sequence
   */
  public String getSymbol() {
    return symbol;
  }
}
