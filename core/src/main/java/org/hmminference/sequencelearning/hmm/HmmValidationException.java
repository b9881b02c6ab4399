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
 * Thrown when the parameters of a Hidden Markov Model are not well-formed.
 * No {@link HmmModel} is ever created from parameters which caused this exception.
 * @see HmmModelValidator
 */
public class HmmValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    EMPTY_OBSERVATION_STATES,
    DUPLICATE_OBSERVATION_STATE,
    EMPTY_HIDDEN_STATES,
    DUPLICATE_HIDDEN_STATE,
    NON_STOCHASTIC_PRIOR,
    NEGATIVE_PRIOR_PROBABILITY,
    PRIOR_DIMENSION_MISMATCH,
    NON_STOCHASTIC_TRANSITION_ROW,
    NEGATIVE_TRANSITION_PROBABILITY,
    NON_SQUARE_TRANSITION,
    TRANSITION_NOT_TWO_DIMENSIONAL,
    TRANSITION_DIMENSION_MISMATCH,
    NON_STOCHASTIC_EMISSION_ROW,
    NEGATIVE_EMISSION_PROBABILITY,
    EMISSION_DIMENSION_MISMATCH,
    EMISSION_NOT_TWO_DIMENSIONAL
  }

  private final Kind kind;

  public HmmValidationException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
