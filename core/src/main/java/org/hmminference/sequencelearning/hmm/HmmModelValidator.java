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

import org.apache.commons.lang.NullArgumentException;
import org.hmminference.sequencelearning.hmm.HmmValidationException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks the parameters of a Hidden Markov Model and builds an {@link HmmModel} from them.
 * <p>
 * Checks run in blocks: state labels, initial probabilities, transition matrix, emission matrix.
 * The first violated constraint is reported with an {@link HmmValidationException}; violations are
 * not aggregated. All three stochastic checks (prior and the rows of both matrices) use the same
 * absolute tolerance.
 */
public class HmmModelValidator {
  public static final double DEFAULT_TOLERANCE = 1e-9;

  private static Logger log = LoggerFactory.getLogger(HmmModelValidator.class);

  private final double tolerance;

  public HmmModelValidator() {
    this(DEFAULT_TOLERANCE);
  }

  public HmmModelValidator(double tolerance) {
    if (!(tolerance >= 0))
      throw new IllegalArgumentException("tolerance");
    this.tolerance = tolerance;
  }

  public double getTolerance() {
    return tolerance;
  }

  /**
   * Validates the given parameters and copies them into a new model.
   * The arrays are not retained, so callers may modify them afterwards.
   *
   * @param observationStates labels of observed states, in the column order of the emission matrix
   * @param hiddenStates labels of hidden states, in the row order of all parameters
   * @param prior initial probability of every hidden state
   * @param transition transition[i][j] is the probability of moving from hidden state i to j
   * @param emission emission[i][k] is the probability of observing k in hidden state i
   * @throws HmmValidationException if any constraint is violated
   */
  public HmmModel validate(List<String> observationStates, List<String> hiddenStates,
                           double[] prior, double[][] transition, double[][] emission) {
    if (prior == null)
      throw new NullArgumentException("prior");
    if (transition == null)
      throw new NullArgumentException("transition");
    if (emission == null)
      throw new NullArgumentException("emission");

    StateIndex stateIndex = new StateIndex(observationStates, hiddenStates);
    int nrOfHiddenStates = stateIndex.getNrOfHiddenStates();
    int nrOfObservationStates = stateIndex.getNrOfObservationStates();

    checkPrior(prior, nrOfHiddenStates);
    checkTransition(transition, nrOfHiddenStates);
    checkEmission(emission, nrOfHiddenStates, nrOfObservationStates);

    log.debug("Validated model with {} hidden and {} observed states", nrOfHiddenStates, nrOfObservationStates);
    return new HmmModel(stateIndex, prior, transition, emission);
  }

  private void checkPrior(double[] prior, int nrOfHiddenStates) {
    if (!sumsToOne(prior))
      throw reject(Kind.NON_STOCHASTIC_PRIOR, "Prior probabilities need to sum to 1");
    // a double[] is always one-dimensional
    if (hasNegative(prior))
      throw reject(Kind.NEGATIVE_PRIOR_PROBABILITY, "Prior probabilities cannot be negative");
    if (prior.length != nrOfHiddenStates)
      throw reject(Kind.PRIOR_DIMENSION_MISMATCH,
        "The number of prior probabilities should correspond to the number of hidden states");
  }

  private void checkTransition(double[][] transition, int nrOfHiddenStates) {
    for (double[] row : transition) {
      if (row != null && !sumsToOne(row))
        throw reject(Kind.NON_STOCHASTIC_TRANSITION_ROW,
          "Every row of transition probability matrix must sum to 1");
    }
    for (double[] row : transition) {
      if (row != null && hasNegative(row))
        throw reject(Kind.NEGATIVE_TRANSITION_PROBABILITY, "Transition probabilities cannot be negative");
    }
    for (double[] row : transition) {
      if (row != null && row.length != transition.length)
        throw reject(Kind.NON_SQUARE_TRANSITION, "Transition probability matrix should be square");
    }
    if (transition.length == 0 || hasNullRow(transition))
      throw reject(Kind.TRANSITION_NOT_TWO_DIMENSIONAL, "Transition probability matrix should be 2D");
    if (transition.length != nrOfHiddenStates)
      throw reject(Kind.TRANSITION_DIMENSION_MISMATCH,
        "The number of states in the transition probability matrix should be equal to the number of hidden states");
  }

  private void checkEmission(double[][] emission, int nrOfHiddenStates, int nrOfObservationStates) {
    for (double[] row : emission) {
      if (row != null && !sumsToOne(row))
        throw reject(Kind.NON_STOCHASTIC_EMISSION_ROW,
          "Every row of emission probability matrix must sum to 1");
    }
    for (double[] row : emission) {
      if (row != null && hasNegative(row))
        throw reject(Kind.NEGATIVE_EMISSION_PROBABILITY, "Emission probabilities cannot be negative");
    }
    if (emission.length != nrOfHiddenStates)
      throw reject(Kind.EMISSION_DIMENSION_MISMATCH,
        "The number of emission probabilities should correspond to number of hidden states");
    boolean rectangular = !hasNullRow(emission);
    for (int i = 0; rectangular && i < emission.length; ++i)
      rectangular = emission[i].length == nrOfObservationStates;
    if (!rectangular)
      throw reject(Kind.EMISSION_NOT_TWO_DIMENSIONAL,
        "Emission probability matrix should be 2D with one column per observation state");
  }

  private boolean sumsToOne(double[] probabilities) {
    double sum = 0;
    for (double p : probabilities)
      sum += p;
    // NaN fails this comparison
    return Math.abs(sum - 1.0) <= tolerance;
  }

  private static boolean hasNegative(double[] probabilities) {
    for (double p : probabilities) {
      if (p < 0)
        return true;
    }
    return false;
  }

  private static boolean hasNullRow(double[][] matrix) {
    for (double[] row : matrix) {
      if (row == null)
        return true;
    }
    return false;
  }

  private static HmmValidationException reject(Kind kind, String message) {
    log.debug("Rejecting model parameters ({}): {}", kind, message);
    return new HmmValidationException(kind, message);
  }
}
