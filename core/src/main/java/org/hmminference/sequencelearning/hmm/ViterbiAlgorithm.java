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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Viterbi algorithm: decodes the most probable sequence of hidden states for the given sequence
 * of observed states.
 * <p>
 * Ties are always resolved to the lowest hidden state index, both for backpointers and for the
 * final state, so decoding is deterministic. Probabilities are not log-scaled.
 */
public class ViterbiAlgorithm {
  private static Logger log = LoggerFactory.getLogger(ViterbiAlgorithm.class);

  private final HmmModel model;

  public ViterbiAlgorithm(HmmModel model) {
    if (model == null)
      throw new NullArgumentException("model");
    this.model = model;
  }

  public HmmModel getModel() {
    return model;
  }

  /**
   * @return labels of the most probable hidden states, one per observed state
   * @throws HmmSequenceException if the sequence is empty or contains a symbol unknown to the model
   */
  public List<String> decode(List<String> sequence) {
    StateIndex stateIndex = model.getStateIndex();
    return stateIndex.hiddenStates(decode(stateIndex.observationIndices(sequence)));
  }

  /**
   * @param observations indices of observed states
   * @return indices of the most probable hidden states
   */
  public int[] decode(int[] observations) {
    model.getStateIndex().checkObservationIndices(observations);
    double[][] delta = new double[observations.length][model.getNrOfHiddenStates()];
    int[][] phi = new int[observations.length][model.getNrOfHiddenStates()];
    viterbi(observations, delta, phi);

    int last = observations.length - 1;
    int[] decoded = new int[observations.length];
    decoded[last] = argmax(delta[last]);
    for (int t = last; t > 0; --t)
      decoded[t - 1] = phi[t][decoded[t]];
    return decoded;
  }

  /**
   * @param observations indices of observed states
   * @return joint probability of the observations and the most probable hidden state path
   */
  public double pathProbability(int[] observations) {
    model.getStateIndex().checkObservationIndices(observations);
    double[][] delta = new double[observations.length][model.getNrOfHiddenStates()];
    int[][] phi = new int[observations.length][model.getNrOfHiddenStates()];
    viterbi(observations, delta, phi);

    double[] lastProbabilities = delta[observations.length - 1];
    return lastProbabilities[argmax(lastProbabilities)];
  }

  /**
   * Fills delta(t, j), the probability of the best path ending in hidden state j at time t,
   * and phi(t, j), the predecessor of j on that path. Row 0 of phi is unused.
   */
  private void viterbi(int[] observations, double[][] delta, int[][] phi) {
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    log.debug("Decoding {} observations over {} hidden states", observations.length, nrOfHiddenStates);

    for (int j = 0; j < nrOfHiddenStates; ++j)
      delta[0][j] = model.getInitialProbability(j) * model.getEmissionProbability(j, observations[0]);

    for (int t = 1; t < observations.length; ++t) {
      for (int j = 0; j < nrOfHiddenStates; ++j) {
        double emission = model.getEmissionProbability(j, observations[t]);
        int maxState = 0;
        double maxProb = delta[t - 1][0] * model.getTransitionProbability(0, j) * emission;
        for (int i = 1; i < nrOfHiddenStates; ++i) {
          double currentProb = delta[t - 1][i] * model.getTransitionProbability(i, j) * emission;
          if (currentProb > maxProb) {
            maxProb = currentProb;
            maxState = i;
          }
        }
        delta[t][j] = maxProb;
        phi[t][j] = maxState;
      }
    }
  }

  private static int argmax(double[] probabilities) {
    int maxState = 0;
    for (int k = 1; k < probabilities.length; ++k) {
      if (probabilities[k] > probabilities[maxState])
        maxState = k;
    }
    return maxState;
  }
}
