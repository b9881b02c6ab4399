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
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Forward algorithm: computes the likelihood of an observed sequence by summing the probabilities
 * of all hidden state paths which could have produced it.
 * <p>
 * Probabilities are kept unscaled, so very long sequences underflow to zero.
 */
public class ForwardAlgorithm {
  private static Logger log = LoggerFactory.getLogger(ForwardAlgorithm.class);

  private final HmmModel model;

  public ForwardAlgorithm(HmmModel model) {
    if (model == null)
      throw new NullArgumentException("model");
    this.model = model;
  }

  public HmmModel getModel() {
    return model;
  }

  /**
   * @return P(sequence | model)
   * @throws HmmSequenceException if the sequence is empty or contains a symbol unknown to the model
   */
  public double likelihood(List<String> sequence) {
    return likelihood(model.getStateIndex().observationIndices(sequence));
  }

  /**
   * @param observations indices of observed states
   * @return P(observations | model)
   */
  public double likelihood(int[] observations) {
    Matrix alpha = forwardProbabilities(observations);
    int last = alpha.numRows() - 1;
    double likelihood = 0.0;
    for (int i = 0; i < alpha.numCols(); ++i)
      likelihood += alpha.getQuick(last, i);
    return likelihood;
  }

  /**
   * Computes the forward variables: alpha(t, i) is the joint probability of the first t + 1
   * observations and being in hidden state i at time t.
   *
   * @param observations indices of observed states
   * @return T x N matrix of forward variables
   */
  public Matrix forwardProbabilities(int[] observations) {
    model.getStateIndex().checkObservationIndices(observations);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    log.debug("Running forward pass over {} observations and {} hidden states", observations.length,
      nrOfHiddenStates);

    Matrix alpha = new DenseMatrix(observations.length, nrOfHiddenStates);
    for (int i = 0; i < nrOfHiddenStates; ++i)
      alpha.setQuick(0, i, model.getInitialProbability(i) * model.getEmissionProbability(i, observations[0]));

    for (int t = 1; t < observations.length; ++t) {
      for (int j = 0; j < nrOfHiddenStates; ++j) {
        double sum = 0.0;
        for (int i = 0; i < nrOfHiddenStates; ++i)
          sum += alpha.getQuick(t - 1, i) * model.getTransitionProbability(i, j);
        alpha.setQuick(t, j, sum * model.getEmissionProbability(j, observations[t]));
      }
    }
    return alpha;
  }
}
