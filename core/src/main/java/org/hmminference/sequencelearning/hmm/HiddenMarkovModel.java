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

import java.util.List;

/**
 * Entry point for inference over a discrete Hidden Markov Model with labelled states.
 * <pre>
 *   HiddenMarkovModel hmm = HiddenMarkovModel.construct(observationStates, hiddenStates,
 *     prior, transition, emission);
 *   double likelihood = hmm.forward(sequence);
 *   List&lt;String&gt; hiddenPath = hmm.viterbi(sequence);
 * </pre>
 * Instances are immutable and may be used from several threads at once.
 */
public final class HiddenMarkovModel {
  private final HmmModel model;
  private final ForwardAlgorithm forwardAlgorithm;
  private final ViterbiAlgorithm viterbiAlgorithm;

  public HiddenMarkovModel(HmmModel model) {
    if (model == null)
      throw new NullArgumentException("model");
    this.model = model;
    this.forwardAlgorithm = new ForwardAlgorithm(model);
    this.viterbiAlgorithm = new ViterbiAlgorithm(model);
  }

  /**
   * Validates the parameters with the default tolerance and builds a model from them.
   * @throws HmmValidationException if the parameters are not well-formed
   * @see HmmModelValidator#validate(List, List, double[], double[][], double[][])
   */
  public static HiddenMarkovModel construct(List<String> observationStates, List<String> hiddenStates,
                                            double[] prior, double[][] transition, double[][] emission) {
    return new HiddenMarkovModel(new HmmModelValidator().validate(observationStates, hiddenStates,
      prior, transition, emission));
  }

  public HmmModel getModel() {
    return model;
  }

  /**
   * @return likelihood of the observed sequence under this model
   * @throws HmmSequenceException if the sequence is empty or contains an unknown observed state
   */
  public double forward(List<String> sequence) {
    return forwardAlgorithm.likelihood(sequence);
  }

  /**
   * @return the most probable hidden state labels, one per observed state
   * @throws HmmSequenceException if the sequence is empty or contains an unknown observed state
   */
  public List<String> viterbi(List<String> sequence) {
    return viterbiAlgorithm.decode(sequence);
  }
}
