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

import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

/**
 * Immutable parameters of a discrete first-order Hidden Markov Model: initial hidden state
 * probabilities, the hidden state transition matrix and the emission matrix, along with the
 * labels of hidden and observed states.
 * <p>
 * Instances are created only by {@link HmmModelValidator}, so every model satisfies the
 * stochastic constraints. Matrix getters return copies; a model may be shared between threads.
 */
public final class HmmModel {
  private final StateIndex stateIndex;
  /** prior[i] = P(first hidden state = i) */
  private final Vector initialProbabilities;
  /** transition(i, j) = P(next hidden state = j | current hidden state = i) */
  private final Matrix transitionMatrix;
  /** emission(i, k) = P(observed state = k | hidden state = i) */
  private final Matrix emissionMatrix;

  HmmModel(StateIndex stateIndex, double[] prior, double[][] transition, double[][] emission) {
    this.stateIndex = stateIndex;
    this.initialProbabilities = new DenseVector(prior.clone());
    this.transitionMatrix = toMatrix(transition);
    this.emissionMatrix = toMatrix(emission);
  }

  private static Matrix toMatrix(double[][] values) {
    Matrix matrix = new DenseMatrix(values.length, values[0].length);
    for (int i = 0; i < values.length; ++i)
      for (int j = 0; j < values[i].length; ++j)
        matrix.setQuick(i, j, values[i][j]);
    return matrix;
  }

  public StateIndex getStateIndex() {
    return stateIndex;
  }

  public int getNrOfHiddenStates() {
    return initialProbabilities.size();
  }

  public int getNrOfObservationStates() {
    return emissionMatrix.numCols();
  }

  public Vector getInitialProbabilities() {
    return initialProbabilities.clone();
  }

  public Matrix getTransitionMatrix() {
    return transitionMatrix.clone();
  }

  public Matrix getEmissionMatrix() {
    return emissionMatrix.clone();
  }

  double getInitialProbability(int hiddenState) {
    return initialProbabilities.getQuick(hiddenState);
  }

  double getTransitionProbability(int from, int to) {
    return transitionMatrix.getQuick(from, to);
  }

  double getEmissionProbability(int hiddenState, int observation) {
    return emissionMatrix.getQuick(hiddenState, observation);
  }

  @Override
  public String toString() {
    return "HmmModel{hiddenStates=" + stateIndex.getHiddenStates()
      + ", observationStates=" + stateIndex.getObservationStates() + '}';
  }
}
