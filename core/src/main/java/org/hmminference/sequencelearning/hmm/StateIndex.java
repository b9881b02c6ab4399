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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang.NullArgumentException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps labels of a model to matrix positions.
 * Observation labels are looked up by name (label to column of the emission matrix),
 * hidden states only by position, since they are needed only to label a decoded path.
 */
public final class StateIndex {
  private final ImmutableMap<String, Integer> observationStates;
  private final ImmutableList<String> hiddenStates;

  StateIndex(List<String> observationStates, List<String> hiddenStates) {
    if (observationStates == null)
      throw new NullArgumentException("observationStates");
    if (hiddenStates == null)
      throw new NullArgumentException("hiddenStates");

    if (observationStates.isEmpty())
      throw new HmmValidationException(HmmValidationException.Kind.EMPTY_OBSERVATION_STATES,
        "Observation states should not be empty");
    Map<String, Integer> indices = new LinkedHashMap<String, Integer>();
    for (String label : observationStates) {
      if (label == null)
        throw new NullArgumentException("observation state");
      if (indices.containsKey(label))
        throw new HmmValidationException(HmmValidationException.Kind.DUPLICATE_OBSERVATION_STATE,
          "Duplicate observation state: " + label);
      indices.put(label, indices.size());
    }

    if (hiddenStates.isEmpty())
      throw new HmmValidationException(HmmValidationException.Kind.EMPTY_HIDDEN_STATES,
        "Hidden states should not be empty");
    Set<String> seen = new HashSet<String>();
    for (String label : hiddenStates) {
      if (label == null)
        throw new NullArgumentException("hidden state");
      if (!seen.add(label))
        throw new HmmValidationException(HmmValidationException.Kind.DUPLICATE_HIDDEN_STATE,
          "Duplicate hidden state: " + label);
    }

    this.observationStates = ImmutableMap.copyOf(indices);
    this.hiddenStates = ImmutableList.copyOf(hiddenStates);
  }

  public int getNrOfObservationStates() {
    return observationStates.size();
  }

  public int getNrOfHiddenStates() {
    return hiddenStates.size();
  }

  /**
   * @return observation labels in column order
   */
  public List<String> getObservationStates() {
    return observationStates.keySet().asList();
  }

  /**
   * @return hidden state labels in row order
   */
  public List<String> getHiddenStates() {
    return hiddenStates;
  }

  public int observationIndex(String label) {
    Integer index = observationStates.get(label);
    if (index == null)
      throw HmmSequenceException.unknownSymbol(label);
    return index;
  }

  /**
   * Resolves a whole observed sequence. Every symbol is checked before anything is returned.
   * @throws HmmSequenceException if the sequence is empty or contains an unknown symbol
   */
  public int[] observationIndices(List<String> sequence) {
    if (sequence == null)
      throw new NullArgumentException("sequence");
    if (sequence.isEmpty())
      throw HmmSequenceException.emptySequence();

    int[] indices = new int[sequence.size()];
    int i = 0;
    for (String label : sequence)
      indices[i++] = observationIndex(label);
    return indices;
  }

  /**
   * Checks an already resolved sequence of observation indices.
   * @throws HmmSequenceException if the sequence is empty or an index is out of the alphabet
   */
  public void checkObservationIndices(int[] observations) {
    if (observations == null)
      throw new NullArgumentException("observations");
    if (observations.length == 0)
      throw HmmSequenceException.emptySequence();
    for (int observation : observations) {
      if (observation < 0 || observation >= observationStates.size())
        throw HmmSequenceException.unknownSymbol(String.valueOf(observation));
    }
  }

  public String hiddenState(int index) {
    Preconditions.checkElementIndex(index, hiddenStates.size(), "hidden state index");
    return hiddenStates.get(index);
  }

  public List<String> hiddenStates(int[] path) {
    List<String> labels = new ArrayList<String>(path.length);
    for (int state : path)
      labels.add(hiddenState(state));
    return labels;
  }
}
