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

package org.hmminference.sequencelearning.hmm.io;

import org.apache.commons.lang.NullArgumentException;
import org.apache.hadoop.io.IntWritable;
import org.apache.hadoop.io.Writable;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;
import org.hmminference.sequencelearning.hmm.HmmModel;
import org.hmminference.sequencelearning.hmm.HmmModelValidator;
import org.hmminference.sequencelearning.hmm.HmmValidationException;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary form of a {@link HmmModel}: observed state labels, hidden state labels, initial
 * probabilities, then the rows of the transition and emission matrices.
 * <p>
 * Reading does not trust the stream: {@link #get(HmmModelValidator)} validates the parameters again.
 */
public class HmmModelWritable implements Writable {
  private List<String> observationStates;
  private List<String> hiddenStates;
  private double[] prior;
  private double[][] transition;
  private double[][] emission;

  public HmmModelWritable() {
  }

  public HmmModelWritable(HmmModel model) {
    set(model);
  }

  public void set(HmmModel model) {
    if (model == null)
      throw new NullArgumentException("model");
    observationStates = model.getStateIndex().getObservationStates();
    hiddenStates = model.getStateIndex().getHiddenStates();
    Vector initialProbabilities = model.getInitialProbabilities();
    prior = new double[initialProbabilities.size()];
    for (int i = 0; i < prior.length; ++i)
      prior[i] = initialProbabilities.getQuick(i);
    transition = toArray(model.getTransitionMatrix());
    emission = toArray(model.getEmissionMatrix());
  }

  /**
   * @return the model read by the last {@link #readFields(DataInput)}
   * @throws HmmValidationException if the stored parameters are not well-formed
   */
  public HmmModel get(HmmModelValidator validator) {
    if (prior == null)
      throw new IllegalStateException("Model was not initialized");
    return validator.validate(observationStates, hiddenStates, prior, transition, emission);
  }

  @Override
  public void write(DataOutput output) throws IOException {
    if (prior == null)
      throw new IllegalStateException("Model was not initialized");
    new StateLabelsWritable(observationStates).write(output);
    new StateLabelsWritable(hiddenStates).write(output);
    new ProbabilitiesWritable(prior).write(output);
    writeMatrix(transition, output);
    writeMatrix(emission, output);
  }

  @Override
  public void readFields(DataInput input) throws IOException {
    StateLabelsWritable labels = new StateLabelsWritable();
    labels.readFields(input);
    observationStates = labels.toLabels();
    labels = new StateLabelsWritable();
    labels.readFields(input);
    hiddenStates = labels.toLabels();

    ProbabilitiesWritable probabilities = new ProbabilitiesWritable();
    probabilities.readFields(input);
    prior = probabilities.toRow();

    transition = readMatrix(input);
    emission = readMatrix(input);
  }

  private static void writeMatrix(double[][] matrix, DataOutput output) throws IOException {
    new IntWritable(matrix.length).write(output);
    for (double[] row : matrix)
      new ProbabilitiesWritable(row).write(output);
  }

  private static double[][] readMatrix(DataInput input) throws IOException {
    int count = readCount(input, "matrix rows");
    List<double[]> rows = new ArrayList<double[]>();
    ProbabilitiesWritable row = new ProbabilitiesWritable();
    for (int i = 0; i < count; ++i) {
      row.readFields(input);
      rows.add(row.toRow());
    }
    return rows.toArray(new double[rows.size()][]);
  }

  /**
   * Reads the element count written in front of labels, probabilities and matrix rows.
   */
  static int readCount(DataInput input, String what) throws IOException {
    IntWritable count = new IntWritable();
    count.readFields(input);
    if (count.get() < 0)
      throw new IOException("Corrupt model stream, negative number of " + what + ": " + count.get());
    return count.get();
  }

  private static double[][] toArray(Matrix matrix) {
    double[][] values = new double[matrix.numRows()][matrix.numCols()];
    for (int i = 0; i < values.length; ++i)
      for (int j = 0; j < values[i].length; ++j)
        values[i][j] = matrix.getQuick(i, j);
    return values;
  }
}
