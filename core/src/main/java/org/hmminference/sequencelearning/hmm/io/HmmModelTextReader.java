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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.apache.commons.lang.NullArgumentException;
import org.hmminference.sequencelearning.hmm.HmmModel;
import org.hmminference.sequencelearning.hmm.HmmModelValidator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a model from its plain text description, e.g.
 * <pre>
 * # two-state weather model
 * observation_states walk shop clean
 * hidden_states Rainy Sunny
 * prior 0.6 0.4
 * transition 0.7 0.3
 * transition 0.4 0.6
 * emission 0.1 0.4 0.5
 * emission 0.6 0.3 0.1
 * </pre>
 * Every {@code transition} and {@code emission} line is one matrix row, in hidden state order.
 * Lines starting with {@code #} and blank lines are ignored.
 */
public class HmmModelTextReader {
  static final String OBSERVATION_STATES = "observation_states";
  static final String HIDDEN_STATES = "hidden_states";
  static final String PRIOR = "prior";
  static final String TRANSITION = "transition";
  static final String EMISSION = "emission";

  private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final HmmModelValidator validator;

  public HmmModelTextReader() {
    this(new HmmModelValidator());
  }

  public HmmModelTextReader(HmmModelValidator validator) {
    if (validator == null)
      throw new NullArgumentException("validator");
    this.validator = validator;
  }

  /**
   * @throws IOException if the description is malformed or incomplete
   * @throws org.hmminference.sequencelearning.hmm.HmmValidationException if the parameters are not well-formed
   */
  public HmmModel read(Reader reader) throws IOException {
    List<String> observationStates = null;
    List<String> hiddenStates = null;
    double[] prior = null;
    List<double[]> transition = new ArrayList<double[]>();
    List<double[]> emission = new ArrayList<double[]>();

    BufferedReader lines = new BufferedReader(reader);
    String line;
    int lineNumber = 0;
    while ((line = lines.readLine()) != null) {
      ++lineNumber;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#"))
        continue;

      List<String> fields = FIELDS.splitToList(trimmed);
      String key = fields.get(0);
      List<String> values = fields.subList(1, fields.size());
      if (OBSERVATION_STATES.equals(key)) {
        checkUnique(observationStates, key, lineNumber);
        observationStates = new ArrayList<String>(values);
      } else if (HIDDEN_STATES.equals(key)) {
        checkUnique(hiddenStates, key, lineNumber);
        hiddenStates = new ArrayList<String>(values);
      } else if (PRIOR.equals(key)) {
        checkUnique(prior, key, lineNumber);
        prior = parseProbabilities(values, lineNumber);
      } else if (TRANSITION.equals(key)) {
        transition.add(parseProbabilities(values, lineNumber));
      } else if (EMISSION.equals(key)) {
        emission.add(parseProbabilities(values, lineNumber));
      } else {
        throw new IOException("Line " + lineNumber + ": unknown key '" + key + '\'');
      }
    }

    checkPresent(observationStates, OBSERVATION_STATES);
    checkPresent(hiddenStates, HIDDEN_STATES);
    checkPresent(prior, PRIOR);

    return validator.validate(observationStates, hiddenStates, prior,
      transition.toArray(new double[transition.size()][]), emission.toArray(new double[emission.size()][]));
  }

  private static double[] parseProbabilities(List<String> values, int lineNumber) throws IOException {
    double[] probabilities = new double[values.size()];
    for (int i = 0; i < probabilities.length; ++i) {
      try {
        probabilities[i] = Double.parseDouble(values.get(i));
      } catch (NumberFormatException e) {
        throw new IOException("Line " + lineNumber + ": not a probability '" + values.get(i) + '\'', e);
      }
    }
    return probabilities;
  }

  private static void checkUnique(Object previous, String key, int lineNumber) throws IOException {
    if (previous != null)
      throw new IOException("Line " + lineNumber + ": '" + key + "' is defined twice");
  }

  private static void checkPresent(Object value, String key) throws IOException {
    if (value == null)
      throw new IOException("Missing '" + key + "' in model description");
  }
}
