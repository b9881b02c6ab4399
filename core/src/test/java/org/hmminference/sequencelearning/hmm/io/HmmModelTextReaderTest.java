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

import org.hmminference.sequencelearning.hmm.HmmModel;
import org.hmminference.sequencelearning.hmm.HmmValidationException;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

public class HmmModelTextReaderTest extends Assert {
  private static final String WEATHER =
    "# weather\n"
      + "observation_states walk shop clean\n"
      + "hidden_states   Rainy\tSunny\n"
      + "\n"
      + "prior 0.6 0.4\n"
      + "transition 0.7 0.3\n"
      + "transition 0.4 0.6\n"
      + "emission 0.1 0.4 0.5\n"
      + "emission 0.6 0.3 0.1\n";

  private static HmmModel read(String text) throws IOException {
    return new HmmModelTextReader().read(new StringReader(text));
  }

  private static void assertMalformed(String text, String message) {
    try {
      read(text);
      fail("Expected IOException: " + message);
    } catch (IOException e) {
      assertEquals(message, e.getMessage());
    }
  }

  @Test
  public void testRead() throws IOException {
    HmmModel model = read(WEATHER);
    assertEquals(Arrays.asList("walk", "shop", "clean"), model.getStateIndex().getObservationStates());
    assertEquals(Arrays.asList("Rainy", "Sunny"), model.getStateIndex().getHiddenStates());
    assertEquals(0.4, model.getInitialProbabilities().get(1), 0.0);
    assertEquals(0.4, model.getTransitionMatrix().get(1, 0), 0.0);
    assertEquals(0.5, model.getEmissionMatrix().get(0, 2), 0.0);
  }

  @Test
  public void testMalformedDescriptions() {
    assertMalformed(WEATHER + "start 1\n", "Line 10: unknown key 'start'");
    assertMalformed(WEATHER.replace("prior 0.6 0.4", "prior 0.6 zero"), "Line 5: not a probability 'zero'");
    assertMalformed(WEATHER + "prior 0.5 0.5\n", "Line 10: 'prior' is defined twice");
    assertMalformed(WEATHER.replace("hidden_states   Rainy\tSunny\n", ""), "Missing 'hidden_states' in model description");
  }

  @Test
  public void testParametersAreValidated() throws IOException {
    try {
      read(WEATHER.replace("transition 0.4 0.6", "transition 0.4 0.5"));
      fail();
    } catch (HmmValidationException e) {
      assertEquals(HmmValidationException.Kind.NON_STOCHASTIC_TRANSITION_ROW, e.getKind());
    }
    try {
      read(WEATHER.replace("transition 0.7 0.3\n", ""));
      fail();
    } catch (HmmValidationException e) {
      assertEquals(HmmValidationException.Kind.NON_SQUARE_TRANSITION, e.getKind());
    }
  }
}
