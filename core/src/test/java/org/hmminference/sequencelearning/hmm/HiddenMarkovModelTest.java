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

import org.hmminference.sequencelearning.hmm.io.HmmModelTextReader;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class HiddenMarkovModelTest extends HmmTestCase {

  static HmmModel readFixture(String name) throws IOException {
    Reader reader = new InputStreamReader(HiddenMarkovModelTest.class.getResourceAsStream("/" + name),
      StandardCharsets.UTF_8);
    try {
      return new HmmModelTextReader().read(reader);
    } finally {
      reader.close();
    }
  }

  @Test
  public void testConstruct() {
    HiddenMarkovModel hmm = HiddenMarkovModel.construct(WEATHER_OBSERVATIONS, WEATHER_HIDDEN,
      WEATHER_PRIOR, WEATHER_TRANSITION, WEATHER_EMISSION);
    assertEquals(WALK_SHOP_CLEAN_LIKELIHOOD, hmm.forward(WALK_SHOP_CLEAN), 1e-12);
    assertEquals(Arrays.asList("Sunny", "Rainy", "Rainy"), hmm.viterbi(WALK_SHOP_CLEAN));
    assertEquals(WEATHER_HIDDEN, hmm.getModel().getStateIndex().getHiddenStates());
  }

  @Test
  public void testConstructRejectsInvalidParameters() {
    try {
      HiddenMarkovModel.construct(WEATHER_OBSERVATIONS, WEATHER_HIDDEN,
        new double[] {0.6, 0.6}, WEATHER_TRANSITION, WEATHER_EMISSION);
      fail();
    } catch (HmmValidationException e) {
      assertEquals(HmmValidationException.Kind.NON_STOCHASTIC_PRIOR, e.getKind());
      assertEquals("Prior probabilities need to sum to 1", e.getMessage());
    }
  }

  @Test
  public void testMiniWeather() throws IOException {
    HiddenMarkovModel hmm = new HiddenMarkovModel(readFixture("mini_weather.hmm"));
    assertEquals(WALK_SHOP_CLEAN_LIKELIHOOD, hmm.forward(WALK_SHOP_CLEAN), 1e-12);

    List<String> decoded = hmm.viterbi(WALK_SHOP_CLEAN);
    assertEquals(WALK_SHOP_CLEAN.size(), decoded.size());
    assertEquals(Arrays.asList("Sunny", "Rainy", "Rainy"), decoded);
  }

  @Test
  public void testMiniWeatherEdgeCases() throws IOException {
    HiddenMarkovModel hmm = new HiddenMarkovModel(readFixture("mini_weather.hmm"));
    for (int attempt = 0; attempt < 2; ++attempt) {
      try {
        if (attempt == 0)
          hmm.forward(Collections.<String>emptyList());
        else
          hmm.viterbi(Collections.<String>emptyList());
        fail();
      } catch (HmmSequenceException e) {
        assertEquals(HmmSequenceException.Kind.EMPTY_SEQUENCE, e.getKind());
      }
      try {
        if (attempt == 0)
          hmm.forward(Arrays.asList("walk", "dog"));
        else
          hmm.viterbi(Arrays.asList("walk", "dog"));
        fail();
      } catch (HmmSequenceException e) {
        assertEquals("Invalid observation state: dog", e.getMessage());
      }
    }
  }

  @Test
  public void testFullWeather() throws IOException {
    HmmModel fullModel = readFixture("full_weather.hmm");
    HiddenMarkovModel hmm = new HiddenMarkovModel(fullModel);
    assertEquals(3, fullModel.getNrOfHiddenStates());
    assertEquals(4, fullModel.getNrOfObservationStates());

    assertEquals(Arrays.asList("Sunny", "Sunny"), hmm.viterbi(Arrays.asList("walk", "walk")));
    assertEquals(Arrays.asList("Sunny", "Sunny"), hmm.viterbi(Arrays.asList("walk", "shop")));
    assertEquals(Arrays.asList("Rainy", "Rainy", "Rainy"), hmm.viterbi(Arrays.asList("clean", "read", "read")));

    List<String> sequence = Arrays.asList("walk", "shop", "read", "clean", "read", "walk", "walk");
    int[] observations = fullModel.getStateIndex().observationIndices(sequence);
    double expected = bruteForceLikelihood(fullModel, observations);
    assertEquals(expected, hmm.forward(sequence), expected * 1e-10);

    List<String> decoded = hmm.viterbi(sequence);
    assertEquals(sequence.size(), decoded.size());
    int[] path = new int[decoded.size()];
    for (int t = 0; t < path.length; ++t)
      path[t] = fullModel.getStateIndex().getHiddenStates().indexOf(decoded.get(t));
    double best = bruteForceBestPathProbability(fullModel, observations);
    assertEquals(best, jointProbability(fullModel, path, observations), best * 1e-10);
  }

  @Test
  public void testConcurrentCalls() throws Exception {
    final HiddenMarkovModel hmm = new HiddenMarkovModel(model);
    final List<String> sequence = Arrays.asList("walk", "clean", "shop", "shop", "walk", "clean");
    final double expectedLikelihood = hmm.forward(sequence);
    final List<String> expectedPath = hmm.viterbi(sequence);

    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<Boolean>> results = new ArrayList<Future<Boolean>>();
      for (int task = 0; task < 16; ++task) {
        results.add(executor.submit(new Callable<Boolean>() {
          @Override
          public Boolean call() {
            for (int i = 0; i < 200; ++i) {
              if (hmm.forward(sequence) != expectedLikelihood || !expectedPath.equals(hmm.viterbi(sequence)))
                return false;
            }
            return true;
          }
        }));
      }
      for (Future<Boolean> result : results)
        assertTrue(result.get());
    } finally {
      executor.shutdown();
    }
  }
}
