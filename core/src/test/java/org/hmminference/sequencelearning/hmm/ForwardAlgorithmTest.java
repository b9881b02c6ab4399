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

import org.apache.mahout.math.Matrix;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

public class ForwardAlgorithmTest extends HmmTestCase {
  private final double epsilon = 1e-12;

  @Test
  public void testWeatherLikelihood() {
    ForwardAlgorithm forward = new ForwardAlgorithm(model);
    assertEquals(WALK_SHOP_CLEAN_LIKELIHOOD, forward.likelihood(WALK_SHOP_CLEAN), epsilon);
  }

  @Test
  public void testForwardVariables() {
    Matrix alpha = new ForwardAlgorithm(model).forwardProbabilities(new int[] {0, 1, 2});
    assertEquals(3, alpha.numRows());
    assertEquals(2, alpha.numCols());

    assertEquals(0.06, alpha.get(0, 0), epsilon);
    assertEquals(0.24, alpha.get(0, 1), epsilon);
    assertEquals(0.0552, alpha.get(1, 0), epsilon);
    assertEquals(0.0486, alpha.get(1, 1), epsilon);
    assertEquals(0.02904, alpha.get(2, 0), epsilon);
    assertEquals(0.004572, alpha.get(2, 1), epsilon);
  }

  @Test
  public void testSingleObservation() {
    // prior . emission column of "clean": 0.6 * 0.5 + 0.4 * 0.1
    assertEquals(0.34, new ForwardAlgorithm(model).likelihood(Arrays.asList("clean")), epsilon);
  }

  @Test
  public void testMatchesSumOverAllPaths() {
    ForwardAlgorithm forward = new ForwardAlgorithm(model);
    Random random = new Random(1234L);
    for (int length = 1; length <= 8; ++length) {
      int[] observations = new int[length];
      for (int t = 0; t < length; ++t)
        observations[t] = random.nextInt(model.getNrOfObservationStates());
      double expected = bruteForceLikelihood(model, observations);
      assertEquals(expected, forward.likelihood(observations), expected * 1e-10);
    }
  }

  @Test
  public void testLikelihoodIsProbability() {
    ForwardAlgorithm forward = new ForwardAlgorithm(model);
    double total = 0.0;
    // every sequence of length 2, the likelihoods add up to one
    for (int a = 0; a < 3; ++a) {
      for (int b = 0; b < 3; ++b) {
        double likelihood = forward.likelihood(new int[] {a, b});
        assertTrue(likelihood > 0.0 && likelihood <= 1.0);
        total += likelihood;
      }
    }
    assertEquals(1.0, total, epsilon);
  }

  @Test
  public void testLongSequenceUnderflows() {
    ForwardAlgorithm forward = new ForwardAlgorithm(model);
    String[] cleans = new String[5000];
    Arrays.fill(cleans, "clean");
    assertEquals(0.0, forward.likelihood(Arrays.asList(cleans)), 0.0);

    // Sunny -> Sunny emitting walk multiplies by 0.6 twice, which rounds the smallest subnormal to itself
    String[] walks = new String[5000];
    Arrays.fill(walks, "walk");
    double likelihood = forward.likelihood(Arrays.asList(walks));
    assertTrue(likelihood > 0.0 && likelihood < Double.MIN_NORMAL);
  }

  @Test
  public void testEmptySequence() {
    try {
      new ForwardAlgorithm(model).likelihood(Collections.<String>emptyList());
      fail();
    } catch (HmmSequenceException e) {
      assertEquals(HmmSequenceException.Kind.EMPTY_SEQUENCE, e.getKind());
    }
    try {
      new ForwardAlgorithm(model).likelihood(new int[0]);
      fail();
    } catch (HmmSequenceException e) {
      assertEquals(HmmSequenceException.Kind.EMPTY_SEQUENCE, e.getKind());
    }
  }

  @Test
  public void testUnknownSymbol() {
    ForwardAlgorithm forward = new ForwardAlgorithm(model);
    try {
      forward.likelihood(Arrays.asList("walk", "dog", "shop"));
      fail();
    } catch (HmmSequenceException e) {
      assertEquals(HmmSequenceException.Kind.UNKNOWN_SYMBOL, e.getKind());
      assertEquals("Invalid observation state: dog", e.getMessage());
    }
    // the model is still usable
    assertEquals(WALK_SHOP_CLEAN_LIKELIHOOD, forward.likelihood(WALK_SHOP_CLEAN), epsilon);
  }
}
