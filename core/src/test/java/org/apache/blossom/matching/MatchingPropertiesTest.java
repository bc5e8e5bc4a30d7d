/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.blossom.matching;

import org.apache.blossom.util.Pair;
import org.apache.blossom.util.graph.EdgeWeigher;
import org.apache.blossom.util.graph.WeightedUndirectedGraph;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.apache.blossom.matching.MatchingFixtures.bruteForce;
import static org.apache.blossom.matching.MatchingFixtures.randomGraph;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Checks matchings of random graphs against an exhaustive search.
 */
public class MatchingPropertiesTest {
  private static final double DELTA = 1e-9;

  private static final MatchingOptions EXACT =
      MatchingOptions.DEFAULT.withIntegerWeights(true).withVerify(true);

  /** Compares a computed matching with the brute-force optimum. */
  private static void checkOptimal(WeightedUndirectedGraph<Integer> graph,
      MatchingOptions options) {
    final boolean maxCardinality = options.isMaxCardinality();
    final Set<Pair<Integer, Integer>> matching =
        Matchings.maxWeightMatching(graph, options);
    final String message = graph + " " + matching;
    assertTrue(message, Matchings.isMatching(graph, matching));

    final MatchingFixtures.Optimum optimum = bruteForce(graph, maxCardinality, false);
    assertEquals(message, optimum.weight,
        Matchings.matchingWeight(graph, matching, EdgeWeigher.DEFAULT), DELTA);
    if (maxCardinality) {
      assertEquals(message, optimum.cardinality, matching.size());
    }
  }

  @Test public void testRandomPositiveWeights() {
    final Random random = new Random(42);
    for (int i = 0; i < 300; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, random.nextInt(9), 0.2 + 0.7 * random.nextDouble(), 1, 20, 1);
      checkOptimal(graph, MatchingOptions.DEFAULT);
      checkOptimal(graph, MatchingOptions.DEFAULT.withMaxCardinality(true));
      checkOptimal(graph, EXACT);
      checkOptimal(graph, EXACT.withMaxCardinality(true));
    }
  }

  @Test public void testRandomMixedSignWeights() {
    final Random random = new Random(7);
    for (int i = 0; i < 300; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, random.nextInt(9), 0.2 + 0.7 * random.nextDouble(), -10, 10, 1);
      checkOptimal(graph, EXACT);
      checkOptimal(graph, EXACT.withMaxCardinality(true));
    }
  }

  @Test public void testRandomFractionalWeights() {
    // Multiples of 1/4 are exact in binary, so sums compare exactly.
    final Random random = new Random(1234);
    for (int i = 0; i < 300; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, random.nextInt(9), 0.2 + 0.7 * random.nextDouble(), 1, 80, 4);
      checkOptimal(graph, MatchingOptions.DEFAULT);
      checkOptimal(graph, MatchingOptions.DEFAULT.withMaxCardinality(true));
    }
  }

  @Test public void testRandomTwelveVertices() {
    final Random random = new Random(12);
    for (int i = 0; i < 20; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, 9 + random.nextInt(4), 0.4, 1, 30, 1);
      checkOptimal(graph, EXACT);
      checkOptimal(graph, EXACT.withMaxCardinality(true));
    }
  }

  @Test public void testRandomMinWeight() {
    final Random random = new Random(99);
    for (int i = 0; i < 300; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, random.nextInt(9), 0.2 + 0.7 * random.nextDouble(), -5, 20, 1);
      final Set<Pair<Integer, Integer>> matching = Matchings.minWeightMatching(graph);
      final String message = graph + " " + matching;
      assertTrue(message, Matchings.isMatching(graph, matching));

      final MatchingFixtures.Optimum optimum = bruteForce(graph, true, true);
      assertEquals(message, optimum.cardinality, matching.size());
      assertEquals(message, optimum.weight,
          Matchings.matchingWeight(graph, matching, EdgeWeigher.DEFAULT), DELTA);
    }
  }

  /** Larger graphs are beyond exhaustive search; the optimality verifier
   * certifies the result instead. */
  @Test public void testLargeGraphsVerified() {
    final Random random = new Random(2024);
    for (int i = 0; i < 10; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, 40 + random.nextInt(40), 0.15, 1, 1000, 1);
      final Set<Pair<Integer, Integer>> matching =
          Matchings.maxWeightMatching(graph, EXACT.withMaxCardinality(i % 2 == 0));
      assertTrue(Matchings.isMatching(graph, matching));
    }
  }

  @Test public void testCompleteGraphHasPerfectMatching() {
    final WeightedUndirectedGraph<Integer> graph =
        randomGraph(new Random(5), 30, 1.0, 1, 100, 1);
    final Set<Pair<Integer, Integer>> matching =
        Matchings.maxWeightMatching(graph, EXACT.withMaxCardinality(true));
    assertEquals(15, matching.size());
    assertTrue(Matchings.isPerfectMatching(graph, matching));
  }

  @Test public void testDeterministic() {
    final Random random = new Random(11);
    for (int i = 0; i < 50; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, 20, 0.3, 1, 10, 1);
      final List<Pair<Integer, Integer>> first =
          ImmutableList.copyOf(Matchings.maxWeightMatching(graph));
      final List<Pair<Integer, Integer>> second =
          ImmutableList.copyOf(Matchings.maxWeightMatching(graph));
      assertEquals(first, second);
    }
  }

  @Test public void testParallelSolves() throws Exception {
    final Random random = new Random(3);
    final List<WeightedUndirectedGraph<Integer>> graphs = new ArrayList<>();
    final List<Set<Pair<Integer, Integer>>> expected = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      final WeightedUndirectedGraph<Integer> graph =
          randomGraph(random, 30, 0.25, 1, 50, 1);
      graphs.add(graph);
      expected.add(Matchings.maxWeightMatching(graph, EXACT));
    }

    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<Set<Pair<Integer, Integer>>>> futures = new ArrayList<>();
      for (final WeightedUndirectedGraph<Integer> graph : graphs) {
        futures.add(executor.submit(() -> Matchings.maxWeightMatching(graph, EXACT)));
      }
      for (int i = 0; i < futures.size(); i++) {
        assertEquals(expected.get(i), futures.get(i).get(60, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }
  }
}

// End MatchingPropertiesTest.java
