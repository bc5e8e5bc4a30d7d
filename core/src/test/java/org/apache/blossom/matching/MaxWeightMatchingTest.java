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
import org.apache.blossom.util.graph.DefaultDirectedGraph;
import org.apache.blossom.util.graph.DefaultEdge;
import org.apache.blossom.util.graph.DefaultUndirectedGraph;
import org.apache.blossom.util.graph.EdgeWeigher;
import org.apache.blossom.util.graph.UndirectedMultigraph;
import org.apache.blossom.util.graph.UnsupportedGraphException;
import org.apache.blossom.util.graph.WeightedEdge;
import org.apache.blossom.util.graph.WeightedUndirectedGraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.util.Set;

import static org.apache.blossom.matching.MatchingFixtures.graph;
import static org.apache.blossom.matching.MatchingFixtures.pairs;
import static org.apache.blossom.matching.MatchingFixtures.unordered;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link Matchings#maxWeightMatching}.
 *
 * <p>Each fixture with integer weights is solved twice: once with default
 * options and once in integer-weight mode, where the optimality verifier
 * checks the dual solution.
 */
public class MaxWeightMatchingTest {
  @Rule public final ExpectedException exception = ExpectedException.none();

  private static final MatchingOptions EXACT =
      MatchingOptions.DEFAULT.withIntegerWeights(true).withVerify(true);

  public MaxWeightMatchingTest() {
  }

  /** Solves in both modes and checks the result against the expected pairs. */
  private static <V> void check(WeightedUndirectedGraph<V> graph,
      boolean maxCardinality, Set<Set<V>> expected) {
    final Set<Pair<V, V>> matching = Matchings.maxWeightMatching(graph,
        MatchingOptions.DEFAULT.withMaxCardinality(maxCardinality));
    assertEquals(expected, unordered(matching));
    assertTrue(Matchings.isMatching(graph, matching));

    final Set<Pair<V, V>> exact = Matchings.maxWeightMatching(graph,
        EXACT.withMaxCardinality(maxCardinality));
    assertEquals(expected, unordered(exact));
  }

  private static <V> void check(WeightedUndirectedGraph<V> graph,
      Set<Set<V>> expected) {
    check(graph, false, expected);
  }

  @Test public void testEmptyGraph() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    assertTrue(Matchings.maxWeightMatching(graph).isEmpty());
    assertTrue(Matchings.maxWeightMatching(graph, true).isEmpty());
  }

  @Test public void testSelfLoop() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(0, 0, 100);
    check(graph, ImmutableSet.of());
  }

  @Test public void testSingleEdge() {
    final DefaultUndirectedGraph<Integer, DefaultEdge> graph =
        DefaultUndirectedGraph.create();
    graph.addVertex(0);
    graph.addVertex(1);
    graph.addEdge(0, 1);
    final Set<Pair<Integer, Integer>> matching = Matchings.maxWeightMatching(graph);
    assertEquals(ImmutableSet.of(Pair.of(0, 1)), matching);
  }

  @Test public void testSmallGraph() {
    final WeightedUndirectedGraph<String> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge("one", "two", 10);
    graph.addEdge("two", "three", 11);
    check(graph, pairs("two", "three"));
  }

  @Test public void testPath() {
    final WeightedUndirectedGraph<Integer> graph =
        graph(new int[]{1, 2, 5}, new int[]{2, 3, 11}, new int[]{3, 4, 5});
    check(graph, pairs(2, 3));
    check(graph, true, pairs(1, 2, 3, 4));
  }

  @Test public void testPairOrder() {
    final WeightedUndirectedGraph<Integer> graph =
        graph(new int[]{4, 3, 5}, new int[]{2, 1, 5}, new int[]{3, 2, 1});
    // Pairs follow the order in which vertices were added: 4, 3, 2, 1.
    assertEquals(ImmutableList.of(Pair.of(4, 3), Pair.of(2, 1)),
        ImmutableList.copyOf(Matchings.maxWeightMatching(graph)));
  }

  @Test public void testFloatingPointWeights() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(1, 2, Math.PI);
    graph.addEdge(2, 3, Math.E);
    graph.addEdge(1, 3, 3.0);
    graph.addEdge(1, 4, Math.sqrt(2.0));
    assertEquals(pairs(1, 4, 2, 3), unordered(Matchings.maxWeightMatching(graph)));
  }

  @Test public void testNegativeWeights() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 2}, new int[]{1, 3, -2}, new int[]{2, 3, 1},
        new int[]{2, 4, -1}, new int[]{3, 4, -6});
    check(graph, pairs(1, 2));
    check(graph, true, pairs(1, 3, 2, 4));
  }

  @Test public void testSquare() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 4, 2}, new int[]{2, 3, 2}, new int[]{1, 2, 1},
        new int[]{3, 4, 4});
    check(graph, pairs(1, 2, 3, 4));
  }

  @Test public void testUniformTriangle() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 1}, new int[]{2, 3, 1}, new int[]{1, 3, 1});
    final Set<Pair<Integer, Integer>> matching =
        Matchings.maxWeightMatching(graph, EXACT.withMaxCardinality(true));
    assertEquals(1, matching.size());
    assertTrue(Matchings.isMaximalMatching(graph, matching));
  }

  /** Creates an S-blossom and uses it for augmentation. */
  @Test public void testSBlossom() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 8}, new int[]{1, 3, 9}, new int[]{2, 3, 10},
        new int[]{3, 4, 7});
    check(graph, pairs(1, 2, 3, 4));

    graph.addEdge(1, 6, 5);
    graph.addEdge(4, 5, 6);
    check(graph, pairs(1, 6, 2, 3, 4, 5));
  }

  /** Creates an S-blossom, relabels it as a T-blossom and uses it for
   * augmentation. */
  @Test public void testSTBlossom() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 9}, new int[]{1, 3, 8}, new int[]{2, 3, 10},
        new int[]{1, 4, 5}, new int[]{4, 5, 4}, new int[]{1, 6, 3});
    check(graph, pairs(1, 6, 2, 3, 4, 5));

    graph.addEdge(4, 5, 3);
    graph.addEdge(1, 6, 4);
    check(graph, pairs(1, 6, 2, 3, 4, 5));

    graph.removeEdge(1, 6);
    graph.addEdge(3, 6, 4);
    check(graph, pairs(1, 2, 3, 6, 4, 5));
  }

  @Test public void testNestedSBlossom() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 9}, new int[]{1, 3, 9}, new int[]{2, 3, 10},
        new int[]{2, 4, 8}, new int[]{3, 5, 8}, new int[]{4, 5, 10},
        new int[]{5, 6, 6});
    check(graph, pairs(1, 3, 2, 4, 5, 6));
  }

  /** Creates an S-blossom, relabels it as S and includes it in a nested
   * S-blossom. */
  @Test public void testNestedSBlossomRelabel() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 10}, new int[]{1, 7, 10}, new int[]{2, 3, 12},
        new int[]{3, 4, 20}, new int[]{3, 5, 20}, new int[]{4, 5, 25},
        new int[]{5, 6, 10}, new int[]{6, 7, 10}, new int[]{7, 8, 8});
    check(graph, pairs(1, 2, 3, 4, 5, 6, 7, 8));
  }

  /** Creates a nested S-blossom, augments and expands it recursively. */
  @Test public void testNestedSBlossomExpand() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 8}, new int[]{1, 3, 8}, new int[]{2, 3, 10},
        new int[]{2, 4, 12}, new int[]{3, 5, 12}, new int[]{4, 5, 14},
        new int[]{4, 6, 12}, new int[]{5, 7, 12}, new int[]{6, 7, 14},
        new int[]{7, 8, 12});
    check(graph, pairs(1, 2, 3, 5, 4, 6, 7, 8));
  }

  /** Creates an S-blossom, relabels it as T and expands it. */
  @Test public void testSBlossomRelabelExpand() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 23}, new int[]{1, 5, 22}, new int[]{1, 6, 15},
        new int[]{2, 3, 25}, new int[]{3, 4, 22}, new int[]{4, 5, 25},
        new int[]{4, 8, 14}, new int[]{5, 7, 13});
    check(graph, pairs(1, 6, 2, 3, 4, 8, 5, 7));
  }

  /** Creates a nested S-blossom, relabels it as T and expands it. */
  @Test public void testNestedSBlossomRelabelExpand() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 19}, new int[]{1, 3, 20}, new int[]{1, 8, 8},
        new int[]{2, 3, 25}, new int[]{2, 4, 18}, new int[]{3, 5, 18},
        new int[]{4, 5, 13}, new int[]{4, 7, 7}, new int[]{5, 6, 7});
    check(graph, pairs(1, 8, 2, 3, 4, 7, 5, 6));
  }

  /** Creates a blossom, relabels it as T in more than one way, expands it
   * and augments. */
  @Test public void testNastyBlossom1() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 45}, new int[]{1, 5, 45}, new int[]{2, 3, 50},
        new int[]{3, 4, 45}, new int[]{4, 5, 50}, new int[]{1, 6, 30},
        new int[]{3, 9, 35}, new int[]{4, 8, 35}, new int[]{5, 7, 26},
        new int[]{9, 10, 5});
    check(graph, pairs(1, 6, 2, 3, 4, 8, 5, 7, 9, 10));
  }

  @Test public void testNastyBlossom2() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 45}, new int[]{1, 5, 45}, new int[]{2, 3, 50},
        new int[]{3, 4, 45}, new int[]{4, 5, 50}, new int[]{1, 6, 30},
        new int[]{3, 9, 35}, new int[]{4, 8, 26}, new int[]{5, 7, 40},
        new int[]{9, 10, 5});
    check(graph, pairs(1, 6, 2, 3, 4, 8, 5, 7, 9, 10));
  }

  /** Creates a blossom, relabels it as T and expands it such that a new
   * least-slack edge from S to a free vertex appears, then augments. */
  @Test public void testNastyBlossomLeastSlack() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 45}, new int[]{1, 5, 45}, new int[]{2, 3, 50},
        new int[]{3, 4, 45}, new int[]{4, 5, 50}, new int[]{1, 6, 30},
        new int[]{3, 9, 35}, new int[]{4, 8, 28}, new int[]{5, 7, 26},
        new int[]{9, 10, 5});
    check(graph, pairs(1, 6, 2, 3, 4, 8, 5, 7, 9, 10));
  }

  /** Creates a nested blossom and relabels it as T in more than one way;
   * expanding the outer blossom puts the inner one on an augmenting path. */
  @Test public void testNastyBlossomAugmenting() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 45}, new int[]{1, 7, 45}, new int[]{2, 3, 50},
        new int[]{3, 4, 45}, new int[]{4, 5, 95}, new int[]{4, 6, 94},
        new int[]{5, 6, 94}, new int[]{6, 7, 50}, new int[]{1, 8, 30},
        new int[]{3, 11, 35}, new int[]{5, 9, 36}, new int[]{7, 10, 26},
        new int[]{11, 12, 5});
    check(graph, pairs(1, 8, 2, 3, 4, 6, 5, 9, 7, 10, 11, 12));
  }

  /** Creates a nested S-blossom, relabels it as S and expands it
   * recursively. */
  @Test public void testNastyBlossomExpandRecursively() {
    final WeightedUndirectedGraph<Integer> graph = graph(
        new int[]{1, 2, 40}, new int[]{1, 3, 40}, new int[]{2, 3, 60},
        new int[]{2, 4, 55}, new int[]{3, 5, 55}, new int[]{4, 5, 50},
        new int[]{1, 8, 15}, new int[]{5, 7, 30}, new int[]{7, 6, 10},
        new int[]{8, 10, 10}, new int[]{4, 9, 30});
    check(graph, pairs(1, 2, 3, 5, 4, 9, 6, 7, 8, 10));
  }

  @Test public void testHeavySelfLoopIgnored() {
    final WeightedUndirectedGraph<Integer> graph =
        graph(new int[]{1, 2, 5}, new int[]{2, 3, 11}, new int[]{3, 4, 5});
    graph.addEdge(2, 2, 1000);
    check(graph, pairs(2, 3));
    final IndexedGraph<Integer> indexed =
        IndexedGraph.of(graph, EdgeWeigher.DEFAULT, false);
    assertEquals(3, indexed.edgeCount);
    assertEquals(11d, indexed.maxWeight, 0d);
    assertTrue(indexed.allInteger);
  }

  @Test public void testIsolatedVertices() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addVertex(1);
    graph.addVertex(2);
    graph.addVertex(3);
    graph.addEdge(4, 5, 7);
    check(graph, pairs(4, 5));
    check(graph, true, pairs(4, 5));
  }

  @Test public void testCustomWeigher() {
    final WeightedUndirectedGraph<Integer> graph =
        graph(new int[]{1, 2, 5}, new int[]{2, 3, 11}, new int[]{3, 4, 5});
    // With every weight equal, the larger matching wins.
    assertEquals(pairs(1, 2, 3, 4),
        unordered(
            Matchings.maxWeightMatching(graph, MatchingOptions.DEFAULT,
                EdgeWeigher.unit())));
    // Weights read from another attribute of the edge.
    final EdgeWeigher<WeightedEdge> negated =
        edge -> -edge.getWeight().doubleValue();
    assertTrue(
        Matchings.maxWeightMatching(graph, MatchingOptions.DEFAULT, negated)
            .isEmpty());
  }

  @Test public void testNullWeightCountsAsOne() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(1, 2, null);
    graph.addEdge(2, 3, null);
    graph.addEdge(3, 4, 2);
    // {1-2, 3-4} weighs 3, more than any single edge.
    check(graph, pairs(1, 2, 3, 4));
  }

  @Test public void testDirectedGraphRejected() {
    final DefaultDirectedGraph<Integer, DefaultEdge> graph = DefaultDirectedGraph.create();
    graph.addVertex(1);
    graph.addVertex(2);
    graph.addEdge(1, 2);
    exception.expect(UnsupportedGraphException.class);
    exception.expectMessage("not implemented for directed type");
    Matchings.maxWeightMatching(graph);
  }

  @Test public void testMultigraphRejected() {
    final UndirectedMultigraph<Integer, DefaultEdge> graph = UndirectedMultigraph.create();
    graph.addVertex(1);
    graph.addVertex(2);
    graph.addEdge(1, 2);
    exception.expect(UnsupportedGraphException.class);
    exception.expectMessage("not implemented for multigraph type");
    Matchings.maxWeightMatching(graph);
  }

  @Test public void testNonIntegerWeightRejectedInIntegerMode() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(1, 2, 2.5);
    exception.expect(IllegalArgumentException.class);
    Matchings.maxWeightMatching(graph, EXACT);
  }

  @Test public void testNaNWeightRejected() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(1, 2, Double.NaN);
    exception.expect(IllegalArgumentException.class);
    Matchings.maxWeightMatching(graph);
  }

  @Test public void testInfiniteWeightRejected() {
    final WeightedUndirectedGraph<Integer> graph = WeightedUndirectedGraph.createWeighted();
    graph.addEdge(1, 2, Double.POSITIVE_INFINITY);
    exception.expect(IllegalArgumentException.class);
    Matchings.maxWeightMatching(graph);
  }

  @Test public void testNullOptionsRejected() {
    exception.expect(NullPointerException.class);
    exception.expectMessage("options");
    Matchings.maxWeightMatching(WeightedUndirectedGraph.createWeighted(), (MatchingOptions) null);
  }

  @Test public void testVerifierRejectsNonOptimalState() {
    final IndexedGraph<Integer> indexed = IndexedGraph.of(
        graph(new int[]{0, 1, 5}), EdgeWeigher.DEFAULT, true);
    final DualVariables duals = new DualVariables(indexed);
    final BlossomForest forest = new BlossomForest(indexed.vertexCount);
    // Nothing matched, yet every vertex dual is still at its initial value.
    final int[] mate = {-1, -1};
    final OptimalityVerifier verifier =
        new OptimalityVerifier(indexed, mate, duals, forest, false);
    exception.expect(IllegalStateException.class);
    exception.expectMessage("Matching is not optimal");
    verifier.verify();
  }
}

// End MaxWeightMatchingTest.java
