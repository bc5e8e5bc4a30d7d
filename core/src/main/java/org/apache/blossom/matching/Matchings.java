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
import org.apache.blossom.util.graph.DefaultEdge;
import org.apache.blossom.util.graph.EdgeWeigher;
import org.apache.blossom.util.graph.Graph;
import org.apache.blossom.util.graph.UnsupportedGraphException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.util.HashSet;
import java.util.Set;

/**
 * Matching algorithms for undirected graphs.
 *
 * <p>A matching is a set of edges no two of which share a vertex. Here a
 * matching is represented as a set of vertex pairs, each matched pair
 * appearing once. The cardinality of a matching is the number of pairs and
 * its weight is the sum of the weights of their edges.
 *
 * <p>Every method accepts only simple undirected graphs and throws
 * {@link UnsupportedGraphException} for a directed graph or a multigraph.
 * Self-loops are allowed in the input but never take part in a matching.
 *
 * <p>The methods keep no state between calls; independent graphs may be
 * processed on different threads at the same time, provided each graph is
 * not modified while it is being processed.
 */
public abstract class Matchings {
  private Matchings() {
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Computes a maximum-weight matching of a graph, reading weights with
   * {@link EdgeWeigher#DEFAULT}.
   *
   * @param graph is an undirected graph.
   * @return the matched vertex pairs.
   */
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> maxWeightMatching(
      final Graph<V, E> graph) {
    return maxWeightMatching(graph, MatchingOptions.DEFAULT, EdgeWeigher.DEFAULT);
  }

  /**
   * Computes a maximum-weight matching of a graph, optionally restricted to
   * matchings of maximum cardinality.
   *
   * @param graph is an undirected graph.
   * @param maxCardinality whether to return, among all matchings of maximum
   * cardinality, one of maximum weight.
   * @return the matched vertex pairs.
   */
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> maxWeightMatching(
      final Graph<V, E> graph, final boolean maxCardinality) {
    return maxWeightMatching(graph,
        MatchingOptions.DEFAULT.withMaxCardinality(maxCardinality), EdgeWeigher.DEFAULT);
  }

  public static <V, E extends DefaultEdge> Set<Pair<V, V>> maxWeightMatching(
      final Graph<V, E> graph, final MatchingOptions options) {
    return maxWeightMatching(graph, options, EdgeWeigher.DEFAULT);
  }

  /**
   * Computes a maximum-weight matching of a graph.
   *
   * <p>Uses Edmonds' blossom algorithm in Galil's primal-dual formulation,
   * in time O(n<sup>3</sup>) for n vertices. With floating point weights
   * the result may be slightly suboptimal because of rounding; with
   * {@link MatchingOptions#isIntegerWeights() integer weights} the
   * computation is exact.
   *
   * @param graph is an undirected graph.
   * @param options controls cardinality, arithmetic and verification.
   * @param weigher reads the weight of each edge; a null weight counts as 1.
   * @return the matched vertex pairs, ordered by the position of their first
   * vertex in the graph's vertex set.
   * @throws UnsupportedGraphException if the graph is directed or a multigraph.
   * @throws IllegalArgumentException if a weight is not finite, or not an
   * integer when integer weights were requested.
   */
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> maxWeightMatching(
      final Graph<V, E> graph, final MatchingOptions options,
      final EdgeWeigher<? super E> weigher) {
    Preconditions.checkNotNull(graph, "graph");
    Preconditions.checkNotNull(options, "options");
    Preconditions.checkNotNull(weigher, "weigher");

    final IndexedGraph<V> indexed =
        IndexedGraph.of(graph, weigher, options.isIntegerWeights());
    if (indexed.vertexCount == 0) {
      return ImmutableSet.of();
    }
    final int[] mate = new BlossomSolver<>(indexed, options).solve();

    // Each pair is reported once, from its lower-numbered vertex.
    final ImmutableSet.Builder<Pair<V, V>> pairs = ImmutableSet.builder();
    for (int v = 0; v < indexed.vertexCount; v++) {
      if (mate[v] >= 0) {
        final int w = indexed.endpoint[mate[v]];
        if (v < w) {
          pairs.add(Pair.of(indexed.vertex(v), indexed.vertex(w)));
        }
      }
    }
    return pairs.build();
  }

  /**
   * Computes a minimum-weight matching among the matchings of maximum
   * cardinality, reading weights with {@link EdgeWeigher#DEFAULT}.
   */
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> minWeightMatching(
      final Graph<V, E> graph) {
    return minWeightMatching(graph, MatchingOptions.DEFAULT, EdgeWeigher.DEFAULT);
  }

  /**
   * Computes a minimum-weight matching among the matchings of maximum
   * cardinality.
   *
   * <p>Each weight w is replaced by (1 + W) - w, where W is the largest
   * weight, and a maximum-weight maximum-cardinality matching is computed on
   * the result. The max-cardinality setting of {@code options} is ignored.
   *
   * @param graph is an undirected graph.
   * @param options controls arithmetic and verification.
   * @param weigher reads the weight of each edge; a null weight counts as 1.
   * @return the matched vertex pairs.
   */
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> minWeightMatching(
      final Graph<V, E> graph, final MatchingOptions options,
      final EdgeWeigher<? super E> weigher) {
    Preconditions.checkNotNull(graph, "graph");
    Preconditions.checkNotNull(options, "options");
    Preconditions.checkNotNull(weigher, "weigher");
    UnsupportedGraphException.checkSimpleUndirected(graph);

    final MatchingOptions maxCardinalityOptions = options.withMaxCardinality(true);
    double maxWeight = Double.NEGATIVE_INFINITY;
    for (final E edge : graph.edgeSet()) {
      if (!edge.isSelfLoop()) {
        maxWeight = Math.max(maxWeight, weigher.weightOf(edge));
      }
    }
    if (maxWeight == Double.NEGATIVE_INFINITY) {
      return maxWeightMatching(graph, maxCardinalityOptions, weigher);
    }
    final double inversion = 1 + maxWeight;
    final EdgeWeigher<E> inverted = edge -> inversion - weigher.weightOf(edge);
    return maxWeightMatching(graph, maxCardinalityOptions, inverted);
  }

  /**
   * Computes a maximal matching greedily: edges are taken in the order of
   * the graph's edge set whenever neither end is matched yet. The result
   * cannot be extended by another edge but need not be of maximum
   * cardinality.
   *
   * @param graph is an undirected graph.
   * @return the matched vertex pairs.
   */
  @SuppressWarnings("unchecked")
  public static <V, E extends DefaultEdge> Set<Pair<V, V>> maximalMatching(
      final Graph<V, E> graph) {
    Preconditions.checkNotNull(graph, "graph");
    UnsupportedGraphException.checkSimpleUndirected(graph);

    final Set<Object> matched = new HashSet<>();
    final ImmutableSet.Builder<Pair<V, V>> pairs = ImmutableSet.builder();
    for (final E edge : graph.edgeSet()) {
      if (!edge.isSelfLoop()
          && !matched.contains(edge.source)
          && !matched.contains(edge.target)) {
        matched.add(edge.source);
        matched.add(edge.target);
        pairs.add(Pair.of((V) edge.source, (V) edge.target));
      }
    }
    return pairs.build();
  }

  /**
   * Returns whether a set of vertex pairs is a matching of a graph: every
   * pair is an edge of the graph that is not a self-loop, and no vertex is
   * in two pairs.
   *
   * @throws IllegalArgumentException if a pair has a vertex that is not in
   * the graph.
   */
  public static <V, E extends DefaultEdge> boolean isMatching(
      final Graph<V, E> graph, final Set<Pair<V, V>> matching) {
    Preconditions.checkNotNull(graph, "graph");
    Preconditions.checkNotNull(matching, "matching");
    UnsupportedGraphException.checkSimpleUndirected(graph);

    final Set<V> covered = new HashSet<>();
    for (final Pair<V, V> pair : matching) {
      checkVertex(graph, pair.left);
      checkVertex(graph, pair.right);
      if (pair.left.equals(pair.right) || graph.getEdge(pair.left, pair.right) == null) {
        return false;
      }
      if (!covered.add(pair.left) || !covered.add(pair.right)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a set of vertex pairs is a maximal matching of a graph:
   * a matching to which no edge of the graph can be added.
   */
  public static <V, E extends DefaultEdge> boolean isMaximalMatching(
      final Graph<V, E> graph, final Set<Pair<V, V>> matching) {
    if (!isMatching(graph, matching)) {
      return false;
    }
    final Set<Object> covered = coveredVertices(matching);
    for (final E edge : graph.edgeSet()) {
      if (!edge.isSelfLoop()
          && !covered.contains(edge.source)
          && !covered.contains(edge.target)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a set of vertex pairs is a perfect matching of a graph:
   * a matching that covers every vertex.
   */
  public static <V, E extends DefaultEdge> boolean isPerfectMatching(
      final Graph<V, E> graph, final Set<Pair<V, V>> matching) {
    if (!isMatching(graph, matching)) {
      return false;
    }
    return coveredVertices(matching).containsAll(graph.vertexSet());
  }

  /**
   * Returns the total weight of the edges of a matching.
   *
   * @param graph is the graph the matching belongs to.
   * @param matching is a set of vertex pairs, each joined by an edge.
   * @param weigher reads the weight of each edge; a null weight counts as 1.
   * @return the sum of the weights.
   * @throws IllegalArgumentException if a pair is not an edge of the graph.
   * @throws UnsupportedGraphException if the graph is directed or a
   * multigraph.
   */
  public static <V, E extends DefaultEdge> double matchingWeight(
      final Graph<V, E> graph, final Set<Pair<V, V>> matching,
      final EdgeWeigher<? super E> weigher) {
    Preconditions.checkNotNull(graph, "graph");
    Preconditions.checkNotNull(matching, "matching");
    Preconditions.checkNotNull(weigher, "weigher");
    UnsupportedGraphException.checkSimpleUndirected(graph);
    double weight = 0;
    for (final Pair<V, V> pair : matching) {
      final E edge = graph.getEdge(pair.left, pair.right);
      Preconditions.checkArgument(edge != null, "no edge %s", pair);
      weight += weigher.weightOf(edge);
    }
    return weight;
  }

  private static <V> Set<Object> coveredVertices(final Set<Pair<V, V>> matching) {
    final Set<Object> covered = new HashSet<>();
    for (final Pair<V, V> pair : matching) {
      covered.add(pair.left);
      covered.add(pair.right);
    }
    return covered;
  }

  private static <V> void checkVertex(final Graph<V, ?> graph, final V vertex) {
    Preconditions.checkArgument(graph.vertexSet().contains(vertex),
        "matching contains %s, which is not in the graph", vertex);
  }
}

// End Matchings.java
