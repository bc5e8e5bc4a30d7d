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

import org.apache.blossom.util.graph.DefaultEdge;
import org.apache.blossom.util.graph.EdgeWeigher;
import org.apache.blossom.util.graph.Graph;
import org.apache.blossom.util.graph.UnsupportedGraphException;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense, index-addressed copy of a simple undirected weighted graph.
 *
 * <p>Vertices are numbered 0 .. n-1 in the iteration order of the source
 * graph. Edge k has the two endpoints 2k and 2k+1; {@code endpoint[p]} is the
 * vertex at endpoint p, and {@code p ^ 1} is the endpoint at the other end of
 * the same edge. Self-loops are dropped.
 *
 * @param <V> Vertex type
 */
final class IndexedGraph<V> {
  //~ Instance fields --------------------------------------------------------

  final ImmutableList<V> vertices;
  final int vertexCount;
  final int edgeCount;

  /** Vertex at each endpoint. */
  final int[] endpoint;

  /** Weight of each edge. */
  final double[] weights;

  /**
   * For each vertex, the remote endpoints of its incident edges; that is,
   * {@code endpoint[p]} is a neighbor for each p in {@code neighborEnds[v]}.
   */
  final int[][] neighborEnds;

  /** Largest edge weight, or 0 if there is no edge heavier than that. */
  final double maxWeight;

  /** Whether every edge weight is an integral value. */
  final boolean allInteger;

  //~ Constructors -----------------------------------------------------------

  private IndexedGraph(ImmutableList<V> vertices, int[] endpoint, double[] weights) {
    this.vertices = vertices;
    this.vertexCount = vertices.size();
    this.edgeCount = weights.length;
    this.endpoint = endpoint;
    this.weights = weights;

    double max = 0;
    boolean integral = true;
    for (double weight : weights) {
      max = Math.max(max, weight);
      integral &= weight == Math.rint(weight);
    }
    this.maxWeight = max;
    this.allInteger = integral;

    final int[] degree = new int[vertexCount];
    for (int v : endpoint) {
      degree[v]++;
    }
    this.neighborEnds = new int[vertexCount][];
    for (int v = 0; v < vertexCount; v++) {
      neighborEnds[v] = new int[degree[v]];
      degree[v] = 0;
    }
    for (int k = 0; k < edgeCount; k++) {
      final int i = endpoint[2 * k];
      final int j = endpoint[2 * k + 1];
      neighborEnds[i][degree[i]++] = 2 * k + 1;
      neighborEnds[j][degree[j]++] = 2 * k;
    }
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Indexes a graph.
   *
   * @param graph is the graph; it must be undirected and not a multigraph.
   * @param weigher reads the weight of each edge.
   * @param integerWeights whether every weight must be integral.
   * @return the indexed graph.
   * @throws UnsupportedGraphException if the graph is directed or a multigraph.
   * @throws IllegalArgumentException if a weight is not finite, or is not
   * integral when integer weights are required.
   */
  @SuppressWarnings("unchecked")
  static <V, E extends DefaultEdge> IndexedGraph<V> of(final Graph<V, E> graph,
      final EdgeWeigher<? super E> weigher, final boolean integerWeights) {
    UnsupportedGraphException.checkSimpleUndirected(graph);

    final ImmutableList<V> vertices = ImmutableList.copyOf(graph.vertexSet());
    final Map<V, Integer> index = new HashMap<>();
    for (int i = 0; i < vertices.size(); i++) {
      index.put(vertices.get(i), i);
    }

    final List<int[]> ends = new ArrayList<>();
    final List<Double> weightList = new ArrayList<>();
    for (final E edge : graph.edgeSet()) {
      if (edge.isSelfLoop()) {
        continue;
      }
      final double weight = weigher.weightOf(edge);
      if (Double.isNaN(weight) || Double.isInfinite(weight)) {
        throw new IllegalArgumentException("edge " + edge + " has weight " + weight);
      }
      if (integerWeights && weight != Math.rint(weight)) {
        throw new IllegalArgumentException("edge " + edge
            + " has non-integer weight " + weight + " but integer weights were requested");
      }
      ends.add(new int[] {index.get((V) edge.source), index.get((V) edge.target)});
      weightList.add(weight);
    }

    final int[] endpoint = new int[2 * ends.size()];
    final double[] weights = new double[ends.size()];
    for (int k = 0; k < ends.size(); k++) {
      endpoint[2 * k] = ends.get(k)[0];
      endpoint[2 * k + 1] = ends.get(k)[1];
      weights[k] = weightList.get(k);
    }
    return new IndexedGraph<>(vertices, endpoint, weights);
  }

  V vertex(int v) {
    return vertices.get(v);
  }
}

// End IndexedGraph.java
