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

import org.apache.blossom.util.trace.BlossomTrace;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks that a matching and its dual solution satisfy the optimality
 * conditions of the matching linear program. Only exact (integer-weight)
 * computations can be checked this way.
 *
 * <p>The conditions are:
 * <ol>
 *   <li>all dual variables are non-negative (vertex duals after adding a
 *   common offset, in max-cardinality mode);
 *   <li>all edges have non-negative slack, and matched edges have zero
 *   slack;
 *   <li>all exposed vertices have zero dual;
 *   <li>every blossom with positive dual is full, that is, every other
 *   connecting edge is matched.
 * </ol>
 */
class OptimalityVerifier {
  private static final Logger LOGGER = BlossomTrace.getMatchingTracer();

  private final IndexedGraph<?> graph;
  private final int[] mate;
  private final DualVariables duals;
  private final BlossomForest forest;
  private final boolean maxCardinality;

  OptimalityVerifier(IndexedGraph<?> graph, int[] mate, DualVariables duals,
      BlossomForest forest, boolean maxCardinality) {
    this.graph = graph;
    this.mate = mate;
    this.duals = duals;
    this.forest = forest;
    this.maxCardinality = maxCardinality;
  }

  /**
   * Checks the optimality conditions.
   *
   * @throws IllegalStateException describing the first violated condition.
   */
  void verify() {
    final int n = graph.vertexCount;
    final int[] endpoint = graph.endpoint;

    // In max-cardinality mode vertex duals may be negative; shift them all
    // by the same non-negative amount.
    final double vertexDualOffset = maxCardinality
        ? Math.max(0, -duals.minVertexDual())
        : 0;
    check(duals.minVertexDual() + vertexDualOffset >= 0,
        "negative vertex dual");
    check(duals.minBlossomDual() >= 0, "negative blossom dual");

    for (int k = 0; k < graph.edgeCount; k++) {
      final int i = endpoint[2 * k];
      final int j = endpoint[2 * k + 1];
      double s = duals.get(i) + duals.get(j) - 2 * graph.weights[k];
      final List<Integer> iBlossoms = enclosing(i);
      final List<Integer> jBlossoms = enclosing(j);
      for (int x = 0; x < Math.min(iBlossoms.size(), jBlossoms.size()); x++) {
        final int bi = iBlossoms.get(x);
        if (bi != jBlossoms.get(x)) {
          break;
        }
        s += 2 * duals.get(bi);
      }
      check(s >= 0, "edge %s has negative slack %s", k, s);
      if (matchedEdge(i) == k || matchedEdge(j) == k) {
        check(matchedEdge(i) == k && matchedEdge(j) == k,
            "edge %s is matched at one end only", k);
        check(s == 0, "matched edge %s has slack %s", k, s);
      }
    }

    for (int v = 0; v < n; v++) {
      check(mate[v] >= 0 || duals.get(v) + vertexDualOffset == 0,
          "exposed vertex %s has dual %s", v, duals.get(v));
    }

    for (int b = n; b < 2 * n; b++) {
      if (forest.isLive(b) && duals.get(b) > 0) {
        final int[] endps = forest.endps[b];
        check(endps.length % 2 == 1, "blossom %s has an even cycle", b);
        for (int x = 1; x < endps.length; x += 2) {
          final int p = endps[x];
          check(mate[endpoint[p]] == (p ^ 1) && mate[endpoint[p ^ 1]] == p,
              "blossom %s with positive dual is not full", b);
        }
      }
    }
    LOGGER.debug("Verified optimality of matching on {} vertices", n);
  }

  /** Returns the matched edge at vertex v, or -1. */
  private int matchedEdge(int v) {
    return mate[v] < 0 ? -1 : mate[v] / 2;
  }

  /** Returns the blossoms that contain vertex v, outermost first, ending
   * with v itself. */
  private List<Integer> enclosing(int v) {
    final List<Integer> blossoms = new ArrayList<>();
    blossoms.add(v);
    while (forest.parent[blossoms.get(blossoms.size() - 1)] != -1) {
      blossoms.add(forest.parent[blossoms.get(blossoms.size() - 1)]);
    }
    Collections.reverse(blossoms);
    return blossoms;
  }

  private static void check(boolean condition, String format, Object... args) {
    if (!condition) {
      final String message = "Matching is not optimal: " + String.format(format, args);
      LOGGER.error(message);
      throw new IllegalStateException(message);
    }
  }
}

// End OptimalityVerifier.java
