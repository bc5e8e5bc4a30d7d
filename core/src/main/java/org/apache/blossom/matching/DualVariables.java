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

import java.util.Arrays;

/**
 * Variables of the dual linear program.
 *
 * <p>Slot v &lt; n holds 2·u(v), twice the dual of vertex v; doubling keeps
 * the values integral when all weights are integers. Slot b &ge; n holds
 * z(b), the dual of non-trivial blossom b. Vertex duals start at the
 * maximum edge weight and blossom duals at zero.
 */
final class DualVariables {
  private final IndexedGraph<?> graph;
  private final double[] dual;

  DualVariables(IndexedGraph<?> graph) {
    this.graph = graph;
    this.dual = new double[2 * graph.vertexCount];
    Arrays.fill(dual, 0, graph.vertexCount, graph.maxWeight);
  }

  double get(int b) {
    return dual[b];
  }

  void set(int b, double value) {
    dual[b] = value;
  }

  void add(int b, double delta) {
    dual[b] += delta;
  }

  /** Returns twice the slack of edge k; only meaningful between two
   * different top-level blossoms. */
  double slack(int k) {
    return dual[graph.endpoint[2 * k]] + dual[graph.endpoint[2 * k + 1]]
        - 2 * graph.weights[k];
  }

  double minVertexDual() {
    double min = Double.POSITIVE_INFINITY;
    for (int v = 0; v < graph.vertexCount; v++) {
      min = Math.min(min, dual[v]);
    }
    return min;
  }

  double minBlossomDual() {
    double min = Double.POSITIVE_INFINITY;
    for (int b = graph.vertexCount; b < dual.length; b++) {
      min = Math.min(min, dual[b]);
    }
    return min;
  }
}

// End DualVariables.java
