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
package org.apache.blossom.util.graph;

/**
 * Reads the weight of an edge.
 *
 * @param <E> Edge type
 */
@FunctionalInterface
public interface EdgeWeigher<E> {
  /** Weight assumed for an edge that carries no weight. */
  double DEFAULT_WEIGHT = 1d;

  /**
   * Reads the weight from {@link WeightedEdge#getWeight()}; any other edge,
   * or a weighted edge whose weight is unset, weighs {@link #DEFAULT_WEIGHT}.
   */
  EdgeWeigher<Object> DEFAULT = edge -> edge instanceof WeightedEdge
      ? ((WeightedEdge) edge).getWeight()
      : null;

  /**
   * Returns the weight of an edge, or null if the edge has no weight.
   *
   * @param edge is the edge to weigh.
   * @return the weight, or null.
   */
  Number weigh(E edge);

  /** Returns the weight of an edge, substituting {@link #DEFAULT_WEIGHT} for null. */
  default double weightOf(E edge) {
    final Number weight = weigh(edge);
    return weight == null ? DEFAULT_WEIGHT : weight.doubleValue();
  }

  /** Returns a weigher that ignores edge data and weighs every edge 1. */
  static <E> EdgeWeigher<E> unit() {
    return edge -> DEFAULT_WEIGHT;
  }
}

// End EdgeWeigher.java
