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
 * Simple undirected graph of {@link WeightedEdge}s.
 *
 * @param <V> Vertex type
 */
public class WeightedUndirectedGraph<V> extends DefaultUndirectedGraph<V, WeightedEdge> {
  //~ Constructors -----------------------------------------------------------

  public WeightedUndirectedGraph() {
    super(WeightedEdge.weightedFactory());
  }

  public static <V> WeightedUndirectedGraph<V> createWeighted() {
    return new WeightedUndirectedGraph<>();
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Adds a weighted edge, adding its ends as vertices if they are new. If the
   * edge already exists its weight is replaced.
   *
   * @param vertex is one end of the edge.
   * @param targetVertex is the other end of the edge.
   * @param weight is the weight, or null for an unweighted edge.
   * @return the new or updated edge.
   */
  public WeightedEdge addEdge(final V vertex, final V targetVertex, final Number weight) {
    addVertex(vertex);
    addVertex(targetVertex);
    WeightedEdge edge = getEdge(vertex, targetVertex);
    if (edge == null) {
      edge = addEdge(vertex, targetVertex);
    }
    edge.setWeight(weight);
    return edge;
  }
}

// End WeightedUndirectedGraph.java
