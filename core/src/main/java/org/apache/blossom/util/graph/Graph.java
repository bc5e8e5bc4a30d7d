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

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Graph.
 *
 * @param <V> Vertex type
 * @param <E> Edge type
 */
public interface Graph<V, E extends DefaultEdge> {
  /**
   * Adds a vertex to this graph.
   *
   * @param vertex Vertex
   * @return Whether vertex was added
   */
  boolean addVertex(V vertex);

  /**
   * Adds an edge to this graph.
   *
   * @param vertex Source vertex
   * @param targetVertex Target vertex
   * @return New edge, if added, otherwise null
   * @throws IllegalArgumentException if either vertex is not already in graph
   */
  E addEdge(V vertex, V targetVertex);

  /**
   * Returns an edge between two vertices, or null. In an undirected graph the
   * order of the two vertices does not matter.
   */
  E getEdge(V source, V target);

  /**
   * Removes the edge between two vertices, if there is one. In a multigraph
   * only the first such edge is removed.
   *
   * @return Whether an edge was removed
   */
  boolean removeEdge(V source, V target);

  Set<V> vertexSet();

  /** Returns all edges, in the order in which they were added. */
  Collection<E> edgeSet();

  /** Returns the edges incident to a vertex (outgoing edges, if directed). */
  List<E> getEdges(V vertex);

  /** Returns the distinct neighbors of a vertex (successors, if directed). */
  Set<V> neighbors(V vertex);

  /** Returns whether edges have a direction. */
  boolean isDirected();

  /** Returns whether more than one edge may join the same pair of vertices. */
  boolean allowsParallelEdges();

  /** Factory for edges.
   *
   * @param <V> Vertex type
   * @param <E> Edge type
   */
  interface EdgeFactory<V, E> {
    E createEdge(V v0, V v1);
  }
}

// End Graph.java
