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
 * DefaultUndirectedGraph is a simple undirected graph: at most one edge joins
 * any pair of vertices, in either order. Self-loops are allowed.
 *
 * @param <V> Vertex type
 * @param <E> Edge type
 */
public class DefaultUndirectedGraph<V, E extends DefaultEdge>
    extends AbstractGraph<V, E> {
  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a new undirected graph.
   *
   * @param edgeFactory is the edge factory.
   */
  public DefaultUndirectedGraph(final EdgeFactory<V, E> edgeFactory) {
    super(edgeFactory);
  }

  public static <V> DefaultUndirectedGraph<V, DefaultEdge> create() {
    return create(DefaultEdge.factory());
  }

  public static <V, E extends DefaultEdge> DefaultUndirectedGraph<V, E> create(
      EdgeFactory<V, E> edgeFactory) {
    return new DefaultUndirectedGraph<>(edgeFactory);
  }

  //~ Methods ----------------------------------------------------------------

  @Override public boolean isDirected() {
    return false;
  }

  @Override public boolean allowsParallelEdges() {
    return false;
  }
}

// End DefaultUndirectedGraph.java
