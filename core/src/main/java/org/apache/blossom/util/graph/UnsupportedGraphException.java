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
 * Thrown when an algorithm is asked to work on a kind of graph it does not
 * support, such as a directed graph or a multigraph.
 */
public class UnsupportedGraphException extends UnsupportedOperationException {
  private static final long serialVersionUID = 1L;

  public UnsupportedGraphException(String message) {
    super(message);
  }

  /**
   * Throws unless the graph is undirected and has no parallel edges.
   *
   * @param graph is the graph to check.
   * @throws UnsupportedGraphException if the graph is directed or a multigraph.
   */
  public static void checkSimpleUndirected(Graph<?, ?> graph) {
    if (graph.isDirected()) {
      throw new UnsupportedGraphException("not implemented for directed type");
    }
    if (graph.allowsParallelEdges()) {
      throw new UnsupportedGraphException("not implemented for multigraph type");
    }
  }
}

// End UnsupportedGraphException.java
