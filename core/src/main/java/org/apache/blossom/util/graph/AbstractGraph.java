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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Adjacency-list implementation of {@link Graph}, shared by the directed,
 * undirected and multigraph variants.
 *
 * <p>Vertices and edges are iterated in insertion order, which makes every
 * algorithm that walks the graph deterministic.
 *
 * @param <V> Vertex type
 * @param <E> Edge type
 */
public abstract class AbstractGraph<V, E extends DefaultEdge>
    implements Graph<V, E> {
  //~ Instance fields --------------------------------------------------------

  final List<E> edges = new ArrayList<>();
  final Map<V, List<E>> vertexMap = new LinkedHashMap<>();
  final EdgeFactory<V, E> edgeFactory;

  //~ Constructors -----------------------------------------------------------

  protected AbstractGraph(final EdgeFactory<V, E> edgeFactory) {
    this.edgeFactory = Objects.requireNonNull(edgeFactory);
  }

  //~ Methods ----------------------------------------------------------------

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append("graph(")
        .append("vertices: ")
        .append(vertexMap.keySet())
        .append(", edges: ")
        .append(edges)
        .append(")");
    return buf.toString();
  }

  @Override public boolean addVertex(final V vertex) {
    if (vertexMap.containsKey(vertex)) {
      return false;
    }
    vertexMap.put(vertex, new ArrayList<>());
    return true;
  }

  @Override public E addEdge(final V vertex, final V targetVertex) {
    final List<E> incident = vertexMap.get(vertex);
    if (incident == null) {
      throw new IllegalArgumentException("no vertex " + vertex);
    }
    final List<E> targetIncident = vertexMap.get(targetVertex);
    if (targetIncident == null) {
      throw new IllegalArgumentException("no vertex " + targetVertex);
    }
    if (!allowsParallelEdges() && getEdge(vertex, targetVertex) != null) {
      return null;
    }

    // Records the edge once globally, and once per distinct end.
    final E edge = edgeFactory.createEdge(vertex, targetVertex);
    edges.add(edge);
    incident.add(edge);
    if (!isDirected() && !vertex.equals(targetVertex)) {
      targetIncident.add(edge);
    }
    return edge;
  }

  @Override public E getEdge(final V source, final V target) {
    final List<E> incident = vertexMap.get(source);
    if (incident == null) {
      return null;
    }
    for (final E edge : incident) {
      if (joins(edge, source, target)) {
        return edge;
      }
    }
    return null;
  }

  @Override public boolean removeEdge(final V source, final V target) {
    final E edge = getEdge(source, target);
    if (edge == null) {
      return false;
    }
    removeIdentical(edges, edge);
    removeIdentical(vertexMap.get(source), edge);
    if (!isDirected() && !source.equals(target)) {
      removeIdentical(vertexMap.get(target), edge);
    }
    return true;
  }

  @Override public Set<V> vertexSet() {
    return Collections.unmodifiableSet(vertexMap.keySet());
  }

  @Override public Collection<E> edgeSet() {
    return Collections.unmodifiableList(edges);
  }

  @Override public List<E> getEdges(final V vertex) {
    final List<E> incident = vertexMap.get(vertex);
    if (incident == null) {
      throw new IllegalArgumentException("no vertex " + vertex);
    }
    return ImmutableList.copyOf(incident);
  }

  @SuppressWarnings("unchecked")
  @Override public Set<V> neighbors(final V vertex) {
    final Set<V> neighbors = new LinkedHashSet<>();
    for (final E edge : getEdges(vertex)) {
      neighbors.add((V) (isDirected() ? edge.target : edge.opposite(vertex)));
    }
    return neighbors;
  }

  /** Returns whether an edge runs from {@code source} to {@code target},
   * honoring direction only if the graph is directed. */
  private boolean joins(final E edge, final V source, final V target) {
    if (isDirected()) {
      return edge.source.equals(source) && edge.target.equals(target);
    }
    return edge.connects(source, target);
  }

  /** Removes an element by identity; equal parallel edges stay. */
  private static <E> void removeIdentical(final List<E> list, final E edge) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == edge) {
        list.remove(i);
        return;
      }
    }
  }
}

// End AbstractGraph.java
