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

import java.util.Objects;

/**
 * Default implementation of edges used in {@link Graph}.
 *
 * <p>For undirected graphs the distinction between {@link #source} and
 * {@link #target} only records the order in which the edge was added.
 * Equality follows that order too, so in an undirected graph an edge added as
 * A-B does not equal one created as B-A; use {@link #connects} to compare
 * edges regardless of direction.
 */
public class DefaultEdge {
  public final Object source;
  public final Object target;

  public DefaultEdge(Object source, Object target) {
    this.source = Objects.requireNonNull(source);
    this.target = Objects.requireNonNull(target);
  }

  public static <V> Graph.EdgeFactory<V, DefaultEdge> factory() {
    return DefaultEdge::new;
  }

  /** Returns whether both ends of this edge are the same vertex. */
  public boolean isSelfLoop() {
    return source.equals(target);
  }

  /**
   * Returns the end of this edge that is not {@code vertex}.
   *
   * @param vertex is one of the ends of this edge.
   * @return the opposite end.
   * @throws IllegalArgumentException if the vertex is not an end of this edge.
   */
  public Object opposite(Object vertex) {
    if (source.equals(vertex)) {
      return target;
    } else if (target.equals(vertex)) {
      return source;
    }
    throw new IllegalArgumentException("vertex " + vertex + " is not an end of " + this);
  }

  /** Returns whether this edge joins {@code u} and {@code v} in either direction. */
  public boolean connects(Object u, Object v) {
    return source.equals(u) && target.equals(v)
        || source.equals(v) && target.equals(u);
  }

  @Override public int hashCode() {
    return source.hashCode() * 31 + target.hashCode();
  }

  /** Returns whether {@code obj} is an edge with the same source and the
   * same target; direction counts even for undirected use. */
  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof DefaultEdge
        && ((DefaultEdge) obj).source.equals(source)
        && ((DefaultEdge) obj).target.equals(target);
  }

  @Override public String toString() {
    return source + "-" + target;
  }
}

// End DefaultEdge.java
