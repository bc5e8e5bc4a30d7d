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
 * Edge that may carry a numeric weight.
 *
 * <p>The weight is optional; an edge whose weight has never been set reports
 * {@code null} and is treated as having weight 1 by {@link EdgeWeigher#DEFAULT}.
 */
public class WeightedEdge extends DefaultEdge {
  private Number weight;

  public WeightedEdge(Object source, Object target) {
    super(source, target);
  }

  public WeightedEdge(Object source, Object target, Number weight) {
    super(source, target);
    this.weight = weight;
  }

  public static <V> Graph.EdgeFactory<V, WeightedEdge> weightedFactory() {
    return WeightedEdge::new;
  }

  /** Returns the weight, or null if it has not been set. */
  public Number getWeight() {
    return weight;
  }

  public void setWeight(Number weight) {
    this.weight = weight;
  }

  @Override public String toString() {
    return weight == null ? super.toString() : super.toString() + "(" + weight + ")";
  }
}

// End WeightedEdge.java
