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

/**
 * Amount by which the dual variables change when the search for an
 * augmenting path is stuck, and what to do once they have changed.
 */
final class DeltaStep {
  /** The bound that limits the step. */
  enum Kind {
    /** Some vertex dual reaches zero; the matching is optimal. */
    VERTEX_DUAL,
    /** An edge from an S-vertex to a free vertex becomes tight. */
    FREE_EDGE,
    /** An edge between two S-blossoms becomes tight. */
    S_BLOSSOM_EDGE,
    /** The dual of a T-blossom reaches zero; the blossom is expanded. */
    T_BLOSSOM
  }

  final Kind kind;
  final double amount;

  /** Edge that becomes tight, or -1. */
  final int edge;

  /** Blossom to expand, or -1. */
  final int blossom;

  private DeltaStep(Kind kind, double amount, int edge, int blossom) {
    this.kind = kind;
    this.amount = amount;
    this.edge = edge;
    this.blossom = blossom;
  }

  static DeltaStep vertexDual(double amount) {
    return new DeltaStep(Kind.VERTEX_DUAL, amount, -1, -1);
  }

  static DeltaStep freeEdge(double amount, int edge) {
    return new DeltaStep(Kind.FREE_EDGE, amount, edge, -1);
  }

  static DeltaStep sBlossomEdge(double amount, int edge) {
    return new DeltaStep(Kind.S_BLOSSOM_EDGE, amount, edge, -1);
  }

  static DeltaStep tBlossom(double amount, int blossom) {
    return new DeltaStep(Kind.T_BLOSSOM, amount, -1, blossom);
  }

  /** Whether a candidate amount should replace {@code step}; ties keep the
   * earlier candidate. */
  static boolean isBetter(double amount, DeltaStep step) {
    return step == null || amount < step.amount;
  }

  @Override public String toString() {
    return kind + "(" + amount + ")";
  }
}

// End DeltaStep.java
