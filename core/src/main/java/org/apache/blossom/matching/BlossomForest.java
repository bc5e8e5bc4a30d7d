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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Arena of blossoms.
 *
 * <p>Handles 0 .. n-1 are the vertices, which are trivial blossoms. Handles
 * n .. 2n-1 are slots for non-trivial blossoms; a slot is in use while its
 * {@link #base} is non-negative. A non-trivial blossom has an odd number of
 * children, starting with the child that contains its base and going round
 * the cycle; {@code endps[b][i]} is the endpoint, lying in child i, of the
 * edge that connects child i to child i+1 (cyclically).
 */
final class BlossomForest {
  //~ Instance fields --------------------------------------------------------

  final int vertexCount;

  /** Top-level blossom that contains each vertex. */
  final int[] inBlossom;

  /** Immediate parent of each (sub-)blossom, or -1 if it is top-level. */
  final int[] parent;

  /** Base vertex of each (sub-)blossom, or -1 if the slot is unused. */
  final int[] base;

  /** Children of each non-trivial blossom, or null. */
  final int[][] childs;

  /** Connecting edge endpoints of each non-trivial blossom, or null. */
  final int[][] endps;

  /**
   * For a top-level S-blossom, its least-slack edges to neighboring
   * S-blossoms, or null if they have not been computed this stage.
   */
  final int[][] bestEdges;

  private final Deque<Integer> unused = new ArrayDeque<>();

  //~ Constructors -----------------------------------------------------------

  BlossomForest(int vertexCount) {
    this.vertexCount = vertexCount;
    this.inBlossom = new int[vertexCount];
    this.parent = new int[2 * vertexCount];
    this.base = new int[2 * vertexCount];
    this.childs = new int[2 * vertexCount][];
    this.endps = new int[2 * vertexCount][];
    this.bestEdges = new int[2 * vertexCount][];
    Arrays.fill(parent, -1);
    Arrays.fill(base, -1);
    for (int v = 0; v < vertexCount; v++) {
      inBlossom[v] = v;
      base[v] = v;
    }
    for (int b = vertexCount; b < 2 * vertexCount; b++) {
      unused.push(b);
    }
  }

  //~ Methods ----------------------------------------------------------------

  boolean isBlossom(int b) {
    return b >= vertexCount;
  }

  boolean isTopLevel(int b) {
    return parent[b] == -1;
  }

  /** Whether handle b is a vertex or an in-use blossom slot. */
  boolean isLive(int b) {
    return base[b] >= 0;
  }

  int allocate() {
    final Integer b = unused.poll();
    if (b == null) {
      throw new AssertionError("no free blossom slot");
    }
    return b;
  }

  void release(int b) {
    assert isBlossom(b);
    childs[b] = null;
    endps[b] = null;
    bestEdges[b] = null;
    base[b] = -1;
    parent[b] = -1;
    unused.push(b);
  }

  /** Calls {@code action} for every vertex inside blossom b. */
  void forEachLeaf(int b, IntConsumer action) {
    if (!isBlossom(b)) {
      action.accept(b);
      return;
    }
    for (int child : childs[b]) {
      forEachLeaf(child, action);
    }
  }

  List<Integer> leaves(int b) {
    final List<Integer> leaves = new ArrayList<>();
    forEachLeaf(b, leaves::add);
    return leaves;
  }

  int indexOfChild(int b, int child) {
    final int[] children = childs[b];
    for (int i = 0; i < children.length; i++) {
      if (children[i] == child) {
        return i;
      }
    }
    throw new AssertionError("blossom " + b + " has no child " + child);
  }

  /** Returns child j of blossom b; negative j counts from the end. */
  int childAt(int b, int j) {
    return childs[b][Math.floorMod(j, childs[b].length)];
  }

  /** Returns connecting endpoint j of blossom b; negative j counts from the end. */
  int endpointAt(int b, int j) {
    return endps[b][Math.floorMod(j, endps[b].length)];
  }

  /** Rotates the child and endpoint lists of b so that child i comes first. */
  void rotate(int b, int i) {
    childs[b] = rotated(childs[b], i);
    endps[b] = rotated(endps[b], i);
  }

  private static int[] rotated(int[] list, int i) {
    final int[] result = new int[list.length];
    System.arraycopy(list, i, result, 0, list.length - i);
    System.arraycopy(list, 0, result, list.length - i, i);
    return result;
  }
}

// End BlossomForest.java
