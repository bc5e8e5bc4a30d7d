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
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Labels of the alternating forest grown during one stage, together with the
 * queue of S-vertices whose neighbors are still to be scanned.
 *
 * <p>For a top-level blossom b, {@code label[b]} is its label and
 * {@code labelEnd[b]} is the remote endpoint of the edge through which it
 * got the label, or -1 if its base is exposed. A vertex w inside a
 * T-blossom has {@code label[w] == T} once it is reachable from an S-vertex
 * outside the blossom, which is what a later expansion of the blossom needs.
 */
final class Labeling {
  //~ Instance fields --------------------------------------------------------

  private final IndexedGraph<?> graph;
  private final BlossomForest forest;
  private final int[] mate;

  final Label[] label;
  final int[] labelEnd;

  /**
   * For a free vertex (or an unreached vertex inside a T-blossom), the
   * least-slack edge from an S-vertex; for a top-level S-blossom, the
   * least-slack edge to a different S-blossom; otherwise -1.
   */
  final int[] bestEdge;

  /** Whether each edge is known to have zero slack. */
  final boolean[] allowEdge;

  /** Newly discovered S-vertices; taken from the tail. */
  final Deque<Integer> queue = new ArrayDeque<>();

  /** Breadcrumbs placed by {@link #scanBlossom}. */
  private final BitSet visited;

  //~ Constructors -----------------------------------------------------------

  Labeling(IndexedGraph<?> graph, BlossomForest forest, int[] mate) {
    this.graph = graph;
    this.forest = forest;
    this.mate = mate;
    this.label = new Label[2 * graph.vertexCount];
    this.labelEnd = new int[2 * graph.vertexCount];
    this.bestEdge = new int[2 * graph.vertexCount];
    this.allowEdge = new boolean[graph.edgeCount];
    this.visited = new BitSet(2 * graph.vertexCount);
    reset();
  }

  //~ Methods ----------------------------------------------------------------

  /** Forgets every label, best edge and allowed edge, ready for a new stage. */
  void reset() {
    Arrays.fill(label, Label.NONE);
    Arrays.fill(labelEnd, -1);
    Arrays.fill(bestEdge, -1);
    Arrays.fill(forest.bestEdges, graph.vertexCount, forest.bestEdges.length, null);
    Arrays.fill(allowEdge, false);
    queue.clear();
  }

  /** Returns the label of the top-level blossom that contains vertex v. */
  Label topLabel(int v) {
    return label[forest.inBlossom[v]];
  }

  /**
   * Assigns a label to the top-level blossom that contains vertex w, coming
   * through the edge whose remote endpoint is p. An S-blossom has its
   * vertices queued; a T-blossom passes label S on to the mate of its base.
   *
   * @param w is a vertex in the blossom to label.
   * @param t is the new label, S or T.
   * @param p is the remote endpoint of the labeling edge, or -1 for a root.
   */
  void assignLabel(int w, Label t, int p) {
    final int b = forest.inBlossom[w];
    assert label[w] == Label.NONE && label[b] == Label.NONE;
    label[w] = label[b] = t;
    labelEnd[w] = labelEnd[b] = p;
    bestEdge[w] = bestEdge[b] = -1;
    if (t == Label.S) {
      forest.forEachLeaf(b, queue::addLast);
    } else {
      // Only the base of a T-blossom has a mate outside the blossom.
      final int base = forest.base[b];
      assert mate[base] >= 0;
      assignLabel(graph.endpoint[mate[base]], Label.S, mate[base] ^ 1);
    }
  }

  /**
   * Traces back from S-vertices v and w, alternating between the two paths,
   * to discover either a new blossom or an augmenting path.
   *
   * @return the base vertex of the new blossom, or -1 if the paths reach two
   * different roots.
   */
  int scanBlossom(int v, int w) {
    final List<Integer> path = new ArrayList<>();
    int base = -1;
    while (v != -1 || w != -1) {
      int b = forest.inBlossom[v];
      if (visited.get(b)) {
        base = forest.base[b];
        break;
      }
      assert label[b] == Label.S;
      path.add(b);
      visited.set(b);
      assert labelEnd[b] == mate[forest.base[b]];
      if (labelEnd[b] == -1) {
        // The base of b is exposed; this path ends here.
        v = -1;
      } else {
        v = graph.endpoint[labelEnd[b]];
        b = forest.inBlossom[v];
        assert label[b] == Label.T;
        assert labelEnd[b] >= 0;
        v = graph.endpoint[labelEnd[b]];
      }
      if (w != -1) {
        final int t = v;
        v = w;
        w = t;
      }
    }
    for (int b : path) {
      visited.clear(b);
    }
    return base;
  }
}

// End Labeling.java
