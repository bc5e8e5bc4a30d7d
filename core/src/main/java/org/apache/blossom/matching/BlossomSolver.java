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

import org.apache.blossom.util.trace.BlossomTrace;

import com.google.common.primitives.Ints;

import net.jcip.annotations.NotThreadSafe;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Computes a maximum-weight matching with Edmonds' blossom algorithm in the
 * primal-dual form described by Galil, "Efficient Algorithms for Finding
 * Maximum Matching in Graphs", ACM Computing Surveys, 1986.
 *
 * <p>The computation runs in stages. Each stage grows alternating trees from
 * all exposed vertices, contracting blossoms as it finds them, until it
 * finds an augmenting path; when the trees cannot grow, the dual variables
 * are adjusted to make another edge tight or to expand a blossom. A stage
 * that ends without augmenting proves the matching optimal. There are at
 * most n stages of O(n²) work each.
 *
 * <p>An instance owns all of its state and is used for one computation.
 *
 * @param <V> Vertex type
 */
@NotThreadSafe
final class BlossomSolver<V> {
  //~ Static fields/initializers ---------------------------------------------

  private static final Logger LOGGER = BlossomTrace.getMatchingTracer();

  //~ Instance fields --------------------------------------------------------

  private final IndexedGraph<V> graph;
  private final MatchingOptions options;
  private final int vertexCount;
  private final int[] endpoint;

  /** Remote endpoint of each vertex's matched edge, or -1 if exposed. */
  private final int[] mate;

  private final DualVariables duals;
  private final BlossomForest forest;
  private final Labeling labels;

  /** Slack at or below which an edge counts as tight. */
  private final double tightSlack;

  private int stageCount;
  private boolean solved;

  //~ Constructors -----------------------------------------------------------

  BlossomSolver(IndexedGraph<V> graph, MatchingOptions options) {
    this.graph = graph;
    this.options = options;
    this.vertexCount = graph.vertexCount;
    this.endpoint = graph.endpoint;
    this.mate = new int[vertexCount];
    Arrays.fill(mate, -1);
    this.duals = new DualVariables(graph);
    this.forest = new BlossomForest(vertexCount);
    this.labels = new Labeling(graph, forest, mate);
    // Integer slacks are exact; a tolerance would admit odd slacks.
    this.tightSlack = options.isIntegerWeights() ? 0d : options.getEpsilon();
    if (options.isIntegerWeights() && options.getEpsilon() > 0) {
      LOGGER.debug("Ignoring epsilon {} in integer mode", options.getEpsilon());
    }
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Runs the algorithm.
   *
   * @return for each vertex, the remote endpoint of its matched edge, or -1.
   * @throws IllegalStateException if optimality verification is enabled and
   * fails.
   */
  int[] solve() {
    if (solved) {
      throw new IllegalStateException("solver has already run");
    }
    solved = true;

    // Each stage either augments the matching by one edge or ends the search.
    for (int stage = 0; stage < vertexCount; stage++) {
      stageCount++;
      labels.reset();

      // Exposed vertices are the roots of the alternating trees.
      for (int v = 0; v < vertexCount; v++) {
        if (mate[v] == -1 && labels.topLabel(v) == Label.NONE) {
          labels.assignLabel(v, Label.S, -1);
        }
      }

      final boolean augmented = runStage();
      assert isSymmetric();
      if (!augmented) {
        break;
      }

      // Zero-dual S-blossoms have no further use once the labels are gone.
      for (int b = vertexCount; b < 2 * vertexCount; b++) {
        if (forest.isLive(b)
            && forest.isTopLevel(b)
            && labels.label[b] == Label.S
            && duals.get(b) == 0) {
          expandBlossom(b, true);
        }
      }
    }

    if (options.isIntegerWeights() && options.isVerify()) {
      new OptimalityVerifier(graph, mate, duals, forest,
          options.isMaxCardinality()).verify();
    } else if (graph.allInteger && graph.edgeCount > 0) {
      LOGGER.debug("All weights are integral; integer mode would verify the result");
    }
    LOGGER.debug("Matched {} vertices of {} over {} edges in {} stages",
        matchedCount(), vertexCount, graph.edgeCount, stageCount);
    return mate;
  }

  /**
   * Runs the substages of one stage: grows the alternating forest and
   * adjusts the duals until an augmenting path is found or the duals prove
   * optimality.
   *
   * @return whether the matching was augmented.
   */
  private boolean runStage() {
    for (;;) {
      if (scanQueue()) {
        return true;
      }

      // No augmenting path under the current tight edges; pump slack out of
      // the dual variables.
      final DeltaStep step = computeDelta();
      LOGGER.trace("Stage {}: dual step {}", stageCount, step);
      applyDelta(step.amount);

      switch (step.kind) {
      case VERTEX_DUAL:
        return false;
      case FREE_EDGE: {
        labels.allowEdge[step.edge] = true;
        int i = endpoint[2 * step.edge];
        if (labels.topLabel(i) == Label.NONE) {
          i = endpoint[2 * step.edge + 1];
        }
        assert labels.topLabel(i) == Label.S;
        labels.queue.addLast(i);
        break;
      }
      case S_BLOSSOM_EDGE: {
        labels.allowEdge[step.edge] = true;
        final int i = endpoint[2 * step.edge];
        assert labels.topLabel(i) == Label.S;
        labels.queue.addLast(i);
        break;
      }
      case T_BLOSSOM:
        expandBlossom(step.blossom, false);
        break;
      default:
        throw new AssertionError(step.kind);
      }
    }
  }

  /**
   * Scans the neighbors of queued S-vertices until every vertex reachable
   * through tight edges has a label or an augmenting path turns up.
   *
   * @return whether the matching was augmented.
   */
  private boolean scanQueue() {
    final Label[] label = labels.label;
    final int[] inBlossom = forest.inBlossom;
    while (!labels.queue.isEmpty()) {
      final int v = labels.queue.pollLast();
      assert labels.topLabel(v) == Label.S;

      for (int p : graph.neighborEnds[v]) {
        final int k = p / 2;
        final int w = endpoint[p];
        if (inBlossom[v] == inBlossom[w]) {
          // Internal to a blossom.
          continue;
        }
        double kslack = 0;
        if (!labels.allowEdge[k]) {
          kslack = duals.slack(k);
          if (kslack <= tightSlack) {
            labels.allowEdge[k] = true;
          }
        }
        if (labels.allowEdge[k]) {
          if (label[inBlossom[w]] == Label.NONE) {
            // w is free; label it T and its mate S.
            labels.assignLabel(w, Label.T, p ^ 1);
          } else if (label[inBlossom[w]] == Label.S) {
            // Either a new blossom or an augmenting path.
            final int base = labels.scanBlossom(v, w);
            if (base >= 0) {
              addBlossom(base, k);
            } else {
              augmentMatching(k);
              return true;
            }
          } else if (label[w] == Label.NONE) {
            // w is inside a T-blossom but not yet reached from outside it;
            // remember the edge for when the blossom is expanded.
            assert label[inBlossom[w]] == Label.T;
            label[w] = Label.T;
            labels.labelEnd[w] = p ^ 1;
          }
        } else if (label[inBlossom[w]] == Label.S) {
          // Least-slack edge to a different S-blossom.
          final int b = inBlossom[v];
          if (labels.bestEdge[b] == -1 || kslack < duals.slack(labels.bestEdge[b])) {
            labels.bestEdge[b] = k;
          }
        } else if (label[w] == Label.NONE) {
          // Least-slack edge to a vertex we cannot reach yet.
          if (labels.bestEdge[w] == -1 || kslack < duals.slack(labels.bestEdge[w])) {
            labels.bestEdge[w] = k;
          }
        }
      }
    }
    return false;
  }

  /** Chooses the smallest of the four dual adjustments. Duals and slacks are
   * doubled, so delta3 is half a slack. */
  private DeltaStep computeDelta() {
    final Label[] label = labels.label;
    DeltaStep best = null;

    // delta1: the minimum vertex dual.
    if (!options.isMaxCardinality()) {
      best = DeltaStep.vertexDual(duals.minVertexDual());
    }

    // delta2: the minimum slack of an edge between an S-vertex and a free
    // vertex.
    for (int v = 0; v < vertexCount; v++) {
      if (labels.topLabel(v) == Label.NONE && labels.bestEdge[v] != -1) {
        final double d = duals.slack(labels.bestEdge[v]);
        if (DeltaStep.isBetter(d, best)) {
          best = DeltaStep.freeEdge(d, labels.bestEdge[v]);
        }
      }
    }

    // delta3: half the minimum slack of an edge between two S-blossoms.
    for (int b = 0; b < 2 * vertexCount; b++) {
      if (forest.isTopLevel(b) && label[b] == Label.S && labels.bestEdge[b] != -1) {
        final double kslack = duals.slack(labels.bestEdge[b]);
        assert !options.isIntegerWeights() || kslack % 2 == 0;
        final double d = kslack / 2;
        if (DeltaStep.isBetter(d, best)) {
          best = DeltaStep.sBlossomEdge(d, labels.bestEdge[b]);
        }
      }
    }

    // delta4: the minimum dual of a T-blossom.
    for (int b = vertexCount; b < 2 * vertexCount; b++) {
      if (forest.isLive(b)
          && forest.isTopLevel(b)
          && label[b] == Label.T
          && DeltaStep.isBetter(duals.get(b), best)) {
        best = DeltaStep.tBlossom(duals.get(b), b);
      }
    }

    if (best == null) {
      // Maximum cardinality reached. A final step makes the optimum
      // verifiable.
      assert options.isMaxCardinality();
      best = DeltaStep.vertexDual(Math.max(0, duals.minVertexDual()));
    }
    return best;
  }

  private void applyDelta(double delta) {
    for (int v = 0; v < vertexCount; v++) {
      final Label t = labels.topLabel(v);
      if (t == Label.S) {
        duals.add(v, -delta);
      } else if (t == Label.T) {
        duals.add(v, delta);
      }
    }
    for (int b = vertexCount; b < 2 * vertexCount; b++) {
      if (forest.isLive(b) && forest.isTopLevel(b)) {
        if (labels.label[b] == Label.S) {
          duals.add(b, delta);
        } else if (labels.label[b] == Label.T) {
          duals.add(b, -delta);
        }
      }
    }
  }

  /**
   * Contracts a new blossom with the given base, closed by edge k between
   * two S-vertices. The blossom gets label S and dual zero; its T-vertices
   * become S-vertices and are queued.
   */
  private void addBlossom(int base, int k) {
    final int[] inBlossom = forest.inBlossom;
    final Label[] label = labels.label;
    final int[] labelEnd = labels.labelEnd;
    int v = endpoint[2 * k];
    int w = endpoint[2 * k + 1];
    final int bb = inBlossom[base];
    int bv = inBlossom[v];
    int bw = inBlossom[w];

    final int b = forest.allocate();
    forest.base[b] = base;
    forest.parent[b] = -1;
    forest.parent[bb] = b;

    // Children and connecting endpoints: trace back from v to the base ...
    final List<Integer> path = new ArrayList<>();
    final List<Integer> endps = new ArrayList<>();
    while (bv != bb) {
      forest.parent[bv] = b;
      path.add(bv);
      endps.add(labelEnd[bv]);
      assert label[bv] == Label.T
          || label[bv] == Label.S && labelEnd[bv] == mate[forest.base[bv]];
      assert labelEnd[bv] >= 0;
      v = endpoint[labelEnd[bv]];
      bv = inBlossom[v];
    }
    path.add(bb);
    Collections.reverse(path);
    Collections.reverse(endps);
    endps.add(2 * k);
    // ... then from w back to the base.
    while (bw != bb) {
      forest.parent[bw] = b;
      path.add(bw);
      endps.add(labelEnd[bw] ^ 1);
      assert label[bw] == Label.T
          || label[bw] == Label.S && labelEnd[bw] == mate[forest.base[bw]];
      assert labelEnd[bw] >= 0;
      w = endpoint[labelEnd[bw]];
      bw = inBlossom[w];
    }
    forest.childs[b] = Ints.toArray(path);
    forest.endps[b] = Ints.toArray(endps);

    assert label[bb] == Label.S;
    label[b] = Label.S;
    labelEnd[b] = labelEnd[bb];
    duals.set(b, 0);

    for (int leaf : forest.leaves(b)) {
      if (label[inBlossom[leaf]] == Label.T) {
        // A T-vertex inside an S-blossom is an S-vertex.
        labels.queue.addLast(leaf);
      }
      inBlossom[leaf] = b;
    }

    // Least-slack edges to other S-blossoms, merged from the children.
    final int[] bestEdgeTo = new int[2 * vertexCount];
    Arrays.fill(bestEdgeTo, -1);
    for (int sub : path) {
      if (forest.bestEdges[sub] == null) {
        for (int leaf : forest.leaves(sub)) {
          for (int p : graph.neighborEnds[leaf]) {
            considerBestEdge(b, p / 2, bestEdgeTo);
          }
        }
      } else {
        for (int edge : forest.bestEdges[sub]) {
          considerBestEdge(b, edge, bestEdgeTo);
        }
      }
      forest.bestEdges[sub] = null;
      labels.bestEdge[sub] = -1;
    }
    final List<Integer> bestEdges = new ArrayList<>();
    for (int edge : bestEdgeTo) {
      if (edge != -1) {
        bestEdges.add(edge);
      }
    }
    forest.bestEdges[b] = Ints.toArray(bestEdges);

    labels.bestEdge[b] = -1;
    for (int edge : forest.bestEdges[b]) {
      if (labels.bestEdge[b] == -1
          || duals.slack(edge) < duals.slack(labels.bestEdge[b])) {
        labels.bestEdge[b] = edge;
      }
    }
  }

  private void considerBestEdge(int b, int k, int[] bestEdgeTo) {
    int j = endpoint[2 * k + 1];
    if (forest.inBlossom[j] == b) {
      j = endpoint[2 * k];
    }
    final int bj = forest.inBlossom[j];
    if (bj != b
        && labels.label[bj] == Label.S
        && (bestEdgeTo[bj] == -1 || duals.slack(k) < duals.slack(bestEdgeTo[bj]))) {
      bestEdgeTo[bj] = k;
    }
  }

  /**
   * Expands a top-level blossom into its children.
   *
   * @param b is the blossom.
   * @param endStage whether the stage is over; if so, zero-dual sub-blossoms
   * are expanded recursively and no labels are kept. Otherwise b is a
   * T-blossom whose dual reached zero, and its children are relabeled to
   * keep the alternating tree valid.
   */
  private void expandBlossom(int b, boolean endStage) {
    final int[] inBlossom = forest.inBlossom;
    final Label[] label = labels.label;
    final int[] labelEnd = labels.labelEnd;

    for (int s : forest.childs[b]) {
      forest.parent[s] = -1;
      if (!forest.isBlossom(s)) {
        inBlossom[s] = s;
      } else if (endStage && duals.get(s) == 0) {
        expandBlossom(s, endStage);
      } else {
        forest.forEachLeaf(s, leaf -> inBlossom[leaf] = s);
      }
    }

    if (!endStage && label[b] == Label.T) {
      // Relabel the children, starting from the one through which the
      // blossom got its label and going round towards the base in the
      // direction that passes an even number of children.
      assert labelEnd[b] >= 0;
      final int entryChild = inBlossom[endpoint[labelEnd[b] ^ 1]];
      int j = forest.indexOfChild(b, entryChild);
      final int jstep;
      final int endptrick;
      if ((j & 1) != 0) {
        j -= forest.childs[b].length;
        jstep = 1;
        endptrick = 0;
      } else {
        jstep = -1;
        endptrick = 1;
      }
      int p = labelEnd[b];
      while (j != 0) {
        // Relabel the T-child.
        label[endpoint[p ^ 1]] = Label.NONE;
        label[endpoint[forest.endpointAt(b, j - endptrick) ^ endptrick ^ 1]] = Label.NONE;
        labels.assignLabel(endpoint[p ^ 1], Label.T, p);
        // Step to the next S-child and note its forward edge.
        labels.allowEdge[forest.endpointAt(b, j - endptrick) / 2] = true;
        j += jstep;
        p = forest.endpointAt(b, j - endptrick) ^ endptrick;
        // Step to the next T-child.
        labels.allowEdge[p / 2] = true;
        j += jstep;
      }
      // The base child becomes T without passing the label on to its mate,
      // which is already labeled.
      final int bv = forest.childAt(b, j);
      label[endpoint[p ^ 1]] = label[bv] = Label.T;
      labelEnd[endpoint[p ^ 1]] = labelEnd[bv] = p;
      labels.bestEdge[bv] = -1;

      // The children on the other side are reachable only if a vertex in
      // them was reached from an S-vertex outside the blossom.
      j += jstep;
      while (forest.childAt(b, j) != entryChild) {
        final int child = forest.childAt(b, j);
        if (label[child] == Label.S) {
          // Labeled through a neighbor during this walk.
          j += jstep;
          continue;
        }
        final int reached = findReachedLeaf(child);
        if (reached >= 0) {
          assert label[reached] == Label.T;
          assert inBlossom[reached] == child;
          label[reached] = Label.NONE;
          label[endpoint[mate[forest.base[child]]]] = Label.NONE;
          labels.assignLabel(reached, Label.T, labelEnd[reached]);
        }
        j += jstep;
      }
    }

    label[b] = Label.NONE;
    labelEnd[b] = -1;
    labels.bestEdge[b] = -1;
    forest.release(b);
  }

  /** Returns the first vertex in blossom b that carries a label, or -1. */
  private int findReachedLeaf(int b) {
    for (int leaf : forest.leaves(b)) {
      if (labels.label[leaf] != Label.NONE) {
        return leaf;
      }
    }
    return -1;
  }

  /**
   * Swaps matched and unmatched edges on the alternating path through
   * blossom b between vertex v and the base, then makes v the base.
   */
  private void augmentBlossom(int b, int v) {
    // The immediate child of b that contains v.
    int t = v;
    while (forest.parent[t] != b) {
      t = forest.parent[t];
    }
    if (forest.isBlossom(t)) {
      augmentBlossom(t, v);
    }

    final int i = forest.indexOfChild(b, t);
    int j = i;
    final int jstep;
    final int endptrick;
    if ((i & 1) != 0) {
      j -= forest.childs[b].length;
      jstep = 1;
      endptrick = 0;
    } else {
      jstep = -1;
      endptrick = 1;
    }
    while (j != 0) {
      j += jstep;
      t = forest.childAt(b, j);
      final int p = forest.endpointAt(b, j - endptrick) ^ endptrick;
      if (forest.isBlossom(t)) {
        augmentBlossom(t, endpoint[p]);
      }
      j += jstep;
      t = forest.childAt(b, j);
      if (forest.isBlossom(t)) {
        augmentBlossom(t, endpoint[p ^ 1]);
      }
      mate[endpoint[p]] = p ^ 1;
      mate[endpoint[p ^ 1]] = p;
    }

    forest.rotate(b, i);
    forest.base[b] = forest.base[forest.childs[b][0]];
    assert forest.base[b] == v;
  }

  /**
   * Augments the matching along the path through edge k, which joins two
   * S-vertices in different alternating trees.
   */
  private void augmentMatching(int k) {
    final int[] inBlossom = forest.inBlossom;
    final int[] labelEnd = labels.labelEnd;
    final int[][] sides = {
        {endpoint[2 * k], 2 * k + 1},
        {endpoint[2 * k + 1], 2 * k}};
    for (int[] side : sides) {
      int s = side[0];
      int p = side[1];
      // Match s to the remote endpoint p, then trace back to the root,
      // flipping edges along the way.
      for (;;) {
        final int bs = inBlossom[s];
        assert labels.label[bs] == Label.S;
        assert labelEnd[bs] == mate[forest.base[bs]];
        if (forest.isBlossom(bs)) {
          augmentBlossom(bs, s);
        }
        mate[s] = p;
        if (labelEnd[bs] == -1) {
          // Reached an exposed root.
          break;
        }
        final int t = endpoint[labelEnd[bs]];
        final int bt = inBlossom[t];
        assert labels.label[bt] == Label.T;
        assert labelEnd[bt] >= 0;
        s = endpoint[labelEnd[bt]];
        final int j = endpoint[labelEnd[bt] ^ 1];
        assert forest.base[bt] == t;
        if (forest.isBlossom(bt)) {
          augmentBlossom(bt, j);
        }
        mate[j] = labelEnd[bt];
        p = labelEnd[bt] ^ 1;
      }
    }
  }

  private boolean isSymmetric() {
    for (int v = 0; v < vertexCount; v++) {
      if (mate[v] >= 0 && mate[endpoint[mate[v]]] != (mate[v] ^ 1)) {
        return false;
      }
    }
    return true;
  }

  private int matchedCount() {
    int count = 0;
    for (int p : mate) {
      if (p >= 0) {
        count++;
      }
    }
    return count;
  }
}

// End BlossomSolver.java
