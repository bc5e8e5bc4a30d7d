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

import org.apache.blossom.config.BlossomSystemProperty;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

import java.util.Objects;

/**
 * Settings for one matching computation.
 *
 * <p>Instances are immutable; each {@code withXxx} method returns a copy with
 * one setting changed, for example
 *
 * <blockquote><pre>
 * MatchingOptions.DEFAULT.withMaxCardinality(true).withIntegerWeights(true)
 * </pre></blockquote>
 */
@Immutable
public final class MatchingOptions {
  /** Options taken from {@link BlossomSystemProperty}; max-cardinality off. */
  public static final MatchingOptions DEFAULT = new MatchingOptions(false,
      BlossomSystemProperty.MATCHING_INTEGER_WEIGHTS.value(),
      BlossomSystemProperty.MATCHING_EPSILON.value(),
      BlossomSystemProperty.MATCHING_VERIFY.value());

  private final boolean maxCardinality;
  private final boolean integerWeights;
  private final double epsilon;
  private final boolean verify;

  private MatchingOptions(boolean maxCardinality, boolean integerWeights,
      double epsilon, boolean verify) {
    Preconditions.checkArgument(epsilon >= 0 && !Double.isInfinite(epsilon),
        "epsilon must be a finite non-negative number, was %s", epsilon);
    this.maxCardinality = maxCardinality;
    this.integerWeights = integerWeights;
    this.epsilon = epsilon;
    this.verify = verify;
  }

  /**
   * Whether only maximum-cardinality matchings are considered; among those,
   * one of maximum weight is returned.
   */
  public boolean isMaxCardinality() {
    return maxCardinality;
  }

  /**
   * Whether every edge weight is promised to be an integer. In this mode the
   * computation is exact, weights that are not integral are rejected, and
   * the result may be checked by the optimality verifier.
   */
  public boolean isIntegerWeights() {
    return integerWeights;
  }

  /** Slack at or below which an edge is treated as tight; ignored in integer
   * mode, where slacks are exact. */
  public double getEpsilon() {
    return epsilon;
  }

  /** Whether to verify optimality after an integer-weight computation. */
  public boolean isVerify() {
    return verify;
  }

  public MatchingOptions withMaxCardinality(boolean maxCardinality) {
    if (maxCardinality == this.maxCardinality) {
      return this;
    }
    return new MatchingOptions(maxCardinality, integerWeights, epsilon, verify);
  }

  public MatchingOptions withIntegerWeights(boolean integerWeights) {
    if (integerWeights == this.integerWeights) {
      return this;
    }
    return new MatchingOptions(maxCardinality, integerWeights, epsilon, verify);
  }

  public MatchingOptions withEpsilon(double epsilon) {
    return new MatchingOptions(maxCardinality, integerWeights, epsilon, verify);
  }

  public MatchingOptions withVerify(boolean verify) {
    if (verify == this.verify) {
      return this;
    }
    return new MatchingOptions(maxCardinality, integerWeights, epsilon, verify);
  }

  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof MatchingOptions
        && maxCardinality == ((MatchingOptions) obj).maxCardinality
        && integerWeights == ((MatchingOptions) obj).integerWeights
        && Double.compare(epsilon, ((MatchingOptions) obj).epsilon) == 0
        && verify == ((MatchingOptions) obj).verify;
  }

  @Override public int hashCode() {
    return Objects.hash(maxCardinality, integerWeights, epsilon, verify);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxCardinality", maxCardinality)
        .add("integerWeights", integerWeights)
        .add("epsilon", epsilon)
        .add("verify", verify)
        .toString();
  }
}

// End MatchingOptions.java
