/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pregel.bsp;

import javax.annotation.concurrent.Immutable;

import org.apache.pregel.values.NodeValue;

import com.google.common.base.MoreObjects;

/**
 * Outcome of a finished run.
 */
@Immutable
public final class PregelResult {
  /** Final value store */
  private final NodeValue nodeValues;
  /** Index of the last superstep that ran */
  private final int ranIterations;
  /** Why the run ended */
  private final TerminationReason terminationReason;

  /**
   * Constructor
   *
   * @param nodeValues Final value store
   * @param ranIterations Index of the last superstep that ran
   * @param terminationReason Why the run ended
   */
  public PregelResult(NodeValue nodeValues, int ranIterations,
      TerminationReason terminationReason) {
    this.nodeValues = nodeValues;
    this.ranIterations = ranIterations;
    this.terminationReason = terminationReason;
  }

  public NodeValue getNodeValues() {
    return nodeValues;
  }

  public int getRanIterations() {
    return ranIterations;
  }

  public boolean didConverge() {
    return terminationReason == TerminationReason.CONVERGED;
  }

  public TerminationReason getTerminationReason() {
    return terminationReason;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ranIterations", ranIterations)
        .add("terminationReason", terminationReason)
        .toString();
  }
}
