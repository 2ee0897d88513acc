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

import java.util.concurrent.RecursiveAction;

import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.partition.Partition;

/**
 * Fork-join task over a partition: splits at the midpoint while the
 * partition holds at least {@link #SEQUENTIAL_THRESHOLD} vertices, then
 * hands the leaves to a {@link ComputeStep}.
 *
 * @param <I> Message iterator type
 */
public class ForkJoinComputeStep<I extends MessageIterator>
    extends RecursiveAction {
  /** Smallest partition that is split further */
  public static final int SEQUENTIAL_THRESHOLD = 1000;

  /** Serialization version */
  private static final long serialVersionUID = 1L;

  /** Sequential body */
  private final transient ComputeStep<I> computeStep;
  /** Vertices of this task */
  private final Partition partition;

  /**
   * Constructor
   *
   * @param computeStep Sequential body
   * @param partition Vertices of this task
   */
  public ForkJoinComputeStep(ComputeStep<I> computeStep,
      Partition partition) {
    this.computeStep = computeStep;
    this.partition = partition;
  }

  @Override
  protected void compute() {
    if (!computeStep.getTerminationFlag().running()) {
      return;
    }
    if (partition.getNodeCount() >= SEQUENTIAL_THRESHOLD) {
      Partition[] halves = partition.splitAtMidpoint();
      invokeAll(new ForkJoinComputeStep<>(computeStep, halves[0]),
          new ForkJoinComputeStep<>(computeStep, halves[1]));
    } else {
      computeStep.computeBatch(partition);
    }
  }
}
