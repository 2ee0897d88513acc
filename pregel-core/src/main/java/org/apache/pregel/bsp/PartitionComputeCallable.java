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

import java.util.Queue;
import java.util.concurrent.Callable;

import org.apache.log4j.Logger;
import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.partition.Partition;

/**
 * Compute thread of the static partitioning schedulers. Pulls partitions
 * from a shared queue until it is empty and runs each through the
 * superstep's {@link ComputeStep}.
 *
 * @param <I> Message iterator type
 */
public class PartitionComputeCallable<I extends MessageIterator>
    implements Callable<Long> {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PartitionComputeCallable.class);

  /** Sequential body */
  private final ComputeStep<I> computeStep;
  /** Partitions left in this superstep */
  private final Queue<Partition> partitions;

  /**
   * Constructor
   *
   * @param computeStep Sequential body
   * @param partitions Shared, thread-safe queue of partitions
   */
  public PartitionComputeCallable(ComputeStep<I> computeStep,
      Queue<Partition> partitions) {
    this.computeStep = computeStep;
    this.partitions = partitions;
  }

  @Override
  public Long call() {
    long computed = 0;
    int processed = 0;
    Partition partition;
    while ((partition = partitions.poll()) != null) {
      if (!computeStep.getTerminationFlag().running()) {
        if (LOG.isInfoEnabled()) {
          LOG.info("call: Termination requested, leaving " +
              (partitions.size() + 1) + " partitions unprocessed");
        }
        break;
      }
      computed += computeStep.computeBatch(partition);
      ++processed;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("call: Computed " + computed + " vertices in " + processed +
          " partitions");
    }
    return computed;
  }
}
