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

import java.util.concurrent.ForkJoinPool;

import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.metrics.PregelMetrics;
import org.apache.pregel.partition.Partition;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;

/**
 * Schedules each superstep as one {@link ForkJoinComputeStep} tree over the
 * whole vertex range on a work-stealing pool.
 *
 * @param <I> Message iterator type
 */
public class ForkJoinComputer<I extends MessageIterator>
    extends PregelComputer<I> {
  /** Work-stealing pool */
  private final ForkJoinPool forkJoinPool;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @param nodeValue Value store
   * @param messenger Messenger
   * @param progressTracker Progress
   * @param terminationFlag Cancellation
   * @param metrics Metrics
   */
  public ForkJoinComputer(Graph graph, PregelConfig config,
      PregelComputation computation, NodeValue nodeValue,
      Messenger<I> messenger, ProgressTracker progressTracker,
      TerminationFlag terminationFlag, PregelMetrics metrics) {
    super(graph, config, computation, nodeValue, messenger, progressTracker,
        terminationFlag, metrics);
    this.forkJoinPool = new ForkJoinPool(config.getConcurrency());
  }

  @Override
  public void runIteration() {
    forkJoinPool.invoke(new ForkJoinComputeStep<>(currentStep(),
        Partition.of(0, graph.nodeCount())));
  }

  @Override
  public void release() {
    try {
      forkJoinPool.shutdownNow();
    } finally {
      super.release();
    }
  }
}
