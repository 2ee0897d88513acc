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

import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.computation.ComputeContext;
import org.apache.pregel.computation.InitContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.metrics.PregelMetrics;
import org.apache.pregel.partition.Partition;
import org.apache.pregel.utils.AtomicBitSet;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;

/**
 * Sequential body of a superstep for one batch of vertices. Shared by
 * every scheduler, one instance per superstep.
 *
 * @param <I> Message iterator type
 */
public class ComputeStep<I extends MessageIterator> {
  /** Graph */
  private final Graph graph;
  /** Run configuration */
  private final PregelConfig config;
  /** User computation */
  private final PregelComputation computation;
  /** Value store */
  private final NodeValue nodeValue;
  /** Messenger */
  private final Messenger<I> messenger;
  /** Vote-to-halt bits */
  private final AtomicBitSet voteBits;
  /** Shared "message sent" flag */
  private final AtomicBoolean sentFlag;
  /** Current superstep */
  private final int iteration;
  /** Progress */
  private final ProgressTracker progressTracker;
  /** Cancellation */
  private final TerminationFlag terminationFlag;
  /** Metrics */
  private final PregelMetrics metrics;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @param nodeValue Value store
   * @param messenger Messenger
   * @param voteBits Vote-to-halt bits
   * @param sentFlag Shared "message sent" flag
   * @param iteration Current superstep
   * @param progressTracker Progress
   * @param terminationFlag Cancellation
   * @param metrics Metrics
   */
  public ComputeStep(Graph graph, PregelConfig config,
      PregelComputation computation, NodeValue nodeValue,
      Messenger<I> messenger, AtomicBitSet voteBits, AtomicBoolean sentFlag,
      int iteration, ProgressTracker progressTracker,
      TerminationFlag terminationFlag, PregelMetrics metrics) {
    this.graph = graph;
    this.config = config;
    this.computation = computation;
    this.nodeValue = nodeValue;
    this.messenger = messenger;
    this.voteBits = voteBits;
    this.sentFlag = sentFlag;
    this.iteration = iteration;
    this.progressTracker = progressTracker;
    this.terminationFlag = terminationFlag;
    this.metrics = metrics;
  }

  public TerminationFlag getTerminationFlag() {
    return terminationFlag;
  }

  /**
   * Run Init (superstep 0) and Compute for every active vertex of a batch.
   * Does nothing once a stop was requested.
   *
   * @param partition Batch
   * @return Number of vertices computed
   */
  public long computeBatch(Partition partition) {
    if (!terminationFlag.running()) {
      return 0;
    }
    boolean isInitialSuperstep = iteration == 0;
    I messageIterator = messenger.messageIterator();
    Messages messages = isInitialSuperstep ? Messages.empty() :
        new Messages(messageIterator);
    InitContext initContext = isInitialSuperstep ?
        new InitContext(graph, config, nodeValue) : null;
    ComputeContext computeContext = new ComputeContext(graph, config,
        nodeValue, computation, messenger, voteBits, sentFlag, iteration);

    long computed = 0;
    long end = partition.getEndNode();
    for (long nodeId = partition.getStartNode(); nodeId < end; ++nodeId) {
      if (initContext != null) {
        initContext.setNodeId(nodeId);
        computation.init(initContext);
      }
      messenger.initMessageIterator(messageIterator, nodeId,
          isInitialSuperstep);
      boolean hasMessages = !messageIterator.isEmpty();
      if (hasMessages || !voteBits.get(nodeId)) {
        voteBits.clear(nodeId);
        computeContext.setNodeId(nodeId);
        computation.compute(computeContext, messages);
        ++computed;
      }
    }
    progressTracker.logProgress(partition.getNodeCount());
    metrics.incrVerticesComputed(computed);
    metrics.incrMessagesSent(computeContext.getMessagesSent());
    return computed;
  }
}
