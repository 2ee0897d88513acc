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
import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.metrics.PregelMetrics;
import org.apache.pregel.utils.AtomicBitSet;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;

/**
 * Runs the vertex part of supersteps over the whole vertex range and owns
 * the state shared by all compute threads of a run. Subclasses decide how
 * the range is scheduled on threads.
 *
 * @param <I> Message iterator type
 */
public abstract class PregelComputer<I extends MessageIterator> {
  /** Graph */
  protected final Graph graph;
  /** Run configuration */
  protected final PregelConfig config;
  /** User computation */
  protected final PregelComputation computation;
  /** Value store */
  protected final NodeValue nodeValue;
  /** Messenger */
  protected final Messenger<I> messenger;
  /** Vote-to-halt bits */
  protected final AtomicBitSet voteBits;
  /** Set when any vertex sends in the current superstep */
  protected final AtomicBoolean sentFlag = new AtomicBoolean();
  /** Progress */
  protected final ProgressTracker progressTracker;
  /** Cancellation */
  protected final TerminationFlag terminationFlag;
  /** Metrics */
  protected final PregelMetrics metrics;
  /** Step of the current superstep */
  private ComputeStep<I> currentStep;

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
  protected PregelComputer(Graph graph, PregelConfig config,
      PregelComputation computation, NodeValue nodeValue,
      Messenger<I> messenger, ProgressTracker progressTracker,
      TerminationFlag terminationFlag, PregelMetrics metrics) {
    this.graph = graph;
    this.config = config;
    this.computation = computation;
    this.nodeValue = nodeValue;
    this.messenger = messenger;
    this.voteBits = new AtomicBitSet(graph.nodeCount());
    this.progressTracker = progressTracker;
    this.terminationFlag = terminationFlag;
    this.metrics = metrics;
  }

  /**
   * Pick the scheduler for the configured partitioning.
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @param nodeValue Value store
   * @param messenger Messenger
   * @param progressTracker Progress
   * @param terminationFlag Cancellation
   * @param metrics Metrics
   * @param <I> Message iterator type
   * @return Computer
   */
  public static <I extends MessageIterator> PregelComputer<I> create(
      Graph graph, PregelConfig config, PregelComputation computation,
      NodeValue nodeValue, Messenger<I> messenger,
      ProgressTracker progressTracker, TerminationFlag terminationFlag,
      PregelMetrics metrics) {
    if (config.useForkJoin()) {
      return new ForkJoinComputer<>(graph, config, computation, nodeValue,
          messenger, progressTracker, terminationFlag, metrics);
    }
    return new PartitionedComputer<>(graph, config, computation, nodeValue,
        messenger, progressTracker, terminationFlag, metrics);
  }

  /**
   * Prepare the run, all vertices active.
   */
  public void initComputation() {
    voteBits.clearAll();
  }

  /**
   * Prepare a superstep: clear the sent flag and swap message buffers.
   *
   * @param iteration Superstep about to start
   */
  public void initIteration(int iteration) {
    sentFlag.set(false);
    messenger.initIteration(iteration);
    currentStep = new ComputeStep<>(graph, config, computation, nodeValue,
        messenger, voteBits, sentFlag, iteration, progressTracker,
        terminationFlag, metrics);
  }

  /**
   * Compute every vertex of the current superstep and return once all of
   * them are done. Failures of user code are rethrown.
   */
  public abstract void runIteration();

  /**
   * Valid after {@link #runIteration()}.
   *
   * @return True if every vertex voted to halt and nothing was sent
   */
  public boolean hasConverged() {
    return !sentFlag.get() && voteBits.allSet();
  }

  /**
   * Free threads and buffered messages.
   */
  public void release() {
    messenger.release();
  }

  /**
   * @return Step of the current superstep
   */
  protected ComputeStep<I> currentStep() {
    return currentStep;
  }

  public AtomicBitSet getVoteBits() {
    return voteBits;
  }
}
