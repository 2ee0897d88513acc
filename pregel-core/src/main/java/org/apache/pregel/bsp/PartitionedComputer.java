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

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;
import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.metrics.PregelMetrics;
import org.apache.pregel.partition.Partition;
import org.apache.pregel.partition.PartitionUtils;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Schedules supersteps over static partitions, by vertex range or by
 * degree. {@code concurrency} {@link PartitionComputeCallable}s share a
 * queue of the partitions on a fixed thread pool.
 *
 * @param <I> Message iterator type
 */
public class PartitionedComputer<I extends MessageIterator>
    extends PregelComputer<I> {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PartitionedComputer.class);

  /** Compute threads */
  private final ExecutorService executor;
  /** Partitions, computed once per run */
  private List<Partition> partitions;

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
  public PartitionedComputer(Graph graph, PregelConfig config,
      PregelComputation computation, NodeValue nodeValue,
      Messenger<I> messenger, ProgressTracker progressTracker,
      TerminationFlag terminationFlag, PregelMetrics metrics) {
    super(graph, config, computation, nodeValue, messenger, progressTracker,
        terminationFlag, metrics);
    this.executor = Executors.newFixedThreadPool(config.getConcurrency(),
        new ThreadFactoryBuilder().setNameFormat("compute-%d")
            .setDaemon(true).build());
  }

  @Override
  public void initComputation() {
    super.initComputation();
    switch (config.getPartitioning()) {
    case DEGREE:
      partitions = PartitionUtils.degreePartition(graph,
          config.getConcurrency());
      break;
    case RANGE:
      partitions = PartitionUtils.rangePartition(config.getConcurrency(),
          graph.nodeCount());
      break;
    default:
      throw new IllegalStateException("initComputation: Partitioning " +
          config.getPartitioning() + " is not static");
    }
    if (LOG.isInfoEnabled()) {
      LOG.info("initComputation: " + partitions.size() + " " +
          config.getPartitioning() + " partitions for " + graph.nodeCount() +
          " vertices");
    }
  }

  @Override
  public void runIteration() {
    ConcurrentLinkedQueue<Partition> queue =
        new ConcurrentLinkedQueue<>(partitions);
    int numThreads = Math.min(config.getConcurrency(), partitions.size());
    List<Future<Long>> futures = Lists.newArrayListWithCapacity(numThreads);
    for (int i = 0; i < numThreads; ++i) {
      futures.add(executor.submit(
          new PartitionComputeCallable<>(currentStep(), queue)));
    }
    try {
      for (Future<Long> future : futures) {
        waitFor(future);
      }
    } catch (RuntimeException | Error e) {
      queue.clear();
      for (Future<Long> future : futures) {
        future.cancel(true);
      }
      throw e;
    }
  }

  /**
   * Wait for a compute thread, rethrowing its failure.
   *
   * @param future Result of a {@link PartitionComputeCallable}
   */
  private static void waitFor(Future<Long> future) {
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("waitFor: Interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      } else if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("waitFor: Compute thread failed",
          cause);
    }
  }

  @Override
  public void release() {
    try {
      executor.shutdownNow();
    } finally {
      super.release();
    }
  }
}
