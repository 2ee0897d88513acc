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

import java.util.Optional;

import org.apache.log4j.Logger;
import org.apache.pregel.comm.messages.MessageIterator;
import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.comm.messages.MessengerFactory;
import org.apache.pregel.computation.MasterComputeContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.graph.NodePropertyValues;
import org.apache.pregel.metrics.PregelMetrics;
import org.apache.pregel.schema.DefaultValue;
import org.apache.pregel.schema.Element;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.utils.LoggingProgressTracker;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;

import com.google.common.base.Preconditions;
import com.yammer.metrics.core.TimerContext;

/**
 * Superstep executor. Runs a {@link PregelComputation} over a graph until
 * every vertex voted to halt without sending a message, master compute asks
 * to stop, the iteration limit is reached or a stop is requested.
 * A run executes at most once.
 */
public class Pregel {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(Pregel.class);

  /** Graph */
  private final Graph graph;
  /** Run configuration */
  private final PregelConfig config;
  /** User computation */
  private final PregelComputation computation;
  /** Value store */
  private final NodeValue nodeValue;
  /** Vertex part of the supersteps */
  private final PregelComputer<?> computer;
  /** Progress */
  private final ProgressTracker progressTracker;
  /** Cancellation */
  private final TerminationFlag terminationFlag;
  /** Metrics */
  private final PregelMetrics metrics;
  /** Lifecycle */
  private volatile ExecutionState state = ExecutionState.NOT_STARTED;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @param progressTracker Progress
   * @param terminationFlag Cancellation
   */
  private Pregel(Graph graph, PregelConfig config,
      PregelComputation computation, ProgressTracker progressTracker,
      TerminationFlag terminationFlag) {
    this.graph = graph;
    this.config = config;
    this.computation = computation;
    this.progressTracker = progressTracker;
    this.terminationFlag = terminationFlag;
    PregelSchema schema = computation.schema(config);
    Preconditions.checkNotNull(schema, "Pregel: Computation %s returned " +
        "no schema", computation.getClass().getName());
    this.nodeValue = NodeValue.of(schema, graph.nodeCount());
    this.metrics = new PregelMetrics(config.metricsEnabled());
    this.computer = createComputer(MessengerFactory.create(config,
        graph.nodeCount(), computation.reducer()));
  }

  /**
   * Create a run logging progress, without cancellation.
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @return Run, not started
   */
  public static Pregel create(Graph graph, PregelConfig config,
      PregelComputation computation) {
    return create(graph, config, computation,
        new LoggingProgressTracker(config.getProgressLogIntervalMsecs()),
        TerminationFlag.RUNNING_TRUE);
  }

  /**
   * Create a run.
   *
   * @param graph Graph
   * @param config Run configuration
   * @param computation User computation
   * @param progressTracker Progress
   * @param terminationFlag Cancellation
   * @return Run, not started
   */
  public static Pregel create(Graph graph, PregelConfig config,
      PregelComputation computation, ProgressTracker progressTracker,
      TerminationFlag terminationFlag) {
    Preconditions.checkNotNull(graph, "create: null graph");
    Preconditions.checkNotNull(config, "create: null config");
    Preconditions.checkNotNull(computation, "create: null computation");
    Preconditions.checkNotNull(progressTracker, "create: null tracker");
    Preconditions.checkNotNull(terminationFlag, "create: null flag");
    return new Pregel(graph, config, computation, progressTracker,
        terminationFlag);
  }

  /**
   * Bind the computer to the messenger's iterator type.
   *
   * @param messenger Messenger
   * @param <I> Message iterator type
   * @return Computer
   */
  private <I extends MessageIterator> PregelComputer<I> createComputer(
      Messenger<I> messenger) {
    return PregelComputer.create(graph, config, computation, nodeValue,
        messenger, progressTracker, terminationFlag, metrics);
  }

  public ExecutionState getState() {
    return state;
  }

  public PregelMetrics getMetrics() {
    return metrics;
  }

  /**
   * Execute supersteps until the run ends. User callback failures abort
   * the run with an {@link IllegalStateException}, no result is produced.
   *
   * @return Result
   */
  public PregelResult run() {
    Preconditions.checkState(state == ExecutionState.NOT_STARTED,
        "run: Already ran, state is %s", state);
    state = ExecutionState.RUNNING;
    if (LOG.isInfoEnabled()) {
      LOG.info("run: Starting " + computation.getClass().getSimpleName() +
          " on " + graph.nodeCount() + " vertices with " + config);
    }
    try {
      PregelResult result = runSupersteps();
      state = result.getTerminationReason().toExecutionState();
      if (LOG.isInfoEnabled()) {
        LOG.info("run: Finished with " + result);
      }
      return result;
    } catch (RuntimeException | Error e) {
      state = ExecutionState.FAILED;
      throw e;
    } finally {
      try {
        computation.close();
      } finally {
        computer.release();
        metrics.shutdown();
      }
    }
  }

  /**
   * Superstep loop.
   *
   * @return Result
   */
  private PregelResult runSupersteps() {
    computer.initComputation();
    initPropertySources();
    int maxIterations = config.getMaxIterations();
    int iteration = 0;
    TerminationReason reason = TerminationReason.ITERATION_LIMIT_REACHED;
    for (; iteration < maxIterations; ++iteration) {
      progressTracker.beginTask("superstep " + iteration, graph.nodeCount());
      TimerContext timerContext = metrics.timeSuperstep();
      try {
        computer.initIteration(iteration);
        computer.runIteration();
      } catch (RuntimeException e) {
        throw new IllegalStateException("runSupersteps: Computation failed " +
            "in superstep " + iteration, e);
      } finally {
        timerContext.stop();
        progressTracker.endTask();
      }
      if (!terminationFlag.running()) {
        reason = TerminationReason.TERMINATED;
        if (LOG.isInfoEnabled()) {
          LOG.info("runSupersteps: Termination requested during superstep " +
              iteration);
        }
        break;
      }
      boolean masterHalt;
      try {
        masterHalt = computation.masterCompute(new MasterComputeContext(graph,
            config, nodeValue, iteration));
      } catch (RuntimeException e) {
        throw new IllegalStateException("runSupersteps: Master compute " +
            "failed in superstep " + iteration, e);
      }
      if (masterHalt || computer.hasConverged()) {
        reason = TerminationReason.CONVERGED;
        break;
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("runSupersteps: Superstep " + iteration + " done, " +
            computer.getVoteBits().cardinality() + " of " +
            graph.nodeCount() + " vertices halted");
      }
    }
    int ranIterations = reason == TerminationReason.ITERATION_LIMIT_REACHED ?
        maxIterations - 1 : iteration;
    return new PregelResult(nodeValue, ranIterations, reason);
  }

  /**
   * Copy graph properties into elements that name a property source.
   * Runs before superstep 0, so Init may still overwrite them.
   */
  private void initPropertySources() {
    for (Element element : nodeValue.schema().elements()) {
      if (!element.getPropertySource().isPresent()) {
        continue;
      }
      String source = element.getPropertySource().get();
      Optional<NodePropertyValues> values = graph.nodeProperties(source);
      if (!values.isPresent()) {
        LOG.warn("initPropertySources: Graph has no property '" + source +
            "' for '" + element.getPropertyKey() + "', keeping defaults");
        continue;
      }
      long nodeCount = graph.nodeCount();
      for (long nodeId = 0; nodeId < nodeCount; ++nodeId) {
        Optional<DefaultValue> value =
            DefaultValue.fromProperty(values.get(), nodeId);
        if (value.isPresent()) {
          nodeValue.set(element.getPropertyKey(), nodeId, value.get());
        }
      }
    }
  }
}
