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
package org.apache.pregel.examples;

import it.unimi.dsi.fastutil.doubles.DoubleIterator;

import java.util.Optional;

import org.apache.log4j.Logger;
import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.computation.ComputeContext;
import org.apache.pregel.computation.InitContext;
import org.apache.pregel.computation.MasterComputeContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.reducers.MessageReducer;
import org.apache.pregel.reducers.ReducerType;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.schema.ValueType;
import org.apache.pregel.schema.Visibility;

/**
 * PageRank with summed messages. The run stops once no rank moves by
 * more than the configured tolerance, otherwise at the iteration limit.
 */
public class PageRankComputation implements PregelComputation {
  /** Rank of a vertex */
  public static final String PAGE_RANK = "pagerank";
  /** Change of the rank in the last superstep */
  public static final String DELTA = "delta";
  /** Default damping factor */
  public static final double DEFAULT_DAMPING_FACTOR = 0.85;
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PageRankComputation.class);

  /** Damping factor */
  private final double dampingFactor;

  /** Constructor with the default damping factor */
  public PageRankComputation() {
    this(DEFAULT_DAMPING_FACTOR);
  }

  /**
   * Constructor
   *
   * @param dampingFactor Probability of following a relationship
   */
  public PageRankComputation(double dampingFactor) {
    this.dampingFactor = dampingFactor;
  }

  @Override
  public PregelSchema schema(PregelConfig config) {
    return PregelSchema.builder()
        .addPublic(PAGE_RANK, ValueType.DOUBLE)
        .add(DELTA, ValueType.DOUBLE, Visibility.PRIVATE)
        .build();
  }

  @Override
  public void init(InitContext context) {
    context.setNodeValue(PAGE_RANK, 1.0 / context.nodeCount());
  }

  @Override
  public void compute(ComputeContext context, Messages messages) {
    double rank = context.doubleNodeValue(PAGE_RANK);
    if (!context.isInitialSuperstep()) {
      double sum = 0;
      DoubleIterator iterator = messages.iterator();
      while (iterator.hasNext()) {
        sum += iterator.nextDouble();
      }
      double newRank = (1 - dampingFactor) / context.nodeCount() +
          dampingFactor * sum;
      context.setNodeValue(DELTA, Math.abs(newRank - rank));
      context.setNodeValue(PAGE_RANK, newRank);
      rank = newRank;
    }
    if (context.degree() > 0) {
      context.sendToNeighbors(rank / context.degree());
    }
  }

  @Override
  public boolean masterCompute(MasterComputeContext context) {
    if (context.isInitialSuperstep() ||
        !context.config().getTolerance().isPresent()) {
      return false;
    }
    final double[] maxDelta = {0};
    context.forEachNode(nodeId -> {
      maxDelta[0] = Math.max(maxDelta[0],
          context.doubleNodeValue(DELTA, nodeId));
      return true;
    });
    if (LOG.isDebugEnabled()) {
      LOG.debug("masterCompute: Superstep " + context.superstep() +
          " max delta " + maxDelta[0]);
    }
    return maxDelta[0] < context.config().getTolerance().getAsDouble();
  }

  @Override
  public Optional<MessageReducer> reducer() {
    return Optional.of(ReducerType.SUM.newReducer());
  }
}
