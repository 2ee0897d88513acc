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

import org.apache.log4j.Logger;
import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.computation.ComputeContext;
import org.apache.pregel.computation.InitContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.schema.DefaultValue;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.schema.Visibility;

/**
 * Hop distance from a single source by relaxation. Unreachable vertices
 * keep {@link Double#POSITIVE_INFINITY}.
 */
public class ShortestDistanceComputation implements PregelComputation {
  /** Distance of a vertex from the source */
  public static final String DISTANCE = "dist";
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(ShortestDistanceComputation.class);

  /** Source vertex */
  private final long sourceNodeId;

  /**
   * Constructor
   *
   * @param sourceNodeId Source vertex
   */
  public ShortestDistanceComputation(long sourceNodeId) {
    this.sourceNodeId = sourceNodeId;
  }

  @Override
  public PregelSchema schema(PregelConfig config) {
    return PregelSchema.builder()
        .addWithDefault(DISTANCE, DefaultValue.of(Double.POSITIVE_INFINITY),
            Visibility.PUBLIC)
        .build();
  }

  @Override
  public void init(InitContext context) {
    if (context.nodeId() == sourceNodeId) {
      context.setNodeValue(DISTANCE, 0.0);
    }
  }

  @Override
  public void compute(ComputeContext context, Messages messages) {
    if (context.isInitialSuperstep()) {
      if (context.nodeId() == sourceNodeId) {
        context.sendToNeighbors(context.doubleNodeValue(DISTANCE));
      }
      return;
    }
    double minDist = Double.POSITIVE_INFINITY;
    DoubleIterator iterator = messages.iterator();
    while (iterator.hasNext()) {
      minDist = Math.min(minDist, iterator.nextDouble() + 1);
    }
    if (minDist < context.doubleNodeValue(DISTANCE)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("compute: Vertex " + context.nodeId() + " got distance " +
            minDist + " in superstep " + context.superstep());
      }
      context.setNodeValue(DISTANCE, minDist);
      context.sendToNeighbors(minDist);
    } else {
      context.voteToHalt();
    }
  }
}
