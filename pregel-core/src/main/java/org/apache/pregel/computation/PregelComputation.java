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
package org.apache.pregel.computation;

import java.util.Optional;

import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.reducers.MessageReducer;
import org.apache.pregel.schema.PregelSchema;

/**
 * User logic of a vertex-centric algorithm. One instance serves every
 * vertex of a run, so {@link #init} and {@link #compute} are called
 * concurrently from many threads.
 */
public interface PregelComputation {
  /**
   * Declare the per-vertex state.
   *
   * @param config Run configuration
   * @return Schema of the value store
   */
  PregelSchema schema(PregelConfig config);

  /**
   * Called once per vertex before the first compute in superstep 0.
   *
   * @param context Context of the vertex
   */
  default void init(InitContext context) {
  }

  /**
   * Called per active vertex per superstep. A vertex is active if it did
   * not vote to halt or if it received a message.
   *
   * @param context Context of the vertex
   * @param messages Messages sent to the vertex in the previous superstep
   */
  void compute(ComputeContext context, Messages messages);

  /**
   * Called once after every superstep, single threaded, after all
   * vertices were computed.
   *
   * @param context Context of the superstep
   * @return True to stop the run as converged
   */
  default boolean masterCompute(MasterComputeContext context) {
    return false;
  }

  /**
   * @return Reducer folding the messages to a vertex, if any
   */
  default Optional<MessageReducer> reducer() {
    return Optional.empty();
  }

  /**
   * Transform a value sent along a weighted relationship by
   * {@link ComputeContext#sendToNeighbors(double)}.
   *
   * @param nodeValue Value sent
   * @param relationshipWeight Weight of the relationship
   * @return Message delivered
   */
  default double applyRelationshipWeight(double nodeValue,
      double relationshipWeight) {
    return nodeValue;
  }

  /**
   * Called once at the end of the run, also after a failure.
   */
  default void close() {
  }
}
