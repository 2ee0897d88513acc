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

import java.util.Optional;

import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.computation.ComputeContext;
import org.apache.pregel.computation.InitContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.NodePropertyValues;
import org.apache.pregel.reducers.MessageReducer;
import org.apache.pregel.reducers.ReducerType;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.schema.ValueType;

/**
 * Weakly connected components by propagating the smallest component id.
 * Relationships must be present in both directions. Vertices start with
 * their own id, or with the value of a seed property when one is given.
 */
public class ConnectedComponentsComputation implements PregelComputation {
  /** Component of a vertex */
  public static final String COMPONENT = "component";

  /** Optional graph property with initial component ids */
  private final Optional<String> seedProperty;

  /** Constructor, every vertex starts in its own component */
  public ConnectedComponentsComputation() {
    this(Optional.<String>empty());
  }

  /**
   * Constructor
   *
   * @param seedProperty Graph property with initial component ids
   */
  public ConnectedComponentsComputation(Optional<String> seedProperty) {
    this.seedProperty = seedProperty;
  }

  @Override
  public PregelSchema schema(PregelConfig config) {
    return PregelSchema.builder()
        .addPublic(COMPONENT, ValueType.LONG)
        .build();
  }

  @Override
  public void init(InitContext context) {
    long component = context.nodeId();
    if (seedProperty.isPresent()) {
      Optional<NodePropertyValues> seeds =
          context.nodeProperties(seedProperty.get());
      if (seeds.isPresent() && seeds.get().hasValue(context.nodeId())) {
        component = seeds.get().longValue(context.nodeId());
      }
    }
    context.setNodeValue(COMPONENT, component);
  }

  @Override
  public void compute(ComputeContext context, Messages messages) {
    long component = context.longNodeValue(COMPONENT);
    if (context.isInitialSuperstep()) {
      context.sendToNeighbors(component);
    } else if (!messages.isEmpty()) {
      // the reducer already folded everything to the minimum
      long candidate = (long) messages.iterator().nextDouble();
      if (candidate < component) {
        context.setNodeValue(COMPONENT, candidate);
        context.sendToNeighbors(candidate);
      }
    }
    context.voteToHalt();
  }

  @Override
  public Optional<MessageReducer> reducer() {
    return Optional.of(ReducerType.MIN.newReducer());
  }
}
