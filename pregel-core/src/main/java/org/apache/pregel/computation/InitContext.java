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
import java.util.Set;

import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.graph.NodePropertyValues;
import org.apache.pregel.values.NodeValue;

/**
 * Context of {@link PregelComputation#init}. Gives access to the vertex
 * properties of the graph so the value store can be seeded from them.
 */
public class InitContext extends NodeCentricContext {
  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param nodeValue Value store
   */
  public InitContext(Graph graph, PregelConfig config, NodeValue nodeValue) {
    super(graph, config, nodeValue);
  }

  public Set<String> nodePropertyKeys() {
    return graph.nodePropertyKeys();
  }

  /**
   * @param key Graph property key
   * @return Projection of the property, empty if the graph lacks it
   */
  public Optional<NodePropertyValues> nodeProperties(String key) {
    return graph.nodeProperties(key);
  }
}
