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

import java.util.function.LongPredicate;

import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.values.NodeValue;

/**
 * Context of {@link PregelComputation#masterCompute}, with access to every
 * vertex of the value store.
 */
public class MasterComputeContext {
  /** Graph */
  private final Graph graph;
  /** Run configuration */
  private final PregelConfig config;
  /** Value store */
  private final NodeValue nodeValue;
  /** Finished superstep */
  private final int superstep;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param nodeValue Value store
   * @param superstep Finished superstep
   */
  public MasterComputeContext(Graph graph, PregelConfig config,
      NodeValue nodeValue, int superstep) {
    this.graph = graph;
    this.config = config;
    this.nodeValue = nodeValue;
    this.superstep = superstep;
  }

  public int superstep() {
    return superstep;
  }

  public boolean isInitialSuperstep() {
    return superstep == 0;
  }

  public long nodeCount() {
    return graph.nodeCount();
  }

  public PregelConfig config() {
    return config;
  }

  /**
   * Visit vertex ids in ascending order.
   *
   * @param consumer Callback, returning false stops the iteration
   */
  public void forEachNode(LongPredicate consumer) {
    long nodeCount = graph.nodeCount();
    for (long nodeId = 0; nodeId < nodeCount; ++nodeId) {
      if (!consumer.test(nodeId)) {
        return;
      }
    }
  }

  public double doubleNodeValue(String key, long nodeId) {
    return nodeValue.doubleValue(key, nodeId);
  }

  public long longNodeValue(String key, long nodeId) {
    return nodeValue.longValue(key, nodeId);
  }

  public long[] longArrayNodeValue(String key, long nodeId) {
    return nodeValue.longArrayValue(key, nodeId);
  }

  public double[] doubleArrayNodeValue(String key, long nodeId) {
    return nodeValue.doubleArrayValue(key, nodeId);
  }

  public void setNodeValue(String key, long nodeId, double value) {
    nodeValue.set(key, nodeId, value);
  }

  public void setNodeValue(String key, long nodeId, long value) {
    nodeValue.setLong(key, nodeId, value);
  }

  public void setNodeValue(String key, long nodeId, long[] value) {
    nodeValue.setLongArray(key, nodeId, value);
  }

  public void setNodeValue(String key, long nodeId, double[] value) {
    nodeValue.setDoubleArray(key, nodeId, value);
  }
}
