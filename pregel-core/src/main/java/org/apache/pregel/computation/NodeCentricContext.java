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

import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.values.NodeValue;

/**
 * State shared by the contexts that act on behalf of a single vertex.
 * Instances are confined to one compute thread and are moved from vertex
 * to vertex with {@link #setNodeId(long)}.
 */
public abstract class NodeCentricContext {
  /** Graph */
  protected final Graph graph;
  /** Run configuration */
  protected final PregelConfig config;
  /** Value store */
  protected final NodeValue nodeValue;
  /** Current vertex */
  protected long nodeId;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param nodeValue Value store
   */
  protected NodeCentricContext(Graph graph, PregelConfig config,
      NodeValue nodeValue) {
    this.graph = graph;
    this.config = config;
    this.nodeValue = nodeValue;
  }

  /**
   * Move the context to a vertex.
   *
   * @param nodeId Vertex id
   */
  public void setNodeId(long nodeId) {
    this.nodeId = nodeId;
  }

  public long nodeId() {
    return nodeId;
  }

  public long nodeCount() {
    return graph.nodeCount();
  }

  public PregelConfig config() {
    return config;
  }

  /**
   * @return Out-degree of the current vertex
   */
  public int degree() {
    return graph.degree(nodeId);
  }

  /**
   * @param key Property key
   * @param value New double value of the current vertex
   */
  public void setNodeValue(String key, double value) {
    nodeValue.set(key, nodeId, value);
  }

  /**
   * @param key Property key
   * @param value New long value of the current vertex
   */
  public void setNodeValue(String key, long value) {
    nodeValue.setLong(key, nodeId, value);
  }

  /**
   * @param key Property key
   * @param value New long array value of the current vertex
   */
  public void setNodeValue(String key, long[] value) {
    nodeValue.setLongArray(key, nodeId, value);
  }

  /**
   * @param key Property key
   * @param value New double array value of the current vertex
   */
  public void setNodeValue(String key, double[] value) {
    nodeValue.setDoubleArray(key, nodeId, value);
  }
}
