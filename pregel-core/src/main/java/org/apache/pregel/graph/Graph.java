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
package org.apache.pregel.graph;

import java.util.Optional;
import java.util.Set;

/**
 * Topology and vertex properties the engine computes over. Vertex ids are
 * dense, in {@code [0, nodeCount())}. Implementations must allow concurrent
 * reads.
 */
public interface Graph {
  /**
   * @return Number of vertices
   */
  long nodeCount();

  /**
   * @return Number of relationships
   */
  long relationshipCount();

  /**
   * Out-degree of a vertex.
   *
   * @param nodeId Vertex id
   * @return Degree
   */
  int degree(long nodeId);

  /**
   * Visit the outgoing relationships of a vertex.
   *
   * @param nodeId Vertex id
   * @param fallbackWeight Weight reported when the graph has no
   *                       relationship property
   * @param consumer Callback
   */
  void forEachRelationship(long nodeId, double fallbackWeight,
      RelationshipConsumer consumer);

  /**
   * @return True if relationships carry a weight
   */
  boolean hasRelationshipProperty();

  /**
   * @return Keys of the vertex properties this graph projects
   */
  Set<String> nodePropertyKeys();

  /**
   * Projection of one vertex property.
   *
   * @param propertyKey Property key
   * @return Projection or empty if the graph has no such property
   */
  Optional<NodePropertyValues> nodeProperties(String propertyKey);
}
