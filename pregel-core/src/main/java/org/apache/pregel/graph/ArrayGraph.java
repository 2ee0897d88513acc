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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * In-memory graph in compressed sparse row layout. Relationships of a
 * vertex are kept in insertion order.
 */
@Immutable
public final class ArrayGraph implements Graph {
  /** Offsets into targets, nodeCount + 1 entries */
  private final long[] offsets;
  /** Relationship targets grouped by source */
  private final long[] targets;
  /** Relationship weights, parallel to targets, or null */
  private final double[] weights;
  /** Vertex properties */
  private final ImmutableMap<String, NodePropertyValues> nodeProperties;

  /**
   * Constructor
   *
   * @param offsets Offsets
   * @param targets Targets
   * @param weights Weights or null
   * @param nodeProperties Vertex properties
   */
  private ArrayGraph(long[] offsets, long[] targets, double[] weights,
      Map<String, NodePropertyValues> nodeProperties) {
    this.offsets = offsets;
    this.targets = targets;
    this.weights = weights;
    this.nodeProperties = ImmutableMap.copyOf(nodeProperties);
  }

  /**
   * Start building a graph.
   *
   * @param nodeCount Number of vertices
   * @return Builder
   */
  public static Builder builder(long nodeCount) {
    return new Builder(nodeCount);
  }

  @Override
  public long nodeCount() {
    return offsets.length - 1;
  }

  @Override
  public long relationshipCount() {
    return targets.length;
  }

  @Override
  public int degree(long nodeId) {
    int id = Math.toIntExact(nodeId);
    return (int) (offsets[id + 1] - offsets[id]);
  }

  @Override
  public void forEachRelationship(long nodeId, double fallbackWeight,
      RelationshipConsumer consumer) {
    int id = Math.toIntExact(nodeId);
    int end = (int) offsets[id + 1];
    for (int i = (int) offsets[id]; i < end; ++i) {
      double weight = weights == null ? fallbackWeight : weights[i];
      if (!consumer.accept(nodeId, targets[i], weight)) {
        return;
      }
    }
  }

  @Override
  public boolean hasRelationshipProperty() {
    return weights != null;
  }

  @Override
  public Set<String> nodePropertyKeys() {
    return nodeProperties.keySet();
  }

  @Override
  public Optional<NodePropertyValues> nodeProperties(String propertyKey) {
    return Optional.ofNullable(nodeProperties.get(propertyKey));
  }

  /**
   * Collects relationships and vertex properties.
   */
  public static final class Builder {
    /** Number of vertices */
    private final int nodeCount;
    /** Relationship sources */
    private final LongArrayList sources = new LongArrayList();
    /** Relationship targets */
    private final LongArrayList targets = new LongArrayList();
    /** Relationship weights */
    private final DoubleArrayList weights = new DoubleArrayList();
    /** Whether any relationship was added with a weight */
    private boolean weighted;
    /** Vertex properties */
    private final Map<String, NodePropertyValues> nodeProperties =
        Maps.newHashMap();

    /**
     * Constructor
     *
     * @param nodeCount Number of vertices
     */
    private Builder(long nodeCount) {
      Preconditions.checkArgument(nodeCount >= 0 &&
          nodeCount < Integer.MAX_VALUE, "Builder: Invalid node count %s",
          nodeCount);
      this.nodeCount = (int) nodeCount;
    }

    /**
     * Add an unweighted relationship.
     *
     * @param source Source vertex
     * @param target Target vertex
     * @return this
     */
    public Builder addRelationship(long source, long target) {
      return addRelationship(source, target, Double.NaN);
    }

    /**
     * Add a weighted relationship. NaN means "no weight".
     *
     * @param source Source vertex
     * @param target Target vertex
     * @param weight Weight
     * @return this
     */
    public Builder addRelationship(long source, long target, double weight) {
      checkNode(source);
      checkNode(target);
      sources.add(source);
      targets.add(target);
      weights.add(weight);
      weighted |= !Double.isNaN(weight);
      return this;
    }

    /**
     * Add a relationship in both directions.
     *
     * @param first First vertex
     * @param second Second vertex
     * @return this
     */
    public Builder addUndirectedRelationship(long first, long second) {
      return addRelationship(first, second).addRelationship(second, first);
    }

    /**
     * Attach a vertex property.
     *
     * @param propertyKey Key
     * @param values Projection covering every vertex
     * @return this
     */
    public Builder addNodeProperty(String propertyKey,
        NodePropertyValues values) {
      Preconditions.checkArgument(values.nodeCount() == nodeCount,
          "addNodeProperty: '%s' covers %s vertices, graph has %s",
          propertyKey, values.nodeCount(), nodeCount);
      nodeProperties.put(propertyKey, values);
      return this;
    }

    /**
     * Verify a vertex id.
     *
     * @param nodeId Vertex id
     */
    private void checkNode(long nodeId) {
      Preconditions.checkArgument(nodeId >= 0 && nodeId < nodeCount,
          "checkNode: Vertex %s outside of [0, %s)", nodeId, nodeCount);
    }

    /**
     * @return Immutable graph
     */
    public ArrayGraph build() {
      int relationshipCount = sources.size();
      long[] offsets = new long[nodeCount + 1];
      for (int i = 0; i < relationshipCount; ++i) {
        offsets[(int) sources.getLong(i) + 1]++;
      }
      for (int i = 0; i < nodeCount; ++i) {
        offsets[i + 1] += offsets[i];
      }
      long[] sortedTargets = new long[relationshipCount];
      double[] sortedWeights = weighted ? new double[relationshipCount] : null;
      long[] cursor = offsets.clone();
      for (int i = 0; i < relationshipCount; ++i) {
        int position = (int) cursor[(int) sources.getLong(i)]++;
        sortedTargets[position] = targets.getLong(i);
        if (sortedWeights != null) {
          double weight = weights.getDouble(i);
          sortedWeights[position] = Double.isNaN(weight) ? 1.0 : weight;
        }
      }
      return new ArrayGraph(offsets, sortedTargets, sortedWeights,
          nodeProperties);
    }
  }
}
