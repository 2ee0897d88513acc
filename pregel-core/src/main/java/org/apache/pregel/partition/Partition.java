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
package org.apache.pregel.partition;

import java.util.function.LongConsumer;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Contiguous range of vertex ids, the unit of schedulable work.
 */
@Immutable
public final class Partition {
  /** First vertex id */
  private final long startNode;
  /** Number of vertices */
  private final long nodeCount;

  /**
   * Constructor
   *
   * @param startNode First vertex id
   * @param nodeCount Number of vertices
   */
  private Partition(long startNode, long nodeCount) {
    this.startNode = startNode;
    this.nodeCount = nodeCount;
  }

  /**
   * @param startNode First vertex id
   * @param nodeCount Number of vertices
   * @return Partition {@code [startNode, startNode + nodeCount)}
   */
  public static Partition of(long startNode, long nodeCount) {
    Preconditions.checkArgument(startNode >= 0,
        "of: Negative start node %s", startNode);
    Preconditions.checkArgument(nodeCount >= 0,
        "of: Negative node count %s", nodeCount);
    return new Partition(startNode, nodeCount);
  }

  public long getStartNode() {
    return startNode;
  }

  public long getNodeCount() {
    return nodeCount;
  }

  /**
   * @return One past the last vertex id
   */
  public long getEndNode() {
    return startNode + nodeCount;
  }

  /**
   * Visit every vertex id in ascending order.
   *
   * @param consumer Callback
   */
  public void consume(LongConsumer consumer) {
    long end = getEndNode();
    for (long nodeId = startNode; nodeId < end; ++nodeId) {
      consumer.accept(nodeId);
    }
  }

  /**
   * Split into two contiguous halves. The first half receives the extra
   * vertex on an odd count.
   *
   * @return Two partitions covering exactly this one
   */
  public Partition[] splitAtMidpoint() {
    Preconditions.checkState(nodeCount >= 2,
        "splitAtMidpoint: Cannot split %s", this);
    long firstCount = (nodeCount + 1) / 2;
    return new Partition[] {
      new Partition(startNode, firstCount),
      new Partition(startNode + firstCount, nodeCount - firstCount)
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Partition)) {
      return false;
    }
    Partition other = (Partition) o;
    return startNode == other.startNode && nodeCount == other.nodeCount;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(startNode) + Long.hashCode(nodeCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("startNode", startNode)
        .add("nodeCount", nodeCount)
        .toString();
  }
}
