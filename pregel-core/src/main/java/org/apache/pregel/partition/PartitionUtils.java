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

import java.math.RoundingMode;
import java.util.List;

import org.apache.pregel.graph.Graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.math.LongMath;

/**
 * Static partitioning of the vertex range.
 */
public class PartitionUtils {
  /** Do not instantiate */
  private PartitionUtils() {
  }

  /**
   * Cut the vertex range into at most {@code concurrency} contiguous
   * partitions of about equal size.
   *
   * @param concurrency Number of workers
   * @param nodeCount Number of vertices
   * @return Partitions in ascending order, covering every vertex once
   */
  public static List<Partition> rangePartition(int concurrency,
      long nodeCount) {
    Preconditions.checkArgument(concurrency >= 1,
        "rangePartition: Invalid concurrency %s", concurrency);
    List<Partition> partitions = Lists.newArrayList();
    if (nodeCount == 0) {
      return partitions;
    }
    long batchSize = LongMath.divide(nodeCount, concurrency,
        RoundingMode.CEILING);
    for (long start = 0; start < nodeCount; start += batchSize) {
      partitions.add(Partition.of(start,
          Math.min(batchSize, nodeCount - start)));
    }
    return partitions;
  }

  /**
   * Cut the vertex range into contiguous partitions of about equal
   * cumulative {@code degree + 1}, so vertices without relationships still
   * cost something.
   *
   * @param graph Graph
   * @param concurrency Number of workers
   * @return Partitions in ascending order, covering every vertex once
   */
  public static List<Partition> degreePartition(Graph graph,
      int concurrency) {
    Preconditions.checkArgument(concurrency >= 1,
        "degreePartition: Invalid concurrency %s", concurrency);
    long nodeCount = graph.nodeCount();
    List<Partition> partitions = Lists.newArrayList();
    if (nodeCount == 0) {
      return partitions;
    }
    long totalWeight = graph.relationshipCount() + nodeCount;
    long target = LongMath.divide(totalWeight, concurrency,
        RoundingMode.CEILING);
    long start = 0;
    long weight = 0;
    for (long nodeId = 0; nodeId < nodeCount; ++nodeId) {
      weight += graph.degree(nodeId) + 1;
      if (weight >= target) {
        partitions.add(Partition.of(start, nodeId + 1 - start));
        start = nodeId + 1;
        weight = 0;
      }
    }
    if (start < nodeCount) {
      partitions.add(Partition.of(start, nodeCount - start));
    }
    return partitions;
  }
}
