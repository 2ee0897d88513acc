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

import java.util.List;

import org.apache.pregel.graph.ArrayGraph;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestPartitionUtils {
  private static void assertCovers(List<Partition> partitions,
      long nodeCount) {
    long next = 0;
    for (Partition partition : partitions) {
      assertEquals(next, partition.getStartNode());
      assertTrue(partition.getNodeCount() > 0);
      next = partition.getEndNode();
    }
    assertEquals(nodeCount, next);
  }

  @Test
  public void testRangePartition() {
    List<Partition> partitions = PartitionUtils.rangePartition(4, 10);
    assertEquals(4, partitions.size());
    assertEquals(3, partitions.get(0).getNodeCount());
    assertEquals(1, partitions.get(3).getNodeCount());
    assertCovers(partitions, 10);

    assertCovers(PartitionUtils.rangePartition(8, 3), 3);
    assertEquals(3, PartitionUtils.rangePartition(8, 3).size());
    assertTrue(PartitionUtils.rangePartition(4, 0).isEmpty());
  }

  @Test
  public void testDegreePartitionBalancesSkew() {
    // vertex 0 is a hub with 30 relationships, the rest have none
    ArrayGraph.Builder builder = ArrayGraph.builder(31);
    for (int target = 1; target <= 30; ++target) {
      builder.addRelationship(0, target);
    }
    ArrayGraph graph = builder.build();
    List<Partition> partitions = PartitionUtils.degreePartition(graph, 2);
    assertCovers(partitions, 31);
    // total weight 61, target 31: the hub fills the first partition alone
    assertEquals(Partition.of(0, 1), partitions.get(0));
    assertEquals(Partition.of(1, 30), partitions.get(1));
  }

  @Test
  public void testDegreePartitionUniform() {
    ArrayGraph.Builder builder = ArrayGraph.builder(8);
    for (int i = 0; i < 8; ++i) {
      builder.addRelationship(i, (i + 1) % 8);
    }
    List<Partition> partitions =
        PartitionUtils.degreePartition(builder.build(), 4);
    assertEquals(4, partitions.size());
    for (Partition partition : partitions) {
      assertEquals(2, partition.getNodeCount());
    }
    assertCovers(partitions, 8);
  }
}
