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

import org.apache.pregel.bsp.Pregel;
import org.apache.pregel.bsp.PregelResult;
import org.apache.pregel.conf.Partitioning;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.ArrayGraph;
import org.apache.pregel.graph.NodePropertyValues;
import org.apache.pregel.values.NodeValueEntry;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link ConnectedComponentsComputation}
 */
public class ConnectedComponentsComputationTest {
  /** Undirected relationships of a small graph with four components */
  private static final int[][] EDGES = {
    {1, 2}, {1, 3}, {2, 4}, {2, 5}, {3, 4}, {4, 5}, {4, 13}, {5, 12},
    {5, 13}, {12, 13}, {6, 7}, {6, 8}, {7, 10}, {7, 11}, {8, 10}, {10, 11}
  };

  private static ArrayGraph.Builder toyGraph() {
    ArrayGraph.Builder builder = ArrayGraph.builder(14);
    for (int[] edge : EDGES) {
      builder.addUndirectedRelationship(edge[0], edge[1]);
    }
    return builder;
  }

  private static long[] components(PregelResult result) {
    long[] components = new long[14];
    for (NodeValueEntry entry : result.getNodeValues()
        .entries(ConnectedComponentsComputation.COMPONENT)) {
      components[(int) entry.getNodeId()] = entry.longValue();
    }
    return components;
  }

  @Test
  public void testToyData() {
    long[] expected = {0, 1, 1, 1, 1, 1, 6, 6, 6, 9, 6, 6, 1, 1};
    for (Partitioning partitioning : Partitioning.values()) {
      PregelConfig config = PregelConfig.builder()
          .partitioning(partitioning)
          .build();
      PregelResult result = Pregel.create(toyGraph().build(), config,
          new ConnectedComponentsComputation()).run();
      assertTrue(result.didConverge());
      assertArrayEquals(partitioning.toString(), expected,
          components(result));
    }
  }

  @Test
  public void testSeeded() {
    long[] seeds = new long[14];
    for (int i = 0; i < seeds.length; ++i) {
      seeds[i] = i + 100;
    }
    seeds[13] = 3;
    ArrayGraph graph = toyGraph()
        .addNodeProperty("seed", NodePropertyValues.ofLongs(seeds))
        .build();
    PregelResult result = Pregel.create(graph, PregelConfig.builder().build(),
        new ConnectedComponentsComputation(Optional.of("seed"))).run();
    long[] expected = {100, 3, 3, 3, 3, 3, 106, 106, 106, 109, 106, 106, 3, 3};
    assertArrayEquals(expected, components(result));
  }
}
