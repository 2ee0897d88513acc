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

import it.unimi.dsi.fastutil.longs.LongArrayList;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestArrayGraph {
  @Test
  public void testAdjacency() {
    ArrayGraph graph = ArrayGraph.builder(4)
        .addRelationship(2, 3)
        .addRelationship(0, 1)
        .addRelationship(0, 2)
        .build();
    assertEquals(4, graph.nodeCount());
    assertEquals(3, graph.relationshipCount());
    assertEquals(2, graph.degree(0));
    assertEquals(0, graph.degree(3));
    assertFalse(graph.hasRelationshipProperty());

    final LongArrayList targets = new LongArrayList();
    graph.forEachRelationship(0, 1.0, (source, target, weight) -> {
      targets.add(target);
      assertEquals(1.0, weight, 0);
      return true;
    });
    assertArrayEquals(new long[] {1, 2}, targets.toLongArray());
  }

  @Test
  public void testWeights() {
    ArrayGraph graph = ArrayGraph.builder(2)
        .addRelationship(0, 1, 0.25)
        .addRelationship(1, 0)
        .build();
    assertTrue(graph.hasRelationshipProperty());
    final double[] seen = new double[2];
    graph.forEachRelationship(0, 1.0, (source, target, weight) -> {
      seen[0] = weight;
      return true;
    });
    graph.forEachRelationship(1, 9.0, (source, target, weight) -> {
      seen[1] = weight;
      return true;
    });
    assertArrayEquals(new double[] {0.25, 1.0}, seen, 0);
  }

  @Test
  public void testNodeProperties() {
    ArrayGraph graph = ArrayGraph.builder(2)
        .addNodeProperty("seed", NodePropertyValues.ofLongs(new long[] {4, 5}))
        .build();
    assertTrue(graph.nodePropertyKeys().contains("seed"));
    assertEquals(5, graph.nodeProperties("seed").get().longValue(1));
    assertFalse(graph.nodeProperties("other").isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRelationshipOutOfRange() {
    ArrayGraph.builder(2).addRelationship(0, 2);
  }
}
