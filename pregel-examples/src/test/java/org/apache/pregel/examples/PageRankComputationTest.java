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

import org.apache.pregel.bsp.Pregel;
import org.apache.pregel.bsp.PregelResult;
import org.apache.pregel.bsp.TerminationReason;
import org.apache.pregel.conf.Partitioning;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.ArrayGraph;
import org.apache.pregel.values.NodeValue;
import org.apache.pregel.values.NodeValueEntry;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link PageRankComputation}
 */
public class PageRankComputationTest {
  private static ArrayGraph star() {
    return ArrayGraph.builder(4)
        .addRelationship(1, 0)
        .addRelationship(2, 0)
        .addRelationship(3, 0)
        .addRelationship(0, 1)
        .build();
  }

  @Test
  public void testCycleIsUniform() {
    ArrayGraph cycle = ArrayGraph.builder(3)
        .addRelationship(0, 1)
        .addRelationship(1, 2)
        .addRelationship(2, 0)
        .build();
    PregelConfig config = PregelConfig.builder().tolerance(1e-9).build();
    PregelResult result = Pregel.create(cycle, config,
        new PageRankComputation()).run();
    assertTrue(result.didConverge());
    assertEquals(1, result.getRanIterations());
    for (NodeValueEntry entry :
        result.getNodeValues().entries(PageRankComputation.PAGE_RANK)) {
      assertEquals(1.0 / 3, entry.doubleValue(), 1e-9);
    }
  }

  @Test
  public void testStar() {
    for (Partitioning partitioning : Partitioning.values()) {
      PregelConfig config = PregelConfig.builder()
          .maxIterations(200)
          .tolerance(1e-7)
          .partitioning(partitioning)
          .build();
      PregelResult result = Pregel.create(star(), config,
          new PageRankComputation()).run();
      assertTrue(result.didConverge());
      NodeValue values = result.getNodeValues();
      String key = PageRankComputation.PAGE_RANK;
      // r2 = r3 = b, r1 = b + d * r0, r0 = b + d * (r1 + r2 + r3)
      double b = 0.15 / 4;
      double r0 = (b + 0.85 * b + 0.85 * 2 * b) / (1 - 0.85 * 0.85);
      assertEquals(r0, values.doubleValue(key, 0), 1e-5);
      assertEquals(b + 0.85 * r0, values.doubleValue(key, 1), 1e-5);
      assertEquals(b, values.doubleValue(key, 2), 1e-9);
      assertEquals(b, values.doubleValue(key, 3), 1e-9);
    }
  }

  @Test
  public void testWithoutToleranceRunsToLimit() {
    PregelConfig config = PregelConfig.builder().maxIterations(5).build();
    PregelResult result = Pregel.create(star(), config,
        new PageRankComputation()).run();
    assertEquals(TerminationReason.ITERATION_LIMIT_REACHED,
        result.getTerminationReason());
    assertEquals(4, result.getRanIterations());
    assertEquals("[pagerank]",
        result.getNodeValues().publicPropertyKeys().toString());
  }
}
