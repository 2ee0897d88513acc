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
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.apache.pregel.values.NodeValue;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link ShortestDistanceComputation}
 */
public class ShortestDistanceComputationTest {
  private static ArrayGraph path() {
    return ArrayGraph.builder(4)
        .addRelationship(0, 1)
        .addRelationship(1, 2)
        .addRelationship(2, 3)
        .build();
  }

  @Test
  public void testPathGraph() {
    for (Partitioning partitioning : Partitioning.values()) {
      PregelConfig config = PregelConfig.builder()
          .partitioning(partitioning)
          .build();
      PregelResult result = Pregel.create(path(), config,
          new ShortestDistanceComputation(0)).run();

      assertEquals(TerminationReason.CONVERGED,
          result.getTerminationReason());
      assertEquals(4, result.getRanIterations());
      NodeValue values = result.getNodeValues();
      for (int nodeId = 0; nodeId < 4; ++nodeId) {
        assertEquals(partitioning.toString(), nodeId,
            values.doubleValue(ShortestDistanceComputation.DISTANCE, nodeId),
            0);
      }
    }
  }

  @Test
  public void testProgressPerSuperstep() {
    ProgressTracker tracker = mock(ProgressTracker.class);
    Pregel.create(path(), PregelConfig.builder().concurrency(1).build(),
        new ShortestDistanceComputation(0), tracker,
        TerminationFlag.RUNNING_TRUE).run();
    // supersteps 0 to 4, one batch each
    verify(tracker, times(5)).beginTask(anyString(), eq(4L));
    verify(tracker, times(5)).logProgress(4);
    verify(tracker, times(5)).endTask();
  }

  @Test
  public void testUnreachableVertex() {
    ArrayGraph graph = ArrayGraph.builder(5)
        .addRelationship(0, 1)
        .addRelationship(1, 2)
        .addRelationship(2, 0)
        .addRelationship(3, 0)
        .build();
    PregelResult result = Pregel.create(graph,
        PregelConfig.builder().build(), new ShortestDistanceComputation(0))
        .run();
    assertTrue(result.didConverge());
    NodeValue values = result.getNodeValues();
    assertEquals(0.0, values.doubleValue("dist", 0), 0);
    assertEquals(2.0, values.doubleValue("dist", 2), 0);
    assertEquals(Double.POSITIVE_INFINITY, values.doubleValue("dist", 3), 0);
    assertEquals(Double.POSITIVE_INFINITY, values.doubleValue("dist", 4), 0);
  }
}
