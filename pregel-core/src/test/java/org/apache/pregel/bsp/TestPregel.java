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
package org.apache.pregel.bsp;

import it.unimi.dsi.fastutil.doubles.DoubleIterator;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.pregel.comm.messages.Messages;
import org.apache.pregel.computation.ComputeContext;
import org.apache.pregel.computation.InitContext;
import org.apache.pregel.computation.MasterComputeContext;
import org.apache.pregel.computation.PregelComputation;
import org.apache.pregel.conf.Partitioning;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.ArrayGraph;
import org.apache.pregel.graph.NodePropertyValues;
import org.apache.pregel.reducers.MessageReducer;
import org.apache.pregel.reducers.ReducerType;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.schema.ValueType;
import org.apache.pregel.utils.ProgressTracker;
import org.apache.pregel.utils.TerminationFlag;
import org.junit.Test;

import com.google.common.base.Throwables;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestPregel {
  /** Failure raised by user code in tests */
  private static class BoomException extends RuntimeException {
    BoomException(String message) {
      super(message);
    }
  }

  /** Schema with a single double slot */
  private abstract static class DoubleValueComputation
      implements PregelComputation {
    @Override
    public PregelSchema schema(PregelConfig config) {
      return PregelSchema.builder().addPublic("value", ValueType.DOUBLE)
          .build();
    }
  }

  /** Min-label propagation, the same labels for any schedule */
  private static class MinLabelComputation implements PregelComputation {
    private final boolean useReducer;

    MinLabelComputation(boolean useReducer) {
      this.useReducer = useReducer;
    }

    @Override
    public PregelSchema schema(PregelConfig config) {
      return PregelSchema.builder().addPublic("label", ValueType.LONG)
          .build();
    }

    @Override
    public void init(InitContext context) {
      context.setNodeValue("label", context.nodeId());
    }

    @Override
    public void compute(ComputeContext context, Messages messages) {
      long label = context.longNodeValue("label");
      if (context.isInitialSuperstep()) {
        context.sendToNeighbors(label);
      } else {
        long min = label;
        DoubleIterator iterator = messages.iterator();
        while (iterator.hasNext()) {
          min = Math.min(min, (long) iterator.nextDouble());
        }
        if (min < label) {
          context.setNodeValue("label", min);
          context.sendToNeighbors(min);
        }
      }
      context.voteToHalt();
    }

    @Override
    public Optional<MessageReducer> reducer() {
      return useReducer ? Optional.of(ReducerType.MIN.newReducer()) :
          Optional.<MessageReducer>empty();
    }
  }

  private static PregelConfig config(Partitioning partitioning) {
    return PregelConfig.builder()
        .concurrency(4)
        .partitioning(partitioning)
        .build();
  }

  private static Pregel pregel(ArrayGraph graph, PregelConfig config,
      PregelComputation computation) {
    return Pregel.create(graph, config, computation, ProgressTracker.EMPTY,
        TerminationFlag.RUNNING_TRUE);
  }

  @Test
  public void testMessagesDeliveredInNextSuperstep() {
    for (Partitioning partitioning : Partitioning.values()) {
      final AtomicIntegerArray received = new AtomicIntegerArray(5);
      final ConcurrentLinkedQueue<String> errors =
          new ConcurrentLinkedQueue<>();
      PregelComputation computation = new DoubleValueComputation() {
        @Override
        public void compute(ComputeContext context, Messages messages) {
          if (context.nodeId() == 0) {
            context.sendTo(1, context.superstep());
          } else {
            DoubleIterator iterator = messages.iterator();
            while (iterator.hasNext()) {
              double message = iterator.nextDouble();
              received.incrementAndGet(context.superstep());
              if (message != context.superstep() - 1) {
                errors.add("superstep " + context.superstep() + " got " +
                    message);
              }
            }
          }
        }
      };
      PregelConfig config = PregelConfig.builder()
          .concurrency(2)
          .maxIterations(5)
          .partitioning(partitioning)
          .build();
      Pregel pregel = pregel(ArrayGraph.builder(2).build(), config,
          computation);
      PregelResult result = pregel.run();

      assertTrue(errors.toString(), errors.isEmpty());
      assertEquals(0, received.get(0));
      for (int superstep = 1; superstep < 5; ++superstep) {
        assertEquals(1, received.get(superstep));
      }
      assertEquals(TerminationReason.ITERATION_LIMIT_REACHED,
          result.getTerminationReason());
      assertFalse(result.didConverge());
      assertEquals(4, result.getRanIterations());
      assertEquals(ExecutionState.ITERATION_LIMIT_REACHED, pregel.getState());
      assertEquals(5, pregel.getMetrics().getMessagesSent());
      assertEquals(10, pregel.getMetrics().getVerticesComputed());
    }
  }

  @Test
  public void testConvergesWhenAllHaltWithoutMessages() {
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        context.voteToHalt();
      }
    };
    Pregel pregel = pregel(ArrayGraph.builder(10).build(),
        config(Partitioning.RANGE), computation);
    PregelResult result = pregel.run();
    assertTrue(result.didConverge());
    assertEquals(0, result.getRanIterations());
    assertEquals(ExecutionState.CONVERGED, pregel.getState());
  }

  @Test
  public void testMessageKeepsRunAlive() {
    // every vertex halts, but vertex 0 sends once more in superstep 0
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        if (context.isInitialSuperstep() && context.nodeId() == 0) {
          context.sendTo(1, 1.0);
        }
        if (!messages.isEmpty()) {
          context.setNodeValue("value", context.superstep());
        }
        context.voteToHalt();
      }
    };
    PregelResult result = pregel(ArrayGraph.builder(2).build(),
        config(Partitioning.AUTO), computation).run();
    assertTrue(result.didConverge());
    assertEquals(1, result.getRanIterations());
    assertEquals(1.0, result.getNodeValues().doubleValue("value", 1), 0);
  }

  @Test
  public void testUserFailureAbortsRun() {
    for (Partitioning partitioning : Partitioning.values()) {
      final BoomException boom = new BoomException("boom");
      final AtomicInteger lastSuperstep = new AtomicInteger(-1);
      final AtomicBoolean closed = new AtomicBoolean();
      PregelComputation computation = new DoubleValueComputation() {
        @Override
        public void compute(ComputeContext context, Messages messages) {
          lastSuperstep.accumulateAndGet(context.superstep(), Math::max);
          if (context.superstep() == 2 && context.nodeId() == 1234) {
            throw boom;
          }
        }

        @Override
        public void close() {
          closed.set(true);
        }
      };
      Pregel pregel = pregel(ArrayGraph.builder(3000).build(),
          config(partitioning), computation);
      try {
        pregel.run();
        fail();
      } catch (IllegalStateException e) {
        assertTrue(e.getMessage().contains("superstep 2"));
        assertSame(boom, Throwables.getRootCause(e));
      }
      assertEquals(2, lastSuperstep.get());
      assertTrue(closed.get());
      assertEquals(ExecutionState.FAILED, pregel.getState());
    }
  }

  @Test
  public void testMasterComputeFailureAbortsRun() {
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
      }

      @Override
      public boolean masterCompute(MasterComputeContext context) {
        throw new BoomException("master");
      }
    };
    try {
      pregel(ArrayGraph.builder(3).build(), config(Partitioning.RANGE),
          computation).run();
      fail();
    } catch (IllegalStateException e) {
      assertTrue(e.getCause() instanceof BoomException);
    }
  }

  @Test
  public void testTermination() {
    for (Partitioning partitioning : Partitioning.values()) {
      final AtomicBoolean stop = new AtomicBoolean();
      final AtomicIntegerArray computed = new AtomicIntegerArray(20);
      PregelComputation computation = new DoubleValueComputation() {
        @Override
        public void compute(ComputeContext context, Messages messages) {
          computed.incrementAndGet(context.superstep());
        }

        @Override
        public boolean masterCompute(MasterComputeContext context) {
          if (context.superstep() == 1) {
            stop.set(true);
          }
          return false;
        }
      };
      Pregel pregel = Pregel.create(ArrayGraph.builder(100).build(),
          config(partitioning), computation, ProgressTracker.EMPTY,
          TerminationFlag.wrap(stop::get, 0));
      PregelResult result = pregel.run();
      assertEquals(TerminationReason.TERMINATED,
          result.getTerminationReason());
      assertFalse(result.didConverge());
      assertEquals(2, result.getRanIterations());
      assertEquals(100, computed.get(1));
      assertEquals(0, computed.get(2));
      assertEquals(ExecutionState.TERMINATED, pregel.getState());
    }
  }

  @Test
  public void testMasterComputeStopsRun() {
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        context.setNodeValue("value", context.superstep());
      }

      @Override
      public boolean masterCompute(MasterComputeContext context) {
        final double[] sum = {0};
        context.forEachNode(nodeId -> {
          sum[0] += context.doubleNodeValue("value", nodeId);
          return true;
        });
        return sum[0] >= 3 * context.nodeCount();
      }
    };
    PregelResult result = pregel(ArrayGraph.builder(4).build(),
        config(Partitioning.RANGE), computation).run();
    assertTrue(result.didConverge());
    assertEquals(3, result.getRanIterations());
  }

  @Test
  public void testDeterministicAcrossSchedules() {
    Random random = new Random(42);
    int nodeCount = 5000;
    ArrayGraph.Builder builder = ArrayGraph.builder(nodeCount);
    for (int i = 0; i < 6000; ++i) {
      builder.addUndirectedRelationship(random.nextInt(nodeCount),
          random.nextInt(nodeCount));
    }
    ArrayGraph graph = builder.build();
    long[] expected = minLabels(graph);

    for (boolean useReducer : new boolean[] {false, true}) {
      for (Partitioning partitioning : Partitioning.values()) {
        for (int run = 0; run < 2; ++run) {
          PregelConfig config = PregelConfig.builder()
              .concurrency(4)
              .maxIterations(200)
              .partitioning(partitioning)
              .build();
          PregelResult result = pregel(graph, config,
              new MinLabelComputation(useReducer)).run();
          assertTrue(result.didConverge());
          long[] labels = new long[nodeCount];
          for (int nodeId = 0; nodeId < nodeCount; ++nodeId) {
            labels[nodeId] = result.getNodeValues().longValue("label", nodeId);
          }
          assertArrayEquals(partitioning + " reducer=" + useReducer,
              expected, labels);
        }
      }
    }
  }

  /** Smallest vertex id per connected component, by breadth-first search */
  private static long[] minLabels(ArrayGraph graph) {
    int nodeCount = (int) graph.nodeCount();
    long[] labels = new long[nodeCount];
    Arrays.fill(labels, -1);
    for (int start = 0; start < nodeCount; ++start) {
      if (labels[start] != -1) {
        continue;
      }
      final ArrayDeque<Long> queue = new ArrayDeque<>();
      final long[] found = labels;
      final long label = start;
      labels[start] = label;
      queue.add((long) start);
      while (!queue.isEmpty()) {
        graph.forEachRelationship(queue.poll(), 1.0, (s, target, w) -> {
          if (found[(int) target] == -1) {
            found[(int) target] = label;
            queue.add(target);
          }
          return true;
        });
      }
    }
    return labels;
  }

  @Test
  public void testPropertySource() {
    ArrayGraph graph = ArrayGraph.builder(3)
        .addNodeProperty("seed",
            NodePropertyValues.ofLongs(new long[] {10, 20, 30}))
        .build();
    PregelComputation computation = new PregelComputation() {
      @Override
      public PregelSchema schema(PregelConfig config) {
        return PregelSchema.builder()
            .addPublic("seeded", ValueType.LONG)
            .withPropertySource("seeded", "seed")
            .addPublic("unseeded", ValueType.DOUBLE)
            .withPropertySource("unseeded", "missing")
            .build();
      }

      @Override
      public void compute(ComputeContext context, Messages messages) {
        context.voteToHalt();
      }
    };
    PregelResult result = pregel(graph, config(Partitioning.RANGE),
        computation).run();
    for (long nodeId = 0; nodeId < 3; ++nodeId) {
      assertEquals(10 * (nodeId + 1),
          result.getNodeValues().longValue("seeded", nodeId));
      assertEquals(0.0,
          result.getNodeValues().doubleValue("unseeded", nodeId), 0);
    }
  }

  @Test
  public void testAsynchronousDeliveryInSameSuperstep() {
    final AtomicLong seen = new AtomicLong(-1);
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        if (context.superstep() != 1) {
          return;
        }
        if (context.nodeId() == 0) {
          context.sendTo(1, 7.0);
        } else if (!messages.isEmpty()) {
          seen.set((long) messages.iterator().nextDouble());
        }
      }
    };
    PregelConfig config = PregelConfig.builder()
        .concurrency(1)
        .maxIterations(2)
        .asynchronous(true)
        .build();
    pregel(ArrayGraph.builder(2).build(), config, computation).run();
    assertEquals(7, seen.get());
  }

  @Test
  public void testSenderTrackedWithReducer() {
    final AtomicLong sender = new AtomicLong(-1);
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        if (context.isInitialSuperstep() && context.nodeId() < 2) {
          context.sendTo(2, context.nodeId() == 0 ? 5.0 : 3.0);
        }
        OptionalLong from = messages.sender();
        if (context.nodeId() == 2 && from.isPresent()) {
          sender.set(from.getAsLong());
        }
        context.voteToHalt();
      }

      @Override
      public Optional<MessageReducer> reducer() {
        return Optional.of(ReducerType.MIN.newReducer());
      }
    };
    // one thread, so the sender of the kept message is deterministic
    PregelConfig config = PregelConfig.builder()
        .concurrency(1)
        .trackSender(true)
        .build();
    PregelResult result = pregel(ArrayGraph.builder(3).build(), config,
        computation).run();
    assertTrue(result.didConverge());
    assertEquals(1, sender.get());
  }

  @Test
  public void testRunsOnlyOnce() {
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        context.voteToHalt();
      }
    };
    Pregel pregel = pregel(ArrayGraph.builder(1).build(),
        config(Partitioning.RANGE), computation);
    pregel.run();
    try {
      pregel.run();
      fail();
    } catch (IllegalStateException e) {
      assertEquals(ExecutionState.CONVERGED, pregel.getState());
    }
  }

  @Test
  public void testWeightedSendToNeighbors() {
    ArrayGraph graph = ArrayGraph.builder(3)
        .addRelationship(0, 1, 2.0)
        .addRelationship(0, 2, 0.5)
        .build();
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        if (context.isInitialSuperstep() && context.nodeId() == 0) {
          context.sendToNeighbors(10.0);
        }
        DoubleIterator iterator = messages.iterator();
        while (iterator.hasNext()) {
          context.setNodeValue("value", iterator.nextDouble());
        }
        context.voteToHalt();
      }

      @Override
      public double applyRelationshipWeight(double nodeValue,
          double relationshipWeight) {
        return nodeValue * relationshipWeight;
      }
    };
    PregelResult result = pregel(graph, config(Partitioning.DEGREE),
        computation).run();
    assertEquals(20.0, result.getNodeValues().doubleValue("value", 1), 0);
    assertEquals(5.0, result.getNodeValues().doubleValue("value", 2), 0);
  }

  @Test
  public void testDistinctNeighbors() {
    ArrayGraph graph = ArrayGraph.builder(3)
        .addRelationship(0, 1)
        .addRelationship(0, 1)
        .addRelationship(0, 2)
        .build();
    final LongArrayList all = new LongArrayList();
    final LongArrayList distinct = new LongArrayList();
    PregelComputation computation = new DoubleValueComputation() {
      @Override
      public void compute(ComputeContext context, Messages messages) {
        if (context.nodeId() == 0) {
          context.forEachNeighbor(all::add);
          context.forEachDistinctNeighbor(distinct::add);
        }
        context.voteToHalt();
      }
    };
    pregel(graph, config(Partitioning.RANGE), computation).run();
    assertArrayEquals(new long[] {1, 1, 2}, all.toLongArray());
    assertArrayEquals(new long[] {1, 2}, distinct.toLongArray());
  }
}
