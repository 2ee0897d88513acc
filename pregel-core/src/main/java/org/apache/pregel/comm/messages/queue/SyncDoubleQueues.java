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
package org.apache.pregel.comm.messages.queue;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;

/**
 * Two generations of per-vertex message queues. Appends go to the next
 * generation under a striped lock, reads come from the current generation
 * without locking. {@link #swap()} must not overlap with appends or reads.
 */
@ThreadSafe
public class SyncDoubleQueues {
  /** Number of lock stripes, a power of two */
  private static final int LOCK_STRIPES = 1024;

  /** Queues read in the current superstep */
  private DoubleArrayList[] currentQueues;
  /** Queues written in the current superstep */
  private DoubleArrayList[] nextQueues;
  /** Stripe locks guarding nextQueues */
  private final Object[] locks;

  /**
   * Constructor
   *
   * @param nodeCount Number of vertices
   */
  public SyncDoubleQueues(long nodeCount) {
    Preconditions.checkArgument(nodeCount >= 0 &&
        nodeCount < Integer.MAX_VALUE, "SyncDoubleQueues: Invalid node " +
        "count %s", nodeCount);
    currentQueues = new DoubleArrayList[(int) nodeCount];
    nextQueues = new DoubleArrayList[(int) nodeCount];
    locks = new Object[LOCK_STRIPES];
    for (int i = 0; i < LOCK_STRIPES; ++i) {
      locks[i] = new Object();
    }
  }

  /**
   * Append a message for the next superstep.
   *
   * @param nodeId Receiver
   * @param message Message
   */
  public void push(long nodeId, double message) {
    int id = (int) nodeId;
    synchronized (locks[id & (LOCK_STRIPES - 1)]) {
      DoubleArrayList queue = nextQueues[id];
      if (queue == null) {
        queue = new DoubleArrayList();
        nextQueues[id] = queue;
      }
      queue.add(message);
    }
  }

  /**
   * Messages of a vertex in the current generation.
   *
   * @param nodeId Receiver
   * @return Queue, or null if empty
   */
  public DoubleArrayList queue(long nodeId) {
    DoubleArrayList queue = currentQueues[(int) nodeId];
    return queue == null || queue.isEmpty() ? null : queue;
  }

  /**
   * Make the next generation current and empty the new next generation.
   * Queue instances are recycled.
   */
  public void swap() {
    DoubleArrayList[] tmp = currentQueues;
    currentQueues = nextQueues;
    nextQueues = tmp;
    for (DoubleArrayList queue : nextQueues) {
      if (queue != null) {
        queue.clear();
      }
    }
  }

  /**
   * Drop both generations.
   */
  public void release() {
    currentQueues = null;
    nextQueues = null;
  }
}
