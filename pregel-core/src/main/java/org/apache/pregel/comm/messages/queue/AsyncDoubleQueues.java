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
 * Single generation of per-vertex message queues. Messages are readable as
 * soon as they are pushed and are removed when popped. Popped slots are
 * reclaimed by {@link #compact()}.
 */
@ThreadSafe
public class AsyncDoubleQueues {
  /** Share of popped slots above which a queue is compacted */
  public static final double COMPACT_THRESHOLD = 0.25;
  /** Number of lock stripes, a power of two */
  private static final int LOCK_STRIPES = 1024;

  /** Queue per vertex, created on first push */
  private DoubleArrayList[] queues;
  /** Index of the first unread message per vertex */
  private int[] heads;
  /** Stripe locks guarding queues and heads */
  private final Object[] locks;

  /**
   * Constructor
   *
   * @param nodeCount Number of vertices
   */
  public AsyncDoubleQueues(long nodeCount) {
    Preconditions.checkArgument(nodeCount >= 0 &&
        nodeCount < Integer.MAX_VALUE, "AsyncDoubleQueues: Invalid node " +
        "count %s", nodeCount);
    queues = new DoubleArrayList[(int) nodeCount];
    heads = new int[(int) nodeCount];
    locks = new Object[LOCK_STRIPES];
    for (int i = 0; i < LOCK_STRIPES; ++i) {
      locks[i] = new Object();
    }
  }

  /**
   * Append a message.
   *
   * @param nodeId Receiver
   * @param message Message, must not be NaN
   */
  public void push(long nodeId, double message) {
    Preconditions.checkArgument(!Double.isNaN(message),
        "push: NaN is not a valid message (target %s)", nodeId);
    int id = (int) nodeId;
    synchronized (locks[id & (LOCK_STRIPES - 1)]) {
      DoubleArrayList queue = queues[id];
      if (queue == null) {
        queue = new DoubleArrayList();
        queues[id] = queue;
      }
      queue.add(message);
    }
  }

  /**
   * Move every unread message of a vertex into a buffer.
   *
   * @param nodeId Receiver
   * @param buffer Destination, not cleared
   * @return Number of messages moved
   */
  public int drainTo(long nodeId, DoubleArrayList buffer) {
    int id = (int) nodeId;
    synchronized (locks[id & (LOCK_STRIPES - 1)]) {
      DoubleArrayList queue = queues[id];
      if (queue == null) {
        return 0;
      }
      int head = heads[id];
      int size = queue.size();
      for (int i = head; i < size; ++i) {
        buffer.add(queue.getDouble(i));
      }
      heads[id] = size;
      return size - head;
    }
  }

  /**
   * Reclaim popped slots. Must not overlap with pushes or drains.
   */
  public void compact() {
    for (int id = 0; id < queues.length; ++id) {
      DoubleArrayList queue = queues[id];
      if (queue == null || heads[id] == 0) {
        continue;
      }
      int head = heads[id];
      if (head == queue.size()) {
        queue.clear();
        heads[id] = 0;
      } else if (head > queue.size() * COMPACT_THRESHOLD) {
        queue.removeElements(0, head);
        heads[id] = 0;
      }
    }
  }

  /**
   * Number of unread messages of a vertex.
   *
   * @param nodeId Receiver
   * @return Unread messages
   */
  public int size(long nodeId) {
    int id = (int) nodeId;
    synchronized (locks[id & (LOCK_STRIPES - 1)]) {
      DoubleArrayList queue = queues[id];
      return queue == null ? 0 : queue.size() - heads[id];
    }
  }

  /**
   * Drop all queues.
   */
  public void release() {
    queues = null;
    heads = null;
  }
}
