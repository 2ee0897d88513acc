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
package org.apache.pregel.comm.messages;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.util.NoSuchElementException;

import org.apache.pregel.comm.messages.queue.SyncDoubleQueues;

import com.google.common.base.Preconditions;

/**
 * Messenger keeping every message. Messages sent in superstep k are
 * delivered in superstep k + 1.
 */
public class SyncQueueMessenger
    implements Messenger<SyncQueueMessenger.Iterator> {
  /** Double-buffered queues */
  private final SyncDoubleQueues queues;
  /** Set once released */
  private volatile boolean released;

  /**
   * Constructor
   *
   * @param nodeCount Number of vertices
   */
  public SyncQueueMessenger(long nodeCount) {
    this.queues = new SyncDoubleQueues(nodeCount);
  }

  @Override
  public void initIteration(int iteration) {
    checkNotReleased("initIteration");
    queues.swap();
  }

  @Override
  public void sendTo(long sourceNodeId, long targetNodeId, double message) {
    checkNotReleased("sendTo");
    queues.push(targetNodeId, message);
  }

  @Override
  public Iterator messageIterator() {
    checkNotReleased("messageIterator");
    return new Iterator();
  }

  @Override
  public void initMessageIterator(Iterator messageIterator, long nodeId,
      boolean isFirstIteration) {
    checkNotReleased("initMessageIterator");
    messageIterator.init(isFirstIteration ? null : queues.queue(nodeId));
  }

  @Override
  public void release() {
    released = true;
    queues.release();
  }

  /**
   * Fail if {@link #release()} was called.
   *
   * @param method Calling method
   */
  private void checkNotReleased(String method) {
    Preconditions.checkState(!released, "%s: Messenger already released",
        method);
  }

  /**
   * Iterator over one vertex queue of the current generation.
   */
  public static final class Iterator implements MessageIterator {
    /** Queue or null */
    private DoubleArrayList queue;
    /** Read position */
    private int position;

    /**
     * Point at a queue.
     *
     * @param queue Queue or null
     */
    void init(DoubleArrayList queue) {
      this.queue = queue;
      this.position = 0;
    }

    @Override
    public boolean isEmpty() {
      return queue == null;
    }

    @Override
    public void reset() {
      position = 0;
    }

    @Override
    public boolean hasNext() {
      return queue != null && position < queue.size();
    }

    @Override
    public double nextDouble() {
      if (!hasNext()) {
        throw new NoSuchElementException("nextDouble: No more messages");
      }
      return queue.getDouble(position++);
    }
  }
}
