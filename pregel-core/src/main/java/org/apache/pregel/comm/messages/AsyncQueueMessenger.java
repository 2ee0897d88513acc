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

import org.apache.pregel.comm.messages.queue.AsyncDoubleQueues;

import com.google.common.base.Preconditions;

/**
 * Messenger for asynchronous runs. A message is readable as soon as it is
 * sent, so a vertex computed later in the same superstep may already see
 * it. Reading removes the messages from the queue.
 */
public class AsyncQueueMessenger
    implements Messenger<AsyncQueueMessenger.Iterator> {
  /** Single generation queues */
  private final AsyncDoubleQueues queues;
  /** Set once released */
  private volatile boolean released;

  /**
   * Constructor
   *
   * @param nodeCount Number of vertices
   */
  public AsyncQueueMessenger(long nodeCount) {
    this.queues = new AsyncDoubleQueues(nodeCount);
  }

  @Override
  public void initIteration(int iteration) {
    checkNotReleased("initIteration");
    if (iteration > 0) {
      queues.compact();
    }
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
    messageIterator.buffer.clear();
    messageIterator.position = 0;
    if (!isFirstIteration) {
      queues.drainTo(nodeId, messageIterator.buffer);
    }
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
   * Iterator over the messages drained for one vertex.
   */
  public static final class Iterator implements MessageIterator {
    /** Drained messages */
    private final DoubleArrayList buffer = new DoubleArrayList();
    /** Read position */
    private int position;

    @Override
    public boolean isEmpty() {
      return buffer.isEmpty();
    }

    @Override
    public void reset() {
      position = 0;
    }

    @Override
    public boolean hasNext() {
      return position < buffer.size();
    }

    @Override
    public double nextDouble() {
      if (!hasNext()) {
        throw new NoSuchElementException("nextDouble: No more messages");
      }
      return buffer.getDouble(position++);
    }
  }
}
