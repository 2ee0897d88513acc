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

import java.util.OptionalLong;

/**
 * Moves messages between vertices across supersteps.
 *
 * @param <I> Message iterator type handed to compute steps
 */
public interface Messenger<I extends MessageIterator> {
  /**
   * Prepare a superstep. Called exactly once per superstep, before any
   * {@link #sendTo} of that superstep.
   *
   * @param iteration Superstep about to start
   */
  void initIteration(int iteration);

  /**
   * Send a message. Safe to call from many threads, never blocks for
   * longer than a single append.
   *
   * @param sourceNodeId Sender
   * @param targetNodeId Receiver
   * @param message Message value
   */
  void sendTo(long sourceNodeId, long targetNodeId, double message);

  /**
   * Create an iterator for one compute thread.
   *
   * @return Fresh iterator
   */
  I messageIterator();

  /**
   * Point an iterator at the messages of a vertex.
   *
   * @param messageIterator Iterator obtained from {@link #messageIterator()}
   * @param nodeId Vertex id
   * @param isFirstIteration True during superstep 0, the iterator is then
   *                         empty
   */
  void initMessageIterator(I messageIterator, long nodeId,
      boolean isFirstIteration);

  /**
   * Sender of the message delivered to a vertex.
   *
   * @param nodeId Vertex id
   * @return Sender, empty unless sender tracking is enabled
   */
  default OptionalLong sender(long nodeId) {
    return OptionalLong.empty();
  }

  /**
   * Drop all buffered messages. The messenger is unusable afterwards.
   */
  void release();
}
