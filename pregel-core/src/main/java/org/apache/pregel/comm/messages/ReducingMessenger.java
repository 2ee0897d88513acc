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

import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLongArray;

import org.apache.pregel.reducers.MessageReducer;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.AtomicDoubleArray;

/**
 * Messenger folding all messages to a vertex into one value with a
 * {@link MessageReducer}. Folding is lock-free unless senders are tracked,
 * then the fold and its sender are updated together under a striped lock.
 * A vertex has a message iff its folded value differs from the reducer
 * identity.
 */
public class ReducingMessenger
    implements Messenger<ReducingMessenger.Iterator> {
  /** Marker for "no sender recorded" */
  private static final long NO_SENDER = -1;
  /** Number of lock stripes when tracking senders, a power of two */
  private static final int LOCK_STRIPES = 1024;

  /** Reducer */
  private final MessageReducer reducer;
  /** Reducer identity */
  private final double identity;
  /** Number of vertices */
  private final int nodeCount;
  /** Values folded in the current superstep */
  private AtomicDoubleArray sendArray;
  /** Values read in the current superstep */
  private AtomicDoubleArray receiveArray;
  /** Senders recorded in the current superstep, or null */
  private AtomicLongArray sendSenders;
  /** Senders read in the current superstep, or null */
  private AtomicLongArray receiveSenders;
  /** Stripe locks pairing a fold with its sender, or null */
  private final Object[] locks;
  /** Set once released */
  private volatile boolean released;

  /**
   * Constructor
   *
   * @param nodeCount Number of vertices
   * @param reducer Reducer
   * @param trackSender Whether to record the sender of the kept message
   */
  public ReducingMessenger(long nodeCount, MessageReducer reducer,
      boolean trackSender) {
    Preconditions.checkArgument(nodeCount >= 0 &&
        nodeCount < Integer.MAX_VALUE, "ReducingMessenger: Invalid node " +
        "count %s", nodeCount);
    this.reducer = Preconditions.checkNotNull(reducer);
    this.identity = reducer.identity();
    Preconditions.checkArgument(!Double.isNaN(identity),
        "ReducingMessenger: Reducer %s has a NaN identity", reducer);
    this.nodeCount = (int) nodeCount;
    this.sendArray = newValueArray();
    this.receiveArray = newValueArray();
    if (trackSender) {
      this.sendSenders = newSenderArray();
      this.receiveSenders = newSenderArray();
      this.locks = new Object[LOCK_STRIPES];
      for (int i = 0; i < LOCK_STRIPES; ++i) {
        locks[i] = new Object();
      }
    } else {
      this.locks = null;
    }
  }

  /**
   * @return Array filled with the identity
   */
  private AtomicDoubleArray newValueArray() {
    AtomicDoubleArray array = new AtomicDoubleArray(nodeCount);
    fill(array);
    return array;
  }

  /**
   * @return Array filled with {@link #NO_SENDER}
   */
  private AtomicLongArray newSenderArray() {
    AtomicLongArray array = new AtomicLongArray(nodeCount);
    for (int i = 0; i < nodeCount; ++i) {
      array.set(i, NO_SENDER);
    }
    return array;
  }

  /**
   * Reset every value to the identity.
   *
   * @param array Array to reset
   */
  private void fill(AtomicDoubleArray array) {
    for (int i = 0; i < nodeCount; ++i) {
      array.set(i, identity);
    }
  }

  @Override
  public void initIteration(int iteration) {
    checkNotReleased("initIteration");
    AtomicDoubleArray tmp = receiveArray;
    receiveArray = sendArray;
    sendArray = tmp;
    fill(sendArray);
    if (sendSenders != null) {
      AtomicLongArray tmpSenders = receiveSenders;
      receiveSenders = sendSenders;
      sendSenders = tmpSenders;
      for (int i = 0; i < nodeCount; ++i) {
        sendSenders.set(i, NO_SENDER);
      }
    }
  }

  @Override
  public void sendTo(long sourceNodeId, long targetNodeId, double message) {
    checkNotReleased("sendTo");
    int target = (int) targetNodeId;
    if (locks != null) {
      synchronized (locks[target & (LOCK_STRIPES - 1)]) {
        double current = sendArray.get(target);
        double reduced = reducer.reduce(current, message);
        if (Double.doubleToRawLongBits(current) !=
            Double.doubleToRawLongBits(reduced)) {
          sendArray.set(target, reduced);
          sendSenders.set(target, sourceNodeId);
        }
      }
      return;
    }
    double current;
    double reduced;
    do {
      current = sendArray.get(target);
      reduced = reducer.reduce(current, message);
      if (Double.doubleToRawLongBits(current) ==
          Double.doubleToRawLongBits(reduced)) {
        return;
      }
    } while (!sendArray.compareAndSet(target, current, reduced));
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
    if (isFirstIteration) {
      messageIterator.init(false, 0, NO_SENDER);
      return;
    }
    int id = (int) nodeId;
    double value = receiveArray.get(id);
    long sender = receiveSenders == null ? NO_SENDER : receiveSenders.get(id);
    messageIterator.init(value != identity, value, sender);
  }

  @Override
  public OptionalLong sender(long nodeId) {
    checkNotReleased("sender");
    if (receiveSenders == null) {
      return OptionalLong.empty();
    }
    long sender = receiveSenders.get((int) nodeId);
    return sender == NO_SENDER ? OptionalLong.empty() : OptionalLong.of(sender);
  }

  @Override
  public void release() {
    released = true;
    sendArray = null;
    receiveArray = null;
    sendSenders = null;
    receiveSenders = null;
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
   * Iterator over at most one folded message.
   */
  public static final class Iterator implements MessageIterator {
    /** Whether there is a message */
    private boolean hasMessage;
    /** Folded message */
    private double message;
    /** Sender or NO_SENDER */
    private long sender;
    /** Whether the message was consumed */
    private boolean consumed;

    /**
     * Point at a folded message.
     *
     * @param hasMessage Whether there is a message
     * @param message Folded message
     * @param sender Sender or NO_SENDER
     */
    void init(boolean hasMessage, double message, long sender) {
      this.hasMessage = hasMessage;
      this.message = message;
      this.sender = sender;
      this.consumed = false;
    }

    @Override
    public boolean isEmpty() {
      return !hasMessage;
    }

    @Override
    public void reset() {
      consumed = false;
    }

    @Override
    public boolean hasNext() {
      return hasMessage && !consumed;
    }

    @Override
    public double nextDouble() {
      if (!hasNext()) {
        throw new NoSuchElementException("nextDouble: No more messages");
      }
      consumed = true;
      return message;
    }

    @Override
    public OptionalLong sender() {
      return hasMessage && sender != NO_SENDER ? OptionalLong.of(sender) :
          OptionalLong.empty();
    }
  }
}
