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

import it.unimi.dsi.fastutil.doubles.DoubleIterable;
import it.unimi.dsi.fastutil.doubles.DoubleIterator;

import java.util.NoSuchElementException;
import java.util.OptionalLong;

import com.google.common.base.Preconditions;

/**
 * Messages delivered to a vertex in the current superstep.
 */
public class Messages implements DoubleIterable {
  /** No messages at all, used before any messenger traffic exists */
  public static final Messages EMPTY = new Messages(new EmptyIterator());

  /** Backing iterator */
  private final MessageIterator iterator;

  /**
   * Constructor
   *
   * @param iterator Backing iterator
   */
  public Messages(MessageIterator iterator) {
    this.iterator = Preconditions.checkNotNull(iterator);
  }

  /**
   * @return The shared empty instance
   */
  public static Messages empty() {
    return EMPTY;
  }

  /**
   * @return True if no message was delivered
   */
  public boolean isEmpty() {
    return iterator.isEmpty();
  }

  /**
   * Iterate the messages from the start. Every call restarts the single
   * backing iterator, so only one iteration may be in progress at a time.
   *
   * @return Iterator
   */
  @Override
  public DoubleIterator iterator() {
    iterator.reset();
    return iterator;
  }

  /**
   * @return Same as {@link #iterator()}
   */
  public MessageIterator doubleIterator() {
    iterator.reset();
    return iterator;
  }

  /**
   * @return Sender of the message if the messenger tracks senders
   */
  public OptionalLong sender() {
    return iterator.sender();
  }

  /**
   * Iterator without elements.
   */
  private static final class EmptyIterator implements MessageIterator {
    @Override
    public boolean isEmpty() {
      return true;
    }

    @Override
    public void reset() {
    }

    @Override
    public boolean hasNext() {
      return false;
    }

    @Override
    public double nextDouble() {
      throw new NoSuchElementException("nextDouble: No messages");
    }
  }
}
