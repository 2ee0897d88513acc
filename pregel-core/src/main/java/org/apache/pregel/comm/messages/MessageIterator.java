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

import it.unimi.dsi.fastutil.doubles.DoubleIterator;

import java.util.OptionalLong;

/**
 * Restartable iterator over the messages addressed to one vertex. An
 * instance is reused for many vertices by re-initializing it through
 * {@link Messenger#initMessageIterator}.
 */
public interface MessageIterator extends DoubleIterator {
  /**
   * @return True if there are no messages, independent of the position
   */
  boolean isEmpty();

  /**
   * Restart iteration from the first message.
   */
  void reset();

  /**
   * Sender of the message, when tracked.
   *
   * @return Sender id or empty
   */
  default OptionalLong sender() {
    return OptionalLong.empty();
  }
}
