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

import java.util.Optional;

import org.apache.log4j.Logger;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.reducers.MessageReducer;

/**
 * Picks the messenger for a run.
 */
public class MessengerFactory {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(MessengerFactory.class);

  /** Do not instantiate */
  private MessengerFactory() {
  }

  /**
   * Create the messenger matching the configuration. A reducer always wins,
   * otherwise the asynchronous flag decides between the two queue based
   * messengers.
   *
   * @param config Run configuration
   * @param nodeCount Number of vertices
   * @param reducer Optional reducer
   * @return New messenger
   */
  public static Messenger<?> create(PregelConfig config, long nodeCount,
      Optional<MessageReducer> reducer) {
    Messenger<?> messenger;
    if (reducer.isPresent()) {
      messenger = new ReducingMessenger(nodeCount, reducer.get(),
          config.trackSender());
    } else if (config.isAsynchronous()) {
      messenger = new AsyncQueueMessenger(nodeCount);
    } else {
      messenger = new SyncQueueMessenger(nodeCount);
    }
    if (config.trackSender() && !reducer.isPresent() &&
        LOG.isInfoEnabled()) {
      LOG.info("create: Sender tracking needs a reducer, ignored for " +
          messenger.getClass().getSimpleName());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("create: Using " + messenger.getClass().getSimpleName() +
          " for " + nodeCount + " vertices");
    }
    return messenger;
  }
}
