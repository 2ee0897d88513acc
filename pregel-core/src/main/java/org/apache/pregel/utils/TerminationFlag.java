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
package org.apache.pregel.utils;

import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;

/**
 * Cached view of a {@link TerminationMonitor}, polled by compute threads
 * at batch boundaries. The monitor is consulted at most once per interval
 * and a stop, once seen, is permanent.
 */
@ThreadSafe
public class TerminationFlag {
  /** Default interval between two monitor checks */
  public static final long DEFAULT_CHECK_INTERVAL_MSECS = 10_000;
  /** Flag that never stops */
  public static final TerminationFlag RUNNING_TRUE =
      new TerminationFlag(TerminationMonitor.EMPTY, Long.MAX_VALUE);

  /** Monitor */
  private final TerminationMonitor monitor;
  /** Interval between two monitor checks */
  private final long intervalMsecs;
  /** Time of the last check, 0 before the first one */
  private volatile long lastCheck;
  /** Cached result */
  private volatile boolean running = true;

  /**
   * Constructor
   *
   * @param monitor Monitor
   * @param intervalMsecs Interval between two checks
   */
  private TerminationFlag(TerminationMonitor monitor, long intervalMsecs) {
    this.monitor = Preconditions.checkNotNull(monitor);
    Preconditions.checkArgument(intervalMsecs >= 0,
        "TerminationFlag: Negative interval %s", intervalMsecs);
    this.intervalMsecs = intervalMsecs;
  }

  /**
   * @param monitor Monitor
   * @return Flag checking every {@link #DEFAULT_CHECK_INTERVAL_MSECS}
   */
  public static TerminationFlag wrap(TerminationMonitor monitor) {
    return new TerminationFlag(monitor, DEFAULT_CHECK_INTERVAL_MSECS);
  }

  /**
   * @param monitor Monitor
   * @param intervalMsecs Interval between two checks, 0 checks every time
   * @return Flag
   */
  public static TerminationFlag wrap(TerminationMonitor monitor,
      long intervalMsecs) {
    return new TerminationFlag(monitor, intervalMsecs);
  }

  /**
   * @return False once a stop was requested
   */
  public boolean running() {
    if (!running) {
      return false;
    }
    long now = System.currentTimeMillis();
    if (lastCheck == 0 || now - lastCheck >= intervalMsecs) {
      lastCheck = now;
      if (monitor.isTerminated()) {
        running = false;
      }
    }
    return running;
  }
}
