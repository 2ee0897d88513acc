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

import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

/**
 * Print log messages only if the interval since the last printed message
 * has passed. When many threads race, exactly one of them prints.
 */
public class TimedLogger {
  /** Time of the last printed message */
  private final AtomicLong lastPrint;
  /** Minimum interval between two messages */
  private final long msecs;
  /** Logger */
  private final Logger log;

  /**
   * Constructor
   *
   * @param msecs Minimum msecs between two messages, 0 prints everything
   * @param log Logger to print to
   */
  public TimedLogger(long msecs, Logger log) {
    this.msecs = msecs;
    this.log = log;
    this.lastPrint = new AtomicLong(System.currentTimeMillis() - msecs);
  }

  /**
   * Print at info level if the interval has passed.
   *
   * @param msg Message to print
   */
  public void info(String msg) {
    if (log.isInfoEnabled() && isPrintable()) {
      log.info(msg);
    }
  }

  /**
   * Claim the right to print.
   *
   * @return True if the caller may print now
   */
  public boolean isPrintable() {
    long now = System.currentTimeMillis();
    long last = lastPrint.get();
    return now - last >= msecs && lastPrint.compareAndSet(last, now);
  }
}
