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
 * Progress tracker writing a percentage to the log, rate limited by a
 * {@link TimedLogger}.
 */
public class LoggingProgressTracker implements ProgressTracker {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(LoggingProgressTracker.class);

  /** Rate limited logger */
  private final TimedLogger timedLogger;
  /** Units finished in the current task */
  private final AtomicLong progress = new AtomicLong();
  /** Name of the current task */
  private volatile String taskName = "";
  /** Volume of the current task */
  private volatile long volume;
  /** Start of the current task */
  private volatile long startMsecs;

  /**
   * Constructor
   *
   * @param logIntervalMsecs Minimum msecs between two progress lines
   */
  public LoggingProgressTracker(long logIntervalMsecs) {
    this.timedLogger = new TimedLogger(logIntervalMsecs, LOG);
  }

  @Override
  public void beginTask(String taskName, long volume) {
    this.taskName = taskName;
    this.volume = volume;
    this.progress.set(0);
    this.startMsecs = System.currentTimeMillis();
    if (LOG.isDebugEnabled()) {
      LOG.debug("beginTask: " + taskName + " with volume " + volume);
    }
  }

  @Override
  public void logProgress(long delta) {
    long done = progress.addAndGet(delta);
    if (volume > 0 && timedLogger.isPrintable() && LOG.isInfoEnabled()) {
      LOG.info("logProgress: " + taskName + " " +
          Math.min(100, done * 100 / volume) + "% (" + done + "/" + volume +
          ")");
    }
  }

  @Override
  public void endTask() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("endTask: " + taskName + " finished " + progress.get() +
          " units in " + (System.currentTimeMillis() - startMsecs) + " ms");
    }
  }

  /**
   * @return Units finished in the current task
   */
  public long getProgress() {
    return progress.get();
  }
}
