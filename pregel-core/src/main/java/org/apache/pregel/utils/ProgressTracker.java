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

/**
 * Receives progress of a run. Implementations must accept concurrent
 * {@link #logProgress(long)} calls.
 */
public interface ProgressTracker {
  /** Discards everything */
  ProgressTracker EMPTY = new ProgressTracker() {
    @Override
    public void beginTask(String taskName, long volume) {
    }

    @Override
    public void logProgress(long progress) {
    }

    @Override
    public void endTask() {
    }
  };

  /**
   * Start a task.
   *
   * @param taskName Name shown in logs
   * @param volume Total units of work
   */
  void beginTask(String taskName, long volume);

  /**
   * Report finished units of work.
   *
   * @param progress Units finished since the last call
   */
  void logProgress(long progress);

  /**
   * Finish the current task.
   */
  void endTask();
}
