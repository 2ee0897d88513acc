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
package org.apache.pregel.conf;

import org.apache.hadoop.conf.Configuration;

/**
 * Adds user methods specific to the engine. This keeps the configuration
 * in one place and only exposes typed access to the options in
 * {@link PregelConstants}.
 */
public class PregelConfiguration extends Configuration
    implements PregelConstants {
  /**
   * Constructor that creates the configuration without loading the
   * Hadoop default resources.
   */
  public PregelConfiguration() {
    super(false);
  }

  /**
   * Constructor.
   *
   * @param conf Configuration to copy
   */
  public PregelConfiguration(Configuration conf) {
    super(conf);
  }

  public final int getConcurrency() {
    return CONCURRENCY.get(this);
  }

  /**
   * Set the number of compute threads.
   *
   * @param concurrency Number of threads
   */
  public final void setConcurrency(int concurrency) {
    CONCURRENCY.set(this, concurrency);
  }

  public final int getMaxIterations() {
    return MAX_ITERATIONS.get(this);
  }

  /**
   * Set the maximum number of supersteps.
   *
   * @param maxIterations Maximum supersteps
   */
  public final void setMaxIterations(int maxIterations) {
    MAX_ITERATIONS.set(this, maxIterations);
  }

  /**
   * Was a tolerance configured at all?
   *
   * @return True if a tolerance is set
   */
  public final boolean hasTolerance() {
    return TOLERANCE.contains(this);
  }

  public final double getTolerance() {
    return TOLERANCE.get(this);
  }

  /**
   * Set the convergence delta handed to the computation.
   *
   * @param tolerance Tolerance
   */
  public final void setTolerance(double tolerance) {
    TOLERANCE.set(this, tolerance);
  }

  public final boolean isAsynchronous() {
    return IS_ASYNCHRONOUS.get(this);
  }

  /**
   * Deliver messages as soon as they are sent.
   *
   * @param asynchronous True for asynchronous delivery
   */
  public final void setAsynchronous(boolean asynchronous) {
    IS_ASYNCHRONOUS.set(this, asynchronous);
  }

  public final Partitioning getPartitioning() {
    return PARTITIONING.get(this);
  }

  /**
   * Set the partitioning policy.
   *
   * @param partitioning Partitioning
   */
  public final void setPartitioning(Partitioning partitioning) {
    PARTITIONING.set(this, partitioning);
  }

  public final boolean trackSender() {
    return TRACK_SENDER.get(this);
  }

  /**
   * Track the sender of reduced messages.
   *
   * @param trackSender True to track senders
   */
  public final void setTrackSender(boolean trackSender) {
    TRACK_SENDER.set(this, trackSender);
  }

  /**
   * Should the metrics registry report over JMX?
   *
   * @return True if metrics are enabled
   */
  public final boolean metricsEnabled() {
    return METRICS_ENABLE.isTrue(this);
  }

  /**
   * Enable or disable metrics.
   *
   * @param enable True to enable
   */
  public final void setMetricsEnabled(boolean enable) {
    METRICS_ENABLE.set(this, enable);
  }

  public final int getProgressLogIntervalMsecs() {
    return PROGRESS_LOG_INTERVAL_MSECS.get(this);
  }
}
