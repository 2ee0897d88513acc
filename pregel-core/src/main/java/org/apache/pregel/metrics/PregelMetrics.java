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
package org.apache.pregel.metrics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

import com.yammer.metrics.core.Counter;
import com.yammer.metrics.core.MetricName;
import com.yammer.metrics.core.MetricsRegistry;
import com.yammer.metrics.core.Timer;
import com.yammer.metrics.core.TimerContext;
import com.yammer.metrics.reporting.JmxReporter;

/**
 * Metrics of one run. Counters are always maintained, JMX reporting and
 * the closing summary only when metrics are enabled.
 */
public class PregelMetrics {
  /** Metric group */
  public static final String GROUP = "pregel";
  /** Counter of sent messages */
  public static final String MESSAGES_SENT = "messages-sent";
  /** Counter of Compute invocations */
  public static final String VERTICES_COMPUTED = "vertices-computed";
  /** Timer of whole supersteps */
  public static final String SUPERSTEP_TIME_MS = "superstep-time-ms";

  /** Class logger */
  private static final Logger LOG = Logger.getLogger(PregelMetrics.class);
  /** Distinguishes runs within one JVM */
  private static final AtomicInteger RUN_ID = new AtomicInteger();

  /** Registry */
  private final MetricsRegistry registry;
  /** JMX reporter or null */
  private final JmxReporter jmxReporter;
  /** Messages sent */
  private final Counter messagesSent;
  /** Compute invocations */
  private final Counter verticesComputed;
  /** Superstep durations */
  private final Timer superstepTimer;

  /**
   * Constructor
   *
   * @param enabled Whether to report to JMX and log a summary
   */
  public PregelMetrics(boolean enabled) {
    String type = "run-" + RUN_ID.getAndIncrement();
    registry = new MetricsRegistry();
    messagesSent = registry.newCounter(
        new MetricName(GROUP, type, MESSAGES_SENT));
    verticesComputed = registry.newCounter(
        new MetricName(GROUP, type, VERTICES_COMPUTED));
    superstepTimer = registry.newTimer(
        new MetricName(GROUP, type, SUPERSTEP_TIME_MS),
        TimeUnit.MILLISECONDS, TimeUnit.SECONDS);
    if (enabled) {
      jmxReporter = new JmxReporter(registry);
      jmxReporter.start();
    } else {
      jmxReporter = null;
    }
  }

  /**
   * @param count Messages sent by one batch
   */
  public void incrMessagesSent(long count) {
    if (count > 0) {
      messagesSent.inc(count);
    }
  }

  /**
   * @param count Compute invocations of one batch
   */
  public void incrVerticesComputed(long count) {
    if (count > 0) {
      verticesComputed.inc(count);
    }
  }

  /**
   * Start timing a superstep.
   *
   * @return Context to stop
   */
  public TimerContext timeSuperstep() {
    return superstepTimer.time();
  }

  public long getMessagesSent() {
    return messagesSent.count();
  }

  public long getVerticesComputed() {
    return verticesComputed.count();
  }

  public long getSuperstepCount() {
    return superstepTimer.count();
  }

  /**
   * Log a summary if enabled and stop reporting.
   */
  public void shutdown() {
    if (jmxReporter != null) {
      if (LOG.isInfoEnabled()) {
        LOG.info("shutdown: " + superstepTimer.count() + " supersteps, " +
            "mean " + String.format("%.2f", superstepTimer.mean()) + " ms, " +
            "max " + String.format("%.2f", superstepTimer.max()) + " ms, " +
            messagesSent.count() + " messages sent, " +
            verticesComputed.count() + " vertices computed");
      }
      jmxReporter.shutdown();
    }
    registry.shutdown();
  }
}
