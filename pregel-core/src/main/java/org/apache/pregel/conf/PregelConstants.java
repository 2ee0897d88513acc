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

/**
 * Constants used all over the engine for configuration.
 */
// CHECKSTYLE: stop InterfaceIsTypeCheck
public interface PregelConstants {
  /** Default number of compute threads */
  int DEFAULT_CONCURRENCY = 4;

  /** Number of threads computing vertices in a superstep */
  IntConfOption CONCURRENCY =
      new IntConfOption("pregel.concurrency", DEFAULT_CONCURRENCY,
          "Number of threads computing vertices in a superstep");

  /** Maximum number of supersteps before the run is stopped */
  IntConfOption MAX_ITERATIONS =
      new IntConfOption("pregel.maxIterations", 20,
          "Maximum number of supersteps before the run is stopped");

  /**
   * Convergence delta. Interpreted by the computation, never by the engine.
   * Unset by default.
   */
  DoubleConfOption TOLERANCE =
      new DoubleConfOption("pregel.tolerance", 0.0,
          "Convergence delta consumed by the computation (optional)");

  /** Whether messages may be observed in the superstep they were sent */
  BooleanConfOption IS_ASYNCHRONOUS =
      new BooleanConfOption("pregel.isAsynchronous", false,
          "Whether messages may be observed in the superstep they were sent");

  /** How vertices are split into units of work */
  EnumConfOption<Partitioning> PARTITIONING =
      EnumConfOption.create("pregel.partitioning", Partitioning.class,
          Partitioning.RANGE, "How vertices are split into units of work");

  /** Whether the sender of a reduced message is tracked */
  BooleanConfOption TRACK_SENDER =
      new BooleanConfOption("pregel.trackSender", false,
          "Whether the sender of a reduced message is tracked");

  /** Enable the metrics registry and report over JMX */
  BooleanConfOption METRICS_ENABLE =
      new BooleanConfOption("pregel.metrics.enable", false,
          "Enable the metrics registry and report over JMX");

  /** Minimum interval between two progress log lines */
  IntConfOption PROGRESS_LOG_INTERVAL_MSECS =
      new IntConfOption("pregel.progressLogIntervalMsecs", 30 * 1000,
          "Minimum interval between two progress log lines in msecs");
}
