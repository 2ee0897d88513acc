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

import java.util.OptionalDouble;

import javax.annotation.concurrent.Immutable;

import org.apache.hadoop.conf.Configuration;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Validated, immutable snapshot of the options a run is started with.
 * Invalid values are rejected when the snapshot is built, so a run never
 * starts with a broken configuration.
 */
@Immutable
public final class PregelConfig {
  /** Number of compute threads */
  private final int concurrency;
  /** Maximum number of supersteps */
  private final int maxIterations;
  /** Optional convergence delta */
  private final OptionalDouble tolerance;
  /** Asynchronous message delivery */
  private final boolean asynchronous;
  /** Partitioning policy */
  private final Partitioning partitioning;
  /** Track senders of reduced messages */
  private final boolean trackSender;
  /** Metrics over JMX */
  private final boolean metricsEnabled;
  /** Minimum msecs between two progress log lines */
  private final int progressLogIntervalMsecs;

  /**
   * Constructor
   *
   * @param builder Validated builder
   */
  private PregelConfig(Builder builder) {
    this.concurrency = builder.concurrency;
    this.maxIterations = builder.maxIterations;
    this.tolerance = builder.tolerance;
    this.asynchronous = builder.asynchronous;
    this.partitioning = builder.partitioning;
    this.trackSender = builder.trackSender;
    this.metricsEnabled = builder.metricsEnabled;
    this.progressLogIntervalMsecs = builder.progressLogIntervalMsecs;
  }

  /**
   * Create a builder initialized with the defaults.
   *
   * @return Builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read and validate all options from a Hadoop configuration.
   *
   * @param conf Configuration
   * @return Validated snapshot
   */
  public static PregelConfig fromConfiguration(Configuration conf) {
    Builder builder = builder()
        .concurrency(PregelConstants.CONCURRENCY.get(conf))
        .maxIterations(PregelConstants.MAX_ITERATIONS.get(conf))
        .asynchronous(PregelConstants.IS_ASYNCHRONOUS.get(conf))
        .partitioning(PregelConstants.PARTITIONING.get(conf))
        .trackSender(PregelConstants.TRACK_SENDER.get(conf))
        .metricsEnabled(PregelConstants.METRICS_ENABLE.get(conf))
        .progressLogIntervalMsecs(
            PregelConstants.PROGRESS_LOG_INTERVAL_MSECS.get(conf));
    if (PregelConstants.TOLERANCE.contains(conf)) {
      builder.tolerance(PregelConstants.TOLERANCE.get(conf));
    }
    return builder.build();
  }

  /**
   * Write this snapshot back into a configuration.
   *
   * @return New configuration holding every option
   */
  public PregelConfiguration toConfiguration() {
    PregelConfiguration conf = new PregelConfiguration();
    conf.setConcurrency(concurrency);
    conf.setMaxIterations(maxIterations);
    if (tolerance.isPresent()) {
      conf.setTolerance(tolerance.getAsDouble());
    }
    conf.setAsynchronous(asynchronous);
    conf.setPartitioning(partitioning);
    conf.setTrackSender(trackSender);
    conf.setMetricsEnabled(metricsEnabled);
    PregelConstants.PROGRESS_LOG_INTERVAL_MSECS.set(conf,
        progressLogIntervalMsecs);
    return conf;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public OptionalDouble getTolerance() {
    return tolerance;
  }

  public boolean isAsynchronous() {
    return asynchronous;
  }

  public Partitioning getPartitioning() {
    return partitioning;
  }

  /**
   * Is fork-join scheduling used for this run?
   *
   * @return True for {@link Partitioning#AUTO}
   */
  public boolean useForkJoin() {
    return partitioning.useForkJoin();
  }

  public boolean trackSender() {
    return trackSender;
  }

  public boolean metricsEnabled() {
    return metricsEnabled;
  }

  public int getProgressLogIntervalMsecs() {
    return progressLogIntervalMsecs;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("concurrency", concurrency)
        .add("maxIterations", maxIterations)
        .add("tolerance", tolerance)
        .add("asynchronous", asynchronous)
        .add("partitioning", partitioning)
        .add("trackSender", trackSender)
        .toString();
  }

  /**
   * Builder for {@link PregelConfig}
   */
  public static final class Builder {
    /** Number of compute threads */
    private int concurrency = PregelConstants.CONCURRENCY.getDefaultValue();
    /** Maximum number of supersteps */
    private int maxIterations =
        PregelConstants.MAX_ITERATIONS.getDefaultValue();
    /** Optional convergence delta */
    private OptionalDouble tolerance = OptionalDouble.empty();
    /** Asynchronous message delivery */
    private boolean asynchronous =
        PregelConstants.IS_ASYNCHRONOUS.getDefaultValue();
    /** Partitioning policy */
    private Partitioning partitioning =
        PregelConstants.PARTITIONING.getDefaultValue();
    /** Track senders of reduced messages */
    private boolean trackSender =
        PregelConstants.TRACK_SENDER.getDefaultValue();
    /** Metrics over JMX */
    private boolean metricsEnabled =
        PregelConstants.METRICS_ENABLE.getDefaultValue();
    /** Minimum msecs between two progress log lines */
    private int progressLogIntervalMsecs =
        PregelConstants.PROGRESS_LOG_INTERVAL_MSECS.getDefaultValue();

    /** Use {@link PregelConfig#builder()} */
    private Builder() {
    }

    /**
     * @param concurrency Number of compute threads, at least 1
     * @return this
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * @param maxIterations Maximum number of supersteps, at least 1
     * @return this
     */
    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    /**
     * @param tolerance Convergence delta, strictly positive
     * @return this
     */
    public Builder tolerance(double tolerance) {
      this.tolerance = OptionalDouble.of(tolerance);
      return this;
    }

    /**
     * @param asynchronous Asynchronous message delivery
     * @return this
     */
    public Builder asynchronous(boolean asynchronous) {
      this.asynchronous = asynchronous;
      return this;
    }

    /**
     * @param partitioning Partitioning policy
     * @return this
     */
    public Builder partitioning(Partitioning partitioning) {
      this.partitioning = partitioning;
      return this;
    }

    /**
     * @param partitioning Partitioning name, case-insensitive
     * @return this
     */
    public Builder partitioning(String partitioning) {
      this.partitioning = Partitioning.parse(partitioning);
      return this;
    }

    /**
     * @param trackSender Track senders of reduced messages
     * @return this
     */
    public Builder trackSender(boolean trackSender) {
      this.trackSender = trackSender;
      return this;
    }

    /**
     * @param metricsEnabled Report metrics over JMX
     * @return this
     */
    public Builder metricsEnabled(boolean metricsEnabled) {
      this.metricsEnabled = metricsEnabled;
      return this;
    }

    /**
     * @param progressLogIntervalMsecs Msecs between progress log lines
     * @return this
     */
    public Builder progressLogIntervalMsecs(int progressLogIntervalMsecs) {
      this.progressLogIntervalMsecs = progressLogIntervalMsecs;
      return this;
    }

    /**
     * Validate and freeze the options.
     *
     * @return PregelConfig
     * @throws IllegalArgumentException if an option is out of range
     */
    public PregelConfig build() {
      Preconditions.checkArgument(concurrency >= 1,
          "build: concurrency must be at least 1, got %s", concurrency);
      Preconditions.checkArgument(maxIterations >= 1,
          "build: maxIterations must be at least 1, got %s", maxIterations);
      if (tolerance.isPresent()) {
        double value = tolerance.getAsDouble();
        Preconditions.checkArgument(value > 0 && !Double.isNaN(value),
            "build: tolerance must be positive when present, got %s", value);
      }
      Preconditions.checkArgument(partitioning != null,
          "build: partitioning must be set");
      Preconditions.checkArgument(progressLogIntervalMsecs >= 0,
          "build: progressLogIntervalMsecs must not be negative, got %s",
          progressLogIntervalMsecs);
      return new PregelConfig(this);
    }
  }
}
