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
 * How the vertex id range is cut into schedulable units of work.
 */
public enum Partitioning {
  /** Contiguous id ranges of roughly nodeCount / concurrency vertices */
  RANGE,
  /** Contiguous id ranges balanced by cumulative vertex degree */
  DEGREE,
  /** Recursive fork-join splitting on a work-stealing pool */
  AUTO;

  /**
   * Parse a partitioning from its name, ignoring case.
   *
   * @param value Name such as "range" or "DEGREE"
   * @return Partitioning
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Partitioning parse(String value) {
    if (value != null) {
      for (Partitioning partitioning : values()) {
        if (partitioning.name().equalsIgnoreCase(value.trim())) {
          return partitioning;
        }
      }
    }
    throw new IllegalArgumentException("parse: Unknown partitioning '" +
        value + "', expected one of RANGE, DEGREE, AUTO");
  }

  /**
   * Only {@link #AUTO} is scheduled with fork-join splitting.
   *
   * @return True if fork-join scheduling is used
   */
  public boolean useForkJoin() {
    return this == AUTO;
  }
}
