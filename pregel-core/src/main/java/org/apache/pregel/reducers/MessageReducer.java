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
package org.apache.pregel.reducers;

/**
 * Folds all messages addressed to one vertex in a superstep into a single
 * value. Implementations must be associative and commutative and must be
 * safe to call from many threads.
 */
public interface MessageReducer {
  /**
   * Fold a message into the current value.
   *
   * @param current Current value, {@link #identity()} if nothing was folded
   * @param message Incoming message
   * @return New value
   */
  double reduce(double current, double message);

  /**
   * Value that represents "no message".
   *
   * @return Identity
   */
  double identity();
}
