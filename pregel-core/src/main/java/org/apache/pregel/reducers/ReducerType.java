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

import org.apache.pregel.reducers.impl.CountReduce;
import org.apache.pregel.reducers.impl.MaxReduce;
import org.apache.pregel.reducers.impl.MinReduce;
import org.apache.pregel.reducers.impl.SumReduce;

/**
 * Built-in reducers, addressable by name.
 */
public enum ReducerType {
  /** Sum of messages */
  SUM {
    @Override
    public MessageReducer newReducer() {
      return SumReduce.INSTANCE;
    }
  },
  /** Smallest message */
  MIN {
    @Override
    public MessageReducer newReducer() {
      return MinReduce.INSTANCE;
    }
  },
  /** Largest message */
  MAX {
    @Override
    public MessageReducer newReducer() {
      return MaxReduce.INSTANCE;
    }
  },
  /** Number of messages */
  COUNT {
    @Override
    public MessageReducer newReducer() {
      return CountReduce.INSTANCE;
    }
  };

  /**
   * @return Reducer instance
   */
  public abstract MessageReducer newReducer();

  /**
   * Case-insensitive lookup.
   *
   * @param name Reducer name
   * @return Reducer type
   */
  public static ReducerType parse(String name) {
    if (name != null) {
      for (ReducerType type : values()) {
        if (type.name().equalsIgnoreCase(name.trim())) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("parse: Unknown reducer '" + name +
        "', expected one of SUM, MIN, MAX, COUNT");
  }
}
