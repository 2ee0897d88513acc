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
package org.apache.pregel.graph;

import org.apache.pregel.schema.ValueType;

import com.google.common.base.Preconditions;

/**
 * Read-only projection of one vertex property of the graph store. This is
 * the only view the engine has of persisted vertex data.
 */
public interface NodePropertyValues {
  /**
   * Type of every value in this projection.
   *
   * @return Value type
   */
  ValueType valueType();

  /**
   * Number of vertices covered.
   *
   * @return Vertex count
   */
  long nodeCount();

  /**
   * Does the vertex have a value?
   *
   * @param nodeId Vertex id
   * @return True if a value exists
   */
  default boolean hasValue(long nodeId) {
    return nodeId >= 0 && nodeId < nodeCount();
  }

  /**
   * @param nodeId Vertex id
   * @return long value
   */
  default long longValue(long nodeId) {
    throw new UnsupportedOperationException("longValue: property of type " +
        valueType());
  }

  /**
   * @param nodeId Vertex id
   * @return double value
   */
  default double doubleValue(long nodeId) {
    throw new UnsupportedOperationException("doubleValue: property of type " +
        valueType());
  }

  /**
   * @param nodeId Vertex id
   * @return long array value
   */
  default long[] longArrayValue(long nodeId) {
    throw new UnsupportedOperationException("longArrayValue: property of " +
        "type " + valueType());
  }

  /**
   * @param nodeId Vertex id
   * @return double array value
   */
  default double[] doubleArrayValue(long nodeId) {
    throw new UnsupportedOperationException("doubleArrayValue: property of " +
        "type " + valueType());
  }

  /**
   * Projection backed by a long array indexed by vertex id.
   *
   * @param values Values, not copied
   * @return Projection
   */
  static NodePropertyValues ofLongs(final long[] values) {
    Preconditions.checkNotNull(values);
    return new NodePropertyValues() {
      @Override
      public ValueType valueType() {
        return ValueType.LONG;
      }

      @Override
      public long nodeCount() {
        return values.length;
      }

      @Override
      public long longValue(long nodeId) {
        return values[Math.toIntExact(nodeId)];
      }

      @Override
      public double doubleValue(long nodeId) {
        return longValue(nodeId);
      }
    };
  }

  /**
   * Projection backed by a double array indexed by vertex id. NaN marks a
   * missing value.
   *
   * @param values Values, not copied
   * @return Projection
   */
  static NodePropertyValues ofDoubles(final double[] values) {
    Preconditions.checkNotNull(values);
    return new NodePropertyValues() {
      @Override
      public ValueType valueType() {
        return ValueType.DOUBLE;
      }

      @Override
      public long nodeCount() {
        return values.length;
      }

      @Override
      public boolean hasValue(long nodeId) {
        return nodeId >= 0 && nodeId < values.length &&
            !Double.isNaN(values[(int) nodeId]);
      }

      @Override
      public double doubleValue(long nodeId) {
        return values[Math.toIntExact(nodeId)];
      }
    };
  }
}
