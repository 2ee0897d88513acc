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
package org.apache.pregel.values;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

import org.apache.pregel.schema.ValueType;
import org.apache.pregel.schema.ValueTypeMismatchException;

import com.google.common.base.MoreObjects;

/**
 * One {@code (nodeId, value)} pair of a value store column, handed out for
 * write-back to persistent storage.
 */
@Immutable
public final class NodeValueEntry {
  /** Property key of the column */
  private final String propertyKey;
  /** Vertex id */
  private final long nodeId;
  /** Column type */
  private final ValueType valueType;
  /** Boxed value: Long, Double, long[] or double[] (arrays may be null) */
  private final Object value;

  /**
   * Constructor
   *
   * @param propertyKey Property key
   * @param nodeId Vertex id
   * @param valueType Column type
   * @param value Boxed value
   */
  NodeValueEntry(String propertyKey, long nodeId, ValueType valueType,
      Object value) {
    this.propertyKey = propertyKey;
    this.nodeId = nodeId;
    this.valueType = valueType;
    this.value = value;
  }

  public String getPropertyKey() {
    return propertyKey;
  }

  public long getNodeId() {
    return nodeId;
  }

  public ValueType getValueType() {
    return valueType;
  }

  /**
   * @return long value
   */
  public long longValue() {
    checkType(ValueType.LONG);
    return (Long) value;
  }

  /**
   * @return double value
   */
  public double doubleValue() {
    checkType(ValueType.DOUBLE);
    return (Double) value;
  }

  /**
   * @return long array value, possibly null
   */
  public long[] longArrayValue() {
    checkType(ValueType.LONG_ARRAY);
    return (long[]) value;
  }

  /**
   * @return double array value, possibly null
   */
  public double[] doubleArrayValue() {
    checkType(ValueType.DOUBLE_ARRAY);
    return (double[]) value;
  }

  /**
   * Verify the requested type.
   *
   * @param requested Requested type
   */
  private void checkType(ValueType requested) {
    if (valueType != requested) {
      throw new ValueTypeMismatchException(propertyKey, requested, valueType);
    }
  }

  @Override
  public String toString() {
    String valueStr;
    if (value instanceof long[]) {
      valueStr = Arrays.toString((long[]) value);
    } else if (value instanceof double[]) {
      valueStr = Arrays.toString((double[]) value);
    } else {
      valueStr = String.valueOf(value);
    }
    return MoreObjects.toStringHelper(this)
        .add("propertyKey", propertyKey)
        .add("nodeId", nodeId)
        .add("value", valueStr)
        .toString();
  }
}
