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
package org.apache.pregel.schema;

import java.util.Arrays;
import java.util.Optional;

import javax.annotation.concurrent.Immutable;

import org.apache.pregel.graph.NodePropertyValues;

import com.google.common.base.Preconditions;

/**
 * Typed constant used to pre-fill a value store column. The value type is
 * derived from the constant.
 */
@Immutable
public final class DefaultValue {
  /** Type of the constant */
  private final ValueType valueType;
  /** Boxed constant: Long, Double, long[] or double[] */
  private final Object value;

  /**
   * Constructor
   *
   * @param valueType Type of the constant
   * @param value Constant
   */
  private DefaultValue(ValueType valueType, Object value) {
    this.valueType = valueType;
    this.value = value;
  }

  /**
   * @param value long constant
   * @return DefaultValue of type {@link ValueType#LONG}
   */
  public static DefaultValue of(long value) {
    return new DefaultValue(ValueType.LONG, value);
  }

  /**
   * @param value double constant
   * @return DefaultValue of type {@link ValueType#DOUBLE}
   */
  public static DefaultValue of(double value) {
    return new DefaultValue(ValueType.DOUBLE, value);
  }

  /**
   * @param value long array constant, copied
   * @return DefaultValue of type {@link ValueType#LONG_ARRAY}
   */
  public static DefaultValue of(long[] value) {
    Preconditions.checkNotNull(value, "of: null long array");
    return new DefaultValue(ValueType.LONG_ARRAY, value.clone());
  }

  /**
   * @param value double array constant, copied
   * @return DefaultValue of type {@link ValueType#DOUBLE_ARRAY}
   */
  public static DefaultValue of(double[] value) {
    Preconditions.checkNotNull(value, "of: null double array");
    return new DefaultValue(ValueType.DOUBLE_ARRAY, value.clone());
  }

  /**
   * Read the value of one vertex from an external property projection.
   *
   * @param values Projected property values
   * @param nodeId Vertex id
   * @return The converted value, or empty when the vertex has none
   */
  public static Optional<DefaultValue> fromProperty(
      NodePropertyValues values, long nodeId) {
    if (!values.hasValue(nodeId)) {
      return Optional.empty();
    }
    switch (values.valueType()) {
    case LONG:
      return Optional.of(of(values.longValue(nodeId)));
    case DOUBLE:
      return Optional.of(of(values.doubleValue(nodeId)));
    case LONG_ARRAY:
      long[] longs = values.longArrayValue(nodeId);
      return longs == null ? Optional.<DefaultValue>empty() :
          Optional.of(of(longs));
    case DOUBLE_ARRAY:
      double[] doubles = values.doubleArrayValue(nodeId);
      return doubles == null ? Optional.<DefaultValue>empty() :
          Optional.of(of(doubles));
    default:
      throw new IllegalStateException("fromProperty: Unknown value type " +
          values.valueType());
    }
  }

  public ValueType getValueType() {
    return valueType;
  }

  /**
   * @return long constant
   * @throws ValueTypeMismatchException if this is not a long
   */
  public long longValue() {
    checkType(ValueType.LONG);
    return (Long) value;
  }

  /**
   * @return double constant
   * @throws ValueTypeMismatchException if this is not a double
   */
  public double doubleValue() {
    checkType(ValueType.DOUBLE);
    return (Double) value;
  }

  /**
   * @return copy of the long array constant
   * @throws ValueTypeMismatchException if this is not a long array
   */
  public long[] longArrayValue() {
    checkType(ValueType.LONG_ARRAY);
    return ((long[]) value).clone();
  }

  /**
   * @return copy of the double array constant
   * @throws ValueTypeMismatchException if this is not a double array
   */
  public double[] doubleArrayValue() {
    checkType(ValueType.DOUBLE_ARRAY);
    return ((double[]) value).clone();
  }

  /**
   * Verify the requested type.
   *
   * @param requested Requested type
   */
  private void checkType(ValueType requested) {
    if (requested != valueType) {
      throw new ValueTypeMismatchException("<default>", requested, valueType);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DefaultValue)) {
      return false;
    }
    DefaultValue that = (DefaultValue) o;
    if (valueType != that.valueType) {
      return false;
    }
    switch (valueType) {
    case LONG_ARRAY:
      return Arrays.equals((long[]) value, (long[]) that.value);
    case DOUBLE_ARRAY:
      return Arrays.equals((double[]) value, (double[]) that.value);
    default:
      return value.equals(that.value);
    }
  }

  @Override
  public int hashCode() {
    switch (valueType) {
    case LONG_ARRAY:
      return 31 * valueType.hashCode() + Arrays.hashCode((long[]) value);
    case DOUBLE_ARRAY:
      return 31 * valueType.hashCode() + Arrays.hashCode((double[]) value);
    default:
      return 31 * valueType.hashCode() + value.hashCode();
    }
  }

  @Override
  public String toString() {
    switch (valueType) {
    case LONG_ARRAY:
      return "DefaultValue(" + Arrays.toString((long[]) value) + ")";
    case DOUBLE_ARRAY:
      return "DefaultValue(" + Arrays.toString((double[]) value) + ")";
    default:
      return "DefaultValue(" + value + ")";
    }
  }
}
