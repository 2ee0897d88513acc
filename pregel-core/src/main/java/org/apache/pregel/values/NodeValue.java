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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.apache.pregel.schema.DefaultValue;
import org.apache.pregel.schema.Element;
import org.apache.pregel.schema.PregelSchema;
import org.apache.pregel.schema.SchemaKeyNotFoundException;
import org.apache.pregel.schema.ValueType;
import org.apache.pregel.schema.ValueTypeMismatchException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Per-vertex state of a run: one dense array per schema element, indexed by
 * vertex id. Rows of different vertices may be written concurrently, a
 * single row must only be written by the thread computing that vertex.
 */
public final class NodeValue {
  /** Schema the store was allocated from */
  private final PregelSchema schema;
  /** Number of vertices */
  private final int nodeCount;
  /** Column per property key: double[], long[], double[][] or long[][] */
  private final Map<String, Object> columns;

  /**
   * Constructor
   *
   * @param schema Schema
   * @param nodeCount Number of vertices
   */
  private NodeValue(PregelSchema schema, int nodeCount) {
    this.schema = schema;
    this.nodeCount = nodeCount;
    this.columns = Maps.newHashMapWithExpectedSize(schema.size());
    for (Element element : schema.elements()) {
      columns.put(element.getPropertyKey(), allocate(element, nodeCount));
    }
  }

  /**
   * Allocate a value store.
   *
   * @param schema Schema
   * @param nodeCount Number of vertices, fixed for the lifetime of the store
   * @return Value store with every column filled with its default
   */
  public static NodeValue of(PregelSchema schema, long nodeCount) {
    Preconditions.checkNotNull(schema, "of: null schema");
    Preconditions.checkArgument(nodeCount >= 0 &&
        nodeCount < Integer.MAX_VALUE, "of: Invalid node count %s",
        nodeCount);
    return new NodeValue(schema, (int) nodeCount);
  }

  /**
   * Allocate one column.
   *
   * @param element Schema element
   * @param nodeCount Number of vertices
   * @return Array pre-filled with the default
   */
  private static Object allocate(Element element, int nodeCount) {
    DefaultValue defaultValue = element.getDefaultValue().orElse(null);
    switch (element.getValueType()) {
    case LONG:
      long[] longs = new long[nodeCount];
      if (defaultValue != null) {
        Arrays.fill(longs, defaultValue.longValue());
      }
      return longs;
    case DOUBLE:
      double[] doubles = new double[nodeCount];
      if (defaultValue != null) {
        Arrays.fill(doubles, defaultValue.doubleValue());
      }
      return doubles;
    case LONG_ARRAY:
      long[][] longArrays = new long[nodeCount][];
      if (defaultValue != null) {
        // Rows are mutable, each gets its own copy
        for (int i = 0; i < nodeCount; ++i) {
          longArrays[i] = defaultValue.longArrayValue();
        }
      }
      return longArrays;
    case DOUBLE_ARRAY:
      double[][] doubleArrays = new double[nodeCount][];
      if (defaultValue != null) {
        for (int i = 0; i < nodeCount; ++i) {
          doubleArrays[i] = defaultValue.doubleArrayValue();
        }
      }
      return doubleArrays;
    default:
      throw new IllegalStateException("allocate: Unknown value type " +
          element.getValueType());
    }
  }

  public PregelSchema schema() {
    return schema;
  }

  public long nodeCount() {
    return nodeCount;
  }

  /**
   * @param key Property key
   * @param nodeId Vertex id
   * @return long value
   */
  public long longValue(String key, long nodeId) {
    return ((long[]) column(key, ValueType.LONG))[index(nodeId)];
  }

  /**
   * @param key Property key
   * @param nodeId Vertex id
   * @return double value
   */
  public double doubleValue(String key, long nodeId) {
    return ((double[]) column(key, ValueType.DOUBLE))[index(nodeId)];
  }

  /**
   * @param key Property key
   * @param nodeId Vertex id
   * @return long array value, null if never written and without default
   */
  public long[] longArrayValue(String key, long nodeId) {
    return ((long[][]) column(key, ValueType.LONG_ARRAY))[index(nodeId)];
  }

  /**
   * @param key Property key
   * @param nodeId Vertex id
   * @return double array value, null if never written and without default
   */
  public double[] doubleArrayValue(String key, long nodeId) {
    return ((double[][]) column(key, ValueType.DOUBLE_ARRAY))[index(nodeId)];
  }

  /**
   * Write a double value.
   *
   * @param key Property key
   * @param nodeId Vertex id
   * @param value Value
   */
  public void set(String key, long nodeId, double value) {
    ((double[]) column(key, ValueType.DOUBLE))[index(nodeId)] = value;
  }

  /**
   * Write a long value.
   *
   * @param key Property key
   * @param nodeId Vertex id
   * @param value Value
   */
  public void setLong(String key, long nodeId, long value) {
    ((long[]) column(key, ValueType.LONG))[index(nodeId)] = value;
  }

  /**
   * Write a long array value. The array is stored, not copied.
   *
   * @param key Property key
   * @param nodeId Vertex id
   * @param value Value
   */
  public void setLongArray(String key, long nodeId, long[] value) {
    ((long[][]) column(key, ValueType.LONG_ARRAY))[index(nodeId)] = value;
  }

  /**
   * Write a double array value. The array is stored, not copied.
   *
   * @param key Property key
   * @param nodeId Vertex id
   * @param value Value
   */
  public void setDoubleArray(String key, long nodeId, double[] value) {
    ((double[][]) column(key, ValueType.DOUBLE_ARRAY))[index(nodeId)] =
        value;
  }

  /**
   * Write a typed constant, widening a long into a double column.
   *
   * @param key Property key
   * @param nodeId Vertex id
   * @param value Value
   */
  public void set(String key, long nodeId, DefaultValue value) {
    ValueType declared = declaredType(key);
    switch (declared) {
    case LONG:
      setLong(key, nodeId, value.longValue());
      break;
    case DOUBLE:
      if (value.getValueType() == ValueType.LONG) {
        set(key, nodeId, (double) value.longValue());
      } else {
        set(key, nodeId, value.doubleValue());
      }
      break;
    case LONG_ARRAY:
      setLongArray(key, nodeId, value.longArrayValue());
      break;
    case DOUBLE_ARRAY:
      setDoubleArray(key, nodeId, value.doubleArrayValue());
      break;
    default:
      throw new IllegalStateException("set: Unknown value type " + declared);
    }
  }

  /**
   * Keys of the columns eligible for write-back, in declaration order.
   *
   * @return Public property keys
   */
  public List<String> publicPropertyKeys() {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (Element element : schema.elements()) {
      if (element.isPublic()) {
        keys.add(element.getPropertyKey());
      }
    }
    return keys.build();
  }

  /**
   * Iterate over every {@code (nodeId, value)} pair of a column, in vertex
   * id order. Only valid once the run has finished.
   *
   * @param key Property key
   * @return Entries
   */
  public Iterable<NodeValueEntry> entries(final String key) {
    final ValueType valueType = declaredType(key);
    final Object column = columns.get(key);
    return new Iterable<NodeValueEntry>() {
      @Override
      public Iterator<NodeValueEntry> iterator() {
        return new Iterator<NodeValueEntry>() {
          /** Next vertex */
          private int next;

          @Override
          public boolean hasNext() {
            return next < nodeCount;
          }

          @Override
          public NodeValueEntry next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            int nodeId = next++;
            return new NodeValueEntry(key, nodeId, valueType,
                valueAt(column, valueType, nodeId));
          }
        };
      }
    };
  }

  /**
   * Box one value of a column.
   *
   * @param column Column array
   * @param valueType Column type
   * @param nodeId Vertex id
   * @return Boxed value
   */
  private static Object valueAt(Object column, ValueType valueType,
      int nodeId) {
    switch (valueType) {
    case LONG:
      return ((long[]) column)[nodeId];
    case DOUBLE:
      return ((double[]) column)[nodeId];
    case LONG_ARRAY:
      return ((long[][]) column)[nodeId];
    case DOUBLE_ARRAY:
      return ((double[][]) column)[nodeId];
    default:
      throw new IllegalStateException("valueAt: Unknown value type " +
          valueType);
    }
  }

  /**
   * Declared type of a key.
   *
   * @param key Property key
   * @return Declared type
   */
  private ValueType declaredType(String key) {
    return schema.propertyType(key).orElseThrow(() ->
        new SchemaKeyNotFoundException(key, schema.propertiesMap().keySet()));
  }

  /**
   * Look up a column and check the accessor type.
   *
   * @param key Property key
   * @param requested Type of the accessor
   * @return Column array
   */
  private Object column(String key, ValueType requested) {
    ValueType declared = declaredType(key);
    if (declared != requested) {
      throw new ValueTypeMismatchException(key, requested, declared);
    }
    return columns.get(key);
  }

  /**
   * Verify a vertex id.
   *
   * @param nodeId Vertex id
   * @return Array index
   */
  private int index(long nodeId) {
    if (nodeId < 0 || nodeId >= nodeCount) {
      throw new IndexOutOfBoundsException("index: Vertex " + nodeId +
          " outside of [0, " + nodeCount + ")");
    }
    return (int) nodeId;
  }
}
