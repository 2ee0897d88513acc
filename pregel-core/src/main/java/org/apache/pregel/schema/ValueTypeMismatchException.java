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

/**
 * Thrown when an accessor type disagrees with the declared element type.
 */
public class ValueTypeMismatchException extends IllegalArgumentException {
  /** Serialization version */
  private static final long serialVersionUID = 1L;

  /** Type the accessor asked for */
  private final ValueType requestedType;
  /** Type the schema declares */
  private final ValueType declaredType;

  /**
   * Constructor
   *
   * @param propertyKey Property key
   * @param requestedType Type of the accessor used
   * @param declaredType Declared type of the element
   */
  public ValueTypeMismatchException(String propertyKey,
      ValueType requestedType, ValueType declaredType) {
    super("Requested property type " + requestedType +
        " is not compatible with available property type " + declaredType +
        " for key '" + propertyKey + "'");
    this.requestedType = requestedType;
    this.declaredType = declaredType;
  }

  public ValueType getRequestedType() {
    return requestedType;
  }

  public ValueType getDeclaredType() {
    return declaredType;
  }
}
