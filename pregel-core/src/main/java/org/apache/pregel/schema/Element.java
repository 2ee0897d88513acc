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

import java.util.Optional;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * One named per-vertex slot of a {@link PregelSchema}.
 */
@Immutable
public final class Element {
  /** Name of the slot */
  private final String propertyKey;
  /** Declared type */
  private final ValueType valueType;
  /** Public slots are written back, private ones are scratch space */
  private final Visibility visibility;
  /** Value every vertex starts with */
  private final Optional<DefaultValue> defaultValue;
  /** Graph property the slot is initialized from */
  private final Optional<String> propertySource;

  /**
   * Constructor
   *
   * @param propertyKey Name of the slot
   * @param valueType Declared type
   * @param visibility Visibility
   * @param defaultValue Optional default value
   * @param propertySource Optional graph property to read initial values from
   */
  Element(String propertyKey, ValueType valueType, Visibility visibility,
      Optional<DefaultValue> defaultValue, Optional<String> propertySource) {
    Preconditions.checkArgument(propertyKey != null && !propertyKey.isEmpty(),
        "Element: property key must not be empty");
    this.propertyKey = propertyKey;
    this.valueType = Preconditions.checkNotNull(valueType,
        "Element: value type of '%s' must be set", propertyKey);
    this.visibility = Preconditions.checkNotNull(visibility,
        "Element: visibility of '%s' must be set", propertyKey);
    this.defaultValue = defaultValue;
    this.propertySource = propertySource;
    if (defaultValue.isPresent() &&
        defaultValue.get().getValueType() != valueType) {
      throw new IllegalArgumentException("Element: default value " +
          defaultValue.get() + " does not match type " + valueType +
          " of '" + propertyKey + "'");
    }
  }

  /**
   * Copy of this element reading its initial values from a graph property.
   *
   * @param sourceKey Graph property key
   * @return New element
   */
  Element withPropertySource(String sourceKey) {
    return new Element(propertyKey, valueType, visibility, defaultValue,
        Optional.of(sourceKey));
  }

  public String getPropertyKey() {
    return propertyKey;
  }

  public ValueType getValueType() {
    return valueType;
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public Optional<DefaultValue> getDefaultValue() {
    return defaultValue;
  }

  public Optional<String> getPropertySource() {
    return propertySource;
  }

  public boolean isPublic() {
    return visibility == Visibility.PUBLIC;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Element)) {
      return false;
    }
    Element that = (Element) o;
    return propertyKey.equals(that.propertyKey) &&
        valueType == that.valueType &&
        visibility == that.visibility &&
        defaultValue.equals(that.defaultValue) &&
        propertySource.equals(that.propertySource);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(propertyKey, valueType, visibility);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", propertyKey)
        .add("type", valueType)
        .add("visibility", visibility)
        .add("default", defaultValue.orElse(null))
        .add("source", propertySource.orElse(null))
        .omitNullValues()
        .toString();
  }
}
