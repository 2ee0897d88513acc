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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Declares the per-vertex slots of a run. Built once through
 * {@link #builder()} and never changed afterwards.
 */
@Immutable
public final class PregelSchema {
  /** Elements by property key, in declaration order */
  private final ImmutableMap<String, Element> elements;

  /**
   * Constructor
   *
   * @param elements Elements by key
   */
  private PregelSchema(Map<String, Element> elements) {
    this.elements = ImmutableMap.copyOf(elements);
  }

  /**
   * Start declaring a schema.
   *
   * @return Builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * All elements in declaration order.
   *
   * @return Elements
   */
  public Collection<Element> elements() {
    return elements.values();
  }

  /**
   * Look up an element.
   *
   * @param propertyKey Property key
   * @return Element or empty if the key was not declared
   */
  public Optional<Element> element(String propertyKey) {
    return Optional.ofNullable(elements.get(propertyKey));
  }

  /**
   * Was this key declared?
   *
   * @param propertyKey Property key
   * @return True if declared
   */
  public boolean hasProperty(String propertyKey) {
    return elements.containsKey(propertyKey);
  }

  /**
   * Declared type of a key.
   *
   * @param propertyKey Property key
   * @return Type or empty if the key was not declared
   */
  public Optional<ValueType> propertyType(String propertyKey) {
    return element(propertyKey).map(Element::getValueType);
  }

  /**
   * Keys mapped to their declared types.
   *
   * @return Unmodifiable map
   */
  public Map<String, ValueType> propertiesMap() {
    return Collections.unmodifiableMap(
        Maps.transformValues(elements, Element::getValueType));
  }

  /**
   * Number of declared elements.
   *
   * @return Element count
   */
  public int size() {
    return elements.size();
  }

  @Override
  public boolean equals(Object o) {
    return this == o ||
        (o instanceof PregelSchema &&
            elements.equals(((PregelSchema) o).elements));
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return "PregelSchema" + elements.values();
  }

  /**
   * Fluent builder. Each key may be declared once.
   */
  public static final class Builder {
    /** Declared elements */
    private final Map<String, Element> elements = new LinkedHashMap<>();

    /** Use {@link PregelSchema#builder()} */
    private Builder() {
    }

    /**
     * Declare a slot without a default value.
     *
     * @param propertyKey Key
     * @param valueType Type
     * @param visibility Visibility
     * @return this
     */
    public Builder add(String propertyKey, ValueType valueType,
        Visibility visibility) {
      return put(new Element(propertyKey, valueType, visibility,
          Optional.<DefaultValue>empty(), Optional.<String>empty()));
    }

    /**
     * Declare a public slot without a default value.
     *
     * @param propertyKey Key
     * @param valueType Type
     * @return this
     */
    public Builder addPublic(String propertyKey, ValueType valueType) {
      return add(propertyKey, valueType, Visibility.PUBLIC);
    }

    /**
     * Declare a slot whose type is the type of its default value.
     *
     * @param propertyKey Key
     * @param defaultValue Value every vertex starts with
     * @param visibility Visibility
     * @return this
     */
    public Builder addWithDefault(String propertyKey,
        DefaultValue defaultValue, Visibility visibility) {
      return put(new Element(propertyKey, defaultValue.getValueType(),
          visibility, Optional.of(defaultValue), Optional.<String>empty()));
    }

    /**
     * Initialize an already declared slot from a graph property.
     *
     * @param propertyKey Declared key
     * @param sourceKey Graph property key
     * @return this
     */
    public Builder withPropertySource(String propertyKey, String sourceKey) {
      Element element = elements.get(propertyKey);
      if (element == null) {
        throw new IllegalStateException("withPropertySource: Property '" +
            propertyKey + "' not found in schema. Add the property " +
            "before setting its source.");
      }
      elements.put(propertyKey, element.withPropertySource(sourceKey));
      return this;
    }

    /**
     * Add an element, refusing duplicates.
     *
     * @param element Element
     * @return this
     */
    private Builder put(Element element) {
      if (elements.containsKey(element.getPropertyKey())) {
        throw new IllegalArgumentException("put: Property '" +
            element.getPropertyKey() + "' is declared twice");
      }
      elements.put(element.getPropertyKey(), element);
      return this;
    }

    /**
     * @return Immutable schema
     */
    public PregelSchema build() {
      return new PregelSchema(elements);
    }
  }
}
