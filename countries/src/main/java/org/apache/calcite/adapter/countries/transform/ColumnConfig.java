/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.countries.transform;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration for one column of the final table.
 *
 * <p>A column reads the first non-null of its ordered source expressions and
 * falls back to a literal default, then is cast to its declared type:
 *
 * <h3>Direct Column</h3>
 * <pre>{@code
 * - name: population
 *   type: INTEGER
 *   source: population
 *   default: 0
 * }</pre>
 *
 * <h3>Positional and Exploded Sources</h3>
 * <pre>{@code
 * - name: capital
 *   type: TEXT
 *   source: "capital[0]"
 *   default: "N/A"
 * - name: currency_name
 *   type: TEXT
 *   source: currency.value.name
 *   default: "N/A"
 * }</pre>
 *
 * <h3>Ordered Fallback</h3>
 * <pre>{@code
 * - name: country_name
 *   type: TEXT
 *   source: [name.common, name.official]
 *   default: "N/A"
 * }</pre>
 */
public class ColumnConfig {

  private final String name;
  private final ColumnType type;
  private final ImmutableList<String> sources;
  private final Object defaultValue;

  private ColumnConfig(Builder builder, ImmutableList<String> sources, Object defaultValue) {
    this.name = builder.name;
    this.type = builder.type;
    this.sources = sources;
    this.defaultValue = defaultValue;
  }

  /**
   * Returns the output column name.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the declared type of the column.
   */
  public ColumnType getType() {
    return type;
  }

  /**
   * Returns the candidate source expressions, in fallback order.
   * Never empty; defaults to the column name.
   */
  public List<String> getSources() {
    return sources;
  }

  /**
   * Returns the default value, already in the column's canonical Java type.
   */
  public Object getDefaultValue() {
    return defaultValue;
  }

  /**
   * Returns a builder initialized from this column.
   */
  public Builder toBuilder() {
    return builder()
        .name(name)
        .type(type)
        .sources(sources)
        .defaultValue(defaultValue);
  }

  /**
   * Creates a new builder for ColumnConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a ColumnConfig from a YAML/JSON map.
   *
   * @param map Configuration map with keys: name, type, source, default
   * @return ColumnConfig instance
   */
  public static ColumnConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.name((String) map.get("name"));
    Object type = map.get("type");
    if (type != null) {
      builder.type(ColumnType.fromString(type.toString()));
    }

    Object source = map.get("source");
    if (source instanceof String) {
      builder.source((String) source);
    } else if (source instanceof List) {
      List<String> sources = new ArrayList<String>();
      for (Object item : (List<?>) source) {
        sources.add(String.valueOf(item));
      }
      builder.sources(sources);
    }

    builder.defaultValue(map.get("default"));
    return builder.build();
  }

  /**
   * Parses a list of column configurations from a YAML/JSON list.
   *
   * @param list List of column configuration maps
   * @return List of ColumnConfig instances
   */
  @SuppressWarnings("unchecked")
  public static List<ColumnConfig> fromList(List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }

    List<ColumnConfig> result = new ArrayList<ColumnConfig>();
    for (Object item : list) {
      if (!(item instanceof Map)) {
        throw new IllegalArgumentException("Unsupported column entry: " + item);
      }
      result.add(fromMap((Map<String, Object>) item));
    }
    return result;
  }

  @Override public String toString() {
    return "ColumnConfig{" + name + " " + type + " <- " + sources
        + " default " + defaultValue + "}";
  }

  /**
   * Builder for ColumnConfig.
   */
  public static class Builder {
    private String name;
    private ColumnType type;
    private List<String> sources;
    private Object defaultValue;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(ColumnType type) {
      this.type = type;
      return this;
    }

    /**
     * Sets a single source expression.
     */
    public Builder source(String source) {
      this.sources = Collections.singletonList(source);
      return this;
    }

    /**
     * Sets the ordered candidate source expressions.
     */
    public Builder sources(List<String> sources) {
      this.sources = sources;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    /**
     * Builds the column, checking that every source parses and that the
     * default is non-null and castable to the column type.
     */
    public ColumnConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name is required");
      }
      if (type == null) {
        throw new IllegalArgumentException("Column '" + name + "' has no type");
      }
      ImmutableList<String> effectiveSources = sources == null || sources.isEmpty()
          ? ImmutableList.of(name)
          : ImmutableList.copyOf(sources);
      for (String source : effectiveSources) {
        RecordPath.parse(source);
      }
      if (defaultValue == null) {
        throw new IllegalArgumentException("Column '" + name + "' has no default value");
      }
      Object canonicalDefault;
      try {
        canonicalDefault = TypeCoercer.convert(type, defaultValue);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Default value '" + defaultValue
            + "' of column '" + name + "' is not a valid " + type, e);
      }
      return new ColumnConfig(this, effectiveSources, canonicalDefault);
    }
  }
}
