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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for one run of the {@link TransformationPipeline}.
 *
 * <p>Holds the four configuration surfaces of the transformation, all of them
 * data that the caller may override:
 * <ol>
 *   <li>Required field paths, checked by {@link SchemaValidator}</li>
 *   <li>Explodable fields, expanded by {@link StructuralFlattener}</li>
 *   <li>Column defaults, applied by {@link FieldNormalizer}</li>
 *   <li>Column types, applied by {@link TypeCoercer}</li>
 * </ol>
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * name: countries
 * required:
 *   - { path: name.common, kind: string }
 *   - { path: currencies, kind: object }
 * explode:
 *   - { field: currencies, alias: currency }
 * columns:
 *   - { name: country_name, type: text, source: name.common, default: "N/A" }
 *   - { name: currency_code, type: text, source: currency.key, default: "N/A" }
 * coercion:
 *   onFailure: fail
 * distinct: false
 * parallel: false
 * nonNegativeColumns: [population]
 * }</pre>
 *
 * <p>A configuration object is scoped to a pipeline run; nothing in it is
 * process-wide state.
 */
public class TransformConfig {

  /** Classpath resource holding the configuration for the countries document. */
  public static final String COUNTRIES_RESOURCE = "countries-transform.yaml";

  private final String name;
  private final ImmutableList<RequiredFieldConfig> requiredFields;
  private final ImmutableList<ExplodeConfig> explodes;
  private final ImmutableList<ColumnConfig> columns;
  private final CoercionFailureAction coercionFailureAction;
  private final boolean distinct;
  private final boolean parallel;
  private final ImmutableList<String> nonNegativeColumns;

  private TransformConfig(Builder builder, ImmutableList<ColumnConfig> columns) {
    this.name = builder.name;
    this.requiredFields = ImmutableList.copyOf(builder.requiredFields);
    this.explodes = ImmutableList.copyOf(builder.explodes);
    this.columns = columns;
    this.coercionFailureAction = builder.coercionFailureAction;
    this.distinct = builder.distinct;
    this.parallel = builder.parallel;
    this.nonNegativeColumns = ImmutableList.copyOf(builder.nonNegativeColumns);
  }

  /**
   * Returns the name used in log messages and results.
   */
  public String getName() {
    return name;
  }

  public List<RequiredFieldConfig> getRequiredFields() {
    return requiredFields;
  }

  /**
   * Returns the required field paths as strings, in declaration order.
   */
  public List<String> getRequiredPaths() {
    List<String> paths = new ArrayList<String>(requiredFields.size());
    for (RequiredFieldConfig field : requiredFields) {
      paths.add(field.getPath().getExpression());
    }
    return paths;
  }

  public List<ExplodeConfig> getExplodes() {
    return explodes;
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  /**
   * Returns the column default mapping, in column order.
   */
  public Map<String, Object> getDefaults() {
    Map<String, Object> defaults = new LinkedHashMap<String, Object>();
    for (ColumnConfig column : columns) {
      defaults.put(column.getName(), column.getDefaultValue());
    }
    return Collections.unmodifiableMap(defaults);
  }

  /**
   * Returns the column type mapping, in column order.
   */
  public Map<String, ColumnType> getTypes() {
    Map<String, ColumnType> types = new LinkedHashMap<String, ColumnType>();
    for (ColumnConfig column : columns) {
      types.put(column.getName(), column.getType());
    }
    return Collections.unmodifiableMap(types);
  }

  public CoercionFailureAction getCoercionFailureAction() {
    return coercionFailureAction;
  }

  /**
   * Returns whether duplicate final rows are removed.
   */
  public boolean isDistinct() {
    return distinct;
  }

  /**
   * Returns whether per-row stages run on a parallel stream.
   */
  public boolean isParallel() {
    return parallel;
  }

  /**
   * Returns numeric columns whose negative values are reported as warnings.
   */
  public List<String> getNonNegativeColumns() {
    return nonNegativeColumns;
  }

  /**
   * Returns a builder initialized from this configuration.
   */
  public Builder toBuilder() {
    return builder()
        .name(name)
        .requiredFields(requiredFields)
        .explodes(explodes)
        .columns(columns)
        .coercionFailureAction(coercionFailureAction)
        .distinct(distinct)
        .parallel(parallel)
        .nonNegativeColumns(nonNegativeColumns);
  }

  /**
   * Creates a new builder for TransformConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the configuration for the countries document, loaded from
   * {@value #COUNTRIES_RESOURCE}.
   */
  public static TransformConfig countries() {
    try (InputStream in =
             TransformConfig.class.getClassLoader().getResourceAsStream(COUNTRIES_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Resource not found: " + COUNTRIES_RESOURCE);
      }
      return fromYaml(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + COUNTRIES_RESOURCE, e);
    }
  }

  /**
   * Reads a configuration from a YAML (or JSON) document.
   */
  @SuppressWarnings("unchecked")
  public static TransformConfig fromYaml(InputStream in) {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    Object document = yaml.load(in);
    if (!(document instanceof Map)) {
      throw new IllegalArgumentException("Transform configuration must be a YAML mapping");
    }
    return fromMap((Map<String, Object>) document);
  }

  /**
   * Creates a TransformConfig from a YAML/JSON map.
   */
  @SuppressWarnings("unchecked")
  public static TransformConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    Object name = map.get("name");
    if (name != null) {
      builder.name(name.toString());
    }
    builder.requiredFields(RequiredFieldConfig.fromList((List<?>) map.get("required")));
    builder.explodes(ExplodeConfig.fromList((List<?>) map.get("explode")));
    builder.columns(ColumnConfig.fromList((List<?>) map.get("columns")));

    Object coercion = map.get("coercion");
    if (coercion instanceof Map) {
      Object onFailure = ((Map<String, Object>) coercion).get("onFailure");
      builder.coercionFailureAction(
          CoercionFailureAction.fromString(onFailure != null ? onFailure.toString() : null));
    }

    builder.distinct(Boolean.TRUE.equals(map.get("distinct")));
    builder.parallel(Boolean.TRUE.equals(map.get("parallel")));

    Object nonNegative = map.get("nonNegativeColumns");
    if (nonNegative instanceof List) {
      List<String> names = new ArrayList<String>();
      for (Object item : (List<?>) nonNegative) {
        names.add(String.valueOf(item));
      }
      builder.nonNegativeColumns(names);
    }
    return builder.build();
  }

  @Override public String toString() {
    return "TransformConfig{name='" + name + "', required=" + requiredFields
        + ", explode=" + explodes + ", columns=" + columns
        + ", onCoercionFailure=" + coercionFailureAction + "}";
  }

  /**
   * Builder for TransformConfig.
   *
   * <p>Besides whole column definitions, the builder accepts per-column
   * overrides of the default and the type, so a caller can start from
   * {@link TransformConfig#countries()} and change a single mapping.
   */
  public static class Builder {
    private String name = "transform";
    private List<RequiredFieldConfig> requiredFields = Collections.emptyList();
    private List<ExplodeConfig> explodes = Collections.emptyList();
    private List<ColumnConfig> columns = Collections.emptyList();
    private CoercionFailureAction coercionFailureAction = CoercionFailureAction.FAIL;
    private boolean distinct;
    private boolean parallel;
    private List<String> nonNegativeColumns = Collections.emptyList();
    private final Map<String, Object> defaultOverrides = new LinkedHashMap<String, Object>();
    private final Map<String, ColumnType> typeOverrides = new LinkedHashMap<String, ColumnType>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder requiredFields(List<RequiredFieldConfig> requiredFields) {
      this.requiredFields = requiredFields;
      return this;
    }

    /**
     * Sets the required field paths, with no expected kinds.
     */
    public Builder requiredPaths(List<String> paths) {
      List<RequiredFieldConfig> fields = new ArrayList<RequiredFieldConfig>();
      for (String path : paths) {
        fields.add(RequiredFieldConfig.of(path));
      }
      this.requiredFields = fields;
      return this;
    }

    public Builder explodes(List<ExplodeConfig> explodes) {
      this.explodes = explodes;
      return this;
    }

    public Builder columns(List<ColumnConfig> columns) {
      this.columns = columns;
      return this;
    }

    /**
     * Overrides the default value of an existing column.
     */
    public Builder defaultValue(String column, Object value) {
      defaultOverrides.put(column, value);
      return this;
    }

    /**
     * Overrides the type of an existing column.
     */
    public Builder columnType(String column, ColumnType type) {
      typeOverrides.put(column, type);
      return this;
    }

    public Builder coercionFailureAction(CoercionFailureAction action) {
      this.coercionFailureAction = action;
      return this;
    }

    public Builder distinct(boolean distinct) {
      this.distinct = distinct;
      return this;
    }

    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder nonNegativeColumns(List<String> nonNegativeColumns) {
      this.nonNegativeColumns = nonNegativeColumns;
      return this;
    }

    public TransformConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Transform name is required");
      }
      if (columns == null || columns.isEmpty()) {
        throw new IllegalArgumentException("At least one column is required");
      }
      if (coercionFailureAction == null) {
        throw new IllegalArgumentException("Coercion failure action is required");
      }

      Set<String> names = new HashSet<String>();
      ImmutableList.Builder<ColumnConfig> effective = ImmutableList.builder();
      for (ColumnConfig column : columns) {
        if (!names.add(column.getName())) {
          throw new IllegalArgumentException("Duplicate column: " + column.getName());
        }
        effective.add(applyOverrides(column));
      }
      checkKnown(defaultOverrides.keySet(), names, "default override");
      checkKnown(typeOverrides.keySet(), names, "type override");
      checkKnown(nonNegativeColumns, names, "nonNegativeColumns");

      Set<String> aliases = new HashSet<String>();
      for (ExplodeConfig explode : explodes) {
        if (!aliases.add(explode.getAlias())) {
          throw new IllegalArgumentException("Duplicate explode alias: " + explode.getAlias());
        }
      }
      return new TransformConfig(this, effective.build());
    }

    private ColumnConfig applyOverrides(ColumnConfig column) {
      @Nullable Object defaultValue = defaultOverrides.get(column.getName());
      @Nullable ColumnType type = typeOverrides.get(column.getName());
      if (defaultValue == null && type == null) {
        return column;
      }
      ColumnConfig.Builder builder = column.toBuilder();
      if (type != null) {
        builder.type(type);
      }
      if (defaultValue != null) {
        builder.defaultValue(defaultValue);
      }
      return builder.build();
    }

    private static void checkKnown(Iterable<String> referenced, Set<String> columns,
        String what) {
      for (String column : referenced) {
        if (!columns.contains(column)) {
          throw new IllegalArgumentException(
              "Unknown column '" + column + "' referenced by " + what);
        }
      }
    }
  }
}
