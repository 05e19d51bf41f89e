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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A field path that must be present in the source schema.
 *
 * <p>Presence is checked across the whole collection: the path is present if
 * at least one record declares it. An optional expected {@link FieldKind} is
 * checked per record and only produces warnings.
 *
 * <pre>{@code
 * required:
 *   - path: name.common
 *     kind: string
 *   - path: currencies
 *     kind: object
 * }</pre>
 *
 * @see SchemaValidator
 */
public class RequiredFieldConfig {

  /**
   * Structural kind of a JSON value.
   */
  public enum FieldKind {
    ANY,
    OBJECT,
    ARRAY,
    NUMBER,
    STRING,
    BOOLEAN;

    /**
     * Returns whether a non-null value is of this kind.
     */
    public boolean matches(Object value) {
      switch (this) {
        case OBJECT:
          return value instanceof Map;
        case ARRAY:
          return value instanceof List;
        case NUMBER:
          return value instanceof Number;
        case STRING:
          return value instanceof String;
        case BOOLEAN:
          return value instanceof Boolean;
        default:
          return true;
      }
    }

    /**
     * Returns the kind of a non-null value.
     */
    public static FieldKind of(Object value) {
      if (value instanceof Map) {
        return OBJECT;
      } else if (value instanceof List) {
        return ARRAY;
      } else if (value instanceof Number) {
        return NUMBER;
      } else if (value instanceof String) {
        return STRING;
      } else if (value instanceof Boolean) {
        return BOOLEAN;
      }
      return ANY;
    }

    public static FieldKind fromString(@Nullable String value) {
      if (value == null) {
        return ANY;
      }
      String normalized = value.trim().toUpperCase(Locale.ROOT);
      if ("MAP".equals(normalized) || "STRUCT".equals(normalized)) {
        return OBJECT;
      }
      try {
        return FieldKind.valueOf(normalized);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown field kind: " + value, e);
      }
    }
  }

  private final RecordPath path;
  private final FieldKind kind;

  public RequiredFieldConfig(String path, FieldKind kind) {
    this.path = RecordPath.parse(path);
    this.kind = kind != null ? kind : FieldKind.ANY;
  }

  /**
   * Creates a required field with no expected kind.
   */
  public static RequiredFieldConfig of(String path) {
    return new RequiredFieldConfig(path, FieldKind.ANY);
  }

  public static RequiredFieldConfig of(String path, FieldKind kind) {
    return new RequiredFieldConfig(path, kind);
  }

  public RecordPath getPath() {
    return path;
  }

  public FieldKind getKind() {
    return kind;
  }

  /**
   * Parses required fields from a YAML/JSON list. Items may be plain path
   * strings or maps with {@code path} and optional {@code kind}.
   */
  @SuppressWarnings("unchecked")
  public static List<RequiredFieldConfig> fromList(@Nullable List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    List<RequiredFieldConfig> result = new ArrayList<RequiredFieldConfig>();
    for (Object item : list) {
      if (item instanceof String) {
        result.add(of((String) item));
      } else if (item instanceof Map) {
        Map<String, Object> map = (Map<String, Object>) item;
        Object path = map.get("path");
        if (!(path instanceof String)) {
          throw new IllegalArgumentException("Required field entry has no 'path': " + map);
        }
        result.add(new RequiredFieldConfig((String) path,
            FieldKind.fromString((String) map.get("kind"))));
      } else {
        throw new IllegalArgumentException("Unsupported required field entry: " + item);
      }
    }
    return result;
  }

  @Override public String toString() {
    return kind == FieldKind.ANY ? path.toString() : path + ":" + kind;
  }
}
