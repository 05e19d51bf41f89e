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
import java.util.Map;

/**
 * Declares a multi-valued field whose entries each produce a separate row.
 *
 * <p>During flattening each entry is bound to the alias as a two-field object,
 * so column sources address it as:
 * <ul>
 *   <li>{@code <alias>.key} - map key, or 0-based position for arrays</li>
 *   <li>{@code <alias>.value} - the entry value</li>
 *   <li>{@code <alias>.value.<path>} - a field inside an object value</li>
 * </ul>
 *
 * <pre>{@code
 * explode:
 *   - field: currencies
 *     alias: currency
 *   - field: languages
 *     alias: language
 * }</pre>
 *
 * @see StructuralFlattener
 */
public class ExplodeConfig {

  /** Name of the entry key inside the alias binding. */
  public static final String KEY = "key";

  /** Name of the entry value inside the alias binding. */
  public static final String VALUE = "value";

  private final RecordPath field;
  private final String alias;

  private ExplodeConfig(RecordPath field, String alias) {
    this.field = field;
    this.alias = alias;
  }

  /**
   * Creates an explode declaration.
   *
   * @param field Path of the map or array field
   * @param alias Name the current entry is bound to; defaults to the field path
   */
  public static ExplodeConfig of(String field, @Nullable String alias) {
    RecordPath path = RecordPath.parse(field);
    String effectiveAlias = alias != null && !alias.trim().isEmpty()
        ? alias.trim() : path.getExpression();
    if (effectiveAlias.contains(".") || effectiveAlias.contains("[")) {
      throw new IllegalArgumentException(
          "Explode alias must be a plain name, got '" + effectiveAlias + "'");
    }
    return new ExplodeConfig(path, effectiveAlias);
  }

  public static ExplodeConfig of(String field) {
    return of(field, null);
  }

  /**
   * Returns the path of the explodable field in the source record.
   */
  public RecordPath getField() {
    return field;
  }

  /**
   * Returns the name the current entry is bound to.
   */
  public String getAlias() {
    return alias;
  }

  /**
   * Parses explode declarations from a YAML/JSON list. Items may be plain
   * field paths or maps with {@code field} and optional {@code alias}.
   */
  @SuppressWarnings("unchecked")
  public static List<ExplodeConfig> fromList(@Nullable List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    List<ExplodeConfig> result = new ArrayList<ExplodeConfig>();
    for (Object item : list) {
      if (item instanceof String) {
        result.add(of((String) item));
      } else if (item instanceof Map) {
        Map<String, Object> map = (Map<String, Object>) item;
        Object field = map.get("field");
        if (!(field instanceof String)) {
          throw new IllegalArgumentException("Explode entry has no 'field': " + map);
        }
        result.add(of((String) field, (String) map.get("alias")));
      } else {
        throw new IllegalArgumentException("Unsupported explode entry: " + item);
      }
    }
    return result;
  }

  @Override public String toString() {
    return "ExplodeConfig{field=" + field + ", alias=" + alias + "}";
  }
}
