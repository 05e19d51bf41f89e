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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entity as parsed from the source document.
 *
 * <p>A RawRecord is a tree of scalars, objects ({@link Map}) and arrays
 * ({@link List}). Fields may be absent or null. The tree is copied on
 * construction and every nested container is unmodifiable, so a record can be
 * shared freely between worker threads.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RawRecord record = RawRecord.of(parsedJsonObject);
 * Object common = record.get("name.common");
 * Object capital = record.get("capital[0]");
 * }</pre>
 *
 * @see RecordPath
 */
public final class RawRecord {

  private final Map<String, Object> fields;

  private RawRecord(Map<String, Object> fields) {
    this.fields = fields;
  }

  /**
   * Creates a record from a parsed JSON object.
   *
   * @param fields Field name to value; nested maps and lists are copied
   * @return Immutable record
   */
  public static RawRecord of(Map<String, ?> fields) {
    Preconditions.checkNotNull(fields, "fields");
    return new RawRecord(freezeMap(fields));
  }

  /**
   * Creates one record per parsed JSON object, preserving order.
   */
  public static List<RawRecord> listOf(List<? extends Map<String, ?>> objects) {
    List<RawRecord> records = new ArrayList<RawRecord>(objects.size());
    for (Map<String, ?> object : objects) {
      records.add(of(object));
    }
    return Collections.unmodifiableList(records);
  }

  /**
   * Returns the top-level fields (unmodifiable).
   */
  public Map<String, Object> getFields() {
    return fields;
  }

  /**
   * Resolves a dotted path such as {@code name.common} or {@code capital[0]}.
   *
   * @return The value, or null if any step of the path is absent
   */
  public @Nullable Object get(String path) {
    return RecordPath.parse(path).resolve(fields);
  }

  /**
   * Returns whether the full key chain of a path exists (the value may be null).
   */
  public boolean has(String path) {
    return RecordPath.parse(path).isPresentIn(fields);
  }

  @Override public boolean equals(Object o) {
    return o == this || o instanceof RawRecord && fields.equals(((RawRecord) o).fields);
  }

  @Override public int hashCode() {
    return fields.hashCode();
  }

  @Override public String toString() {
    return "RawRecord" + fields;
  }

  private static Map<String, Object> freezeMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<String, Object>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static @Nullable Object freeze(@Nullable Object value) {
    if (value instanceof Map) {
      return freezeMap((Map<?, ?>) value);
    }
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      List<Object> copy = new ArrayList<Object>(list.size());
      for (Object item : list) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
