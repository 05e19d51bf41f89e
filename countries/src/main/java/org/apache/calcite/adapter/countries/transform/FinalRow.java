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
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully validated, flattened, normalized and coerced row.
 *
 * <p>Values are held in column order in an immutable list that rejects nulls,
 * so a FinalRow cannot carry a null. Each value is an instance of its column
 * type's Java class ({@link String}, {@link Long} or {@link Double}).
 *
 * <p>Equality is by column names and values; the originating record index is
 * provenance only.
 */
public final class FinalRow {

  private final ImmutableList<String> columns;
  private final ImmutableList<Object> values;
  private final int recordIndex;

  FinalRow(List<String> columns, List<Object> values, int recordIndex) {
    Preconditions.checkArgument(columns.size() == values.size(),
        "%s columns but %s values", columns.size(), values.size());
    this.columns = ImmutableList.copyOf(columns);
    this.values = ImmutableList.copyOf(values);
    this.recordIndex = recordIndex;
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Object> getValues() {
    return values;
  }

  /**
   * Returns the 0-based position of the source record in the input collection.
   */
  public int getRecordIndex() {
    return recordIndex;
  }

  /**
   * Returns the value of a column.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  public Object get(String column) {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown column: " + column);
    }
    return values.get(index);
  }

  public String getString(String column) {
    return (String) get(column);
  }

  public long getLong(String column) {
    return (Long) get(column);
  }

  public double getDouble(String column) {
    return (Double) get(column);
  }

  /**
   * Returns the row as a column-ordered map.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    for (int i = 0; i < columns.size(); i++) {
      map.put(columns.get(i), values.get(i));
    }
    return map;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FinalRow)) {
      return false;
    }
    FinalRow that = (FinalRow) o;
    return columns.equals(that.columns) && values.equals(that.values);
  }

  @Override public int hashCode() {
    return columns.hashCode() * 31 + values.hashCode();
  }

  @Override public String toString() {
    return "FinalRow" + toMap();
  }
}
