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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves every column of a flat row to a non-null value.
 *
 * <p>Each column is the coalesce of its candidate sources, evaluated left to
 * right, with the column's declared default as the last candidate. Since
 * every {@link ColumnConfig} must declare a non-null default, no column of a
 * normalized row is null.
 */
public class FieldNormalizer {

  private final ImmutableList<ColumnConfig> columns;

  public FieldNormalizer(List<ColumnConfig> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  /**
   * Normalizes rows coming out of the {@link StructuralFlattener}.
   *
   * @param rows Rows keyed by source expression
   * @param parallel Whether to use a parallel stream; order is preserved
   * @return Rows keyed by column name, in column order
   */
  public List<FlatRow> normalize(List<FlatRow> rows, boolean parallel) {
    return (parallel ? rows.parallelStream() : rows.stream())
        .map(this::normalize)
        .collect(Collectors.toList());
  }

  /**
   * Normalizes one row.
   */
  public FlatRow normalize(FlatRow row) {
    Map<String, Object> values = new LinkedHashMap<String, Object>();
    for (ColumnConfig column : columns) {
      values.put(column.getName(), coalesce(row, column));
    }
    return row.withValues(values);
  }

  /**
   * Returns the first non-null candidate source of a column, or its default.
   */
  static Object coalesce(FlatRow row, ColumnConfig column) {
    for (String source : column.getSources()) {
      Object value = row.get(source);
      if (value != null) {
        return value;
      }
    }
    return column.getDefaultValue();
  }
}
