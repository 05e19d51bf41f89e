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
import java.util.List;

/**
 * The finalized table handed to the load step.
 *
 * <p>Column definitions and rows are both immutable and ordered. Two tables
 * are equal when their columns and rows are equal, and
 * {@link #toDelimitedText()} renders the table deterministically, so two runs
 * over the same input can be compared byte for byte.
 */
public final class FinalTable {

  private final ImmutableList<ColumnConfig> columns;
  private final ImmutableList<FinalRow> rows;

  public FinalTable(List<ColumnConfig> columns, List<FinalRow> rows) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<String>(columns.size());
    for (ColumnConfig column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  public List<FinalRow> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Returns all values of one column, in row order.
   */
  public List<Object> column(String name) {
    List<Object> values = new ArrayList<Object>(rows.size());
    for (FinalRow row : rows) {
      values.add(row.get(name));
    }
    return values;
  }

  /**
   * Renders the table as tab-separated text with a header line.
   * Tabs, newlines and backslashes inside text values are escaped.
   */
  public String toDelimitedText() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.join("\t", getColumnNames())).append('\n');
    for (FinalRow row : rows) {
      List<Object> values = row.getValues();
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          sb.append('\t');
        }
        sb.append(escape(values.get(i).toString()));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\")
        .replace("\t", "\\t")
        .replace("\n", "\\n")
        .replace("\r", "\\r");
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FinalTable)) {
      return false;
    }
    FinalTable that = (FinalTable) o;
    return getColumnNames().equals(that.getColumnNames()) && rows.equals(that.rows);
  }

  @Override public int hashCode() {
    return getColumnNames().hashCode() * 31 + rows.hashCode();
  }

  @Override public String toString() {
    return "FinalTable{columns=" + getColumnNames() + ", rows=" + rows.size() + "}";
  }
}
