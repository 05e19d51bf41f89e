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

import java.util.Objects;

/**
 * One value that could not be cast to its column's declared type.
 *
 * <p>Identifies the row by its position in the flattened table and by the
 * input record it came from, so the caller can decide whether to drop the
 * row or halt the batch.
 *
 * @see TypeCoercer
 * @see CoercionException
 */
public class CoercionFailure {

  private final int rowIndex;
  private final int recordIndex;
  private final String column;
  private final ColumnType type;
  private final @Nullable Object value;
  private final String reason;

  public CoercionFailure(int rowIndex, int recordIndex, String column, ColumnType type,
      @Nullable Object value, String reason) {
    this.rowIndex = rowIndex;
    this.recordIndex = recordIndex;
    this.column = Objects.requireNonNull(column, "column");
    this.type = Objects.requireNonNull(type, "type");
    this.value = value;
    this.reason = reason;
  }

  /**
   * Returns the 0-based position of the row in the flattened table.
   */
  public int getRowIndex() {
    return rowIndex;
  }

  /**
   * Returns the 0-based position of the source record in the input collection.
   */
  public int getRecordIndex() {
    return recordIndex;
  }

  public String getColumn() {
    return column;
  }

  public ColumnType getType() {
    return type;
  }

  /**
   * Returns the offending value as it was after normalization.
   */
  public @Nullable Object getValue() {
    return value;
  }

  public String getReason() {
    return reason;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CoercionFailure)) {
      return false;
    }
    CoercionFailure that = (CoercionFailure) o;
    return rowIndex == that.rowIndex
        && recordIndex == that.recordIndex
        && column.equals(that.column)
        && type == that.type
        && Objects.equals(value, that.value)
        && Objects.equals(reason, that.reason);
  }

  @Override public int hashCode() {
    return Objects.hash(rowIndex, recordIndex, column, type, value, reason);
  }

  @Override public String toString() {
    return "row " + rowIndex + " (record " + recordIndex + ") column '" + column
        + "': cannot convert '" + value + "' to " + type + ": " + reason;
  }
}
