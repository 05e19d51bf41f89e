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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flat row between the flattener and the coercer.
 *
 * <p>Out of the {@link StructuralFlattener} the values are keyed by source
 * expression ({@code name.common}, {@code currency.key}, ...); out of the
 * {@link FieldNormalizer} they are keyed by column name. Values may be null.
 * The row remembers which input record it came from and its position among
 * that record's rows.
 */
public final class FlatRow {

  private final int recordIndex;
  private final int ordinal;
  private final Map<String, Object> values;

  public FlatRow(int recordIndex, int ordinal, Map<String, ?> values) {
    this.recordIndex = recordIndex;
    this.ordinal = ordinal;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
  }

  /**
   * Returns the 0-based position of the source record in the input collection.
   */
  public int getRecordIndex() {
    return recordIndex;
  }

  /**
   * Returns the 0-based position of this row among the rows of its record.
   */
  public int getOrdinal() {
    return ordinal;
  }

  /**
   * Returns all values (unmodifiable, may contain nulls).
   */
  public Map<String, Object> getValues() {
    return values;
  }

  public @Nullable Object get(String key) {
    return values.get(key);
  }

  /**
   * Returns a row with the same provenance and different values.
   */
  public FlatRow withValues(Map<String, ?> newValues) {
    return new FlatRow(recordIndex, ordinal, newValues);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlatRow)) {
      return false;
    }
    FlatRow that = (FlatRow) o;
    return recordIndex == that.recordIndex
        && ordinal == that.ordinal
        && values.equals(that.values);
  }

  @Override public int hashCode() {
    return (recordIndex * 31 + ordinal) * 31 + values.hashCode();
  }

  @Override public String toString() {
    return "FlatRow{record=" + recordIndex + ", ordinal=" + ordinal + ", values=" + values + "}";
  }
}
