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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of {@link TypeCoercer#coerce}.
 *
 * <p>Keeps one slot per input row, in order. A slot is empty when at least
 * one of the row's values failed; the failures say which columns.
 */
public class CoercionResult {

  private final List<@Nullable FinalRow> rows;
  private final ImmutableList<CoercionFailure> failures;

  CoercionResult(List<@Nullable FinalRow> rows, List<CoercionFailure> failures) {
    this.rows = Collections.unmodifiableList(new ArrayList<@Nullable FinalRow>(rows));
    this.failures = ImmutableList.copyOf(failures);
  }

  /**
   * Returns the number of input rows.
   */
  public int size() {
    return rows.size();
  }

  /**
   * Returns the coerced row at a position, or null if that row failed.
   */
  public @Nullable FinalRow getRow(int rowIndex) {
    return rows.get(rowIndex);
  }

  /**
   * Returns the rows that coerced cleanly, in order.
   */
  public List<FinalRow> getCoercedRows() {
    List<FinalRow> result = new ArrayList<FinalRow>(rows.size());
    for (FinalRow row : rows) {
      if (row != null) {
        result.add(row);
      }
    }
    return result;
  }

  public List<CoercionFailure> getFailures() {
    return failures;
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /**
   * Returns the positions of the rows with at least one failure.
   */
  public Set<Integer> getFailedRowIndexes() {
    Set<Integer> indexes = new LinkedHashSet<Integer>();
    for (CoercionFailure failure : failures) {
      indexes.add(failure.getRowIndex());
    }
    return indexes;
  }

  @Override public String toString() {
    return "CoercionResult{rows=" + rows.size() + ", failures=" + failures.size() + "}";
  }
}
