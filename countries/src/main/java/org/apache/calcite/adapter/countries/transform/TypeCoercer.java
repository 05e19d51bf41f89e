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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Casts normalized columns to their declared {@link ColumnType}.
 *
 * <h3>Conversion Rules</h3>
 * <ul>
 *   <li>INTEGER - integral numbers as-is; fractional numbers and numeric
 *       strings are truncated toward zero. Booleans, containers, non-numeric
 *       text, non-finite numbers and values outside the 64-bit range fail.</li>
 *   <li>REAL - any finite number or numeric string.</li>
 *   <li>TEXT - strings as-is; numbers in plain decimal form without trailing
 *       zeros ({@code 1000.0} becomes {@code "1000"}); booleans as
 *       {@code true}/{@code false}; objects and arrays as compact JSON.</li>
 * </ul>
 *
 * <p>The coercer never throws for bad data. Every failing value is reported
 * as a {@link CoercionFailure} in the {@link CoercionResult}, and the caller
 * decides whether to drop the row or halt the batch.
 */
public class TypeCoercer {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final ImmutableList<ColumnConfig> columns;
  private final ImmutableList<String> columnNames;

  public TypeCoercer(List<ColumnConfig> columns) {
    this.columns = ImmutableList.copyOf(columns);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (ColumnConfig column : columns) {
      names.add(column.getName());
    }
    this.columnNames = names.build();
  }

  /**
   * Coerces normalized rows.
   *
   * @param rows Rows keyed by column name
   * @param parallel Whether to use a parallel stream; order is preserved
   * @return Coerced rows and the failures, if any
   */
  public CoercionResult coerce(List<FlatRow> rows, boolean parallel) {
    IntStream indexes = IntStream.range(0, rows.size());
    if (parallel) {
      indexes = indexes.parallel();
    }
    List<RowOutcome> outcomes = indexes
        .mapToObj(i -> coerceRow(i, rows.get(i)))
        .collect(Collectors.toList());

    List<@Nullable FinalRow> coerced = new ArrayList<@Nullable FinalRow>(outcomes.size());
    List<CoercionFailure> failures = new ArrayList<CoercionFailure>();
    for (RowOutcome outcome : outcomes) {
      coerced.add(outcome.row);
      failures.addAll(outcome.failures);
    }
    return new CoercionResult(coerced, failures);
  }

  /**
   * Coerces one row, replacing each value that cannot be cast with the
   * column default.
   */
  public FinalRow coerceWithDefaults(FlatRow row) {
    List<Object> values = new ArrayList<Object>(columns.size());
    for (ColumnConfig column : columns) {
      Object value = row.get(column.getName());
      try {
        values.add(value == null ? column.getDefaultValue() : convert(column.getType(), value));
      } catch (IllegalArgumentException e) {
        values.add(column.getDefaultValue());
      }
    }
    return new FinalRow(columnNames, values, row.getRecordIndex());
  }

  private RowOutcome coerceRow(int rowIndex, FlatRow row) {
    List<Object> values = new ArrayList<Object>(columns.size());
    List<CoercionFailure> failures = null;
    for (ColumnConfig column : columns) {
      Object value = row.get(column.getName());
      try {
        if (value == null) {
          throw new IllegalArgumentException("value is null after normalization");
        }
        values.add(convert(column.getType(), value));
      } catch (IllegalArgumentException e) {
        if (failures == null) {
          failures = new ArrayList<CoercionFailure>(2);
        }
        failures.add(
            new CoercionFailure(rowIndex, row.getRecordIndex(), column.getName(),
                column.getType(), value, e.getMessage()));
      }
    }
    if (failures != null) {
      return new RowOutcome(null, failures);
    }
    return new RowOutcome(new FinalRow(columnNames, values, row.getRecordIndex()),
        Collections.<CoercionFailure>emptyList());
  }

  /**
   * Converts a non-null value to the canonical Java type of a column type.
   *
   * @throws IllegalArgumentException if the value cannot be converted
   */
  public static Object convert(ColumnType type, Object value) {
    switch (type) {
      case TEXT:
        return toText(value);
      case INTEGER:
        return toInteger(value);
      case REAL:
        return toReal(value);
      default:
        throw new IllegalArgumentException("Unsupported column type: " + type);
    }
  }

  private static String toText(Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return value.toString();
      }
      return decimal(value).stripTrailingZeros().toPlainString();
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).stripTrailingZeros().toPlainString();
    }
    if (value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    if (value instanceof Map || value instanceof List) {
      try {
        return OBJECT_MAPPER.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("cannot render as JSON: " + e.getMessage(), e);
      }
    }
    return value.toString();
  }

  private static Long toInteger(Object value) {
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    try {
      return decimal(value).setScale(0, RoundingMode.DOWN).longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("out of 64-bit integer range", e);
    }
  }

  private static Double toReal(Object value) {
    double d;
    if (value instanceof Double || value instanceof Float || value instanceof Long
        || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      d = ((Number) value).doubleValue();
    } else {
      d = decimal(value).doubleValue();
    }
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new IllegalArgumentException("not a finite number");
    }
    return d;
  }

  private static BigDecimal decimal(Object value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("not a finite number");
      }
      return new BigDecimal(value.toString());
    }
    if (value instanceof Number) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if (text.isEmpty()) {
        throw new IllegalArgumentException("empty text is not numeric");
      }
      try {
        return new BigDecimal(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("text is not numeric", e);
      }
    }
    throw new IllegalArgumentException(value.getClass().getSimpleName() + " is not numeric");
  }

  /** Coercion outcome of one row; {@code row} is null when anything failed. */
  private static class RowOutcome {
    final @Nullable FinalRow row;
    final List<CoercionFailure> failures;

    RowOutcome(@Nullable FinalRow row, List<CoercionFailure> failures) {
      this.row = row;
      this.failures = failures;
    }
  }
}
