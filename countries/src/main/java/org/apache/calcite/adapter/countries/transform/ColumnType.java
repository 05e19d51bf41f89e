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

import java.util.Locale;

/**
 * Semantic type of an output column.
 *
 * <p>Each type maps to exactly one Java class in a {@link FinalRow}, whatever
 * the range of the input values:
 * <ul>
 *   <li>{@link #TEXT} - {@link String}</li>
 *   <li>{@link #INTEGER} - {@link Long} (64-bit)</li>
 *   <li>{@link #REAL} - {@link Double}</li>
 * </ul>
 */
public enum ColumnType {
  TEXT(String.class),
  INTEGER(Long.class),
  REAL(Double.class);

  private final Class<?> javaClass;

  ColumnType(Class<?> javaClass) {
    this.javaClass = javaClass;
  }

  /**
   * Returns the Java class of values of this type in a {@link FinalRow}.
   */
  public Class<?> getJavaClass() {
    return javaClass;
  }

  /**
   * Parses a type name from configuration.
   *
   * <p>Accepts the canonical names plus common SQL aliases
   * ({@code varchar}, {@code bigint}, {@code double}, ...).
   *
   * @param value Type name, case-insensitive
   * @return The column type
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static ColumnType fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Column type is required");
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "text":
      case "string":
      case "varchar":
        return TEXT;
      case "integer":
      case "int":
      case "bigint":
      case "long":
        return INTEGER;
      case "real":
      case "double":
      case "float":
      case "decimal":
        return REAL;
      default:
        throw new IllegalArgumentException("Unknown column type: " + value);
    }
  }
}
