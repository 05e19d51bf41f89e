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
 * What the {@link TransformationPipeline} does with rows whose values cannot
 * be coerced to their declared column types.
 */
public enum CoercionFailureAction {
  /** Abort the whole batch with a {@link CoercionException}. */
  FAIL,
  /** Drop the failing rows, log each failure, keep the rest. */
  DROP_ROW,
  /** Replace each failing value with its column default. */
  USE_DEFAULT;

  /**
   * Parses an action from configuration ({@code fail}, {@code drop_row},
   * {@code dropRow}, {@code use_default}, ...).
   *
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static CoercionFailureAction fromString(String value) {
    if (value == null) {
      return FAIL;
    }
    String normalized = value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "fail":
        return FAIL;
      case "drop":
      case "droprow":
        return DROP_ROW;
      case "default":
      case "usedefault":
        return USE_DEFAULT;
      default:
        throw new IllegalArgumentException("Unknown coercion failure action: " + value);
    }
  }
}
