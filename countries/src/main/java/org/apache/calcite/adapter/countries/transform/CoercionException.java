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

import java.util.List;

/**
 * Thrown when normalized values cannot be cast to their declared column type
 * and the configured {@link CoercionFailureAction} is
 * {@link CoercionFailureAction#FAIL}.
 *
 * <p>Carries every failure of the batch, each with its row, column and
 * offending value.
 */
public class CoercionException extends TransformException {

  private static final long serialVersionUID = 1L;

  /** Number of failures spelled out in the message; the rest are counted. */
  private static final int MESSAGE_LIMIT = 10;

  private final ImmutableList<CoercionFailure> failures;

  public CoercionException(List<CoercionFailure> failures) {
    super(Stage.COERCION, describe(failures));
    this.failures = ImmutableList.copyOf(failures);
  }

  /**
   * Returns all coercion failures, ordered by row then column.
   */
  public List<CoercionFailure> getFailures() {
    return failures;
  }

  private static String describe(List<CoercionFailure> failures) {
    StringBuilder sb = new StringBuilder();
    sb.append(failures.size()).append(" value(s) could not be coerced");
    int shown = Math.min(failures.size(), MESSAGE_LIMIT);
    for (int i = 0; i < shown; i++) {
      sb.append("\n  - ").append(failures.get(i));
    }
    if (failures.size() > shown) {
      sb.append("\n  ... (").append(failures.size() - shown).append(" more)");
    }
    return sb.toString();
  }
}
