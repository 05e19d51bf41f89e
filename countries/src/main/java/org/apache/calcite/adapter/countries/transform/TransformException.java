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

/**
 * Base class for failures raised by the {@link TransformationPipeline}.
 *
 * <p>Every failure carries the {@link Stage} that raised it so the caller can
 * tell a schema problem from bad data or an implementation bug without
 * re-running the transformation.
 *
 * @see EmptyDatasetException
 * @see SchemaValidationException
 * @see FlattenIntegrityException
 * @see CoercionException
 */
public class TransformException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Stages of the transformation, in execution order.
   */
  public enum Stage {
    /** Required field presence checks. */
    VALIDATION,
    /** Outer expansion of explodable fields. */
    FLATTEN,
    /** Null substitution with column defaults. */
    NORMALIZE,
    /** Casting columns to their declared types. */
    COERCION
  }

  private final Stage stage;

  protected TransformException(Stage stage, String message) {
    super("[" + stage + "] " + message);
    this.stage = stage;
  }

  /**
   * Returns the stage that raised this failure.
   */
  public Stage getStage() {
    return stage;
  }
}
