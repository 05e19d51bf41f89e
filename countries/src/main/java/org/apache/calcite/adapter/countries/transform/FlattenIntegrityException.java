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
 * Thrown when an explosion step produced no row for a record.
 *
 * <p>Outer expansion always yields at least one row per record, so this
 * signals a bug in the flattener rather than bad input data.
 */
public class FlattenIntegrityException extends TransformException {

  private static final long serialVersionUID = 1L;

  private final int recordIndex;

  public FlattenIntegrityException(int recordIndex, String detail) {
    super(Stage.FLATTEN, "Record " + recordIndex + " was dropped during flattening: " + detail);
    this.recordIndex = recordIndex;
  }

  /**
   * Creates a failure that concerns the batch rather than a single record.
   */
  public FlattenIntegrityException(String detail) {
    super(Stage.FLATTEN, "Flattening dropped records: " + detail);
    this.recordIndex = -1;
  }

  /**
   * Returns the position of the dropped record in the input collection,
   * or -1 if the failure concerns the whole batch.
   */
  public int getRecordIndex() {
    return recordIndex;
  }
}
