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
 * Thrown when one or more required field paths are missing from the
 * structural schema of a record collection.
 *
 * <p>The exception lists every missing path, not only the first, so one run
 * surfaces all schema drift at once.
 */
public class SchemaValidationException extends TransformException {

  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> missingPaths;

  public SchemaValidationException(List<String> missingPaths) {
    super(Stage.VALIDATION, "Required field(s) not found in source schema: " + missingPaths);
    this.missingPaths = ImmutableList.copyOf(missingPaths);
  }

  /**
   * Returns the required paths that no record contains, in declaration order.
   */
  public List<String> getMissingPaths() {
    return missingPaths;
  }
}
