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
package org.apache.calcite.adapter.countries.etl;

import org.apache.calcite.adapter.countries.transform.RawRecord;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the raw records of one document to the transformation.
 *
 * @see JsonDocumentSource
 */
@FunctionalInterface
public interface DocumentSource {

  /**
   * Fetches and parses the document.
   *
   * @return Records in document order
   * @throws IOException If the document cannot be read or parsed
   */
  List<RawRecord> fetch() throws IOException;
}
