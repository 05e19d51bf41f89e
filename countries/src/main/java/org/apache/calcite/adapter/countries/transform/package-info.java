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

/**
 * Transformation of a semi-structured document into a typed flat table.
 *
 * <h2>Stages</h2>
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.countries.transform.SchemaValidator} - Fails fast
 *       when required field paths are missing</li>
 *   <li>{@link org.apache.calcite.adapter.countries.transform.StructuralFlattener} - Outer
 *       expansion of map and array fields into rows</li>
 *   <li>{@link org.apache.calcite.adapter.countries.transform.FieldNormalizer} - Coalesce
 *       of candidate sources with per-column defaults</li>
 *   <li>{@link org.apache.calcite.adapter.countries.transform.TypeCoercer} - Casts to TEXT,
 *       INTEGER or REAL</li>
 *   <li>{@link org.apache.calcite.adapter.countries.transform.TransformationPipeline} - Runs
 *       the four stages in order, atomically</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>{@link org.apache.calcite.adapter.countries.transform.TransformConfig} holds the
 * required paths, explodable fields, column defaults and column types. The
 * configuration for the countries document ships as
 * {@code countries-transform.yaml}.
 */
package org.apache.calcite.adapter.countries.transform;
