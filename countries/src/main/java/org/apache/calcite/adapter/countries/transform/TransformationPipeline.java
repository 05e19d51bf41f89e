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

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns raw records into a finalized table.
 *
 * <p>TransformationPipeline runs four stages strictly in order:
 * <ol>
 *   <li>Validation - required field paths must be present
 *       ({@link SchemaValidator})</li>
 *   <li>Flattening - explodable fields are outer-expanded into flat rows
 *       ({@link StructuralFlattener})</li>
 *   <li>Normalization - each column takes its first non-null source or its
 *       default ({@link FieldNormalizer})</li>
 *   <li>Coercion - each column is cast to its declared type
 *       ({@link TypeCoercer})</li>
 * </ol>
 *
 * <p>The pipeline is atomic: it returns a complete table or throws a
 * {@link TransformException}, never a partial table. It holds no mutable
 * state, so the same instance may be reused and re-running it on the same
 * records gives an equal table.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TransformationPipeline pipeline = new TransformationPipeline(TransformConfig.countries());
 * FinalTable table = pipeline.transform(records);
 * }</pre>
 *
 * <h3>Coercion Failures</h3>
 * <p>Handled according to {@link TransformConfig#getCoercionFailureAction()}:
 * <ul>
 *   <li>{@code FAIL} - throw {@link CoercionException} with every failure</li>
 *   <li>{@code DROP_ROW} - drop the failing rows, logging each failure</li>
 *   <li>{@code USE_DEFAULT} - substitute the column default for each failing value</li>
 * </ul>
 *
 * @see TransformConfig
 * @see FinalTable
 */
public class TransformationPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransformationPipeline.class);

  private final TransformConfig config;
  private final SchemaValidator validator;
  private final StructuralFlattener flattener;
  private final FieldNormalizer normalizer;
  private final TypeCoercer coercer;

  /**
   * Creates a pipeline for a configuration.
   *
   * @param config Transformation configuration
   */
  public TransformationPipeline(TransformConfig config) {
    this.config = Preconditions.checkNotNull(config, "config");
    this.validator = new SchemaValidator(config.getRequiredFields());
    this.flattener = StructuralFlattener.create(config);
    this.normalizer = new FieldNormalizer(config.getColumns());
    this.coercer = new TypeCoercer(config.getColumns());
  }

  public TransformConfig getConfig() {
    return config;
  }

  /**
   * Transforms raw records into a finalized table.
   *
   * @param records Records from the extraction step
   * @return The complete table
   * @throws EmptyDatasetException if there are no records
   * @throws SchemaValidationException if required paths are missing
   * @throws FlattenIntegrityException if flattening dropped a record
   * @throws CoercionException if values cannot be coerced and the action is FAIL
   */
  public FinalTable transform(List<RawRecord> records) {
    String name = config.getName();
    boolean parallel = config.isParallel();
    long startTime = System.currentTimeMillis();
    LOGGER.info("Starting transformation '{}'", name);

    try {
      // Phase 1: Validate
      LOGGER.info("Phase 1: Validating {} required fields", config.getRequiredFields().size());
      ValidatedRecordSet validated = validator.validate(records);

      // Phase 2: Flatten
      LOGGER.info("Phase 2: Flattening {} records over {} explodable fields",
          validated.size(), config.getExplodes().size());
      List<FlatRow> flatRows = flattener.flatten(validated, parallel);
      LOGGER.info("Flattened {} records into {} rows", validated.size(), flatRows.size());

      // Phase 3: Normalize
      LOGGER.info("Phase 3: Normalizing {} columns", config.getColumns().size());
      List<FlatRow> normalized = normalizer.normalize(flatRows, parallel);

      // Phase 4: Coerce
      LOGGER.info("Phase 4: Coercing columns to {}", config.getTypes());
      CoercionResult coercion = coercer.coerce(normalized, parallel);
      List<FinalRow> rows = applyFailureAction(coercion, normalized);

      if (config.isDistinct()) {
        int before = rows.size();
        rows = new ArrayList<FinalRow>(new LinkedHashSet<FinalRow>(rows));
        LOGGER.info("Removed {} duplicate rows", before - rows.size());
      }
      reportNegativeValues(rows);

      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.info("Transformation '{}' complete: {} records -> {} rows in {}ms",
          name, validated.size(), rows.size(), elapsed);
      return new FinalTable(config.getColumns(), rows);
    } catch (TransformException e) {
      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.error("Transformation '{}' failed at stage {} after {}ms: {}",
          name, e.getStage(), elapsed, e.getMessage());
      throw e;
    }
  }

  private List<FinalRow> applyFailureAction(CoercionResult coercion, List<FlatRow> normalized) {
    if (!coercion.hasFailures()) {
      return coercion.getCoercedRows();
    }

    switch (config.getCoercionFailureAction()) {
      case DROP_ROW:
        for (CoercionFailure failure : coercion.getFailures()) {
          LOGGER.warn("Dropping row: {}", failure);
        }
        LOGGER.warn("Dropped {} of {} rows with coercion failures",
            coercion.getFailedRowIndexes().size(), coercion.size());
        return coercion.getCoercedRows();

      case USE_DEFAULT:
        List<FinalRow> rows = new ArrayList<FinalRow>(coercion.size());
        for (int i = 0; i < coercion.size(); i++) {
          FinalRow row = coercion.getRow(i);
          rows.add(row != null ? row : coercer.coerceWithDefaults(normalized.get(i)));
        }
        LOGGER.warn("Substituted defaults for {} values that could not be coerced",
            coercion.getFailures().size());
        return rows;

      case FAIL:
      default:
        throw new CoercionException(coercion.getFailures());
    }
  }

  private void reportNegativeValues(List<FinalRow> rows) {
    for (String column : config.getNonNegativeColumns()) {
      long negative = 0;
      for (FinalRow row : rows) {
        Object value = row.get(column);
        if (value instanceof Number && ((Number) value).doubleValue() < 0) {
          negative++;
        }
      }
      if (negative > 0) {
        LOGGER.warn("Found {} rows with negative '{}'", negative, column);
      }
    }
  }
}
