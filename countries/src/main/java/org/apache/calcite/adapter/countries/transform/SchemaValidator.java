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
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Gate that checks a record collection against the required field paths
 * before any transformation runs.
 *
 * <p>The check is over the collection's structural schema: a path passes if
 * at least one record declares it, even with a null value. A path missing
 * from every record fails the whole batch, and all such paths are reported
 * together.
 *
 * <p>Expected {@link RequiredFieldConfig.FieldKind kinds} are advisory: a
 * record whose value has another kind produces one warning per path and
 * validation continues.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * SchemaValidator validator = new SchemaValidator(config.getRequiredFields());
 * ValidatedRecordSet validated = validator.validate(records);
 * }</pre>
 */
public class SchemaValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaValidator.class);

  private final ImmutableList<RequiredFieldConfig> requiredFields;

  public SchemaValidator(List<RequiredFieldConfig> requiredFields) {
    this.requiredFields = ImmutableList.copyOf(requiredFields);
  }

  /**
   * Validates a record collection.
   *
   * @param records Records from the extraction step
   * @return The same records, tagged as validated
   * @throws EmptyDatasetException if there are no records
   * @throws SchemaValidationException if any required path is absent from all records
   */
  public ValidatedRecordSet validate(List<RawRecord> records) {
    Preconditions.checkNotNull(records, "records");
    if (records.isEmpty()) {
      throw new EmptyDatasetException();
    }
    LOGGER.debug("Validating {} records against {} required paths",
        records.size(), requiredFields.size());

    List<String> missing = new ArrayList<String>();
    List<String> required = new ArrayList<String>();
    for (RequiredFieldConfig field : requiredFields) {
      String path = field.getPath().getExpression();
      required.add(path);
      if (!isPresent(field, records)) {
        missing.add(path);
        continue;
      }
      checkKind(field, records);
    }

    if (!missing.isEmpty()) {
      LOGGER.error("Schema validation failed, missing required fields: {}", missing);
      throw new SchemaValidationException(missing);
    }
    LOGGER.info("Schema validation passed for {} records", records.size());
    return new ValidatedRecordSet(records, required);
  }

  private static boolean isPresent(RequiredFieldConfig field, List<RawRecord> records) {
    for (RawRecord record : records) {
      if (field.getPath().isPresentIn(record.getFields())) {
        return true;
      }
    }
    return false;
  }

  private static void checkKind(RequiredFieldConfig field, List<RawRecord> records) {
    if (field.getKind() == RequiredFieldConfig.FieldKind.ANY) {
      return;
    }
    for (int i = 0; i < records.size(); i++) {
      Object value = field.getPath().resolve(records.get(i));
      if (value != null && !field.getKind().matches(value)) {
        LOGGER.warn("Field '{}' has kind {} in record {}, expected {}. Continuing.",
            field.getPath(), RequiredFieldConfig.FieldKind.of(value), i, field.getKind());
        return;
      }
    }
  }
}
