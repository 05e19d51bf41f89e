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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SchemaValidator.
 */
@Tag("unit")
public class SchemaValidatorTest {

  private static final SchemaValidator COUNTRIES =
      new SchemaValidator(TransformConfig.countries().getRequiredFields());

  @Test void testAllRequiredPathsPresent() {
    List<RawRecord> records = TestRecords.resource("countries-sample.json");
    ValidatedRecordSet validated = COUNTRIES.validate(records);

    assertEquals(records.size(), validated.size());
    assertSame(records.get(0), validated.get(0));
    assertEquals(
        Arrays.asList("name.common", "capital", "population", "area", "currencies",
            "languages"),
        validated.getRequiredPaths());
  }

  @Test void testPathPresentInOneRecordIsEnough() {
    SchemaValidator validator = new SchemaValidator(
        Arrays.asList(RequiredFieldConfig.of("currencies"), RequiredFieldConfig.of("capital")));
    List<RawRecord> records = TestRecords.parse(
        "[{'capital': ['A']},"
        + " {'capital': [], 'currencies': {'EUR': {'name': 'Euro'}}}]");

    assertEquals(2, validator.validate(records).size());
  }

  @Test void testNullValueCountsAsPresent() {
    SchemaValidator validator =
        new SchemaValidator(Collections.singletonList(RequiredFieldConfig.of("currencies")));
    List<RawRecord> records = TestRecords.parse("[{'currencies': null}]");

    assertEquals(1, validator.validate(records).size());
  }

  @Test void testEveryMissingPathIsReported() {
    List<RawRecord> records = TestRecords.parse(
        "[{'name': {'common': 'Testland'}, 'capital': [], 'population': 1, 'area': 1.0}]");

    SchemaValidationException e =
        assertThrows(SchemaValidationException.class, () -> COUNTRIES.validate(records));
    assertEquals(Arrays.asList("currencies", "languages"), e.getMissingPaths());
    assertEquals(TransformException.Stage.VALIDATION, e.getStage());
    assertTrue(e.getMessage().contains("currencies"));
    assertTrue(e.getMessage().contains("languages"));
  }

  @Test void testNestedPathMissing() {
    List<RawRecord> records = TestRecords.parse(
        "[{'name': {'official': 'Republic of Testland'}, 'capital': [], 'population': 1,"
        + " 'area': 1.0, 'currencies': {}, 'languages': {}}]");

    SchemaValidationException e =
        assertThrows(SchemaValidationException.class, () -> COUNTRIES.validate(records));
    assertEquals(Collections.singletonList("name.common"), e.getMissingPaths());
  }

  @Test void testEmptyCollectionIsDistinctFromSchemaFailure() {
    EmptyDatasetException e = assertThrows(EmptyDatasetException.class,
        () -> COUNTRIES.validate(Collections.<RawRecord>emptyList()));
    assertEquals(TransformException.Stage.VALIDATION, e.getStage());
  }

  @Test void testKindMismatchDoesNotFail() {
    SchemaValidator validator = new SchemaValidator(
        Collections.singletonList(
            RequiredFieldConfig.of("population", RequiredFieldConfig.FieldKind.NUMBER)));
    List<RawRecord> records = TestRecords.parse("[{'population': 'many'}]");

    assertEquals(1, validator.validate(records).size());
  }

  @Test void testFieldKindMatching() {
    assertTrue(RequiredFieldConfig.FieldKind.OBJECT.matches(Collections.emptyMap()));
    assertTrue(RequiredFieldConfig.FieldKind.ARRAY.matches(Collections.emptyList()));
    assertTrue(RequiredFieldConfig.FieldKind.NUMBER.matches(12.5d));
    assertTrue(RequiredFieldConfig.FieldKind.STRING.matches("x"));
    assertTrue(RequiredFieldConfig.FieldKind.ANY.matches(true));
    assertEquals(RequiredFieldConfig.FieldKind.OBJECT,
        RequiredFieldConfig.FieldKind.fromString("map"));
    assertEquals(RequiredFieldConfig.FieldKind.ANY,
        RequiredFieldConfig.FieldKind.fromString(null));
  }
}
