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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TransformationPipeline over the countries configuration.
 */
@Tag("unit")
public class TransformationPipelineTest {

  private static final String TESTLAND = "{'name': {'common': 'Testland'}, 'capital': [],"
      + " 'population': 1000, 'area': 12.5, 'currencies': {},"
      + " 'languages': {'tst': 'Testish'}}";

  private final TransformationPipeline pipeline =
      new TransformationPipeline(TransformConfig.countries());

  @Test void testSingleRecordWithEmptyCurrencies() {
    FinalTable table = pipeline.transform(TestRecords.parse("[" + TESTLAND + "]"));

    assertEquals(1, table.size());
    Map<String, Object> expected = new LinkedHashMap<String, Object>();
    expected.put("country_name", "Testland");
    expected.put("capital", "N/A");
    expected.put("population", 1000L);
    expected.put("area", 12.5d);
    expected.put("currency_code", "N/A");
    expected.put("currency_name", "N/A");
    expected.put("language_code", "tst");
    expected.put("language_name", "Testish");
    assertEquals(expected, table.getRows().get(0).toMap());
  }

  @Test void testTwoCurrenciesOneLanguage() {
    FinalTable table = pipeline.transform(TestRecords.parse(
        "[{'name': {'common': 'Panama'}, 'capital': ['Panama City'],"
        + " 'population': 4314768, 'area': 75417.0,"
        + " 'currencies': {'PAB': {'name': 'Panamanian balboa', 'symbol': 'B/.'},"
        + "                'USD': {'name': 'United States dollar', 'symbol': '$'}},"
        + " 'languages': {'spa': 'Spanish'}}]"));

    assertEquals(2, table.size());
    FinalRow first = table.getRows().get(0);
    FinalRow second = table.getRows().get(1);
    assertEquals("PAB", first.getString("currency_code"));
    assertEquals("Panamanian balboa", first.getString("currency_name"));
    assertEquals("USD", second.getString("currency_code"));
    assertEquals("United States dollar", second.getString("currency_name"));
    for (String column : table.getColumnNames()) {
      if (!column.startsWith("currency_")) {
        assertEquals(first.get(column), second.get(column), column);
      }
    }
    assertEquals("spa", second.getString("language_code"));
    assertEquals("Spanish", second.getString("language_name"));
  }

  @Test void testSampleDocument() {
    FinalTable table = pipeline.transform(TestRecords.resource("countries-sample.json"));

    assertEquals(8, table.size());
    assertEquals(
        Arrays.<Object>asList("Switzerland", "Switzerland", "Switzerland", "Switzerland",
            "Panama", "Panama", "Antarctica", "Bouvet Island"),
        table.column("country_name"));

    FinalRow antarctica = table.getRows().get(6);
    assertEquals("N/A", antarctica.getString("capital"));
    assertEquals(14000000.0d, antarctica.getDouble("area"));
    assertEquals("N/A", antarctica.getString("currency_code"));
    assertEquals("N/A", antarctica.getString("language_code"));

    FinalRow bouvet = table.getRows().get(7);
    assertEquals("N/A", bouvet.getString("capital"));
    assertEquals(0L, bouvet.getLong("population"));
    assertEquals("N/A", bouvet.getString("currency_name"));
    assertEquals("nor", bouvet.getString("language_code"));
  }

  @Test void testRowCountIsProductOfEntryCounts() {
    Random random = new Random(20240601L);
    List<Map<String, Object>> objects = new ArrayList<Map<String, Object>>();
    long expectedRows = 0;
    for (int i = 0; i < 40; i++) {
      int currencies = random.nextInt(4);
      int languages = random.nextInt(4);
      objects.add(country("C" + i, currencies, languages, random.nextBoolean()));
      expectedRows += (long) Math.max(currencies, 1) * Math.max(languages, 1);
    }

    FinalTable table = pipeline.transform(RawRecord.listOf(objects));

    assertEquals(expectedRows, table.size());
    assertTrue(table.size() >= objects.size());
  }

  @Test void testNoNullValuesInOutput() {
    FinalTable table = pipeline.transform(TestRecords.parse(
        "[{'name': {'common': null}, 'capital': [null], 'population': null, 'area': null,"
        + " 'currencies': {'XXX': null}, 'languages': {'xx': null}},"
        + TESTLAND + "]"));

    assertFalse(table.isEmpty());
    for (FinalRow row : table.getRows()) {
      for (int i = 0; i < row.getValues().size(); i++) {
        Object value = row.getValues().get(i);
        assertNotNull(value);
        assertEquals(table.getColumns().get(i).getType().getJavaClass(), value.getClass());
      }
    }
    FinalRow allDefaults = table.getRows().get(0);
    assertEquals("N/A", allDefaults.getString("country_name"));
    assertEquals(0L, allDefaults.getLong("population"));
    assertEquals(0.0d, allDefaults.getDouble("area"));
    assertEquals("XXX", allDefaults.getString("currency_code"));
    assertEquals("N/A", allDefaults.getString("currency_name"));
    assertEquals("N/A", allDefaults.getString("language_name"));
  }

  @Test void testIdempotence() {
    List<RawRecord> records = TestRecords.resource("countries-sample.json");

    FinalTable first = pipeline.transform(records);
    FinalTable second = pipeline.transform(records);

    assertEquals(first, second);
    assertEquals(first.toDelimitedText(), second.toDelimitedText());
  }

  @Test void testMissingCurrenciesFailsValidation() {
    List<RawRecord> records = TestRecords.parse(
        "[{'name': {'common': 'Testland'}, 'capital': [], 'population': 1000, 'area': 12.5,"
        + " 'languages': {'tst': 'Testish'}}]");

    SchemaValidationException e =
        assertThrows(SchemaValidationException.class, () -> pipeline.transform(records));
    assertEquals(Collections.singletonList("currencies"), e.getMissingPaths());
  }

  @Test void testEmptyInputFails() {
    assertThrows(EmptyDatasetException.class,
        () -> pipeline.transform(Collections.<RawRecord>emptyList()));
  }

  @Test void testNonNumericPopulationFailsCoercion() {
    List<RawRecord> records = TestRecords.parse("[" + TESTLAND + ","
        + "{'name': {'common': 'Sentinel'}, 'capital': ['X'], 'population': 'N/A',"
        + " 'area': 1.0, 'currencies': {}, 'languages': {}}]");

    CoercionException e =
        assertThrows(CoercionException.class, () -> pipeline.transform(records));
    assertEquals(1, e.getFailures().size());
    CoercionFailure failure = e.getFailures().get(0);
    assertEquals("population", failure.getColumn());
    assertEquals(1, failure.getRowIndex());
    assertEquals(1, failure.getRecordIndex());
    assertEquals("N/A", failure.getValue());
    assertEquals(TransformException.Stage.COERCION, e.getStage());
    assertTrue(e.getMessage().contains("column 'population'"));
  }

  @Test void testDropRowPolicy() {
    TransformationPipeline dropping = new TransformationPipeline(
        TransformConfig.countries().toBuilder()
            .coercionFailureAction(CoercionFailureAction.DROP_ROW)
            .build());
    List<RawRecord> records = TestRecords.parse("[" + TESTLAND + ","
        + "{'name': {'common': 'Sentinel'}, 'capital': ['X'], 'population': 'N/A',"
        + " 'area': 1.0, 'currencies': {}, 'languages': {'a': 'A', 'b': 'B'}}]");

    FinalTable table = dropping.transform(records);

    assertEquals(1, table.size());
    assertEquals("Testland", table.getRows().get(0).getString("country_name"));
  }

  @Test void testUseDefaultPolicy() {
    TransformationPipeline defaulting = new TransformationPipeline(
        TransformConfig.countries().toBuilder()
            .coercionFailureAction(CoercionFailureAction.USE_DEFAULT)
            .build());
    List<RawRecord> records = TestRecords.parse(
        "[{'name': {'common': 'Sentinel'}, 'capital': ['X'], 'population': 'N/A',"
        + " 'area': 'wide', 'currencies': {}, 'languages': {}}]");

    FinalTable table = defaulting.transform(records);

    assertEquals(1, table.size());
    FinalRow row = table.getRows().get(0);
    assertEquals(0L, row.getLong("population"));
    assertEquals(0.0d, row.getDouble("area"));
    assertEquals("X", row.getString("capital"));
  }

  @Test void testDistinct() {
    List<RawRecord> records = TestRecords.parse("[" + TESTLAND + "," + TESTLAND + "]");

    assertEquals(2, pipeline.transform(records).size());

    TransformationPipeline distinct = new TransformationPipeline(
        TransformConfig.countries().toBuilder().distinct(true).build());
    assertEquals(1, distinct.transform(records).size());
  }

  @Test void testParallelMatchesSequential() {
    Random random = new Random(7L);
    List<Map<String, Object>> objects = new ArrayList<Map<String, Object>>();
    for (int i = 0; i < 300; i++) {
      objects.add(country("P" + i, random.nextInt(3), random.nextInt(3), random.nextBoolean()));
    }
    List<RawRecord> records = RawRecord.listOf(objects);
    TransformationPipeline parallel = new TransformationPipeline(
        TransformConfig.countries().toBuilder().parallel(true).build());

    FinalTable sequentialTable = pipeline.transform(records);
    FinalTable parallelTable = parallel.transform(records);

    assertEquals(sequentialTable, parallelTable);
    assertEquals(sequentialTable.toDelimitedText(), parallelTable.toDelimitedText());
  }

  @Test void testNegativePopulationIsKept() {
    List<RawRecord> records = TestRecords.parse(
        "[{'name': {'common': 'Minus'}, 'capital': [], 'population': -5, 'area': 1,"
        + " 'currencies': {}, 'languages': {}}]");

    FinalTable table = pipeline.transform(records);

    assertEquals(-5L, table.getRows().get(0).getLong("population"));
  }

  @Test void testDelimitedText() {
    FinalTable table = pipeline.transform(TestRecords.parse("[" + TESTLAND + "]"));

    assertEquals("country_name\tcapital\tpopulation\tarea\tcurrency_code\tcurrency_name"
            + "\tlanguage_code\tlanguage_name\n"
            + "Testland\tN/A\t1000\t12.5\tN/A\tN/A\ttst\tTestish\n",
        table.toDelimitedText());
  }

  private static Map<String, Object> country(String name, int currencies, int languages,
      boolean hasCapital) {
    Map<String, Object> country = new LinkedHashMap<String, Object>();
    country.put("name", Collections.singletonMap("common", name));
    country.put("capital",
        hasCapital ? Collections.singletonList(name + " City") : Collections.emptyList());
    country.put("population", name.length() * 1000);
    country.put("area", name.length() * 1.5);
    Map<String, Object> currencyMap = new LinkedHashMap<String, Object>();
    for (int c = 0; c < currencies; c++) {
      currencyMap.put("CUR" + c, Collections.singletonMap("name", "Currency " + c));
    }
    country.put("currencies", currencyMap);
    Map<String, Object> languageMap = new LinkedHashMap<String, Object>();
    for (int l = 0; l < languages; l++) {
      languageMap.put("l" + l, "Language " + l);
    }
    country.put("languages", languageMap);
    return country;
  }
}
