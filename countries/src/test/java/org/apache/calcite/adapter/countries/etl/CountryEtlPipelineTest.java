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

import org.apache.calcite.adapter.countries.transform.FinalTable;
import org.apache.calcite.adapter.countries.transform.TransformConfig;
import org.apache.calcite.adapter.countries.transform.TransformException;
import org.apache.calcite.adapter.countries.transform.TransformationPipeline;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CountryEtlPipeline.
 */
@Tag("integration")
public class CountryEtlPipelineTest {

  @TempDir
  Path tempDir;

  private final TransformationPipeline transformation =
      new TransformationPipeline(TransformConfig.countries());

  @Test void testExtractTransformLoad() throws IOException {
    Path json = JsonDocumentSourceTest.copySample(tempDir);
    Path rawCopy = tempDir.resolve("raw/countries.json");
    Path output = tempDir.resolve("warehouse/countries.parquet");

    EtlResult result = new CountryEtlPipeline("countries",
        new JsonDocumentSource(json.toString(), rawCopy),
        transformation,
        new ParquetTableWriter(output)).execute();

    assertTrue(result.isSuccessful(), result.toString());
    assertEquals("countries", result.getPipelineName());
    assertEquals(4, result.getRecordsRead());
    assertEquals(8, result.getRowsTransformed());
    assertEquals(8, result.getRowsWritten());
    assertTrue(result.getElapsedMs() >= 0);
    assertNull(result.getFailedPhase());
    assertTrue(Files.exists(rawCopy));
    assertTrue(Files.exists(output));
  }

  @Test void testLoadReceivesTableUnchanged() throws IOException {
    Path json = JsonDocumentSourceTest.copySample(tempDir);
    AtomicReference<FinalTable> loaded = new AtomicReference<FinalTable>();
    JsonDocumentSource source = new JsonDocumentSource(json.toString(), null);

    EtlResult result = new CountryEtlPipeline("capture", source, transformation,
        table -> {
          loaded.set(table);
          return table.size();
        }).execute();

    assertTrue(result.isSuccessful());
    assertEquals(transformation.transform(source.fetch()), loaded.get());
  }

  @Test void testValidationFailureStopsBeforeLoad() {
    AtomicReference<FinalTable> loaded = new AtomicReference<FinalTable>();
    DocumentSource source = () -> JsonDocumentSource.parse(
        ("[{\"name\": {\"common\": \"Testland\"}, \"capital\": [], \"population\": 1,"
            + " \"area\": 1.0, \"languages\": {}}]").getBytes(StandardCharsets.UTF_8));

    EtlResult result = new CountryEtlPipeline("invalid", source, transformation,
        table -> {
          loaded.set(table);
          return table.size();
        }).execute();

    assertTrue(result.isFailed());
    assertEquals(EtlResult.Phase.TRANSFORM, result.getFailedPhase());
    assertEquals(TransformException.Stage.VALIDATION, result.getFailedStage());
    assertEquals(1, result.getRecordsRead());
    assertTrue(result.getErrors().contains("missing required field: currencies"));
    assertTrue(result.toString().contains("FAILED in TRANSFORM/VALIDATION"));
    assertNull(loaded.get());
  }

  @Test void testCoercionFailureIsReported() {
    DocumentSource source = () -> JsonDocumentSource.parse(
        ("[{\"name\": {\"common\": \"Testland\"}, \"capital\": [], \"population\": \"lots\","
            + " \"area\": 1.0, \"currencies\": {}, \"languages\": {}}]")
            .getBytes(StandardCharsets.UTF_8));

    EtlResult result = new CountryEtlPipeline("coercion", source, transformation,
        table -> table.size()).execute();

    assertEquals(TransformException.Stage.COERCION, result.getFailedStage());
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).contains("column 'population'"));
  }

  @Test void testExtractFailure() {
    EtlResult result = new CountryEtlPipeline("missing",
        new JsonDocumentSource(tempDir.resolve("absent.json").toString(), null),
        transformation,
        table -> table.size()).execute();

    assertTrue(result.isFailed());
    assertEquals(EtlResult.Phase.EXTRACT, result.getFailedPhase());
    assertNull(result.getFailedStage());
    assertEquals(0, result.getRecordsRead());
  }

  @Test void testLoadFailure() throws IOException {
    Path json = JsonDocumentSourceTest.copySample(tempDir);
    IOException failure = new IOException("disk full");

    EtlResult result = new CountryEtlPipeline("load",
        new JsonDocumentSource(json.toString(), null),
        transformation,
        table -> {
          throw failure;
        }).execute();

    assertFalse(result.isSuccessful());
    assertEquals(EtlResult.Phase.LOAD, result.getFailedPhase());
    assertEquals(8, result.getRowsTransformed());
    assertEquals(0, result.getRowsWritten());
    assertEquals("disk full", result.getFailureMessage());
  }
}
