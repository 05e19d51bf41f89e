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

import org.apache.calcite.adapter.countries.transform.CoercionException;
import org.apache.calcite.adapter.countries.transform.CoercionFailure;
import org.apache.calcite.adapter.countries.transform.FinalTable;
import org.apache.calcite.adapter.countries.transform.RawRecord;
import org.apache.calcite.adapter.countries.transform.SchemaValidationException;
import org.apache.calcite.adapter.countries.transform.TransformException;
import org.apache.calcite.adapter.countries.transform.TransformationPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs extract, transform and load once, in that order.
 *
 * <p>Each phase only starts if the previous one succeeded, and the load step
 * receives the finalized table unchanged. Failures are logged and returned
 * as a failed {@link EtlResult} that names the phase and, for the
 * transformation, the stage.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CountryEtlPipeline pipeline = new CountryEtlPipeline("countries",
 *     new JsonDocumentSource(url, rawCopyPath),
 *     new TransformationPipeline(TransformConfig.countries()),
 *     new ParquetTableWriter(outputPath));
 * EtlResult result = pipeline.execute();
 * }</pre>
 */
public class CountryEtlPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CountryEtlPipeline.class);

  private final String name;
  private final DocumentSource source;
  private final TransformationPipeline transformation;
  private final TableWriter writer;

  public CountryEtlPipeline(String name, DocumentSource source,
      TransformationPipeline transformation, TableWriter writer) {
    this.name = name;
    this.source = source;
    this.transformation = transformation;
    this.writer = writer;
  }

  /**
   * Executes the pipeline.
   *
   * @return Execution result with statistics, or the failure
   */
  public EtlResult execute() {
    LOGGER.info("--- Starting pipeline '{}' ---", name);
    long startTime = System.currentTimeMillis();
    EtlResult.Builder result = EtlResult.builder().pipelineName(name);
    EtlResult.Phase phase = EtlResult.Phase.EXTRACT;

    try {
      List<RawRecord> records = source.fetch();
      result.recordsRead(records.size());

      phase = EtlResult.Phase.TRANSFORM;
      FinalTable table = transformation.transform(records);
      result.rowsTransformed(table.size());

      phase = EtlResult.Phase.LOAD;
      long written = writer.write(table);
      result.rowsWritten(written);

      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.info("--- Pipeline '{}' complete: {} records, {} rows written in {}ms ---",
          name, records.size(), written, elapsed);
      return result.elapsedMs(elapsed).build();

    } catch (TransformException e) {
      LOGGER.error("--- Pipeline '{}' failed in {}: {} ---", name, phase, e.getMessage(), e);
      return result.elapsedMs(System.currentTimeMillis() - startTime)
          .failed(phase, e.getMessage())
          .failedStage(e.getStage())
          .errors(details(e))
          .build();
    } catch (IOException e) {
      LOGGER.error("--- Pipeline '{}' failed in {}: {} ---", name, phase, e.getMessage(), e);
      return result.elapsedMs(System.currentTimeMillis() - startTime)
          .failed(phase, e.getMessage())
          .build();
    }
  }

  private static List<String> details(TransformException e) {
    List<String> details = new ArrayList<String>();
    if (e instanceof SchemaValidationException) {
      for (String path : ((SchemaValidationException) e).getMissingPaths()) {
        details.add("missing required field: " + path);
      }
    } else if (e instanceof CoercionException) {
      for (CoercionFailure failure : ((CoercionException) e).getFailures()) {
        details.add(failure.toString());
      }
    }
    return details;
  }
}
