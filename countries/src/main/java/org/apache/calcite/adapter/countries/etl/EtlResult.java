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

import org.apache.calcite.adapter.countries.transform.TransformException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a {@link CountryEtlPipeline} run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * EtlResult result = pipeline.execute();
 * if (result.isSuccessful()) {
 *   System.out.println("Wrote " + result.getRowsWritten() + " rows");
 * } else {
 *   System.err.println("Failed in " + result.getFailedPhase() + ": " + result.getFailureMessage());
 * }
 * }</pre>
 */
public class EtlResult {

  /**
   * Phases of a pipeline run.
   */
  public enum Phase {
    EXTRACT,
    TRANSFORM,
    LOAD
  }

  private final String pipelineName;
  private final int recordsRead;
  private final long rowsTransformed;
  private final long rowsWritten;
  private final long elapsedMs;
  private final boolean failed;
  private final @Nullable Phase failedPhase;
  private final TransformException.@Nullable Stage failedStage;
  private final @Nullable String failureMessage;
  private final List<String> errors;

  private EtlResult(Builder builder) {
    this.pipelineName = builder.pipelineName;
    this.recordsRead = builder.recordsRead;
    this.rowsTransformed = builder.rowsTransformed;
    this.rowsWritten = builder.rowsWritten;
    this.elapsedMs = builder.elapsedMs;
    this.failed = builder.failed;
    this.failedPhase = builder.failedPhase;
    this.failedStage = builder.failedStage;
    this.failureMessage = builder.failureMessage;
    this.errors = builder.errors != null
        ? Collections.unmodifiableList(new ArrayList<String>(builder.errors))
        : Collections.<String>emptyList();
  }

  public String getPipelineName() {
    return pipelineName;
  }

  /**
   * Returns the number of raw records extracted.
   */
  public int getRecordsRead() {
    return recordsRead;
  }

  /**
   * Returns the number of rows in the finalized table.
   */
  public long getRowsTransformed() {
    return rowsTransformed;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public boolean isSuccessful() {
    return !failed;
  }

  public boolean isFailed() {
    return failed;
  }

  /**
   * Returns the phase that failed, or null on success.
   */
  public @Nullable Phase getFailedPhase() {
    return failedPhase;
  }

  /**
   * Returns the transformation stage that failed, or null if the failure
   * was not in the transformation.
   */
  public TransformException.@Nullable Stage getFailedStage() {
    return failedStage;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  public List<String> getErrors() {
    return errors;
  }

  /**
   * Creates a new builder for EtlResult.
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("EtlResult{pipeline='").append(pipelineName).append("'");
    if (failed) {
      sb.append(", FAILED in ").append(failedPhase);
      if (failedStage != null) {
        sb.append("/").append(failedStage);
      }
      sb.append(": ").append(failureMessage);
    } else {
      sb.append(", records=").append(recordsRead);
      sb.append(", rows=").append(rowsTransformed);
      sb.append(", written=").append(rowsWritten);
    }
    sb.append(", elapsed=").append(elapsedMs).append("ms}");
    return sb.toString();
  }

  /**
   * Builder for EtlResult.
   */
  public static class Builder {
    private String pipelineName;
    private int recordsRead;
    private long rowsTransformed;
    private long rowsWritten;
    private long elapsedMs;
    private boolean failed;
    private Phase failedPhase;
    private TransformException.Stage failedStage;
    private String failureMessage;
    private List<String> errors;

    public Builder pipelineName(String pipelineName) {
      this.pipelineName = pipelineName;
      return this;
    }

    public Builder recordsRead(int recordsRead) {
      this.recordsRead = recordsRead;
      return this;
    }

    public Builder rowsTransformed(long rowsTransformed) {
      this.rowsTransformed = rowsTransformed;
      return this;
    }

    public Builder rowsWritten(long rowsWritten) {
      this.rowsWritten = rowsWritten;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    /**
     * Marks the result as failed in a phase.
     */
    public Builder failed(Phase phase, String message) {
      this.failed = true;
      this.failedPhase = phase;
      this.failureMessage = message;
      return this;
    }

    public Builder failedStage(TransformException.Stage stage) {
      this.failedStage = stage;
      return this;
    }

    public Builder errors(List<String> errors) {
      this.errors = errors;
      return this;
    }

    public EtlResult build() {
      return new EtlResult(this);
    }
  }
}
