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

import org.apache.calcite.adapter.countries.transform.ColumnConfig;
import org.apache.calcite.adapter.countries.transform.ColumnType;
import org.apache.calcite.adapter.countries.transform.FinalRow;
import org.apache.calcite.adapter.countries.transform.FinalTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link FinalTable} to a single Parquet file using DuckDB.
 *
 * <p>Rows are inserted into an in-memory DuckDB table whose column types
 * follow the table's declared types, then exported with
 * {@code COPY ... TO ... (FORMAT PARQUET)}:
 * <ul>
 *   <li>TEXT - {@code VARCHAR}</li>
 *   <li>INTEGER - {@code BIGINT}</li>
 *   <li>REAL - {@code DOUBLE}</li>
 * </ul>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TableWriter writer = new ParquetTableWriter(Paths.get("out/countries.parquet"));
 * long rows = writer.write(table);
 * }</pre>
 *
 * <p>An existing file at the output path is overwritten.
 */
public class ParquetTableWriter implements TableWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableWriter.class);

  private static final String STAGING_TABLE = "final_rows";
  private static final int BATCH_SIZE = 1000;

  private final Path output;
  private final String compression;

  public ParquetTableWriter(Path output) {
    this(output, "snappy");
  }

  /**
   * Creates a writer.
   *
   * @param output Parquet file to write
   * @param compression Parquet codec name (snappy, zstd, gzip, uncompressed)
   */
  public ParquetTableWriter(Path output, String compression) {
    if (output == null) {
      throw new IllegalArgumentException("Output path is required");
    }
    String codec = compression != null ? compression.toLowerCase(Locale.ROOT) : "snappy";
    if (!codec.matches("[a-z0-9_]+")) {
      throw new IllegalArgumentException("Invalid compression codec: " + compression);
    }
    this.output = output;
    this.compression = codec;
  }

  public Path getOutput() {
    return output;
  }

  @Override public long write(FinalTable table) throws IOException {
    LOGGER.info("Writing {} rows to Parquet file {}", table.size(), output);
    long startTime = System.currentTimeMillis();

    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:")) {
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(buildCreateSql(table.getColumns()));
      }
      insertRows(conn, table);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(buildCopySql());
      }
    } catch (SQLException e) {
      throw new IOException("Failed to write Parquet file " + output + ": " + e.getMessage(), e);
    }

    LOGGER.info("Wrote {} rows to {} in {}ms",
        table.size(), output, System.currentTimeMillis() - startTime);
    return table.size();
  }

  private void insertRows(Connection conn, FinalTable table) throws SQLException {
    List<ColumnConfig> columns = table.getColumns();
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(STAGING_TABLE).append(" VALUES (");
    for (int i = 0; i < columns.size(); i++) {
      sql.append(i == 0 ? "?" : ", ?");
    }
    sql.append(")");

    try (PreparedStatement insert = conn.prepareStatement(sql.toString())) {
      int pending = 0;
      for (FinalRow row : table.getRows()) {
        List<Object> values = row.getValues();
        for (int i = 0; i < columns.size(); i++) {
          bind(insert, i + 1, columns.get(i).getType(), values.get(i));
        }
        insert.addBatch();
        if (++pending == BATCH_SIZE) {
          insert.executeBatch();
          pending = 0;
        }
      }
      if (pending > 0) {
        insert.executeBatch();
      }
    }
  }

  private static void bind(PreparedStatement stmt, int index, ColumnType type, Object value)
      throws SQLException {
    switch (type) {
      case INTEGER:
        stmt.setLong(index, (Long) value);
        break;
      case REAL:
        stmt.setDouble(index, (Double) value);
        break;
      default:
        stmt.setString(index, (String) value);
        break;
    }
  }

  static String buildCreateSql(List<ColumnConfig> columns) {
    StringBuilder sql = new StringBuilder("CREATE TABLE ").append(STAGING_TABLE).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      ColumnConfig column = columns.get(i);
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(quoteIdentifier(column.getName())).append(' ').append(sqlType(column.getType()));
    }
    return sql.append(")").toString();
  }

  private String buildCopySql() {
    return "COPY " + STAGING_TABLE + " TO '" + output.toAbsolutePath().toString().replace("'", "''")
        + "' (FORMAT PARQUET, COMPRESSION '" + compression + "')";
  }

  static String sqlType(ColumnType type) {
    switch (type) {
      case INTEGER:
        return "BIGINT";
      case REAL:
        return "DOUBLE";
      default:
        return "VARCHAR";
    }
  }

  private static String quoteIdentifier(String name) {
    return "\"" + name.replace("\"", "\"\"") + "\"";
  }
}
