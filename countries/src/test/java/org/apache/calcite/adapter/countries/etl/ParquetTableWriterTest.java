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
import org.apache.calcite.adapter.countries.transform.FinalTable;
import org.apache.calcite.adapter.countries.transform.TransformConfig;
import org.apache.calcite.adapter.countries.transform.TransformationPipeline;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ParquetTableWriter.
 */
@Tag("integration")
public class ParquetTableWriterTest {

  @TempDir
  Path tempDir;

  private FinalTable sampleTable() throws IOException {
    Path json = JsonDocumentSourceTest.copySample(tempDir);
    return new TransformationPipeline(TransformConfig.countries())
        .transform(new JsonDocumentSource(json.toString(), null).fetch());
  }

  @Test void testWriteAndReadBack() throws IOException, SQLException {
    FinalTable table = sampleTable();
    Path output = tempDir.resolve("out").resolve("countries.parquet");

    long written = new ParquetTableWriter(output).write(table);

    assertEquals(8, written);
    assertTrue(Files.exists(output));
    assertEquals(8L, queryLong("SELECT count(*) FROM " + scan(output)));
    assertEquals(4L,
        queryLong("SELECT count(*) FROM " + scan(output) + " WHERE country_name = 'Switzerland'"));
    assertEquals(8654622L,
        queryLong("SELECT max(population) FROM " + scan(output)));
    assertEquals(0L,
        queryLong("SELECT count(*) FROM " + scan(output) + " WHERE currency_code IS NULL"
            + " OR language_name IS NULL OR area IS NULL"));

    List<String> codes = new ArrayList<String>();
    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT currency_code, area FROM " + scan(output)
             + " WHERE country_name = 'Panama' ORDER BY currency_code")) {
      while (rs.next()) {
        codes.add(rs.getString(1));
        assertEquals(75417.0d, rs.getDouble(2));
      }
    }
    assertEquals(Arrays.asList("PAB", "USD"), codes);
  }

  @Test void testColumnTypes() throws IOException, SQLException {
    Path output = tempDir.resolve("typed.parquet");
    new ParquetTableWriter(output, "zstd").write(sampleTable());

    List<String> types = new ArrayList<String>();
    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("DESCRIBE SELECT * FROM " + scan(output))) {
      while (rs.next()) {
        types.add(rs.getString("column_name") + ":" + rs.getString("column_type"));
      }
    }
    assertEquals(
        Arrays.asList("country_name:VARCHAR", "capital:VARCHAR", "population:BIGINT",
            "area:DOUBLE", "currency_code:VARCHAR", "currency_name:VARCHAR",
            "language_code:VARCHAR", "language_name:VARCHAR"),
        types);
  }

  @Test void testOverwritesExistingFile() throws IOException, SQLException {
    Path output = tempDir.resolve("again.parquet");
    FinalTable table = sampleTable();

    new ParquetTableWriter(output).write(table);
    new ParquetTableWriter(output).write(table);

    assertEquals(8L, queryLong("SELECT count(*) FROM " + scan(output)));
  }

  @Test void testCreateSql() {
    List<ColumnConfig> columns = Arrays.asList(
        ColumnConfig.builder().name("name").type(ColumnType.TEXT).defaultValue("").build(),
        ColumnConfig.builder().name("n").type(ColumnType.INTEGER).defaultValue(0).build(),
        ColumnConfig.builder().name("x").type(ColumnType.REAL).defaultValue(0).build());

    assertEquals("CREATE TABLE final_rows (\"name\" VARCHAR, \"n\" BIGINT, \"x\" DOUBLE)",
        ParquetTableWriter.buildCreateSql(columns));
  }

  @Test void testInvalidCompression() {
    assertThrows(IllegalArgumentException.class,
        () -> new ParquetTableWriter(tempDir.resolve("x.parquet"), "snappy'; DROP"));
  }

  private static String scan(Path file) {
    return "read_parquet('" + file.toAbsolutePath().toString().replace("'", "''") + "')";
  }

  private static long queryLong(String sql) throws SQLException {
    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      assertTrue(rs.next());
      return rs.getLong(1);
    }
  }
}
