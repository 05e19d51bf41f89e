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

import org.apache.calcite.adapter.countries.transform.RawRecord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.ByteStreams;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a JSON document of records from a URL or a local file.
 *
 * <p>The document must be an array of objects; a single top-level object is
 * read as a one-record collection. Object key order and number types are
 * kept as parsed by Jackson.
 *
 * <p>When a raw copy path is given, the fetched bytes are written there
 * verbatim before parsing, so the exact input of a run can be inspected.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * DocumentSource source = new JsonDocumentSource(
 *     "https://restcountries.com/v3.1/all", Paths.get("raw/countries.json"));
 * List<RawRecord> records = source.fetch();
 * }</pre>
 *
 * <p>Requests are single attempts without authentication.
 */
public class JsonDocumentSource implements DocumentSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocumentSource.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /** Default connect and read timeout. */
  public static final int DEFAULT_TIMEOUT_MS = 30_000;

  private final String location;
  private final @Nullable Path rawCopy;
  private final int timeoutMs;

  /**
   * Creates a source.
   *
   * @param location {@code http(s)://} or {@code file:} URL, or a local path
   * @param rawCopy Where to persist the raw bytes, or null to skip
   */
  public JsonDocumentSource(String location, @Nullable Path rawCopy) {
    this(location, rawCopy, DEFAULT_TIMEOUT_MS);
  }

  public JsonDocumentSource(String location, @Nullable Path rawCopy, int timeoutMs) {
    if (location == null || location.isEmpty()) {
      throw new IllegalArgumentException("Document location is required");
    }
    this.location = location;
    this.rawCopy = rawCopy;
    this.timeoutMs = timeoutMs;
  }

  @Override public List<RawRecord> fetch() throws IOException {
    LOGGER.info("Reading document from {}", location);
    byte[] content = read();
    LOGGER.debug("Read {} bytes from {}", content.length, location);

    if (rawCopy != null) {
      Path parent = rawCopy.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(rawCopy, content);
      LOGGER.info("Raw document saved to {}", rawCopy);
    }

    List<RawRecord> records = parse(content);
    LOGGER.info("Parsed {} records from {}", records.size(), location);
    return records;
  }

  /**
   * Parses a JSON document into records.
   *
   * @throws IOException If the content is not valid JSON, or not an array of
   *     objects or a single object
   */
  @SuppressWarnings("unchecked")
  public static List<RawRecord> parse(byte[] content) throws IOException {
    JsonNode root = OBJECT_MAPPER.readTree(content);
    if (root == null || root.isMissingNode()) {
      throw new IOException("Document is empty");
    }

    List<RawRecord> records = new ArrayList<RawRecord>();
    if (root.isArray()) {
      int index = 0;
      for (JsonNode item : root) {
        if (!item.isObject()) {
          throw new IOException("Element " + index + " is " + item.getNodeType()
              + ", expected an object");
        }
        records.add(RawRecord.of(OBJECT_MAPPER.convertValue(item, Map.class)));
        index++;
      }
    } else if (root.isObject()) {
      records.add(RawRecord.of(OBJECT_MAPPER.convertValue(root, Map.class)));
    } else {
      throw new IOException("Document root is " + root.getNodeType()
          + ", expected an array of objects");
    }
    return Collections.unmodifiableList(records);
  }

  private byte[] read() throws IOException {
    String lower = location.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      return readHttp();
    }
    Path path = lower.startsWith("file:") ? Paths.get(URI.create(location)) : Paths.get(location);
    return Files.readAllBytes(path);
  }

  private byte[] readHttp() throws IOException {
    HttpURLConnection conn = (HttpURLConnection) new URL(location).openConnection();
    try {
      conn.setRequestMethod("GET");
      conn.setConnectTimeout(timeoutMs);
      conn.setReadTimeout(timeoutMs);
      conn.setRequestProperty("Accept", "application/json");

      int status = conn.getResponseCode();
      if (status < 200 || status >= 300) {
        throw new IOException("HTTP " + status + " from " + location + ": "
            + conn.getResponseMessage());
      }
      try (InputStream in = conn.getInputStream()) {
        return ByteStreams.toByteArray(in);
      }
    } finally {
      conn.disconnect();
    }
  }

  @Override public String toString() {
    return "JsonDocumentSource{" + location + "}";
  }
}
