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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Expands each record's explodable fields into flat rows.
 *
 * <p>Explodable fields are expanded one after another with outer semantics.
 * Expanding field A multiplies a record's rows by the number of entries in A,
 * or by 1 when A is absent, null, empty or not a container; expanding field B
 * then multiplies each of those rows again. The net effect per record is the
 * Cartesian product of the entry counts, and a record is never dropped.
 *
 * <p>For every row the flattener then resolves the configured source
 * expressions. An expression whose first segment is an explode alias reads
 * the entry bound to that alias ({@code currency.key},
 * {@code currency.value.name}); any other expression is resolved against the
 * record itself ({@code name.common}, {@code capital[0]}) and does not
 * multiply rows. Malformed entries resolve to null rather than failing.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * // record: {"currencies": {"EUR": {...}, "USD": {...}}, "languages": {"en": "English"}}
 * // explode: currencies as currency, languages as language
 * // rows:    [{currency=EUR, language=en}, {currency=USD, language=en}]
 * }</pre>
 *
 * @see ExplodeConfig
 */
public class StructuralFlattener {

  private static final Logger LOGGER = LoggerFactory.getLogger(StructuralFlattener.class);

  private final ImmutableList<ExplodeConfig> explodes;
  private final ImmutableList<RecordPath> sources;

  /**
   * Creates a flattener.
   *
   * @param explodes Explodable fields, in expansion order
   * @param sourceExpressions Source expressions each row must carry
   */
  public StructuralFlattener(List<ExplodeConfig> explodes, Collection<String> sourceExpressions) {
    this.explodes = ImmutableList.copyOf(explodes);
    ImmutableList.Builder<RecordPath> paths = ImmutableList.builder();
    for (String expression : new LinkedHashSet<String>(sourceExpressions)) {
      paths.add(RecordPath.parse(expression));
    }
    this.sources = paths.build();
  }

  /**
   * Creates a flattener for the explodes and column sources of a configuration.
   */
  public static StructuralFlattener create(TransformConfig config) {
    List<String> expressions = new ArrayList<String>();
    for (ColumnConfig column : config.getColumns()) {
      expressions.addAll(column.getSources());
    }
    return new StructuralFlattener(config.getExplodes(), expressions);
  }

  /**
   * Flattens all records sequentially.
   */
  public List<FlatRow> flatten(ValidatedRecordSet records) {
    return flatten(records, false);
  }

  /**
   * Flattens all records, optionally on a parallel stream. Row order is the
   * same either way: record order, then expansion order within a record.
   *
   * @throws FlattenIntegrityException if a record produced no rows
   */
  public List<FlatRow> flatten(ValidatedRecordSet records, boolean parallel) {
    IntStream indexes = IntStream.range(0, records.size());
    if (parallel) {
      indexes = indexes.parallel();
    }
    List<List<FlatRow>> perRecord = indexes
        .mapToObj(i -> flattenRecord(i, records.get(i)))
        .collect(Collectors.toList());

    List<FlatRow> rows = new ArrayList<FlatRow>();
    for (List<FlatRow> recordRows : perRecord) {
      rows.addAll(recordRows);
    }
    if (rows.size() < records.size()) {
      throw new FlattenIntegrityException(
          rows.size() + " rows for " + records.size() + " records");
    }
    LOGGER.debug("Flattened {} records into {} rows", records.size(), rows.size());
    return rows;
  }

  /**
   * Flattens one record into its rows.
   *
   * @param recordIndex Position of the record in the input, kept on each row
   * @param record Record to flatten
   * @return At least one row
   * @throws FlattenIntegrityException if the expansion produced no rows
   */
  public List<FlatRow> flattenRecord(int recordIndex, RawRecord record) {
    List<Map<String, Object>> bindings = expand(record);
    if (bindings.isEmpty()) {
      throw new FlattenIntegrityException(recordIndex, "expansion produced no rows");
    }

    List<FlatRow> rows = new ArrayList<FlatRow>(bindings.size());
    for (int ordinal = 0; ordinal < bindings.size(); ordinal++) {
      Map<String, Object> binding = bindings.get(ordinal);
      Map<String, Object> values = new LinkedHashMap<String, Object>();
      for (RecordPath source : sources) {
        values.put(source.getExpression(), resolve(source, record, binding));
      }
      rows.add(new FlatRow(recordIndex, ordinal, values));
    }
    return rows;
  }

  /**
   * Expands the explodable fields of a record into alias bindings, one per
   * output row. An alias is bound to null when its field has no entries.
   */
  List<Map<String, Object>> expand(RawRecord record) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    result.add(new LinkedHashMap<String, Object>());

    for (ExplodeConfig explode : explodes) {
      List<Map<String, Object>> entries = entriesOf(explode.getField().resolve(record));
      List<Map<String, Object>> expanded = new ArrayList<Map<String, Object>>();

      for (Map<String, Object> existing : result) {
        if (entries.isEmpty()) {
          Map<String, Object> placeholder = new LinkedHashMap<String, Object>(existing);
          placeholder.put(explode.getAlias(), null);
          expanded.add(placeholder);
          continue;
        }
        for (Map<String, Object> entry : entries) {
          Map<String, Object> combination = new LinkedHashMap<String, Object>(existing);
          combination.put(explode.getAlias(), entry);
          expanded.add(combination);
        }
      }
      result = expanded;
    }
    return result;
  }

  /**
   * Returns the entries of a map or array value as key/value bindings.
   * Anything else has no entries.
   */
  static List<Map<String, Object>> entriesOf(@Nullable Object value) {
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      List<Map<String, Object>> entries = new ArrayList<Map<String, Object>>(map.size());
      for (Map.Entry<?, ?> e : map.entrySet()) {
        entries.add(entry(e.getKey(), e.getValue()));
      }
      return entries;
    }
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      List<Map<String, Object>> entries = new ArrayList<Map<String, Object>>(list.size());
      for (int i = 0; i < list.size(); i++) {
        entries.add(entry((long) i, list.get(i)));
      }
      return entries;
    }
    if (value != null) {
      LOGGER.debug("Explodable value of type {} has no entries", value.getClass().getSimpleName());
    }
    return Collections.emptyList();
  }

  private static Map<String, Object> entry(@Nullable Object key, @Nullable Object value) {
    Map<String, Object> entry = new LinkedHashMap<String, Object>(4);
    entry.put(ExplodeConfig.KEY, key);
    entry.put(ExplodeConfig.VALUE, value);
    return Collections.unmodifiableMap(entry);
  }

  private static @Nullable Object resolve(RecordPath source, RawRecord record,
      Map<String, Object> binding) {
    String head = source.head();
    if (head != null && binding.containsKey(head)) {
      Object entry = binding.get(head);
      RecordPath tail = source.tail();
      return tail == null ? entry : tail.resolve(entry);
    }
    return source.resolve(record);
  }
}
