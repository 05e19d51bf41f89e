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

import java.util.Iterator;
import java.util.List;

/**
 * A record collection that has passed {@link SchemaValidator} checks.
 *
 * <p>Only the validator creates instances, so holding one proves the
 * required paths were present. It is never persisted.
 */
public final class ValidatedRecordSet implements Iterable<RawRecord> {

  private final ImmutableList<RawRecord> records;
  private final ImmutableList<String> requiredPaths;

  ValidatedRecordSet(List<RawRecord> records, List<String> requiredPaths) {
    this.records = ImmutableList.copyOf(records);
    this.requiredPaths = ImmutableList.copyOf(requiredPaths);
  }

  public List<RawRecord> getRecords() {
    return records;
  }

  /**
   * Returns the paths that were checked.
   */
  public List<String> getRequiredPaths() {
    return requiredPaths;
  }

  public int size() {
    return records.size();
  }

  public RawRecord get(int index) {
    return records.get(index);
  }

  @Override public Iterator<RawRecord> iterator() {
    return records.iterator();
  }

  @Override public String toString() {
    return "ValidatedRecordSet{records=" + records.size() + ", required=" + requiredPaths + "}";
  }
}
