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

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed field path into a record tree.
 *
 * <p>Paths are dot-separated field names; any segment may be followed by one
 * or more list indexes:
 * <ul>
 *   <li>{@code name.common} - field {@code common} of object {@code name}</li>
 *   <li>{@code capital[0]} - first element of list {@code capital}</li>
 *   <li>{@code currency.value.name} - nested access through three objects</li>
 * </ul>
 *
 * <p>Resolution never throws: an absent key, a null, a container of the wrong
 * kind or an index past the end of a list all resolve to null.
 */
public final class RecordPath {

  private static final Pattern SEGMENT = Pattern.compile("([^\\[\\]]*)((?:\\[\\d+])*)");
  private static final Pattern INDEX = Pattern.compile("\\[(\\d+)]");

  private final String expression;
  /** Steps in order; a String is a map key, an Integer a list index. */
  private final ImmutableList<Object> steps;

  private RecordPath(String expression, ImmutableList<Object> steps) {
    this.expression = expression;
    this.steps = steps;
  }

  /**
   * Parses a path expression.
   *
   * @param expression Path such as {@code name.common} or {@code capital[0]}
   * @return Parsed path
   * @throws IllegalArgumentException if the expression is empty or malformed
   */
  public static RecordPath parse(String expression) {
    if (expression == null || expression.trim().isEmpty()) {
      throw new IllegalArgumentException("Field path must not be empty");
    }
    String trimmed = expression.trim();
    ImmutableList.Builder<Object> steps = ImmutableList.builder();
    for (String segment : trimmed.split("\\.", -1)) {
      Matcher matcher = SEGMENT.matcher(segment);
      if (!matcher.matches() || segment.isEmpty()) {
        throw new IllegalArgumentException(
            "Malformed field path '" + expression + "' at segment '" + segment + "'");
      }
      String name = matcher.group(1);
      if (!name.isEmpty()) {
        steps.add(name);
      }
      Matcher index = INDEX.matcher(matcher.group(2));
      while (index.find()) {
        try {
          steps.add(Integer.valueOf(index.group(1)));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "List index out of range in field path '" + expression + "'", e);
        }
      }
    }
    return new RecordPath(trimmed, steps.build());
  }

  /**
   * Returns the expression this path was parsed from.
   */
  public String getExpression() {
    return expression;
  }

  /**
   * Returns the first step if it is a field name, otherwise null.
   */
  public @Nullable String head() {
    Object first = steps.get(0);
    return first instanceof String ? (String) first : null;
  }

  /**
   * Returns the path without its first step, or null if there is only one.
   */
  public @Nullable RecordPath tail() {
    if (steps.size() == 1) {
      return null;
    }
    ImmutableList<Object> rest = steps.subList(1, steps.size());
    return new RecordPath(render(rest), rest);
  }

  /**
   * Resolves this path against a record tree.
   *
   * @param root Root object (usually {@link RawRecord#getFields()})
   * @return The value at this path, or null if any step is missing
   */
  public @Nullable Object resolve(@Nullable Object root) {
    Object current = root;
    for (Object step : steps) {
      current = step(current, step);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Resolves this path against a record.
   */
  public @Nullable Object resolve(RawRecord record) {
    return resolve(record.getFields());
  }

  /**
   * Returns whether the key chain of this path exists in a record tree.
   *
   * <p>The final value may be null; what matters is that the field is
   * declared. An index step only requires the list itself to exist.
   */
  public boolean isPresentIn(@Nullable Object root) {
    Object current = root;
    for (int i = 0; i < steps.size(); i++) {
      Object step = steps.get(i);
      if (step instanceof String) {
        if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(step)) {
          return false;
        }
      } else if (!(current instanceof List)) {
        return false;
      }
      if (i == steps.size() - 1) {
        return true;
      }
      current = step(current, step);
    }
    return true;
  }

  private static @Nullable Object step(@Nullable Object current, Object step) {
    if (step instanceof String) {
      return current instanceof Map ? ((Map<?, ?>) current).get(step) : null;
    }
    if (current instanceof List) {
      List<?> list = (List<?>) current;
      int index = (Integer) step;
      return index < list.size() ? list.get(index) : null;
    }
    return null;
  }

  private static String render(List<Object> steps) {
    StringBuilder sb = new StringBuilder();
    for (Object step : steps) {
      if (step instanceof Integer) {
        sb.append('[').append(step).append(']');
      } else {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(step);
      }
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    return o == this || o instanceof RecordPath && steps.equals(((RecordPath) o).steps);
  }

  @Override public int hashCode() {
    return steps.hashCode();
  }

  @Override public String toString() {
    return expression;
  }
}
