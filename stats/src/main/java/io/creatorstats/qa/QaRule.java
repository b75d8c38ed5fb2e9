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
package io.creatorstats.qa;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * QA rule for one column: expected type, optional fill value and an ordered
 * list of assertions.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * - column: follower_count
 *   expected_type: int64
 *   fill_na: 0
 *   assertions:
 *     - check: non_negative
 *       should_fail: true
 *       message: "Follower count cannot be negative"
 * }</pre>
 *
 * <p>Missing entries are handled in this order:
 * <ol>
 *   <li>If {@code fill_na} is set, the entry is replaced by the fill value</li>
 *   <li>Otherwise, if {@code nullable} is true, the entry stays null</li>
 *   <li>Otherwise the rule cannot coerce the column and evaluation fails</li>
 * </ol>
 */
public class QaRule {

  private final String column;
  private final ColumnType type;
  private final @Nullable Object fillValue;
  private final boolean nullable;
  private final List<Assertion> assertions;

  private QaRule(Builder builder) {
    this.column = builder.column;
    this.type = builder.type;
    this.fillValue = builder.fillValue;
    this.nullable = builder.nullable;
    this.assertions = builder.assertions != null
        ? Collections.unmodifiableList(new ArrayList<Assertion>(builder.assertions))
        : Collections.<Assertion>emptyList();
  }

  public String getColumn() {
    return column;
  }

  public ColumnType getType() {
    return type;
  }

  /**
   * Returns the fill value, already converted to {@link #getType()}, or null
   * if missing entries are not filled.
   */
  public @Nullable Object getFillValue() {
    return fillValue;
  }

  public boolean hasFillValue() {
    return fillValue != null;
  }

  /**
   * Returns whether missing entries without a fill value are kept as nulls.
   */
  public boolean isNullable() {
    return nullable;
  }

  public List<Assertion> getAssertions() {
    return assertions;
  }

  @Override public String toString() {
    return "QaRule{column='" + column + "', type=" + type.getConfigName()
        + (fillValue != null ? ", fill=" + fillValue : "")
        + ", assertions=" + assertions.size() + "}";
  }

  /**
   * Creates a new builder for QaRule.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a QaRule from a YAML/JSON map.
   *
   * @param map Configuration map with keys: column, expected_type, fill_na, nullable, assertions
   * @return QaRule instance
   * @throws IllegalArgumentException If the map is invalid
   */
  @SuppressWarnings("unchecked")
  public static QaRule fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Rule configuration is required");
    }
    Builder builder = builder();
    builder.column((String) map.get("column"));
    Object type = map.get("expected_type");
    builder.type(ColumnType.fromName(type != null ? type.toString() : null));
    if (map.containsKey("fill_na")) {
      builder.fillValue(map.get("fill_na"));
    }
    Object nullable = map.get("nullable");
    if (nullable instanceof Boolean) {
      builder.nullable((Boolean) nullable);
    }

    Object assertionsObj = map.get("assertions");
    if (assertionsObj instanceof List) {
      List<Assertion> assertions = new ArrayList<Assertion>();
      for (Object item : (List<?>) assertionsObj) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Assertion for column '" + map.get("column")
              + "' must be a map, got: " + item);
        }
        assertions.add(Assertion.fromMap((Map<String, Object>) item));
      }
      builder.assertions(assertions);
    } else if (assertionsObj != null) {
      throw new IllegalArgumentException("'assertions' for column '" + map.get("column")
          + "' must be a list");
    }
    return builder.build();
  }

  /**
   * Builder for QaRule.
   */
  public static class Builder {
    private String column;
    private ColumnType type;
    private Object rawFillValue;
    private Object fillValue;
    private boolean nullable;
    private List<Assertion> assertions;

    public Builder column(String column) {
      this.column = column;
      return this;
    }

    public Builder type(ColumnType type) {
      this.type = type;
      return this;
    }

    public Builder fillValue(@Nullable Object fillValue) {
      this.rawFillValue = fillValue;
      return this;
    }

    public Builder nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder assertions(List<Assertion> assertions) {
      this.assertions = assertions;
      return this;
    }

    public Builder assertion(Assertion assertion) {
      if (this.assertions == null) {
        this.assertions = new ArrayList<Assertion>();
      }
      this.assertions.add(assertion);
      return this;
    }

    public QaRule build() {
      if (column == null || column.isEmpty()) {
        throw new IllegalArgumentException("Rule column is required");
      }
      if (type == null) {
        throw new IllegalArgumentException("Rule for column '" + column
            + "' requires an expected type");
      }
      if (rawFillValue != null) {
        CoercionResult fill = type.coerce(rawFillValue);
        if (!fill.isOk()) {
          throw new IllegalArgumentException("Fill value '" + rawFillValue + "' for column '"
              + column + "' is not a valid " + type.getConfigName());
        }
        fillValue = fill.getValue();
      } else {
        fillValue = null;
      }
      return new QaRule(this);
    }
  }
}
