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

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Kinds of column assertion a QA rule can carry.
 *
 * <p>Each constant implements {@link #countViolations(List, Assertion)} for
 * its own kind, so evaluation is a fixed dispatch on the enum rather than a
 * configurable predicate. Parameters live on the {@link Assertion}; only
 * {@link #IN_RANGE} and {@link #MATCHES} read any.
 *
 * <p>Null values are only counted by {@link #NOT_NULL}; every other check
 * skips them.
 */
public enum CheckType {

  /** Every value is present. */
  NOT_NULL("not_null") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      long count = 0;
      for (Object value : values) {
        if (value == null) {
          count++;
        }
      }
      return count;
    }
  },

  /** Every numeric value is {@code >= 0}. */
  NON_NEGATIVE("non_negative") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      long count = 0;
      for (Object value : values) {
        if (value instanceof Number && ((Number) value).doubleValue() < 0) {
          count++;
        }
      }
      return count;
    }
  },

  /** Every string value has at least one non-whitespace character. */
  NON_EMPTY_STRING("non_empty_string") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      long count = 0;
      for (Object value : values) {
        if (value != null && value.toString().trim().isEmpty()) {
          count++;
        }
      }
      return count;
    }
  },

  /** No value occurs twice. Each repeat after the first occurrence is one violation. */
  UNIQUE("unique") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      Set<Object> seen = new HashSet<Object>();
      long count = 0;
      for (Object value : values) {
        if (value != null && !seen.add(value)) {
          count++;
        }
      }
      return count;
    }
  },

  /** Every numeric value lies within {@code [min, max]}; either bound may be open. */
  IN_RANGE("in_range") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      Double min = assertion.getMin();
      Double max = assertion.getMax();
      long count = 0;
      for (Object value : values) {
        if (!(value instanceof Number)) {
          continue;
        }
        double d = ((Number) value).doubleValue();
        if ((min != null && d < min) || (max != null && d > max)) {
          count++;
        }
      }
      return count;
    }
  },

  /** Every value's string form matches the assertion's pattern in full. */
  MATCHES("matches") {
    @Override public long countViolations(List<?> values, Assertion assertion) {
      long count = 0;
      for (Object value : values) {
        if (value != null && !assertion.getPattern().matcher(value.toString()).matches()) {
          count++;
        }
      }
      return count;
    }
  };

  private final String configName;

  CheckType(String configName) {
    this.configName = configName;
  }

  /**
   * Counts the values that violate this check.
   *
   * @param values Column values after type coercion and fill
   * @param assertion Assertion carrying any parameters for this check
   * @return Number of violating rows; 0 when the check passes
   */
  public abstract long countViolations(List<?> values, Assertion assertion);

  /**
   * Returns the name used for this check in rule files.
   */
  public String getConfigName() {
    return configName;
  }

  /**
   * Parses a check name from a rule file ({@code non_negative}, {@code unique}, ...).
   *
   * @throws IllegalArgumentException If the name is not recognized
   */
  public static CheckType fromName(@Nullable String name) {
    if (name == null) {
      throw new IllegalArgumentException("Assertion check is required");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (CheckType type : values()) {
      if (type.configName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown assertion check: " + name);
  }
}
