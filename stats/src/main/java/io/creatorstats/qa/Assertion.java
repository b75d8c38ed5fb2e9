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

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One check within a QA rule, tagged as fatal or warning-only.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * assertions:
 *   - check: non_negative
 *     should_fail: true
 *     message: "Views cannot be negative"
 *   - check: in_range
 *     min: 0
 *     max: 1000000000
 *   - check: matches
 *     pattern: "v[0-9]+"
 * }</pre>
 *
 * <p>{@code should_fail} defaults to false: a violation is reported as a
 * {@link ValidationWarning} and evaluation continues.
 */
public class Assertion {

  private final CheckType check;
  private final boolean shouldFail;
  private final String message;
  private final @Nullable Double min;
  private final @Nullable Double max;
  private final @Nullable Pattern pattern;

  private Assertion(Builder builder) {
    this.check = builder.check;
    this.shouldFail = builder.shouldFail;
    this.message = builder.message;
    this.min = builder.min;
    this.max = builder.max;
    this.pattern = builder.pattern;
  }

  public CheckType getCheck() {
    return check;
  }

  /**
   * Returns whether a violation aborts the run.
   */
  public boolean isShouldFail() {
    return shouldFail;
  }

  /**
   * Returns the human-readable message reported on violation.
   */
  public String getMessage() {
    return message;
  }

  /**
   * Returns the lower bound for {@link CheckType#IN_RANGE}, or null if open.
   */
  public @Nullable Double getMin() {
    return min;
  }

  /**
   * Returns the upper bound for {@link CheckType#IN_RANGE}, or null if open.
   */
  public @Nullable Double getMax() {
    return max;
  }

  /**
   * Returns the pattern for {@link CheckType#MATCHES}.
   *
   * @throws IllegalStateException If this assertion is not a pattern check
   */
  public Pattern getPattern() {
    if (pattern == null) {
      throw new IllegalStateException("Assertion " + check + " has no pattern");
    }
    return pattern;
  }

  @Override public String toString() {
    return "Assertion{" + check.getConfigName() + (shouldFail ? ", fatal" : ", warn")
        + ", message='" + message + "'}";
  }

  /**
   * Creates a new builder for an assertion of the given kind.
   */
  public static Builder builder(CheckType check) {
    return new Builder(check);
  }

  /**
   * Creates an Assertion from a YAML/JSON map.
   *
   * @param map Configuration map with keys: check, should_fail, message, min, max, pattern
   * @return Assertion instance
   * @throws IllegalArgumentException If the map is invalid
   */
  public static Assertion fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Assertion configuration is required");
    }
    Builder builder = builder(CheckType.fromName((String) map.get("check")));

    Object shouldFail = map.get("should_fail");
    if (shouldFail instanceof Boolean) {
      builder.shouldFail((Boolean) shouldFail);
    } else if (shouldFail != null) {
      builder.shouldFail(Boolean.parseBoolean(shouldFail.toString()));
    }
    Object message = map.get("message");
    if (message != null) {
      builder.message(message.toString());
    }
    if (map.get("min") instanceof Number) {
      builder.min(((Number) map.get("min")).doubleValue());
    }
    if (map.get("max") instanceof Number) {
      builder.max(((Number) map.get("max")).doubleValue());
    }
    Object pattern = map.get("pattern");
    if (pattern != null) {
      builder.pattern(pattern.toString());
    }
    return builder.build();
  }

  /**
   * Builder for Assertion.
   */
  public static class Builder {
    private final CheckType check;
    private boolean shouldFail;
    private String message;
    private Double min;
    private Double max;
    private Pattern pattern;

    Builder(CheckType check) {
      this.check = check;
    }

    public Builder shouldFail(boolean shouldFail) {
      this.shouldFail = shouldFail;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder min(double min) {
      this.min = min;
      return this;
    }

    public Builder max(double max) {
      this.max = max;
      return this;
    }

    public Builder pattern(String regex) {
      try {
        this.pattern = Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("Invalid pattern for " + check.getConfigName()
            + ": " + regex, e);
      }
      return this;
    }

    public Assertion build() {
      if (check == null) {
        throw new IllegalArgumentException("Assertion check is required");
      }
      switch (check) {
        case IN_RANGE:
          if (min == null && max == null) {
            throw new IllegalArgumentException("in_range requires min and/or max");
          }
          if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("in_range min " + min + " exceeds max " + max);
          }
          pattern = null;
          break;
        case MATCHES:
          if (pattern == null) {
            throw new IllegalArgumentException("matches requires a pattern");
          }
          min = null;
          max = null;
          break;
        default:
          min = null;
          max = null;
          pattern = null;
      }
      if (message == null || message.isEmpty()) {
        message = "Check '" + check.getConfigName() + "' failed";
      }
      return new Assertion(this);
    }
  }
}
