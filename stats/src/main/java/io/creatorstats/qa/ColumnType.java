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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Primitive column types a QA rule can declare.
 *
 * <p>Each type owns its conversion from the raw value produced by a reader
 * (typically a String from CSV, or an already-typed value from code):
 * <ul>
 *   <li>{@link #INT64} - {@link Long}; integral numbers and strings such as
 *       {@code "42"} or {@code "42.0"}</li>
 *   <li>{@link #FLOAT64} - {@link Double}</li>
 *   <li>{@link #STRING} - {@link String}; any non-null value via {@code toString()}</li>
 *   <li>{@link #BOOLEAN} - {@link Boolean}; {@code true/false}, case-insensitive</li>
 * </ul>
 *
 * <p>Null, and blank strings for non-string types, are {@code MISSING}.
 */
public enum ColumnType {

  INT64("int64") {
    @Override public CoercionResult coerce(@Nullable Object raw) {
      if (raw == null) {
        return CoercionResult.missing();
      }
      if (raw instanceof Long || raw instanceof Integer
          || raw instanceof Short || raw instanceof Byte) {
        return CoercionResult.ok(((Number) raw).longValue());
      }
      if (raw instanceof BigInteger || raw instanceof BigDecimal) {
        try {
          return CoercionResult.ok(new BigDecimal(raw.toString()).longValueExact());
        } catch (ArithmeticException e) {
          return CoercionResult.malformed(raw);
        }
      }
      if (raw instanceof Number) {
        double d = ((Number) raw).doubleValue();
        if (Double.isNaN(d)) {
          return CoercionResult.missing();
        }
        // 2^63 is the first double above Long.MAX_VALUE
        if (Double.isInfinite(d) || d != Math.rint(d)
            || d < Long.MIN_VALUE || d >= 0x1p63) {
          return CoercionResult.malformed(raw);
        }
        return CoercionResult.ok((long) d);
      }
      String text = raw.toString().trim();
      if (text.isEmpty()) {
        return CoercionResult.missing();
      }
      try {
        return CoercionResult.ok(Long.parseLong(text));
      } catch (NumberFormatException e) {
        try {
          // "12.0" style values written by spreadsheet exports
          return CoercionResult.ok(new BigDecimal(text).longValueExact());
        } catch (NumberFormatException | ArithmeticException ignored) {
          return CoercionResult.malformed(raw);
        }
      }
    }
  },

  FLOAT64("float64") {
    @Override public CoercionResult coerce(@Nullable Object raw) {
      if (raw == null) {
        return CoercionResult.missing();
      }
      if (raw instanceof Number) {
        double d = ((Number) raw).doubleValue();
        return Double.isNaN(d) ? CoercionResult.missing() : CoercionResult.ok(d);
      }
      String text = raw.toString().trim();
      if (text.isEmpty()) {
        return CoercionResult.missing();
      }
      try {
        double d = Double.parseDouble(text);
        return Double.isNaN(d) ? CoercionResult.missing() : CoercionResult.ok(d);
      } catch (NumberFormatException e) {
        return CoercionResult.malformed(raw);
      }
    }
  },

  STRING("string") {
    @Override public CoercionResult coerce(@Nullable Object raw) {
      if (raw == null) {
        return CoercionResult.missing();
      }
      return CoercionResult.ok(raw.toString());
    }
  },

  BOOLEAN("boolean") {
    @Override public CoercionResult coerce(@Nullable Object raw) {
      if (raw == null) {
        return CoercionResult.missing();
      }
      if (raw instanceof Boolean) {
        return CoercionResult.ok(raw);
      }
      String text = raw.toString().trim().toLowerCase(Locale.ROOT);
      if (text.isEmpty()) {
        return CoercionResult.missing();
      }
      if ("true".equals(text)) {
        return CoercionResult.ok(Boolean.TRUE);
      }
      if ("false".equals(text)) {
        return CoercionResult.ok(Boolean.FALSE);
      }
      return CoercionResult.malformed(raw);
    }
  };

  private final String configName;

  ColumnType(String configName) {
    this.configName = configName;
  }

  /**
   * Converts a raw value to this type.
   *
   * @param raw Raw value, may be null
   * @return Conversion outcome; never null
   */
  public abstract CoercionResult coerce(@Nullable Object raw);

  /**
   * Returns the name used for this type in rule files.
   */
  public String getConfigName() {
    return configName;
  }

  /**
   * Parses a type name from a rule file.
   *
   * <p>Accepts the configured names ({@code int64}, {@code float64},
   * {@code string}, {@code boolean}) and a few common aliases.
   *
   * @param name Type name
   * @return Matching type
   * @throws IllegalArgumentException If the name is not recognized
   */
  public static ColumnType fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Column type is required");
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "int64":
      case "long":
      case "int":
      case "integer":
        return INT64;
      case "float64":
      case "double":
      case "float":
        return FLOAT64;
      case "string":
      case "str":
        return STRING;
      case "boolean":
      case "bool":
        return BOOLEAN;
      default:
        throw new IllegalArgumentException("Unknown column type: " + name);
    }
  }
}
