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

/**
 * Values of a column could not be converted to the rule's expected type.
 *
 * <p>The {@link #getKind() kind} tells a null that has no fill value
 * ({@link CoercionResult.Status#MISSING}) apart from a value that does not
 * parse ({@link CoercionResult.Status#MALFORMED}).
 */
public class TypeMismatchException extends SchemaException {
  private static final long serialVersionUID = 1L;

  private final ColumnType expectedType;
  private final CoercionResult.Status kind;
  private final long rowCount;
  private final @Nullable String sampleValue;

  public TypeMismatchException(String dataset, String column, ColumnType expectedType,
      CoercionResult.Status kind, long rowCount, @Nullable Object sampleValue) {
    super(dataset, column, buildMessage(dataset, column, expectedType, kind, rowCount,
        sampleValue));
    this.expectedType = expectedType;
    this.kind = kind;
    this.rowCount = rowCount;
    this.sampleValue = sampleValue != null ? sampleValue.toString() : null;
  }

  private static String buildMessage(String dataset, String column, ColumnType type,
      CoercionResult.Status kind, long rowCount, @Nullable Object sampleValue) {
    if (kind == CoercionResult.Status.MISSING) {
      return dataset + " - Column '" + column + "' contains " + rowCount
          + " null value(s) and has no fill value";
    }
    return dataset + " - Column '" + column + "' has " + rowCount + " value(s) that are not "
        + type.getConfigName() + " (e.g. '" + sampleValue + "')";
  }

  public ColumnType getExpectedType() {
    return expectedType;
  }

  public CoercionResult.Status getKind() {
    return kind;
  }

  public long getRowCount() {
    return rowCount;
  }

  /**
   * Returns one offending value, or null for missing entries.
   */
  public @Nullable String getSampleValue() {
    return sampleValue;
  }
}
