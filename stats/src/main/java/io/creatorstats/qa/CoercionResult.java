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
 * Outcome of converting one raw value to a {@link ColumnType}.
 *
 * <p>Conversion never throws. A failed conversion is classified so the
 * evaluator can report a missing entry differently from a malformed one:
 * <ul>
 *   <li>{@link Status#OK} - Value converted</li>
 *   <li>{@link Status#MISSING} - Value was null or blank</li>
 *   <li>{@link Status#MALFORMED} - Value was present but not convertible</li>
 * </ul>
 */
public final class CoercionResult {

  /**
   * Classification of a conversion attempt.
   */
  public enum Status {
    OK,
    MISSING,
    MALFORMED
  }

  private static final CoercionResult MISSING_RESULT =
      new CoercionResult(Status.MISSING, null, null);

  private final Status status;
  private final @Nullable Object value;
  private final @Nullable Object rawValue;

  private CoercionResult(Status status, @Nullable Object value, @Nullable Object rawValue) {
    this.status = status;
    this.value = value;
    this.rawValue = rawValue;
  }

  public static CoercionResult ok(Object value) {
    return new CoercionResult(Status.OK, value, value);
  }

  public static CoercionResult missing() {
    return MISSING_RESULT;
  }

  public static CoercionResult malformed(Object rawValue) {
    return new CoercionResult(Status.MALFORMED, null, rawValue);
  }

  public Status getStatus() {
    return status;
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  /**
   * Returns the converted value, or null unless the status is {@link Status#OK}.
   */
  public @Nullable Object getValue() {
    return value;
  }

  /**
   * Returns the value that was offered for conversion.
   */
  public @Nullable Object getRawValue() {
    return rawValue;
  }

  @Override public String toString() {
    if (status == Status.OK) {
      return "CoercionResult{OK, value=" + value + "}";
    }
    return "CoercionResult{" + status + ", raw=" + rawValue + "}";
  }
}
