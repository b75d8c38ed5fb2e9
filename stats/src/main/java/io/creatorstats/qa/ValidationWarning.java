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

import java.util.Objects;

/**
 * A {@code should_fail: false} assertion that was violated.
 *
 * <p>Warnings are collected during validation and returned with the run's
 * result; they never stop processing.
 */
public final class ValidationWarning {

  private final String dataset;
  private final String column;
  private final CheckType check;
  private final String message;
  private final long violationCount;

  public ValidationWarning(String dataset, String column, CheckType check, String message,
      long violationCount) {
    this.dataset = dataset;
    this.column = column;
    this.check = check;
    this.message = message;
    this.violationCount = violationCount;
  }

  public String getDataset() {
    return dataset;
  }

  public String getColumn() {
    return column;
  }

  public CheckType getCheck() {
    return check;
  }

  public String getMessage() {
    return message;
  }

  public long getViolationCount() {
    return violationCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ValidationWarning)) {
      return false;
    }
    ValidationWarning that = (ValidationWarning) o;
    return violationCount == that.violationCount
        && dataset.equals(that.dataset)
        && column.equals(that.column)
        && check == that.check
        && message.equals(that.message);
  }

  @Override public int hashCode() {
    return Objects.hash(dataset, column, check, message, violationCount);
  }

  @Override public String toString() {
    return dataset + " - " + message + " (column '" + column + "', check '"
        + check.getConfigName() + "', " + violationCount + " row(s))";
  }
}
