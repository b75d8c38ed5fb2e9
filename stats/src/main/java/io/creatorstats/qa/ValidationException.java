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

/**
 * A {@code should_fail: true} assertion was violated.
 */
public class ValidationException extends DataQualityException {
  private static final long serialVersionUID = 1L;

  private final String column;
  private final CheckType check;
  private final long violationCount;

  public ValidationException(String dataset, String column, Assertion assertion,
      long violationCount) {
    super(dataset, dataset + " - " + assertion.getMessage() + " (column '" + column + "', check '"
        + assertion.getCheck().getConfigName() + "', " + violationCount + " row(s))");
    this.column = column;
    this.check = assertion.getCheck();
    this.violationCount = violationCount;
  }

  public String getColumn() {
    return column;
  }

  public CheckType getCheck() {
    return check;
  }

  public long getViolationCount() {
    return violationCount;
  }
}
