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
 * A column a rule refers to is missing, or cannot be read as its declared type.
 *
 * <p>Always fatal, whatever the {@code should_fail} flags of the rule's assertions.
 */
public class SchemaException extends DataQualityException {
  private static final long serialVersionUID = 1L;

  private final String column;

  public SchemaException(String dataset, String column, String message) {
    super(dataset, message);
    this.column = column;
  }

  /**
   * Creates the exception for a column the dataset does not contain.
   */
  public static SchemaException missingColumn(String dataset, String column) {
    return new SchemaException(dataset, column,
        dataset + " - Column '" + column + "' not found");
  }

  public String getColumn() {
    return column;
  }
}
