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
 * Base class for fatal data quality failures.
 *
 * <p>Any subclass aborts the run before output is written.
 *
 * @see SchemaException
 * @see TypeMismatchException
 * @see ValidationException
 */
public class DataQualityException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String dataset;

  public DataQualityException(String dataset, String message) {
    super(message);
    this.dataset = dataset;
  }

  /**
   * Returns the name of the dataset that failed.
   */
  public String getDataset() {
    return dataset;
  }
}
