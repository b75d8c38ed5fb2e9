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
package io.creatorstats.storage;

import java.io.IOException;

/**
 * Thrown when an output file cannot be staged or published.
 */
public class PartitionWriteException extends IOException {
  private static final long serialVersionUID = 1L;

  private final OutputTable table;
  private final String path;

  public PartitionWriteException(OutputTable table, String path, String message,
      Throwable cause) {
    super(message + " [" + table.getDirectory() + ": " + path + "]", cause);
    this.table = table;
    this.path = path;
  }

  public OutputTable getTable() {
    return table;
  }

  /**
   * Returns the path that was being written when the failure occurred.
   */
  public String getPath() {
    return path;
  }
}
