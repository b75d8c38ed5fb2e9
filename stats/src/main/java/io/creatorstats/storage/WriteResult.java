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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Files and row counts published by one {@link PartitionedAvroWriter#write} call.
 */
public final class WriteResult {

  private final List<String> files;
  private final Map<OutputTable, Long> rowsPerTable;
  private final long elapsedMs;

  public WriteResult(List<String> files, Map<OutputTable, Long> rowsPerTable, long elapsedMs) {
    this.files = ImmutableList.copyOf(files);
    this.rowsPerTable = ImmutableMap.copyOf(new EnumMap<OutputTable, Long>(rowsPerTable));
    this.elapsedMs = elapsedMs;
  }

  /**
   * Returns published file paths relative to the output root, in write order.
   */
  public List<String> getFiles() {
    return files;
  }

  public int getFileCount() {
    return files.size();
  }

  public Map<OutputTable, Long> getRowsPerTable() {
    return rowsPerTable;
  }

  public long getRows(OutputTable table) {
    Long rows = rowsPerTable.get(table);
    return rows == null ? 0L : rows;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "WriteResult{files=" + files.size() + ", rows=" + rowsPerTable
        + ", elapsedMs=" + elapsedMs + "}";
  }
}
