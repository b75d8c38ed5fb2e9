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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The three output tables and their path layout.
 *
 * <pre>
 * creator_stats/{date}.{ext}
 * creators/{date}.{ext}
 * videos/creator_id={creator_id}/{date}.{ext}
 * </pre>
 */
public enum OutputTable {
  CREATOR_STATS("creator_stats", null),
  CREATORS("creators", null),
  VIDEOS("videos", "creator_id");

  /** Partition directory value used for a null partition key, as Hive does. */
  public static final String DEFAULT_PARTITION = "__HIVE_DEFAULT_PARTITION__";

  private final String directory;
  private final @Nullable String partitionColumn;

  OutputTable(String directory, @Nullable String partitionColumn) {
    this.directory = directory;
    this.partitionColumn = partitionColumn;
  }

  public String getDirectory() {
    return directory;
  }

  public @Nullable String getPartitionColumn() {
    return partitionColumn;
  }

  /**
   * Returns the file path relative to the output root.
   *
   * @param partitionValue Partition key value; ignored for unpartitioned tables
   * @param date Run date, {@code yyyy-MM-dd}
   * @param extension File extension without the dot
   */
  public String relativePath(@Nullable Object partitionValue, String date, String extension) {
    String fileName = date + "." + extension;
    if (partitionColumn == null) {
      return directory + "/" + fileName;
    }
    String value = partitionValue == null ? DEFAULT_PARTITION : partitionValue.toString();
    return directory + "/" + partitionColumn + "=" + value + "/" + fileName;
  }
}
