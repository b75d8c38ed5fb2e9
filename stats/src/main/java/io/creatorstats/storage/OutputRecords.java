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

import io.creatorstats.dataset.Dataset;
import io.creatorstats.metrics.CreatorStatistic;
import io.creatorstats.qa.QaPipeline;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Records of one output table, grouped by partition value.
 *
 * <p>Unpartitioned tables hold a single group keyed by {@code null}.
 * Partitioned groups are ordered by partition value.
 */
public final class OutputRecords {

  private final OutputTable table;
  private final Schema schema;
  private final Map<Object, List<GenericRecord>> partitions;

  private OutputRecords(OutputTable table, Schema schema,
      Map<Object, List<GenericRecord>> partitions) {
    this.table = table;
    this.schema = schema;
    this.partitions = Collections.unmodifiableMap(partitions);
  }

  public OutputTable getTable() {
    return table;
  }

  public Schema getSchema() {
    return schema;
  }

  /**
   * Returns records per partition value. A null key stands for the whole
   * table, or for rows whose partition column is null.
   */
  public Map<Object, List<GenericRecord>> getPartitions() {
    return partitions;
  }

  public long getRecordCount() {
    long count = 0;
    for (List<GenericRecord> records : partitions.values()) {
      count += records.size();
    }
    return count;
  }

  /**
   * Builds {@code creator_stats} records.
   */
  public static OutputRecords creatorStats(List<CreatorStatistic> statistics) {
    Schema schema = AvroSchemas.creatorStats();
    List<GenericRecord> records = new ArrayList<GenericRecord>(statistics.size());
    for (CreatorStatistic statistic : statistics) {
      GenericRecord record = new GenericData.Record(schema);
      record.put("creator_id", statistic.getCreatorId());
      record.put("timestamp", statistic.getTimestamp());
      record.put("username", statistic.getUsername());
      record.put("follower_count", statistic.getFollowerCount());
      record.put("avg_views", statistic.getAvgViews());
      record.put("top_category", statistic.getTopCategory());
      record.put("avg_engagement", statistic.getAvgEngagement());
      record.put("virality_score", statistic.getViralityScore());
      record.put("top_keywords", new ArrayList<String>(statistic.getTopKeywords()));
      record.put("updated_at", toEpochMicros(statistic.getUpdatedAt()));
      records.add(record);
    }
    Map<Object, List<GenericRecord>> partitions = new LinkedHashMap<Object, List<GenericRecord>>();
    partitions.put(null, records);
    return new OutputRecords(OutputTable.CREATOR_STATS, schema, partitions);
  }

  /**
   * Builds records for a processed input table.
   *
   * @param table {@link OutputTable#CREATORS} or {@link OutputTable#VIDEOS}
   * @param dataset Validated dataset
   * @param pipeline Rules used to type the schema
   */
  public static OutputRecords fromDataset(OutputTable table, Dataset dataset,
      QaPipeline pipeline) {
    if (table == OutputTable.CREATOR_STATS) {
      throw new IllegalArgumentException("creator_stats is built from statistics");
    }
    Schema schema = AvroSchemas.forPipeline(recordName(table), dataset.getColumns(), pipeline);
    String partitionColumn = table.getPartitionColumn();
    if (partitionColumn != null && !dataset.hasColumn(partitionColumn)) {
      throw new IllegalArgumentException("Dataset '" + dataset.getName()
          + "' has no partition column '" + partitionColumn + "'");
    }

    Map<Object, List<GenericRecord>> partitions = partitionColumn == null
        ? new LinkedHashMap<Object, List<GenericRecord>>()
        : new TreeMap<Object, List<GenericRecord>>(OutputRecords::comparePartitionValues);
    if (partitionColumn == null) {
      partitions.put(null, new ArrayList<GenericRecord>());
    }
    for (Map<String, Object> row : dataset.getRows()) {
      GenericRecord record = new GenericData.Record(schema);
      for (String column : dataset.getColumns()) {
        Object value = row.get(column);
        Schema.Field field = schema.getField(column);
        record.put(column, value == null ? null : toAvroValue(field.schema(), value));
      }
      Object key = partitionColumn == null ? null : row.get(partitionColumn);
      partitions.computeIfAbsent(key, k -> new ArrayList<GenericRecord>()).add(record);
    }
    return new OutputRecords(table, schema, partitions);
  }

  private static Object toAvroValue(Schema fieldSchema, Object value) {
    Schema.Type type = fieldSchema.getType() == Schema.Type.UNION
        ? nonNullBranch(fieldSchema).getType()
        : fieldSchema.getType();
    if (type == Schema.Type.STRING) {
      return value.toString();
    }
    return value;
  }

  private static Schema nonNullBranch(Schema union) {
    for (Schema branch : union.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        return branch;
      }
    }
    return union;
  }

  /** Numeric partition values in numeric order, others by text; null last. */
  private static int comparePartitionValues(Object a, Object b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : 1) : -1;
    }
    if (a instanceof Long && b instanceof Long) {
      return Long.compare((Long) a, (Long) b);
    }
    return a.toString().compareTo(b.toString());
  }

  private static String recordName(OutputTable table) {
    return table == OutputTable.CREATORS ? "Creator" : "Video";
  }

  static long toEpochMicros(Instant instant) {
    return TimeUnit.SECONDS.toMicros(instant.getEpochSecond())
        + TimeUnit.NANOSECONDS.toMicros(instant.getNano());
  }
}
