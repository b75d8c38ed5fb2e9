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

import io.creatorstats.qa.ColumnType;
import io.creatorstats.qa.QaPipeline;
import io.creatorstats.qa.QaRule;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

import java.util.List;

/**
 * Avro schemas of the output tables.
 */
public final class AvroSchemas {

  static final String NAMESPACE = "io.creatorstats.avro";

  private static final Schema CREATOR_STATS = buildCreatorStats();

  private AvroSchemas() {
  }

  /**
   * Returns the fixed schema of {@code creator_stats}.
   */
  public static Schema creatorStats() {
    return CREATOR_STATS;
  }

  /**
   * Builds a schema for a processed input table.
   *
   * <p>Columns covered by a rule of {@code pipeline} take the rule's type;
   * any other column is written as a string. Every field is nullable.
   *
   * @param recordName Avro record name
   * @param columns Column names in output order
   * @param pipeline Rules declaring column types
   * @return Record schema
   */
  public static Schema forPipeline(String recordName, List<String> columns,
      QaPipeline pipeline) {
    SchemaBuilder.FieldAssembler<Schema> fields =
        SchemaBuilder.record(recordName).namespace(NAMESPACE).fields();
    for (String column : columns) {
      QaRule rule = pipeline.getRule(column);
      ColumnType type = rule == null ? ColumnType.STRING : rule.getType();
      switch (type) {
        case INT64:
          fields = fields.name(column).type().nullable().longType().noDefault();
          break;
        case FLOAT64:
          fields = fields.name(column).type().nullable().doubleType().noDefault();
          break;
        case BOOLEAN:
          fields = fields.name(column).type().nullable().booleanType().noDefault();
          break;
        case STRING:
        default:
          fields = fields.name(column).type().nullable().stringType().noDefault();
          break;
      }
    }
    return fields.endRecord();
  }

  private static Schema buildCreatorStats() {
    Schema timestampMicros =
        LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
    return SchemaBuilder.record("CreatorStats").namespace(NAMESPACE)
        .doc("Per-creator engagement statistics for one run")
        .fields()
        .name("creator_id").type().longType().noDefault()
        .name("timestamp").doc("Run date, yyyy-MM-dd").type().stringType().noDefault()
        .name("username").type().stringType().noDefault()
        .name("follower_count").type().longType().noDefault()
        .name("avg_views").type().doubleType().noDefault()
        .name("top_category").type().stringType().noDefault()
        .name("avg_engagement").type().doubleType().noDefault()
        .name("virality_score").type().doubleType().noDefault()
        .name("top_keywords").type().array().items().stringType().noDefault()
        .name("updated_at").type(timestampMicros).noDefault()
        .endRecord();
  }
}
