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
package io.creatorstats.etl;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link RunConfig}.
 */
@Tag("unit")
public class RunConfigTest {

  @Test void testDefaults() {
    Clock clock = Clock.fixed(Instant.parse("2025-01-31T23:30:00Z"), ZoneOffset.UTC);
    RunConfig config = RunConfig.builder().outputRoot("/data/out").clock(clock).build();

    assertEquals(LocalDate.of(2025, 1, 31), config.getRunDate());
    assertEquals(RunConfig.DEFAULT_KEYWORD_LIMIT, config.getKeywordLimit());
    assertEquals(RunConfig.DEFAULT_TRENDING_LIMIT, config.getTrendingLimit());
    assertEquals("avro", config.getExtension());
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("output", "/data/out");
    map.put("date", "2024-12-01");
    map.put("keyword_limit", 5);
    map.put("trending_limit", 10);
    map.put("extension", "avro2");

    RunConfig config = RunConfig.fromMap(map);

    assertEquals("/data/out", config.getOutputRoot());
    assertEquals(LocalDate.of(2024, 12, 1), config.getRunDate());
    assertEquals(5, config.getKeywordLimit());
    assertEquals(10, config.getTrendingLimit());
    assertEquals("avro2", config.getExtension());
  }

  @Test void testOutputRootIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> RunConfig.builder().build());
  }

  @Test void testExtensionWithDotIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> RunConfig.builder().outputRoot("/out").extension(".avro").build());
  }

  @Test void testInvalidDate() {
    assertThrows(IllegalArgumentException.class, () -> RunConfig.parseDate("31/01/2025"));
  }
}
