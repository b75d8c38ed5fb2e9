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
package io.creatorstats.dataset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Dataset}.
 */
@Tag("unit")
public class DatasetTest {

  private static Dataset sample() {
    return Dataset.builder("videos")
        .columns("video_id", "creator_id")
        .addRow("v1", 1L)
        .addRow("v2", 2L)
        .addRow("v3", 1L)
        .build();
  }

  @Test void testColumnValuesInRowOrder() {
    assertEquals(Arrays.<Object>asList(1L, 2L, 1L), sample().column("creator_id"));
  }

  @Test void testMapRowFillsMissingColumnsWithNull() {
    Map<String, Object> row = new HashMap<String, Object>();
    row.put("video_id", "v1");
    row.put("ignored", "x");
    Dataset dataset = Dataset.builder("videos")
        .columns("video_id", "creator_id")
        .addRow(row)
        .build();

    assertNull(dataset.getRows().get(0).get("creator_id"));
    assertEquals(Arrays.asList("video_id", "creator_id"),
        Arrays.asList(dataset.getRows().get(0).keySet().toArray()));
  }

  @Test void testWithColumnValuesLeavesOriginalUntouched() {
    Dataset original = sample();
    Dataset replaced = original.withColumnValues("video_id", Arrays.asList("a", "b", "c"));

    assertEquals(Arrays.<Object>asList("a", "b", "c"), replaced.column("video_id"));
    assertEquals(Arrays.<Object>asList("v1", "v2", "v3"), original.column("video_id"));
  }

  @Test void testWithColumnValuesRejectsWrongSize() {
    assertThrows(IllegalArgumentException.class,
        () -> sample().withColumnValues("video_id", Collections.singletonList("a")));
  }

  @Test void testUnknownColumnFails() {
    assertThrows(IllegalArgumentException.class, () -> sample().column("views"));
  }

  @Test void testRowsAreUnmodifiable() {
    Dataset dataset = sample();
    assertThrows(UnsupportedOperationException.class,
        () -> dataset.getRows().get(0).put("video_id", "x"));
    assertTrue(dataset.hasColumn("video_id"));
  }

  @Test void testPositionalRowMustMatchColumns() {
    assertThrows(IllegalArgumentException.class,
        () -> Dataset.builder("videos").columns("a", "b").addRow("only one"));
  }
}
