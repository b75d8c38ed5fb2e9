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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link QaConfigLoader}.
 */
@Tag("unit")
public class QaConfigLoaderTest {

  @TempDir
  Path tempDir;

  @Test void testBundledRulesCoverInputColumns() throws IOException {
    QaConfig config = QaConfigLoader.fromResource(QaConfigLoader.BUNDLED_RULES);

    assertEquals(Arrays.asList("creator_id", "username", "follower_count", "avg_views",
        "category", "bio"), config.getCreators().getColumns());
    assertEquals(Arrays.asList("video_id", "creator_id", "views", "likes", "comments",
        "shares", "caption"), config.getVideos().getColumns());

    QaRule views = config.getVideos().getRule("views");
    assertEquals(ColumnType.INT64, views.getType());
    assertEquals(0L, views.getFillValue());
    assertTrue(views.getAssertions().get(0).isShouldFail());
    assertEquals("", config.getVideos().getRule("caption").getFillValue());
  }

  @Test void testFromFile() throws IOException {
    Path rules = tempDir.resolve("rules.yaml");
    String yaml = "creators:\n"
        + "  - column: creator_id\n"
        + "    expected_type: int64\n"
        + "videos:\n"
        + "  - column: likes\n"
        + "    expected_type: int64\n"
        + "    nullable: true\n"
        + "    assertions:\n"
        + "      - check: in_range\n"
        + "        min: 0\n"
        + "        max: 1000000\n";
    Files.write(rules, yaml.getBytes(StandardCharsets.UTF_8));

    QaConfig config = QaConfigLoader.fromFile(rules);

    QaRule likes = config.getVideos().getRule("likes");
    assertTrue(likes.isNullable());
    assertEquals(CheckType.IN_RANGE, likes.getAssertions().get(0).getCheck());
    assertEquals(1000000.0, likes.getAssertions().get(0).getMax());
  }

  @Test void testInvalidRulesAreReportedAsIoErrors() {
    IOException unknownCheck = assertThrows(IOException.class,
        () -> QaConfigLoader.fromString("creators:\n"
            + "  - column: a\n"
            + "    expected_type: int64\n"
            + "    assertions:\n"
            + "      - check: positive\n"
            + "videos: []\n"));
    assertTrue(unknownCheck.getMessage().contains("positive"));

    assertThrows(IOException.class, () -> QaConfigLoader.fromString("creators: []\n"));
    assertThrows(IOException.class, () -> QaConfigLoader.fromString("creators: [\n"));
  }

  @Test void testMissingResource() {
    assertThrows(IOException.class, () -> QaConfigLoader.fromResource("/no-such-rules.yaml"));
  }
}
