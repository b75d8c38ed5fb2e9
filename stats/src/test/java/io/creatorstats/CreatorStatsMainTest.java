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
package io.creatorstats;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CreatorStatsMain}.
 */
@Tag("integration")
public class CreatorStatsMainTest {

  @TempDir
  Path tempDir;

  private final CreatorStatsMain main = new CreatorStatsMain(
      Clock.fixed(Instant.parse("2025-01-31T08:00:00Z"), ZoneOffset.UTC));

  private Path write(String name, String... lines) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  private String[] args(Path creators, Path videos, String... extra) {
    String[] base = {
        "--creators", creators.toString(),
        "--videos", videos.toString(),
        "--output", tempDir.resolve("out").toString()};
    String[] all = Arrays.copyOf(base, base.length + extra.length);
    System.arraycopy(extra, 0, all, base.length, extra.length);
    return all;
  }

  @Test void testSuccessfulRun() throws IOException {
    Path creators = write("creators.csv",
        "creator_id,username,follower_count,avg_views,category,bio",
        "1,alice,100,500,Tech,hello");
    Path videos = write("videos.csv",
        "video_id,creator_id,views,likes,comments,shares,caption",
        "v1,1,1000,20,5,5,great tech tips");

    assertEquals(CreatorStatsMain.EXIT_OK, main.run(args(creators, videos)));
    assertTrue(Files.exists(tempDir.resolve("out/creator_stats/2025-01-31.avro")));
  }

  @Test void testExplicitDate() throws IOException {
    Path creators = write("creators.csv",
        "creator_id,username,follower_count,avg_views,category,bio",
        "1,alice,100,500,Tech,hello");
    Path videos = write("videos.csv",
        "video_id,creator_id,views,likes,comments,shares,caption",
        "v1,1,1000,20,5,5,great tech tips");

    assertEquals(CreatorStatsMain.EXIT_OK,
        main.run(args(creators, videos, "--date", "2024-06-30")));
    assertTrue(Files.exists(tempDir.resolve("out/videos/creator_id=1/2024-06-30.avro")));
  }

  @Test void testValidationFailureExitCode() throws IOException {
    Path creators = write("creators.csv",
        "creator_id,username,follower_count,avg_views,category,bio",
        "1,alice,100,500,Tech,hello",
        "1,again,100,500,Tech,hello");
    Path videos = write("videos.csv",
        "video_id,creator_id,views,likes,comments,shares,caption",
        "v1,1,1000,20,5,5,great tech tips");

    assertEquals(CreatorStatsMain.EXIT_FAILURE, main.run(args(creators, videos)));
    assertFalse(Files.exists(tempDir.resolve("out/creator_stats")));
  }

  @Test void testMissingInputFileExitCode() {
    assertEquals(CreatorStatsMain.EXIT_FAILURE, main.run(args(
        tempDir.resolve("absent.csv"), tempDir.resolve("absent2.csv"))));
  }

  @Test void testUsageErrors() throws IOException {
    assertEquals(CreatorStatsMain.EXIT_USAGE, main.run(new String[] {"--creators", "x.csv"}));

    Path creators = write("c.csv", "creator_id");
    Path videos = write("v.csv", "video_id");
    assertEquals(CreatorStatsMain.EXIT_USAGE,
        main.run(args(creators, videos, "--date", "not-a-date")));
  }
}
