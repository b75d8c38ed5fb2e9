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
package io.creatorstats.format.csv;

import io.creatorstats.dataset.Dataset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CsvDatasetReader}.
 */
@Tag("unit")
public class CsvDatasetReaderTest {

  @TempDir
  Path tempDir;

  private final CsvDatasetReader reader = new CsvDatasetReader();

  @Test void testReadsHeaderAndRows() throws IOException {
    Dataset dataset = reader.read("videos", new StringReader(
        "video_id,creator_id,caption\n"
            + "v1,1,\"hello, world\"\n"
            + "v2,2,plain\n"));

    assertEquals("videos", dataset.getName());
    assertEquals(Arrays.asList("video_id", "creator_id", "caption"), dataset.getColumns());
    assertEquals(2, dataset.size());
    assertEquals("hello, world", dataset.getRows().get(0).get("caption"));
    assertEquals(Arrays.asList("1", "2"), dataset.column("creator_id"));
  }

  @Test void testEmptyAndShortRowsBecomeNull() throws IOException {
    Dataset dataset = reader.read("creators", new StringReader(
        "creator_id,username,bio\n"
            + "1,,x\n"
            + "2,bob\n"));

    assertNull(dataset.getRows().get(0).get("username"));
    assertNull(dataset.getRows().get(1).get("bio"));
  }

  @Test void testTsvFileIsTabSeparated() throws IOException {
    Path file = tempDir.resolve("creators.tsv");
    Files.write(file, Arrays.asList("creator_id\tusername", "1\ta, b"),
        StandardCharsets.UTF_8);

    Dataset dataset = reader.read("creators", file);

    assertEquals(Arrays.asList("creator_id", "username"), dataset.getColumns());
    assertEquals("a, b", dataset.getRows().get(0).get("username"));
  }

  @Test void testByteOrderMarkIsStrippedFromHeader() throws IOException {
    Path file = tempDir.resolve("creators.csv");
    Files.write(file, Arrays.asList("\uFEFFcreator_id,username", "1,alice"),
        StandardCharsets.UTF_8);

    Dataset dataset = reader.read("creators", file);

    assertTrue(dataset.hasColumn("creator_id"));
    assertEquals("1", dataset.getRows().get(0).get("creator_id"));
  }

  @Test void testHeaderOnlyFileIsEmptyDataset() throws IOException {
    Dataset dataset = reader.read("videos", new StringReader("video_id,creator_id\n"));
    assertTrue(dataset.isEmpty());
    assertEquals(2, dataset.getColumns().size());
  }

  @Test void testMissingHeaderFails() {
    assertThrows(IOException.class, () -> reader.read("videos", new StringReader("")));
  }

  @Test void testTooManyCellsFails() {
    assertThrows(IOException.class, () -> reader.read("videos",
        new StringReader("video_id,creator_id\nv1,1,extra\n")));
  }

  @Test void testDuplicateHeaderFails() {
    assertThrows(IOException.class, () -> reader.read("videos",
        new StringReader("video_id,video_id\nv1,v2\n")));
  }
}
