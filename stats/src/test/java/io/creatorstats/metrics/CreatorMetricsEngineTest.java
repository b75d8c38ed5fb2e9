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
package io.creatorstats.metrics;

import io.creatorstats.dataset.Dataset;
import io.creatorstats.text.TfIdfKeywordExtractor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CreatorMetricsEngine}.
 */
@Tag("unit")
public class CreatorMetricsEngineTest {

  private static final LocalDate RUN_DATE = LocalDate.of(2025, 1, 31);
  private static final Instant UPDATED_AT = Instant.parse("2025-01-31T10:15:30.123456789Z");

  private CreatorMetricsEngine engine;

  @BeforeEach
  void setUp() {
    engine = new CreatorMetricsEngine(TfIdfKeywordExtractor.english(), 3, 5);
  }

  private static Dataset.Builder creators() {
    return Dataset.builder("creators")
        .columns("creator_id", "username", "follower_count", "avg_views", "category", "bio");
  }

  private static Dataset.Builder videos() {
    return Dataset.builder("videos")
        .columns("video_id", "creator_id", "views", "likes", "comments", "shares", "caption");
  }

  @Test void testSingleCreatorScenario() {
    Dataset creators = creators().addRow(1L, "a", 100L, 50L, "Tech", "bio").build();
    Dataset videos = videos()
        .addRow("v1", 1L, 1000L, 50L, 10L, 5L, "great tech tips")
        .addRow("v2", 1L, 0L, 0L, 0L, 0L, "")
        .build();

    MetricsResult result = engine.compute(creators, videos, RUN_DATE, UPDATED_AT);

    assertEquals(1, result.getStatistics().size());
    CreatorStatistic stat = result.getStatistics().get(0);
    assertEquals(1L, stat.getCreatorId());
    assertEquals("2025-01-31", stat.getTimestamp());
    assertEquals("a", stat.getUsername());
    assertEquals(100L, stat.getFollowerCount());
    assertEquals(500.0, stat.getAvgViews(), 1e-12);
    assertEquals("Tech", stat.getTopCategory());
    assertEquals(0.0325, stat.getAvgEngagement(), 1e-12);
    assertEquals(Math.log(0.000325), stat.getViralityScore(), 1e-9);
    assertTrue(stat.getViralityScore() < 0);
    assertEquals(Arrays.asList("great", "tech", "tips"), stat.getTopKeywords());
    assertEquals(Instant.parse("2025-01-31T10:15:30.123456Z"), stat.getUpdatedAt());
    assertEquals(0, result.getUnmatchedVideoCount());
  }

  @Test void testZeroFollowersGivesZeroVirality() {
    Dataset creators = creators().addRow(1L, "u1", 0L, 0L, "Cat", "").build();
    Dataset videos = videos().addRow("101", 1L, 1000L, 10L, 5L, 2L, "test").build();

    CreatorStatistic stat =
        engine.compute(creators, videos, RUN_DATE, UPDATED_AT).getStatistics().get(0);

    assertEquals(0.0, stat.getViralityScore());
    assertEquals(0.017, stat.getAvgEngagement(), 1e-12);
  }

  @Test void testUnmatchedVideosExcludedFromAggregation() {
    Dataset creators = creators().addRow(1L, "u1", 10L, 0L, "A", "").build();
    Dataset videos = videos()
        .addRow("101", 1L, 100L, 0L, 0L, 0L, "a")
        .addRow("102", 99L, 200L, 0L, 0L, 0L, "b")
        .build();

    MetricsResult result = engine.compute(creators, videos, RUN_DATE, UPDATED_AT);

    assertEquals(1, result.getStatistics().size());
    assertEquals(100.0, result.getStatistics().get(0).getAvgViews());
    assertEquals(1, result.getMatchedVideoCount());
    assertEquals(1, result.getUnmatchedVideoCount());
    assertEquals(100.0, result.getCorpus().getAvgViewsTotal());
  }

  @Test void testCreatorsWithoutVideosHaveNoStatistic() {
    Dataset creators = creators()
        .addRow(2L, "b", 5L, 0L, "B", "")
        .addRow(1L, "a", 5L, 0L, "A", "")
        .addRow(3L, "c", 5L, 0L, "C", "")
        .build();
    Dataset videos = videos()
        .addRow("v3", 3L, 10L, 1L, 0L, 0L, "")
        .addRow("v1", 1L, 10L, 1L, 0L, 0L, "")
        .build();

    MetricsResult result = engine.compute(creators, videos, RUN_DATE, UPDATED_AT);

    assertEquals(2, result.getStatistics().size());
    assertEquals(1L, result.getStatistics().get(0).getCreatorId());
    assertEquals(3L, result.getStatistics().get(1).getCreatorId());
    assertTrue(result.getStatistics().get(0).getTopKeywords().isEmpty());
  }

  @Test void testAllZeroViewsNeverProducesNaN() {
    Dataset creators = creators().addRow(1L, "a", 10L, 0L, "A", "").build();
    Dataset videos = videos()
        .addRow("v1", 1L, 0L, 5L, 5L, 5L, "")
        .addRow("v2", 1L, 0L, 0L, 0L, 0L, "")
        .build();

    CreatorStatistic stat =
        engine.compute(creators, videos, RUN_DATE, UPDATED_AT).getStatistics().get(0);

    assertEquals(0.0, stat.getAvgViews());
    assertEquals(0.0, stat.getAvgEngagement());
    assertEquals(0.0, stat.getViralityScore());
  }

  @Test void testCorpusStatistics() {
    Dataset creators = creators()
        .addRow(1L, "u1", 1L, 0L, "Gaming", "")
        .addRow(2L, "u2", 1L, 0L, "Cooking", "")
        .build();
    Dataset videos = videos()
        .addRow("101", 1L, 10L, 0L, 0L, 0L, "viral viral trend")
        .addRow("102", 1L, 20L, 0L, 0L, 0L, "viral trend cool")
        .addRow("103", 2L, 600L, 0L, 0L, 0L, "viral something else")
        .build();

    CorpusStatistics corpus = engine.compute(creators, videos, RUN_DATE, UPDATED_AT).getCorpus();

    assertEquals(210.0, corpus.getAvgViewsTotal(), 1e-12);
    assertEquals(Arrays.asList("Cooking", "Gaming"),
        Arrays.asList(corpus.getViewsPerCategory().keySet().toArray()));
    assertEquals(Long.valueOf(30L), corpus.getViewsPerCategory().get("Gaming"));
    assertEquals(Long.valueOf(600L), corpus.getViewsPerCategory().get("Cooking"));
    assertEquals(Arrays.asList("viral", "trend", "cool"), corpus.getTrendingKeywords());
    assertEquals(Arrays.asList("101", "102", "103"),
        Arrays.asList(corpus.getKeywordsPerVideo().keySet().toArray()));
    assertEquals(Collections.singletonList("viral"), corpus.getKeywordsPerVideo().get("103"));
  }

  @Test void testEmptyInputs() {
    MetricsResult result = engine.compute(creators().build(), videos().build(), RUN_DATE,
        UPDATED_AT);
    assertTrue(result.getStatistics().isEmpty());
    assertEquals(0.0, result.getCorpus().getAvgViewsTotal());
    assertTrue(result.getCorpus().getTrendingKeywords().isEmpty());
  }

  @Test void testDeterministic() {
    Dataset creators = creators()
        .addRow(1L, "a", 10L, 0L, "A", "")
        .addRow(2L, "b", 20L, 0L, "B", "")
        .build();
    Dataset videos = videos()
        .addRow("v1", 2L, 100L, 3L, 2L, 1L, "alpha beta gamma")
        .addRow("v2", 1L, 50L, 1L, 0L, 0L, "delta epsilon")
        .addRow("v3", 2L, 70L, 0L, 4L, 0L, "beta gamma")
        .build();

    MetricsResult first = engine.compute(creators, videos, RUN_DATE, UPDATED_AT);
    MetricsResult second = engine.compute(creators, videos, RUN_DATE, UPDATED_AT);
    assertEquals(first.getStatistics(), second.getStatistics());
  }
}
