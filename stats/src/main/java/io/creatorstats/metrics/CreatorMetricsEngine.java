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
import io.creatorstats.text.KeywordExtractor;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Joins validated videos to validated creators and aggregates per-creator
 * engagement statistics.
 *
 * <p>Videos whose {@code creator_id} has no creator row are left out of every
 * aggregate and counted as unmatched. Creators without matched videos get no
 * statistic. Statistics are ordered by creator id.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CreatorMetricsEngine engine =
 *     new CreatorMetricsEngine(TfIdfKeywordExtractor.english(), 3, 5);
 * MetricsResult result = engine.compute(creators, videos, runDate, Instant.now());
 * }</pre>
 */
public class CreatorMetricsEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(CreatorMetricsEngine.class);

  public static final String CREATOR_ID = "creator_id";
  public static final String USERNAME = "username";
  public static final String FOLLOWER_COUNT = "follower_count";
  public static final String CATEGORY = "category";
  public static final String VIDEO_ID = "video_id";
  public static final String VIEWS = "views";
  public static final String LIKES = "likes";
  public static final String COMMENTS = "comments";
  public static final String SHARES = "shares";
  public static final String CAPTION = "caption";

  private final KeywordExtractor keywordExtractor;
  private final int keywordLimit;
  private final int trendingLimit;

  public CreatorMetricsEngine(KeywordExtractor keywordExtractor, int keywordLimit,
      int trendingLimit) {
    this.keywordExtractor = requireNonNull(keywordExtractor, "keywordExtractor");
    if (keywordLimit < 0 || trendingLimit < 0) {
      throw new IllegalArgumentException("Keyword limits must not be negative");
    }
    this.keywordLimit = keywordLimit;
    this.trendingLimit = trendingLimit;
  }

  /**
   * Computes statistics for one run.
   *
   * @param creators Validated creators
   * @param videos Validated videos
   * @param runDate Date written to each statistic's {@code timestamp}
   * @param updatedAt Run instant written to each statistic's {@code updated_at}
   * @return Statistics, join counts and corpus summary
   */
  public MetricsResult compute(Dataset creators, Dataset videos, LocalDate runDate,
      Instant updatedAt) {
    Map<Long, Map<String, Object>> creatorsById = indexCreators(creators);

    Map<Long, List<Map<String, Object>>> videosByCreator =
        new TreeMap<Long, List<Map<String, Object>>>();
    List<Map<String, Object>> matched = new ArrayList<Map<String, Object>>();
    int unmatched = 0;
    for (Map<String, Object> video : videos.getRows()) {
      Long creatorId = asLong(video.get(CREATOR_ID));
      if (creatorId == null || !creatorsById.containsKey(creatorId)) {
        unmatched++;
        continue;
      }
      videosByCreator.computeIfAbsent(creatorId, k -> new ArrayList<Map<String, Object>>())
          .add(video);
      matched.add(video);
    }
    if (unmatched > 0) {
      LOGGER.warn("Found {} videos with unmatched creator_id", unmatched);
    }

    String timestamp = runDate.format(DateTimeFormatter.ISO_LOCAL_DATE);
    List<CreatorStatistic> statistics = new ArrayList<CreatorStatistic>();
    for (Map.Entry<Long, List<Map<String, Object>>> entry : videosByCreator.entrySet()) {
      CreatorStatistic statistic = aggregate(creatorsById.get(entry.getKey()), entry.getKey(),
          entry.getValue(), timestamp, updatedAt);
      LOGGER.info("Creator stats: {}", statistic.toLogLine());
      statistics.add(statistic);
    }

    CorpusStatistics corpus = corpusStatistics(matched, creatorsById);
    LOGGER.debug("Computed {} creator statistic(s) from {} matched video(s)",
        statistics.size(), matched.size());
    return new MetricsResult(statistics, matched.size(), unmatched, corpus);
  }

  private CreatorStatistic aggregate(Map<String, Object> creator, long creatorId,
      List<Map<String, Object>> videos, String timestamp, Instant updatedAt) {
    double[] views = new double[videos.size()];
    double[] rates = new double[videos.size()];
    List<String> captions = new ArrayList<String>(videos.size());
    for (int i = 0; i < videos.size(); i++) {
      Map<String, Object> video = videos.get(i);
      long videoViews = longValue(video.get(VIEWS));
      views[i] = videoViews;
      rates[i] = EngagementMetrics.engagementRate(videoViews, longValue(video.get(LIKES)),
          longValue(video.get(COMMENTS)), longValue(video.get(SHARES)));
      captions.add(stringValue(video.get(CAPTION)));
    }

    long followerCount = longValue(creator.get(FOLLOWER_COUNT));
    double avgEngagement = EngagementMetrics.mean(rates);
    return CreatorStatistic.builder()
        .creatorId(creatorId)
        .timestamp(timestamp)
        .username(stringValue(creator.get(USERNAME)))
        .followerCount(followerCount)
        .avgViews(EngagementMetrics.mean(views))
        .topCategory(stringValue(creator.get(CATEGORY)))
        .avgEngagement(avgEngagement)
        .viralityScore(EngagementMetrics.viralityScore(avgEngagement, followerCount))
        .topKeywords(keywordExtractor.topKeywords(captions, keywordLimit))
        .updatedAt(updatedAt)
        .build();
  }

  private CorpusStatistics corpusStatistics(List<Map<String, Object>> matched,
      Map<Long, Map<String, Object>> creatorsById) {
    if (matched.isEmpty()) {
      return CorpusStatistics.empty();
    }
    double[] views = new double[matched.size()];
    Map<String, Long> viewsPerCategory = new TreeMap<String, Long>();
    List<String> captions = new ArrayList<String>(matched.size());
    for (int i = 0; i < matched.size(); i++) {
      Map<String, Object> video = matched.get(i);
      long videoViews = longValue(video.get(VIEWS));
      views[i] = videoViews;
      Map<String, Object> creator = creatorsById.get(asLong(video.get(CREATOR_ID)));
      viewsPerCategory.merge(stringValue(creator.get(CATEGORY)), videoViews, Long::sum);
      captions.add(stringValue(video.get(CAPTION)));
    }

    List<List<String>> perDocument =
        keywordExtractor.topKeywordsPerDocument(captions, keywordLimit);
    Map<String, List<String>> keywordsPerVideo = new LinkedHashMap<String, List<String>>();
    for (int i = 0; i < matched.size(); i++) {
      keywordsPerVideo.put(stringValue(matched.get(i).get(VIDEO_ID)), perDocument.get(i));
    }

    return new CorpusStatistics(EngagementMetrics.mean(views), viewsPerCategory,
        keywordsPerVideo, keywordExtractor.topKeywords(captions, trendingLimit));
  }

  private static Map<Long, Map<String, Object>> indexCreators(Dataset creators) {
    Map<Long, Map<String, Object>> byId = new LinkedHashMap<Long, Map<String, Object>>();
    for (Map<String, Object> row : creators.getRows()) {
      Long id = asLong(row.get(CREATOR_ID));
      if (id == null) {
        continue;
      }
      if (byId.putIfAbsent(id, row) != null) {
        LOGGER.warn("Duplicate creator_id {}; using the first row", id);
      }
    }
    return byId;
  }

  private static @Nullable Long asLong(@Nullable Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    return null;
  }

  private static long longValue(@Nullable Object value) {
    return value instanceof Number ? ((Number) value).longValue() : 0L;
  }

  private static String stringValue(@Nullable Object value) {
    return value == null ? "" : value.toString();
  }
}
