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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Summary figures over all matched videos of a run.
 */
public final class CorpusStatistics {

  private final double avgViewsTotal;
  private final Map<String, Long> viewsPerCategory;
  private final Map<String, List<String>> keywordsPerVideo;
  private final List<String> trendingKeywords;

  public CorpusStatistics(double avgViewsTotal, Map<String, Long> viewsPerCategory,
      Map<String, List<String>> keywordsPerVideo, List<String> trendingKeywords) {
    this.avgViewsTotal = avgViewsTotal;
    this.viewsPerCategory = ImmutableMap.copyOf(viewsPerCategory);
    this.keywordsPerVideo = ImmutableMap.copyOf(keywordsPerVideo);
    this.trendingKeywords = ImmutableList.copyOf(trendingKeywords);
  }

  public static CorpusStatistics empty() {
    return new CorpusStatistics(0.0, ImmutableMap.<String, Long>of(),
        ImmutableMap.<String, List<String>>of(), ImmutableList.<String>of());
  }

  /**
   * Mean views over all matched videos; 0 when there are none.
   */
  public double getAvgViewsTotal() {
    return avgViewsTotal;
  }

  /**
   * Total views per creator category, in category order.
   */
  public Map<String, Long> getViewsPerCategory() {
    return viewsPerCategory;
  }

  /**
   * Top keywords per video id, in video input order.
   */
  public Map<String, List<String>> getKeywordsPerVideo() {
    return keywordsPerVideo;
  }

  public List<String> getTrendingKeywords() {
    return trendingKeywords;
  }

  @Override public String toString() {
    return "CorpusStatistics{avgViewsTotal=" + avgViewsTotal
        + ", viewsPerCategory=" + viewsPerCategory
        + ", trendingKeywords=" + trendingKeywords + "}";
  }
}
