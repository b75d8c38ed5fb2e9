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

import java.util.List;

/**
 * Output of {@link CreatorMetricsEngine#compute}.
 */
public final class MetricsResult {

  private final List<CreatorStatistic> statistics;
  private final int matchedVideoCount;
  private final int unmatchedVideoCount;
  private final CorpusStatistics corpus;

  public MetricsResult(List<CreatorStatistic> statistics, int matchedVideoCount,
      int unmatchedVideoCount, CorpusStatistics corpus) {
    this.statistics = ImmutableList.copyOf(statistics);
    this.matchedVideoCount = matchedVideoCount;
    this.unmatchedVideoCount = unmatchedVideoCount;
    this.corpus = corpus;
  }

  /**
   * Returns one statistic per creator with at least one matched video,
   * ordered by creator id.
   */
  public List<CreatorStatistic> getStatistics() {
    return statistics;
  }

  public int getMatchedVideoCount() {
    return matchedVideoCount;
  }

  /**
   * Returns the number of videos whose creator id is not in the creators dataset.
   */
  public int getUnmatchedVideoCount() {
    return unmatchedVideoCount;
  }

  public CorpusStatistics getCorpus() {
    return corpus;
  }
}
