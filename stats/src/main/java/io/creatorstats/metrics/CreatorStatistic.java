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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Per-creator engagement statistics for one run. Immutable.
 */
public final class CreatorStatistic {

  private final long creatorId;
  private final String timestamp;
  private final String username;
  private final long followerCount;
  private final double avgViews;
  private final String topCategory;
  private final double avgEngagement;
  private final double viralityScore;
  private final List<String> topKeywords;
  private final Instant updatedAt;

  private CreatorStatistic(Builder builder) {
    this.creatorId = builder.creatorId;
    this.timestamp = builder.timestamp;
    this.username = builder.username;
    this.followerCount = builder.followerCount;
    this.avgViews = builder.avgViews;
    this.topCategory = builder.topCategory;
    this.avgEngagement = builder.avgEngagement;
    this.viralityScore = builder.viralityScore;
    this.topKeywords = ImmutableList.copyOf(builder.topKeywords);
    this.updatedAt = builder.updatedAt.truncatedTo(ChronoUnit.MICROS);
  }

  public long getCreatorId() {
    return creatorId;
  }

  /**
   * Returns the run date as {@code yyyy-MM-dd}.
   */
  public String getTimestamp() {
    return timestamp;
  }

  public String getUsername() {
    return username;
  }

  public long getFollowerCount() {
    return followerCount;
  }

  public double getAvgViews() {
    return avgViews;
  }

  public String getTopCategory() {
    return topCategory;
  }

  public double getAvgEngagement() {
    return avgEngagement;
  }

  public double getViralityScore() {
    return viralityScore;
  }

  public List<String> getTopKeywords() {
    return topKeywords;
  }

  /**
   * Returns the run instant, truncated to microseconds.
   */
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * Formats the statistic as a pipe-delimited log line.
   */
  public String toLogLine() {
    return creatorId + "|" + username + "|" + followerCount + "|" + avgViews + "|"
        + avgEngagement + "|" + viralityScore + "|" + topCategory + "|"
        + String.join(",", topKeywords);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CreatorStatistic)) {
      return false;
    }
    CreatorStatistic that = (CreatorStatistic) o;
    return creatorId == that.creatorId
        && followerCount == that.followerCount
        && Double.compare(avgViews, that.avgViews) == 0
        && Double.compare(avgEngagement, that.avgEngagement) == 0
        && Double.compare(viralityScore, that.viralityScore) == 0
        && timestamp.equals(that.timestamp)
        && username.equals(that.username)
        && topCategory.equals(that.topCategory)
        && topKeywords.equals(that.topKeywords)
        && updatedAt.equals(that.updatedAt);
  }

  @Override public int hashCode() {
    return Objects.hash(creatorId, timestamp, username, followerCount, avgViews, topCategory,
        avgEngagement, viralityScore, topKeywords, updatedAt);
  }

  @Override public String toString() {
    return "CreatorStatistic{" + toLogLine() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for CreatorStatistic.
   */
  public static class Builder {
    private long creatorId;
    private String timestamp;
    private String username = "";
    private long followerCount;
    private double avgViews;
    private String topCategory = "";
    private double avgEngagement;
    private double viralityScore;
    private List<String> topKeywords = ImmutableList.of();
    private Instant updatedAt;

    public Builder creatorId(long creatorId) {
      this.creatorId = creatorId;
      return this;
    }

    public Builder timestamp(String timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder username(String username) {
      this.username = username == null ? "" : username;
      return this;
    }

    public Builder followerCount(long followerCount) {
      this.followerCount = followerCount;
      return this;
    }

    public Builder avgViews(double avgViews) {
      this.avgViews = avgViews;
      return this;
    }

    public Builder topCategory(String topCategory) {
      this.topCategory = topCategory == null ? "" : topCategory;
      return this;
    }

    public Builder avgEngagement(double avgEngagement) {
      this.avgEngagement = avgEngagement;
      return this;
    }

    public Builder viralityScore(double viralityScore) {
      this.viralityScore = viralityScore;
      return this;
    }

    public Builder topKeywords(List<String> topKeywords) {
      this.topKeywords = topKeywords;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public CreatorStatistic build() {
      if (timestamp == null) {
        throw new IllegalArgumentException("timestamp is required");
      }
      if (updatedAt == null) {
        throw new IllegalArgumentException("updatedAt is required");
      }
      return new CreatorStatistic(this);
    }
  }
}
