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

/**
 * Engagement arithmetic with explicit guards for degenerate inputs.
 *
 * <p>None of these methods throw, and none return NaN or an infinity.
 */
public final class EngagementMetrics {

  private EngagementMetrics() {
  }

  /**
   * Returns {@code (likes + comments + shares) / views}, or 0 when views is
   * not positive.
   */
  public static double engagementRate(long views, long likes, long comments, long shares) {
    if (views <= 0) {
      return 0.0;
    }
    return ((double) likes + comments + shares) / views;
  }

  /**
   * Returns {@code ln(avgEngagement / followerCount)}, or 0 when the follower
   * count is not positive or the ratio is not positive.
   */
  public static double viralityScore(double avgEngagement, long followerCount) {
    if (followerCount <= 0) {
      return 0.0;
    }
    double ratio = avgEngagement / followerCount;
    if (!(ratio > 0.0) || Double.isInfinite(ratio)) {
      return 0.0;
    }
    return Math.log(ratio);
  }

  /**
   * Arithmetic mean, 0 for an empty input.
   */
  public static double mean(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }
}
