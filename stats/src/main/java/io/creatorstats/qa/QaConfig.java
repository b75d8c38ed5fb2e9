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

import java.util.List;
import java.util.Map;

/**
 * QA configuration for a run: one rule pipeline per input dataset.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * creators:
 *   - column: creator_id
 *     expected_type: int64
 *     assertions:
 *       - check: non_negative
 *         should_fail: true
 * videos:
 *   - column: video_id
 *     expected_type: string
 * }</pre>
 *
 * @see QaConfigLoader
 */
public class QaConfig {

  public static final String CREATORS = "creators";
  public static final String VIDEOS = "videos";

  private final QaPipeline creators;
  private final QaPipeline videos;

  private QaConfig(Builder builder) {
    this.creators = builder.creators;
    this.videos = builder.videos;
  }

  public QaPipeline getCreators() {
    return creators;
  }

  public QaPipeline getVideos() {
    return videos;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a QaConfig from a parsed YAML/JSON document.
   *
   * @param map Map with {@code creators} and {@code videos} rule lists
   * @return QaConfig instance
   * @throws IllegalArgumentException If either pipeline is missing or invalid
   */
  public static QaConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("QA configuration is empty");
    }
    Object creatorsObj = map.get(CREATORS);
    Object videosObj = map.get(VIDEOS);
    if (!(creatorsObj instanceof List)) {
      throw new IllegalArgumentException("QA configuration requires a '" + CREATORS + "' list");
    }
    if (!(videosObj instanceof List)) {
      throw new IllegalArgumentException("QA configuration requires a '" + VIDEOS + "' list");
    }
    return builder()
        .creators(QaPipeline.fromList(CREATORS, (List<?>) creatorsObj))
        .videos(QaPipeline.fromList(VIDEOS, (List<?>) videosObj))
        .build();
  }

  /**
   * Builder for QaConfig.
   */
  public static class Builder {
    private QaPipeline creators;
    private QaPipeline videos;

    public Builder creators(QaPipeline creators) {
      this.creators = creators;
      return this;
    }

    public Builder videos(QaPipeline videos) {
      this.videos = videos;
      return this;
    }

    public QaConfig build() {
      if (creators == null) {
        throw new IllegalArgumentException("Creators pipeline is required");
      }
      if (videos == null) {
        throw new IllegalArgumentException("Videos pipeline is required");
      }
      return new QaConfig(this);
    }
  }
}
