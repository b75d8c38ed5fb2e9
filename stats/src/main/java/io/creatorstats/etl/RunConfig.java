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
package io.creatorstats.etl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Parameters of one pipeline run.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * output: /data/creator-stats
 * date: "2025-01-31"        # optional, defaults to today
 * keyword_limit: 3
 * trending_limit: 5
 * extension: avro
 * }</pre>
 */
public class RunConfig {

  public static final int DEFAULT_KEYWORD_LIMIT = 3;
  public static final int DEFAULT_TRENDING_LIMIT = 5;
  public static final String DEFAULT_EXTENSION = "avro";

  private final String outputRoot;
  private final @Nullable LocalDate runDate;
  private final int keywordLimit;
  private final int trendingLimit;
  private final String extension;
  private final Clock clock;

  private RunConfig(Builder builder) {
    this.outputRoot = builder.outputRoot;
    this.runDate = builder.runDate;
    this.keywordLimit = builder.keywordLimit;
    this.trendingLimit = builder.trendingLimit;
    this.extension = builder.extension;
    this.clock = builder.clock;
  }

  public String getOutputRoot() {
    return outputRoot;
  }

  /**
   * Returns the configured run date, or today according to the clock.
   */
  public LocalDate getRunDate() {
    return runDate != null ? runDate : LocalDate.now(clock);
  }

  public int getKeywordLimit() {
    return keywordLimit;
  }

  public int getTrendingLimit() {
    return trendingLimit;
  }

  public String getExtension() {
    return extension;
  }

  public Clock getClock() {
    return clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a RunConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return RunConfig instance
   */
  public static RunConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    Object output = map.get("output");
    if (output != null) {
      builder.outputRoot(output.toString());
    }
    Object date = map.get("date");
    if (date != null) {
      builder.runDate(parseDate(date.toString()));
    }
    Object keywordLimit = map.get("keyword_limit");
    if (keywordLimit instanceof Number) {
      builder.keywordLimit(((Number) keywordLimit).intValue());
    }
    Object trendingLimit = map.get("trending_limit");
    if (trendingLimit instanceof Number) {
      builder.trendingLimit(((Number) trendingLimit).intValue());
    }
    Object extension = map.get("extension");
    if (extension != null) {
      builder.extension(extension.toString());
    }
    return builder.build();
  }

  /**
   * Parses a {@code yyyy-MM-dd} date.
   *
   * @throws IllegalArgumentException If the text is not a valid date
   */
  public static LocalDate parseDate(String text) {
    try {
      return LocalDate.parse(text.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid run date '" + text + "', expected yyyy-MM-dd",
          e);
    }
  }

  /**
   * Builder for RunConfig.
   */
  public static class Builder {
    private String outputRoot;
    private LocalDate runDate;
    private int keywordLimit = DEFAULT_KEYWORD_LIMIT;
    private int trendingLimit = DEFAULT_TRENDING_LIMIT;
    private String extension = DEFAULT_EXTENSION;
    private Clock clock = Clock.systemDefaultZone();

    public Builder outputRoot(String outputRoot) {
      this.outputRoot = outputRoot;
      return this;
    }

    public Builder runDate(@Nullable LocalDate runDate) {
      this.runDate = runDate;
      return this;
    }

    public Builder keywordLimit(int keywordLimit) {
      this.keywordLimit = keywordLimit;
      return this;
    }

    public Builder trendingLimit(int trendingLimit) {
      this.trendingLimit = trendingLimit;
      return this;
    }

    public Builder extension(String extension) {
      this.extension = extension;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RunConfig build() {
      if (outputRoot == null || outputRoot.isEmpty()) {
        throw new IllegalArgumentException("Output root is required");
      }
      if (keywordLimit < 0 || trendingLimit < 0) {
        throw new IllegalArgumentException("Keyword limits must not be negative");
      }
      if (extension == null || extension.isEmpty() || extension.startsWith(".")) {
        throw new IllegalArgumentException("Extension must be non-empty and without a dot: "
            + extension);
      }
      if (clock == null) {
        throw new IllegalArgumentException("Clock is required");
      }
      return new RunConfig(this);
    }
  }
}
