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

import io.creatorstats.metrics.CorpusStatistics;
import io.creatorstats.qa.ValidationWarning;
import io.creatorstats.storage.OutputTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a successful {@link CreatorStatsPipeline} run.
 *
 * <p>Fatal failures are thrown rather than reported here, so a result always
 * describes a run whose output was published.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineResult result = pipeline.execute(creators, videos);
 * LOGGER.info("Wrote {} files for {}", result.getFiles().size(), result.getRunDate());
 * for (ValidationWarning warning : result.getWarnings()) {
 *   LOGGER.warn("{}", warning);
 * }
 * }</pre>
 */
public class PipelineResult {

  private final LocalDate runDate;
  private final int statisticCount;
  private final Map<OutputTable, Long> rowsPerTable;
  private final List<String> files;
  private final List<ValidationWarning> warnings;
  private final int unmatchedVideoCount;
  private final CorpusStatistics corpus;
  private final long elapsedMs;

  private PipelineResult(Builder builder) {
    this.runDate = builder.runDate;
    this.statisticCount = builder.statisticCount;
    this.rowsPerTable = Collections.unmodifiableMap(
        new EnumMap<OutputTable, Long>(builder.rowsPerTable));
    this.files = Collections.unmodifiableList(new ArrayList<String>(builder.files));
    this.warnings = Collections.unmodifiableList(
        new ArrayList<ValidationWarning>(builder.warnings));
    this.unmatchedVideoCount = builder.unmatchedVideoCount;
    this.corpus = builder.corpus;
    this.elapsedMs = builder.elapsedMs;
  }

  public LocalDate getRunDate() {
    return runDate;
  }

  /**
   * Returns the number of creator statistics written.
   */
  public int getStatisticCount() {
    return statisticCount;
  }

  public Map<OutputTable, Long> getRowsPerTable() {
    return rowsPerTable;
  }

  /**
   * Returns published file paths relative to the output root.
   */
  public List<String> getFiles() {
    return files;
  }

  public List<ValidationWarning> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public int getUnmatchedVideoCount() {
    return unmatchedVideoCount;
  }

  public CorpusStatistics getCorpus() {
    return corpus;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "PipelineResult{runDate=" + runDate + ", statistics=" + statisticCount
        + ", files=" + files.size() + ", warnings=" + warnings.size()
        + ", unmatchedVideos=" + unmatchedVideoCount + ", elapsedMs=" + elapsedMs + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for PipelineResult.
   */
  public static class Builder {
    private LocalDate runDate;
    private int statisticCount;
    private Map<OutputTable, Long> rowsPerTable = new EnumMap<OutputTable, Long>(OutputTable.class);
    private List<String> files = new ArrayList<String>();
    private List<ValidationWarning> warnings = new ArrayList<ValidationWarning>();
    private int unmatchedVideoCount;
    private CorpusStatistics corpus = CorpusStatistics.empty();
    private long elapsedMs;

    public Builder runDate(LocalDate runDate) {
      this.runDate = runDate;
      return this;
    }

    public Builder statisticCount(int statisticCount) {
      this.statisticCount = statisticCount;
      return this;
    }

    public Builder rowsPerTable(Map<OutputTable, Long> rowsPerTable) {
      this.rowsPerTable = new EnumMap<OutputTable, Long>(OutputTable.class);
      this.rowsPerTable.putAll(rowsPerTable);
      return this;
    }

    public Builder files(List<String> files) {
      this.files = files;
      return this;
    }

    public Builder warnings(List<ValidationWarning> warnings) {
      this.warnings = warnings;
      return this;
    }

    public Builder unmatchedVideoCount(int unmatchedVideoCount) {
      this.unmatchedVideoCount = unmatchedVideoCount;
      return this;
    }

    public Builder corpus(CorpusStatistics corpus) {
      this.corpus = corpus;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public PipelineResult build() {
      if (runDate == null) {
        throw new IllegalArgumentException("Run date is required");
      }
      return new PipelineResult(this);
    }
  }
}
