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

import io.creatorstats.dataset.Dataset;
import io.creatorstats.format.csv.CsvDatasetReader;
import io.creatorstats.metrics.CorpusStatistics;
import io.creatorstats.metrics.CreatorMetricsEngine;
import io.creatorstats.metrics.MetricsResult;
import io.creatorstats.qa.DataQualityException;
import io.creatorstats.qa.DatasetValidator;
import io.creatorstats.qa.QaConfig;
import io.creatorstats.qa.ValidationOutcome;
import io.creatorstats.storage.LocalFileStorageProvider;
import io.creatorstats.storage.OutputRecords;
import io.creatorstats.storage.OutputTable;
import io.creatorstats.storage.PartitionedAvroWriter;
import io.creatorstats.storage.StorageProvider;
import io.creatorstats.storage.WriteResult;
import io.creatorstats.text.KeywordExtractor;
import io.creatorstats.text.TfIdfKeywordExtractor;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Orchestrates one creator statistics run.
 *
 * <p>Phases, in order:
 * <ol>
 *   <li>Validation - creators then videos against their QA pipelines</li>
 *   <li>Metrics - join, per-creator aggregation and corpus summary</li>
 *   <li>Write - stage all three output tables, then publish them</li>
 * </ol>
 *
 * <p>A fatal validation failure aborts the run before anything is written.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * QaConfig rules = QaConfigLoader.fromResource(QaConfigLoader.BUNDLED_RULES);
 * RunConfig run = RunConfig.builder().outputRoot("/data/out").build();
 *
 * CreatorStatsPipeline pipeline = new CreatorStatsPipeline(rules, run);
 * PipelineResult result = pipeline.execute(creatorsCsv, videosCsv);
 * }</pre>
 *
 * @see RunConfig
 * @see PipelineResult
 */
public class CreatorStatsPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CreatorStatsPipeline.class);

  public static final String CREATORS = "creators";
  public static final String VIDEOS = "videos";

  private final QaConfig qaConfig;
  private final RunConfig runConfig;
  private final StorageProvider storageProvider;
  private final KeywordExtractor keywordExtractor;
  private final @Nullable ProgressListener progressListener;

  /**
   * Creates a pipeline writing to the local filesystem with English keyword extraction.
   *
   * @param qaConfig QA rules for both inputs
   * @param runConfig Run parameters
   */
  public CreatorStatsPipeline(QaConfig qaConfig, RunConfig runConfig) {
    this(qaConfig, runConfig, new LocalFileStorageProvider(), TfIdfKeywordExtractor.english(),
        new LoggingProgressListener());
  }

  /**
   * Creates a pipeline.
   *
   * @param qaConfig QA rules for both inputs
   * @param runConfig Run parameters
   * @param storageProvider Storage provider for output files
   * @param keywordExtractor Keyword ranking
   * @param progressListener Listener for progress updates, may be null
   */
  public CreatorStatsPipeline(QaConfig qaConfig, RunConfig runConfig,
      StorageProvider storageProvider, KeywordExtractor keywordExtractor,
      @Nullable ProgressListener progressListener) {
    this.qaConfig = requireNonNull(qaConfig, "qaConfig");
    this.runConfig = requireNonNull(runConfig, "runConfig");
    this.storageProvider = requireNonNull(storageProvider, "storageProvider");
    this.keywordExtractor = requireNonNull(keywordExtractor, "keywordExtractor");
    this.progressListener = progressListener;
  }

  /**
   * Reads both CSV files and executes the run.
   *
   * @param creatorsFile Creators CSV or TSV file
   * @param videosFile Videos CSV or TSV file
   * @return Run result
   * @throws DataQualityException If validation fails
   * @throws IOException If an input cannot be read or output cannot be written
   */
  public PipelineResult execute(Path creatorsFile, Path videosFile)
      throws DataQualityException, IOException {
    CsvDatasetReader reader = new CsvDatasetReader();
    Dataset creators = reader.read(CREATORS, creatorsFile);
    Dataset videos = reader.read(VIDEOS, videosFile);
    return execute(creators, videos);
  }

  /**
   * Executes the run on already-loaded datasets.
   *
   * @param creators Raw creators dataset
   * @param videos Raw videos dataset
   * @return Run result
   * @throws DataQualityException If validation fails
   * @throws IOException If output cannot be written
   */
  public PipelineResult execute(Dataset creators, Dataset videos)
      throws DataQualityException, IOException {
    long startTime = System.currentTimeMillis();
    LocalDate runDate = runConfig.getRunDate();
    Instant updatedAt = runConfig.getClock().instant();
    String date = runDate.format(DateTimeFormatter.ISO_LOCAL_DATE);
    LOGGER.info("Starting creator stats run for {} (output: {})", date,
        runConfig.getOutputRoot());

    // Phase 1: validation
    LOGGER.info("Phase 1: Validating input datasets");
    phaseStart("validation", creators.size() + videos.size());
    ValidationOutcome outcome = new DatasetValidator(qaConfig).validate(creators, videos);
    Dataset validCreators = outcome.getCreators().getDataset();
    Dataset validVideos = outcome.getVideos().getDataset();
    phaseComplete("validation", validCreators.size() + validVideos.size());

    // Phase 2: metrics
    LOGGER.info("Phase 2: Computing creator statistics");
    phaseStart("metrics", validVideos.size());
    CreatorMetricsEngine engine = new CreatorMetricsEngine(keywordExtractor,
        runConfig.getKeywordLimit(), runConfig.getTrendingLimit());
    MetricsResult metrics = engine.compute(validCreators, validVideos, runDate, updatedAt);
    phaseComplete("metrics", metrics.getStatistics().size());

    // Phase 3: write
    LOGGER.info("Phase 3: Writing output tables");
    List<OutputRecords> tables = Arrays.asList(
        OutputRecords.creatorStats(metrics.getStatistics()),
        OutputRecords.fromDataset(OutputTable.CREATORS, validCreators, qaConfig.getCreators()),
        OutputRecords.fromDataset(OutputTable.VIDEOS, validVideos, qaConfig.getVideos()));
    phaseStart("write", tables.size());
    PartitionedAvroWriter writer = new PartitionedAvroWriter(storageProvider,
        runConfig.getOutputRoot(), runConfig.getExtension());
    WriteResult written = writer.write(newRunId(date), date, tables);
    phaseComplete("write", written.getFileCount());

    logCorpus(metrics.getCorpus());

    long elapsed = System.currentTimeMillis() - startTime;
    PipelineResult result = PipelineResult.builder()
        .runDate(runDate)
        .statisticCount(metrics.getStatistics().size())
        .rowsPerTable(written.getRowsPerTable())
        .files(written.getFiles())
        .warnings(outcome.getWarnings())
        .unmatchedVideoCount(metrics.getUnmatchedVideoCount())
        .corpus(metrics.getCorpus())
        .elapsedMs(elapsed)
        .build();
    LOGGER.info("Creator stats run complete: {}", result);
    return result;
  }

  private static void logCorpus(CorpusStatistics corpus) {
    LOGGER.info("Average Views Total: {}", corpus.getAvgViewsTotal());
    LOGGER.info("Views Per Category: {}", corpus.getViewsPerCategory());
    LOGGER.info("Top Keywords By Video: {}", corpus.getKeywordsPerVideo());
    LOGGER.info("Trending Keywords: {}", corpus.getTrendingKeywords());
  }

  private static String newRunId(String date) {
    return date + "_" + UUID.randomUUID();
  }

  private void phaseStart(String phase, int totalItems) {
    if (progressListener != null) {
      progressListener.onPhaseStart(phase, totalItems);
    }
  }

  private void phaseComplete(String phase, int processedItems) {
    if (progressListener != null) {
      progressListener.onPhaseComplete(phase, processedItems);
    }
  }

  /**
   * Listener for pipeline progress updates.
   */
  public interface ProgressListener {
    /**
     * Called when a phase starts.
     *
     * @param phase Phase name
     * @param totalItems Total items in this phase
     */
    void onPhaseStart(String phase, int totalItems);

    /**
     * Called when a phase completes.
     *
     * @param phase Phase name
     * @param processedItems Number of items processed
     */
    void onPhaseComplete(String phase, int processedItems);
  }

  /**
   * Default progress listener that logs to SLF4J.
   */
  public static class LoggingProgressListener implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onPhaseStart(String phase, int totalItems) {
      LOG.info("Starting phase '{}' with {} items", phase, totalItems);
    }

    @Override
    public void onPhaseComplete(String phase, int processedItems) {
      LOG.info("Completed phase '{}': {} items processed", phase, processedItems);
    }
  }
}
