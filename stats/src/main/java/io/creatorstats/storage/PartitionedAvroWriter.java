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
package io.creatorstats.storage;

import org.apache.avro.file.CodecFactory;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Writes output tables as Avro container files under a Hive-style layout.
 *
 * <p>Every file of a run is first written to
 * {@code {root}/_temporary/{runId}/} mirroring its final relative path. Only
 * when all files have been staged are they moved into place, one atomic
 * rename per file, so an existing file for the same date is either fully
 * replaced or left untouched. If staging fails the staging directory is
 * removed and nothing is published. If a move fails, the files already
 * published by the run are removed and the files they replaced are moved
 * back.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PartitionedAvroWriter writer =
 *     new PartitionedAvroWriter(new LocalFileStorageProvider(), "/data/out", "avro");
 * WriteResult result = writer.write(runId, "2025-01-31", Arrays.asList(
 *     OutputRecords.creatorStats(stats),
 *     OutputRecords.fromDataset(OutputTable.CREATORS, creators, config.getCreators()),
 *     OutputRecords.fromDataset(OutputTable.VIDEOS, videos, config.getVideos())));
 * }</pre>
 */
public class PartitionedAvroWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionedAvroWriter.class);

  /** Directory under the output root holding in-progress runs. */
  public static final String STAGING_DIRECTORY = "_temporary";

  /** Directory under a run's staging directory holding replaced files. */
  static final String PREVIOUS_DIRECTORY = "_previous";

  private final StorageProvider storageProvider;
  private final String outputRoot;
  private final String extension;

  public PartitionedAvroWriter(StorageProvider storageProvider, String outputRoot,
      String extension) {
    this.storageProvider = requireNonNull(storageProvider, "storageProvider");
    this.outputRoot = requireNonNull(outputRoot, "outputRoot");
    this.extension = requireNonNull(extension, "extension");
  }

  /**
   * Stages and publishes every table.
   *
   * @param runId Unique identifier of the run, used for the staging directory
   * @param date Run date, {@code yyyy-MM-dd}
   * @param tables Tables to write
   * @return Published files and row counts
   * @throws PartitionWriteException If a file cannot be staged or published
   */
  public WriteResult write(String runId, String date, List<OutputRecords> tables)
      throws IOException {
    long startTime = System.currentTimeMillis();
    String stagingBase = storageProvider.resolvePath(outputRoot, STAGING_DIRECTORY + "/" + runId);
    LOGGER.debug("Staging {} table(s) in {}", tables.size(), stagingBase);

    Map<String, OutputTable> staged = new LinkedHashMap<String, OutputTable>();
    Map<OutputTable, Long> rowsPerTable = new EnumMap<OutputTable, Long>(OutputTable.class);
    try {
      for (OutputRecords table : tables) {
        for (Map.Entry<Object, List<GenericRecord>> partition
            : table.getPartitions().entrySet()) {
          String relativePath =
              table.getTable().relativePath(partition.getKey(), date, extension);
          stage(table, stagingBase, relativePath, partition.getValue());
          staged.put(relativePath, table.getTable());
        }
        rowsPerTable.merge(table.getTable(), table.getRecordCount(), Long::sum);
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Staging failed for run {}: {}", runId, e.getMessage());
      discardStaging(stagingBase);
      throw e;
    }

    List<String> published = new ArrayList<String>(staged.size());
    List<String> backedUp = new ArrayList<String>();
    try {
      for (Map.Entry<String, OutputTable> entry : staged.entrySet()) {
        publish(entry.getValue(), stagingBase, entry.getKey(), backedUp);
        published.add(entry.getKey());
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Publishing failed for run {}: {}", runId, e.getMessage());
      rollback(stagingBase, published, backedUp);
      throw e;
    } finally {
      discardStaging(stagingBase);
    }

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Published {} file(s) under {} in {}ms", published.size(), outputRoot, elapsed);
    return new WriteResult(published, rowsPerTable, elapsed);
  }

  private void stage(OutputRecords table, String stagingBase, String relativePath,
      List<GenericRecord> records) throws PartitionWriteException {
    String stagedPath = storageProvider.resolvePath(stagingBase, relativePath);
    try {
      storageProvider.createDirectories(parentOf(stagedPath));
      GenericDatumWriter<GenericRecord> datumWriter =
          new GenericDatumWriter<GenericRecord>(table.getSchema());
      try (OutputStream out = storageProvider.openOutputStream(stagedPath);
           DataFileWriter<GenericRecord> fileWriter =
               new DataFileWriter<GenericRecord>(datumWriter)) {
        fileWriter.setCodec(CodecFactory.nullCodec());
        fileWriter.create(table.getSchema(), out);
        for (GenericRecord record : records) {
          fileWriter.append(record);
        }
      }
      LOGGER.debug("Staged {} record(s) to {}", records.size(), stagedPath);
    } catch (IOException | RuntimeException e) {
      throw new PartitionWriteException(table.getTable(), relativePath,
          "Failed to stage output file: " + e.getMessage(), e);
    }
  }

  /**
   * Moves a staged file into place. An existing target is first moved to
   * {@code {stagingBase}/_previous/} and recorded in {@code backedUp} so that
   * {@link #rollback} can put it back.
   */
  private void publish(OutputTable table, String stagingBase, String relativePath,
      List<String> backedUp) throws PartitionWriteException {
    String source = storageProvider.resolvePath(stagingBase, relativePath);
    String target = storageProvider.resolvePath(outputRoot, relativePath);
    try {
      if (storageProvider.exists(target)) {
        String backup = backupPath(stagingBase, relativePath);
        storageProvider.createDirectories(parentOf(backup));
        storageProvider.move(target, backup);
        backedUp.add(relativePath);
      }
      storageProvider.createDirectories(parentOf(target));
      storageProvider.move(source, target);
      LOGGER.debug("Published {}", target);
    } catch (IOException e) {
      throw new PartitionWriteException(table, relativePath,
          "Failed to publish output file: " + e.getMessage(), e);
    }
  }

  /**
   * Removes the files this run published and restores the files they
   * replaced. Failures are logged so that the remaining files are still
   * restored.
   */
  private void rollback(String stagingBase, List<String> published, List<String> backedUp) {
    for (int i = published.size() - 1; i >= 0; i--) {
      String target = storageProvider.resolvePath(outputRoot, published.get(i));
      try {
        storageProvider.delete(target);
      } catch (IOException e) {
        LOGGER.error("Could not remove published file {}: {}", target, e.getMessage());
      }
    }
    for (int i = backedUp.size() - 1; i >= 0; i--) {
      String relativePath = backedUp.get(i);
      String target = storageProvider.resolvePath(outputRoot, relativePath);
      try {
        storageProvider.move(backupPath(stagingBase, relativePath), target);
        LOGGER.info("Restored previous file {}", target);
      } catch (IOException e) {
        LOGGER.error("Could not restore previous file {}: {}", target, e.getMessage());
      }
    }
  }

  private String backupPath(String stagingBase, String relativePath) {
    return storageProvider.resolvePath(stagingBase, PREVIOUS_DIRECTORY + "/" + relativePath);
  }

  private void discardStaging(String stagingBase) {
    try {
      storageProvider.delete(stagingBase);
      String stagingRoot = storageProvider.resolvePath(outputRoot, STAGING_DIRECTORY);
      if (storageProvider.listFiles(stagingRoot).isEmpty()) {
        storageProvider.delete(stagingRoot);
      }
    } catch (IOException e) {
      LOGGER.warn("Could not remove staging directory {} (will remain): {}",
          stagingBase, e.getMessage());
    }
  }

  private static String parentOf(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return slash > 0 ? path.substring(0, slash) : path;
  }
}
