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
package io.creatorstats.format.csv;

import io.creatorstats.dataset.Dataset;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited file with a header row into a {@link Dataset}.
 *
 * <p>Values are kept as strings; typing is left to the QA rules. Empty cells
 * become null. Files ending in {@code .tsv} are tab separated, anything else
 * is comma separated.
 */
public class CsvDatasetReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvDatasetReader.class);

  /**
   * Reads a file into a dataset.
   *
   * @param name Dataset name used in diagnostics
   * @param path File to read
   * @return Dataset with the header's columns
   * @throws IOException If the file cannot be read, has no header, or a row
   *     has more cells than the header
   */
  public Dataset read(String name, Path path) throws IOException {
    LOGGER.info("Reading {} from {}", name, path);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
         CSVReader csvReader = openCsv(reader, isTsv(path))) {
      Dataset dataset = read(name, csvReader, path.toString());
      LOGGER.debug("Read {} row(s) with columns {}", dataset.size(), dataset.getColumns());
      return dataset;
    }
  }

  /**
   * Reads comma separated text from a reader. The reader is not closed.
   */
  public Dataset read(String name, Reader reader) throws IOException {
    return read(name, openCsv(reader, false), name);
  }

  private static Dataset read(String name, CSVReader csvReader, String source)
      throws IOException {
    try {
      String[] header = csvReader.readNext();
      if (header == null) {
        throw new IOException("No header row in " + source);
      }
      List<String> columns = Arrays.asList(trimAll(header));
      Dataset.Builder builder = Dataset.builder(name).columns(columns);

      String[] cells;
      while ((cells = csvReader.readNext()) != null) {
        if (cells.length == 1 && cells[0].isEmpty()) {
          continue;
        }
        if (cells.length > columns.size()) {
          throw new IOException("Row " + csvReader.getLinesRead() + " of " + source + " has "
              + cells.length + " cells but the header declares " + columns.size());
        }
        Map<String, Object> row = new LinkedHashMap<String, Object>();
        for (int i = 0; i < columns.size(); i++) {
          String cell = i < cells.length ? cells[i] : null;
          row.put(columns.get(i), cell == null || cell.isEmpty() ? null : cell);
        }
        builder.addRow(row);
      }
      return builder.build();
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV in " + source + ": " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid header in " + source + ": " + e.getMessage(), e);
    }
  }

  private static CSVReader openCsv(Reader reader, boolean tsv) {
    if (tsv) {
      return new CSVReaderBuilder(reader)
          .withCSVParser(new CSVParserBuilder().withSeparator('\t').build())
          .build();
    }
    return new CSVReader(reader);
  }

  private static boolean isTsv(Path path) {
    return path.getFileName().toString().endsWith(".tsv");
  }

  private static String[] trimAll(String[] values) {
    String[] trimmed = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      // strip a UTF-8 byte order mark from the first header cell
      trimmed[i] = values[i].replace("\uFEFF", "").trim();
    }
    return trimmed;
  }
}
