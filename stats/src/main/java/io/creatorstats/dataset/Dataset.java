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
package io.creatorstats.dataset;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, in-memory tabular dataset with named columns.
 *
 * <p>Rows are maps of column name to value, the same shape the ETL stages
 * pass around. Column order is preserved as declared, and every row holds
 * an entry (possibly null) for every column.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Dataset creators = Dataset.builder("creators")
 *     .columns("creator_id", "username", "follower_count")
 *     .addRow(1L, "alice", 100L)
 *     .addRow(2L, "bob", 0L)
 *     .build();
 *
 * List<Object> ids = creators.column("creator_id");
 * }</pre>
 *
 * <p>Stages never modify a dataset; {@link #withColumnValues(String, List)}
 * returns a new copy.
 */
public final class Dataset {

  private final String name;
  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private Dataset(String name, List<String> columns, List<Map<String, Object>> rows) {
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    List<Map<String, Object>> copies = new ArrayList<Map<String, Object>>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> copy = new LinkedHashMap<String, Object>();
      for (String column : this.columns) {
        copy.put(column, row.get(column));
      }
      copies.add(Collections.unmodifiableMap(copy));
    }
    this.rows = Collections.unmodifiableList(copies);
  }

  /**
   * Returns the dataset name, used in diagnostics (e.g. "creators").
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the column names in declaration order.
   */
  public List<String> getColumns() {
    return columns;
  }

  /**
   * Returns the rows. Each row is an unmodifiable map keyed by column name.
   */
  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Returns the values of one column, in row order.
   *
   * @param column Column name
   * @return Column values (may contain nulls)
   * @throws IllegalArgumentException If the column does not exist
   */
  public List<Object> column(String column) {
    if (!hasColumn(column)) {
      throw new IllegalArgumentException("Dataset '" + name + "' has no column '" + column + "'");
    }
    List<Object> values = new ArrayList<Object>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(column));
    }
    return values;
  }

  /**
   * Returns a copy of this dataset with one column's values replaced.
   *
   * @param column Existing column name
   * @param values New values, one per row
   * @return New dataset
   */
  public Dataset withColumnValues(String column, List<?> values) {
    if (!hasColumn(column)) {
      throw new IllegalArgumentException("Dataset '" + name + "' has no column '" + column + "'");
    }
    if (values.size() != rows.size()) {
      throw new IllegalArgumentException("Expected " + rows.size() + " values for column '"
          + column + "' but got " + values.size());
    }
    List<Map<String, Object>> replaced = new ArrayList<Map<String, Object>>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Map<String, Object> row = new LinkedHashMap<String, Object>(rows.get(i));
      row.put(column, values.get(i));
      replaced.add(row);
    }
    return new Dataset(name, columns, replaced);
  }

  @Override public String toString() {
    return "Dataset{name='" + name + "', columns=" + columns + ", rows=" + rows.size() + "}";
  }

  /**
   * Creates a new builder for a dataset with the given name.
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Builder for Dataset.
   */
  public static class Builder {
    private final String name;
    private final List<String> columns = new ArrayList<String>();
    private final List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();

    Builder(String name) {
      this.name = name;
    }

    public Builder columns(String... columns) {
      return columns(Arrays.asList(columns));
    }

    public Builder columns(List<String> columns) {
      this.columns.clear();
      this.columns.addAll(columns);
      return this;
    }

    /**
     * Adds a row from positional values matching the declared columns.
     */
    public Builder addRow(Object... values) {
      if (values.length != columns.size()) {
        throw new IllegalArgumentException("Row has " + values.length
            + " values but dataset '" + name + "' declares " + columns.size() + " columns");
      }
      Map<String, Object> row = new LinkedHashMap<String, Object>();
      for (int i = 0; i < values.length; i++) {
        row.put(columns.get(i), values[i]);
      }
      rows.add(row);
      return this;
    }

    /**
     * Adds a row from a map. Columns missing from the map are set to null.
     */
    public Builder addRow(Map<String, Object> row) {
      rows.add(row);
      return this;
    }

    public Dataset build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Dataset name is required");
      }
      if (columns.size() != new HashSet<String>(columns).size()) {
        throw new IllegalArgumentException("Duplicate column names in dataset '" + name
            + "': " + columns);
      }
      return new Dataset(name, columns, rows);
    }
  }
}
