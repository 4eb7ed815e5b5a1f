/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sentinelmesh.anomalydetector.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Tabular representation of a metric batch with mixed column types.
 *
 * <p>Row i corresponds to the i-th sample of the batch the table was extracted from.
 */
public class FeatureTable {
  private static final FeatureTable EMPTY = new FeatureTable(0, new LinkedHashMap<>());

  @Getter private final int rowCount;
  private final Map<String, FeatureColumn> columns;

  private FeatureTable(int rowCount, Map<String, FeatureColumn> columns) {
    this.rowCount = rowCount;
    this.columns = Collections.unmodifiableMap(columns);
  }

  public static FeatureTable empty() {
    return EMPTY;
  }

  public static Builder builder(int rowCount) {
    return new Builder(rowCount);
  }

  public boolean isEmpty() {
    return rowCount == 0 || columns.isEmpty();
  }

  public List<String> getColumnNames() {
    return new ArrayList<>(columns.keySet());
  }

  public FeatureColumn getColumn(String name) {
    return columns.get(name);
  }

  /** Names of the numeric columns in declaration order. */
  public List<String> getNumericColumnNames() {
    final var names = new ArrayList<String>();
    for (FeatureColumn column : columns.values()) {
      if (column.isNumeric()) {
        names.add(column.getName());
      }
    }
    return names;
  }

  public boolean hasNumericColumns() {
    return !getNumericColumnNames().isEmpty();
  }

  /**
   * Builds a dense matrix of the specified numeric columns. Missing values become 0.0.
   *
   * @param columnNames Numeric columns to include, in output order
   * @return Matrix of rowCount rows and columnNames.size() columns
   * @throws IllegalArgumentException when a column is missing or not numeric
   */
  public double[][] toNumericMatrix(List<String> columnNames) {
    final var selected = new ArrayList<FeatureColumn>(columnNames.size());
    for (String name : columnNames) {
      final var column = columns.get(name);
      if (column == null || !column.isNumeric()) {
        throw new IllegalArgumentException("No numeric column " + name);
      }
      selected.add(column);
    }
    final double[][] matrix = new double[rowCount][selected.size()];
    for (int row = 0; row < rowCount; ++row) {
      for (int col = 0; col < selected.size(); ++col) {
        matrix[row][col] = imputed(selected.get(col).getNumber(row));
      }
    }
    return matrix;
  }

  /**
   * Returns the numeric part of a row.
   *
   * @param row Row index
   * @return The row; missing values are kept as null
   */
  public FeatureVector getNumericRow(int row) {
    final var values = new LinkedHashMap<String, Double>();
    for (FeatureColumn column : columns.values()) {
      if (column.isNumeric()) {
        values.put(column.getName(), column.getNumber(row));
      }
    }
    return new FeatureVector(row, values);
  }

  /** Missing value imputation policy shared by preparation and reporting. */
  public static double imputed(Double value) {
    return value == null || value.isNaN() ? 0.0 : value;
  }

  public static class Builder {
    private final int rowCount;
    private final Map<String, FeatureColumn> columns = new LinkedHashMap<>();

    private Builder(int rowCount) {
      if (rowCount < 0) {
        throw new IllegalArgumentException("rowCount must not be negative");
      }
      this.rowCount = rowCount;
    }

    public Builder addNumeric(String name, Double[] values) {
      return add(FeatureColumn.numeric(name, values));
    }

    public Builder addString(String name, String[] values) {
      return add(FeatureColumn.string(name, values));
    }

    private Builder add(FeatureColumn column) {
      if (column.size() != rowCount) {
        throw new IllegalArgumentException(
            String.format(
                "Column %s has %d rows; expected %d", column.getName(), column.size(), rowCount));
      }
      if (columns.putIfAbsent(column.getName(), column) != null) {
        throw new IllegalArgumentException("Duplicate column " + column.getName());
      }
      return this;
    }

    public FeatureTable build() {
      return new FeatureTable(rowCount, new LinkedHashMap<>(columns));
    }
  }
}
