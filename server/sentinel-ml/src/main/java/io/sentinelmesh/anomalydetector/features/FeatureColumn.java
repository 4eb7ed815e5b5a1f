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

import java.util.Arrays;
import lombok.Getter;

/** A named, typed column of a {@link FeatureTable}. Null entries denote missing values. */
public class FeatureColumn {
  @Getter private final String name;
  @Getter private final ColumnType type;
  private final Object[] values;

  private FeatureColumn(String name, ColumnType type, Object[] values) {
    this.name = name;
    this.type = type;
    this.values = values;
  }

  public static FeatureColumn numeric(String name, Double[] values) {
    return new FeatureColumn(name, ColumnType.NUMERIC, Arrays.copyOf(values, values.length));
  }

  public static FeatureColumn string(String name, String[] values) {
    return new FeatureColumn(name, ColumnType.STRING, Arrays.copyOf(values, values.length));
  }

  public int size() {
    return values.length;
  }

  public boolean isNumeric() {
    return type == ColumnType.NUMERIC;
  }

  /**
   * Returns a numeric entry.
   *
   * @param row Row index
   * @return The value, null if missing
   * @throws IllegalStateException when the column is not numeric
   */
  public Double getNumber(int row) {
    if (!isNumeric()) {
      throw new IllegalStateException("Column " + name + " is not numeric");
    }
    return (Double) values[row];
  }

  public Object get(int row) {
    return values[row];
  }
}
