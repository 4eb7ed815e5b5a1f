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

/** Dense numeric matrix consumed by detection strategies. Rows align with the input batch. */
public class FeatureMatrix {
  private final double[][] data;
  private final int width;

  /**
   * The constructor.
   *
   * @param data Row-major values; the matrix takes a deep copy
   * @throws IllegalArgumentException when rows have different lengths
   */
  public FeatureMatrix(double[][] data) {
    this.width = data.length > 0 ? data[0].length : 0;
    this.data = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      if (data[i].length != width) {
        throw new IllegalArgumentException(
            String.format("Row %d has %d columns; expected %d", i, data[i].length, width));
      }
      this.data[i] = Arrays.copyOf(data[i], width);
    }
  }

  public int getRowCount() {
    return data.length;
  }

  public int getWidth() {
    return width;
  }

  public double get(int row, int column) {
    return data[row][column];
  }

  public double[] getRow(int row) {
    return Arrays.copyOf(data[row], width);
  }

  /** Returns a deep copy of the values. */
  public double[][] toArray() {
    final double[][] copy = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      copy[i] = Arrays.copyOf(data[i], width);
    }
    return copy;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FeatureMatrix)) {
      return false;
    }
    return Arrays.deepEquals(data, ((FeatureMatrix) other).data);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(data);
  }

  @Override
  public String toString() {
    return "FeatureMatrix [rows=" + data.length + ", width=" + width + "]";
  }
}
