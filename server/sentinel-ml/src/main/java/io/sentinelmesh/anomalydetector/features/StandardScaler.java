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
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Column-wise standardization to zero mean and unit variance.
 *
 * <p>Uses the population standard deviation. A column without variance keeps scale 1 so that it
 * is only centered.
 */
public class StandardScaler {
  private final double[] means;
  private final double[] scales;

  private StandardScaler(double[] means, double[] scales) {
    this.means = means;
    this.scales = scales;
  }

  /**
   * Fits the scaler.
   *
   * @param data Row-major training values, at least one row
   * @return The fitted scaler
   */
  public static StandardScaler fit(double[][] data) {
    if (data.length == 0) {
      throw new IllegalArgumentException("Cannot fit a scaler on an empty matrix");
    }
    final int width = data[0].length;
    final double[] means = new double[width];
    final double[] scales = new double[width];
    final var column = new double[data.length];
    for (int col = 0; col < width; ++col) {
      for (int row = 0; row < data.length; ++row) {
        column[row] = data[row][col];
      }
      means[col] = new Mean().evaluate(column);
      final double std = new StandardDeviation(false).evaluate(column);
      scales[col] = std > 0 ? std : 1.0;
    }
    return new StandardScaler(means, scales);
  }

  public int getWidth() {
    return means.length;
  }

  public double[][] transform(double[][] data) {
    final double[][] scaled = new double[data.length][];
    for (int row = 0; row < data.length; ++row) {
      if (data[row].length != means.length) {
        throw new IllegalArgumentException(
            String.format("Expected %d columns, got %d", means.length, data[row].length));
      }
      scaled[row] = new double[means.length];
      for (int col = 0; col < means.length; ++col) {
        scaled[row][col] = (data[row][col] - means[col]) / scales[col];
      }
    }
    return scaled;
  }

  double[] getMeans() {
    return Arrays.copyOf(means, means.length);
  }

  double[] getScales() {
    return Arrays.copyOf(scales, scales.length);
  }
}
