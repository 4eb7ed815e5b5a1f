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
package io.sentinelmesh.anomalydetector;

import io.sentinelmesh.models.MetricSample;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Metric batches and matrices shared by the detector tests. */
public class MetricBatches {
  /** 2024-01-01T13:00:00Z, a Monday. */
  public static final long TIMESTAMP = 1704114000000L;

  public static MetricSample sample(String name, Double value) {
    return new MetricSample(
        name, value, Map.of(MetricSample.LABEL_SERVICE, "api", "pod", "api-0"), TIMESTAMP);
  }

  /**
   * Values tightly clustered around 10 followed by a single value of 1000.
   *
   * @param name Metric name
   * @param normalCount Number of clustered samples
   * @return The batch; the outlier is the last sample
   */
  public static List<MetricSample> clusterWithOutlier(String name, int normalCount) {
    final var batch = new ArrayList<MetricSample>();
    for (int i = 0; i < normalCount; ++i) {
      batch.add(sample(name, 10.0 + (i % 5) * 0.1));
    }
    batch.add(sample(name, 1000.0));
    return batch;
  }

  /**
   * Gaussian points around the origin with one far point at the end.
   *
   * @param rows Number of gaussian rows
   * @param width Number of columns
   * @param seed Random seed
   * @return Matrix of rows + 1 rows
   */
  public static double[][] gaussianWithOutlier(int rows, int width, long seed) {
    final var random = new Random(seed);
    final double[][] data = new double[rows + 1][width];
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < width; ++j) {
        data[i][j] = random.nextGaussian();
      }
    }
    for (int j = 0; j < width; ++j) {
      data[rows][j] = 8.0;
    }
    return data;
  }
}
