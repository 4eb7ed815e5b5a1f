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
package io.sentinelmesh.anomalydetector.detectors;

import io.sentinelmesh.anomalydetector.features.FeatureColumn;
import io.sentinelmesh.anomalydetector.features.FeatureTable;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-column z-score rule over the current batch.
 *
 * <p>A row is flagged when, for any numeric column with a nonzero standard deviation, the
 * absolute z-score of its value exceeds {@link #Z_SCORE_LIMIT}. Statistics are computed from the
 * present values of the batch only; missing values are neither counted nor flagged. Needs no
 * training.
 */
public class StatisticalOutlierDetector {
  private static final Logger logger = LoggerFactory.getLogger(StatisticalOutlierDetector.class);

  public static final double Z_SCORE_LIMIT = 3.0;

  /**
   * Flags outlier rows.
   *
   * @param table The feature table of the batch
   * @return Indices of the flagged rows in ascending order
   */
  public SortedSet<Integer> flag(FeatureTable table) {
    final SortedSet<Integer> flagged = new TreeSet<>();
    if (table == null || table.isEmpty()) {
      return flagged;
    }
    for (String name : table.getNumericColumnNames()) {
      final FeatureColumn column = table.getColumn(name);
      final List<Integer> rows = new ArrayList<>();
      final List<Double> present = new ArrayList<>();
      for (int row = 0; row < column.size(); ++row) {
        final Double value = column.getNumber(row);
        if (value != null && !value.isNaN()) {
          rows.add(row);
          present.add(value);
        }
      }
      if (present.size() < 2) {
        continue;
      }
      final double[] values = present.stream().mapToDouble(Double::doubleValue).toArray();
      final double mean = new Mean().evaluate(values);
      final double std = new StandardDeviation().evaluate(values);
      if (!(std > 0)) {
        continue;
      }
      for (int i = 0; i < values.length; ++i) {
        if (Math.abs((values[i] - mean) / std) > Z_SCORE_LIMIT) {
          flagged.add(rows.get(i));
        }
      }
    }
    if (!flagged.isEmpty()) {
      logger.debug("Statistical outliers at rows {}", flagged);
    }
    return flagged;
  }
}
