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
package io.sentinelmesh.anomalydetector.strategies;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.anomalydetector.MetricBatches;
import io.sentinelmesh.anomalydetector.features.FeatureMatrix;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class ReconstructionErrorStrategyTest {

  /** Rows on a two dimensional subspace of eight columns, plus one row off the subspace. */
  private static FeatureMatrix lowRank(int rows) {
    final var random = new Random(5);
    final double[][] data = new double[rows + 1][8];
    for (int i = 0; i < rows; ++i) {
      final double a = random.nextGaussian();
      final double b = random.nextGaussian();
      for (int j = 0; j < 8; ++j) {
        data[i][j] = (j % 2 == 0 ? a : b) * (j + 1) + random.nextGaussian() * 0.01;
      }
    }
    for (int j = 0; j < 8; ++j) {
      data[rows][j] = j % 2 == 0 ? 3.0 : -3.0;
    }
    return new FeatureMatrix(data);
  }

  @Test
  public void testBottleneckIsBuiltForObservedWidth() throws Exception {
    final var strategy = new ReconstructionErrorStrategy(0.1);
    strategy.train(lowRank(50));
    assertThat(strategy.getBottleneckWidth(), is(2));

    final var narrow = new ReconstructionErrorStrategy(0.1);
    narrow.train(new FeatureMatrix(MetricBatches.gaussianWithOutlier(20, 3, 2)));
    assertThat(narrow.getBottleneckWidth(), is(0));
  }

  @Test
  public void testRowOffTheSubspaceIsAnomalous() throws Exception {
    final FeatureMatrix matrix = lowRank(50);
    final var strategy = new ReconstructionErrorStrategy(0.1);
    strategy.train(matrix);

    final int outlier = matrix.getRowCount() - 1;
    final double[] scores = strategy.score(matrix);
    for (int i = 0; i < outlier; ++i) {
      Assert.assertTrue(scores[i] < scores[outlier]);
    }
    assertThat(strategy.classify(matrix)[outlier], is(DetectionStrategy.ANOMALOUS));
  }

  @Test
  public void testMeanReconstructionBelowFourFeatures() throws Exception {
    final FeatureMatrix matrix = new FeatureMatrix(MetricBatches.gaussianWithOutlier(30, 2, 3));
    final var strategy = new ReconstructionErrorStrategy(0.1);
    strategy.train(matrix);
    final int[] labels = strategy.classify(matrix);
    assertThat(labels[matrix.getRowCount() - 1], is(DetectionStrategy.ANOMALOUS));
  }

  @Test
  public void testRetrainingRefitsFromScratch() throws Exception {
    final FeatureMatrix matrix = lowRank(40);
    final var strategy = new ReconstructionErrorStrategy(0.1);
    strategy.train(new FeatureMatrix(MetricBatches.gaussianWithOutlier(20, 3, 2)));
    strategy.train(matrix);

    final var fresh = new ReconstructionErrorStrategy(0.1);
    fresh.train(matrix);
    Assert.assertArrayEquals(fresh.score(matrix), strategy.score(matrix), 1e-12);
    assertThat(strategy.getInputWidth(), is(8));
  }
}
