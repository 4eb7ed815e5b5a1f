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
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.anomalydetector.MetricBatches;
import io.sentinelmesh.anomalydetector.features.FeatureMatrix;
import org.junit.Assert;
import org.junit.Test;

public class LocalOutlierFactorStrategyTest {

  @Test
  public void testIsolatedRowIsAnomalous() throws Exception {
    final FeatureMatrix matrix = new FeatureMatrix(MetricBatches.gaussianWithOutlier(60, 2, 4));
    final var strategy = new LocalOutlierFactorStrategy(0.1, 20);
    strategy.train(matrix);

    final int outlier = matrix.getRowCount() - 1;
    final double[] scores = strategy.score(matrix);
    for (int i = 0; i < outlier; ++i) {
      Assert.assertTrue(scores[i] < scores[outlier]);
    }
    assertThat(strategy.classify(matrix)[outlier], is(DetectionStrategy.ANOMALOUS));
    assertThat(strategy.getEffectiveNeighbors(), is(20));
  }

  @Test
  public void testNeighborsAreBoundedByTrainingRows() throws Exception {
    final var strategy = new LocalOutlierFactorStrategy(0.1, 20);
    strategy.train(new FeatureMatrix(new double[][] {{0.0}, {1.0}, {2.0}, {10.0}}));
    assertThat(strategy.getEffectiveNeighbors(), is(3));
  }

  @Test
  public void testIdenticalRowsScoreZero() throws Exception {
    final var strategy = new LocalOutlierFactorStrategy(0.1, 5);
    final var matrix = new FeatureMatrix(new double[][] {{1.0}, {1.0}, {1.0}, {1.0}});
    strategy.train(matrix);
    for (double score : strategy.score(matrix)) {
      assertThat(score, closeTo(0.0, 1e-9));
    }
    for (int label : strategy.classify(matrix)) {
      assertThat(label, is(DetectionStrategy.NORMAL));
    }
  }

  @Test
  public void testFactorToScore() {
    assertThat(LocalOutlierFactorStrategy.toScore(0.8), is(0.0));
    assertThat(LocalOutlierFactorStrategy.toScore(1.0), is(0.0));
    assertThat(LocalOutlierFactorStrategy.toScore(2.0), closeTo(0.5, 1e-12));
    assertThat(LocalOutlierFactorStrategy.toScore(Double.POSITIVE_INFINITY), is(1.0));
    assertThat(LocalOutlierFactorStrategy.toScore(Double.NaN), is(0.0));
  }
}
