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

import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * Isolation scoring with a random forest of isolation trees.
 *
 * <p>The seed is applied to the calling thread before fitting. The forest grows its trees in
 * parallel, so repeated training on the same rows is close to but not exactly reproducible.
 */
public class IsolationForestStrategy extends ThresholdedDetectionStrategy {
  static final double SUBSAMPLE = 0.7;

  private final int numTrees;
  private final long seed;

  private IsolationForest forest;

  public IsolationForestStrategy(double contamination, int numTrees, long seed) {
    super(StrategyKind.ISOLATION_FOREST, contamination);
    if (numTrees <= 0) {
      throw new IllegalArgumentException("numTrees should be greater than 0");
    }
    this.numTrees = numTrees;
    this.seed = seed;
  }

  @Override
  protected double[] fit(double[][] data) {
    MathEx.setSeed(seed);
    forest = IsolationForest.fit(data, numTrees, maxDepth(data.length), SUBSAMPLE, 0);
    return forest.score(data);
  }

  @Override
  protected double[] scoreRows(double[][] data) {
    return forest.score(data);
  }

  /** Tree depth limit, the ceiling of log2 of the subsample size and at least 1. */
  static int maxDepth(int rows) {
    final double sampled = Math.max(2.0, rows * SUBSAMPLE);
    return Math.max(1, (int) Math.ceil(Math.log(sampled) / Math.log(2.0)));
  }

  public int getNumTrees() {
    return numTrees;
  }
}
