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

import lombok.Getter;
import lombok.ToString;

/** Builds untrained strategy instances with the detector's parameters. */
@Getter
@ToString
public class StrategyFactory {
  private final double contamination;
  private final int isolationForestTrees;
  private final int lofNeighbors;
  private final long randomSeed;

  public StrategyFactory(
      double contamination, int isolationForestTrees, int lofNeighbors, long randomSeed) {
    this.contamination = contamination;
    this.isolationForestTrees = isolationForestTrees;
    this.lofNeighbors = lofNeighbors;
    this.randomSeed = randomSeed;
  }

  /**
   * Creates a new, untrained strategy.
   *
   * @param kind The strategy kind
   * @return A fresh instance
   */
  public DetectionStrategy create(StrategyKind kind) {
    switch (kind) {
      case ISOLATION_FOREST:
        return new IsolationForestStrategy(contamination, isolationForestTrees, randomSeed);
      case RECONSTRUCTION_ERROR:
        return new ReconstructionErrorStrategy(contamination);
      case LOCAL_OUTLIER_FACTOR:
        return new LocalOutlierFactorStrategy(contamination, lofNeighbors);
      default:
        throw new UnsupportedOperationException("Unsupported strategy: " + kind);
    }
  }
}
