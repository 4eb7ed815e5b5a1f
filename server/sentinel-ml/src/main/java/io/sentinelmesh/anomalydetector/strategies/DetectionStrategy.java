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

import io.sentinelmesh.anomalydetector.features.FeatureMatrix;
import io.sentinelmesh.errors.exception.StrategyException;

/**
 * A pluggable anomaly model behind a fixed train / classify / score contract.
 *
 * <p>Training refits from scratch on the given matrix only. A trained instance is published in
 * a model generation and never trained again; retraining builds a new instance.
 */
public interface DetectionStrategy {
  int ANOMALOUS = -1;
  int NORMAL = 1;

  StrategyKind getKind();

  default String getName() {
    return getKind().getStrategyName();
  }

  /**
   * Fits the strategy.
   *
   * @param matrix Prepared training features
   * @throws StrategyException when the strategy cannot be fitted
   */
  void train(FeatureMatrix matrix) throws StrategyException;

  /**
   * Classifies each row.
   *
   * @param matrix Prepared features of the trained width
   * @return {@link #ANOMALOUS} or {@link #NORMAL} per row, aligned with the input rows
   * @throws StrategyException when the strategy is not trained or inference fails
   */
  int[] classify(FeatureMatrix matrix) throws StrategyException;

  /**
   * Scores each row.
   *
   * @param matrix Prepared features of the trained width
   * @return Anomaly strength per row, in [0, 1]; larger is more anomalous
   * @throws StrategyException when the strategy is not trained or inference fails
   */
  double[] score(FeatureMatrix matrix) throws StrategyException;

  boolean isTrained();

  /** Feature width the strategy was trained with, -1 before training. */
  int getInputWidth();
}
