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
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.StrategyException;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Base of the strategies that classify by thresholding their score.
 *
 * <p>The decision threshold is the (1 - contamination) percentile of the scores of the training
 * rows; a row is anomalous when its score is strictly above it.
 */
public abstract class ThresholdedDetectionStrategy implements DetectionStrategy {
  private final StrategyKind kind;
  private final double contamination;

  private int inputWidth = -1;
  private double threshold;

  protected ThresholdedDetectionStrategy(StrategyKind kind, double contamination) {
    if (!(contamination > 0 && contamination < 0.5)) {
      throw new IllegalArgumentException("contamination must be in (0, 0.5): " + contamination);
    }
    this.kind = kind;
    this.contamination = contamination;
  }

  /**
   * Fits the model.
   *
   * @param data Training rows, at least two
   * @return Scores of the training rows in [0, 1]
   */
  protected abstract double[] fit(double[][] data);

  /**
   * Scores rows with the fitted model.
   *
   * @param data Rows of the fitted width
   * @return Scores in [0, 1]
   */
  protected abstract double[] scoreRows(double[][] data);

  @Override
  public StrategyKind getKind() {
    return kind;
  }

  @Override
  public void train(FeatureMatrix matrix) throws StrategyException {
    if (matrix.getRowCount() < 2) {
      throw new StrategyException(
          AnomalyDetectionError.STRATEGY_TRAINING_FAILED,
          getName() + " needs at least two rows to train, got " + matrix.getRowCount());
    }
    try {
      final double[] trainingScores = fit(matrix.toArray());
      threshold = contaminationThreshold(trainingScores, contamination);
      inputWidth = matrix.getWidth();
    } catch (RuntimeException e) {
      inputWidth = -1;
      throw new StrategyException(
          AnomalyDetectionError.STRATEGY_TRAINING_FAILED,
          getName() + " failed to train; " + e.getMessage(),
          e);
    }
  }

  @Override
  public int[] classify(FeatureMatrix matrix) throws StrategyException {
    final double[] scores = score(matrix);
    final int[] labels = new int[scores.length];
    for (int i = 0; i < scores.length; ++i) {
      labels[i] = scores[i] > threshold ? ANOMALOUS : NORMAL;
    }
    return labels;
  }

  @Override
  public double[] score(FeatureMatrix matrix) throws StrategyException {
    if (!isTrained()) {
      throw new StrategyException(
          AnomalyDetectionError.STRATEGY_NOT_TRAINED, getName() + " has not been trained");
    }
    if (matrix.getWidth() != inputWidth) {
      throw new StrategyException(
          AnomalyDetectionError.STRATEGY_DIMENSION_MISMATCH,
          String.format(
              "%s was trained with %d features, got %d",
              getName(), inputWidth, matrix.getWidth()));
    }
    try {
      return scoreRows(matrix.toArray());
    } catch (RuntimeException e) {
      throw new StrategyException(getName() + " failed to score; " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isTrained() {
    return inputWidth >= 0;
  }

  @Override
  public int getInputWidth() {
    return inputWidth;
  }

  public double getThreshold() {
    return threshold;
  }

  static double contaminationThreshold(double[] trainingScores, double contamination) {
    return new Percentile().evaluate(trainingScores, (1.0 - contamination) * 100.0);
  }
}
