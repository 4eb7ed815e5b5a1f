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

import io.sentinelmesh.anomalydetector.features.PcaReducer;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

/**
 * Reconstruction error of a linear bottleneck.
 *
 * <p>Rows are projected onto the leading principal components of the training data, a quarter
 * of the feature width, and mapped back. The score of a row grows with its mean squared
 * reconstruction error. The bottleneck is rebuilt on every training for the observed width.
 * Below four features the bottleneck is empty and rows are reconstructed by the training mean.
 */
public class ReconstructionErrorStrategy extends ThresholdedDetectionStrategy {
  static final int COMPRESSION = 4;

  private PcaReducer bottleneck;
  private double[] means;
  private double errorScale;

  public ReconstructionErrorStrategy(double contamination) {
    super(StrategyKind.RECONSTRUCTION_ERROR, contamination);
  }

  @Override
  protected double[] fit(double[][] data) {
    final int width = data[0].length;
    final int numComponents = width / COMPRESSION;
    bottleneck = numComponents > 0 ? PcaReducer.fitComponents(data, numComponents) : null;
    means = new double[width];
    final var column = new double[data.length];
    for (int col = 0; col < width; ++col) {
      for (int row = 0; row < data.length; ++row) {
        column[row] = data[row][col];
      }
      means[col] = new Mean().evaluate(column);
    }
    final double[] errors = errors(data);
    errorScale = new Mean().evaluate(errors);
    return normalize(errors);
  }

  @Override
  protected double[] scoreRows(double[][] data) {
    return normalize(errors(data));
  }

  /** Number of components of the bottleneck, 0 when rows are reconstructed by the mean. */
  public int getBottleneckWidth() {
    return bottleneck != null ? bottleneck.getOutputWidth() : 0;
  }

  double[] errors(double[][] data) {
    final double[][] restored;
    if (bottleneck != null) {
      restored = bottleneck.inverseTransform(bottleneck.transform(data));
    } else {
      restored = new double[data.length][];
      for (int row = 0; row < data.length; ++row) {
        restored[row] = means.clone();
      }
    }
    final double[] errors = new double[data.length];
    for (int row = 0; row < data.length; ++row) {
      double sum = 0;
      for (int col = 0; col < data[row].length; ++col) {
        final double diff = data[row][col] - restored[row][col];
        sum += diff * diff;
      }
      errors[row] = sum / data[row].length;
    }
    return errors;
  }

  private double[] normalize(double[] errors) {
    final double[] scores = new double[errors.length];
    for (int i = 0; i < errors.length; ++i) {
      if (errorScale > 0) {
        scores[i] = errors[i] / (errors[i] + errorScale);
      } else {
        scores[i] = errors[i] > 0 ? 1.0 : 0.0;
      }
    }
    return scores;
  }
}
