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

import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math3.util.MathArrays;

/**
 * Local outlier factor over the training rows.
 *
 * <p>The factor of a row compares the local reachability density of its k nearest training
 * rows with its own. A training row is never its own neighbor. The factor is mapped to a score
 * by {@code 1 - 1 / lof}, so factors at or below 1 score 0.
 */
public class LocalOutlierFactorStrategy extends ThresholdedDetectionStrategy {
  static final double DENSITY_EPSILON = 1e-10;

  private final int numNeighbors;

  private double[][] reference;
  private int k;
  private double[] kDistances;
  private double[] densities;

  public LocalOutlierFactorStrategy(double contamination, int numNeighbors) {
    super(StrategyKind.LOCAL_OUTLIER_FACTOR, contamination);
    if (numNeighbors <= 0) {
      throw new IllegalArgumentException("numNeighbors should be greater than 0");
    }
    this.numNeighbors = numNeighbors;
  }

  @Override
  protected double[] fit(double[][] data) {
    final int n = data.length;
    reference = new double[n][];
    for (int i = 0; i < n; ++i) {
      reference[i] = data[i].clone();
    }
    k = Math.min(numNeighbors, n - 1);

    final int[][] neighbors = new int[n][];
    final double[][] distances = new double[n][];
    kDistances = new double[n];
    for (int i = 0; i < n; ++i) {
      distances[i] = distancesTo(reference[i]);
      neighbors[i] = nearest(distances[i], i);
      kDistances[i] = distances[i][neighbors[i][k - 1]];
    }
    densities = new double[n];
    for (int i = 0; i < n; ++i) {
      densities[i] = density(neighbors[i], distances[i]);
    }
    final double[] scores = new double[n];
    for (int i = 0; i < n; ++i) {
      scores[i] = toScore(factor(neighbors[i], densities[i]));
    }
    return scores;
  }

  @Override
  protected double[] scoreRows(double[][] data) {
    final double[] scores = new double[data.length];
    for (int row = 0; row < data.length; ++row) {
      final double[] distances = distancesTo(data[row]);
      final int[] neighbors = nearest(distances, -1);
      scores[row] = toScore(factor(neighbors, density(neighbors, distances)));
    }
    return scores;
  }

  /** Effective neighborhood size, bounded by the number of training rows minus one. */
  public int getEffectiveNeighbors() {
    return k;
  }

  private double[] distancesTo(double[] point) {
    final double[] distances = new double[reference.length];
    for (int i = 0; i < reference.length; ++i) {
      distances[i] = MathArrays.distance(point, reference[i]);
    }
    return distances;
  }

  private int[] nearest(double[] distances, int exclude) {
    return IntStream.range(0, distances.length)
        .filter(i -> i != exclude)
        .boxed()
        .sorted(Comparator.comparingDouble((Integer i) -> distances[i]))
        .limit(k)
        .mapToInt(Integer::intValue)
        .toArray();
  }

  private double density(int[] neighbors, double[] distances) {
    double sum = 0;
    for (int o : neighbors) {
      sum += Math.max(kDistances[o], distances[o]);
    }
    return 1.0 / (sum / neighbors.length + DENSITY_EPSILON);
  }

  private double factor(int[] neighbors, double density) {
    double sum = 0;
    for (int o : neighbors) {
      sum += densities[o];
    }
    return sum / neighbors.length / density;
  }

  static double toScore(double lof) {
    if (!(lof > 1.0)) {
      return 0.0;
    }
    return Double.isInfinite(lof) ? 1.0 : 1.0 - 1.0 / lof;
  }

  @Override
  public String toString() {
    return "LocalOutlierFactorStrategy [numNeighbors="
        + numNeighbors
        + ", k="
        + k
        + ", trainingRows="
        + (reference != null ? reference.length : 0)
        + "]";
  }
}
