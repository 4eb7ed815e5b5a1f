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
package io.sentinelmesh.anomalydetector.features;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * Principal component projection keeping the smallest number of components whose cumulative
 * explained variance exceeds the requested ratio.
 */
public class PcaReducer {
  private final double[] means;

  /** One row per retained component, ordered by decreasing variance. */
  private final double[][] components;

  private final double explainedVarianceRatio;

  private PcaReducer(double[] means, double[][] components, double explainedVarianceRatio) {
    this.means = means;
    this.components = components;
    this.explainedVarianceRatio = explainedVarianceRatio;
  }

  /**
   * Fits the reducer.
   *
   * @param data Row-major training values, at least two rows
   * @param varianceRatio Variance to retain, in (0, 1]
   * @return The fitted reducer
   */
  public static PcaReducer fit(double[][] data, double varianceRatio) {
    return fit(data, varianceRatio, 0);
  }

  /**
   * Fits a reducer keeping a fixed number of components.
   *
   * @param data Row-major training values, at least two rows
   * @param numComponents Number of components to keep, between 1 and the data width
   * @return The fitted reducer
   */
  public static PcaReducer fitComponents(double[][] data, int numComponents) {
    if (data.length > 0 && (numComponents < 1 || numComponents > data[0].length)) {
      throw new IllegalArgumentException("numComponents out of range: " + numComponents);
    }
    return fit(data, 1.0, numComponents);
  }

  private static PcaReducer fit(double[][] data, double varianceRatio, int fixedComponents) {
    if (data.length < 2) {
      throw new IllegalArgumentException("At least two rows are required to fit PCA");
    }
    final int width = data[0].length;
    final double[] means = new double[width];
    for (double[] row : data) {
      for (int col = 0; col < width; ++col) {
        means[col] += row[col] / data.length;
      }
    }

    final RealMatrix covariance = new Covariance(data, false).getCovarianceMatrix();
    final var decomposition = new EigenDecomposition(covariance);
    final double[] eigenvalues = decomposition.getRealEigenvalues();
    final int[] order =
        IntStream.range(0, eigenvalues.length)
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed())
            .mapToInt(Integer::intValue)
            .toArray();

    double total = 0;
    for (double eigenvalue : eigenvalues) {
      total += Math.max(eigenvalue, 0.0);
    }

    int numComponents = 1;
    double cumulative = total > 0 ? Math.max(eigenvalues[order[0]], 0.0) / total : 1.0;
    while (numComponents < order.length
        && (fixedComponents > 0
            ? numComponents < fixedComponents
            : cumulative <= varianceRatio)) {
      if (total > 0) {
        cumulative += Math.max(eigenvalues[order[numComponents]], 0.0) / total;
      }
      ++numComponents;
    }

    final double[][] components = new double[numComponents][];
    for (int i = 0; i < numComponents; ++i) {
      components[i] = decomposition.getEigenvector(order[i]).toArray();
    }
    return new PcaReducer(means, components, Math.min(cumulative, 1.0));
  }

  public int getInputWidth() {
    return means.length;
  }

  public int getOutputWidth() {
    return components.length;
  }

  public double getExplainedVarianceRatio() {
    return explainedVarianceRatio;
  }

  public double[][] transform(double[][] data) {
    final double[][] projected = new double[data.length][components.length];
    for (int row = 0; row < data.length; ++row) {
      if (data[row].length != means.length) {
        throw new IllegalArgumentException(
            String.format("Expected %d columns, got %d", means.length, data[row].length));
      }
      for (int k = 0; k < components.length; ++k) {
        double sum = 0;
        for (int col = 0; col < means.length; ++col) {
          sum += (data[row][col] - means[col]) * components[k][col];
        }
        projected[row][k] = sum;
      }
    }
    return projected;
  }

  /**
   * Maps projected values back to the input space.
   *
   * @param projected Values produced by {@link #transform}
   * @return Reconstructed values of the input width
   */
  public double[][] inverseTransform(double[][] projected) {
    final double[][] restored = new double[projected.length][means.length];
    for (int row = 0; row < projected.length; ++row) {
      if (projected[row].length != components.length) {
        throw new IllegalArgumentException(
            String.format(
                "Expected %d components, got %d", components.length, projected[row].length));
      }
      for (int col = 0; col < means.length; ++col) {
        double sum = means[col];
        for (int k = 0; k < components.length; ++k) {
          sum += projected[row][k] * components[k][col];
        }
        restored[row][col] = sum;
      }
    }
    return restored;
  }

  @Override
  public String toString() {
    return "PcaReducer [inputWidth="
        + means.length
        + ", outputWidth="
        + components.length
        + ", explainedVarianceRatio="
        + explainedVarianceRatio
        + ", means="
        + Arrays.toString(means)
        + "]";
  }
}
