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

import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.FeatureTransformException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable set of fitted feature transform parameters: the numeric columns the transform was
 * fitted on, the scaler, and the optional PCA reducer.
 */
public class FeatureTransform {
  private final List<String> columns;
  private final StandardScaler scaler;
  private final PcaReducer reducer;

  FeatureTransform(List<String> columns, StandardScaler scaler, PcaReducer reducer) {
    this.columns = Collections.unmodifiableList(List.copyOf(columns));
    this.scaler = scaler;
    this.reducer = reducer;
  }

  public List<String> getColumns() {
    return columns;
  }

  public StandardScaler getScaler() {
    return scaler;
  }

  public Optional<PcaReducer> getReducer() {
    return Optional.ofNullable(reducer);
  }

  /** Width of the matrices this transform produces. */
  public int getOutputWidth() {
    return reducer != null ? reducer.getOutputWidth() : scaler.getWidth();
  }

  /**
   * Applies the fitted parameters to a table.
   *
   * @param table The feature table
   * @return Scaled and, when a reducer was fitted, reduced features
   * @throws FeatureTransformException when the table's numeric columns differ from the fitted ones
   */
  public FeatureMatrix apply(FeatureTable table) throws FeatureTransformException {
    final List<String> numericColumns = table.getNumericColumnNames();
    if (!numericColumns.equals(columns)) {
      throw new FeatureTransformException(
          AnomalyDetectionError.FEATURE_SCHEMA_MISMATCH,
          "fitted=" + columns + ", actual=" + numericColumns);
    }
    double[][] values = scaler.transform(table.toNumericMatrix(columns));
    if (reducer != null) {
      values = reducer.transform(values);
    }
    return new FeatureMatrix(values);
  }

  @Override
  public String toString() {
    return "FeatureTransform [columns=" + columns + ", reducer=" + reducer + "]";
  }
}
