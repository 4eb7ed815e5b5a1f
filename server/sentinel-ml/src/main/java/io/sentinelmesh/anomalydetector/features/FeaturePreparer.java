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

import io.sentinelmesh.anomalydetector.diagnostics.DetectionDiagnostics;
import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.FeatureTransformException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a feature table into the numeric matrix shared by all detection strategies.
 *
 * <p>Numeric columns are selected, missing values are imputed with zero, values are standardized
 * and, when there are more than {@link #PCA_MIN_COLUMNS} columns, projected onto the principal
 * components retaining {@link #PCA_VARIANCE_RATIO} of the variance. Fitted parameters are reused
 * for every following batch until a retrain replaces them.
 */
public class FeaturePreparer {
  private static final Logger logger = LoggerFactory.getLogger(FeaturePreparer.class);

  public static final int PCA_MIN_COLUMNS = 10;
  public static final double PCA_VARIANCE_RATIO = 0.95;

  private final DetectionDiagnostics diagnostics;

  public FeaturePreparer(DetectionDiagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  /**
   * Prepares the features of a batch.
   *
   * @param table The feature table of the batch
   * @param fitted Previously fitted transform, null if none has been fitted yet
   * @return Prepared features, or empty when there is nothing to analyze or preparation failed
   */
  public Optional<PreparedFeatures> prepare(FeatureTable table, FeatureTransform fitted) {
    if (table == null || table.isEmpty() || !table.hasNumericColumns()) {
      logger.debug("No numeric features to analyze");
      return Optional.empty();
    }
    try {
      if (fitted != null) {
        return Optional.of(new PreparedFeatures(fitted.apply(table), fitted, false));
      }
      final FeatureTransform transform = fit(table);
      return Optional.of(new PreparedFeatures(transform.apply(table), transform, true));
    } catch (FeatureTransformException e) {
      diagnostics.record(DiagnosticStage.FEATURE_PREPARATION, null, e);
      return Optional.empty();
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.FEATURE_PREPARATION,
          AnomalyDetectionError.FEATURE_TRANSFORM_FAILED,
          null,
          e.getMessage(),
          e);
      return Optional.empty();
    }
  }

  /**
   * Fits a new transform on a table: scaler first, then the reducer on the scaled values.
   *
   * @param table Training table
   * @return The fitted transform
   * @throws FeatureTransformException when the table has no numeric data or fitting fails
   */
  public FeatureTransform fit(FeatureTable table) throws FeatureTransformException {
    if (table == null || table.isEmpty() || !table.hasNumericColumns()) {
      throw new FeatureTransformException("no numeric columns to fit on");
    }
    final List<String> columns = table.getNumericColumnNames();
    try {
      final double[][] values = table.toNumericMatrix(columns);
      final StandardScaler scaler = StandardScaler.fit(values);
      PcaReducer reducer = null;
      if (columns.size() > PCA_MIN_COLUMNS) {
        reducer = PcaReducer.fit(scaler.transform(values), PCA_VARIANCE_RATIO);
        logger.debug(
            "Fitted PCA reducing {} columns to {} components",
            columns.size(),
            reducer.getOutputWidth());
      }
      return new FeatureTransform(columns, scaler, reducer);
    } catch (RuntimeException e) {
      throw new FeatureTransformException("fitting failed; " + e.getMessage(), e);
    }
  }
}
