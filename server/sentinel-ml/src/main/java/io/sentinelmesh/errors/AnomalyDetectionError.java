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
package io.sentinelmesh.errors;

public enum AnomalyDetectionError implements SentinelError {
  APPLICATION_ERROR("ANOMALY00", "Generic anomaly detection error"),
  FEATURE_EXTRACTION_FAILED("ANOMALY01", "Failed to extract features from metric batch"),
  FEATURE_TRANSFORM_FAILED("ANOMALY02", "Failed to scale or reduce features"),
  FEATURE_SCHEMA_MISMATCH("ANOMALY03", "Feature columns do not match the fitted transform"),
  STRATEGY_NOT_TRAINED("ANOMALY04", "Detection strategy has not been trained"),
  STRATEGY_DIMENSION_MISMATCH(
      "ANOMALY05", "Feature width differs from the width the strategy was trained with"),
  STRATEGY_TRAINING_FAILED("ANOMALY06", "Detection strategy failed to train"),
  STRATEGY_INFERENCE_FAILED("ANOMALY07", "Detection strategy failed to classify or score"),
  TRAINING_FAILED("ANOMALY08", "Anomaly detection models failed to train"),
  STATISTICAL_DETECTION_FAILED("ANOMALY09", "Statistical outlier detection failed"),
  VOTING_FAILED("ANOMALY0a", "Failed to combine strategy verdicts"),
  SYNTHESIS_FAILED("ANOMALY0b", "Failed to create anomaly result"),
  INVALID_CONFIGURATION(
      "ANOMALY0c", "Unable to complete operation due to invalid detector configuration"),
  NOTIFICATION_FAILED("ANOMALY0d", "Failed to deliver anomaly notification"),
  ;

  private final String errorCode;
  private final String message;

  private AnomalyDetectionError(String errorCode, String message) {
    this.errorCode = errorCode;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}
