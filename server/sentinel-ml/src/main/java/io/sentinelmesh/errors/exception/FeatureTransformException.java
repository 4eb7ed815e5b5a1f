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
package io.sentinelmesh.errors.exception;

import io.sentinelmesh.errors.AnomalyDetectionError;

/** Exception thrown when feature scaling or reduction cannot be fitted or applied. */
public class FeatureTransformException extends AnomalyDetectionException {

  private static final long serialVersionUID = 3318857095524771201L;

  public FeatureTransformException() {
    super(AnomalyDetectionError.FEATURE_TRANSFORM_FAILED);
  }

  public FeatureTransformException(String message) {
    super(AnomalyDetectionError.FEATURE_TRANSFORM_FAILED, message);
  }

  public FeatureTransformException(AnomalyDetectionError info, String message) {
    super(info, message);
  }

  public FeatureTransformException(String message, Throwable t) {
    super(AnomalyDetectionError.FEATURE_TRANSFORM_FAILED, message, t);
  }

  public FeatureTransformException(AnomalyDetectionError info, String message, Throwable t) {
    super(info, message, t);
  }
}
