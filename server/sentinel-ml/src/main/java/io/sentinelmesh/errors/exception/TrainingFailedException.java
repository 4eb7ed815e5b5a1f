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

/** Exception thrown when a training run cannot produce a usable model generation. */
public class TrainingFailedException extends AnomalyDetectionException {

  private static final long serialVersionUID = 1590632884617710925L;

  public TrainingFailedException() {
    super(AnomalyDetectionError.TRAINING_FAILED);
  }

  public TrainingFailedException(String message) {
    super(AnomalyDetectionError.TRAINING_FAILED, message);
  }

  public TrainingFailedException(AnomalyDetectionError info, String message) {
    super(info, message);
  }

  public TrainingFailedException(String message, Throwable t) {
    super(AnomalyDetectionError.TRAINING_FAILED, message, t);
  }

  public TrainingFailedException(AnomalyDetectionError info, String message, Throwable t) {
    super(info, message, t);
  }
}
