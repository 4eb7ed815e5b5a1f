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

/**
 * Exception thrown to indicate that the detector cannot be built due to a misconfiguration.
 *
 * <p>Unlike the detection stage exceptions, this one is unchecked since it is raised only while
 * the service is being assembled.
 */
public class InvalidConfigurationException extends RuntimeException {

  private static final long serialVersionUID = 7255356423560979021L;

  public InvalidConfigurationException(String message) {
    super(AnomalyDetectionError.INVALID_CONFIGURATION.getErrorMessage() + ": " + message);
  }

  public InvalidConfigurationException(String message, Throwable t) {
    super(AnomalyDetectionError.INVALID_CONFIGURATION.getErrorMessage() + ": " + message, t);
  }

  public String getErrorCode() {
    return AnomalyDetectionError.INVALID_CONFIGURATION.getErrorCode();
  }
}
