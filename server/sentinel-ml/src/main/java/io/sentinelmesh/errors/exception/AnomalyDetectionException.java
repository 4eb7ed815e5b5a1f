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
import io.sentinelmesh.errors.SentinelError;
import java.util.Objects;
import lombok.Getter;
import lombok.Setter;

/**
 * An exception thrown when an anomaly detection stage fails.
 *
 * <p>The engine never lets this exception reach its callers. It is caught at the stage boundary
 * and turned into a diagnostic event carrying the error code.
 */
public class AnomalyDetectionException extends Exception implements SentinelError {

  private static final long serialVersionUID = 4127390556512708831L;

  protected final SentinelError info;

  protected String mymessage;
  // Internal error message used for troubleshooting, not reported to the alerting layer
  @Setter @Getter protected String internalMessage;

  public AnomalyDetectionException(String message) {
    this.info = AnomalyDetectionError.APPLICATION_ERROR;
    mymessage = message;
  }

  public AnomalyDetectionException(String message, Throwable t) {
    super(t);
    this.info = AnomalyDetectionError.APPLICATION_ERROR;
    mymessage = message;
  }

  public AnomalyDetectionException(SentinelError info) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public AnomalyDetectionException(SentinelError info, String additionalMessage) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public AnomalyDetectionException(SentinelError info, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public AnomalyDetectionException(SentinelError info, String additionalMessage, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public SentinelError getInfo() {
    return info;
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  @Override
  public String getMessage() {
    return mymessage;
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(super.toString());
    if (internalMessage != null) {
      sb.append(" (").append(internalMessage).append(" )");
    }
    return sb.toString();
  }
}
