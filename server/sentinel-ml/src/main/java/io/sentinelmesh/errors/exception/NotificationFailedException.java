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

/** This exception will be thrown when a notifier fails to deliver detected anomalies. */
public class NotificationFailedException extends AnomalyDetectionException {

  private static final long serialVersionUID = 8106468676285188452L;

  public NotificationFailedException(String message) {
    super(AnomalyDetectionError.NOTIFICATION_FAILED, message);
  }

  public NotificationFailedException(String message, Throwable t) {
    super(AnomalyDetectionError.NOTIFICATION_FAILED, message, t);
  }
}
