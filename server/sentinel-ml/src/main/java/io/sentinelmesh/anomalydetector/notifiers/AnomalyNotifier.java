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
package io.sentinelmesh.anomalydetector.notifiers;

import io.sentinelmesh.errors.exception.NotificationFailedException;
import io.sentinelmesh.models.AnomalyResult;
import java.util.List;

/** Interface with a single method to deliver detected anomalies to the alerting layer. */
public interface AnomalyNotifier {

  /**
   * Send a notification.
   *
   * @param anomalies Anomalies of one batch, in batch order
   * @throws NotificationFailedException when the anomalies could not be delivered
   */
  void sendNotification(List<AnomalyResult> anomalies) throws NotificationFailedException;
}
