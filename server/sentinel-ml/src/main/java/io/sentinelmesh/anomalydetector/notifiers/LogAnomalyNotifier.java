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

import com.fasterxml.jackson.core.JsonProcessingException;
import io.sentinelmesh.errors.exception.NotificationFailedException;
import io.sentinelmesh.models.AnomalyResult;
import io.sentinelmesh.utils.SentinelObjectMapperProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Notifier implementation which logs each anomaly as a WARNING log in JSON. */
public class LogAnomalyNotifier implements AnomalyNotifier {
  private static final Logger logger = LoggerFactory.getLogger(LogAnomalyNotifier.class);

  @Override
  public void sendNotification(List<AnomalyResult> anomalies)
      throws NotificationFailedException {
    for (AnomalyResult anomaly : anomalies) {
      try {
        logger.warn(
            "Anomaly {} severity={} {}",
            anomaly.getType().stringify(),
            anomaly.getSeverity().stringify(),
            SentinelObjectMapperProvider.get().writeValueAsString(anomaly));
      } catch (JsonProcessingException e) {
        throw new NotificationFailedException("Failed to serialize anomaly " + anomaly.getId(), e);
      }
    }
  }
}
