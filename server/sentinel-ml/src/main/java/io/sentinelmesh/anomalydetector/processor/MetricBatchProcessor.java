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
package io.sentinelmesh.anomalydetector.processor;

import io.sentinelmesh.anomalydetector.AnomalyDetectionEngine;
import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.anomalydetector.notifiers.AnomalyNotifier;
import io.sentinelmesh.errors.exception.NotificationFailedException;
import io.sentinelmesh.models.AnomalyResult;
import io.sentinelmesh.models.MetricSample;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver class for running anomaly detection on a metric batch received from the ingestion
 * layer. Encapsulates the detection engine and the notification of detected anomalies.
 */
public class MetricBatchProcessor {
  private static final Logger logger = LoggerFactory.getLogger(MetricBatchProcessor.class);
  private final AnomalyDetectionEngine engine;
  private final AnomalyNotifier anomalyNotifier;
  private final boolean isAnomalyNotificationEnabled;

  public MetricBatchProcessor(
      AnomalyDetectionEngine engine,
      AnomalyNotifier anomalyNotifier,
      boolean isAnomalyNotificationEnabled) {
    this.engine = engine;
    this.anomalyNotifier = anomalyNotifier;
    this.isAnomalyNotificationEnabled = isAnomalyNotificationEnabled;
  }

  /**
   * Runs detection on a batch and notifies the anomalies found.
   *
   * @param batch The metric batch
   * @return The detected anomalies
   */
  public List<AnomalyResult> processBatch(List<MetricSample> batch) {
    logger.debug(
        "Anomaly detector processing batch of {} metrics", batch != null ? batch.size() : 0);
    final List<AnomalyResult> anomalies = engine.detect(batch);
    if (!anomalies.isEmpty()) {
      logger.info("Detected {} anomalies", anomalies.size());
      if (isAnomalyNotificationEnabled) {
        try {
          anomalyNotifier.sendNotification(anomalies);
        } catch (NotificationFailedException e) {
          engine.getDiagnostics().record(DiagnosticStage.NOTIFICATION, null, e);
        }
      }
    }
    return anomalies;
  }
}
