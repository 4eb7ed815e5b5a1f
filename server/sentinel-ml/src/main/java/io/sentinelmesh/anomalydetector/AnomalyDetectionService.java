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
package io.sentinelmesh.anomalydetector;

import io.sentinelmesh.anomalydetector.factories.AnomalyDetectionEngineFactory;
import io.sentinelmesh.anomalydetector.lifecycle.ModelRetrainWorker;
import io.sentinelmesh.anomalydetector.notifiers.AnomalyNotifier;
import io.sentinelmesh.anomalydetector.notifiers.LogAnomalyNotifier;
import io.sentinelmesh.anomalydetector.processor.MetricBatchProcessor;
import io.sentinelmesh.common.AnomalyDetectorConfig;
import io.sentinelmesh.healthcheck.DetectorHealthLogger;
import io.sentinelmesh.maintenance.Maintenance;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembly of the anomaly detection service: the engine, the batch processor used by the
 * ingestion layer, and the maintenance workers for periodic retraining and health logging.
 */
@Getter
public class AnomalyDetectionService {
  private static final Logger logger = LoggerFactory.getLogger(AnomalyDetectionService.class);

  public static final String APPLICATION_NAME = "sentinel-ml";

  private final AnomalyDetectionEngine engine;
  private final MetricBatchProcessor processor;
  private final Maintenance maintenance;

  public AnomalyDetectionService() {
    this(AnomalyDetectionEngineFactory.getAnomalyDetectionEngine(), new LogAnomalyNotifier());
  }

  public AnomalyDetectionService(AnomalyDetectionEngine engine, AnomalyNotifier notifier) {
    this.engine = engine;
    this.processor =
        new MetricBatchProcessor(
            engine, notifier, AnomalyDetectorConfig.getAnomalyNotificationsEnabled());
    this.maintenance = new Maintenance();
    maintenance.register(
        new ModelRetrainWorker(engine, AnomalyDetectorConfig.getRetrainIntervalSeconds()));
    maintenance.register(
        new DetectorHealthLogger(
            APPLICATION_NAME, engine, AnomalyDetectorConfig.getHealthCheckIntervalSeconds()));
  }

  public void start() {
    logger.info("Starting {}", APPLICATION_NAME);
    maintenance.start();
  }

  public void shutdown() {
    logger.info("Shutting down {}", APPLICATION_NAME);
    maintenance.shutdown();
  }
}
