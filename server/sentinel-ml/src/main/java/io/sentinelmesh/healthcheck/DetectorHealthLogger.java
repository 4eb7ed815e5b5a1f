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
package io.sentinelmesh.healthcheck;

import io.sentinelmesh.anomalydetector.AnomalyDetectionEngine;
import io.sentinelmesh.maintenance.MaintenanceWorker;
import io.sentinelmesh.models.DetectorHealth;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DetectorHealthLogger extends MaintenanceWorker {
  private static final Logger logger = LoggerFactory.getLogger(DetectorHealthLogger.class);
  private final String application;
  private final AnomalyDetectionEngine engine;

  public DetectorHealthLogger(
      final String applicationName, AnomalyDetectionEngine engine, int intervalSeconds) {
    super(intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    this.application = applicationName;
    this.engine = engine;
  }

  @Override
  public void runMaintenance() {
    final DetectorHealth health = engine.health();
    if (health.isHealthy()) {
      logger.info(
          "Health Check Service : {} running fine; algorithms={}/{}, lastTraining={}",
          application,
          health.getAlgorithmsLoaded(),
          health.getTotalAlgorithms(),
          health.getLastTraining());
    } else {
      logger.warn(
          "Health Check Service : {} not healthy. Health Check Details = {}, failures={}",
          application,
          health,
          engine.getDiagnostics().totalFailureCount());
    }
  }
}
