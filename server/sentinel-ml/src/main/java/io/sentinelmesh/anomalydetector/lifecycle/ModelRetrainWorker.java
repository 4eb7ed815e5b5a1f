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
package io.sentinelmesh.anomalydetector.lifecycle;

import io.sentinelmesh.anomalydetector.AnomalyDetectionEngine;
import io.sentinelmesh.maintenance.MaintenanceWorker;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodically retrains the engine on its recent metrics window. */
public class ModelRetrainWorker extends MaintenanceWorker {
  private static final Logger logger = LoggerFactory.getLogger(ModelRetrainWorker.class);

  private final AnomalyDetectionEngine engine;

  public ModelRetrainWorker(AnomalyDetectionEngine engine, int intervalSeconds) {
    super(intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    this.engine = engine;
  }

  @Override
  public void runMaintenance() {
    logger.debug("Starting periodic model retraining");
    if (engine.retrain()) {
      logger.info(
          "Periodic model retraining completed; generation={}",
          engine.getLifecycle().current().getSequence());
    }
  }
}
