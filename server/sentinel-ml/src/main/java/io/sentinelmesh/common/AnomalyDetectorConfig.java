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
package io.sentinelmesh.common;

/** Configuration parameters of the anomaly detection service. */
public class AnomalyDetectorConfig {

  public static final String ANOMALY_DETECTION_CONTAMINATION =
      "io.sentinelmesh.anomaly.detector.contamination";
  public static final String ANOMALY_DETECTION_THRESHOLD =
      "io.sentinelmesh.anomaly.detector.threshold";
  public static final String ANOMALY_DETECTOR_WINDOW_LENGTH =
      "io.sentinelmesh.anomaly.detector.window.length";
  public static final String ANOMALY_DETECTOR_STRATEGIES =
      "io.sentinelmesh.anomaly.detector.strategies";
  public static final String ANOMALY_DETECTOR_RANDOM_SEED =
      "io.sentinelmesh.anomaly.detector.randomSeed";
  public static final String ISOLATION_FOREST_NUM_TREES =
      "io.sentinelmesh.anomaly.detector.isolationForest.numTrees";
  public static final String LOF_NUM_NEIGHBORS =
      "io.sentinelmesh.anomaly.detector.lof.numNeighbors";
  public static final String DIAGNOSTICS_HISTORY_LENGTH =
      "io.sentinelmesh.anomaly.detector.diagnostics.history";
  public static final String RETRAIN_INTERVAL_SECONDS =
      "io.sentinelmesh.anomaly.detector.retrain.interval";

  public static final String HEALTH_CHECK_INTERVAL_SECONDS = "io.sentinelmesh.healthcheck.interval";

  public static final String ANOMALY_NOTIFICATIONS_ENABLED =
      "io.sentinelmesh.alerts.anomalyNotificationsEnabled";

  public static final String DEFAULT_STRATEGIES =
      "isolationForest,reconstructionError,localOutlierFactor";

  private static SentinelConfigBase getInstance() {
    return SentinelConfigBase.getInstance();
  }

  /** Expected proportion of anomalous samples in training data. */
  public static double getContamination() {
    return getInstance().getDouble(ANOMALY_DETECTION_CONTAMINATION, 0.1, 0.0, 0.5);
  }

  /** Decision threshold reported with every anomaly for audit. */
  public static double getAnomalyDetectionThreshold() {
    return getInstance().getDouble(ANOMALY_DETECTION_THRESHOLD, 0.8);
  }

  /** Number of most recent metric samples kept for retraining. */
  public static int getAnomalyDetectorWindowLength() {
    return getInstance().getInt(ANOMALY_DETECTOR_WINDOW_LENGTH, 100, 1, Integer.MAX_VALUE);
  }

  /** Names of the learned detection strategies taking part in the ensemble. */
  public static String[] getEnabledStrategies() {
    return getInstance().getStringArray(ANOMALY_DETECTOR_STRATEGIES, ",", DEFAULT_STRATEGIES);
  }

  /**
   * Seed for the randomized strategies.
   *
   * <p>The isolation forest grows its trees in parallel, so the seed does not make its scores
   * exactly reproducible.
   */
  public static long getRandomSeed() {
    return getInstance().getLong(ANOMALY_DETECTOR_RANDOM_SEED, 42L);
  }

  public static int getIsolationForestNumTrees() {
    return getInstance().getInt(ISOLATION_FOREST_NUM_TREES, 100, 1, 10000);
  }

  public static int getLofNumNeighbors() {
    return getInstance().getInt(LOF_NUM_NEIGHBORS, 20, 1, 1000);
  }

  /** Number of diagnostic events retained for operators. */
  public static int getDiagnosticsHistoryLength() {
    return getInstance().getInt(DIAGNOSTICS_HISTORY_LENGTH, 100, 1, 100000);
  }

  /** Interval of periodic model retraining in seconds. */
  public static int getRetrainIntervalSeconds() {
    return getInstance().getInt(RETRAIN_INTERVAL_SECONDS, 3600, 1, Integer.MAX_VALUE);
  }

  /** Interval of periodic detector health logging in seconds. */
  public static int getHealthCheckIntervalSeconds() {
    return getInstance().getInt(HEALTH_CHECK_INTERVAL_SECONDS, 300, 1, Integer.MAX_VALUE);
  }

  public static boolean getAnomalyNotificationsEnabled() {
    return getInstance().getBoolean(ANOMALY_NOTIFICATIONS_ENABLED, true);
  }
}
