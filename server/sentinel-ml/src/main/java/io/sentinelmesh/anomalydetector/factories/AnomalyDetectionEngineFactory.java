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
package io.sentinelmesh.anomalydetector.factories;

import io.sentinelmesh.anomalydetector.AnomalyDetectionEngine;
import io.sentinelmesh.anomalydetector.detectors.StatisticalOutlierDetector;
import io.sentinelmesh.anomalydetector.diagnostics.DetectionDiagnostics;
import io.sentinelmesh.anomalydetector.ensemble.EnsembleVoter;
import io.sentinelmesh.anomalydetector.features.DefaultMetricFeatureExtractor;
import io.sentinelmesh.anomalydetector.features.FeaturePreparer;
import io.sentinelmesh.anomalydetector.features.MetricFeatureExtractor;
import io.sentinelmesh.anomalydetector.lifecycle.TrainingLifecycleManager;
import io.sentinelmesh.anomalydetector.strategies.StrategyFactory;
import io.sentinelmesh.anomalydetector.strategies.StrategyKind;
import io.sentinelmesh.anomalydetector.synthesis.AnomalyIdGenerator;
import io.sentinelmesh.anomalydetector.synthesis.AnomalyTypeClassifier;
import io.sentinelmesh.anomalydetector.synthesis.ResultSynthesizer;
import io.sentinelmesh.anomalydetector.window.RecentMetricWindow;
import io.sentinelmesh.common.AnomalyDetectorConfig;
import io.sentinelmesh.errors.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory for the anomaly detection engine. */
public class AnomalyDetectionEngineFactory {
  private static final Logger logger =
      LoggerFactory.getLogger(AnomalyDetectionEngineFactory.class);

  /**
   * Builds an engine with the default feature extraction from the current configuration.
   *
   * @return A new, untrained engine
   * @throws InvalidConfigurationException when a configuration value is invalid
   */
  public static AnomalyDetectionEngine getAnomalyDetectionEngine() {
    return getAnomalyDetectionEngine(new DefaultMetricFeatureExtractor());
  }

  /**
   * Builds an engine from the current configuration.
   *
   * @param featureExtractor Feature extraction to use
   * @return A new, untrained engine
   * @throws InvalidConfigurationException when a configuration value is invalid
   */
  public static AnomalyDetectionEngine getAnomalyDetectionEngine(
      MetricFeatureExtractor featureExtractor) {
    final List<StrategyKind> roster = parseStrategies(AnomalyDetectorConfig.getEnabledStrategies());
    final var strategyFactory =
        new StrategyFactory(
            AnomalyDetectorConfig.getContamination(),
            AnomalyDetectorConfig.getIsolationForestNumTrees(),
            AnomalyDetectorConfig.getLofNumNeighbors(),
            AnomalyDetectorConfig.getRandomSeed());
    final double threshold = AnomalyDetectorConfig.getAnomalyDetectionThreshold();
    logger.info(
        "Building anomaly detection engine; strategies={}, threshold={}, {}",
        roster,
        threshold,
        strategyFactory);

    final var diagnostics =
        new DetectionDiagnostics(AnomalyDetectorConfig.getDiagnosticsHistoryLength());
    final var featurePreparer = new FeaturePreparer(diagnostics);
    return new AnomalyDetectionEngine(
        featureExtractor,
        featurePreparer,
        new StatisticalOutlierDetector(),
        new TrainingLifecycleManager(roster, strategyFactory, featurePreparer, diagnostics),
        new EnsembleVoter(),
        new ResultSynthesizer(threshold, new AnomalyTypeClassifier(), new AnomalyIdGenerator()),
        new RecentMetricWindow(AnomalyDetectorConfig.getAnomalyDetectorWindowLength()),
        diagnostics);
  }

  /**
   * Resolves the configured strategy names.
   *
   * @param names Strategy names; blanks are ignored, duplicates are rejected
   * @return The strategies in configuration order
   * @throws InvalidConfigurationException when a name is unknown or repeated
   */
  public static List<StrategyKind> parseStrategies(String[] names) {
    final var roster = new ArrayList<StrategyKind>();
    for (String name : names) {
      if (StringUtils.isBlank(name)) {
        continue;
      }
      final StrategyKind kind;
      try {
        kind = StrategyKind.forValue(name);
      } catch (IllegalArgumentException e) {
        throw new InvalidConfigurationException(
            AnomalyDetectorConfig.ANOMALY_DETECTOR_STRATEGIES + ": " + e.getMessage(), e);
      }
      if (roster.contains(kind)) {
        throw new InvalidConfigurationException(
            AnomalyDetectorConfig.ANOMALY_DETECTOR_STRATEGIES + ": duplicate strategy " + name);
      }
      roster.add(kind);
    }
    return roster;
  }
}
