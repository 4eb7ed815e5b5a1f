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

import io.sentinelmesh.anomalydetector.detectors.StatisticalOutlierDetector;
import io.sentinelmesh.anomalydetector.diagnostics.DetectionDiagnostics;
import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.anomalydetector.ensemble.Consensus;
import io.sentinelmesh.anomalydetector.ensemble.EnsembleVoter;
import io.sentinelmesh.anomalydetector.ensemble.StrategyVerdicts;
import io.sentinelmesh.anomalydetector.features.FeaturePreparer;
import io.sentinelmesh.anomalydetector.features.FeatureTable;
import io.sentinelmesh.anomalydetector.features.MetricFeatureExtractor;
import io.sentinelmesh.anomalydetector.features.PreparedFeatures;
import io.sentinelmesh.anomalydetector.lifecycle.ModelGeneration;
import io.sentinelmesh.anomalydetector.lifecycle.TrainingLifecycleManager;
import io.sentinelmesh.anomalydetector.lifecycle.TrainingState;
import io.sentinelmesh.anomalydetector.strategies.DetectionStrategy;
import io.sentinelmesh.anomalydetector.synthesis.ResultSynthesizer;
import io.sentinelmesh.anomalydetector.window.RecentMetricWindow;
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.AnomalyDetectionException;
import io.sentinelmesh.errors.exception.StrategyException;
import io.sentinelmesh.models.AnomalyResult;
import io.sentinelmesh.models.DetectorHealth;
import io.sentinelmesh.models.MetricSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensemble anomaly detection over metric batches.
 *
 * <p>A batch flows through feature extraction and preparation, the trained strategies and the
 * statistical detector, the voter and the result synthesizer. The engine never throws to its
 * callers: a failing strategy is left out of the vote, and any other failure turns the batch
 * result into an empty list. Every absorbed failure is recorded in {@link
 * #getDiagnostics()}.
 */
public class AnomalyDetectionEngine {
  private static final Logger logger = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

  public static final String STATISTICAL_VOTER = "statistical";

  private final MetricFeatureExtractor featureExtractor;
  private final FeaturePreparer featurePreparer;
  private final StatisticalOutlierDetector statisticalDetector;
  private final TrainingLifecycleManager lifecycle;
  private final EnsembleVoter voter;
  private final ResultSynthesizer synthesizer;
  private final RecentMetricWindow recentMetrics;
  private final DetectionDiagnostics diagnostics;

  public AnomalyDetectionEngine(
      MetricFeatureExtractor featureExtractor,
      FeaturePreparer featurePreparer,
      StatisticalOutlierDetector statisticalDetector,
      TrainingLifecycleManager lifecycle,
      EnsembleVoter voter,
      ResultSynthesizer synthesizer,
      RecentMetricWindow recentMetrics,
      DetectionDiagnostics diagnostics) {
    this.featureExtractor = featureExtractor;
    this.featurePreparer = featurePreparer;
    this.statisticalDetector = statisticalDetector;
    this.lifecycle = lifecycle;
    this.voter = voter;
    this.synthesizer = synthesizer;
    this.recentMetrics = recentMetrics;
    this.diagnostics = diagnostics;
  }

  /**
   * Detects anomalies in a batch.
   *
   * @param batch Metric samples
   * @return Anomalies in batch order, at most one per sample; empty on any batch level failure
   */
  public List<AnomalyResult> detect(List<MetricSample> batch) {
    if (batch == null || batch.isEmpty()) {
      return Collections.emptyList();
    }
    try {
      recentMetrics.addAll(batch);
      final List<AnomalyResult> anomalies = detectInternal(batch);
      logger.debug("Detected {} anomalies from {} metrics", anomalies.size(), batch.size());
      return anomalies;
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.DETECTION,
          AnomalyDetectionError.APPLICATION_ERROR,
          null,
          e.getMessage(),
          e);
    }
    return Collections.emptyList();
  }

  private List<AnomalyResult> detectInternal(List<MetricSample> batch) {
    final FeatureTable table = extract(batch);
    if (table == null || !table.hasNumericColumns()) {
      logger.debug("No numeric features in batch of {} metrics", batch.size());
      return Collections.emptyList();
    }

    ModelGeneration generation = lifecycle.ensureTrained(table);
    Optional<PreparedFeatures> prepared = featurePreparer.prepare(table, generation.getTransform());
    if (prepared.isEmpty()) {
      return Collections.emptyList();
    }
    if (prepared.get().isNewlyFitted()) {
      generation = lifecycle.adoptTransform(generation, prepared.get().getTransform());
      if (generation.getTransform() != prepared.get().getTransform()) {
        // a training completed in the meantime
        prepared = featurePreparer.prepare(table, generation.getTransform());
        if (prepared.isEmpty()) {
          return Collections.emptyList();
        }
      }
    }

    final var participants = new ArrayList<String>();
    final var verdicts = new ArrayList<StrategyVerdicts>();
    for (DetectionStrategy strategy : generation.activeStrategies()) {
      try {
        final var matrix = prepared.get().getMatrix();
        verdicts.add(
            new StrategyVerdicts(
                strategy.getName(), strategy.classify(matrix), strategy.score(matrix)));
        participants.add(strategy.getName());
      } catch (StrategyException e) {
        diagnostics.record(DiagnosticStage.STRATEGY_INFERENCE, strategy.getName(), e);
      } catch (RuntimeException e) {
        diagnostics.record(
            DiagnosticStage.STRATEGY_INFERENCE,
            AnomalyDetectionError.STRATEGY_INFERENCE_FAILED,
            strategy.getName(),
            e.getMessage(),
            e);
      }
    }
    participants.add(STATISTICAL_VOTER);

    final List<Consensus> anomalous;
    try {
      anomalous = voter.anomalous(table.getRowCount(), verdicts, flagOutliers(table));
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.VOTING, AnomalyDetectionError.VOTING_FAILED, null, e.getMessage(), e);
      return Collections.emptyList();
    }

    final long detectedAt = System.currentTimeMillis();
    final var results = new ArrayList<AnomalyResult>(anomalous.size());
    for (Consensus consensus : anomalous) {
      final int index = consensus.getIndex();
      try {
        results.add(
            synthesizer.synthesize(
                batch.get(index),
                table.getNumericRow(index),
                consensus,
                participants,
                detectedAt));
      } catch (AnomalyDetectionException e) {
        diagnostics.record(DiagnosticStage.SYNTHESIS, null, e);
        return Collections.emptyList();
      } catch (RuntimeException e) {
        diagnostics.record(
            DiagnosticStage.SYNTHESIS,
            AnomalyDetectionError.SYNTHESIS_FAILED,
            null,
            e.getMessage(),
            e);
        return Collections.emptyList();
      }
    }
    return results;
  }

  private FeatureTable extract(List<MetricSample> batch) {
    try {
      return featureExtractor.extract(batch);
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.EXTRACTION,
          AnomalyDetectionError.FEATURE_EXTRACTION_FAILED,
          null,
          e.getMessage(),
          e);
      return null;
    }
  }

  private Set<Integer> flagOutliers(FeatureTable table) {
    try {
      return statisticalDetector.flag(table);
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.STATISTICAL,
          AnomalyDetectionError.STATISTICAL_DETECTION_FAILED,
          null,
          e.getMessage(),
          e);
      return new TreeSet<>();
    }
  }

  /**
   * Refits the feature transform and every strategy on the given data.
   *
   * @param recentData Training data; an empty table is a logged no-op
   * @return true if a new model generation was published
   */
  public boolean retrain(FeatureTable recentData) {
    try {
      return lifecycle.retrain(recentData);
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.TRAINING, AnomalyDetectionError.TRAINING_FAILED, null, e.getMessage(), e);
      return false;
    }
  }

  /**
   * Retrains on the recent metrics window.
   *
   * @return true if a new model generation was published
   */
  public boolean retrain() {
    final List<MetricSample> recent = recentMetrics.snapshot();
    if (recent.isEmpty()) {
      logger.info("No recent metrics available; skipping retrain");
      return false;
    }
    final FeatureTable table = extract(recent);
    if (table == null) {
      return false;
    }
    return retrain(table);
  }

  public boolean isReady() {
    return lifecycle.getState() == TrainingState.TRAINED;
  }

  public DetectorHealth health() {
    final ModelGeneration generation = lifecycle.current();
    return new DetectorHealth(
        generation.isTrained(),
        generation.getTrainedAt(),
        generation.activeStrategies().size() + 1,
        lifecycle.getRoster().size() + 1);
  }

  public DetectionDiagnostics getDiagnostics() {
    return diagnostics;
  }

  public TrainingLifecycleManager getLifecycle() {
    return lifecycle;
  }

  public RecentMetricWindow getRecentMetrics() {
    return recentMetrics;
  }
}
