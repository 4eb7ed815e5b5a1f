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

import io.sentinelmesh.anomalydetector.diagnostics.DetectionDiagnostics;
import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.anomalydetector.features.FeatureMatrix;
import io.sentinelmesh.anomalydetector.features.FeaturePreparer;
import io.sentinelmesh.anomalydetector.features.FeatureTable;
import io.sentinelmesh.anomalydetector.features.FeatureTransform;
import io.sentinelmesh.anomalydetector.strategies.DetectionStrategy;
import io.sentinelmesh.anomalydetector.strategies.StrategyFactory;
import io.sentinelmesh.anomalydetector.strategies.StrategyKind;
import io.sentinelmesh.anomalydetector.strategies.StrategySlot;
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.FeatureTransformException;
import io.sentinelmesh.errors.exception.StrategyException;
import io.sentinelmesh.errors.exception.TrainingFailedException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the model generations of the ensemble.
 *
 * <p>Readers take the current generation without locking. Training is single writer: the
 * initial training blocks detections that arrive while it runs, while a retrain requested
 * during another training is coalesced into the running one. A failed training publishes
 * nothing, so the state never goes back to {@link TrainingState#UNTRAINED}.
 *
 * <p>Training fits the feature transform first, then every configured strategy on the
 * transformed features. A strategy that fails is isolated: it keeps its previous slot when the
 * feature width did not change and becomes uninitialized otherwise. The training as a whole
 * fails when the transform cannot be fitted or every configured strategy fails.
 */
public class TrainingLifecycleManager {
  private static final Logger logger = LoggerFactory.getLogger(TrainingLifecycleManager.class);

  private final List<StrategyKind> roster;
  private final StrategyFactory strategyFactory;
  private final FeaturePreparer featurePreparer;
  private final DetectionDiagnostics diagnostics;

  private final AtomicReference<ModelGeneration> current;
  private final AtomicLong sequence = new AtomicLong();
  private final ReentrantLock trainingLock = new ReentrantLock();

  public TrainingLifecycleManager(
      List<StrategyKind> roster,
      StrategyFactory strategyFactory,
      FeaturePreparer featurePreparer,
      DetectionDiagnostics diagnostics) {
    this.roster = Collections.unmodifiableList(new ArrayList<>(roster));
    this.strategyFactory = strategyFactory;
    this.featurePreparer = featurePreparer;
    this.diagnostics = diagnostics;
    this.current = new AtomicReference<>(ModelGeneration.initial(this.roster));
  }

  public ModelGeneration current() {
    return current.get();
  }

  public TrainingState getState() {
    return current.get().getState();
  }

  public List<StrategyKind> getRoster() {
    return roster;
  }

  /** Time of the last successful training in milliseconds since epoch, null if never trained. */
  public Long getLastTraining() {
    return current.get().getTrainedAt();
  }

  /**
   * Trains on the given table unless a trained generation exists already.
   *
   * <p>Blocks until the training, this one or a concurrent one, completes.
   *
   * @param table Training data
   * @return The generation to use for detection, trained unless the training failed
   */
  public ModelGeneration ensureTrained(FeatureTable table) {
    ModelGeneration generation = current.get();
    if (generation.isTrained()) {
      return generation;
    }
    trainingLock.lock();
    try {
      generation = current.get();
      if (generation.isTrained()) {
        return generation;
      }
      logger.info("No trained models available; running initial training");
      train(table, generation);
      return current.get();
    } finally {
      trainingLock.unlock();
    }
  }

  /**
   * Refits the transform and every strategy on recent data.
   *
   * @param table Recent data
   * @return true if a new generation was published
   */
  public boolean retrain(FeatureTable table) {
    if (table == null || table.isEmpty()) {
      logger.info("No recent data available; skipping retrain");
      return false;
    }
    if (!trainingLock.tryLock()) {
      logger.info("Training already in progress; retrain request coalesced");
      return false;
    }
    try {
      return train(table, current.get());
    } finally {
      trainingLock.unlock();
    }
  }

  /**
   * Installs a transform fitted during detection into a generation that has none.
   *
   * @param expected The generation the transform was fitted for
   * @param transform The fitted transform
   * @return The current generation after the attempt; it may carry another transform when a
   *     training completed in the meantime
   */
  public ModelGeneration adoptTransform(ModelGeneration expected, FeatureTransform transform) {
    if (expected.getTransform() != null) {
      return current.get();
    }
    final var next = expected.withTransform(sequence.incrementAndGet(), transform);
    if (current.compareAndSet(expected, next)) {
      logger.debug("Adopted feature transform {}", transform);
      return next;
    }
    return current.get();
  }

  private boolean train(FeatureTable table, ModelGeneration previous) {
    final long start = System.currentTimeMillis();
    try {
      final var next = buildGeneration(table, previous);
      current.set(next);
      logger.info(
          "Published model generation {}; strategies={}/{}, features={}, rows={}, elapsed={}ms",
          next.getSequence(),
          next.activeStrategies().size(),
          roster.size(),
          next.getTransform().getOutputWidth(),
          table.getRowCount(),
          System.currentTimeMillis() - start);
      return true;
    } catch (TrainingFailedException e) {
      diagnostics.record(DiagnosticStage.TRAINING, null, e);
      return false;
    } catch (RuntimeException e) {
      diagnostics.record(
          DiagnosticStage.TRAINING, AnomalyDetectionError.TRAINING_FAILED, null, e.getMessage(), e);
      return false;
    }
  }

  ModelGeneration buildGeneration(FeatureTable table, ModelGeneration previous)
      throws TrainingFailedException {
    final FeatureTransform transform;
    final FeatureMatrix matrix;
    try {
      transform = featurePreparer.fit(table);
      matrix = transform.apply(table);
    } catch (FeatureTransformException e) {
      throw new TrainingFailedException(
          "Feature transform could not be fitted; " + e.getMessage(), e);
    }

    final var slots = new ArrayList<StrategySlot>(roster.size());
    int trained = 0;
    for (StrategyKind kind : roster) {
      final DetectionStrategy strategy = strategyFactory.create(kind);
      try {
        strategy.train(matrix);
        slots.add(StrategySlot.trained(strategy));
        ++trained;
        continue;
      } catch (StrategyException e) {
        diagnostics.record(DiagnosticStage.STRATEGY_TRAINING, strategy.getName(), e);
      } catch (RuntimeException e) {
        diagnostics.record(
            DiagnosticStage.STRATEGY_TRAINING,
            AnomalyDetectionError.STRATEGY_TRAINING_FAILED,
            strategy.getName(),
            e.getMessage(),
            e);
      }
      final StrategySlot prior = previous.getSlot(kind);
      if (prior.isTrained() && prior.getStrategy().getInputWidth() == matrix.getWidth()) {
        logger.warn("Keeping previously trained {} after training failure", strategy.getName());
        slots.add(prior);
      } else {
        slots.add(StrategySlot.uninitialized(kind));
      }
    }
    if (!roster.isEmpty() && trained == 0) {
      throw new TrainingFailedException("All " + roster.size() + " strategies failed to train");
    }
    return new ModelGeneration(
        sequence.incrementAndGet(), transform, slots, System.currentTimeMillis());
  }
}
