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

import io.sentinelmesh.anomalydetector.features.FeatureTransform;
import io.sentinelmesh.anomalydetector.strategies.DetectionStrategy;
import io.sentinelmesh.anomalydetector.strategies.StrategyKind;
import io.sentinelmesh.anomalydetector.strategies.StrategySlot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * One immutable, fully fitted snapshot of the feature transform and the strategies.
 *
 * <p>A detection binds to one generation for the whole batch. A retrain publishes a new
 * generation and never modifies a published one.
 */
@Getter
@ToString
public final class ModelGeneration {
  private final long sequence;

  /** Fitted feature transform, null until one has been fitted. */
  private final FeatureTransform transform;

  /** One slot per configured strategy, in configuration order. */
  private final List<StrategySlot> slots;

  /** Time of the training that produced this generation, null if never trained. */
  private final Long trainedAt;

  ModelGeneration(
      long sequence, FeatureTransform transform, List<StrategySlot> slots, Long trainedAt) {
    this.sequence = sequence;
    this.transform = transform;
    this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    this.trainedAt = trainedAt;
  }

  /**
   * The generation before any training.
   *
   * @param roster Configured strategies
   * @return A generation with no transform and every slot uninitialized
   */
  public static ModelGeneration initial(List<StrategyKind> roster) {
    final var slots = new ArrayList<StrategySlot>(roster.size());
    for (StrategyKind kind : roster) {
      slots.add(StrategySlot.uninitialized(kind));
    }
    return new ModelGeneration(0, null, slots, null);
  }

  ModelGeneration withTransform(long sequence, FeatureTransform transform) {
    return new ModelGeneration(sequence, transform, slots, trainedAt);
  }

  public TrainingState getState() {
    return trainedAt != null ? TrainingState.TRAINED : TrainingState.UNTRAINED;
  }

  public boolean isTrained() {
    return trainedAt != null;
  }

  /** The trained strategies, in configuration order. */
  public List<DetectionStrategy> activeStrategies() {
    final var active = new ArrayList<DetectionStrategy>();
    for (StrategySlot slot : slots) {
      if (slot.isTrained()) {
        active.add(slot.getStrategy());
      }
    }
    return active;
  }

  /**
   * Returns the slot of a strategy.
   *
   * @param kind The strategy kind
   * @return The slot, or an uninitialized slot when the strategy is not configured
   */
  public StrategySlot getSlot(StrategyKind kind) {
    for (StrategySlot slot : slots) {
      if (slot.getKind() == kind) {
        return slot;
      }
    }
    return StrategySlot.uninitialized(kind);
  }
}
