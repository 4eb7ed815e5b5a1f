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
package io.sentinelmesh.anomalydetector.ensemble;

import io.sentinelmesh.anomalydetector.strategies.DetectionStrategy;
import io.sentinelmesh.anomalydetector.strategies.StrategyKind;
import lombok.Getter;

/** Classification and scores of one strategy for a whole batch. */
public class StrategyVerdicts {
  @Getter private final String strategyName;
  private final int[] labels;
  private final double[] scores;

  public StrategyVerdicts(String strategyName, int[] labels, double[] scores) {
    if (labels.length != scores.length) {
      throw new IllegalArgumentException(
          String.format(
              "%s produced %d labels and %d scores", strategyName, labels.length, scores.length));
    }
    this.strategyName = strategyName;
    this.labels = labels.clone();
    this.scores = scores.clone();
  }

  public StrategyVerdicts(StrategyKind kind, int[] labels, double[] scores) {
    this(kind.getStrategyName(), labels, scores);
  }

  public int size() {
    return labels.length;
  }

  public Verdict get(int index) {
    return new Verdict(labels[index] == DetectionStrategy.ANOMALOUS, scores[index]);
  }
}
