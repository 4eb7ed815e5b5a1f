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
package io.sentinelmesh.anomalydetector.strategies;

import lombok.Getter;
import lombok.ToString;

/**
 * The place of one configured strategy in a model generation.
 *
 * <p>An uninitialized slot carries no strategy; the voter skips it.
 */
@Getter
@ToString
public final class StrategySlot {
  private final StrategyKind kind;
  private final StrategyState state;
  private final DetectionStrategy strategy;

  private StrategySlot(StrategyKind kind, StrategyState state, DetectionStrategy strategy) {
    this.kind = kind;
    this.state = state;
    this.strategy = strategy;
  }

  public static StrategySlot uninitialized(StrategyKind kind) {
    return new StrategySlot(kind, StrategyState.UNINITIALIZED, null);
  }

  public static StrategySlot trained(DetectionStrategy strategy) {
    if (!strategy.isTrained()) {
      throw new IllegalArgumentException(strategy.getName() + " has not been trained");
    }
    return new StrategySlot(strategy.getKind(), StrategyState.TRAINED, strategy);
  }

  public boolean isTrained() {
    return state == StrategyState.TRAINED;
  }
}
