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

import java.util.HashMap;
import java.util.Map;

/** The detection strategies the ensemble knows how to build. */
public enum StrategyKind {
  ISOLATION_FOREST("isolationForest"),
  RECONSTRUCTION_ERROR("reconstructionError"),
  LOCAL_OUTLIER_FACTOR("localOutlierFactor");

  private static final Map<String, StrategyKind> byName = new HashMap<>();

  static {
    for (StrategyKind kind : values()) {
      byName.put(kind.strategyName.toLowerCase(), kind);
    }
  }

  private final String strategyName;

  StrategyKind(String strategyName) {
    this.strategyName = strategyName;
  }

  /** Name used in configuration and in anomaly metadata. */
  public String getStrategyName() {
    return strategyName;
  }

  /**
   * Resolves a strategy kind by its configuration name, case-insensitively.
   *
   * @param name The name
   * @return The kind
   * @throws IllegalArgumentException when the name is unknown
   */
  public static StrategyKind forValue(String name) {
    final var kind = byName.get(name.trim().toLowerCase());
    if (kind == null) {
      throw new IllegalArgumentException("Unknown detection strategy: " + name);
    }
    return kind;
  }
}
