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
package io.sentinelmesh.anomalydetector.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/** Numeric features of one sample, as extracted before scaling. */
@Getter
@ToString
public class FeatureVector {
  private final int index;

  /** Feature values by column name; null for missing values. */
  private final Map<String, Double> values;

  public FeatureVector(int index, Map<String, Double> values) {
    this.index = index;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns the features with missing or NaN values coerced to 0.0, as the strategies saw them.
   *
   * @return Imputed features in column order
   */
  public Map<String, Double> toImputedMap() {
    final var imputed = new LinkedHashMap<String, Double>();
    values.forEach((name, value) -> imputed.put(name, FeatureTable.imputed(value)));
    return imputed;
  }
}
