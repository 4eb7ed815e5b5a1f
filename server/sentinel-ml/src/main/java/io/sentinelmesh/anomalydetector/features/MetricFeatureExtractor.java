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

import io.sentinelmesh.models.MetricSample;
import java.util.List;

/** Converts a metric batch into a feature table whose row i describes sample i. */
public interface MetricFeatureExtractor {

  /**
   * Extracts the features of a batch.
   *
   * @param samples The batch, never null
   * @return Feature table with one row per sample
   */
  FeatureTable extract(List<MetricSample> samples);
}
