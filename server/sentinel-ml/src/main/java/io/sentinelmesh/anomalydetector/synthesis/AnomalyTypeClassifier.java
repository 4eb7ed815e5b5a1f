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
package io.sentinelmesh.anomalydetector.synthesis;

import io.sentinelmesh.models.AnomalyType;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Attributes an anomaly to a kind of behavior from the metric name alone.
 *
 * <p>Keywords are matched case-insensitively as substrings; the first matching rule wins.
 */
public class AnomalyTypeClassifier {
  private static final List<Map.Entry<String[], AnomalyType>> rules =
      List.of(
          Map.entry(new String[] {"cpu", "memory"}, AnomalyType.RESOURCE_USAGE),
          Map.entry(new String[] {"network"}, AnomalyType.TRAFFIC_PATTERN),
          Map.entry(new String[] {"error", "failed"}, AnomalyType.ERROR_RATE),
          Map.entry(new String[] {"latency", "duration"}, AnomalyType.LATENCY),
          Map.entry(new String[] {"security", "auth"}, AnomalyType.SECURITY));

  public AnomalyType classify(String metricName) {
    if (metricName == null) {
      return AnomalyType.PERFORMANCE;
    }
    for (Map.Entry<String[], AnomalyType> rule : rules) {
      if (StringUtils.containsAnyIgnoreCase(metricName, rule.getKey())) {
        return rule.getValue();
      }
    }
    return AnomalyType.PERFORMANCE;
  }
}
