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
package io.sentinelmesh.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One observation of an infrastructure metric.
 *
 * <p>Instances are immutable. Labels are kept sorted by key so that two samples carrying the same
 * content serialize identically.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@ToString
@EqualsAndHashCode
public class MetricSample {
  public static final String LABEL_SERVICE = "service";
  public static final String LABEL_NAMESPACE = "namespace";

  private final String name;

  /** Observed value; null when the collector could not produce one. */
  private final Double value;

  private final Map<String, String> labels;

  /** Observation time in milliseconds since epoch. */
  private final Long timestamp;

  @JsonCreator
  public MetricSample(
      @JsonProperty("name") String name,
      @JsonProperty("value") Double value,
      @JsonProperty("labels") Map<String, String> labels,
      @JsonProperty("timestamp") Long timestamp) {
    this.name = name;
    this.value = value;
    this.labels =
        labels != null
            ? Collections.unmodifiableMap(new TreeMap<>(labels))
            : Collections.emptyMap();
    this.timestamp = timestamp;
  }

  /**
   * Returns a label value.
   *
   * @param key Label key
   * @param defaultValue Value returned when the label is missing
   * @return The label value or the default
   */
  public String getLabel(String key, String defaultValue) {
    final String label = labels.get(key);
    return label != null ? label : defaultValue;
  }
}
