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
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A detected anomaly event handed over to the alerting layer.
 *
 * <p>Instances are immutable once created.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@ToString
@EqualsAndHashCode
public class AnomalyResult {
  public static final String METADATA_VOTE_RATIO = "vote_ratio";
  public static final String METADATA_ALGORITHMS = "algorithms";
  public static final String METADATA_FINGERPRINT = "fingerprint";
  public static final String METADATA_ORIGINAL_METRIC = "original_metric";

  @JsonProperty("id")
  private final String id;

  @JsonProperty("type")
  private final AnomalyType type;

  @JsonProperty("severity")
  private final AnomalySeverity severity;

  @JsonProperty("description")
  private final String description;

  @JsonProperty("service")
  private final String service;

  @JsonProperty("namespace")
  private final String namespace;

  /** Consensus confidence. */
  @JsonProperty("score")
  private final double score;

  /** Configured decision threshold, carried for audit. */
  @JsonProperty("threshold")
  private final double threshold;

  @JsonProperty("features")
  private final Map<String, Double> features;

  @JsonProperty("labels")
  private final Map<String, String> labels;

  /** Detection time in milliseconds since epoch. */
  @JsonProperty("detected_at")
  private final long detectedAt;

  @JsonProperty("metadata")
  private final Map<String, Object> metadata;

  @JsonCreator
  public AnomalyResult(
      @JsonProperty("id") String id,
      @JsonProperty("type") AnomalyType type,
      @JsonProperty("severity") AnomalySeverity severity,
      @JsonProperty("description") String description,
      @JsonProperty("service") String service,
      @JsonProperty("namespace") String namespace,
      @JsonProperty("score") double score,
      @JsonProperty("threshold") double threshold,
      @JsonProperty("features") Map<String, Double> features,
      @JsonProperty("labels") Map<String, String> labels,
      @JsonProperty("detected_at") long detectedAt,
      @JsonProperty("metadata") Map<String, Object> metadata) {
    this.id = id;
    this.type = type;
    this.severity = severity;
    this.description = description;
    this.service = service;
    this.namespace = namespace;
    this.score = score;
    this.threshold = threshold;
    this.features = freeze(features);
    this.labels = freeze(labels);
    this.detectedAt = detectedAt;
    this.metadata = freeze(metadata);
  }

  private static <V> Map<String, V> freeze(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
