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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.sentinelmesh.anomalydetector.ensemble.Consensus;
import io.sentinelmesh.anomalydetector.features.FeatureVector;
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.AnomalyDetectionException;
import io.sentinelmesh.models.AnomalyResult;
import io.sentinelmesh.models.AnomalySeverity;
import io.sentinelmesh.models.AnomalyType;
import io.sentinelmesh.models.MetricSample;
import io.sentinelmesh.utils.SentinelObjectMapperProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Turns an anomalous consensus and its originating metric into an anomaly record. */
public class ResultSynthesizer {
  static final String UNKNOWN_SERVICE = "unknown";
  static final String DEFAULT_NAMESPACE = "default";
  static final String UNKNOWN_METRIC = "unknown";

  private static final TypeReference<Map<String, Object>> METRIC_MAP_TYPE =
      new TypeReference<>() {};

  private final double threshold;
  private final AnomalyTypeClassifier typeClassifier;
  private final AnomalyIdGenerator idGenerator;

  public ResultSynthesizer(
      double threshold, AnomalyTypeClassifier typeClassifier, AnomalyIdGenerator idGenerator) {
    this.threshold = threshold;
    this.typeClassifier = typeClassifier;
    this.idGenerator = idGenerator;
  }

  /**
   * Builds the anomaly record.
   *
   * @param sample The originating metric
   * @param features Numeric features of the sample as extracted
   * @param consensus The consensus of the sample
   * @param algorithms Names of the voters that took part
   * @param detectedAt Detection time in milliseconds since epoch
   * @return The anomaly record
   * @throws AnomalyDetectionException when the record cannot be built
   */
  public AnomalyResult synthesize(
      MetricSample sample,
      FeatureVector features,
      Consensus consensus,
      List<String> algorithms,
      long detectedAt)
      throws AnomalyDetectionException {
    final Map<String, Object> originalMetric;
    final String fingerprint;
    try {
      originalMetric = SentinelObjectMapperProvider.get().convertValue(sample, METRIC_MAP_TYPE);
      fingerprint = idGenerator.fingerprint(sample);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new AnomalyDetectionException(
          AnomalyDetectionError.SYNTHESIS_FAILED,
          "metric " + sample.getName() + " could not be serialized",
          e);
    }

    final AnomalyType type = typeClassifier.classify(sample.getName());
    final AnomalySeverity severity =
        AnomalySeverity.of(consensus.getConfidence(), consensus.getVoteRatio());

    final var metadata = new LinkedHashMap<String, Object>();
    metadata.put(AnomalyResult.METADATA_VOTE_RATIO, consensus.getVoteRatio());
    metadata.put(AnomalyResult.METADATA_ALGORITHMS, new ArrayList<>(algorithms));
    metadata.put(AnomalyResult.METADATA_FINGERPRINT, fingerprint);
    metadata.put(AnomalyResult.METADATA_ORIGINAL_METRIC, originalMetric);

    return new AnomalyResult(
        idGenerator.generate(fingerprint, detectedAt),
        type,
        severity,
        describe(sample, type),
        sample.getLabel(MetricSample.LABEL_SERVICE, UNKNOWN_SERVICE),
        sample.getLabel(MetricSample.LABEL_NAMESPACE, DEFAULT_NAMESPACE),
        consensus.getConfidence(),
        threshold,
        features.toImputedMap(),
        sample.getLabels(),
        detectedAt,
        metadata);
  }

  static String describe(MetricSample sample, AnomalyType type) {
    final String name = sample.getName() != null ? sample.getName() : UNKNOWN_METRIC;
    final String service = sample.getLabel(MetricSample.LABEL_SERVICE, UNKNOWN_SERVICE);
    switch (type) {
      case RESOURCE_USAGE:
        final Object value = sample.getValue() != null ? sample.getValue() : 0;
        return String.format(
            "Unusual resource usage detected in %s for service %s (value: %s)",
            name, service, value);
      case TRAFFIC_PATTERN:
        return String.format(
            "Abnormal traffic pattern detected in %s for service %s", name, service);
      case ERROR_RATE:
        return String.format("Elevated error rate detected in %s for service %s", name, service);
      case LATENCY:
        return String.format(
            "Unusual latency pattern detected in %s for service %s", name, service);
      case SECURITY:
        return String.format("Security anomaly detected in %s for service %s", name, service);
      case PERFORMANCE:
      default:
        return String.format("Performance anomaly detected in %s for service %s", name, service);
    }
  }
}
