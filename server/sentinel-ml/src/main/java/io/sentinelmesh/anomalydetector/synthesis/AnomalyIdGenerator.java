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
import com.google.common.hash.Hashing;
import io.sentinelmesh.models.MetricSample;
import io.sentinelmesh.utils.SentinelObjectMapperProvider;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates anomaly identifiers.
 *
 * <p>An identifier is {@code anomaly_<UTC time>_<fingerprint>_<sequence>}. The fingerprint is
 * derived from the content of the original metric, so repeated detections of the same event
 * share it; the sequence keeps identifiers unique within the process.
 */
public class AnomalyIdGenerator {
  static final String PREFIX = "anomaly_";
  static final int FINGERPRINT_LENGTH = 16;

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final AtomicLong sequence = new AtomicLong();

  /**
   * Content fingerprint of a metric: leading hex digits of the SHA-256 of its canonical JSON.
   *
   * @param sample The metric
   * @return Fingerprint of {@value #FINGERPRINT_LENGTH} hex digits
   * @throws JsonProcessingException when the metric cannot be serialized
   */
  public String fingerprint(MetricSample sample) throws JsonProcessingException {
    final byte[] canonical = SentinelObjectMapperProvider.get().writeValueAsBytes(sample);
    return Hashing.sha256()
        .hashBytes(canonical)
        .toString()
        .substring(0, FINGERPRINT_LENGTH);
  }

  /**
   * Builds the identifier of a detection.
   *
   * @param fingerprint Fingerprint of the original metric
   * @param detectedAt Detection time in milliseconds since epoch
   * @return A new identifier
   */
  public String generate(String fingerprint, long detectedAt) {
    return PREFIX
        + TIME_FORMAT.format(Instant.ofEpochMilli(detectedAt))
        + "_"
        + fingerprint
        + "_"
        + sequence.incrementAndGet();
  }
}
