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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;

import com.fasterxml.jackson.core.type.TypeReference;
import io.sentinelmesh.utils.SentinelObjectMapperProvider;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class AnomalyResultTest {

  private static AnomalyResult makeResult() {
    final Map<String, Object> metadata = new HashMap<>();
    metadata.put(AnomalyResult.METADATA_VOTE_RATIO, 0.75);
    metadata.put(AnomalyResult.METADATA_ALGORITHMS, List.of("isolationForest", "statistical"));
    return new AnomalyResult(
        "anomaly_20250101_000000_0123456789abcdef_1",
        AnomalyType.LATENCY,
        AnomalySeverity.HIGH,
        "Unusual latency pattern detected in request_latency for service api",
        "api",
        "default",
        0.8,
        0.8,
        Map.of("value", 250.0),
        Map.of("service", "api"),
        1735689600000L,
        metadata);
  }

  @Test
  public void testJsonPropertyNames() throws Exception {
    final var mapper = SentinelObjectMapperProvider.get();
    final Map<String, Object> json =
        mapper.readValue(
            mapper.writeValueAsString(makeResult()), new TypeReference<Map<String, Object>>() {});

    assertThat(json, hasKey("detected_at"));
    assertThat((String) json.get("type"), is("latency"));
    assertThat((String) json.get("severity"), is("high"));
    assertThat((String) json.get("namespace"), is("default"));
    @SuppressWarnings("unchecked")
    final Map<String, Object> metadata = (Map<String, Object>) json.get("metadata");
    assertThat((Double) metadata.get("vote_ratio"), is(0.75));
  }

  @Test
  public void testJsonRoundTrip() throws Exception {
    final var mapper = SentinelObjectMapperProvider.get();
    final AnomalyResult original = makeResult();
    final AnomalyResult decoded =
        mapper.readValue(mapper.writeValueAsString(original), AnomalyResult.class);
    assertThat(decoded, is(original));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testMapsAreFrozen() {
    makeResult().getMetadata().put("extra", 1);
  }
}
