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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.models.AnomalyType;
import org.junit.Test;

public class AnomalyTypeClassifierTest {
  private final AnomalyTypeClassifier classifier = new AnomalyTypeClassifier();

  @Test
  public void testKeywords() {
    assertThat(classifier.classify("container_cpu_usage"), is(AnomalyType.RESOURCE_USAGE));
    assertThat(classifier.classify("Memory_RSS"), is(AnomalyType.RESOURCE_USAGE));
    assertThat(classifier.classify("network_bytes_in"), is(AnomalyType.TRAFFIC_PATTERN));
    assertThat(classifier.classify("http_errors_total"), is(AnomalyType.ERROR_RATE));
    assertThat(classifier.classify("jobs_failed"), is(AnomalyType.ERROR_RATE));
    assertThat(classifier.classify("request_duration_p99"), is(AnomalyType.LATENCY));
    assertThat(classifier.classify("security_events"), is(AnomalyType.SECURITY));
    assertThat(classifier.classify("oauth_attempts"), is(AnomalyType.SECURITY));
  }

  @Test
  public void testFirstMatchingRuleWins() {
    assertThat(classifier.classify("cpu_network_error"), is(AnomalyType.RESOURCE_USAGE));
    assertThat(classifier.classify("network_error_rate"), is(AnomalyType.TRAFFIC_PATTERN));
    assertThat(classifier.classify("authentication_latency"), is(AnomalyType.LATENCY));
  }

  @Test
  public void testFallback() {
    assertThat(classifier.classify("queue_depth"), is(AnomalyType.PERFORMANCE));
    assertThat(classifier.classify(""), is(AnomalyType.PERFORMANCE));
    assertThat(classifier.classify(null), is(AnomalyType.PERFORMANCE));
  }
}
