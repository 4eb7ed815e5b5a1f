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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Health status of the anomaly detector as reported to probes. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@ToString
@EqualsAndHashCode
public class DetectorHealth {
  @JsonProperty("healthy")
  private final boolean healthy;

  /** Time of the last successful training in milliseconds since epoch, null if never trained. */
  @JsonProperty("last_training")
  private final Long lastTraining;

  @JsonProperty("algorithms_loaded")
  private final int algorithmsLoaded;

  @JsonProperty("total_algorithms")
  private final int totalAlgorithms;

  @JsonCreator
  public DetectorHealth(
      @JsonProperty("healthy") boolean healthy,
      @JsonProperty("last_training") Long lastTraining,
      @JsonProperty("algorithms_loaded") int algorithmsLoaded,
      @JsonProperty("total_algorithms") int totalAlgorithms) {
    this.healthy = healthy;
    this.lastTraining = lastTraining;
    this.algorithmsLoaded = algorithmsLoaded;
    this.totalAlgorithms = totalAlgorithms;
  }
}
