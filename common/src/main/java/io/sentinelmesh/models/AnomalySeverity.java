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
import com.fasterxml.jackson.annotation.JsonValue;
import io.sentinelmesh.utils.EnumStringifier;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Severity of a detected anomaly.
 *
 * <p>Each entry carries the inclusive lower bound of the combined score, i.e. the mean of
 * confidence and vote ratio, from which the severity applies. Entries are declared from the
 * highest bound downwards.
 */
@Getter
@RequiredArgsConstructor
public enum AnomalySeverity {
  CRITICAL(0.9),
  HIGH(0.7),
  MEDIUM(0.5),
  LOW(Double.NEGATIVE_INFINITY);

  private final double lowerBound;

  private static final EnumStringifier<AnomalySeverity> stringifier =
      new EnumStringifier<>(values());

  /**
   * Resolves the severity of an anomaly.
   *
   * @param confidence Consensus confidence in [0, 1]
   * @param voteRatio Consensus vote ratio in [0, 1]
   * @return The severity
   */
  public static AnomalySeverity of(double confidence, double voteRatio) {
    return ofCombinedScore((confidence + voteRatio) / 2);
  }

  /**
   * Resolves the severity for a combined score.
   *
   * @param combinedScore The mean of confidence and vote ratio
   * @return The severity
   */
  public static AnomalySeverity ofCombinedScore(double combinedScore) {
    for (AnomalySeverity severity : values()) {
      if (combinedScore >= severity.lowerBound) {
        return severity;
      }
    }
    // NaN
    return LOW;
  }

  @JsonCreator
  public static AnomalySeverity forValue(String value) {
    return stringifier.destringify(value);
  }

  @JsonValue
  public String stringify() {
    return stringifier.stringify(this);
  }
}
