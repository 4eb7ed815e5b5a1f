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
package io.sentinelmesh.anomalydetector.ensemble;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** Aggregated decision of the ensemble for one sample. */
@Getter
@ToString
@AllArgsConstructor
public class Consensus {
  /** Row of the sample in its batch. */
  private final int index;

  private final int votes;
  private final int totalVoters;

  /** votes / totalVoters, in [0, 1]. */
  private final double voteRatio;

  /** Mean strength reported by the voters, in [0, 1]. */
  private final double confidence;

  private final boolean anomalous;
}
