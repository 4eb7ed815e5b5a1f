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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Majority voting over the active strategies and the statistical detector.
 *
 * <p>Every active strategy is a voter: it votes when it classifies the sample as anomalous and
 * always adds the magnitude of its score to the confidence pool. The statistical detector is
 * always one more voter, whether it flags the sample or not, and adds {@link
 * #STATISTICAL_CONFIDENCE} to the pool when it does. A sample is anomalous when at least {@link
 * #VOTE_THRESHOLD} of the voters vote for it.
 */
public class EnsembleVoter {
  public static final double VOTE_THRESHOLD = 0.5;
  public static final double DEFAULT_CONFIDENCE = 0.5;
  public static final double STATISTICAL_CONFIDENCE = 1.0;

  /**
   * Computes the consensus of every sample.
   *
   * @param rowCount Number of samples in the batch
   * @param verdicts Verdicts of the active strategies, one entry per sample each
   * @param statisticalFlags Rows flagged by the statistical detector
   * @return One consensus per sample, in batch order
   */
  public List<Consensus> vote(
      int rowCount, List<StrategyVerdicts> verdicts, Set<Integer> statisticalFlags) {
    for (StrategyVerdicts strategyVerdicts : verdicts) {
      if (strategyVerdicts.size() != rowCount) {
        throw new IllegalArgumentException(
            String.format(
                "%s produced %d verdicts for %d samples",
                strategyVerdicts.getStrategyName(), strategyVerdicts.size(), rowCount));
      }
    }
    final var result = new ArrayList<Consensus>(rowCount);
    for (int i = 0; i < rowCount; ++i) {
      int votes = 0;
      int totalVoters = 0;
      double confidenceSum = 0;
      int confidenceCount = 0;
      for (StrategyVerdicts strategyVerdicts : verdicts) {
        final Verdict verdict = strategyVerdicts.get(i);
        if (verdict.isAnomalous()) {
          ++votes;
        }
        confidenceSum += strength(verdict.getScore());
        ++confidenceCount;
        ++totalVoters;
      }
      if (statisticalFlags.contains(i)) {
        ++votes;
        confidenceSum += STATISTICAL_CONFIDENCE;
        ++confidenceCount;
      }
      ++totalVoters;

      final double voteRatio = (double) votes / totalVoters;
      final double confidence =
          confidenceCount > 0 ? confidenceSum / confidenceCount : DEFAULT_CONFIDENCE;
      result.add(
          new Consensus(i, votes, totalVoters, voteRatio, confidence, voteRatio >= VOTE_THRESHOLD));
    }
    return result;
  }

  /**
   * Returns the anomalous samples only.
   *
   * @see #vote(int, List, Set)
   */
  public List<Consensus> anomalous(
      int rowCount, List<StrategyVerdicts> verdicts, Set<Integer> statisticalFlags) {
    final var anomalous = new ArrayList<Consensus>();
    for (Consensus consensus : vote(rowCount, verdicts, statisticalFlags)) {
      if (consensus.isAnomalous()) {
        anomalous.add(consensus);
      }
    }
    return anomalous;
  }

  /** Score magnitude bounded to [0, 1]; NaN counts as 0. */
  static double strength(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.min(Math.abs(score), 1.0);
  }
}
