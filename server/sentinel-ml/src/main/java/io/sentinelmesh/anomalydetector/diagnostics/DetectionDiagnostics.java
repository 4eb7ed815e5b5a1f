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
package io.sentinelmesh.anomalydetector.diagnostics;

import io.sentinelmesh.errors.SentinelError;
import io.sentinelmesh.errors.exception.AnomalyDetectionException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the failures the detector recovers from.
 *
 * <p>Every fail-open path of the engine reports here so that persistent degradation is visible
 * to operators through logs, per-stage counters and a bounded history of recent events, while
 * the callers of the engine only observe empty results.
 */
public class DetectionDiagnostics {
  private static final Logger logger = LoggerFactory.getLogger(DetectionDiagnostics.class);

  private final int historyLength;
  private final Map<DiagnosticStage, AtomicLong> failureCounts;
  private final Deque<DiagnosticEvent> history;

  public DetectionDiagnostics(int historyLength) {
    if (historyLength <= 0) {
      throw new IllegalArgumentException("historyLength should be greater than 0");
    }
    this.historyLength = historyLength;
    this.failureCounts = new EnumMap<>(DiagnosticStage.class);
    for (DiagnosticStage stage : DiagnosticStage.values()) {
      failureCounts.put(stage, new AtomicLong());
    }
    this.history = new ArrayDeque<>(historyLength);
  }

  /**
   * Records a failure raised as a detection exception.
   *
   * @param stage Stage at which the failure was absorbed
   * @param strategy Strategy name, null if not strategy specific
   * @param e The exception
   * @return The recorded event
   */
  public DiagnosticEvent record(
      DiagnosticStage stage, String strategy, AnomalyDetectionException e) {
    return record(stage, e.getInfo(), strategy, e.getMessage(), e);
  }

  /**
   * Records a failure.
   *
   * @param stage Stage at which the failure was absorbed
   * @param error Error classification
   * @param strategy Strategy name, null if not strategy specific
   * @param message Description of the failure
   * @param cause Underlying exception, may be null
   * @return The recorded event
   */
  public DiagnosticEvent record(
      DiagnosticStage stage,
      SentinelError error,
      String strategy,
      String message,
      Throwable cause) {
    final var event =
        new DiagnosticEvent(
            stage,
            error.getErrorCode(),
            strategy,
            message,
            cause != null ? cause.getClass().getName() : null,
            System.currentTimeMillis());
    failureCounts.get(stage).incrementAndGet();
    synchronized (history) {
      if (history.size() >= historyLength) {
        history.pollFirst();
      }
      history.addLast(event);
    }
    if (cause == null || cause instanceof AnomalyDetectionException) {
      logger.warn(
          "Anomaly detection degraded; stage={}, code={}, strategy={}, message={}",
          stage,
          event.getErrorCode(),
          strategy,
          message);
    } else {
      logger.error(
          "Anomaly detection degraded; stage={}, code={}, strategy={}, message={}",
          stage,
          event.getErrorCode(),
          strategy,
          message,
          cause);
    }
    return event;
  }

  public long failureCount(DiagnosticStage stage) {
    return failureCounts.get(stage).get();
  }

  public long totalFailureCount() {
    long total = 0;
    for (AtomicLong count : failureCounts.values()) {
      total += count.get();
    }
    return total;
  }

  /**
   * Returns the most recent events, oldest first.
   *
   * @return A snapshot of the retained events
   */
  public List<DiagnosticEvent> recentEvents() {
    synchronized (history) {
      return new ArrayList<>(history);
    }
  }
}
