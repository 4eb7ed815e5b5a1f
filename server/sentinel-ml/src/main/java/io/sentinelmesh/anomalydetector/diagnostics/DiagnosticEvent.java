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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** A failure that was absorbed by the detector instead of being raised to its caller. */
@Getter
@ToString
@AllArgsConstructor
public class DiagnosticEvent {
  private final DiagnosticStage stage;
  private final String errorCode;

  /** Name of the detection strategy involved, null when the failure is not strategy specific. */
  private final String strategy;

  private final String message;

  /** Class name of the underlying exception, null when there is none. */
  private final String exceptionClass;

  private final long timestamp;
}
