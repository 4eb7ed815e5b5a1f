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
import static org.hamcrest.Matchers.is;

import org.junit.Assert;
import org.junit.Test;

public class AnomalySeverityTest {

  @Test
  public void testThresholdsAreInclusiveLowerBounds() {
    assertThat(AnomalySeverity.ofCombinedScore(1.0), is(AnomalySeverity.CRITICAL));
    assertThat(AnomalySeverity.ofCombinedScore(0.9), is(AnomalySeverity.CRITICAL));
    assertThat(AnomalySeverity.ofCombinedScore(0.8999), is(AnomalySeverity.HIGH));
    assertThat(AnomalySeverity.ofCombinedScore(0.7), is(AnomalySeverity.HIGH));
    assertThat(AnomalySeverity.ofCombinedScore(0.6999), is(AnomalySeverity.MEDIUM));
    assertThat(AnomalySeverity.ofCombinedScore(0.5), is(AnomalySeverity.MEDIUM));
    assertThat(AnomalySeverity.ofCombinedScore(0.4999), is(AnomalySeverity.LOW));
    assertThat(AnomalySeverity.ofCombinedScore(0.0), is(AnomalySeverity.LOW));
    assertThat(AnomalySeverity.ofCombinedScore(Double.NaN), is(AnomalySeverity.LOW));
  }

  @Test
  public void testCombinedScoreIsMeanOfConfidenceAndVoteRatio() {
    assertThat(AnomalySeverity.of(1.0, 0.8), is(AnomalySeverity.CRITICAL));
    assertThat(AnomalySeverity.of(0.9, 0.5), is(AnomalySeverity.HIGH));
    assertThat(AnomalySeverity.of(0.5, 0.5), is(AnomalySeverity.MEDIUM));
    assertThat(AnomalySeverity.of(0.3, 0.5), is(AnomalySeverity.LOW));
  }

  @Test
  public void testSeverityIsMonotonic() {
    AnomalySeverity previous = AnomalySeverity.LOW;
    for (int i = 0; i <= 1000; ++i) {
      final AnomalySeverity current = AnomalySeverity.ofCombinedScore(i / 1000.0);
      Assert.assertTrue(
          "severity decreased at " + i, current.ordinal() <= previous.ordinal());
      previous = current;
    }
  }

  @Test
  public void testWireNames() {
    assertThat(AnomalySeverity.CRITICAL.stringify(), is("critical"));
    assertThat(AnomalySeverity.forValue("High"), is(AnomalySeverity.HIGH));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownWireName() {
    AnomalySeverity.forValue("urgent");
  }
}
