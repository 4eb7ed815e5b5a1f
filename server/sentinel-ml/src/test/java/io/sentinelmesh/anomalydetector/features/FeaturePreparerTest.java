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
package io.sentinelmesh.anomalydetector.features;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.sameInstance;

import io.sentinelmesh.anomalydetector.diagnostics.DetectionDiagnostics;
import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.errors.AnomalyDetectionError;
import io.sentinelmesh.errors.exception.FeatureTransformException;
import java.util.Random;
import org.junit.Before;
import org.junit.Test;

public class FeaturePreparerTest {
  private DetectionDiagnostics diagnostics;
  private FeaturePreparer preparer;

  @Before
  public void setUp() {
    diagnostics = new DetectionDiagnostics(10);
    preparer = new FeaturePreparer(diagnostics);
  }

  private static FeatureTable values(Double... values) {
    return FeatureTable.builder(values.length)
        .addNumeric("value", values)
        .addString("name", new String[values.length])
        .build();
  }

  @Test
  public void testNothingToAnalyzeWithoutNumericColumns() {
    final var table = FeatureTable.builder(2).addString("name", new String[] {"a", "b"}).build();
    assertThat(preparer.prepare(table, null).isPresent(), is(false));
    assertThat(preparer.prepare(FeatureTable.empty(), null).isPresent(), is(false));
    assertThat(diagnostics.totalFailureCount(), is(0L));
  }

  @Test
  public void testFitsOnFirstUseAndReusesAfterwards() {
    final var table = values(1.0, 3.0, null);
    final PreparedFeatures first = preparer.prepare(table, null).get();
    assertThat(first.isNewlyFitted(), is(true));

    final PreparedFeatures second = preparer.prepare(table, first.getTransform()).get();
    assertThat(second.isNewlyFitted(), is(false));
    assertThat(second.getTransform(), sameInstance(first.getTransform()));
    assertThat(second.getMatrix(), is(first.getMatrix()));
  }

  @Test
  public void testFittedStatisticsAreFrozen() {
    final FeatureTransform transform =
        preparer.prepare(values(1.0, 3.0), null).get().getTransform();
    final FeatureMatrix matrix = preparer.prepare(values(5.0), transform).get().getMatrix();
    assertThat(matrix.get(0, 0), closeTo(3.0, 1e-12));
  }

  @Test
  public void testReducesDimensionalityAboveTenColumns() throws Exception {
    final int rows = 40;
    final var random = new Random(3);
    final var builder = FeatureTable.builder(rows);
    final Double[] base = new Double[rows];
    for (int i = 0; i < rows; ++i) {
      base[i] = random.nextGaussian();
    }
    for (int col = 0; col < 12; ++col) {
      final Double[] column = new Double[rows];
      for (int i = 0; i < rows; ++i) {
        column[i] = base[i] * (col + 1) + random.nextGaussian() * 0.01;
      }
      builder.addNumeric("f" + col, column);
    }
    final FeatureTransform transform = preparer.fit(builder.build());
    assertThat(transform.getReducer().isPresent(), is(true));
    assertThat(transform.getOutputWidth(), lessThan(12));
  }

  @Test
  public void testNoReductionUpToTenColumns() throws Exception {
    final FeatureTransform transform = preparer.fit(values(1.0, 2.0, 4.0));
    assertThat(transform.getReducer().isPresent(), is(false));
    assertThat(transform.getOutputWidth(), is(1));
  }

  @Test
  public void testSchemaMismatchSkipsBatch() {
    final FeatureTransform transform =
        preparer.prepare(values(1.0, 3.0), null).get().getTransform();
    final var other = FeatureTable.builder(1).addNumeric("latency", new Double[] {1.0}).build();

    assertThat(preparer.prepare(other, transform).isPresent(), is(false));
    assertThat(diagnostics.failureCount(DiagnosticStage.FEATURE_PREPARATION), is(1L));
    assertThat(
        diagnostics.recentEvents().get(0).getErrorCode(),
        is(AnomalyDetectionError.FEATURE_SCHEMA_MISMATCH.getErrorCode()));
  }

  @Test(expected = FeatureTransformException.class)
  public void testFitWithoutNumericColumns() throws Exception {
    preparer.fit(FeatureTable.builder(1).addString("name", new String[] {"a"}).build());
  }
}
