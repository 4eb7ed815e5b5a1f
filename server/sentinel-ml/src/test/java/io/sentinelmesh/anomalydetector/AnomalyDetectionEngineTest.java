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
package io.sentinelmesh.anomalydetector;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import io.sentinelmesh.anomalydetector.diagnostics.DiagnosticStage;
import io.sentinelmesh.anomalydetector.factories.AnomalyDetectionEngineFactory;
import io.sentinelmesh.anomalydetector.features.FeatureTable;
import io.sentinelmesh.common.AnomalyDetectorConfig;
import io.sentinelmesh.common.SentinelConfigBase;
import io.sentinelmesh.models.AnomalyResult;
import io.sentinelmesh.models.AnomalyType;
import io.sentinelmesh.models.DetectorHealth;
import io.sentinelmesh.models.MetricSample;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class AnomalyDetectionEngineTest {
  private Properties properties;
  private AnomalyDetectionEngine engine;

  @Before
  public void setUp() {
    properties = new Properties();
    SentinelConfigBase.setProperties(properties);
    engine = AnomalyDetectionEngineFactory.getAnomalyDetectionEngine();
  }

  @After
  public void tearDown() {
    SentinelConfigBase.setProperties(System.getProperties());
  }

  private static AnomalyResult findOutlier(List<AnomalyResult> results) {
    for (AnomalyResult result : results) {
      if (result.getFeatures().get("value") == 1000.0) {
        return result;
      }
    }
    Assert.fail("the outlier was not reported in " + results);
    return null;
  }

  @SuppressWarnings("unchecked")
  private static List<String> algorithms(AnomalyResult result) {
    return (List<String>) result.getMetadata().get(AnomalyResult.METADATA_ALGORITHMS);
  }

  @Test
  public void testEmptyBatch() {
    assertThat(engine.detect(List.of()).size(), is(0));
    assertThat(engine.detect(null).size(), is(0));
    assertThat(engine.isReady(), is(false));
  }

  @Test
  public void testBatchWithoutNumericFeatures() {
    final var batch =
        List.of(
            new MetricSample("cpu_usage", null, Map.of(), null),
            new MetricSample("memory_usage", null, null, null));
    assertThat(engine.detect(batch).size(), is(0));
    assertThat(engine.isReady(), is(false));
    assertThat(engine.getDiagnostics().totalFailureCount(), is(0L));
    assertThat(engine.getRecentMetrics().size(), is(2));
  }

  @Test
  public void testOutlierIsDetected() {
    final List<MetricSample> batch = MetricBatches.clusterWithOutlier("cpu_usage", 30);

    final List<AnomalyResult> results = engine.detect(batch);

    assertThat(engine.isReady(), is(true));
    assertThat(results.size(), lessThanOrEqualTo(batch.size()));
    final AnomalyResult outlier = findOutlier(results);
    assertThat(outlier.getType(), is(AnomalyType.RESOURCE_USAGE));
    assertThat(
        outlier.getDescription(),
        is("Unusual resource usage detected in cpu_usage for service api (value: 1000.0)"));
    assertThat(outlier.getService(), is("api"));
    assertThat(outlier.getNamespace(), is("default"));
    assertThat(outlier.getThreshold(), is(0.8));
    assertThat(
        (Double) outlier.getMetadata().get(AnomalyResult.METADATA_VOTE_RATIO),
        greaterThanOrEqualTo(0.5));
    assertThat(algorithms(outlier), hasItem(AnomalyDetectionEngine.STATISTICAL_VOTER));
    assertThat(algorithms(outlier).size(), is(4));
    // every voter, the isolation forest included, flags the outlier
    assertThat((Double) outlier.getMetadata().get(AnomalyResult.METADATA_VOTE_RATIO), is(1.0));
    assertThat(engine.getDiagnostics().totalFailureCount(), is(0L));
  }

  @Test
  public void testResultsFollowBatchOrder() {
    final var batch = new ArrayList<MetricSample>();
    batch.add(MetricBatches.sample("cpu_usage", 1000.0));
    batch.addAll(MetricBatches.clusterWithOutlier("cpu_usage", 30).subList(0, 30));

    final List<AnomalyResult> results = engine.detect(batch);

    assertThat(results.get(0).getFeatures().get("value"), is(1000.0));
  }

  @Test
  public void testStatisticalDetectorAlone() {
    properties.setProperty(AnomalyDetectorConfig.ANOMALY_DETECTOR_STRATEGIES, "");
    engine = AnomalyDetectionEngineFactory.getAnomalyDetectionEngine();

    final List<AnomalyResult> results =
        engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30));

    assertThat(results.size(), is(1));
    assertThat(algorithms(results.get(0)), contains(AnomalyDetectionEngine.STATISTICAL_VOTER));
    assertThat(
        (Double) results.get(0).getMetadata().get(AnomalyResult.METADATA_VOTE_RATIO), is(1.0));
    assertThat(engine.health().getTotalAlgorithms(), is(1));
  }

  @Test
  public void testHealth() {
    final DetectorHealth before = engine.health();
    assertThat(before.isHealthy(), is(false));
    assertThat(before.getLastTraining(), nullValue());
    assertThat(before.getAlgorithmsLoaded(), is(1));
    assertThat(before.getTotalAlgorithms(), is(4));

    engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30));

    final DetectorHealth after = engine.health();
    assertThat(after.isHealthy(), is(true));
    assertThat(after.getLastTraining(), notNullValue());
    assertThat(after.getAlgorithmsLoaded(), is(4));
    assertThat(after.getTotalAlgorithms(), is(4));
  }

  @Test
  public void testRetrainFromRecentMetrics() {
    assertThat(engine.retrain(), is(false));

    engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30));
    final long sequence = engine.getLifecycle().current().getSequence();

    assertThat(engine.retrain(), is(true));
    assertThat(engine.getLifecycle().current().getSequence(), greaterThan(sequence));
    assertThat(engine.isReady(), is(true));
  }

  @Test
  public void testRetrainWithEmptyDataKeepsState() {
    assertThat(engine.retrain(FeatureTable.empty()), is(false));
    assertThat(engine.isReady(), is(false));

    engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30));
    assertThat(engine.retrain(FeatureTable.empty()), is(false));
    assertThat(engine.isReady(), is(true));
  }

  @Test
  public void testFeatureSchemaChangeDropsBatch() {
    engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30));

    // no timestamps, so no calendar features
    final var batch = new ArrayList<MetricSample>();
    for (int i = 0; i < 10; ++i) {
      batch.add(new MetricSample("cpu_usage", 10.0 + i, null, null));
    }
    assertThat(engine.detect(batch).size(), is(0));
    assertThat(engine.getDiagnostics().failureCount(DiagnosticStage.FEATURE_PREPARATION), is(1L));
  }

  @Test
  public void testExtractionFailureIsAbsorbed() {
    engine =
        AnomalyDetectionEngineFactory.getAnomalyDetectionEngine(
            batch -> {
              throw new IllegalStateException("unreadable labels");
            });

    assertThat(engine.detect(MetricBatches.clusterWithOutlier("cpu_usage", 30)).size(), is(0));
    assertThat(engine.getDiagnostics().failureCount(DiagnosticStage.EXTRACTION), is(1L));
    assertThat(engine.retrain(), is(false));
    assertThat(engine.getDiagnostics().failureCount(DiagnosticStage.EXTRACTION), is(2L));
  }

  @Test
  public void testTrainingFailureIsAbsorbed() {
    final List<AnomalyResult> results =
        engine.detect(List.of(MetricBatches.sample("cpu_usage", 10.0)));

    assertThat(results.size(), is(0));
    assertThat(engine.isReady(), is(false));
    assertThat(engine.getDiagnostics().failureCount(DiagnosticStage.TRAINING), is(1L));
  }
}
