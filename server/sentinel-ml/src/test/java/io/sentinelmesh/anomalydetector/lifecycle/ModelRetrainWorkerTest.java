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
package io.sentinelmesh.anomalydetector.lifecycle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.anomalydetector.AnomalyDetectionEngine;
import io.sentinelmesh.anomalydetector.MetricBatches;
import io.sentinelmesh.anomalydetector.factories.AnomalyDetectionEngineFactory;
import io.sentinelmesh.common.SentinelConfigBase;
import java.util.Properties;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ModelRetrainWorkerTest {
  private AnomalyDetectionEngine engine;

  @Before
  public void setUp() {
    SentinelConfigBase.setProperties(new Properties());
    engine = AnomalyDetectionEngineFactory.getAnomalyDetectionEngine();
  }

  @After
  public void tearDown() {
    SentinelConfigBase.setProperties(System.getProperties());
  }

  @Test
  public void testRetrainsOnRecentMetrics() {
    final var worker = new ModelRetrainWorker(engine, 60);

    worker.run();
    assertThat(engine.isReady(), is(false));

    engine.detect(MetricBatches.clusterWithOutlier("memory_usage", 30));
    final long sequence = engine.getLifecycle().current().getSequence();
    worker.run();
    assertThat(engine.getLifecycle().current().getSequence(), greaterThan(sequence));
  }

  @Test
  public void testShutdownWorkerDoesNothing() {
    engine.detect(MetricBatches.clusterWithOutlier("memory_usage", 30));
    final long sequence = engine.getLifecycle().current().getSequence();

    final var worker = new ModelRetrainWorker(engine, 60);
    worker.shutdown();
    worker.run();
    assertThat(engine.getLifecycle().current().getSequence(), is(sequence));
  }
}
