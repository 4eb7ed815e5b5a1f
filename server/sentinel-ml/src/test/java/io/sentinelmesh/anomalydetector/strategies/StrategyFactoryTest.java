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
package io.sentinelmesh.anomalydetector.strategies;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.anomalydetector.features.FeatureMatrix;
import org.junit.Test;

public class StrategyFactoryTest {
  private final StrategyFactory factory = new StrategyFactory(0.1, 50, 10, 42);

  @Test
  public void testCreatesFreshUntrainedStrategies() {
    final DetectionStrategy forest = factory.create(StrategyKind.ISOLATION_FOREST);
    assertThat(forest, instanceOf(IsolationForestStrategy.class));
    assertThat(((IsolationForestStrategy) forest).getNumTrees(), is(50));
    assertThat(forest.isTrained(), is(false));
    assertThat(forest.getInputWidth(), is(-1));
    assertThat(
        factory.create(StrategyKind.RECONSTRUCTION_ERROR),
        instanceOf(ReconstructionErrorStrategy.class));
    assertThat(
        factory.create(StrategyKind.LOCAL_OUTLIER_FACTOR),
        instanceOf(LocalOutlierFactorStrategy.class));
  }

  @Test
  public void testKindNames() {
    assertThat(StrategyKind.forValue(" IsolationForest "), is(StrategyKind.ISOLATION_FOREST));
    assertThat(StrategyKind.LOCAL_OUTLIER_FACTOR.getStrategyName(), is("localOutlierFactor"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownKind() {
    StrategyKind.forValue("dbscan");
  }

  @Test
  public void testSlots() throws Exception {
    final StrategySlot empty = StrategySlot.uninitialized(StrategyKind.ISOLATION_FOREST);
    assertThat(empty.getState(), is(StrategyState.UNINITIALIZED));
    assertThat(empty.isTrained(), is(false));

    final DetectionStrategy strategy = factory.create(StrategyKind.LOCAL_OUTLIER_FACTOR);
    strategy.train(new FeatureMatrix(new double[][] {{0.0}, {1.0}, {2.0}}));
    final StrategySlot slot = StrategySlot.trained(strategy);
    assertThat(slot.getState(), is(StrategyState.TRAINED));
    assertThat(slot.getKind(), is(StrategyKind.LOCAL_OUTLIER_FACTOR));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUntrainedStrategyCannotFillTrainedSlot() {
    StrategySlot.trained(factory.create(StrategyKind.RECONSTRUCTION_ERROR));
  }
}
