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

import org.junit.Assert;
import org.junit.Test;

public class StandardScalerTest {

  @Test
  public void testScalesToZeroMeanAndUnitVariance() {
    final double[][] data = {{1.0, 10.0}, {3.0, 10.0}};
    final var scaler = StandardScaler.fit(data);

    Assert.assertArrayEquals(new double[] {2.0, 10.0}, scaler.getMeans(), 1e-12);
    // population standard deviation, constant column keeps scale 1
    Assert.assertArrayEquals(new double[] {1.0, 1.0}, scaler.getScales(), 1e-12);

    final double[][] scaled = scaler.transform(data);
    Assert.assertArrayEquals(new double[] {-1.0, 0.0}, scaled[0], 1e-12);
    Assert.assertArrayEquals(new double[] {1.0, 0.0}, scaled[1], 1e-12);
  }

  @Test
  public void testTransformUsesFittedStatistics() {
    final var scaler = StandardScaler.fit(new double[][] {{1.0}, {3.0}});
    assertThat(scaler.transform(new double[][] {{5.0}})[0][0], closeTo(3.0, 1e-12));
    assertThat(scaler.getWidth(), is(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWidthMismatch() {
    StandardScaler.fit(new double[][] {{1.0}, {3.0}}).transform(new double[][] {{1.0, 2.0}});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyData() {
    StandardScaler.fit(new double[0][]);
  }
}
