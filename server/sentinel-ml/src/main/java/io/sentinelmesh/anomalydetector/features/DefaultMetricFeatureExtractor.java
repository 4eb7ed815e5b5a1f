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

import io.sentinelmesh.models.MetricSample;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Default feature extraction: the metric value plus calendar features of the observation time,
 * with the identifying attributes kept as string columns.
 *
 * <p>A numeric column without any value in the batch is left out, so a batch carrying neither
 * values nor timestamps has no numeric features.
 */
public class DefaultMetricFeatureExtractor implements MetricFeatureExtractor {
  public static final String VALUE = "value";
  public static final String HOUR_OF_DAY = "hour_of_day";
  public static final String DAY_OF_WEEK = "day_of_week";
  public static final String NAME = "name";
  public static final String SERVICE = "service";
  public static final String NAMESPACE = "namespace";

  @Override
  public FeatureTable extract(List<MetricSample> samples) {
    if (samples.isEmpty()) {
      return FeatureTable.empty();
    }
    final int size = samples.size();
    final Double[] values = new Double[size];
    final Double[] hours = new Double[size];
    final Double[] days = new Double[size];
    final String[] names = new String[size];
    final String[] services = new String[size];
    final String[] namespaces = new String[size];
    for (int i = 0; i < size; ++i) {
      final MetricSample sample = samples.get(i);
      values[i] = sample.getValue();
      if (sample.getTimestamp() != null) {
        final ZonedDateTime time =
            Instant.ofEpochMilli(sample.getTimestamp()).atZone(ZoneOffset.UTC);
        hours[i] = (double) time.getHour();
        // Monday is 0
        days[i] = (double) (time.getDayOfWeek().getValue() - 1);
      }
      names[i] = sample.getName();
      services[i] = sample.getLabels().get(MetricSample.LABEL_SERVICE);
      namespaces[i] = sample.getLabels().get(MetricSample.LABEL_NAMESPACE);
    }
    final FeatureTable.Builder builder = FeatureTable.builder(size);
    addIfPresent(builder, VALUE, values);
    addIfPresent(builder, HOUR_OF_DAY, hours);
    addIfPresent(builder, DAY_OF_WEEK, days);
    return builder
        .addString(NAME, names)
        .addString(SERVICE, services)
        .addString(NAMESPACE, namespaces)
        .build();
  }

  private static void addIfPresent(FeatureTable.Builder builder, String name, Double[] values) {
    for (Double value : values) {
      if (value != null) {
        builder.addNumeric(name, values);
        return;
      }
    }
  }
}
