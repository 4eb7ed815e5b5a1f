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
package io.sentinelmesh.anomalydetector.window;

import io.sentinelmesh.models.MetricSample;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;

/**
 * Class RecentMetricWindow is a wrapper on LinkedList that keeps the most recent metric samples
 * seen by the detector. It guarantees that 1) the number of elements is at most the capacity
 * passed in the constructor, the oldest samples being dropped first, and 2) a consistent copy of
 * the window can be taken while other threads keep adding.
 */
public class RecentMetricWindow extends LinkedList<MetricSample> {

  private static final long serialVersionUID = 6043216978245309251L;

  private final int capacity;

  public RecentMetricWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity should be greater than 0");
    }
    this.capacity = capacity;
  }

  public int getCapacity() {
    return capacity;
  }

  @Override
  public synchronized boolean add(MetricSample sample) {
    while (super.size() >= capacity) {
      super.poll();
    }
    super.add(sample);
    return true;
  }

  @Override
  public synchronized boolean addAll(Collection<? extends MetricSample> samples) {
    for (MetricSample sample : samples) {
      add(sample);
    }
    return !samples.isEmpty();
  }

  @Override
  public synchronized int size() {
    return super.size();
  }

  @Override
  public synchronized void clear() {
    super.clear();
  }

  /** Returns a copy of the window, oldest sample first. */
  public synchronized List<MetricSample> snapshot() {
    return new ArrayList<>(this);
  }

  @Override
  public void addFirst(MetricSample elem) {
    throw new UnsupportedOperationException("This operation is not supported");
  }

  @Override
  public void addLast(MetricSample elem) {
    throw new UnsupportedOperationException("This operation is not supported");
  }

  @Override
  public MetricSample remove() {
    throw new UnsupportedOperationException("This operation is not supported");
  }
}
