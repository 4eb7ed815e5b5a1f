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
package io.sentinelmesh.maintenance;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules the detector's background workers, periodic retraining and health logging. */
public class Maintenance {
  private static final Logger logger = LoggerFactory.getLogger(Maintenance.class);

  private static final int POOL_SIZE = 2;

  @Getter
  private final ScheduledExecutorService scheduler =
      Executors.newScheduledThreadPool(
          POOL_SIZE,
          new ThreadFactoryBuilder()
              .setNameFormat("sentinel-maint-%d")
              .setPriority(Thread.MIN_PRIORITY)
              .setDaemon(true)
              .build());

  /** Registered workers with their scheduled task, null until started. */
  private final Map<MaintenanceWorker, ScheduledFuture<?>> workers = new LinkedHashMap<>();

  private boolean running = false;
  private volatile boolean shutdown = false;

  /**
   * Adds a worker. A worker added while running is scheduled immediately.
   *
   * @param worker The maintenance worker to register.
   */
  public synchronized void register(MaintenanceWorker worker) {
    logger.debug("registering maintenance worker {}", worker);
    workers.put(worker, running ? schedule(worker) : null);
  }

  /**
   * Removes a worker and cancels its scheduled task.
   *
   * @param worker The maintenance worker to unregister.
   * @return true if the worker was registered, false otherwise.
   */
  public synchronized boolean unregister(MaintenanceWorker worker) {
    if (!workers.containsKey(worker)) {
      logger.warn("maintenance worker {} is not registered", worker);
      return false;
    }
    final ScheduledFuture<?> task = workers.remove(worker);
    if (task != null) {
      task.cancel(false);
    }
    logger.info("unregistered maintenance worker {}", worker);
    return true;
  }

  /** Schedules every registered worker with its own initial delay and interval. */
  public synchronized void start() {
    if (shutdown || running) {
      logger.warn("Maintenance cannot start; shutdown={}, running={}", shutdown, running);
      return;
    }
    running = true;
    workers.replaceAll((worker, task) -> schedule(worker));
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** Shuts the workers down and stops the scheduler. Pending runs are discarded. */
  public synchronized void shutdown() {
    if (shutdown) {
      return;
    }
    shutdown = true;
    running = false;
    workers.forEach(
        (worker, task) -> {
          worker.shutdown();
          if (task != null) {
            task.cancel(false);
          }
        });
    scheduler.shutdownNow();
    logger.info("Maintenance shut down; workers={}", workers.size());
  }

  private ScheduledFuture<?> schedule(MaintenanceWorker worker) {
    logger.info(
        "{}: interval={} {}, initial={} {}",
        worker.getClass().getSimpleName(),
        worker.getInterval(),
        worker.getTimeUnit(),
        worker.getInitialDelay(),
        worker.getTimeUnit());
    return scheduler.scheduleWithFixedDelay(
        worker, worker.getInitialDelay(), worker.getInterval(), worker.getTimeUnit());
  }
}
