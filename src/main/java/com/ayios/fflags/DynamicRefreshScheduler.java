package com.ayios.fflags;

import com.google.common.annotations.VisibleForTesting;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * The timer that drives {@link DynamicFlagRefresher}.
 * <p>
 * The timer is armed by {@link #start()}, but each tick is a no-op until fast flags have been loaded.
 * The interval can be changed while running; that cancels the current task and schedules a new one,
 * whose first tick comes one new interval later. Closing the scheduler cancels the timer but lets a
 * refresh cycle that is already running finish.
 */
final class DynamicRefreshScheduler implements Closeable {
  private static final String WILL_RETRY_MESSAGE = "will retry at next scheduled refresh interval";

  private final BooleanSupplier readyToRefresh;
  private final DynamicFlagRefresher refresher;
  private final ScheduledExecutorService scheduler;
  private final LDLogger logger;

  private Duration refreshInterval; // guarded by this
  private ScheduledFuture<?> task; // guarded by this
  private boolean closed; // guarded by this

  DynamicRefreshScheduler(
      BooleanSupplier readyToRefresh,
      DynamicFlagRefresher refresher,
      ScheduledExecutorService sharedExecutor,
      Duration refreshInterval,
      LDLogger logger
      ) {
    this.readyToRefresh = readyToRefresh;
    this.refresher = refresher;
    this.scheduler = sharedExecutor;
    this.refreshInterval = checkInterval(refreshInterval);
    this.logger = logger;
  }

  void start() {
    synchronized (this) {
      if (task != null || closed) {
        return;
      }
      logger.info("Starting dynamic flag refresh with interval: {} milliseconds", refreshInterval.toMillis());
      task = schedule(refreshInterval);
    }
  }

  synchronized Duration getRefreshInterval() {
    return refreshInterval;
  }

  synchronized boolean isRunning() {
    return task != null;
  }

  /**
   * Replaces the refresh interval. If the timer is running, it is rescheduled.
   *
   * @return the interval that was replaced
   */
  Duration setRefreshInterval(Duration newInterval) {
    checkInterval(newInterval);
    synchronized (this) {
      Duration previous = refreshInterval;
      if (previous.equals(newInterval)) {
        return previous;
      }
      refreshInterval = newInterval;
      if (task != null) {
        task.cancel(false);
        task = schedule(newInterval);
      }
      logger.info("Changed dynamic flag refresh interval from {} to {} milliseconds",
          previous.toMillis(), newInterval.toMillis());
      return previous;
    }
  }

  @Override
  public void close() {
    synchronized (this) {
      closed = true;
      if (task != null) {
        task.cancel(false);
        task = null;
      }
    }
  }

  @VisibleForTesting
  void tick() {
    if (!readyToRefresh.getAsBoolean()) {
      logger.debug("Fast flags are not loaded yet; skipping dynamic refresh");
      return;
    }
    refresher.refreshOnce().whenComplete((result, error) -> {
      if (error != null) {
        logger.warn("Dynamic flag refresh failed, {}: {}", WILL_RETRY_MESSAGE, LogValues.exceptionSummary(error));
      }
    });
  }

  private ScheduledFuture<?> schedule(Duration interval) {
    long millis = interval.toMillis();
    return scheduler.scheduleAtFixedRate(this::safeTick, millis, millis, TimeUnit.MILLISECONDS);
  }

  // An exception escaping from a fixed-rate task would suppress all later ticks.
  private void safeTick() {
    try {
      tick();
    } catch (RuntimeException e) {
      logger.error("Unexpected error from dynamic refresh timer: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    }
  }

  private static Duration checkInterval(Duration interval) {
    if (interval == null || interval.isNegative() || interval.isZero() || interval.toMillis() == 0) {
      throw new IllegalArgumentException("refresh interval must be at least one millisecond: " + interval);
    }
    return interval;
  }
}
