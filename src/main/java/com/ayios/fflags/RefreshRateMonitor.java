package com.ayios.fflags;

import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.FlagValueChangeListener;
import com.ayios.fflags.interfaces.RefreshRateChangeEvent;
import com.ayios.fflags.interfaces.RefreshRateChangeListener;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;

import java.time.Duration;

/**
 * Reacts to changes of the reserved refresh-rate flag by rescheduling the refresh timer.
 * <p>
 * This is an ordinary flag change listener; the refresher knows nothing about it. Because it only
 * hears about a new value after a refresh at the old interval has seen it, a change always takes
 * effect one cycle late. The value is in milliseconds and must be a positive number; anything else
 * is ignored.
 */
final class RefreshRateMonitor implements FlagValueChangeListener {
  private final DynamicRefreshScheduler scheduler;
  private final EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> refreshRateBroadcaster;
  private final LDLogger logger;

  RefreshRateMonitor(
      DynamicRefreshScheduler scheduler,
      EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> refreshRateBroadcaster,
      LDLogger logger
      ) {
    this.scheduler = scheduler;
    this.refreshRateBroadcaster = refreshRateBroadcaster;
    this.logger = logger;
  }

  @Override
  public void onFlagValueChange(FlagValueChangeEvent event) {
    LDValue value = event.getNewValue();
    if (!value.isNumber() || value.longValue() <= 0) {
      logger.warn("Ignoring refresh rate flag \"{}\" with invalid value {}; expected a positive number of milliseconds",
          event.getFlagId(), value.toJsonString());
      return;
    }
    Duration current = Duration.ofMillis(value.longValue());
    if (current.equals(scheduler.getRefreshInterval())) {
      return;
    }
    Duration previous = scheduler.setRefreshInterval(current);
    refreshRateBroadcaster.broadcast(new RefreshRateChangeEvent(current, previous));
  }
}
