package com.ayios.fflags;

import com.ayios.fflags.interfaces.FlagTracker;
import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.FlagValueChangeListener;
import com.ayios.fflags.interfaces.RefreshRateChangeEvent;
import com.ayios.fflags.interfaces.RefreshRateChangeListener;

final class FlagTrackerImpl implements FlagTracker {
  private final EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> flagChangeBroadcaster;
  private final EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> refreshRateBroadcaster;

  FlagTrackerImpl(
      EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> flagChangeBroadcaster,
      EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> refreshRateBroadcaster
      ) {
    this.flagChangeBroadcaster = flagChangeBroadcaster;
    this.refreshRateBroadcaster = refreshRateBroadcaster;
  }

  @Override
  public void addFlagChangeListener(FlagValueChangeListener listener) {
    flagChangeBroadcaster.register(listener);
  }

  @Override
  public void removeFlagChangeListener(FlagValueChangeListener listener) {
    flagChangeBroadcaster.unregister(listener);
  }

  @Override
  public FlagValueChangeListener addFlagValueChangeListener(String flagId, FlagValueChangeListener listener) {
    FlagIdFilter adapter = new FlagIdFilter(flagId, listener);
    addFlagChangeListener(adapter);
    return adapter;
  }

  @Override
  public void addRefreshRateChangeListener(RefreshRateChangeListener listener) {
    refreshRateBroadcaster.register(listener);
  }

  @Override
  public void removeRefreshRateChangeListener(RefreshRateChangeListener listener) {
    refreshRateBroadcaster.unregister(listener);
  }

  private static final class FlagIdFilter implements FlagValueChangeListener {
    private final String flagId;
    private final FlagValueChangeListener listener;

    FlagIdFilter(String flagId, FlagValueChangeListener listener) {
      this.flagId = flagId;
      this.listener = listener;
    }

    @Override
    public void onFlagValueChange(FlagValueChangeEvent event) {
      if (event.getFlagId().equals(flagId)) {
        listener.onFlagValueChange(event);
      }
    }
  }
}
