package com.ayios.fflags.interfaces;

/**
 * An event listener that is notified when the dynamic refresh interval changes at runtime.
 * <p>
 * This only happens if self-reconfiguration is enabled with
 * {@link com.ayios.fflags.integrations.DynamicRefreshBuilder#selfReconfigure(boolean)}.
 *
 * @see FlagTracker#addRefreshRateChangeListener(RefreshRateChangeListener)
 */
public interface RefreshRateChangeListener {
  /**
   * The client calls this method after it has rescheduled the refresh timer.
   *
   * @param event the event parameters
   */
  void onRefreshRateChange(RefreshRateChangeEvent event);
}
