package com.ayios.fflags.interfaces;

/**
 * An interface for subscribing to dynamic flag changes.
 * <p>
 * An implementation of this interface is returned by {@link FFlagsClientInterface#getFlagTracker()}.
 * Application code never needs to implement this interface.
 * <p>
 * All listeners are called from the client's worker thread, in the order that the changes were
 * detected. A listener should not block; in particular it must not wait on the futures returned by
 * {@link FFlagsClientInterface#loadFastOnce()} or {@link FFlagsClientInterface#refreshDynamicOnce()},
 * because those run on the same thread.
 */
public interface FlagTracker {
  /**
   * Registers a listener to be notified of value changes in any dynamic flag.
   * <p>
   * Calling this method for an already-registered listener has no effect.
   *
   * @param listener the event listener to register
   * @see #removeFlagChangeListener(FlagValueChangeListener)
   */
  public void addFlagChangeListener(FlagValueChangeListener listener);

  /**
   * Unregisters a listener so that it will no longer be notified.
   * <p>
   * This also accepts the object returned by {@link #addFlagValueChangeListener(String, FlagValueChangeListener)}.
   * Calling this method for a listener that was not previously registered has no effect.
   *
   * @param listener the event listener to unregister
   */
  public void removeFlagChangeListener(FlagValueChangeListener listener);

  /**
   * Registers a listener to be notified of value changes in one specific dynamic flag.
   * <p>
   * The returned object represents the subscription; to unsubscribe, pass that object (not your own
   * listener) to {@link #removeFlagChangeListener(FlagValueChangeListener)}.
   *
   * @param flagId the dynamic flag id
   * @param listener an object that you provide which will be notified of changes
   * @return a listener that can be used to unregister the subscription
   */
  public FlagValueChangeListener addFlagValueChangeListener(String flagId, FlagValueChangeListener listener);

  /**
   * Registers a listener to be notified when the dynamic refresh interval changes.
   *
   * @param listener the event listener to register
   */
  public void addRefreshRateChangeListener(RefreshRateChangeListener listener);

  /**
   * Unregisters a refresh interval listener.
   *
   * @param listener the event listener to unregister
   */
  public void removeRefreshRateChangeListener(RefreshRateChangeListener listener);
}
