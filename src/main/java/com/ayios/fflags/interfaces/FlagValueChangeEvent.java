package com.ayios.fflags.interfaces;

import com.launchdarkly.sdk.LDValue;

/**
 * Parameter class used with {@link FlagValueChangeListener}.
 * <p>
 * An event is only generated when a refresh cycle sees a dynamic flag whose value differs from the
 * value that was cached before the cycle. The first time a flag is seen there is no event.
 *
 * @see FlagTracker#addFlagValueChangeListener(String, FlagValueChangeListener)
 */
public class FlagValueChangeEvent {
  private final String flagId;
  private final LDValue oldValue;
  private final LDValue newValue;

  /**
   * Constructs a new instance.
   *
   * @param flagId the dynamic flag id
   * @param oldValue the previously cached value
   * @param newValue the new value
   */
  public FlagValueChangeEvent(String flagId, LDValue oldValue, LDValue newValue) {
    this.flagId = flagId;
    this.oldValue = LDValue.normalize(oldValue);
    this.newValue = LDValue.normalize(newValue);
  }

  /**
   * Returns the id of the dynamic flag that changed.
   *
   * @return the flag id
   */
  public String getFlagId() {
    return flagId;
  }

  /**
   * Returns the value that was cached before the refresh cycle.
   *
   * @return the previous flag value
   */
  public LDValue getOldValue() {
    return oldValue;
  }

  /**
   * Returns the value that is now cached.
   * <p>
   * If the flag was evicted because it no longer exists in the store (which only happens if
   * eviction was enabled with {@link com.ayios.fflags.integrations.DynamicRefreshBuilder#evictStaleFlags(boolean)}),
   * this is {@link LDValue#ofNull()}.
   *
   * @return the new flag value
   */
  public LDValue getNewValue() {
    return newValue;
  }

  @Override
  public String toString() {
    return "FlagValueChangeEvent(" + flagId + ": " + oldValue + " -> " + newValue + ")";
  }
}
