package com.ayios.fflags.subsystems;

import com.ayios.fflags.integrations.DynamicRefreshBuilder;

import java.time.Duration;

/**
 * Encapsulates the configuration of dynamic flag refreshing.
 * <p>
 * Use {@link DynamicRefreshBuilder} to construct an instance.
 */
public final class DynamicRefreshConfiguration {
  private final Duration refreshInterval;
  private final boolean selfReconfigure;
  private final boolean evictStaleFlags;

  /**
   * Creates an instance.
   *
   * @param refreshInterval see {@link #getRefreshInterval()}
   * @param selfReconfigure see {@link #isSelfReconfigure()}
   * @param evictStaleFlags see {@link #isEvictStaleFlags()}
   */
  public DynamicRefreshConfiguration(Duration refreshInterval, boolean selfReconfigure, boolean evictStaleFlags) {
    this.refreshInterval = refreshInterval;
    this.selfReconfigure = selfReconfigure;
    this.evictStaleFlags = evictStaleFlags;
  }

  /**
   * The initial interval between refresh cycles.
   *
   * @return the refresh interval
   * @see DynamicRefreshBuilder#refreshInterval(Duration)
   */
  public Duration getRefreshInterval() {
    return refreshInterval;
  }

  /**
   * True if the reserved refresh-rate flag is allowed to change the refresh interval.
   *
   * @return true if self-reconfiguration is enabled
   * @see DynamicRefreshBuilder#selfReconfigure(boolean)
   */
  public boolean isSelfReconfigure() {
    return selfReconfigure;
  }

  /**
   * True if dynamic flags that disappear from the store are removed from the cache.
   *
   * @return true if eviction is enabled
   * @see DynamicRefreshBuilder#evictStaleFlags(boolean)
   */
  public boolean isEvictStaleFlags() {
    return evictStaleFlags;
  }
}
