package com.ayios.fflags.integrations;

import com.ayios.fflags.Components;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;

import java.time.Duration;

/**
 * Contains methods for configuring how dynamic flags are refreshed.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#dynamicRefresh()}, change its properties with the methods of this class, and
 * pass it to {@link com.ayios.fflags.FFlagsConfig.Builder#refresh(ComponentConfigurer)}:
 * <pre><code>
 *     FFlagsConfig config = new FFlagsConfig.Builder()
 *         .refresh(Components.dynamicRefresh().refreshInterval(Duration.ofSeconds(10)).selfReconfigure(true))
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#dynamicRefresh()}.
 */
public abstract class DynamicRefreshBuilder implements ComponentConfigurer<DynamicRefreshConfiguration> {
  /**
   * The default value for {@link #refreshInterval(Duration)}: 30 seconds.
   */
  public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(30);

  /**
   * The id of the reserved dynamic flag that controls the refresh interval when
   * {@link #selfReconfigure(boolean)} is enabled. Its value is a number of milliseconds.
   */
  public static final String REFRESH_RATE_FLAG_ID = "DynamicFFlagRefreshRate";

  protected Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
  protected boolean selfReconfigure = false;
  protected boolean evictStaleFlags = false;

  /**
   * Sets the interval at which the client refreshes dynamic flags from the store.
   * <p>
   * The default is {@link #DEFAULT_REFRESH_INTERVAL}. Passing null restores the default.
   *
   * @param refreshInterval the refresh interval
   * @return the builder
   * @throws IllegalArgumentException if the interval is shorter than one millisecond
   */
  public DynamicRefreshBuilder refreshInterval(Duration refreshInterval) {
    if (refreshInterval == null) {
      this.refreshInterval = DEFAULT_REFRESH_INTERVAL;
    } else if (refreshInterval.toMillis() <= 0) {
      throw new IllegalArgumentException("refresh interval must be at least one millisecond");
    } else {
      this.refreshInterval = refreshInterval;
    }
    return this;
  }

  /**
   * Sets whether the refresh interval follows the value of the {@link #REFRESH_RATE_FLAG_ID} flag.
   * <p>
   * When enabled, every time a refresh cycle sees that flag change to a different positive number,
   * the timer is rescheduled to that many milliseconds and a
   * {@link com.ayios.fflags.interfaces.RefreshRateChangeEvent} is sent. The first value seen for
   * the flag is not applied, since first sightings are not changes. The default is false.
   *
   * @param selfReconfigure true to let the flag control the interval
   * @return the builder
   */
  public DynamicRefreshBuilder selfReconfigure(boolean selfReconfigure) {
    this.selfReconfigure = selfReconfigure;
    return this;
  }

  /**
   * Sets whether dynamic flags that are no longer returned by the store are removed from the cache.
   * <p>
   * By default they are kept, with their last known value. When enabled, a flag missing from a
   * successful refresh is removed and a change event is sent with a null new value. Do not enable
   * this if your query filter returns different scopes on different calls, since flags outside the
   * current scope would be evicted.
   *
   * @param evictStaleFlags true to evict flags that disappear from the store
   * @return the builder
   */
  public DynamicRefreshBuilder evictStaleFlags(boolean evictStaleFlags) {
    this.evictStaleFlags = evictStaleFlags;
    return this;
  }
}
