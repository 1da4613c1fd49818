package com.ayios.fflags;

import com.ayios.fflags.integrations.DynamicRefreshBuilder;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.LoggingConfiguration;

/**
 * This class exposes configuration options for the {@link FFlagsClient}. Instances of this class must
 * be constructed with a {@link FFlagsConfig.Builder}.
 */
public final class FFlagsConfig {
  static final FFlagsConfig DEFAULT = new Builder().build();

  final ComponentConfigurer<FlagStore> flagStore;
  final ComponentConfigurer<LoggingConfiguration> logging;
  final QueryFilter queryFilter;
  final ComponentConfigurer<DynamicRefreshConfiguration> refresh;
  final int threadPriority;

  FFlagsConfig(Builder builder) {
    this.flagStore = builder.flagStore == null ? ComponentsImpl.NullFlagStoreFactory.INSTANCE : builder.flagStore;
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    this.queryFilter = builder.queryFilter == null ? QueryFilter.NONE : builder.queryFilter;
    this.refresh = builder.refresh == null ? Components.dynamicRefresh() : builder.refresh;
    this.threadPriority = builder.threadPriority;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link FFlagsConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * FFlagsConfig config = new FFlagsConfig.Builder()
   *      .flagStore(FileData.flagStore().filePaths("flags.yml"))
   *      .refresh(Components.dynamicRefresh().selfReconfigure(true))
   *      .build()
   * </pre>
   */
  public static class Builder {
    private ComponentConfigurer<FlagStore> flagStore = null;
    private ComponentConfigurer<LoggingConfiguration> logging = null;
    private QueryFilter queryFilter = null;
    private ComponentConfigurer<DynamicRefreshConfiguration> refresh = null;
    private int threadPriority = Thread.MIN_PRIORITY;

    /**
     * Creates a builder with all configuration parameters set to the default
     */
    public Builder() {
    }

    /**
     * Sets the store that flag records are read from.
     * <p>
     * Use {@link com.ayios.fflags.integrations.FileData#flagStore()},
     * {@link com.ayios.fflags.integrations.TestFlagStore}, or {@link Components#flagStore(FlagStore)}
     * for your own implementation. If no store is set, the client has no flags and every read
     * returns its fallback.
     *
     * @param flagStoreConfigurer the store configuration builder
     * @return the builder
     */
    public Builder flagStore(ComponentConfigurer<FlagStore> flagStoreConfigurer) {
      this.flagStore = flagStoreConfigurer;
      return this;
    }

    /**
     * Sets the client's logging configuration, using a factory object. This object is normally a
     * configuration builder obtained from {@link Components#logging()}.
     *
     * @param loggingConfigurer the logging configuration builder
     * @return the main configuration builder
     */
    public Builder logging(ComponentConfigurer<LoggingConfiguration> loggingConfigurer) {
      this.logging = loggingConfigurer;
      return this;
    }

    /**
     * Sets a hook that adds extra predicates to every store query. The default adds none.
     *
     * @param queryFilter the filter, or null for none
     * @return the builder
     * @see QueryFilter
     */
    public Builder queryFilter(QueryFilter queryFilter) {
      this.queryFilter = queryFilter;
      return this;
    }

    /**
     * Sets the dynamic refresh configuration. This is normally a builder obtained from
     * {@link Components#dynamicRefresh()}.
     *
     * @param refreshConfigurer the refresh configuration builder
     * @return the builder
     * @see DynamicRefreshBuilder
     */
    public Builder refresh(ComponentConfigurer<DynamicRefreshConfiguration> refreshConfigurer) {
      this.refresh = refreshConfigurer;
      return this;
    }

    /**
     * Set the priority to use for the client's worker thread.
     * <p>
     * The default is {@link Thread#MIN_PRIORITY}. Values outside the range of
     * [{@link Thread#MIN_PRIORITY}, {@link Thread#MAX_PRIORITY}] are set to the nearest valid value.
     *
     * @param threadPriority the priority for the worker thread
     * @return the builder
     */
    public Builder threadPriority(int threadPriority) {
      this.threadPriority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, threadPriority));
      return this;
    }

    /**
     * Builds the configured {@link FFlagsConfig} object.
     *
     * @return the {@link FFlagsConfig} configured by this builder
     */
    public FFlagsConfig build() {
      return new FFlagsConfig(this);
    }
  }
}
