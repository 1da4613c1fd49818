package com.ayios.fflags;

import com.ayios.fflags.ComponentsImpl.DynamicRefreshBuilderImpl;
import com.ayios.fflags.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.ayios.fflags.integrations.DynamicRefreshBuilder;
import com.ayios.fflags.integrations.LoggingConfigurationBuilder;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.FlagStore;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;

/**
 * Provides configurable factories for the standard implementations of client component interfaces.
 * <p>
 * The standard way to specify a configuration is to call one of the static methods here (such as
 * {@link #dynamicRefresh()}), apply any desired change to the builder it returns, and then pass it
 * to the corresponding method of {@link FFlagsConfig.Builder}.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for dynamic flag refreshing.
   * <pre><code>
   *     FFlagsConfig config = new FFlagsConfig.Builder()
   *         .refresh(Components.dynamicRefresh().refreshInterval(Duration.ofSeconds(5)))
   *         .build();
   * </code></pre>
   *
   * @return a builder for setting refresh properties
   * @see FFlagsConfig.Builder#refresh(ComponentConfigurer)
   */
  public static DynamicRefreshBuilder dynamicRefresh() {
    return new DynamicRefreshBuilderImpl();
  }

  /**
   * Returns a configuration builder for the client's logging configuration.
   * <p>
   * Passing this to {@link FFlagsConfig.Builder#logging(ComponentConfigurer)}, after setting any
   * desired properties on the builder, applies this configuration to the client.
   *
   * @return a logging configuration builder
   * @see FFlagsConfig.Builder#logging(ComponentConfigurer)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the client's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for {@code Components.logging().adapter(logAdapter)}.
   *
   * @param logAdapter the log adapter
   * @return a logging configuration builder
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off client logging.
   * <p>
   * This is a shortcut for {@code Components.logging(Logs.none())}.
   *
   * @return a logging configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }

  /**
   * Returns a configuration object that uses an already-created {@link FlagStore}.
   * <p>
   * The client takes ownership of the store and closes it when the client is closed.
   *
   * @param store the store
   * @return a factory that always returns the store
   * @see FFlagsConfig.Builder#flagStore(ComponentConfigurer)
   */
  public static ComponentConfigurer<FlagStore> flagStore(FlagStore store) {
    return context -> store;
  }
}
