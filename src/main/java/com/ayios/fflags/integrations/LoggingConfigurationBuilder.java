package com.ayios.fflags.integrations;

import com.ayios.fflags.Components;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.LoggingConfiguration;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;

/**
 * Contains methods for configuring the client's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.ayios.fflags.FFlagsConfig.Builder#logging(ComponentConfigurer)}:
 * <pre><code>
 *     FFlagsConfig config = new FFlagsConfig.Builder()
 *         .logging(Components.logging().level(LDLogLevel.DEBUG))
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder implements ComponentConfigurer<LoggingConfiguration> {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;

  /**
   * Specifies an implementation for logging.
   * <p>
   * The default is SLF4J if it is on the classpath, otherwise {@link Logs#toConsole()}. To send
   * client events to your own sink, pass any {@link LDLogAdapter}; to disable logging, use
   * {@link Logs#none()} or {@link Components#noLogging()}.
   *
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * Logger names are only used by frameworks that support named loggers, like SLF4J. The default
   * base name is {@code com.ayios.fflags.FFlagsClient}; sub-loggers append {@code .Store},
   * {@code .Refresh}, or {@code .Events}.
   *
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }

  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This only applies to adapters that do not have their own filtering configuration, such as
   * {@link Logs#toConsole()}. The default is {@link LDLogLevel#INFO}.
   *
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }
}
