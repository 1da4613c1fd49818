package com.ayios.fflags.subsystems;

import com.ayios.fflags.Components;
import com.launchdarkly.logging.LDLogger;

/**
 * Context information provided by the {@link com.ayios.fflags.FFlagsClient} when creating components.
 * <p>
 * This is passed as a parameter to {@link ComponentConfigurer#build(ClientContext)}. Component
 * factories do not receive the entire {@link com.ayios.fflags.FFlagsConfig} because it could
 * contain factory objects that they have no business accessing.
 * <p>
 * The actual implementation class may contain other properties that are only relevant to the
 * built-in components and are not exposed here.
 */
public class ClientContext {
  private final LDLogger baseLogger;
  private final LoggingConfiguration logging;
  private final int threadPriority;

  /**
   * Constructs an instance, specifying all properties.
   *
   * @param logging the logging configuration; null means no logging
   * @param threadPriority the thread priority for worker threads
   */
  public ClientContext(LoggingConfiguration logging, int threadPriority) {
    this.logging = logging;
    this.threadPriority = threadPriority;

    this.baseLogger = logging == null ? LDLogger.none() :
      LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
  }

  /**
   * Basic constructor for convenience in testing, using default logging and thread priority.
   */
  public ClientContext() {
    this(defaultLogging(), Thread.MIN_PRIORITY);
  }

  private static LoggingConfiguration defaultLogging() {
    ClientContext minimalContext = new ClientContext(null, Thread.MIN_PRIORITY);
    return Components.logging().build(minimalContext);
  }

  /**
   * The base logger for the client. Components should call {@link LDLogger#subLogger(String)}
   * on it to get a logger for their own area of functionality.
   *
   * @return the base logger
   */
  public LDLogger getBaseLogger() {
    return baseLogger;
  }

  /**
   * The client's logging configuration.
   *
   * @return the logging configuration
   */
  public LoggingConfiguration getLogging() {
    return logging;
  }

  /**
   * The thread priority that should be used for any worker threads created by components.
   *
   * @return the thread priority
   */
  public int getThreadPriority() {
    return threadPriority;
  }
}
