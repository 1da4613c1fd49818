package com.ayios.fflags;

/**
 * Static logger names to be shared by implementation code in the main {@code com.ayios.fflags}
 * package.
 * <p>
 * Most class names here are package-private implementation details that are not meaningful to users,
 * so it is preferable to log under a few stable names that describe an area of functionality.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = FFlagsClient.class.getName();
  static final String EVENTS_LOGGER_NAME = "Events";
  static final String REFRESH_LOGGER_NAME = "Refresh";
  static final String STORE_LOGGER_NAME = "Store";
}
