package com.ayios.fflags.interfaces;

import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.launchdarkly.sdk.LDValue;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * This interface defines the public methods of {@link com.ayios.fflags.FFlagsClient}.
 * <p>
 * Applications will normally interact directly with {@link com.ayios.fflags.FFlagsClient}, and must
 * use its constructor to initialize the client, but being able to refer to it indirectly via an
 * interface may be helpful in test scenarios.
 */
public interface FFlagsClientInterface extends Closeable {
  /**
   * Returns the cached value of a fast flag.
   * <p>
   * This never blocks and never triggers a load. If {@link #loadFastOnce()} has not completed yet,
   * or the flag does not exist, it returns {@code fallback}.
   *
   * @param flagId the flag id
   * @param fallback the value to return if the flag is not cached
   * @return the cached value or the fallback
   */
  LDValue readFast(String flagId, LDValue fallback);

  /**
   * Returns the cached value of a dynamic flag, as of the last completed refresh cycle.
   *
   * @param flagId the flag id
   * @param fallback the value to return if the flag is not cached
   * @return the cached value or the fallback
   */
  LDValue readDynamic(String flagId, LDValue fallback);

  /**
   * Returns a fast flag as a boolean; the fallback is used if it is missing or not a boolean.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  boolean fastBoolean(String flagId, boolean fallback);

  /**
   * Returns a fast flag as an int; the fallback is used if it is missing or not a number.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  int fastInt(String flagId, int fallback);

  /**
   * Returns a fast flag as a double; the fallback is used if it is missing or not a number.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  double fastDouble(String flagId, double fallback);

  /**
   * Returns a fast flag as a string; the fallback is used if it is missing or not a string.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  String fastString(String flagId, String fallback);

  /**
   * Returns a fast flag as a list of strings; the fallback is used if it is missing or not an array
   * of strings.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  List<String> fastStringList(String flagId, List<String> fallback);

  /**
   * Returns a dynamic flag as a boolean; the fallback is used if it is missing or not a boolean.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  boolean dynamicBoolean(String flagId, boolean fallback);

  /**
   * Returns a dynamic flag as an int; the fallback is used if it is missing or not a number.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  int dynamicInt(String flagId, int fallback);

  /**
   * Returns a dynamic flag as a double; the fallback is used if it is missing or not a number.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  double dynamicDouble(String flagId, double fallback);

  /**
   * Returns a dynamic flag as a string; the fallback is used if it is missing or not a string.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  String dynamicString(String flagId, String fallback);

  /**
   * Returns a dynamic flag as a list of strings; the fallback is used if it is missing or not an
   * array of strings.
   *
   * @param flagId the flag id
   * @param fallback the fallback value
   * @return the value
   */
  List<String> dynamicStringList(String flagId, List<String> fallback);

  /**
   * Returns a snapshot of every cached flag of one kind.
   *
   * @param kind the flag kind
   * @return an immutable map of flag ids to values
   */
  Map<String, LDValue> allFlags(FlagKind kind);

  /**
   * Loads all fast flags from the store, unless that has already been done.
   * <p>
   * Fast flags are loaded only once per client. Once a load has succeeded, this method returns a
   * completed future without querying the store. If a load is already in progress, the same future
   * is returned. If the load fails, the future completes exceptionally and a later call will try
   * again.
   * <p>
   * Dynamic refreshing does not start until the first fast load has completed.
   *
   * @return a future that completes when fast flags are cached
   */
  Future<Void> loadFastOnce();

  /**
   * Runs one refresh cycle for dynamic flags, regardless of the timer.
   * <p>
   * If a cycle is already running, this returns that cycle's future rather than starting another.
   * The future completes exceptionally if the store query or the query filter failed.
   *
   * @return a future that completes when the cycle has finished
   */
  Future<Void> refreshDynamicOnce();

  /**
   * Returns true if fast flags have been loaded.
   *
   * @return true if {@link #loadFastOnce()} has succeeded
   */
  boolean isFastLoaded();

  /**
   * Returns the interval currently used by the refresh timer.
   *
   * @return the refresh interval
   */
  Duration getRefreshInterval();

  /**
   * Returns an interface for subscribing to flag value changes and refresh interval changes.
   *
   * @return a {@link FlagTracker}
   */
  FlagTracker getFlagTracker();
}
