package com.ayios.fflags;

import com.ayios.fflags.integrations.DynamicRefreshBuilder;
import com.ayios.fflags.interfaces.FFlagsClientInterface;
import com.ayios.fflags.interfaces.FlagTracker;
import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.FlagValueChangeListener;
import com.ayios.fflags.interfaces.RefreshRateChangeEvent;
import com.ayios.fflags.interfaces.RefreshRateChangeListener;
import com.ayios.fflags.subsystems.ClientContext;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for reading fast and dynamic feature flags. Applications should instantiate a single
 * instance for the lifetime of the application.
 * <p>
 * Fast flags are loaded once, when the application calls {@link #loadFastOnce()}, and never change
 * afterward. Dynamic flags are refreshed from the store at a fixed interval, starting after the fast
 * flags have been loaded. Reads are served from memory and never wait for the store.
 */
public final class FFlagsClient implements FFlagsClientInterface {
  // how long close() lets a running store query or queued notifications finish
  static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);

  private final FlagStore flagStore;
  private final FlagCache cache;
  private final FastFlagLoader fastLoader;
  private final DynamicFlagRefresher refresher;
  private final DynamicRefreshScheduler refreshScheduler;
  private final FlagTrackerImpl flagTracker;
  private final ScheduledExecutorService sharedExecutor;
  private final LDLogger baseLogger;

  /**
   * Creates a new client instance with the default configuration.
   * <p>
   * No flag store is configured, so every read returns its fallback. This is mostly useful for
   * applications that want to run without flags.
   */
  public FFlagsClient() {
    this(FFlagsConfig.DEFAULT);
  }

  /**
   * Creates a new client to connect to a flag store with a custom configuration.
   * <p>
   * The refresh timer is started immediately, but dynamic flags are not read until the fast flags
   * have been loaded by {@link #loadFastOnce()}.
   *
   * @param config a client configuration object
   * @throws NullPointerException if a non-nullable parameter was null
   * @throws IllegalArgumentException if the refresh configuration is invalid
   */
  public FFlagsClient(FFlagsConfig config) {
    checkNotNull(config, "config must not be null");

    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("FFlagsClient-%d")
        .setPriority(config.threadPriority)
        .build();
    this.sharedExecutor = Executors.newSingleThreadScheduledExecutor(threadFactory);

    ClientContext minimalContext = new ClientContext(null, config.threadPriority);
    final ClientContext context = new ClientContext(config.logging.build(minimalContext), config.threadPriority);
    this.baseLogger = context.getBaseLogger();
    LDLogger storeLogger = baseLogger.subLogger(Loggers.STORE_LOGGER_NAME);
    LDLogger refreshLogger = baseLogger.subLogger(Loggers.REFRESH_LOGGER_NAME);
    LDLogger eventsLogger = baseLogger.subLogger(Loggers.EVENTS_LOGGER_NAME);

    DynamicRefreshConfiguration refreshConfig = config.refresh.build(context);
    this.flagStore = config.flagStore.build(context);
    this.cache = new FlagCache();

    EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> flagChangeBroadcaster =
        EventBroadcasterImpl.forFlagValueChanges(sharedExecutor, eventsLogger);
    EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> refreshRateBroadcaster =
        EventBroadcasterImpl.forRefreshRateChanges(sharedExecutor, eventsLogger);
    this.flagTracker = new FlagTrackerImpl(flagChangeBroadcaster, refreshRateBroadcaster);

    this.fastLoader = new FastFlagLoader(flagStore, cache, config.queryFilter, sharedExecutor, storeLogger);
    this.refresher = new DynamicFlagRefresher(flagStore, cache, config.queryFilter, flagChangeBroadcaster,
        sharedExecutor, refreshConfig.isEvictStaleFlags(), refreshLogger);
    this.refreshScheduler = new DynamicRefreshScheduler(fastLoader::isLoaded, refresher, sharedExecutor,
        refreshConfig.getRefreshInterval(), refreshLogger);

    if (refreshConfig.isSelfReconfigure()) {
      RefreshRateMonitor monitor = new RefreshRateMonitor(refreshScheduler, refreshRateBroadcaster, refreshLogger);
      flagTracker.addFlagValueChangeListener(DynamicRefreshBuilder.REFRESH_RATE_FLAG_ID, monitor);
    }

    refreshScheduler.start();
  }

  @Override
  public LDValue readFast(String flagId, LDValue fallback) {
    return read(FlagKind.FAST, flagId, fallback);
  }

  @Override
  public LDValue readDynamic(String flagId, LDValue fallback) {
    return read(FlagKind.DYNAMIC, flagId, fallback);
  }

  @Override
  public boolean fastBoolean(String flagId, boolean fallback) {
    return typedRead(FlagKind.FAST, flagId, LDValue.of(fallback), LDValueType.BOOLEAN).booleanValue();
  }

  @Override
  public int fastInt(String flagId, int fallback) {
    return typedRead(FlagKind.FAST, flagId, LDValue.of(fallback), LDValueType.NUMBER).intValue();
  }

  @Override
  public double fastDouble(String flagId, double fallback) {
    return typedRead(FlagKind.FAST, flagId, LDValue.of(fallback), LDValueType.NUMBER).doubleValue();
  }

  @Override
  public String fastString(String flagId, String fallback) {
    return stringOrFallback(typedRead(FlagKind.FAST, flagId, null, LDValueType.STRING), fallback);
  }

  @Override
  public List<String> fastStringList(String flagId, List<String> fallback) {
    return stringList(FlagKind.FAST, flagId, fallback);
  }

  @Override
  public boolean dynamicBoolean(String flagId, boolean fallback) {
    return typedRead(FlagKind.DYNAMIC, flagId, LDValue.of(fallback), LDValueType.BOOLEAN).booleanValue();
  }

  @Override
  public int dynamicInt(String flagId, int fallback) {
    return typedRead(FlagKind.DYNAMIC, flagId, LDValue.of(fallback), LDValueType.NUMBER).intValue();
  }

  @Override
  public double dynamicDouble(String flagId, double fallback) {
    return typedRead(FlagKind.DYNAMIC, flagId, LDValue.of(fallback), LDValueType.NUMBER).doubleValue();
  }

  @Override
  public String dynamicString(String flagId, String fallback) {
    return stringOrFallback(typedRead(FlagKind.DYNAMIC, flagId, null, LDValueType.STRING), fallback);
  }

  @Override
  public List<String> dynamicStringList(String flagId, List<String> fallback) {
    return stringList(FlagKind.DYNAMIC, flagId, fallback);
  }

  @Override
  public Map<String, LDValue> allFlags(FlagKind kind) {
    checkNotNull(kind, "kind must not be null");
    return cache.snapshot(kind);
  }

  @Override
  public Future<Void> loadFastOnce() {
    return fastLoader.loadOnce();
  }

  @Override
  public Future<Void> refreshDynamicOnce() {
    return refresher.refreshOnce();
  }

  @Override
  public boolean isFastLoaded() {
    return fastLoader.isLoaded();
  }

  @Override
  public Duration getRefreshInterval() {
    return refreshScheduler.getRefreshInterval();
  }

  @Override
  public FlagTracker getFlagTracker() {
    return flagTracker;
  }

  /**
   * Shuts down the client: stops the refresh timer, waits up to one second for work already on the
   * worker thread to finish, and closes the flag store. A load or refresh that has not completed by
   * then is interrupted, and its future completes exceptionally. Flag values already cached remain
   * readable.
   *
   * @throws IOException if the flag store could not be closed
   */
  @Override
  public void close() throws IOException {
    baseLogger.info("Closing FFlags client");
    refreshScheduler.close();
    sharedExecutor.shutdown();
    try {
      if (!sharedExecutor.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        baseLogger.warn("Flag store work did not finish within {}; interrupting it", CLOSE_TIMEOUT);
        sharedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      sharedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      fastLoader.close();
      refresher.close();
      flagStore.close();
    }
  }

  @VisibleForTesting
  DynamicRefreshScheduler getRefreshScheduler() {
    return refreshScheduler;
  }

  private LDValue read(FlagKind kind, String flagId, LDValue fallback) {
    LDValue value = cache.get(kind, flagId);
    return value == null ? fallback : value;
  }

  // Returns null for a miss or type mismatch when no fallback value is given.
  private LDValue typedRead(FlagKind kind, String flagId, LDValue fallback, LDValueType expectedType) {
    LDValue value = cache.get(kind, flagId);
    if (value == null) {
      return fallback;
    }
    if (value.getType() != expectedType) {
      baseLogger.debug("Flag \"{}\" ({}) has a value of type {}, not {}; returning fallback",
          flagId, kind.getTag(), value.getType(), expectedType);
      return fallback;
    }
    return value;
  }

  private static String stringOrFallback(LDValue value, String fallback) {
    return value == null ? fallback : value.stringValue();
  }

  private List<String> stringList(FlagKind kind, String flagId, List<String> fallback) {
    LDValue value = typedRead(kind, flagId, null, LDValueType.ARRAY);
    if (value == null) {
      return fallback;
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (LDValue element: value.values()) {
      if (element.getType() != LDValueType.STRING) {
        baseLogger.debug("Flag \"{}\" ({}) is not a list of strings; returning fallback", flagId, kind.getTag());
        return fallback;
      }
      builder.add(element.stringValue());
    }
    return builder.build();
  }
}
