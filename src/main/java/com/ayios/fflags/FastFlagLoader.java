package com.ayios.fflags;

import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Populates the fast partition of the cache, once.
 * <p>
 * After the first successful load, {@link #loadOnce()} never touches the store again. While a load is
 * running, every caller gets the same future. A failed load leaves the loader unloaded so the next
 * call starts over; records written before the failure are not rolled back.
 */
final class FastFlagLoader {
  private final FlagStore store;
  private final FlagCache cache;
  private final QueryFilter queryFilter;
  private final Executor executor;
  private final LDLogger logger;

  private volatile boolean loaded = false;
  private CompletableFuture<Void> inFlight = null; // guarded by this

  FastFlagLoader(
      FlagStore store,
      FlagCache cache,
      QueryFilter queryFilter,
      Executor executor,
      LDLogger logger
      ) {
    this.store = store;
    this.cache = cache;
    this.queryFilter = queryFilter;
    this.executor = executor;
    this.logger = logger;
  }

  boolean isLoaded() {
    return loaded;
  }

  CompletableFuture<Void> loadOnce() {
    CompletableFuture<Void> future;
    synchronized (this) {
      if (loaded) {
        return CompletableFuture.completedFuture(null);
      }
      if (inFlight != null) {
        return inFlight;
      }
      future = new CompletableFuture<>();
      inFlight = future;
    }
    try {
      executor.execute(() -> load(future));
    } catch (RejectedExecutionException e) {
      finish(future, e);
    }
    return future;
  }

  private void load(CompletableFuture<Void> future) {
    try {
      FlagQuery query = FlagQueries.buildQuery(FlagKind.FAST, queryFilter, logger);
      logger.debug("Loading fast flags with {}", query);
      List<FlagRecord> records = store.query(query);
      int count = 0;
      for (FlagRecord r: records) {
        if (r.getKind() != FlagKind.FAST) {
          logger.warn("Store returned {} for a fast flag query; ignoring it", r);
          continue;
        }
        cache.put(FlagKind.FAST, r.getId(), r.getValue());
        count++;
      }
      logger.info("Loaded {} fast flags", count);
      finish(future, null);
    } catch (Exception e) {
      logger.error("Failed to load fast flags: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      finish(future, e);
    }
  }

  // Fails a load that can no longer run because the worker thread is gone.
  void close() {
    CompletableFuture<Void> pending;
    synchronized (this) {
      pending = inFlight;
      inFlight = null;
    }
    if (pending != null) {
      pending.completeExceptionally(new IllegalStateException("client was closed"));
    }
  }

  private void finish(CompletableFuture<Void> future, Exception error) {
    synchronized (this) {
      if (error == null) {
        loaded = true;
      }
      if (inFlight == future) {
        inFlight = null;
      }
    }
    if (error == null) {
      future.complete(null);
    } else {
      future.completeExceptionally(error);
    }
  }
}
