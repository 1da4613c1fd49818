package com.ayios.fflags;

import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.FlagValueChangeListener;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.launchdarkly.sdk.LDValue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs refresh cycles for the dynamic partition of the cache.
 * <p>
 * Each cycle queries the store and, for every record in the order returned, overwrites the cached
 * value and broadcasts a {@link FlagValueChangeEvent} if there was a previous value that is not equal
 * to the new one. {@link LDValue#equals(Object)} compares arrays element by element, in order, so a
 * fresh array with the same contents is not a change.
 * <p>
 * At most one cycle runs at a time: a request made while a cycle is running joins that cycle.
 */
final class DynamicFlagRefresher {
  private final FlagStore store;
  private final FlagCache cache;
  private final QueryFilter queryFilter;
  private final EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> flagChangeBroadcaster;
  private final Executor executor;
  private final boolean evictStaleFlags;
  private final LDLogger logger;

  private CompletableFuture<Void> inFlight = null; // guarded by this

  DynamicFlagRefresher(
      FlagStore store,
      FlagCache cache,
      QueryFilter queryFilter,
      EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> flagChangeBroadcaster,
      Executor executor,
      boolean evictStaleFlags,
      LDLogger logger
      ) {
    this.store = store;
    this.cache = cache;
    this.queryFilter = queryFilter;
    this.flagChangeBroadcaster = flagChangeBroadcaster;
    this.executor = executor;
    this.evictStaleFlags = evictStaleFlags;
    this.logger = logger;
  }

  boolean isRefreshing() {
    synchronized (this) {
      return inFlight != null;
    }
  }

  CompletableFuture<Void> refreshOnce() {
    CompletableFuture<Void> future;
    synchronized (this) {
      if (inFlight != null) {
        logger.debug("Refresh already in progress; joining it");
        return inFlight;
      }
      future = new CompletableFuture<>();
      inFlight = future;
    }
    try {
      executor.execute(() -> refresh(future));
    } catch (RejectedExecutionException e) {
      finish(future, e);
    }
    return future;
  }

  private void refresh(CompletableFuture<Void> future) {
    try {
      FlagQuery query = FlagQueries.buildQuery(FlagKind.DYNAMIC, queryFilter, logger);
      logger.debug("Refreshing dynamic flags with {}", query);
      List<FlagRecord> records = store.query(query);
      Set<String> seen = new HashSet<>();
      int changes = 0;
      for (FlagRecord r: records) {
        if (r.getKind() != FlagKind.DYNAMIC) {
          logger.warn("Store returned {} for a dynamic flag query; ignoring it", r);
          continue;
        }
        seen.add(r.getId());
        LDValue newValue = r.getValue();
        LDValue oldValue = cache.put(FlagKind.DYNAMIC, r.getId(), newValue);
        if (oldValue != null && !oldValue.equals(newValue)) {
          changes++;
          flagChangeBroadcaster.broadcast(new FlagValueChangeEvent(r.getId(), oldValue, newValue));
        }
      }
      if (evictStaleFlags) {
        changes += evictUnseen(seen);
      }
      logger.debug("Refreshed {} dynamic flags, {} changed", seen.size(), changes);
      finish(future, null);
    } catch (Exception e) {
      logger.warn("Failed to refresh dynamic flags: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      finish(future, e);
    }
  }

  private int evictUnseen(Set<String> seen) {
    int evicted = 0;
    for (String id: cache.ids(FlagKind.DYNAMIC)) {
      if (seen.contains(id)) {
        continue;
      }
      LDValue oldValue = cache.remove(FlagKind.DYNAMIC, id);
      if (oldValue != null) {
        evicted++;
        logger.debug("Evicted dynamic flag \"{}\" that is no longer in the store", id);
        flagChangeBroadcaster.broadcast(new FlagValueChangeEvent(id, oldValue, LDValue.ofNull()));
      }
    }
    return evicted;
  }

  // Fails a refresh that can no longer run because the worker thread is gone.
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
