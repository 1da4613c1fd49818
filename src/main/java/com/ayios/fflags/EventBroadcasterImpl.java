package com.ayios.fflags;

import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.FlagValueChangeListener;
import com.ayios.fflags.interfaces.RefreshRateChangeEvent;
import com.ayios.fflags.interfaces.RefreshRateChangeListener;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;

/**
 * Holds the listeners for one kind of client event and notifies them on the client's worker thread.
 * <p>
 * Each listener call is a separate task, so a slow or failing listener delays but never prevents the
 * others. A listener added twice is notified once.
 *
 * @param <ListenerT> the listener interface class
 * @param <EventT> the event class
 */
class EventBroadcasterImpl<ListenerT, EventT> {
  private final CopyOnWriteArrayList<ListenerT> listeners = new CopyOnWriteArrayList<>();
  private final BiConsumer<ListenerT, EventT> notifyAction;
  private final Executor executor;
  private final LDLogger logger;

  EventBroadcasterImpl(
      BiConsumer<ListenerT, EventT> notifyAction,
      Executor executor,
      LDLogger logger
      ) {
    this.notifyAction = notifyAction;
    this.executor = executor;
    this.logger = logger;
  }

  static EventBroadcasterImpl<FlagValueChangeListener, FlagValueChangeEvent> forFlagValueChanges(
      Executor executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(FlagValueChangeListener::onFlagValueChange, executor, logger);
  }

  static EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> forRefreshRateChanges(
      Executor executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(RefreshRateChangeListener::onRefreshRateChange, executor, logger);
  }

  void register(ListenerT listener) {
    listeners.addIfAbsent(listener);
  }

  void unregister(ListenerT listener) {
    listeners.remove(listener);
  }

  /**
   * Queues a notification of the event for every listener registered at this moment. Once the
   * client is closed, notifications that cannot be queued are dropped.
   *
   * @param event the event to deliver
   */
  void broadcast(EventT event) {
    for (ListenerT l: listeners) {
      try {
        executor.execute(() -> notify(l, event));
      } catch (RejectedExecutionException e) {
        logger.debug("Client is closed; not delivering {} to {}", event, l.getClass());
        return;
      }
    }
  }

  private void notify(ListenerT listener, EventT event) {
    try {
      notifyAction.accept(listener, event);
    } catch (Exception e) {
      logger.warn("Unexpected error from listener ({}): {}", listener.getClass(), LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    }
  }
}
