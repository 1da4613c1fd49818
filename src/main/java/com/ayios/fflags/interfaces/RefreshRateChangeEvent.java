package com.ayios.fflags.interfaces;

import java.time.Duration;

/**
 * Parameter class used with {@link RefreshRateChangeListener}: the dynamic refresh interval was
 * changed because the reserved refresh-rate flag changed.
 */
public class RefreshRateChangeEvent {
  private final Duration current;
  private final Duration previous;

  /**
   * Constructs a new instance.
   *
   * @param current the interval now in effect
   * @param previous the interval that was replaced
   */
  public RefreshRateChangeEvent(Duration current, Duration previous) {
    this.current = current;
    this.previous = previous;
  }

  /**
   * The interval now in effect.
   *
   * @return the current interval
   */
  public Duration getCurrent() {
    return current;
  }

  /**
   * The interval that was in effect before the change.
   *
   * @return the previous interval
   */
  public Duration getPrevious() {
    return previous;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof RefreshRateChangeEvent) {
      RefreshRateChangeEvent other = (RefreshRateChangeEvent)o;
      return current.equals(other.current) && previous.equals(other.previous);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return current.hashCode() * 31 + previous.hashCode();
  }

  @Override
  public String toString() {
    return "RefreshRateChangeEvent(current=" + current.toMillis() + "ms, previous=" + previous.toMillis() + "ms)";
  }
}
