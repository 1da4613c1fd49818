package com.ayios.fflags.interfaces;

/**
 * An event listener that is notified when a dynamic flag's cached value has changed.
 *
 * <pre><code>
 *     client.getFlagTracker().addFlagValueChangeListener("checkout-timeout", event -&gt; {
 *         resizePool(event.getNewValue().intValue());
 *     });
 * </code></pre>
 *
 * @see FlagTracker
 */
public interface FlagValueChangeListener {
  /**
   * The client calls this method when a dynamic flag's value has changed.
   *
   * @param event the event parameters
   */
  void onFlagValueChange(FlagValueChangeEvent event);
}
