package com.ayios.fflags.subsystems;

/**
 * The common interface for client component factories and configuration builders.
 * <p>
 * Several kinds of components can be configured through {@link com.ayios.fflags.FFlagsConfig.Builder}.
 * The configuration methods accept an object implementing this interface, which the client uses to
 * create the component once it has a {@link ClientContext}.
 *
 * @param <T> the type of the component being constructed
 */
public interface ComponentConfigurer<T> {
  /**
   * Called internally by the client to create the configured component.
   *
   * @param clientContext provides configuration properties and other components from the current client
   * @return the configured component
   */
  T build(ClientContext clientContext);
}
