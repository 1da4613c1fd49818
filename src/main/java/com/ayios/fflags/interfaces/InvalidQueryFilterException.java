package com.ayios.fflags.interfaces;

/**
 * Indicates that a {@link QueryFilter} returned something other than {@code false}, null, or a
 * JSON object, or threw an exception. The load or refresh cycle that called the filter fails with
 * this exception; nothing is merged into the query.
 */
@SuppressWarnings("serial")
public class InvalidQueryFilterException extends RuntimeException {
  /**
   * Creates an instance.
   *
   * @param message the description
   */
  public InvalidQueryFilterException(String message) {
    super(message);
  }

  /**
   * Creates an instance.
   *
   * @param message the description
   * @param cause the underlying exception
   */
  public InvalidQueryFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
