package org.eao.jsa.domain.error;

/**
 * Root of the checked failures raised while turning file headers into archive records.
 *
 * <p>Subclasses identify the stage that rejected the input so callers can decide whether the failure
 * is scoped to one file, one observation, or the whole run.</p>
 *
 * @since 0.1.0
 */
public class IngestException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message human-readable explanation
   */
  public IngestException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message human-readable explanation
   * @param cause underlying failure
   */
  public IngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
