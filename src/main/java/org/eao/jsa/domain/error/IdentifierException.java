package org.eao.jsa.domain.error;

/**
 * Raised when the observation id, product id or grouping algorithm of a file cannot be derived.
 *
 * @since 0.1.0
 */
public final class IdentifierException extends IngestException {
  private static final long serialVersionUID = 1L;

  public IdentifierException(String message) {
    super(message);
  }

  public IdentifierException(String message, Throwable cause) {
    super(message, cause);
  }
}
