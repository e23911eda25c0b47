package org.eao.jsa.domain.error;

/**
 * Raised when the record store cannot be read or written.
 *
 * @since 0.1.0
 */
public final class StoreException extends IngestException {
  private static final long serialVersionUID = 1L;

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
