package org.eao.jsa.domain.error;

/**
 * Raised when reconciling a run against the record store would revert newer data.
 *
 * @since 0.1.0
 */
public final class ReconciliationException extends IngestException {
  private static final long serialVersionUID = 1L;

  public ReconciliationException(String message) {
    super(message);
  }

  public ReconciliationException(String message, Throwable cause) {
    super(message, cause);
  }
}
