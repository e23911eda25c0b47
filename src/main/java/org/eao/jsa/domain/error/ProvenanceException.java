package org.eao.jsa.domain.error;

/**
 * Raised when a membership or provenance reference points to a record that does not exist.
 *
 * @since 0.1.0
 */
public final class ProvenanceException extends IngestException {
  private static final long serialVersionUID = 1L;

  public ProvenanceException(String message) {
    super(message);
  }

  public ProvenanceException(String message, Throwable cause) {
    super(message, cause);
  }
}
