package org.eao.jsa.domain.error;

/**
 * Raised when a degenerate footprint cannot be repaired into a usable polygon.
 *
 * @since 0.1.0
 */
public final class GeometryException extends IngestException {
  private static final long serialVersionUID = 1L;

  public GeometryException(String message) {
    super(message);
  }

  public GeometryException(String message, Throwable cause) {
    super(message, cause);
  }
}
