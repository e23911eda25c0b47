package org.eao.jsa.domain.metadict;

import java.time.Instant;
import org.eao.jsa.domain.header.HeaderValues;

/**
 * How an incoming scalar value combines with the value already aggregated for the same key.
 *
 * @since 0.1.0
 */
public enum MergePolicy {
  /** The incoming value replaces the stored one. */
  LAST_WRITER_WINS {
    @Override
    public String merge(String stored, String incoming) {
      return incoming;
    }
  },
  /** Timestamps only move forward: the later of the two values is kept. */
  LATEST_DATE {
    @Override
    public String merge(String stored, String incoming) {
      if (stored == null) {
        return incoming;
      }
      Instant current = HeaderValues.parseInstant(stored);
      Instant candidate = HeaderValues.parseInstant(incoming);
      return candidate.isAfter(current) ? incoming : stored;
    }
  },
  /** A zero never replaces a stored non-zero number. */
  NON_ZERO_STICKY {
    @Override
    public String merge(String stored, String incoming) {
      if (stored == null) {
        return incoming;
      }
      if (Double.parseDouble(incoming) == 0.0 && Double.parseDouble(stored) != 0.0) {
        return stored;
      }
      return incoming;
    }
  };

  /**
   * Combines two values of one key.
   *
   * @param stored value aggregated so far, or {@code null}
   * @param incoming value from the file being folded in; never {@code null}
   * @return value to keep
   */
  public abstract String merge(String stored, String incoming);
}
