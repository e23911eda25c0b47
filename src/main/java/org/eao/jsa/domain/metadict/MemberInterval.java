package org.eao.jsa.domain.metadict;

/**
 * Observing interval as MJD (UTC).
 *
 * @since 0.1.0
 */
public record MemberInterval(double startMjd, double endMjd) {
  public MemberInterval {
    if (endMjd < startMjd) {
      throw new IllegalArgumentException("interval end " + endMjd + " precedes start " + startMjd);
    }
  }
}
