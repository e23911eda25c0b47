package org.eao.jsa.application.port;

/**
 * What closing an {@link ObservationLease} did to the store.
 *
 * @since 0.1.0
 */
public enum LeaseOutcome {
  /** Nothing changed, so nothing was written. */
  UNCHANGED,
  /** The modified observation was written. */
  WRITTEN,
  /** The observation lost its last plane and was deleted. */
  REMOVED,
  /** Changes were dropped because of a dry run or an explicit discard. */
  DISCARDED
}
