package org.eao.jsa.application.port;

import java.util.Objects;
import java.util.Optional;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Exclusive hold on one stored observation for a fetch, modify and
 * write-back cycle.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch the stored observation (or nothing) and hand out a working copy.</li>
 *   <li>On close, write the copy back only when it differs from what was fetched.</li>
 *   <li>Delete the observation when it lost every plane, but only if removal was allowed.</li>
 *   <li>Drop all changes on dry runs or after {@link #discard()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the thread that opened it.</p>
 *
 * @since 0.1.0
 */
public final class ObservationLease implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ObservationLease.class);

  private final RecordStorePort store;
  private final ObservationUri uri;
  private final ProcessOptions options;
  private final Observation original;
  private Observation working;
  private boolean discarded;
  private boolean closed;
  private LeaseOutcome outcome;

  private ObservationLease(
      RecordStorePort store, ObservationUri uri, ProcessOptions options, Observation original) {
    this.store = store;
    this.uri = uri;
    this.options = options;
    this.original = original;
    this.working = original == null ? null : original.copy();
  }

  static ObservationLease open(RecordStorePort store, ObservationUri uri, ProcessOptions options)
      throws StoreException {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(options, "options");
    store.lock(uri);
    try {
      Observation stored = store.get(uri).orElse(null);
      return new ObservationLease(store, uri, options, stored);
    } catch (StoreException | RuntimeException ex) {
      store.unlock(uri);
      throw ex;
    }
  }

  public ObservationUri uri() {
    return uri;
  }

  /** Whether the store held the observation when the lease was opened. */
  public boolean existed() {
    return original != null;
  }

  /** Snapshot of the observation as fetched; callers must not modify it. */
  public Optional<Observation> stored() {
    return Optional.ofNullable(original);
  }

  /** Working copy, empty when the store had none and none was created. */
  public Optional<Observation> observation() {
    return Optional.ofNullable(working);
  }

  /**
   * Returns the working copy, creating an empty observation when the store had none.
   *
   * @param algorithm grouping algorithm for a new observation
   * @return working copy
   */
  public Observation observationOrCreate(String algorithm) {
    if (working == null) {
      working = new Observation(uri.collection(), uri.observationId(), algorithm);
    }
    return working;
  }

  /** Drops every change made through this lease. */
  public void discard() {
    discarded = true;
  }

  /** Outcome of {@link #close()}, or {@code null} while open. */
  public LeaseOutcome outcome() {
    return outcome;
  }

  @Override
  public void close() throws StoreException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      outcome = writeBack();
      log.debug("Closed lease on {} with outcome {}", uri, outcome);
    } finally {
      store.unlock(uri);
    }
  }

  private LeaseOutcome writeBack() throws StoreException {
    if (discarded || options.dryRun()) {
      return Objects.equals(working, original) ? LeaseOutcome.UNCHANGED : LeaseOutcome.DISCARDED;
    }
    if (working == null || working.equals(original)) {
      return LeaseOutcome.UNCHANGED;
    }
    if (working.planes().isEmpty()) {
      if (original == null) {
        return LeaseOutcome.UNCHANGED;
      }
      if (!options.allowRemove()) {
        throw new StoreException("refusing to remove " + uri
            + " after its last plane was deleted; removal was not allowed");
      }
      store.remove(uri);
      return LeaseOutcome.REMOVED;
    }
    store.put(working);
    return LeaseOutcome.WRITTEN;
  }
}
