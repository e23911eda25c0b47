package org.eao.jsa.application.port;

import java.util.Optional;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * <strong>What:</strong> Access contract of the remote record store holding archived observations.
 * <p><strong>Role:</strong> Outbound port; the synchronizer and reconciler modify observations only
 * through {@link #process(ObservationUri, ProcessOptions)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations guarantee at most one holder per observation
 * between {@link #lock(ObservationUri)} and {@link #unlock(ObservationUri)}.</p>
 *
 * @since 0.1.0
 */
public interface RecordStorePort {
  /**
   * Fetches an observation.
   *
   * @param uri observation reference
   * @return stored observation, empty when absent
   * @throws StoreException when the store cannot be read
   */
  Optional<Observation> get(ObservationUri uri) throws StoreException;

  /**
   * Writes an observation, replacing any stored version.
   *
   * @param observation observation to store
   * @throws StoreException when the store cannot be written
   */
  void put(Observation observation) throws StoreException;

  /**
   * Deletes an observation; absent observations are ignored.
   *
   * @param uri observation reference
   * @throws StoreException when the store cannot be written
   */
  void remove(ObservationUri uri) throws StoreException;

  /**
   * Acquires the exclusive hold on one observation. The default does nothing, which suits
   * single-writer stores.
   *
   * @param uri observation reference
   * @throws StoreException when the hold cannot be acquired
   */
  default void lock(ObservationUri uri) throws StoreException {}

  /**
   * Releases the hold acquired by {@link #lock(ObservationUri)}.
   *
   * @param uri observation reference
   */
  default void unlock(ObservationUri uri) {}

  /**
   * Opens an exclusive fetch, modify and write-back cycle on one observation.
   *
   * @param uri observation reference
   * @param options dry-run and remove permissions
   * @return open lease; close it to write back
   * @throws StoreException when the observation cannot be fetched
   */
  default ObservationLease process(ObservationUri uri, ProcessOptions options) throws StoreException {
    return ObservationLease.open(this, uri, options);
  }
}
