package org.eao.jsa.application.ingest;

import java.util.Objects;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * Where a file's contribution lands: observation, plane and the algorithm of the observation.
 *
 * @param collection archive collection being ingested
 * @param algorithm observation algorithm name ({@code exposure} for single observations)
 * @param observationId observation identifier
 * @param productId plane product identifier
 * @param scienceProduct science product token heading the product id
 * @param mainProduct whether the file carries the plane's science product rather than a preview
 */
public record PlaneIdentity(
    String collection,
    String algorithm,
    String observationId,
    String productId,
    String scienceProduct,
    boolean mainProduct) {

  public PlaneIdentity {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(observationId, "observationId");
    Objects.requireNonNull(productId, "productId");
  }

  public PlaneUri planeUri() {
    return new PlaneUri(collection, observationId, productId);
  }
}
