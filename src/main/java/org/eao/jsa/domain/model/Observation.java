package org.eao.jsa.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * <strong>What:</strong> An archived observation as held by the record store.
 * <p><strong>Role:</strong> Unit of fetch and write-back; the synchronizer copies aggregated facts
 * into it and the reconciler prunes stale planes and artifacts from it.</p>
 * <p><strong>Thread-safety:</strong> Mutable and not thread-safe; the store hands out one instance
 * per exclusive hold.</p>
 *
 * @since 0.1.0
 */
public final class Observation {
  private final String collection;
  private final String observationId;
  private String algorithm;
  private final SortedMap<String, String> attributes = new TreeMap<>();
  private final SortedSet<ObservationUri> members = new TreeSet<>();
  private final Map<String, Plane> planes = new LinkedHashMap<>();

  /**
   * Creates an empty observation.
   *
   * @param collection archive collection
   * @param observationId observation identifier within the collection
   * @param algorithm grouping algorithm, {@code exposure} for single observations
   */
  public Observation(String collection, String observationId, String algorithm) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.observationId = Objects.requireNonNull(observationId, "observationId");
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
  }

  public String collection() {
    return collection;
  }

  public String observationId() {
    return observationId;
  }

  public ObservationUri uri() {
    return new ObservationUri(collection, observationId);
  }

  public String algorithm() {
    return algorithm;
  }

  public void setAlgorithm(String algorithm) {
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
  }

  /** Observation-level scalar attributes (proposal, target, instrument, environment). */
  public SortedMap<String, String> attributes() {
    return attributes;
  }

  /** Member observations of a composite. */
  public SortedSet<ObservationUri> members() {
    return members;
  }

  /** Mutable plane map keyed by product id, in insertion order. */
  public Map<String, Plane> planes() {
    return planes;
  }

  /** Returns the plane for {@code productId}, creating it when absent. */
  public Plane planeFor(String productId) {
    return planes.computeIfAbsent(productId, Plane::new);
  }

  /** Deep copy, used to detect whether a merge changed anything. */
  public Observation copy() {
    Observation copy = new Observation(collection, observationId, algorithm);
    copy.attributes.putAll(attributes);
    copy.members.addAll(members);
    planes.forEach((id, plane) -> copy.planes.put(id, plane.copy()));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Observation other)) {
      return false;
    }
    return collection.equals(other.collection)
        && observationId.equals(other.observationId)
        && algorithm.equals(other.algorithm)
        && attributes.equals(other.attributes)
        && members.equals(other.members)
        && planes.equals(other.planes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(collection, observationId, algorithm, attributes, members, planes);
  }

  @Override
  public String toString() {
    return "Observation[" + uri() + ", planes=" + planes.keySet() + "]";
  }
}
