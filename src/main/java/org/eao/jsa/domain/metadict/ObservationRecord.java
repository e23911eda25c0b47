package org.eao.jsa.domain.metadict;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * Aggregated facts of one observation within a run.
 *
 * @since 0.1.0
 */
public final class ObservationRecord {
  private final String collection;
  private final String observationId;
  private final SortedSet<ObservationUri> memberset = new TreeSet<>();
  private final Map<String, PlaneRecord> planes = new LinkedHashMap<>();

  public ObservationRecord(String collection, String observationId) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.observationId = Objects.requireNonNull(observationId, "observationId");
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

  public SortedSet<ObservationUri> memberset() {
    return memberset;
  }

  /** Planes keyed by product id, in first-seen order. */
  public Map<String, PlaneRecord> planes() {
    return planes;
  }

  public PlaneRecord plane(String productId) {
    return planes.computeIfAbsent(productId, PlaneRecord::new);
  }
}
