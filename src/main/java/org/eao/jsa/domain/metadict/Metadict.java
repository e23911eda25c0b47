package org.eao.jsa.domain.metadict;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * All observations aggregated in one run, keyed by observation id.
 *
 * @since 0.1.0
 */
public final class Metadict {
  private final String collection;
  private final SortedMap<String, ObservationRecord> observations = new TreeMap<>();

  public Metadict(String collection) {
    this.collection = collection;
  }

  public String collection() {
    return collection;
  }

  public SortedMap<String, ObservationRecord> observations() {
    return observations;
  }

  public ObservationRecord observation(String observationId) {
    return observations.computeIfAbsent(observationId, id -> new ObservationRecord(collection, id));
  }

  public Optional<PlaneRecord> plane(String observationId, String productId) {
    ObservationRecord record = observations.get(observationId);
    return record == null ? Optional.empty() : Optional.ofNullable(record.planes().get(productId));
  }

  public boolean contains(String observationId) {
    return observations.containsKey(observationId);
  }

  public int planeCount() {
    int count = 0;
    for (Map.Entry<String, ObservationRecord> entry : observations.entrySet()) {
      count += entry.getValue().planes().size();
    }
    return count;
  }
}
