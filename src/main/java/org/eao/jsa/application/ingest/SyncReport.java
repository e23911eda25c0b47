package org.eao.jsa.application.ingest;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * Result of writing one batch to the record store.
 *
 * @param written observations written
 * @param wouldWrite observations a dry run discarded instead of writing
 * @param unchanged observations whose stored version already matched
 * @param removedPlanes stale product ids removed per observation
 * @param removedObservations observations removed because no planes were left
 * @param supersededArtifacts number of older artifact versions removed
 * @param failures error message per observation URI that could not be written
 */
public record SyncReport(
    List<Observation> written,
    List<Observation> wouldWrite,
    List<ObservationUri> unchanged,
    Map<ObservationUri, List<String>> removedPlanes,
    List<ObservationUri> removedObservations,
    int supersededArtifacts,
    Map<String, String> failures) {

  public SyncReport {
    written = List.copyOf(written);
    wouldWrite = List.copyOf(wouldWrite);
    unchanged = List.copyOf(unchanged);
    removedPlanes = Collections.unmodifiableMap(new TreeMap<>(removedPlanes));
    removedObservations = List.copyOf(removedObservations);
    failures = Collections.unmodifiableMap(new TreeMap<>(failures));
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
