package org.eao.jsa.application.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.ArchiveQueryPort.PlaneRunRow;
import org.eao.jsa.application.port.LeaseOutcome;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.application.port.ObservationLease;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.application.port.RecordStorePort;
import org.eao.jsa.domain.error.ReconciliationException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.Artifact;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.domain.naming.FileIds;
import org.eao.jsa.domain.naming.FileIds.Versioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Removes planes and artifacts that a new recipe run has made obsolete.
 * <p><strong>Why:</strong> A re-run of a recipe may produce fewer planes than before, or new
 * versions of versioned files; the archive must not keep the leftovers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record, per run id, which stored planes share an observation with that run.</li>
 *   <li>Prune stale planes of observations touched by the batch.</li>
 *   <li>Replace older versions of versioned artifacts and refuse version regressions.</li>
 *   <li>At the end of the batch, clean up observations the batch did not touch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per batch.</p>
 *
 * @since 0.1.0
 */
public final class StaleRecordReconciler {
  private static final Logger log = LoggerFactory.getLogger(StaleRecordReconciler.class);

  private final String collection;
  private final ArchiveQueryPort archive;
  private final RunAliases aliases;
  private final MetricsPort metrics;
  private final Set<String> registeredRuns = new HashSet<>();
  private final SortedMap<String, Map<String, Boolean>> removeDict = new TreeMap<>();

  public StaleRecordReconciler(
      String collection, ArchiveQueryPort archive, RunAliases aliases, MetricsPort metrics) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.archive = Objects.requireNonNull(archive, "archive");
    this.aliases = aliases == null ? RunAliases.NONE : aliases;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Records the stored planes that share an observation with a plane of the given run. Each run
   * id is queried once per batch.
   *
   * @param runId recipe instance identifier of a file in the batch
   * @throws StoreException when the archive cannot be queried
   */
  public void registerRun(String runId) throws StoreException {
    if (runId == null || !registeredRuns.add(runId)) {
      return;
    }
    Set<String> runIds = new HashSet<>();
    runIds.add(runId);
    runIds.addAll(aliases.aliasesOf(runId));
    for (String id : runIds) {
      metrics.increment("ingest.queries");
      for (PlaneRunRow row : archive.planesSharingRun(collection, id)) {
        if (!collection.equals(row.collection())) {
          continue;
        }
        boolean sameRun = runIds.contains(row.runId());
        removeDict.computeIfAbsent(row.observationId(), ignored -> new LinkedHashMap<>())
            .merge(row.productId(), sameRun, Boolean::logicalOr);
      }
    }
    log.debug("Registered run {} with aliases {}", runId, runIds);
  }

  /** Stored planes recorded for an observation, with whether each was produced by a batch run. */
  public Map<String, Boolean> candidates(String observationId) {
    Map<String, Boolean> entries = removeDict.get(observationId);
    return entries == null ? Map.of() : Map.copyOf(entries);
  }

  /**
   * Removes planes of a touched observation that were produced by one of the batch's runs but
   * are not produced by the batch any more. Consumes the observation's entries.
   *
   * @param observation working copy of the stored observation
   * @param currentProducts product ids produced by the batch for this observation
   * @return removed product ids
   */
  public List<String> pruneStalePlanes(Observation observation, Set<String> currentProducts) {
    Map<String, Boolean> entries = removeDict.remove(observation.observationId());
    List<String> removed = new ArrayList<>();
    if (entries == null) {
      return removed;
    }
    for (Map.Entry<String, Boolean> entry : entries.entrySet()) {
      String productId = entry.getKey();
      if (entry.getValue() && !currentProducts.contains(productId)
          && observation.planes().remove(productId) != null) {
        removed.add(productId);
        log.info("Removing stale plane {}/{}", observation.uri(), productId);
      }
    }
    return removed;
  }

  /**
   * Applies versioned-artifact rules to one observation. For every plane of the batch, the
   * highest version written by the batch is compared with the lowest version stored before the
   * batch: a lower version is refused, a higher version deletes every older version of the same
   * base name.
   *
   * @param stored observation as it was before the batch, or {@code null} when it is new
   * @param working working copy being written
   * @param record aggregated observation of the batch
   * @return number of superseded artifacts removed
   * @throws ReconciliationException when the batch would replace a newer version with an older one
   */
  public int replaceVersions(Observation stored, Observation working, ObservationRecord record)
      throws ReconciliationException {
    int superseded = 0;
    for (PlaneRecord planeRecord : record.planes().values()) {
      Map<String, Integer> after = new HashMap<>();
      for (String uri : planeRecord.uriDict().keySet()) {
        versionOf(uri).ifPresent(v -> after.merge(v.baseName(), v.version(), Math::max));
      }
      if (after.isEmpty()) {
        continue;
      }
      Map<String, Integer> before = new HashMap<>();
      Plane storedPlane = stored == null ? null : stored.planes().get(planeRecord.productId());
      if (storedPlane != null) {
        for (String uri : storedPlane.artifacts().keySet()) {
          versionOf(uri).ifPresent(v -> before.merge(v.baseName(), v.version(), Math::min));
        }
      }
      Plane plane = working.planes().get(planeRecord.productId());
      for (Map.Entry<String, Integer> entry : after.entrySet()) {
        Integer oldest = before.get(entry.getKey());
        if (oldest == null || oldest.intValue() == entry.getValue().intValue()) {
          continue;
        }
        if (entry.getValue() < oldest) {
          throw new ReconciliationException(working.uri() + "/" + planeRecord.productId() + ": "
              + entry.getKey() + " version " + entry.getValue()
              + " is older than the stored version " + oldest);
        }
        superseded += removeOlder(plane, entry.getKey(), entry.getValue());
      }
    }
    return superseded;
  }

  private static int removeOlder(Plane plane, String baseName, int version) {
    int removed = 0;
    Iterator<Artifact> artifacts = plane.artifacts().values().iterator();
    while (artifacts.hasNext()) {
      Artifact artifact = artifacts.next();
      Optional<Versioned> candidate = versionOf(artifact.uri());
      if (candidate.isPresent() && candidate.get().baseName().equals(baseName)
          && candidate.get().version() < version) {
        log.info("Removing superseded artifact {}", artifact.uri());
        artifacts.remove();
        removed++;
      }
    }
    return removed;
  }

  private static Optional<Versioned> versionOf(String artifactUri) {
    return FileIds.versioned(FileIds.fileIdOf(artifactUri));
  }

  /**
   * End of batch: for observations that the batch did not touch but that share a run with it,
   * removes the planes produced by the batch's runs. An observation left without planes is
   * removed entirely.
   *
   * @param metadict metadict of the batch
   * @param store record store
   * @param options write options of the batch
   * @return outcome of the clean-up
   */
  public Cleanup finish(Metadict metadict, RecordStorePort store, ProcessOptions options) {
    Map<ObservationUri, List<String>> removedPlanes = new TreeMap<>();
    List<ObservationUri> removedObservations = new ArrayList<>();
    Map<String, String> failures = new TreeMap<>();
    ProcessOptions removal = options.withAllowRemove(true);

    Iterator<Map.Entry<String, Map<String, Boolean>>> pending = removeDict.entrySet().iterator();
    while (pending.hasNext()) {
      Map.Entry<String, Map<String, Boolean>> entry = pending.next();
      pending.remove();
      if (metadict.contains(entry.getKey())) {
        continue;
      }
      ObservationUri uri = new ObservationUri(collection, entry.getKey());
      try {
        List<String> removed = new ArrayList<>();
        LeaseOutcome outcome;
        ObservationLease lease = store.process(uri, removal);
        try {
          Optional<Observation> observation = lease.observation();
          if (observation.isPresent()) {
            for (Map.Entry<String, Boolean> plane : entry.getValue().entrySet()) {
              if (plane.getValue() && observation.get().planes().remove(plane.getKey()) != null) {
                removed.add(plane.getKey());
              }
            }
          }
        } finally {
          lease.close();
        }
        outcome = lease.outcome();
        if (!removed.isEmpty()) {
          removedPlanes.put(uri, removed);
          removed.forEach(ignored -> metrics.increment("ingest.planes.removed"));
          log.info("Removed stale planes {} of untouched observation {}", removed, uri);
        }
        if (outcome == LeaseOutcome.REMOVED) {
          removedObservations.add(uri);
          log.info("Removed observation {} which has no planes left", uri);
        }
      } catch (StoreException ex) {
        failures.put(uri.uri(), ex.getMessage());
        metrics.increment("ingest.observations.failed");
        log.error("Failed to clean up stale planes of {}", uri, ex);
      }
    }
    return new Cleanup(removedPlanes, removedObservations, failures);
  }

  /**
   * Outcome of the end-of-batch clean-up.
   *
   * @param removedPlanes product ids removed per untouched observation
   * @param removedObservations observations removed because no planes were left
   * @param failures error message per observation URI that could not be cleaned up
   */
  public record Cleanup(
      Map<ObservationUri, List<String>> removedPlanes,
      List<ObservationUri> removedObservations,
      Map<String, String> failures) {
    public Cleanup {
      removedPlanes = Collections.unmodifiableMap(new TreeMap<>(removedPlanes));
      removedObservations = List.copyOf(removedObservations);
      failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }
  }
}
