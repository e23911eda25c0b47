package org.eao.jsa.application.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.eao.jsa.application.port.ClockPort;
import org.eao.jsa.application.port.LeaseOutcome;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.application.port.ObservationLease;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.application.port.RecordStorePort;
import org.eao.jsa.domain.error.IngestException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Writes every aggregated observation of a batch to the record store.
 * <p><strong>Why:</strong> Each observation is read, merged and written under its own lease so
 * that a failure affects only that observation and a repeated batch writes nothing.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check completeness, verify provenance inputs and compute WCS per observation.</li>
 *   <li>Merge the batch into the stored observation and apply stale-record rules.</li>
 *   <li>Record failures per observation, or stop at the first one when fail-fast is set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per batch.</p>
 * <p><strong>Observability:</strong> Counts written, dry-run and failed observations, removed planes and
 * superseded artifacts; records the batch latency.</p>
 *
 * @since 0.1.0
 */
public final class RepositorySynchronizer {
  private static final Logger log = LoggerFactory.getLogger(RepositorySynchronizer.class);

  private final RecordStorePort store;
  private final StaleRecordReconciler reconciler;
  private final ProvenanceResolver provenance;
  private final MetadictAggregator aggregator;
  private final WcsBuilder wcsBuilder;
  private final ObservationAssembler assembler;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ProcessOptions options;
  private final boolean failFast;

  public RepositorySynchronizer(
      RecordStorePort store,
      StaleRecordReconciler reconciler,
      ProvenanceResolver provenance,
      MetadictAggregator aggregator,
      WcsBuilder wcsBuilder,
      ObservationAssembler assembler,
      MetricsPort metrics,
      ClockPort clock,
      ProcessOptions options,
      boolean failFast) {
    this.store = Objects.requireNonNull(store, "store");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.provenance = Objects.requireNonNull(provenance, "provenance");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.wcsBuilder = Objects.requireNonNull(wcsBuilder, "wcsBuilder");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.options = Objects.requireNonNull(options, "options");
    this.failFast = failFast;
  }

  /**
   * Writes the batch.
   *
   * @param metadict aggregated batch after the replacement pass
   * @return what was written, removed and what failed
   * @throws IngestException only in fail-fast mode, for the first observation that fails
   */
  public SyncReport synchronize(Metadict metadict) throws IngestException {
    long started = clock.nowMillis();
    List<Observation> written = new ArrayList<>();
    List<Observation> wouldWrite = new ArrayList<>();
    List<ObservationUri> unchanged = new ArrayList<>();
    Map<ObservationUri, List<String>> removedPlanes = new TreeMap<>();
    List<ObservationUri> removedObservations = new ArrayList<>();
    Map<String, String> failures = new TreeMap<>();
    int superseded = 0;

    for (ObservationRecord record : metadict.observations().values()) {
      String previous = MDC.get("observation");
      MDC.put("observation", record.uri().uri());
      try {
        Outcome outcome = synchronizeOne(metadict, record);
        superseded += outcome.superseded();
        if (!outcome.removedPlanes().isEmpty()) {
          removedPlanes.put(record.uri(), outcome.removedPlanes());
        }
        switch (outcome.lease()) {
          case WRITTEN -> {
            written.add(outcome.observation());
            metrics.increment("ingest.observations.written");
          }
          case DISCARDED -> {
            wouldWrite.add(outcome.observation());
            metrics.increment("ingest.observations.dryRun");
          }
          case REMOVED -> removedObservations.add(record.uri());
          case UNCHANGED -> unchanged.add(record.uri());
          default -> throw new IllegalStateException("unexpected lease outcome " + outcome.lease());
        }
        log.info("Observation {} {}", record.uri(), outcome.lease());
      } catch (IngestException ex) {
        failures.put(record.uri().uri(), ex.getMessage());
        metrics.increment("ingest.observations.failed");
        log.error("Observation {} failed", record.uri(), ex);
        if (failFast) {
          throw ex;
        }
      } finally {
        if (previous == null) {
          MDC.remove("observation");
        } else {
          MDC.put("observation", previous);
        }
      }
    }

    StaleRecordReconciler.Cleanup cleanup = reconciler.finish(metadict, store, options);
    removedPlanes.putAll(cleanup.removedPlanes());
    removedObservations.addAll(cleanup.removedObservations());
    failures.putAll(cleanup.failures());

    metrics.observe("ingest.sync.latencyMs", clock.nowMillis() - started);
    return new SyncReport(written, wouldWrite, unchanged, removedPlanes, removedObservations, superseded, failures);
  }

  private Outcome synchronizeOne(Metadict metadict, ObservationRecord record) throws IngestException {
    aggregator.requireComplete(record);
    provenance.verifyInputs(metadict, record);
    Map<String, Map<String, FileWcs>> wcs = new TreeMap<>();
    for (PlaneRecord plane : record.planes().values()) {
      wcs.put(plane.productId(), wcsBuilder.build(plane));
    }

    ObservationLease lease = store.process(record.uri(), options);
    IngestException failure = null;
    List<String> removed = List.of();
    int superseded = 0;
    Observation observation = null;
    try {
      observation = lease.observationOrCreate(MetadictAggregator.algorithmOf(record));
      assembler.apply(record, observation, wcs);
      removed = reconciler.pruneStalePlanes(observation, record.planes().keySet());
      superseded = reconciler.replaceVersions(lease.stored().orElse(null), observation, record);
    } catch (IngestException ex) {
      lease.discard();
      failure = ex;
    } catch (RuntimeException ex) {
      lease.discard();
      throw ex;
    } finally {
      try {
        lease.close();
      } catch (StoreException closeEx) {
        if (failure != null) {
          failure.addSuppressed(closeEx);
        } else {
          failure = closeEx;
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
    removed.forEach(ignored -> metrics.increment("ingest.planes.removed"));
    for (int i = 0; i < superseded; i++) {
      metrics.increment("ingest.artifacts.superseded");
    }
    return new Outcome(lease.outcome(), observation.copy(), removed, superseded);
  }

  private record Outcome(LeaseOutcome lease, Observation observation, List<String> removedPlanes, int superseded) {}
}
