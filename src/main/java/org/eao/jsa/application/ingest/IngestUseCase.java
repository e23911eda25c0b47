package org.eao.jsa.application.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.ClockPort;
import org.eao.jsa.application.port.HeaderSource;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.application.port.RecordStorePort;
import org.eao.jsa.domain.error.IngestException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.header.FileHeader;
import org.eao.jsa.domain.header.HeaderFields;
import org.eao.jsa.domain.metadict.FileContribution;
import org.eao.jsa.domain.model.PlaneUri;
import org.eao.jsa.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one ingestion batch from headers to stored observations.
 * <p><strong>Why:</strong> Ties the pipeline stages together in the order the data requires:
 * every file is extracted, identified and resolved before the batch is aggregated and written.</p>
 * <p><strong>Role:</strong> Application-layer use case invoked by the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Process headers in file-id order so the outcome does not depend on directory listing order.</li>
 *   <li>Reject the whole batch on any per-file problem, unless running as a check.</li>
 *   <li>Run the second provenance pass and the replacement pass before writing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run} invocations.</p>
 * <p><strong>Observability:</strong> Logs batch start, completion and failure with the collection
 * in the MDC; counts files read and rejected.</p>
 *
 * @since 0.1.0
 */
public final class IngestUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestUseCase.class);

  private final String collection;
  private final ArchiveQueryPort archive;
  private final RecordStorePort store;
  private final RunAliases aliases;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ProcessOptions options;
  private final boolean failFast;
  private final boolean checkOnly;

  /**
   * @param collection archive collection being ingested
   * @param archive archive queries for members, inputs, stale planes and proposals
   * @param store record store receiving the observations
   * @param aliases alternative run ids for stale-plane detection
   * @param metrics metrics sink; {@code null} disables metrics
   * @param clock clock used for latency measurement; {@code null} uses the system clock
   * @param options dry-run and removal options for writes
   * @param failFast stop at the first observation that fails to write
   * @param checkOnly report per-file problems and continue instead of rejecting the batch
   */
  public IngestUseCase(
      String collection,
      ArchiveQueryPort archive,
      RecordStorePort store,
      RunAliases aliases,
      MetricsPort metrics,
      ClockPort clock,
      ProcessOptions options,
      boolean failFast,
      boolean checkOnly) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.archive = Objects.requireNonNull(archive, "archive");
    this.store = Objects.requireNonNull(store, "store");
    this.aliases = aliases == null ? RunAliases.NONE : aliases;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.options = Objects.requireNonNull(options, "options");
    this.failFast = failFast;
    this.checkOnly = checkOnly;
  }

  /**
   * Runs the batch.
   *
   * @param source headers to ingest
   * @return batch report
   * @throws IOException when the headers cannot be read
   * @throws ValidationException when a file is rejected outside a check run
   * @throws IngestException when the archive cannot be queried or, in fail-fast mode, a write fails
   */
  public IngestReport run(HeaderSource source) throws IOException, IngestException {
    Objects.requireNonNull(source, "source");
    String previousCollection = MDC.get("collection");
    String previousMode = MDC.get("mode");
    MDC.put("collection", collection);
    MDC.put("mode", checkOnly ? "check" : "ingest");
    try {
      log.info("Ingestion of collection {} started{}", collection, options.dryRun() ? " (dry run)" : "");
      IngestReport report = runBatch(source);
      log.info("Ingestion of collection {} completed: {} files, {} rejected", collection,
          report.filesRead(), report.rejected().size());
      return report;
    } catch (IOException | IngestException | RuntimeException ex) {
      log.error("Ingestion of collection {} failed", collection, ex);
      throw ex;
    } finally {
      restore("collection", previousCollection);
      restore("mode", previousMode);
    }
  }

  private IngestReport runBatch(HeaderSource source) throws IOException, IngestException {
    List<FileHeader> headers = new ArrayList<>(source.readAll());
    headers.sort(Comparator.comparing(FileHeader::fileId));

    AggregationSession session = new AggregationSession(collection);
    HeaderExtractor extractor = new HeaderExtractor(collection);
    IdentifierResolver identifiers = new IdentifierResolver(collection);
    MembershipResolver membership = new MembershipResolver(archive, session, metrics);
    ProvenanceResolver provenance = new ProvenanceResolver(archive, session, metrics);
    ContributionBuilder contributions = new ContributionBuilder(archive, session, metrics);
    MetadictAggregator aggregator = new MetadictAggregator();
    StaleRecordReconciler reconciler = new StaleRecordReconciler(collection, archive, aliases, metrics);

    Map<String, List<String>> rejected = new LinkedHashMap<>();
    for (FileHeader header : headers) {
      metrics.increment("ingest.files.read");
      String previousFile = MDC.get("fileId");
      MDC.put("fileId", header.fileId());
      try {
        HeaderFields fields = extractor.extract(header);
        PlaneIdentity identity = identifiers.resolve(fields);
        reconciler.registerRun(fields.provenance().runId());
        MembershipResult members = membership.resolve(fields.fileId(), fields.membership());
        PlaneUri self = identity.planeUri();
        ProvenanceInputs inputs = provenance.firstPass(fields.fileId(), self, fields.provenance());
        FileContribution contribution = contributions.build(fields, identity, members, inputs);
        aggregator.fold(session.metadict(), contribution);
        // only files that made it into the metadict can be inputs of other files
        session.inputCache().put(fields.fileId(), self);
      } catch (StoreException ex) {
        throw ex;
      } catch (ValidationException ex) {
        reject(rejected, header.fileId(), ex.problems(), ex);
      } catch (IngestException ex) {
        reject(rejected, header.fileId(), List.of(ex.getMessage()), ex);
      } finally {
        restore("fileId", previousFile);
      }
    }

    if (!rejected.isEmpty() && !checkOnly) {
      List<String> problems = new ArrayList<>();
      rejected.forEach((fileId, list) -> list.forEach(problem -> problems.add(fileId + ": " + problem)));
      throw new ValidationException("batch", problems);
    }

    provenance.resolvePending(session.metadict());
    aggregator.finish(session.metadict());
    log.info("Aggregated {} observations with {} planes", session.metadict().observations().size(),
        session.metadict().planeCount());

    RepositorySynchronizer synchronizer = new RepositorySynchronizer(store, reconciler, provenance,
        aggregator, new WcsBuilder(), new ObservationAssembler(), metrics, clock, options, failFast);
    SyncReport sync = synchronizer.synchronize(session.metadict());
    return new IngestReport(headers.size(), rejected, sync);
  }

  private void reject(Map<String, List<String>> rejected, String fileId, List<String> problems, Exception ex) {
    rejected.put(fileId, problems);
    metrics.increment("ingest.files.rejected");
    log.error("File {} rejected: {}", fileId, Logs.truncate(ex.getMessage(), 2000));
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
