package org.eao.jsa.application.ingest;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.ArchiveQueryPort.ArtifactPlaneRow;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.domain.error.ProvenanceException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.header.ProvenanceFields;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.PlaneUri;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.domain.naming.FileIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns {@code INPn} plane URIs and {@code PRVn} file names into the input
 * planes of a product.
 * <p><strong>Why:</strong> A product may name files produced earlier in the same batch, so file
 * inputs that are unknown when a header is read get a second chance once every file has been
 * folded into the metadict.</p>
 * <p><strong>Role:</strong> Runs twice per batch: {@link #firstPass} per file and
 * {@link #resolvePending} once at the end.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; bound to one {@link AggregationSession}.</p>
 *
 * @since 0.1.0
 */
public final class ProvenanceResolver {
  private static final Logger log = LoggerFactory.getLogger(ProvenanceResolver.class);
  private static final String TEMPORARY_PREFIX = "oractemp";

  private final ArchiveQueryPort archive;
  private final AggregationSession session;
  private final MetricsPort metrics;

  public ProvenanceResolver(ArchiveQueryPort archive, AggregationSession session, MetricsPort metrics) {
    this.archive = Objects.requireNonNull(archive, "archive");
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Resolves the inputs that are already known when the file is read. File inputs are taken only
   * from files ingested earlier in this batch or met as members; the rest wait for
   * {@link #resolvePending}, since a file may be re-produced by this batch under a new plane.
   *
   * @param fileId file being ingested
   * @param self plane receiving the file
   * @param provenance provenance entries from the header
   * @return input planes plus file ids left for the second pass
   * @throws ProvenanceException when an {@code INPn} entry is not a plane URI
   */
  public ProvenanceInputs firstPass(String fileId, PlaneUri self, ProvenanceFields provenance)
      throws ProvenanceException {
    SortedSet<PlaneUri> planes = new TreeSet<>();
    SortedSet<String> pending = new TreeSet<>();

    for (String entry : provenance.inputPlaneUris()) {
      PlaneUri input;
      try {
        input = PlaneUri.parse(entry);
      } catch (IllegalArgumentException ex) {
        throw new ProvenanceException(fileId + ": input " + entry + " is not a plane URI", ex);
      }
      if (input.equals(self)) {
        log.warn("{}: ignoring input {} which refers to its own plane", fileId, entry);
        continue;
      }
      session.inputCache().putIfAbsent(input.uri(), input);
      planes.add(input);
    }

    for (String entry : provenance.inputFiles()) {
      String inputId = FileIds.fileIdOf(entry);
      if (inputId.startsWith(TEMPORARY_PREFIX)) {
        continue;
      }
      if (inputId.equals(fileId)) {
        log.warn("{}: ignoring provenance file {} which refers to the file itself", fileId, entry);
        continue;
      }
      PlaneUri input = session.inputCache().get(inputId);
      if (input == null) {
        pending.add(inputId);
      } else if (input.equals(self)) {
        log.warn("{}: ignoring provenance file {} which belongs to its own plane", fileId, entry);
      } else {
        planes.add(input);
      }
    }
    return new ProvenanceInputs(planes, pending);
  }

  /**
   * Second pass: resolves file inputs left pending, first against the files ingested in this batch
   * and then against the archive. Files that still cannot be found are dropped with a warning.
   *
   * @param metadict metadict holding every contribution of the batch
   * @throws StoreException when the archive cannot be queried
   */
  public void resolvePending(Metadict metadict) throws StoreException {
    for (ObservationRecord observation : metadict.observations().values()) {
      for (PlaneRecord plane : observation.planes().values()) {
        PlaneUri self = new PlaneUri(metadict.collection(), observation.observationId(), plane.productId());
        Iterator<String> files = plane.fileset().iterator();
        while (files.hasNext()) {
          String inputId = files.next();
          PlaneUri input = session.inputCache().get(inputId);
          if (input == null) {
            input = lookup(inputId);
          }
          if (input == null) {
            log.warn("{}: provenance input file {} could not be resolved to a plane", self, inputId);
          } else if (input.equals(self)) {
            log.warn("{}: ignoring provenance file {} which belongs to its own plane", self, inputId);
          } else {
            plane.inputset().add(input);
          }
          files.remove();
        }
      }
    }
  }

  /**
   * Checks that every input plane of an observation exists, either in this batch or in the archive.
   *
   * @param metadict metadict of the batch
   * @param observation observation whose inputs are checked
   * @throws ProvenanceException when an input plane exists nowhere
   * @throws StoreException when the archive cannot be queried
   */
  public void verifyInputs(Metadict metadict, ObservationRecord observation)
      throws ProvenanceException, StoreException {
    for (PlaneRecord plane : observation.planes().values()) {
      for (PlaneUri input : plane.inputset()) {
        if (session.knownPlanes().contains(input) || producedInBatch(metadict, input)) {
          continue;
        }
        metrics.increment("ingest.queries");
        if (!archive.planeExists(input)) {
          throw new ProvenanceException("input plane " + input + " of " + observation.uri() + "/"
              + plane.productId() + " does not exist");
        }
        session.knownPlanes().add(input);
      }
    }
  }

  private static boolean producedInBatch(Metadict metadict, PlaneUri plane) {
    return metadict.collection().equals(plane.collection())
        && metadict.plane(plane.observationId(), plane.productId()).isPresent();
  }

  private PlaneUri lookup(String inputId) throws StoreException {
    Set<String> collections = new HashSet<>(ArchiveCollections.PROVENANCE_SEARCH);
    collections.add(session.collection());
    metrics.increment("ingest.queries");
    List<ArtifactPlaneRow> rows = archive.planesForFile(collections, inputId);
    PlaneUri found = null;
    for (ArtifactPlaneRow row : rows) {
      String rowFileId = FileIds.fileIdOf(row.artifactUri());
      Map<String, PlaneUri> cache = session.inputCache();
      cache.putIfAbsent(rowFileId, row.plane());
      session.knownPlanes().add(row.plane());
      if (found == null && rowFileId.equals(inputId)) {
        found = row.plane();
      }
    }
    return found;
  }
}
