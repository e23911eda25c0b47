package org.eao.jsa.application.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.ArchiveQueryPort.MemberPlaneRow;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.domain.error.ProvenanceException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.header.MembershipFields;
import org.eao.jsa.domain.metadict.MemberInterval;
import org.eao.jsa.domain.metadict.MemberRef;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.PlaneUri;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.domain.naming.FileIds;
import org.eao.jsa.domain.naming.ObsIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the {@code MBRn} and {@code OBSn} header entries of a file into
 * member observations of the JCMT collection.
 * <p><strong>Why:</strong> Composite products list their raw observations; the archive supplies
 * each member's time interval and release date.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Look up each member once per batch and cache the answer.</li>
 *   <li>Seed the file-id to plane index with the artifacts of every member plane returned.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; bound to one {@link AggregationSession}.</p>
 *
 * @since 0.1.0
 */
public final class MembershipResolver {
  private static final Logger log = LoggerFactory.getLogger(MembershipResolver.class);
  private static final String RAW_PREFIX = "raw";

  private final ArchiveQueryPort archive;
  private final AggregationSession session;
  private final MetricsPort metrics;

  public MembershipResolver(ArchiveQueryPort archive, AggregationSession session, MetricsPort metrics) {
    this.archive = Objects.requireNonNull(archive, "archive");
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Resolves every member listed by a file.
   *
   * @param fileId file being ingested, used in messages
   * @param membership member entries from the header
   * @return resolved members; {@link MembershipResult#EMPTY} when the file lists none
   * @throws ProvenanceException when a member cannot be found or is ambiguous
   * @throws StoreException when the archive cannot be queried
   */
  public MembershipResult resolve(String fileId, MembershipFields membership)
      throws ProvenanceException, StoreException {
    Objects.requireNonNull(membership, "membership");
    if (membership.size() == 0) {
      return MembershipResult.EMPTY;
    }
    List<MemberRef> refs = new ArrayList<>();
    for (String entry : membership.memberUris()) {
      refs.add(memberByUri(fileId, entry));
    }
    for (String entry : membership.memberSubsystemIds()) {
      refs.add(memberBySubsystem(fileId, entry));
    }

    SortedSet<ObservationUri> members = new TreeSet<>();
    SortedMap<ObservationUri, MemberInterval> intervals = new TreeMap<>();
    Instant latest = null;
    for (MemberRef ref : refs) {
      members.add(ref.observationUri());
      intervals.put(ref.observationUri(), ref.interval());
      if (latest == null || ref.releaseDate().isAfter(latest)) {
        latest = ref.releaseDate();
      }
    }
    log.debug("{}: resolved {} members, latest release {}", fileId, members.size(), latest);
    return new MembershipResult(members, intervals, latest);
  }

  private MemberRef memberByUri(String fileId, String entry) throws ProvenanceException, StoreException {
    MemberRef cached = session.memberCache().get(entry);
    if (cached != null) {
      return cached;
    }
    ObservationUri uri;
    try {
      uri = ObservationUri.parse(entry);
    } catch (IllegalArgumentException ex) {
      throw new ProvenanceException(fileId + ": member " + entry + " is not an observation URI", ex);
    }
    if (!ArchiveCollections.JCMT.equals(uri.collection())) {
      throw new ProvenanceException(fileId + ": member " + entry + " must be in collection JCMT");
    }
    metrics.increment("ingest.queries");
    List<MemberPlaneRow> rows = archive.memberPlanes(ArchiveCollections.JCMT, uri.observationId());
    seedInputCache(rows);
    MemberRef ref = firstRawPlane(uri.observationId(), rows)
        .orElseThrow(() -> new ProvenanceException(
            fileId + ": member " + entry + " was not found in the archive"));
    session.memberCache().put(entry, ref);
    return ref;
  }

  private MemberRef memberBySubsystem(String fileId, String entry)
      throws ProvenanceException, StoreException {
    MemberRef cached = session.memberCache().get(entry);
    if (cached != null) {
      return cached;
    }
    String pattern = ObsIds.memberSearchPattern(entry)
        .orElseThrow(() -> new ProvenanceException(
            fileId + ": OBSn entry " + entry + " is not a recognised subsystem observation id"));
    metrics.increment("ingest.queries");
    List<MemberPlaneRow> rows = archive.memberPlanesLike(ArchiveCollections.JCMT, pattern);
    TreeSet<String> observationIds = new TreeSet<>();
    for (MemberPlaneRow row : rows) {
      observationIds.add(row.observationId());
    }
    if (observationIds.size() > 1) {
      throw new ProvenanceException(fileId + ": OBSn entry " + entry
          + " matches more than one observation: " + observationIds);
    }
    seedInputCache(rows);
    String observationId = observationIds.isEmpty() ? null : observationIds.first();
    MemberRef ref = (observationId == null ? Optional.<MemberRef>empty() : firstRawPlane(observationId, rows))
        .orElseThrow(() -> new ProvenanceException(
            fileId + ": OBSn entry " + entry + " was not found in the archive"));
    session.memberCache().put(entry, ref);
    return ref;
  }

  private static Optional<MemberRef> firstRawPlane(String observationId, List<MemberPlaneRow> rows) {
    for (MemberPlaneRow row : rows) {
      if (row.observationId().equals(observationId)
          && row.productId().startsWith(RAW_PREFIX)
          && row.complete()) {
        return Optional.of(new MemberRef(
            new ObservationUri(ArchiveCollections.JCMT, observationId),
            new MemberInterval(row.startMjd(), row.endMjd()),
            row.releaseDate()));
      }
    }
    return Optional.empty();
  }

  private void seedInputCache(List<MemberPlaneRow> rows) {
    for (MemberPlaneRow row : rows) {
      PlaneUri plane = new PlaneUri(ArchiveCollections.JCMT, row.observationId(), row.productId());
      session.inputCache().putIfAbsent(plane.uri(), plane);
      for (String artifactUri : row.artifactUris()) {
        session.inputCache().putIfAbsent(FileIds.fileIdOf(artifactUri), plane);
      }
      session.knownPlanes().add(plane);
    }
  }
}
