package org.eao.jsa.application.port;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * Read-only queries against the archive, used to resolve references the batch cannot satisfy
 * by itself.
 *
 * <p>Every call is a blocking round trip; callers cache results for the duration of a run.</p>
 *
 * @since 0.1.0
 */
public interface ArchiveQueryPort {

  /**
   * Planes of every observation that holds at least one plane tagged with {@code runId}.
   *
   * @param collection collection to search
   * @param runId provenance run id
   * @return one row per plane, with that plane's own run id
   * @throws StoreException when the query fails
   */
  List<PlaneRunRow> planesSharingRun(String collection, String runId) throws StoreException;

  /**
   * Planes of one observation with their time bounds and release date.
   *
   * @param collection collection of the observation
   * @param observationId observation id
   * @return matching planes, possibly empty
   * @throws StoreException when the query fails
   */
  List<MemberPlaneRow> memberPlanes(String collection, String observationId) throws StoreException;

  /**
   * Planes of observations whose id matches an SQL {@code LIKE} pattern.
   *
   * @param collection collection to search
   * @param observationIdPattern pattern with {@code %} wildcards
   * @return matching planes, possibly empty
   * @throws StoreException when the query fails
   */
  List<MemberPlaneRow> memberPlanesLike(String collection, String observationIdPattern)
      throws StoreException;

  /**
   * Planes holding an artifact with the given file id.
   *
   * @param collections collections to search
   * @param fileId file id
   * @return matching planes, possibly empty
   * @throws StoreException when the query fails
   */
  List<ArtifactPlaneRow> planesForFile(Set<String> collections, String fileId) throws StoreException;

  /**
   * Whether a plane exists.
   *
   * @param plane plane reference
   * @return {@code true} when stored
   * @throws StoreException when the query fails
   */
  boolean planeExists(PlaneUri plane) throws StoreException;

  /**
   * Looks up the principal investigator and title of a proposal.
   *
   * @param proposalId proposal id
   * @return proposal details, empty when unknown
   * @throws StoreException when the query fails
   */
  Optional<ProposalInfo> proposal(String proposalId) throws StoreException;

  /**
   * Plane tagged with a run id.
   *
   * @param collection collection
   * @param observationId observation id
   * @param productId product id
   * @param runId run id of this plane, may be {@code null}
   */
  record PlaneRunRow(String collection, String observationId, String productId, String runId) {}

  /**
   * Plane of a candidate member observation.
   *
   * @param observationId observation id
   * @param productId product id
   * @param startMjd time lower bound, may be {@code null}
   * @param endMjd time upper bound, may be {@code null}
   * @param releaseDate data release date, may be {@code null}
   * @param artifactUris artifact URIs of the plane
   */
  record MemberPlaneRow(
      String observationId,
      String productId,
      Double startMjd,
      Double endMjd,
      Instant releaseDate,
      List<String> artifactUris) {

    public MemberPlaneRow {
      artifactUris = List.copyOf(artifactUris);
    }

    /** Whether interval and release date are all known. */
    public boolean complete() {
      return startMjd != null && endMjd != null && releaseDate != null;
    }
  }

  /**
   * Plane holding a given file.
   *
   * @param plane plane reference
   * @param artifactUri matching artifact
   */
  record ArtifactPlaneRow(PlaneUri plane, String artifactUri) {}

  /**
   * Proposal details.
   *
   * @param pi principal investigator
   * @param title title
   */
  record ProposalInfo(String pi, String title) {}
}
