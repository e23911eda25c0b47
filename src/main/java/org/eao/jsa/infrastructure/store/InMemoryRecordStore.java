package org.eao.jsa.infrastructure.store;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.RecordStorePort;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.domain.model.PlaneUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Record store and archive query adapter holding observations in memory.
 * <p><strong>Why:</strong> Serves as the backing index of the JSON directory store and as the
 * archive double in tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Copy observations on the way in and out so callers never share state with the store.</li>
 *   <li>Answer archive queries by scanning stored plane attributes and artifact URIs.</li>
 *   <li>Grant at most one holder per observation through a per-URI lock.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe.</p>
 *
 * @since 0.1.0
 */
public class InMemoryRecordStore implements RecordStorePort, ArchiveQueryPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

  private final Map<ObservationUri, Observation> observations = new ConcurrentSkipListMap<>();
  private final Map<String, ProposalInfo> proposals = new ConcurrentHashMap<>();
  private final Map<ObservationUri, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Override
  public Optional<Observation> get(ObservationUri uri) throws StoreException {
    Observation stored = observations.get(Objects.requireNonNull(uri, "uri"));
    return stored == null ? Optional.empty() : Optional.of(stored.copy());
  }

  @Override
  public void put(Observation observation) throws StoreException {
    Objects.requireNonNull(observation, "observation");
    observations.put(observation.uri(), observation.copy());
  }

  @Override
  public void remove(ObservationUri uri) throws StoreException {
    observations.remove(Objects.requireNonNull(uri, "uri"));
  }

  @Override
  public void lock(ObservationUri uri) throws StoreException {
    locks.computeIfAbsent(uri, ignored -> new ReentrantLock()).lock();
  }

  @Override
  public void unlock(ObservationUri uri) {
    ReentrantLock lock = locks.get(uri);
    if (lock != null && lock.isHeldByCurrentThread()) {
      lock.unlock();
    }
  }

  /** Registers proposal details returned by {@link #proposal(String)}. */
  public void addProposal(String proposalId, String pi, String title) {
    proposals.put(Objects.requireNonNull(proposalId, "proposalId"), new ProposalInfo(pi, title));
  }

  /** Snapshot of every stored observation URI. */
  public List<ObservationUri> uris() {
    return List.copyOf(observations.keySet());
  }

  public int size() {
    return observations.size();
  }

  @Override
  public List<PlaneRunRow> planesSharingRun(String collection, String runId) throws StoreException {
    List<PlaneRunRow> rows = new ArrayList<>();
    for (Observation observation : observations.values()) {
      if (!observation.collection().equals(collection)) {
        continue;
      }
      boolean tagged = observation.planes().values().stream()
          .anyMatch(plane -> runId.equals(plane.runId()));
      if (!tagged) {
        continue;
      }
      for (Plane plane : observation.planes().values()) {
        rows.add(new PlaneRunRow(collection, observation.observationId(), plane.productId(), plane.runId()));
      }
    }
    return rows;
  }

  @Override
  public List<MemberPlaneRow> memberPlanes(String collection, String observationId) throws StoreException {
    Observation observation = observations.get(new ObservationUri(collection, observationId));
    return observation == null ? List.of() : memberRows(observation);
  }

  @Override
  public List<MemberPlaneRow> memberPlanesLike(String collection, String observationIdPattern)
      throws StoreException {
    Pattern pattern = likePattern(observationIdPattern);
    List<MemberPlaneRow> rows = new ArrayList<>();
    for (Observation observation : observations.values()) {
      if (observation.collection().equals(collection)
          && pattern.matcher(observation.observationId()).matches()) {
        rows.addAll(memberRows(observation));
      }
    }
    return rows;
  }

  @Override
  public List<ArtifactPlaneRow> planesForFile(Set<String> collections, String fileId) throws StoreException {
    List<ArtifactPlaneRow> rows = new ArrayList<>();
    for (Observation observation : observations.values()) {
      if (!collections.contains(observation.collection())) {
        continue;
      }
      for (Plane plane : observation.planes().values()) {
        plane.artifacts().values().stream()
            .filter(artifact -> artifact.fileId().equals(fileId))
            .forEach(artifact -> rows.add(new ArtifactPlaneRow(
                new PlaneUri(observation.collection(), observation.observationId(), plane.productId()),
                artifact.uri())));
      }
    }
    return rows;
  }

  @Override
  public boolean planeExists(PlaneUri plane) throws StoreException {
    Observation observation = observations.get(plane.observationUri());
    return observation != null && observation.planes().containsKey(plane.productId());
  }

  @Override
  public Optional<ProposalInfo> proposal(String proposalId) throws StoreException {
    return Optional.ofNullable(proposals.get(proposalId));
  }

  private static List<MemberPlaneRow> memberRows(Observation observation) {
    List<MemberPlaneRow> rows = new ArrayList<>();
    for (Plane plane : observation.planes().values()) {
      rows.add(new MemberPlaneRow(
          observation.observationId(),
          plane.productId(),
          parseDouble(plane.attributes().get(PlaneKeys.TIME_LOWER)),
          parseDouble(plane.attributes().get(PlaneKeys.TIME_UPPER)),
          parseInstant(plane.attributes().get(PlaneKeys.PLANE_DATA_RELEASE)),
          List.copyOf(plane.artifacts().keySet())));
    }
    return rows;
  }

  static Pattern likePattern(String like) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : like.toCharArray()) {
      if (c == '%' || c == '_') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '%' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static Double parseDouble(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException ex) {
      log.warn("Ignoring unreadable time bound {}", value);
      return null;
    }
  }

  private static Instant parseInstant(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      log.warn("Ignoring unreadable release date {}", value);
      return null;
    }
  }
}
