package org.eao.jsa.application.ingest;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.eao.jsa.application.port.ArchiveQueryPort.ProposalInfo;
import org.eao.jsa.domain.metadict.MemberRef;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * State shared by the resolvers for the duration of one ingestion batch.
 *
 * <p>Holds the metadict being built together with caches that keep the archive from being asked
 * the same question twice: member lookups, the file-id to plane index fed by member queries and
 * input lookups, planes already verified to exist, and proposal details.
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe; a batch is processed on one thread.</p>
 */
public final class AggregationSession {
  private final Metadict metadict;
  private final Map<String, MemberRef> memberCache = new HashMap<>();
  private final Map<String, PlaneUri> inputCache = new HashMap<>();
  private final Set<PlaneUri> knownPlanes = new HashSet<>();
  private final Map<String, Optional<ProposalInfo>> proposals = new HashMap<>();

  public AggregationSession(String collection) {
    this.metadict = new Metadict(Objects.requireNonNull(collection, "collection"));
  }

  public String collection() {
    return metadict.collection();
  }

  public Metadict metadict() {
    return metadict;
  }

  /** Member references keyed by the raw {@code MBRn} or {@code OBSn} header value. */
  public Map<String, MemberRef> memberCache() {
    return memberCache;
  }

  /** Plane that produced a file, keyed by file id or by plane URI text. */
  public Map<String, PlaneUri> inputCache() {
    return inputCache;
  }

  public Set<PlaneUri> knownPlanes() {
    return knownPlanes;
  }

  public Map<String, Optional<ProposalInfo>> proposals() {
    return proposals;
  }
}
