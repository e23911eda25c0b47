package org.eao.jsa.domain.metadict;

import java.time.Instant;
import java.util.Objects;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * Resolved member of a composite observation.
 *
 * @param observationUri member observation
 * @param interval observing interval of the member
 * @param releaseDate data release date of the member
 * @since 0.1.0
 */
public record MemberRef(ObservationUri observationUri, MemberInterval interval, Instant releaseDate) {
  public MemberRef {
    Objects.requireNonNull(observationUri, "observationUri");
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(releaseDate, "releaseDate");
  }
}
