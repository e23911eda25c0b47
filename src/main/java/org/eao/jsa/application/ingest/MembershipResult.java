package org.eao.jsa.application.ingest;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.eao.jsa.domain.metadict.MemberInterval;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * Members of one file together with their time intervals and the latest member release date.
 *
 * @param members member observation URIs
 * @param intervals member observation time intervals
 * @param latestRelease latest release date over all members, or {@code null} without members
 */
public record MembershipResult(
    SortedSet<ObservationUri> members,
    SortedMap<ObservationUri, MemberInterval> intervals,
    Instant latestRelease) {

  public static final MembershipResult EMPTY = new MembershipResult(new TreeSet<>(), new TreeMap<>(), null);

  public MembershipResult {
    members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    intervals = Collections.unmodifiableSortedMap(new TreeMap<>(intervals));
  }

  public int size() {
    return members.size();
  }
}
