package org.eao.jsa.domain.wcs;

import java.util.List;

/**
 * Time coverage of a chunk as MJD (UTC) ranges.
 *
 * @param samples covered ranges sorted by start; one range for a single observation, one per
 *     member for composites
 * @param exposureSeconds total exposure
 * @since 0.1.0
 */
public record TemporalWcs(List<CoordRange> samples, double exposureSeconds) {
  public static final String TIMESYS = "UTC";

  public TemporalWcs {
    samples = List.copyOf(samples);
  }

  /** Full span covered by all samples. */
  public CoordRange span() {
    double start = Double.POSITIVE_INFINITY;
    double end = Double.NEGATIVE_INFINITY;
    for (CoordRange sample : samples) {
      start = Math.min(start, sample.start());
      end = Math.max(end, sample.end());
    }
    return new CoordRange(start, end);
  }
}
