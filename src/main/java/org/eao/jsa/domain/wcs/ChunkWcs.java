package org.eao.jsa.domain.wcs;

/**
 * Coordinate summary attached to one chunk; each axis may be absent.
 *
 * @since 0.1.0
 */
public record ChunkWcs(SpatialWcs position, SpectralWcs energy, TemporalWcs time) {

  public static final ChunkWcs EMPTY = new ChunkWcs(null, null, null);

  public boolean hasPosition() {
    return position != null;
  }

  public ChunkWcs withTime(TemporalWcs replacement) {
    return new ChunkWcs(position, energy, replacement);
  }

  public boolean isEmpty() {
    return position == null && energy == null && time == null;
  }
}
