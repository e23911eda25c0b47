package org.eao.jsa.domain.model;

import java.util.Objects;
import org.eao.jsa.domain.wcs.ChunkWcs;

/**
 * Smallest unit of a stored artifact, carrying its coordinate summary.
 *
 * @since 0.1.0
 */
public record Chunk(ChunkWcs wcs) {
  public Chunk {
    Objects.requireNonNull(wcs, "wcs");
  }
}
