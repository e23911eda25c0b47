package org.eao.jsa.application.ingest;

import java.util.Objects;
import org.eao.jsa.domain.wcs.ChunkWcs;
import org.eao.jsa.domain.wcs.TemporalWcs;

/**
 * WCS computed for one file of a plane.
 *
 * @param chunk axes derived from the file's own header
 * @param memberTime one time sample per member observation, or {@code null} for non-composite files
 */
public record FileWcs(ChunkWcs chunk, TemporalWcs memberTime) {
  public FileWcs {
    Objects.requireNonNull(chunk, "chunk");
  }

  /** Chunk WCS for a science or noise part: the member time axis replaces the file time axis. */
  public ChunkWcs forDataPart() {
    if (memberTime != null && chunk.hasPosition()) {
      return chunk.withTime(memberTime);
    }
    return chunk;
  }
}
