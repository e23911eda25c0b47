package org.eao.jsa.infrastructure.json;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.validation.Paths;

/**
 * Writes observations as {@code <collection>_<observationId>.json} files into one directory.
 *
 * <p>Each file is written to a temporary sibling first and moved into place, so readers never see a
 * partial document.</p>
 *
 * @since 0.1.0
 */
public final class ObservationJsonWriter {
  private final Path directory;
  private final ObservationJsonCodec codec;

  /**
   * @param directory output directory, created when missing
   * @param codec observation codec
   * @throws IllegalArgumentException when the directory is not writable
   */
  public ObservationJsonWriter(Path directory, ObservationJsonCodec codec) {
    this.directory = Paths.ensureWritableDirectory("out", directory, true);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Path directory() {
    return directory;
  }

  /** File that holds {@code uri} inside the output directory. */
  public Path fileFor(ObservationUri uri) {
    return directory.resolve(uri.collection() + "_" + uri.observationId() + ".json");
  }

  /**
   * Writes one observation, replacing any earlier file for it.
   *
   * @param observation observation to write
   * @return written file
   * @throws IOException when the file cannot be written
   */
  public Path write(Observation observation) throws IOException {
    Path target = fileFor(observation.uri());
    Path temp = Files.createTempFile(directory, ".obs-", ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp)) {
        codec.write(observation, out);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      return target;
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }
}
