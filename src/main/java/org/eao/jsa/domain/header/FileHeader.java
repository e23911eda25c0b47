package org.eao.jsa.domain.header;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Metadata of one input file as delivered by a header source.
 *
 * @param fileId archive file id
 * @param fileName original file name, used for the artifact content type
 * @param primary primary header, keyword to value
 * @param firstExtension first extension header of catalog-like files, or {@code null}
 * @param mocAreaSqDeg area of the file's coverage map in square degrees, or {@code null}
 * @since 0.1.0
 */
public record FileHeader(
    String fileId,
    String fileName,
    Map<String, Object> primary,
    Map<String, Object> firstExtension,
    Double mocAreaSqDeg) {

  public FileHeader {
    Objects.requireNonNull(fileId, "fileId");
    Objects.requireNonNull(fileName, "fileName");
    primary = Map.copyOf(Objects.requireNonNull(primary, "primary"));
    firstExtension = firstExtension == null ? null : Map.copyOf(firstExtension);
  }

  public HeaderValues values() {
    return new HeaderValues(primary);
  }

  public Optional<HeaderValues> extensionValues() {
    return firstExtension == null ? Optional.empty() : Optional.of(new HeaderValues(firstExtension));
  }

  public OptionalDouble mocArea() {
    return mocAreaSqDeg == null ? OptionalDouble.empty() : OptionalDouble.of(mocAreaSqDeg);
  }
}
