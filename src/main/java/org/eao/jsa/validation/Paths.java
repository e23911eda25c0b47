package org.eao.jsa.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for the directories the ingestion CLI reads and writes.
 * <p><strong>Why:</strong> Fails early with a clear message instead of partway through a batch.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves an existing readable directory.
   *
   * @param name label used in exception messages
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDirectory(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    try {
      Path real = path.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " must be an existing directory: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to access " + name + ": " + path, ex);
    }
  }

  /**
   * Validates a writable directory, creating it when requested.
   *
   * @param name label used in exception messages
   * @param path candidate directory
   * @param createIfMissing whether to create the directory and its parents
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path ensureWritableDirectory(String name, Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.notExists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!createIfMissing) {
        throw new IllegalArgumentException(name + " does not exist: " + normalized);
      }
      try {
        Files.createDirectories(normalized);
      } catch (IOException ex) {
        throw new IllegalArgumentException("Unable to create " + name + ": " + normalized, ex);
      }
    }
    if (!Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " must be a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    return normalized;
  }
}
