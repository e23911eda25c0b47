package org.eao.jsa.domain.naming;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File identifiers and the version suffix carried by versioned processed products.
 *
 * @since 0.1.0
 */
public final class FileIds {
  private static final Pattern VERSIONED = Pattern.compile("^(.*)_(\\d{3})$");

  private FileIds() {}

  /**
   * Derives the archive file id from a path or file name: the base name without directory,
   * compression suffix or extension.
   *
   * @param path file path or name
   * @return file id
   */
  public static String fileIdOf(String path) {
    String name = path;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    for (String compression : new String[] {".gz", ".bz2", ".fz"}) {
      if (name.endsWith(compression)) {
        name = name.substring(0, name.length() - compression.length());
      }
    }
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /**
   * Splits a versioned file id such as {@code jcmts20140322_00034_850_reduced_001}.
   *
   * @param fileId file id
   * @return base name and version, empty when the id carries no 3-digit version suffix
   */
  public static Optional<Versioned> versioned(String fileId) {
    Matcher m = VERSIONED.matcher(fileId);
    if (!m.matches()) {
      return Optional.empty();
    }
    return Optional.of(new Versioned(m.group(1), Integer.parseInt(m.group(2))));
  }

  /**
   * Versioned file id.
   *
   * @param baseName file id without the version suffix
   * @param version numeric version
   */
  public record Versioned(String baseName, int version) {}
}
