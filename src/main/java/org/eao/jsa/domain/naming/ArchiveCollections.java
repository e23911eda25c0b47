package org.eao.jsa.domain.naming;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Archive collections this ingestion accepts and the relationships between them.
 *
 * @since 0.1.0
 */
public final class ArchiveCollections {
  public static final String JCMT = "JCMT";
  public static final String JCMTLS = "JCMTLS";
  public static final String JCMTUSER = "JCMTUSER";
  public static final String SANDBOX = "SANDBOX";

  public static final Set<String> ALL = Set.of(JCMT, JCMTLS, JCMTUSER, SANDBOX);
  public static final Set<String> EXTERNAL = Set.of(JCMTLS, JCMTUSER);

  /** Collections searched when a provenance file name has to be looked up in the archive. */
  public static final Set<String> PROVENANCE_SEARCH = Set.of(JCMT, JCMTLS, JCMTUSER);

  private ArchiveCollections() {}

  /**
   * Normalizes and checks a collection name.
   *
   * @param raw configured name
   * @return upper-case collection name
   * @throws IllegalArgumentException for unknown collections
   */
  public static String requireKnown(String raw) {
    String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    if (!ALL.contains(normalized)) {
      throw new IllegalArgumentException(
          "collection must be one of " + new TreeSet<>(ALL) + " (was '" + raw + "')");
    }
    return normalized;
  }

  /**
   * Whether a file declaring {@code instream} may be ingested into {@code collection}.
   *
   * @param collection target collection
   * @param instream value of the file's {@code INSTREAM} header
   * @return {@code true} when allowed
   */
  public static boolean acceptsInstream(String collection, String instream) {
    if (instream == null) {
      return false;
    }
    String normalized = instream.trim().toUpperCase(Locale.ROOT);
    if (SANDBOX.equals(collection)) {
      return ALL.contains(normalized);
    }
    return collection.equals(normalized);
  }

  public static boolean isExternal(String instream) {
    return instream != null && EXTERNAL.contains(instream);
  }
}
