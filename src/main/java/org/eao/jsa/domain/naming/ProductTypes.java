package org.eao.jsa.domain.naming;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parsed {@code PRODTYPE} declaration such as {@code 0=science,1=noise,auxiliary}: product types
 * for numbered extensions plus a default for the file.
 *
 * @since 0.1.0
 */
public final class ProductTypes {
  public static final Set<String> OPTIONS = Set.of(
      "science", "calibration", "preview", "info", "catalog", "noise", "weight", "auxiliary");

  private final Map<Integer, String> extensions;
  private final String fileDefault;

  private ProductTypes(Map<Integer, String> extensions, String fileDefault) {
    this.extensions = Collections.unmodifiableMap(extensions);
    this.fileDefault = fileDefault;
  }

  /**
   * Parses a declaration.
   *
   * @param declaration comma-separated entries, {@code n=type} or a bare default {@code type}
   * @return parsed declaration
   * @throws IllegalArgumentException when an entry is malformed or no type is declared
   */
  public static ProductTypes parse(String declaration) {
    Map<Integer, String> extensions = new TreeMap<>();
    String fileDefault = null;
    for (String raw : declaration.split(",")) {
      String entry = raw.trim().toLowerCase(Locale.ROOT);
      if (entry.isEmpty()) {
        continue;
      }
      int eq = entry.indexOf('=');
      if (eq < 0) {
        fileDefault = requireOption(entry, declaration);
        continue;
      }
      String ext = entry.substring(0, eq).trim();
      String type = requireOption(entry.substring(eq + 1).trim(), declaration);
      try {
        extensions.put(Integer.parseInt(ext), type);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("extension number '" + ext + "' in PRODTYPE '"
            + declaration + "' is not an integer", ex);
      }
    }
    if (extensions.isEmpty() && fileDefault == null) {
      throw new IllegalArgumentException("PRODTYPE '" + declaration + "' declares no product type");
    }
    return new ProductTypes(extensions, fileDefault);
  }

  /** Types by extension number, ascending. */
  public Map<Integer, String> extensions() {
    return extensions;
  }

  /** Type of the file as a whole, or {@code null}. */
  public String fileDefault() {
    return fileDefault;
  }

  private static String requireOption(String type, String declaration) {
    if (!OPTIONS.contains(type)) {
      throw new IllegalArgumentException("product type '" + type + "' in PRODTYPE '" + declaration
          + "' must be one of " + new TreeSet<>(OPTIONS));
    }
    return type;
  }
}
