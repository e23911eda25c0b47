package org.eao.jsa.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.validation.Strings;

/**
 * Immutable configuration of one ingestion run.
 *
 * @param mode run mode
 * @param collection archive collection receiving the observations
 * @param headers directory holding one JSON header file per FITS file
 * @param store directory holding the stored observations
 * @param out optional directory receiving every written observation
 * @param dryRun compute everything but write nothing
 * @param allowRemove allow an observation to be removed when its last plane goes
 * @param failFast stop at the first observation that fails to write
 * @param recipeInstanceMapping optional file of run-id aliases
 * @since 0.1.0
 */
public record IngestConfig(
    IngestMode mode,
    String collection,
    Path headers,
    Path store,
    Optional<Path> out,
    boolean dryRun,
    boolean allowRemove,
    boolean failFast,
    Optional<Path> recipeInstanceMapping) {

  public IngestConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(store, "store");
    out = out == null ? Optional.empty() : out;
    recipeInstanceMapping = recipeInstanceMapping == null ? Optional.empty() : recipeInstanceMapping;
  }

  /**
   * Builds a configuration from a flat, merged key/value map.
   *
   * @param mode run mode
   * @param args merged configuration values
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static IngestConfig fromMap(IngestMode mode, Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String collection = ArchiveCollections.requireKnown(
        Strings.requireNonBlank("collection", args.get("collection")));
    Path headers = Path.of(Strings.requireNonBlank("headers", args.get("headers")));
    Path store = Path.of(Strings.requireNonBlank("store", args.get("store")));
    boolean dryRun = parseBoolean("dryRun", args.get("dryRun"), mode == IngestMode.CHECK);
    return new IngestConfig(
        mode,
        collection,
        headers,
        store,
        optionalPath(args.get("out")),
        dryRun,
        parseBoolean("allowRemove", args.get("allowRemove"), false),
        parseBoolean("failFast", args.get("failFast"), false),
        optionalPath(args.get("recipeInstanceMapping")));
  }

  private static Optional<Path> optionalPath(String value) {
    String trimmed = Strings.trimToNull(value);
    return trimmed == null ? Optional.empty() : Optional.of(Path.of(trimmed));
  }

  private static boolean parseBoolean(String key, String value, boolean defaultValue) {
    String trimmed = Strings.trimToNull(value);
    if (trimmed == null) {
      return defaultValue;
    }
    return switch (trimmed.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
