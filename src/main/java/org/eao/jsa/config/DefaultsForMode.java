package org.eao.jsa.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each ingestion mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target mode
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(IngestMode mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode) {
      case INGEST -> Map.of("dryRun", "false");
      case CHECK -> Map.of("dryRun", "true");
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("collection", "JCMT");
    map.put("headers", "./headers");
    map.put("store", "./store");
    map.put("out", "");
    map.put("allowRemove", "false");
    map.put("failFast", "false");
    map.put("recipeInstanceMapping", "");
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
