package org.eao.jsa.infrastructure.metrics;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Metrics export settings taken from the merged configuration, falling back to the standard
 * {@code OTEL_*} environment variables when a key is blank.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public static final TelemetrySettings DISABLED = new TelemetrySettings("none", DEFAULT_ENDPOINT, "");

  public TelemetrySettings {
    exporter = Objects.requireNonNull(exporter, "exporter").trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  public static TelemetrySettings fromConfig(Map<String, String> config) {
    Objects.requireNonNull(config, "config");
    return new TelemetrySettings(
        firstNonBlank(config.get("metricsExporter"), System.getenv("OTEL_METRICS_EXPORTER"), "otlp"),
        firstNonBlank(config.get("otelEndpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT),
        firstNonBlank(config.get("otelResourceAttributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), ""));
  }

  public boolean enabled() {
    return !"none".equals(exporter);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }
}
