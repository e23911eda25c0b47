package org.eao.jsa.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {

  @Test
  void configValuesWinAndAreNormalized() {
    TelemetrySettings settings = TelemetrySettings.fromConfig(Map.of(
        "metricsExporter", " NONE ",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals("none", settings.exporter());
    assertFalse(settings.enabled());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("deployment.environment=test", settings.resourceAttributes());
  }

  @Test
  void blankEndpointFallsBackToLocalCollector() {
    TelemetrySettings settings = new TelemetrySettings("otlp", " ", null);

    assertTrue(settings.enabled());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
  }

  @Test
  void resourceAttributesSkipMalformedTokens() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("site=jcmt, broken, =x, team = jsa");

    assertEquals(2, attributes.size());
    assertEquals("jcmt", attributes.get(AttributeKey.stringKey("site")));
    assertEquals("jsa", attributes.get(AttributeKey.stringKey("team")));
  }
}
