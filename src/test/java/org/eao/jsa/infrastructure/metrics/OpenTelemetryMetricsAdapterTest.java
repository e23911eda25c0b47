package org.eao.jsa.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("jsa.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAndServiceResource() {
    adapter.increment("ingest.files.read");
    adapter.increment("ingest.files.read");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "ingest.files.read");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("ingest.files.read", point.getAttributes().get(KEY));
    assertEquals("jsa-ingest", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.eao", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsLatencyHistogramInMilliseconds() {
    adapter.observe("ingest.sync.latencyMs", 120);
    adapter.observe("ingest.sync.latencyMs", 30);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "ingest.sync.latencyMs");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(150.0, point.getSum());
  }

  @Test
  void sanitizeNameKeepsInstrumentNamesValid() {
    assertEquals("ingest.files.read", OpenTelemetryMetricsAdapter.sanitizeName("ingest.files.read"));
    assertEquals("m9_planes_removed", OpenTelemetryMetricsAdapter.sanitizeName("9 planes/removed"));
    assertEquals("jsa.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " was not exported"));
  }

  @Test
  void disabledSettingsGiveNoopAdapter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.DISABLED)) {
      noop.increment("ingest.files.read");
      assertTrue(noop.isNoop());
    }
  }
}
