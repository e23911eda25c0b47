package org.eao.jsa.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(IngestMode.INGEST);
    Map<String, String> yaml = Map.of("collection", "JCMTLS", "store", "/data/store");
    Map<String, String> cli = Map.of("collection", "SANDBOX");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        IngestMode.INGEST, Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("SANDBOX", merged.get("collection"));
    assertEquals("/data/store", merged.get("store"));
    assertEquals("./headers", merged.get("headers"));
    assertEquals(List.of("CLI overrides YAML for key: collection"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(IngestMode.CHECK,
        Optional.of(Map.of("dryRun", "false")), Map.of(), DefaultsForMode.asFlatMap(IngestMode.CHECK),
        warnings::add);

    assertEquals("false", merged.get("dryRun"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void unknownMetricsExporterIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(IngestMode.INGEST, Optional.empty(),
            Map.of("metricsExporter", "prometheus"), Map.of(), msg -> {}));
    assertTrue(ex.getMessage().contains("prometheus"));
  }
}
