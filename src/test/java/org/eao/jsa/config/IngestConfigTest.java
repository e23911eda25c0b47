package org.eao.jsa.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IngestConfigTest {

  @Test
  void fromMapNormalizesCollectionAndParsesOptions() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(IngestMode.INGEST));
    args.put("collection", " jcmtls ");
    args.put("out", "/tmp/out");
    args.put("allowRemove", "yes");
    args.put("failFast", "1");
    args.put("recipeInstanceMapping", "/etc/jsa/mapping.txt");

    IngestConfig config = IngestConfig.fromMap(IngestMode.INGEST, args);

    assertEquals("JCMTLS", config.collection());
    assertEquals(Optional.of(Path.of("/tmp/out")), config.out());
    assertTrue(config.allowRemove());
    assertTrue(config.failFast());
    assertEquals(Optional.of(Path.of("/etc/jsa/mapping.txt")), config.recipeInstanceMapping());
  }

  @Test
  void unknownCollectionIsRejected() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(IngestMode.INGEST));
    args.put("collection", "ALMA");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(IngestMode.INGEST, args));
    assertTrue(ex.getMessage().contains("collection must be one of"));
  }

  @Test
  void blankStoreIsRejected() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(IngestMode.INGEST));
    args.put("store", "  ");

    assertThrows(IllegalArgumentException.class, () -> IngestConfig.fromMap(IngestMode.INGEST, args));
  }

  @Test
  void malformedBooleanIsRejected() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(IngestMode.INGEST));
    args.put("dryRun", "maybe");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(IngestMode.INGEST, args));
    assertEquals("dryRun must be true or false (was 'maybe')", ex.getMessage());
  }

  @Test
  void modeNamesAreCaseInsensitive() {
    assertEquals(IngestMode.CHECK, IngestMode.fromString(" Check "));
    assertEquals(IngestMode.INGEST, IngestMode.fromString(null));
    assertThrows(IllegalArgumentException.class, () -> IngestMode.fromString("capture"));
  }
}
