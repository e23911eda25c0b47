package org.eao.jsa.config;

import java.util.Locale;

/** Run modes of the ingestion CLI. */
public enum IngestMode {
  /** Ingest a batch; any rejected file aborts the batch before anything is written. */
  INGEST,
  /** Validate a batch, reporting every problem; nothing is written by default. */
  CHECK;

  public static IngestMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return INGEST;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ingest" -> INGEST;
      case "check" -> CHECK;
      default -> throw new IllegalArgumentException("Unsupported mode: " + raw);
    };
  }

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
