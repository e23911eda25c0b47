package org.eao.jsa.application.ingest;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one ingestion batch.
 *
 * @param filesRead number of headers read
 * @param rejected problems per rejected file id
 * @param sync outcome of the store synchronization; {@code null} when no file was accepted
 */
public record IngestReport(int filesRead, Map<String, List<String>> rejected, SyncReport sync) {
  public IngestReport {
    rejected = Collections.unmodifiableMap(new TreeMap<>(rejected));
  }

  public boolean clean() {
    return rejected.isEmpty() && (sync == null || !sync.hasFailures());
  }
}
