package org.eao.jsa.domain.header;

import java.time.Instant;
import java.util.List;

/**
 * How a file was produced.
 *
 * @param recipe processing recipe ({@code RECIPE})
 * @param project processing project
 * @param reference reference URL ({@code REFERENC})
 * @param version software versions
 * @param producer producing organisation ({@code PRODUCER})
 * @param runId normalized processing run id ({@code DPRCINST})
 * @param lastExecuted processing time ({@code DPDATE})
 * @param inputPlaneUris {@code INPn} plane URIs
 * @param inputFiles {@code PRVn} file names
 * @since 0.1.0
 */
public record ProvenanceFields(
    String recipe,
    String project,
    String reference,
    String version,
    String producer,
    String runId,
    Instant lastExecuted,
    List<String> inputPlaneUris,
    List<String> inputFiles) {

  public ProvenanceFields {
    inputPlaneUris = inputPlaneUris == null ? List.of() : List.copyOf(inputPlaneUris);
    inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
  }
}
