package org.eao.jsa.domain.metadict;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * Everything one file adds to the metadict.
 *
 * @param fileId contributing file
 * @param observationId observation the file belongs to
 * @param productId plane the file belongs to
 * @param planeDict scalar attributes
 * @param memberset member observations
 * @param inputset resolved provenance inputs
 * @param fileset provenance input file ids awaiting resolution
 * @param artifactUri archive URI of the file
 * @param localPath path of the file as read
 * @param sections per-artifact and per-extension sections, keyed by URI
 * @param custom derived metrics
 * @since 0.1.0
 */
public record FileContribution(
    String fileId,
    String observationId,
    String productId,
    SortedMap<String, String> planeDict,
    Set<ObservationUri> memberset,
    Set<PlaneUri> inputset,
    Set<String> fileset,
    String artifactUri,
    Path localPath,
    Map<String, FitsUriSection> sections,
    Map<String, String> custom) {

  public FileContribution {
    Objects.requireNonNull(fileId, "fileId");
    Objects.requireNonNull(observationId, "observationId");
    Objects.requireNonNull(productId, "productId");
    Objects.requireNonNull(artifactUri, "artifactUri");
  }
}
