package org.eao.jsa.application.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.eao.jsa.domain.error.IdentifierException;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.metadict.FileContribution;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.PlaneUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds per-file contributions into the metadict.
 * <p><strong>Why:</strong> Several files feed the same plane; their values are merged key by key,
 * with release dates keeping the latest value and source densities keeping the first non-zero
 * value, so the result does not depend on the order files are read.</p>
 * <p><strong>Role:</strong> {@link #fold} once per accepted file, {@link #finish} once per batch.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the metadict itself is not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MetadictAggregator {
  private static final Logger log = LoggerFactory.getLogger(MetadictAggregator.class);

  /**
   * Merges one contribution into the metadict.
   *
   * @param metadict metadict of the batch
   * @param contribution values derived from one file
   * @throws IdentifierException when the file places a different algorithm on an observation
   */
  public void fold(Metadict metadict, FileContribution contribution) throws IdentifierException {
    Objects.requireNonNull(metadict, "metadict");
    Objects.requireNonNull(contribution, "contribution");
    ObservationRecord observation = metadict.observation(contribution.observationId());
    String algorithm = contribution.planeDict().get(PlaneKeys.ALGORITHM);
    String existing = algorithmOf(observation);
    if (existing != null && algorithm != null && !existing.equals(algorithm)) {
      throw new IdentifierException(contribution.fileId() + ": observation " + observation.uri()
          + " already has algorithm " + existing + ", not " + algorithm);
    }

    observation.memberset().addAll(contribution.memberset());
    PlaneRecord plane = observation.plane(contribution.productId());
    for (Map.Entry<String, String> entry : contribution.planeDict().entrySet()) {
      plane.put(entry.getKey(), entry.getValue());
    }
    plane.inputset().addAll(contribution.inputset());
    plane.fileset().addAll(contribution.fileset());
    plane.uriDict().put(contribution.artifactUri(), contribution.localPath());
    plane.custom().putAll(contribution.custom());
    for (Map.Entry<String, FitsUriSection> entry : contribution.sections().entrySet()) {
      plane.section(entry.getKey()).mergeFrom(entry.getValue());
    }
    log.debug("Folded {} into {}/{}", contribution.fileId(), observation.uri(), plane.productId());
  }

  /**
   * Replacement pass run after every file has been folded: writes the accumulated member and
   * input sets into each plane dictionary as sorted, space-separated URI lists, removing the keys
   * when the sets are empty.
   *
   * @param metadict metadict of the batch
   */
  public void finish(Metadict metadict) {
    for (ObservationRecord observation : metadict.observations().values()) {
      String members = observation.memberset().stream()
          .map(ObservationUri::uri)
          .sorted()
          .collect(Collectors.joining(" "));
      for (PlaneRecord plane : observation.planes().values()) {
        String inputs = plane.inputset().stream()
            .map(PlaneUri::uri)
            .sorted()
            .collect(Collectors.joining(" "));
        replace(plane, PlaneKeys.MEMBERS, members);
        replace(plane, PlaneKeys.PROVENANCE_INPUTS, inputs);
      }
    }
  }

  /**
   * Checks that an observation carries everything needed to be written.
   *
   * @param observation aggregated observation
   * @throws ValidationException listing the missing values
   */
  public void requireComplete(ObservationRecord observation) throws ValidationException {
    List<String> problems = new ArrayList<>();
    if (algorithmOf(observation) == null) {
      problems.add("no algorithm for " + observation.uri());
    }
    for (PlaneRecord plane : observation.planes().values()) {
      if (!plane.planeDict().containsKey(PlaneKeys.RUN_ID)) {
        problems.add("plane " + plane.productId() + " has no recipe instance");
      }
      if (carriesScience(plane) && !plane.planeDict().containsKey(PlaneKeys.CALIBRATION_LEVEL)) {
        problems.add("plane " + plane.productId() + " has no calibration level");
      }
    }
    if (!problems.isEmpty()) {
      throw new ValidationException(observation.uri().uri(), problems);
    }
  }

  /** Algorithm recorded for an observation, or {@code null} before any plane has one. */
  public static String algorithmOf(ObservationRecord observation) {
    for (PlaneRecord plane : observation.planes().values()) {
      String algorithm = plane.planeDict().get(PlaneKeys.ALGORITHM);
      if (algorithm != null) {
        return algorithm;
      }
    }
    return null;
  }

  private static boolean carriesScience(PlaneRecord plane) {
    for (FitsUriSection section : plane.fitsuri().values()) {
      String artifactType = section.attributes().get(FitsUriSection.ARTIFACT_PRODUCT_TYPE);
      String partType = section.attributes().get(FitsUriSection.PART_PRODUCT_TYPE);
      if (isScience(artifactType) || isScience(partType)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isScience(String productType) {
    return "science".equals(productType) || "catalog".equals(productType);
  }

  private static void replace(PlaneRecord plane, String key, String value) {
    if (value.isEmpty()) {
      plane.planeDict().remove(key);
    } else {
      plane.planeDict().put(key, value);
    }
  }
}
