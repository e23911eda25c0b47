package org.eao.jsa.application.ingest;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.Artifact;
import org.eao.jsa.domain.model.Chunk;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.Part;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.domain.naming.MimeTypes;
import org.eao.jsa.domain.wcs.ChunkWcs;
import org.eao.jsa.domain.wcs.CoordRange;

/**
 * Applies an aggregated observation record to a stored (or new) observation.
 *
 * <p>Observation-level keys go to the observation, everything else to the plane. Artifacts are
 * rebuilt from scratch for every file of the batch, so applying the same record twice produces an
 * identical observation. Members and plane inputs are always replaced by those of the batch.
 */
public final class ObservationAssembler {
  private static final Set<String> DATA_PARTS = Set.of("science", "noise");
  private static final String PRIMARY_PART = "0";

  /**
   * @param record aggregated observation
   * @param observation observation to update in place
   * @param wcs WCS per plane product id, then per artifact URI
   */
  public void apply(ObservationRecord record, Observation observation, Map<String, Map<String, FileWcs>> wcs) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(observation, "observation");
    String algorithm = MetadictAggregator.algorithmOf(record);
    if (algorithm != null) {
      observation.setAlgorithm(algorithm);
    }
    observation.members().clear();
    observation.members().addAll(record.memberset());
    for (PlaneRecord planeRecord : record.planes().values()) {
      Plane plane = observation.planeFor(planeRecord.productId());
      applyPlane(planeRecord, observation, plane, wcs.getOrDefault(planeRecord.productId(), Map.of()));
    }
  }

  private static void applyPlane(
      PlaneRecord record, Observation observation, Plane plane, Map<String, FileWcs> wcs) {
    for (Map.Entry<String, String> entry : record.planeDict().entrySet()) {
      String key = entry.getKey();
      if (key.equals(PlaneKeys.ALGORITHM) || key.equals(PlaneKeys.MEMBERS)
          || key.equals(PlaneKeys.PROVENANCE_INPUTS)) {
        continue;
      }
      if (PlaneKeys.isObservationLevel(key)) {
        observation.attributes().put(key, entry.getValue());
      } else {
        plane.attributes().put(key, entry.getValue());
      }
    }
    plane.inputs().clear();
    plane.inputs().addAll(record.inputset());
    plane.custom().putAll(record.custom());

    for (Map.Entry<String, Path> entry : record.uriDict().entrySet()) {
      String uri = entry.getKey();
      plane.artifacts().put(uri, artifact(uri, entry.getValue(), record, wcs.get(uri)));
    }
    updateTimeBounds(plane);
  }

  private static Artifact artifact(String uri, Path localPath, PlaneRecord record, FileWcs wcs) {
    FitsUriSection fileSection = record.fitsuri().get(uri);
    Map<String, String> fileAttributes = fileSection == null ? Map.of() : fileSection.attributes();
    Artifact artifact = new Artifact(uri, fileAttributes.get(FitsUriSection.ARTIFACT_PRODUCT_TYPE));
    artifact.setContentType(MimeTypes.forFileName(localPath.getFileName().toString()));

    Map<Integer, String> extensions = new TreeMap<>();
    String prefix = uri + "#";
    for (Map.Entry<String, FitsUriSection> entry : record.fitsuri().entrySet()) {
      if (entry.getKey().startsWith(prefix)) {
        int extension = Integer.parseInt(entry.getKey().substring(prefix.length()));
        extensions.put(extension, entry.getValue().attributes().get(FitsUriSection.PART_PRODUCT_TYPE));
      }
    }
    if (extensions.isEmpty()) {
      Part part = new Part(PRIMARY_PART, artifact.productType());
      addChunk(part, wcs, true);
      artifact.parts().put(part.name(), part);
      return artifact;
    }
    for (Map.Entry<Integer, String> entry : extensions.entrySet()) {
      Part part = new Part(Integer.toString(entry.getKey()), entry.getValue());
      addChunk(part, wcs, DATA_PARTS.contains(entry.getValue()));
      artifact.parts().put(part.name(), part);
    }
    return artifact;
  }

  private static void addChunk(Part part, FileWcs wcs, boolean dataPart) {
    if (wcs == null || !dataPart) {
      return;
    }
    ChunkWcs chunk = wcs.forDataPart();
    if (!chunk.isEmpty()) {
      part.chunks().add(new Chunk(chunk));
    }
  }

  private static void updateTimeBounds(Plane plane) {
    double lower = Double.POSITIVE_INFINITY;
    double upper = Double.NEGATIVE_INFINITY;
    for (Artifact artifact : plane.artifacts().values()) {
      for (Part part : artifact.parts().values()) {
        for (Chunk chunk : part.chunks()) {
          if (chunk.wcs().time() != null) {
            CoordRange span = chunk.wcs().time().span();
            lower = Math.min(lower, span.start());
            upper = Math.max(upper, span.end());
          }
        }
      }
    }
    if (lower <= upper) {
      plane.attributes().put(PlaneKeys.TIME_LOWER, Double.toString(lower));
      plane.attributes().put(PlaneKeys.TIME_UPPER, Double.toString(upper));
    }
  }
}
