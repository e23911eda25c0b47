package org.eao.jsa.infrastructure.json;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eao.jsa.domain.model.Artifact;
import org.eao.jsa.domain.model.Chunk;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.Part;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.domain.model.PlaneUri;
import org.eao.jsa.domain.wcs.ChunkWcs;
import org.eao.jsa.domain.wcs.CoordRange;
import org.eao.jsa.domain.wcs.RepairKind;
import org.eao.jsa.domain.wcs.SpatialWcs;
import org.eao.jsa.domain.wcs.SpectralWcs;
import org.eao.jsa.domain.wcs.TemporalWcs;
import org.eao.jsa.domain.wcs.Vec2;

/**
 * <strong>What:</strong> Writes and reads {@link Observation} records as JSON with Jackson's
 * streaming API.
 * <p><strong>Why:</strong> Stored observations must read back equal to what was written so that
 * an unchanged observation is recognized and not rewritten.</p>
 * <p><strong>Thread-safety:</strong> Safe to share; generators and parsers are created per call.</p>
 *
 * @since 0.1.0
 */
public final class ObservationJsonCodec {
  private final JsonDocuments documents;

  public ObservationJsonCodec() {
    this(new JsonDocuments());
  }

  public ObservationJsonCodec(JsonDocuments documents) {
    this.documents = Objects.requireNonNull(documents, "documents");
  }

  /**
   * Writes an observation as a pretty-printed JSON document.
   *
   * @param observation observation to write
   * @param out destination; not closed by this method
   * @throws IOException when writing fails
   */
  public void write(Observation observation, OutputStream out) throws IOException {
    Objects.requireNonNull(observation, "observation");
    try (JsonGenerator gen = documents.factory().createGenerator(out, JsonEncoding.UTF8)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("collection", observation.collection());
      gen.writeStringField("observationId", observation.observationId());
      gen.writeStringField("algorithm", observation.algorithm());
      writeStringMap(gen, "attributes", observation.attributes());
      gen.writeArrayFieldStart("members");
      for (ObservationUri member : observation.members()) {
        gen.writeString(member.uri());
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("planes");
      for (Plane plane : observation.planes().values()) {
        writePlane(gen, plane);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Reads an observation written by {@link #write}.
   *
   * @param in JSON content; not closed by this method
   * @param source description of the content for error messages
   * @return parsed observation
   * @throws IOException when the content cannot be read or does not describe an observation
   */
  public Observation read(InputStream in, String source) throws IOException {
    Map<String, Object> root = documents.parseObject(in, source);
    try {
      Observation observation = new Observation(
          requireString(root, "collection"),
          requireString(root, "observationId"),
          requireString(root, "algorithm"));
      readStringMap(root.get("attributes"), observation.attributes());
      for (Object member : list(root.get("members"))) {
        observation.members().add(ObservationUri.parse((String) member));
      }
      for (Object rawPlane : list(root.get("planes"))) {
        Map<String, Object> planeMap = map(rawPlane);
        Plane plane = observation.planeFor(requireString(planeMap, "productId"));
        readPlane(planeMap, plane);
      }
      return observation;
    } catch (ClassCastException | IllegalArgumentException | NullPointerException ex) {
      throw new IOException(source + ": malformed observation document", ex);
    }
  }

  private static void writePlane(JsonGenerator gen, Plane plane) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("productId", plane.productId());
    writeStringMap(gen, "attributes", plane.attributes());
    gen.writeArrayFieldStart("inputs");
    for (PlaneUri input : plane.inputs()) {
      gen.writeString(input.uri());
    }
    gen.writeEndArray();
    writeStringMap(gen, "custom", plane.custom());
    gen.writeArrayFieldStart("artifacts");
    for (Artifact artifact : plane.artifacts().values()) {
      gen.writeStartObject();
      gen.writeStringField("uri", artifact.uri());
      writeOptional(gen, "productType", artifact.productType());
      writeOptional(gen, "contentType", artifact.contentType());
      gen.writeArrayFieldStart("parts");
      for (Part part : artifact.parts().values()) {
        gen.writeStartObject();
        gen.writeStringField("name", part.name());
        writeOptional(gen, "productType", part.productType());
        gen.writeArrayFieldStart("chunks");
        for (Chunk chunk : part.chunks()) {
          writeChunk(gen, chunk.wcs());
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeChunk(JsonGenerator gen, ChunkWcs wcs) throws IOException {
    gen.writeStartObject();
    SpatialWcs position = wcs.position();
    if (position != null) {
      gen.writeObjectFieldStart("position");
      gen.writeArrayFieldStart("vertices");
      for (Vec2 vertex : position.vertices()) {
        gen.writeStartArray();
        gen.writeNumber(vertex.x());
        gen.writeNumber(vertex.y());
        gen.writeEndArray();
      }
      gen.writeEndArray();
      if (position.repair() != null) {
        gen.writeStringField("repair", position.repair().name());
      }
      gen.writeEndObject();
    }
    SpectralWcs energy = wcs.energy();
    if (energy != null) {
      gen.writeObjectFieldStart("energy");
      gen.writeStringField("ctype", energy.ctype());
      gen.writeStringField("unit", energy.unit());
      gen.writeStringField("specsys", energy.specsys());
      if (energy.restFrequencyHz() != null) {
        gen.writeNumberField("restFrequencyHz", energy.restFrequencyHz());
      }
      writeRanges(gen, energy.samples());
      gen.writeNumberField("resolvingPower", energy.resolvingPower());
      writeOptional(gen, "bandpassName", energy.bandpassName());
      writeOptional(gen, "species", energy.species());
      writeOptional(gen, "transition", energy.transition());
      gen.writeEndObject();
    }
    TemporalWcs time = wcs.time();
    if (time != null) {
      gen.writeObjectFieldStart("time");
      writeRanges(gen, time.samples());
      gen.writeNumberField("exposureSeconds", time.exposureSeconds());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeRanges(JsonGenerator gen, List<CoordRange> ranges) throws IOException {
    gen.writeArrayFieldStart("samples");
    for (CoordRange range : ranges) {
      gen.writeStartArray();
      gen.writeNumber(range.start());
      gen.writeNumber(range.end());
      gen.writeEndArray();
    }
    gen.writeEndArray();
  }

  private static void writeStringMap(JsonGenerator gen, String field, Map<String, String> values)
      throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, String> entry : values.entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static void readPlane(Map<String, Object> planeMap, Plane plane) {
    readStringMap(planeMap.get("attributes"), plane.attributes());
    for (Object input : list(planeMap.get("inputs"))) {
      plane.inputs().add(PlaneUri.parse((String) input));
    }
    readStringMap(planeMap.get("custom"), plane.custom());
    for (Object rawArtifact : list(planeMap.get("artifacts"))) {
      Map<String, Object> artifactMap = map(rawArtifact);
      Artifact artifact = new Artifact(requireString(artifactMap, "uri"), (String) artifactMap.get("productType"));
      artifact.setContentType((String) artifactMap.get("contentType"));
      for (Object rawPart : list(artifactMap.get("parts"))) {
        Map<String, Object> partMap = map(rawPart);
        Part part = new Part(requireString(partMap, "name"), (String) partMap.get("productType"));
        for (Object rawChunk : list(partMap.get("chunks"))) {
          part.chunks().add(new Chunk(readChunk(map(rawChunk))));
        }
        artifact.parts().put(part.name(), part);
      }
      plane.artifacts().put(artifact.uri(), artifact);
    }
  }

  private static ChunkWcs readChunk(Map<String, Object> chunk) {
    SpatialWcs position = null;
    if (chunk.get("position") != null) {
      Map<String, Object> positionMap = map(chunk.get("position"));
      List<Vec2> vertices = new ArrayList<>();
      for (Object rawVertex : list(positionMap.get("vertices"))) {
        List<Object> pair = list(rawVertex);
        vertices.add(new Vec2(number(pair.get(0)), number(pair.get(1))));
      }
      String repair = (String) positionMap.get("repair");
      position = new SpatialWcs(vertices, repair == null ? null : RepairKind.valueOf(repair));
    }
    SpectralWcs energy = null;
    if (chunk.get("energy") != null) {
      Map<String, Object> energyMap = map(chunk.get("energy"));
      Object rest = energyMap.get("restFrequencyHz");
      energy = new SpectralWcs(
          requireString(energyMap, "ctype"),
          requireString(energyMap, "unit"),
          requireString(energyMap, "specsys"),
          rest == null ? null : number(rest),
          ranges(energyMap.get("samples")),
          number(energyMap.get("resolvingPower")),
          (String) energyMap.get("bandpassName"),
          (String) energyMap.get("species"),
          (String) energyMap.get("transition"));
    }
    TemporalWcs time = null;
    if (chunk.get("time") != null) {
      Map<String, Object> timeMap = map(chunk.get("time"));
      time = new TemporalWcs(ranges(timeMap.get("samples")), number(timeMap.get("exposureSeconds")));
    }
    return new ChunkWcs(position, energy, time);
  }

  private static List<CoordRange> ranges(Object raw) {
    List<CoordRange> ranges = new ArrayList<>();
    for (Object rawRange : list(raw)) {
      List<Object> pair = list(rawRange);
      ranges.add(new CoordRange(number(pair.get(0)), number(pair.get(1))));
    }
    return ranges;
  }

  private static void readStringMap(Object raw, Map<String, String> target) {
    if (raw == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : map(raw).entrySet()) {
      target.put(entry.getKey(), entry.getValue() == null ? null : entry.getValue().toString());
    }
  }

  private static String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("missing string field '" + key + "'");
    }
    return text;
  }

  private static double number(Object value) {
    if (value instanceof String text) {
      // non-finite values are written as quoted tokens
      return Double.parseDouble(text);
    }
    return ((Number) value).doubleValue();
  }

  private static Map<String, Object> map(Object value) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("expected a JSON object but found " + value);
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, entry) -> typed.put(String.valueOf(key), entry));
    return typed;
  }

  private static List<Object> list(Object value) {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> raw)) {
      throw new IllegalArgumentException("expected a JSON array but found " + value);
    }
    return new ArrayList<>(raw);
  }
}
