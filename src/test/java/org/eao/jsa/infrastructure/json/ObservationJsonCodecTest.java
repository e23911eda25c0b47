package org.eao.jsa.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
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
import org.junit.jupiter.api.Test;

class ObservationJsonCodecTest {
  private final ObservationJsonCodec codec = new ObservationJsonCodec();

  @Test
  void compositeObservationIsReadBackUnchanged() throws IOException {
    Observation observation = new Observation("JCMT", "jcmth20130403_00051_345796", "night");
    observation.attributes().put("target.name", "W3");
    observation.members().add(new ObservationUri("JCMT", "acsis_00051_20130403T101318"));
    Plane plane = observation.planeFor("cube-345796MHz-250MHzx8192-1");
    plane.attributes().put("plane.calibrationLevel", "1");
    plane.inputs().add(new PlaneUri("JCMT", "acsis_00051_20130403T101318", "raw-hybrid-345796MHz-1"));
    plane.custom().put("area", "0.0004");
    Artifact artifact = new Artifact("ad:JCMT/jcmth20130403_cube", "science");
    artifact.setContentType("application/fits");
    Part part = new Part("0", "science");
    part.chunks().add(new Chunk(new ChunkWcs(
        new SpatialWcs(List.of(new Vec2(36.45, 61.85), new Vec2(36.35, 61.85), new Vec2(36.35, 61.89),
            new Vec2(36.45, 61.89)), RepairKind.NONE),
        new SpectralWcs("FREQ", "GHz", "TOPOCENT", 345.796e9, List.of(new CoordRange(345.6, 345.85)),
            1.1332e7, null, "CO", "3 - 2"),
        new TemporalWcs(List.of(new CoordRange(56385.4259, 56385.4467)), 1797.12))));
    artifact.parts().put(part.name(), part);
    artifact.parts().put("1", new Part("1", "noise"));
    plane.artifacts().put(artifact.uri(), artifact);

    Observation read = roundTrip(observation);

    assertEquals(observation, read);
    assertEquals(List.of("0", "1"), List.copyOf(read.planes().values().iterator().next()
        .artifacts().get("ad:JCMT/jcmth20130403_cube").parts().keySet()));
  }

  @Test
  void missingAlgorithmIsReportedWithSource() {
    byte[] json = "{\"collection\": \"JCMT\", \"observationId\": \"x\"}".getBytes(StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class,
        () -> codec.read(new ByteArrayInputStream(json), "x.json"));
    assertTrue(ex.getMessage().startsWith("x.json: malformed observation document"));
  }

  @Test
  void nonObjectRootIsRejected() {
    byte[] json = "[1, 2]".getBytes(StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class,
        () -> codec.read(new ByteArrayInputStream(json), "list.json"));
    assertEquals("list.json: JSON document must be an object", ex.getMessage());
  }

  @Test
  void planesGivenAsObjectAreMalformed() {
    byte[] json = ("{\"collection\": \"JCMT\", \"observationId\": \"x\", \"algorithm\": \"night\","
        + " \"planes\": {\"productId\": \"reduced-850um\"}}").getBytes(StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class,
        () -> codec.read(new ByteArrayInputStream(json), "planes.json"));
    assertTrue(ex.getMessage().startsWith("planes.json: malformed observation document"));
    assertTrue(ex.getCause().getMessage().startsWith("expected a JSON array"));
  }

  private Observation roundTrip(Observation observation) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(observation, out);
    return codec.read(new ByteArrayInputStream(out.toByteArray()), "memory");
  }
}
