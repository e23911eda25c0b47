package org.eao.jsa.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eao.jsa.domain.error.GeometryException;
import org.eao.jsa.domain.header.WcsInputs;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.MemberInterval;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.wcs.ChunkWcs;
import org.eao.jsa.domain.wcs.CoordRange;
import org.eao.jsa.domain.wcs.Corners;
import org.eao.jsa.domain.wcs.RepairKind;
import org.eao.jsa.domain.wcs.SidebandMode;
import org.eao.jsa.domain.wcs.SpectralWcs;
import org.eao.jsa.domain.wcs.SubsystemRecord;
import org.eao.jsa.domain.wcs.Vec2;
import org.junit.jupiter.api.Test;

class WcsBuilderTest {
  private static final Corners BOX = new Corners(
      new Vec2(83.90, -5.45), new Vec2(83.74, -5.45), new Vec2(83.74, -5.33), new Vec2(83.90, -5.33));
  private static final Instant START = Instant.parse("2014-03-22T06:10:52Z");
  private static final Instant END = Instant.parse("2014-03-22T06:40:52Z");

  private final WcsBuilder builder = new WcsBuilder();

  @Test
  void continuumFileGetsWavelengthBandAndOwnTime() throws Exception {
    PlaneRecord plane = new PlaneRecord("reduced-850um");
    plane.section("ad:JCMT/f1").setWcsInputs(new WcsInputs(BOX, null, 850.0, 85.0, START, END));

    ChunkWcs chunk = builder.build(plane).get("ad:JCMT/f1").chunk();

    assertEquals(RepairKind.NONE, chunk.position().repair());
    SpectralWcs energy = chunk.energy();
    assertEquals("WAVE", energy.ctype());
    assertEquals("SCUBA-2-850um", energy.bandpassName());
    assertEquals(807.5e-6, energy.samples().get(0).start(), 1e-12);
    assertEquals(892.5e-6, energy.samples().get(0).end(), 1e-12);
    assertEquals(10.0, energy.resolvingPower(), 1e-9);
    assertEquals(1800.0, chunk.time().exposureSeconds(), 1e-3);
  }

  @Test
  void hybridSubsystemsShareOneMergedSpectralRange() throws Exception {
    PlaneRecord plane = new PlaneRecord("cube-345796MHz-250MHzx8192-1");
    plane.put(PlaneKeys.ENERGY_SPECIES, "CO");
    plane.put(PlaneKeys.ENERGY_TRANSITION, "3 - 2");
    plane.section("ad:JCMT/f1").setWcsInputs(new WcsInputs(BOX,
        subsystem(345.60, 345.70, 337.60, 337.70, SidebandMode.DSB), null, null, START, END));
    plane.section("ad:JCMT/f2").setWcsInputs(new WcsInputs(BOX,
        subsystem(345.65, 345.85, 337.45, 337.65, SidebandMode.DSB), null, null, START, END));

    Map<String, FileWcs> wcs = builder.build(plane);

    SpectralWcs first = wcs.get("ad:JCMT/f1").chunk().energy();
    SpectralWcs second = wcs.get("ad:JCMT/f2").chunk().energy();
    assertEquals(first, second);
    assertEquals(List.of(new CoordRange(337.45, 337.70), new CoordRange(345.60, 345.85)), first.samples());
    assertEquals("CO", first.species());
    assertEquals("3 - 2", first.transition());
    assertEquals(345.796e9, first.restFrequencyHz(), 1.0);
  }

  @Test
  void singleSidebandOmitsImageBand() throws Exception {
    PlaneRecord plane = new PlaneRecord("cube-345796MHz-250MHzx8192-1");
    plane.section("ad:JCMT/f1").setWcsInputs(new WcsInputs(BOX,
        subsystem(345.60, 345.85, 337.45, 337.70, SidebandMode.SSB), null, null, START, END));

    SpectralWcs energy = builder.build(plane).get("ad:JCMT/f1").chunk().energy();

    assertEquals(List.of(new CoordRange(345.60, 345.85)), energy.samples());
  }

  @Test
  void compositeProductGetsOneTimeSamplePerMember() throws Exception {
    PlaneRecord plane = new PlaneRecord("reduced-850um");
    FitsUriSection section = plane.section("ad:JCMT/f1");
    section.setWcsInputs(new WcsInputs(BOX, null, 850.0, 85.0, START, END));
    section.memberTimes().put(new ObservationUri("JCMT", "b"), new MemberInterval(56738.30, 56738.31));
    section.memberTimes().put(new ObservationUri("JCMT", "a"), new MemberInterval(56738.25, 56738.26));

    FileWcs wcs = builder.build(plane).get("ad:JCMT/f1");

    assertNotNull(wcs.memberTime());
    assertEquals(List.of(new CoordRange(56738.25, 56738.26), new CoordRange(56738.30, 56738.31)),
        wcs.forDataPart().time().samples());
    assertEquals(1728.0, wcs.memberTime().exposureSeconds(), 1e-3);
  }

  @Test
  void singleMemberKeepsFileTime() throws Exception {
    PlaneRecord plane = new PlaneRecord("reduced-850um");
    FitsUriSection section = plane.section("ad:JCMT/f1");
    section.setWcsInputs(new WcsInputs(BOX, null, 850.0, 85.0, START, END));
    section.memberTimes().put(new ObservationUri("JCMT", "a"), new MemberInterval(56738.25, 56738.26));

    FileWcs wcs = builder.build(plane).get("ad:JCMT/f1");

    assertNull(wcs.memberTime());
    assertSame(wcs.chunk(), wcs.forDataPart());
  }

  @Test
  void sectionsWithoutInputsAreSkipped() throws Exception {
    PlaneRecord plane = new PlaneRecord("reduced-850um");
    plane.section("ad:JCMT/f1#1");

    assertTrue(builder.build(plane).isEmpty());
  }

  @Test
  void degenerateFootprintWithoutBeamNamesTheFile() {
    Vec2 point = new Vec2(10.0, 20.0);
    PlaneRecord plane = new PlaneRecord("reduced");
    plane.section("ad:JCMT/f1").setWcsInputs(
        new WcsInputs(new Corners(point, point, point, point), null, null, null, null, null));

    GeometryException ex = assertThrows(GeometryException.class, () -> builder.build(plane));
    assertTrue(ex.getMessage().startsWith("ad:JCMT/f1: "));
  }

  private static SubsystemRecord subsystem(
      double sigLo, double sigHi, double imgLo, double imgHi, SidebandMode mode) {
    return new SubsystemRecord(345.796e9, 5.0, 30517.578125, sigLo, sigHi, imgLo, imgHi, mode);
  }
}
