package org.eao.jsa.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.eao.jsa.application.port.ArchiveQueryPort.ArtifactPlaneRow;
import org.eao.jsa.application.port.ArchiveQueryPort.MemberPlaneRow;
import org.eao.jsa.application.port.ArchiveQueryPort.PlaneRunRow;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.domain.model.PlaneUri;
import org.eao.jsa.testutil.ArchiveFixtures;
import org.eao.jsa.testutil.HeaderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryRecordStoreTest {
  private InMemoryRecordStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryRecordStore();
    store.put(ArchiveFixtures.scuba2Raw());
    store.put(ArchiveFixtures.acsisRaw());
  }

  @Test
  void likePatternTreatsPercentAndUnderscoreAsWildcards() {
    assertTrue(InMemoryRecordStore.likePattern("scuba2%20140322T061052")
        .matcher(HeaderFixtures.SCUBA2_OBSID).matches());
    assertTrue(InMemoryRecordStore.likePattern("a_c").matcher("abc").matches());
    assertFalse(InMemoryRecordStore.likePattern("a_c").matcher("abbc").matches());
    assertFalse(InMemoryRecordStore.likePattern("a.c").matcher("abc").matches());
  }

  @Test
  void memberRowsCarryIntervalReleaseAndArtifacts() throws Exception {
    List<MemberPlaneRow> rows = store.memberPlanes("JCMT", HeaderFixtures.SCUBA2_OBSID);

    assertEquals(1, rows.size());
    MemberPlaneRow row = rows.get(0);
    assertEquals("raw-850um", row.productId());
    assertEquals(ArchiveFixtures.SCUBA2_START_MJD, row.startMjd());
    assertEquals(ArchiveFixtures.SCUBA2_RELEASE, row.releaseDate());
    assertEquals(List.of("ad:JCMT/" + HeaderFixtures.SCUBA2_RAW_FILE), row.artifactUris());
    assertTrue(row.complete());
  }

  @Test
  void unreadableReleaseDateMakesRowIncomplete() throws Exception {
    Observation observation = ArchiveFixtures.scuba2Raw();
    observation.planes().get("raw-850um").attributes().put("plane.dataRelease", "soon");
    store.put(observation);

    MemberPlaneRow row = store.memberPlanes("JCMT", HeaderFixtures.SCUBA2_OBSID).get(0);

    assertNull(row.releaseDate());
    assertFalse(row.complete());
  }

  @Test
  void planesForFileSearchesOnlyTheGivenCollections() throws Exception {
    List<ArtifactPlaneRow> rows = store.planesForFile(Set.of("JCMT"), HeaderFixtures.ACSIS_RAW_FILE);

    assertEquals(List.of(new ArtifactPlaneRow(
        new PlaneUri("JCMT", HeaderFixtures.ACSIS_OBSID, "raw-hybrid-345796MHz-1"),
        "ad:JCMT/" + HeaderFixtures.ACSIS_RAW_FILE)), rows);
    assertTrue(store.planesForFile(Set.of("JCMTLS"), HeaderFixtures.ACSIS_RAW_FILE).isEmpty());
  }

  @Test
  void planesSharingRunListEveryPlaneOfTaggedObservations() throws Exception {
    Observation night = new Observation("JCMT", HeaderFixtures.NIGHT_ID, "night");
    night.planeFor("reduced-850um").attributes().put(Plane.RUN_ID, "jac-000000042");
    night.planeFor("reduced-450um").attributes().put(Plane.RUN_ID, "jac-000000041");
    store.put(night);

    List<PlaneRunRow> rows = store.planesSharingRun("JCMT", "jac-000000042");

    assertEquals(List.of(
        new PlaneRunRow("JCMT", HeaderFixtures.NIGHT_ID, "reduced-850um", "jac-000000042"),
        new PlaneRunRow("JCMT", HeaderFixtures.NIGHT_ID, "reduced-450um", "jac-000000041")), rows);
    assertTrue(store.planesSharingRun("JCMTLS", "jac-000000042").isEmpty());
  }

  @Test
  void storedObservationsAreCopies() throws Exception {
    ObservationUri uri = new ObservationUri("JCMT", HeaderFixtures.SCUBA2_OBSID);
    Observation fetched = store.get(uri).orElseThrow();
    fetched.planes().clear();

    assertEquals(1, store.get(uri).orElseThrow().planes().size());
    assertTrue(store.planeExists(new PlaneUri("JCMT", HeaderFixtures.SCUBA2_OBSID, "raw-850um")));
    assertFalse(store.planeExists(new PlaneUri("JCMT", HeaderFixtures.SCUBA2_OBSID, "reduced-850um")));
  }

  @Test
  void proposalsAreLookedUpById() throws Exception {
    store.addProposal("M13AU01", "Smith", "Orion survey");

    assertEquals("Smith", store.proposal("M13AU01").orElseThrow().pi());
    assertTrue(store.proposal("M99XX99").isEmpty());
  }

  @Test
  void releaseInstantIsParsedFromStoredText() throws Exception {
    assertEquals(Instant.parse("2014-04-03T00:00:00Z"),
        store.memberPlanes("JCMT", HeaderFixtures.ACSIS_OBSID).get(0).releaseDate());
  }
}
