package org.eao.jsa.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.domain.error.ReconciliationException;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.ObservationRecord;
import org.eao.jsa.domain.model.Artifact;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.model.Plane;
import org.eao.jsa.infrastructure.store.InMemoryRecordStore;
import org.eao.jsa.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StaleRecordReconcilerTest {
  private static final String RUN = "jac-000000042";
  private static final String OLD_RUN = "jac-000000007";
  private static final String NIGHT = "jcmts20140322_850";
  private static final String OTHER_NIGHT = "jcmts20140321_850";

  private InMemoryRecordStore store;
  private RecordingMetricsPort metrics;
  private StaleRecordReconciler reconciler;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryRecordStore();
    metrics = new RecordingMetricsPort();
    reconciler = new StaleRecordReconciler("JCMT", store, RunAliases.NONE, metrics);

    Observation night = new Observation("JCMT", NIGHT, "night");
    plane(night, "reduced-850um", RUN);
    plane(night, "rsp-850um", RUN);
    plane(night, "peak-cat-850um", OLD_RUN);
    store.put(night);
  }

  @Test
  void registersEveryPlaneOfObservationsSharingTheRun() throws Exception {
    reconciler.registerRun(RUN);
    reconciler.registerRun(RUN);

    assertEquals(Map.of("reduced-850um", true, "rsp-850um", true, "peak-cat-850um", false),
        reconciler.candidates(NIGHT));
    assertEquals(1, metrics.count("ingest.queries"));
  }

  @Test
  void aliasesCountAsTheSameRun() throws Exception {
    reconciler = new StaleRecordReconciler("JCMT", store, runId -> Set.of(OLD_RUN), metrics);

    reconciler.registerRun(RUN);

    assertEquals(Boolean.TRUE, reconciler.candidates(NIGHT).get("peak-cat-850um"));
    assertEquals(2, metrics.count("ingest.queries"));
  }

  @Test
  void pruneRemovesPlanesOfTheRunThatWereNotReproduced() throws Exception {
    reconciler.registerRun(RUN);
    Observation working = store.get(new ObservationUri("JCMT", NIGHT)).orElseThrow();

    List<String> removed = reconciler.pruneStalePlanes(working, Set.of("reduced-850um"));

    assertEquals(List.of("rsp-850um"), removed);
    assertEquals(Set.of("reduced-850um", "peak-cat-850um"), working.planes().keySet());
    assertTrue(reconciler.candidates(NIGHT).isEmpty());
  }

  @Test
  void newerVersionSupersedesOlderArtifacts() throws Exception {
    Observation stored = new Observation("JCMT", NIGHT, "night");
    Plane storedPlane = stored.planeFor("reduced-850um");
    addArtifact(storedPlane, "jcmts20140322_reduced_001");
    addArtifact(storedPlane, "jcmts20140322_preview_001");
    Observation working = stored.copy();
    addArtifact(working.planes().get("reduced-850um"), "jcmts20140322_reduced_002");

    int superseded = reconciler.replaceVersions(stored, working, record("jcmts20140322_reduced_002"));

    assertEquals(1, superseded);
    assertEquals(Set.of("ad:JCMT/jcmts20140322_preview_001", "ad:JCMT/jcmts20140322_reduced_002"),
        working.planes().get("reduced-850um").artifacts().keySet());
  }

  @Test
  void olderVersionThanStoredIsRefused() {
    Observation stored = new Observation("JCMT", NIGHT, "night");
    addArtifact(stored.planeFor("reduced-850um"), "jcmts20140322_reduced_003");
    Observation working = stored.copy();

    ReconciliationException ex = assertThrows(ReconciliationException.class,
        () -> reconciler.replaceVersions(stored, working, record("jcmts20140322_reduced_002")));
    assertTrue(ex.getMessage().contains("version 2 is older than the stored version 3"));
  }

  @Test
  void sameVersionAndNewObservationsAreLeftAlone() throws Exception {
    Observation working = new Observation("JCMT", NIGHT, "night");
    addArtifact(working.planeFor("reduced-850um"), "jcmts20140322_reduced_002");

    assertEquals(0, reconciler.replaceVersions(null, working, record("jcmts20140322_reduced_002")));
    assertEquals(1, working.planes().get("reduced-850um").artifacts().size());
  }

  @Test
  void finishCleansUntouchedObservationsAndRemovesEmptyOnes() throws Exception {
    Observation other = new Observation("JCMT", OTHER_NIGHT, "night");
    plane(other, "reduced-850um", RUN);
    store.put(other);
    reconciler.registerRun(RUN);
    Metadict metadict = new Metadict("JCMT");

    StaleRecordReconciler.Cleanup cleanup = reconciler.finish(metadict, store, ProcessOptions.WRITE);

    ObservationUri nightUri = new ObservationUri("JCMT", NIGHT);
    ObservationUri otherUri = new ObservationUri("JCMT", OTHER_NIGHT);
    assertEquals(List.of("reduced-850um", "rsp-850um"), cleanup.removedPlanes().get(nightUri));
    assertEquals(List.of(otherUri), cleanup.removedObservations());
    assertTrue(cleanup.failures().isEmpty());
    assertEquals(Set.of("peak-cat-850um"), store.get(nightUri).orElseThrow().planes().keySet());
    assertFalse(store.get(otherUri).isPresent());
    assertEquals(3, metrics.count("ingest.planes.removed"));
  }

  @Test
  void finishSkipsObservationsOfTheBatch() throws Exception {
    reconciler.registerRun(RUN);
    Metadict metadict = new Metadict("JCMT");
    metadict.observation(NIGHT).plane("reduced-850um");

    StaleRecordReconciler.Cleanup cleanup = reconciler.finish(metadict, store, ProcessOptions.WRITE);

    assertTrue(cleanup.removedPlanes().isEmpty());
    assertEquals(3, store.get(new ObservationUri("JCMT", NIGHT)).orElseThrow().planes().size());
  }

  @Test
  void dryRunReportsButKeepsTheStore() throws Exception {
    reconciler.registerRun(RUN);

    StaleRecordReconciler.Cleanup cleanup =
        reconciler.finish(new Metadict("JCMT"), store, new ProcessOptions(true, false));

    assertEquals(2, cleanup.removedPlanes().get(new ObservationUri("JCMT", NIGHT)).size());
    assertEquals(3, store.get(new ObservationUri("JCMT", NIGHT)).orElseThrow().planes().size());
  }

  private static void plane(Observation observation, String productId, String runId) {
    observation.planeFor(productId).attributes().put(Plane.RUN_ID, runId);
  }

  private static void addArtifact(Plane plane, String fileId) {
    String uri = "ad:JCMT/" + fileId;
    plane.artifacts().put(uri, new Artifact(uri, "science"));
  }

  private static ObservationRecord record(String fileId) {
    ObservationRecord record = new ObservationRecord("JCMT", NIGHT);
    record.plane("reduced-850um").uriDict().put("ad:JCMT/" + fileId, Path.of(fileId + ".fits"));
    return record;
  }
}
