package org.eao.jsa.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.eao.jsa.application.port.ClockPort;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.metadict.FileContribution;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.Metadict;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.infrastructure.store.InMemoryRecordStore;
import org.eao.jsa.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RepositorySynchronizerTest {
  private static final ObservationUri GOOD = new ObservationUri("JCMT", "jcmts20140322_850");
  private static final ObservationUri BAD = new ObservationUri("JCMT", "jcmts20140321_850");

  private InMemoryRecordStore store;
  private RecordingMetricsPort metrics;
  private Metadict metadict;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryRecordStore();
    metrics = new RecordingMetricsPort();
    metadict = new Metadict("JCMT");
    MetadictAggregator aggregator = new MetadictAggregator();
    aggregator.fold(metadict, contribution("f1", GOOD.observationId(), "jac-000000042"));
    aggregator.fold(metadict, contribution("f2", BAD.observationId(), null));
    aggregator.finish(metadict);
  }

  @Test
  void failingObservationDoesNotStopTheOthers() throws Exception {
    SyncReport report = synchronizer(ProcessOptions.WRITE, false).synchronize(metadict);

    assertEquals(1, report.written().size());
    assertTrue(report.failures().get(BAD.uri()).contains("has no recipe instance"));
    assertTrue(store.get(GOOD).isPresent());
    assertFalse(store.get(BAD).isPresent());
    assertEquals(1, metrics.count("ingest.observations.failed"));
    assertEquals(List.of(250L), metrics.observed("ingest.sync.latencyMs"));
  }

  @Test
  void failFastStopsAtTheFirstFailure() {
    assertThrows(ValidationException.class,
        () -> synchronizer(ProcessOptions.WRITE, true).synchronize(metadict));
  }

  @Test
  void writtenObservationCarriesArtifactAndAttributes() throws Exception {
    synchronizer(ProcessOptions.WRITE, false).synchronize(metadict);

    Observation observation = store.get(GOOD).orElseThrow();
    assertEquals("night", observation.algorithm());
    assertEquals("2", observation.planes().get("reduced-850um").attributes().get(PlaneKeys.CALIBRATION_LEVEL));
    assertEquals(Set.of("ad:JCMT/f1"), observation.planes().get("reduced-850um").artifacts().keySet());
    assertEquals("application/fits",
        observation.planes().get("reduced-850um").artifacts().get("ad:JCMT/f1").contentType());
  }

  @Test
  void secondWriteOfTheSameBatchIsUnchanged() throws Exception {
    synchronizer(ProcessOptions.WRITE, false).synchronize(metadict);

    SyncReport again = synchronizer(ProcessOptions.WRITE, false).synchronize(metadict);

    assertEquals(List.of(GOOD), again.unchanged());
    assertEquals(1, metrics.count("ingest.observations.written"));
  }

  @Test
  void dryRunIsCountedApartFromWrites() throws Exception {
    SyncReport report = synchronizer(new ProcessOptions(true, false), false).synchronize(metadict);

    assertTrue(report.written().isEmpty());
    assertEquals(1, report.wouldWrite().size());
    assertEquals(GOOD, report.wouldWrite().get(0).uri());
    assertFalse(store.get(GOOD).isPresent());
    assertEquals(0, metrics.count("ingest.observations.written"));
    assertEquals(1, metrics.count("ingest.observations.dryRun"));
  }

  private RepositorySynchronizer synchronizer(ProcessOptions options, boolean failFast) {
    AggregationSession session = new AggregationSession("JCMT");
    long[] ticks = {1_000L, 1_250L};
    int[] calls = {0};
    ClockPort clock = () -> ticks[Math.min(calls[0]++, 1)];
    return new RepositorySynchronizer(store,
        new StaleRecordReconciler("JCMT", store, RunAliases.NONE, metrics),
        new ProvenanceResolver(store, session, metrics),
        new MetadictAggregator(), new WcsBuilder(), new ObservationAssembler(),
        metrics, clock, options, failFast);
  }

  private static FileContribution contribution(String fileId, String observationId, String runId) {
    TreeMap<String, String> dict = new TreeMap<>();
    dict.put(PlaneKeys.ALGORITHM, "night");
    dict.put(PlaneKeys.CALIBRATION_LEVEL, "2");
    if (runId != null) {
      dict.put(PlaneKeys.RUN_ID, runId);
    }
    FitsUriSection section = new FitsUriSection();
    section.attributes().put(FitsUriSection.ARTIFACT_PRODUCT_TYPE, "science");
    String uri = "ad:JCMT/" + fileId;
    return new FileContribution(fileId, observationId, "reduced-850um", dict, Set.of(), Set.of(), Set.of(),
        uri, Path.of(fileId + ".fits"), Map.of(uri, section), Map.of());
  }
}
