package org.eao.jsa.application.port;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.infrastructure.store.InMemoryRecordStore;
import org.eao.jsa.testutil.ArchiveFixtures;
import org.eao.jsa.testutil.HeaderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ObservationLeaseTest {
  private static final ObservationUri RAW = new ObservationUri("JCMT", HeaderFixtures.SCUBA2_OBSID);
  private static final ObservationUri NEW = new ObservationUri("JCMT", HeaderFixtures.NIGHT_ID);

  private InMemoryRecordStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryRecordStore();
    store.put(ArchiveFixtures.scuba2Raw());
  }

  @Test
  void untouchedObservationIsNotWritten() throws Exception {
    ObservationLease lease = store.process(RAW, ProcessOptions.WRITE);
    assertTrue(lease.existed());
    lease.close();

    assertEquals(LeaseOutcome.UNCHANGED, lease.outcome());
  }

  @Test
  void modifiedObservationIsWritten() throws Exception {
    try (ObservationLease lease = store.process(NEW, ProcessOptions.WRITE)) {
      assertFalse(lease.existed());
      lease.observationOrCreate("night").planeFor("reduced-850um");
      lease.close();
      assertEquals(LeaseOutcome.WRITTEN, lease.outcome());
    }
    assertTrue(store.get(NEW).isPresent());
  }

  @Test
  void dryRunDiscardsChanges() throws Exception {
    ObservationLease lease = store.process(NEW, new ProcessOptions(true, false));
    lease.observationOrCreate("night").planeFor("reduced-850um");
    lease.close();

    assertEquals(LeaseOutcome.DISCARDED, lease.outcome());
    assertFalse(store.get(NEW).isPresent());
  }

  @Test
  void removingLastPlaneRequiresPermission() throws Exception {
    ObservationLease refused = store.process(RAW, ProcessOptions.WRITE);
    refused.observation().orElseThrow().planes().clear();
    StoreException ex = assertThrows(StoreException.class, refused::close);
    assertTrue(ex.getMessage().contains("removal was not allowed"));
    assertTrue(store.get(RAW).isPresent());

    ObservationLease allowed = store.process(RAW, ProcessOptions.WRITE.withAllowRemove(true));
    allowed.observation().orElseThrow().planes().clear();
    allowed.close();
    assertEquals(LeaseOutcome.REMOVED, allowed.outcome());
    assertFalse(store.get(RAW).isPresent());
  }

  @Test
  void workingCopyDoesNotAlterTheSnapshot() throws Exception {
    ObservationLease lease = store.process(RAW, ProcessOptions.WRITE);
    Observation working = lease.observation().orElseThrow();
    working.setAlgorithm("night");
    lease.discard();
    lease.close();

    assertEquals("exposure", lease.stored().orElseThrow().algorithm());
    assertEquals(LeaseOutcome.DISCARDED, lease.outcome());
    assertEquals("exposure", store.get(RAW).orElseThrow().algorithm());
  }
}
