package org.eao.jsa.testutil;

import java.time.Instant;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.model.Artifact;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.domain.model.Plane;

/** Stored observations that processed products refer to. */
public final class ArchiveFixtures {
  /** Start of {@link HeaderFixtures#SCUBA2_OBSID}. */
  public static final double SCUBA2_START_MJD = 56738.2575;
  public static final double SCUBA2_END_MJD = 56738.2784;
  public static final Instant SCUBA2_RELEASE = Instant.parse("2015-03-22T00:00:00Z");
  public static final double ACSIS_START_MJD = 56385.4259;
  public static final double ACSIS_END_MJD = 56385.4467;
  public static final Instant ACSIS_RELEASE = Instant.parse("2014-04-03T00:00:00Z");

  private ArchiveFixtures() {}

  /**
   * Raw observation in collection JCMT with a single raw plane.
   *
   * @param observationId observation id
   * @param productId raw plane id, starting with {@code raw}
   * @param fileId raw file id
   * @param startMjd observing start
   * @param endMjd observing end
   * @param release data release date, or {@code null}
   * @return observation ready to be stored
   */
  public static Observation rawObservation(
      String observationId, String productId, String fileId, double startMjd, double endMjd, Instant release) {
    Observation observation = new Observation("JCMT", observationId, "exposure");
    Plane plane = observation.planeFor(productId);
    plane.attributes().put(PlaneKeys.TIME_LOWER, Double.toString(startMjd));
    plane.attributes().put(PlaneKeys.TIME_UPPER, Double.toString(endMjd));
    if (release != null) {
      plane.attributes().put(PlaneKeys.PLANE_DATA_RELEASE, release.toString());
    }
    plane.artifacts().put("ad:JCMT/" + fileId, new Artifact("ad:JCMT/" + fileId, "science"));
    return observation;
  }

  public static Observation scuba2Raw() {
    return rawObservation(HeaderFixtures.SCUBA2_OBSID, "raw-850um", HeaderFixtures.SCUBA2_RAW_FILE,
        SCUBA2_START_MJD, SCUBA2_END_MJD, SCUBA2_RELEASE);
  }

  public static Observation acsisRaw() {
    return rawObservation(HeaderFixtures.ACSIS_OBSID, "raw-hybrid-345796MHz-1", HeaderFixtures.ACSIS_RAW_FILE,
        ACSIS_START_MJD, ACSIS_END_MJD, ACSIS_RELEASE);
  }
}
