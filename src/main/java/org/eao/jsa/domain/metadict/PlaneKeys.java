package org.eao.jsa.domain.metadict;

import java.util.List;
import java.util.Map;

/**
 * Names of the scalar attributes aggregated per plane and the merge policy of each.
 *
 * <p>Keys not listed in {@link #POLICIES} merge with {@link MergePolicy#LAST_WRITER_WINS}.</p>
 *
 * @since 0.1.0
 */
public final class PlaneKeys {
  public static final String ALGORITHM = "algorithm.name";
  public static final String OBS_META_RELEASE = "obs.metaRelease";
  public static final String OBS_INTENT = "obs.intent";
  public static final String OBS_TYPE = "obs.type";
  public static final String PLANE_META_RELEASE = "plane.metaRelease";
  public static final String PLANE_DATA_RELEASE = "plane.dataRelease";
  public static final String CALIBRATION_LEVEL = "plane.calibrationLevel";
  public static final String DATA_PRODUCT_TYPE = "plane.dataProductType";
  public static final String SOURCE_DENSITY = "plane.sourceDensity";
  public static final String RUN_ID = "provenance.runID";
  public static final String PROVENANCE_NAME = "provenance.name";
  public static final String PROVENANCE_PROJECT = "provenance.project";
  public static final String PROVENANCE_PRODUCER = "provenance.producer";
  public static final String PROVENANCE_REFERENCE = "provenance.reference";
  public static final String PROVENANCE_VERSION = "provenance.version";
  public static final String PROVENANCE_LAST_EXECUTED = "provenance.lastExecuted";
  public static final String PROVENANCE_INPUTS = "provenance.inputs";
  public static final String MEMBERS = "members";
  public static final String PROPOSAL_ID = "proposal.id";
  public static final String PROPOSAL_PROJECT = "proposal.project";
  public static final String PROPOSAL_PI = "proposal.pi";
  public static final String PROPOSAL_TITLE = "proposal.title";
  public static final String INSTRUMENT_NAME = "instrument.name";
  public static final String INSTRUMENT_KEYWORDS = "instrument.keywords";
  public static final String TARGET_NAME = "target.name";
  public static final String TARGET_TYPE = "target.type";
  public static final String TARGET_STANDARD = "target.standard";
  public static final String TARGET_MOVING = "target.moving";
  public static final String TARGET_REDSHIFT = "target.redshift";
  public static final String TARGET_POSITION_RA = "targetPosition.cval1";
  public static final String TARGET_POSITION_DEC = "targetPosition.cval2";
  public static final String TARGET_POSITION_COORDSYS = "targetPosition.coordsys";
  public static final String TARGET_POSITION_EQUINOX = "targetPosition.equinox";
  public static final String TELESCOPE_NAME = "telescope.name";
  public static final String ENV_SEEING = "environment.seeing";
  public static final String ENV_HUMIDITY = "environment.humidity";
  public static final String ENV_ELEVATION = "environment.elevation";
  public static final String ENV_TAU = "environment.tau";
  public static final String ENV_WAVELENGTH_TAU = "environment.wavelengthTau";
  public static final String ENV_AMBIENT_TEMP = "environment.ambientTemp";
  public static final String ENERGY_SPECIES = "energy.transition.species";
  public static final String ENERGY_TRANSITION = "energy.transition.transition";
  public static final String ENERGY_BANDPASS = "energy.bandpassName";
  public static final String TIME_LOWER = "time.bounds.lower";
  public static final String TIME_UPPER = "time.bounds.upper";

  /** Custom metric keys recorded per plane. */
  public static final String CUSTOM_AREA = "area";
  public static final String CUSTOM_SOURCE_COUNT = "sourceCount";

  private static final Map<String, MergePolicy> POLICIES = Map.of(
      OBS_META_RELEASE, MergePolicy.LATEST_DATE,
      PLANE_META_RELEASE, MergePolicy.LATEST_DATE,
      PLANE_DATA_RELEASE, MergePolicy.LATEST_DATE,
      SOURCE_DENSITY, MergePolicy.NON_ZERO_STICKY);

  private static final List<String> OBSERVATION_PREFIXES = List.of(
      "obs.", "proposal.", "target.", "targetPosition.", "telescope.", "environment.",
      "instrument.", MEMBERS);

  private PlaneKeys() {}

  public static MergePolicy policyOf(String key) {
    return POLICIES.getOrDefault(key, MergePolicy.LAST_WRITER_WINS);
  }

  /** Whether an aggregated key describes the observation rather than the plane. */
  public static boolean isObservationLevel(String key) {
    for (String prefix : OBSERVATION_PREFIXES) {
      if (key.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
