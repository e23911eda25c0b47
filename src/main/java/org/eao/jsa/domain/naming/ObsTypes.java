package org.eao.jsa.domain.naming;

import java.util.Set;

/**
 * Observation types and sampling modes accepted for each kind of instrument.
 *
 * @since 0.1.0
 */
public final class ObsTypes {
  /** Types that contain no astronomical data and are never ingested as processed products. */
  public static final Set<String> NON_ASTRONOMICAL = Set.of("flatfield", "noise", "setup", "skydip");

  public static final Set<String> HETERODYNE_OBS_TYPES = Set.of("pointing", "science", "focus", "skydip");
  public static final Set<String> HETERODYNE_SAM_MODES = Set.of("jiggle", "grid", "raster", "scan");
  public static final Set<String> CONTINUUM_OBS_TYPES =
      Set.of("pointing", "science", "focus", "skydip", "flatfield", "setup", "noise");
  public static final Set<String> CONTINUUM_SAM_MODES = Set.of("scan", "stare");

  private ObsTypes() {}

  /**
   * Archive observation type: science observations are described by their sampling mode, with
   * {@code raster} reported as {@code scan}.
   *
   * @param jcmtObsType {@code OBS_TYPE} header
   * @param samMode {@code SAM_MODE} header
   * @return archive observation type
   */
  public static String archiveType(String jcmtObsType, String samMode) {
    if ("science".equals(jcmtObsType)) {
      return "raster".equals(samMode) ? "scan" : samMode;
    }
    return jcmtObsType;
  }
}
