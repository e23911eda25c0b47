package org.eao.jsa.domain.naming;

/**
 * Observation intent. Observatory-designated science is science; SCUBA-2 pointings are usable
 * for science too. Everything else is calibration.
 *
 * @since 0.1.0
 */
public final class Intents {
  public static final String SCIENCE = "science";
  public static final String CALIBRATION = "calibration";

  private Intents() {}

  public static String intent(String obsType, String backend) {
    if ("science".equals(obsType) || ("pointing".equals(obsType) && "SCUBA-2".equals(backend))) {
      return SCIENCE;
    }
    return CALIBRATION;
  }
}
